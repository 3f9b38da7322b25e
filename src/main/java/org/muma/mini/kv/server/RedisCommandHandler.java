package org.muma.mini.kv.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.mini.kv.command.Command;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个连接的会话处理器，每个 Channel 一个实例
 * 异常只会关闭当前连接，不影响其它连接和监听端口。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<Command> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    static final ErrorMessage MAX_CLIENTS_REACHED = new ErrorMessage("ERR max number of clients reached");

    private final CommandDispatcher dispatcher;
    // 所有连接共享的在线客户端计数
    private final AtomicInteger connectedClients;
    private final int maxClients;

    private boolean counted;
    private boolean rejected;

    public RedisCommandHandler(CommandDispatcher dispatcher, AtomicInteger connectedClients, int maxClients) {
        this.dispatcher = dispatcher;
        this.connectedClients = connectedClients;
        this.maxClients = maxClients;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        counted = true;
        if (total > maxClients) {
            log.warn("Rejecting client {}: {} clients connected, limit {}", ctx.channel().remoteAddress(), total, maxClients);
            rejected = true;
            ctx.writeAndFlush(MAX_CLIENTS_REACHED).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (counted) {
            counted = false;
            int total = connectedClients.decrementAndGet();
            log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        }
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Command command) {
        if (rejected) {
            return;
        }
        log.info("Execute Command: {} args={}", command.name(), command.args());

        RedisMessage response = dispatcher.dispatch(command);
        if (log.isDebugEnabled()) {
            log.debug("Sending response to {}: {}", ctx.channel().remoteAddress(), response);
        }
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Error handling client {}, closing connection", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
