package org.muma.mini.kv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import lombok.Getter;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.ConfigStore;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.server.RedisCommandHandler;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;
import org.muma.mini.kv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicInteger;

public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final MiniKvConfig config;

    // 整个进程只有一份存储和运行时配置，所有连接共享
    @Getter
    private final StorageEngine storage;
    @Getter
    private final ConfigStore configStore;
    private final CommandDispatcher dispatcher;

    private final AtomicInteger connectedClients = new AtomicInteger();
    private final RespEncoder encoder = new RespEncoder();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MiniKvServer(MiniKvConfig config) {
        this.config = config;
        this.storage = new MemoryStorageEngine(config.getExpireCycleMs());
        this.configStore = ConfigStore.from(config);
        this.dispatcher = new CommandDispatcher(storage, configStore);
    }

    /**
     * 绑定端口后立即返回；绑定失败时释放所有资源并抛出异常
     */
    public void start() throws InterruptedException {
        // boss 单线程负责 accept，worker 线程数固定，连接只在 worker 间分配
        bossGroup = new NioEventLoopGroup(1, ThreadUtils.namedThreadFactory("kv-boss"));
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads(), ThreadUtils.namedThreadFactory("kv-worker"));

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.INFO))
                    .option(ChannelOption.SO_REUSEADDR, true)
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new RespDecoder())
                                    .addLast(encoder)
                                    .addLast(new RedisCommandHandler(dispatcher, connectedClients, config.getMaxClients()));
                        }
                    });

            log.info("Starting Mini-KV server on port {}", config.getPort());
            serverChannel = bootstrap.bind(config.getPort()).sync().channel();
            log.info("Mini-KV started successfully on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start server on port {}", config.getPort(), e);
            stop();
            throw e;
        }
    }

    /**
     * 阻塞直到监听端口关闭
     */
    public void awaitClose() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    public int getBoundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void stop() {
        log.info("Shutting down Mini-KV server");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
        }
        storage.shutdown();
    }

    public static void main(String[] args) throws InterruptedException {
        MiniKvConfig config = MiniKvConfig.load(args);
        MiniKvServer server = new MiniKvServer(config);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "kv-shutdown"));
        server.awaitClose();
    }
}
