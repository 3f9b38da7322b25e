package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

/**
 * RESP 协议编码器
 * 无状态，所有连接可以共享同一个实例
 */
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NIL_LENGTH = "-1".getBytes(StandardCharsets.UTF_8);

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        writeTo(out, msg);
    }

    /**
     * 把一个回复写入 ByteBuf，数组元素递归调用
     */
    public static void writeTo(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeBytes(s.toBytes(s.content()));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeBytes(e.toBytes(e.content()));
            out.writeBytes(CRLF);
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.isNil()) {
                out.writeBytes(NIL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeLength(out, b.content().length);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            if (a.elements() == null) {
                out.writeBytes(NIL_LENGTH);
                out.writeBytes(CRLF);
                return;
            }
            writeLength(out, a.elements().length);
            for (BulkString element : a.elements()) {
                writeTo(out, element);
            }
        }
    }

    private static void writeLength(ByteBuf out, int length) {
        out.writeBytes(String.valueOf(length).getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(CRLF);
    }
}
