package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;
import org.muma.mini.kv.command.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 请求解码器
 * 客户端请求固定为 BulkString 数组: *<argc>\r\n($<len>\r\n<arg>\r\n)+
 * 按长度前缀读取参数，参数里可以包含空格和 CRLF。
 * 数据不完整时由 ReplayingDecoder 回滚，等下一批数据到达后从帧头重新解析。
 * 每个连接持有独立实例 (有状态，不能 Sharable)。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    static final int MAX_BULK_LENGTH = 64 * 1024 * 1024;
    static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    static final int MAX_LINE_LENGTH = 64 * 1024;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        try {
            out.add(decodeCommand(in));
        } catch (ProtocolException | NumberFormatException e) {
            // 帧已经错位，丢弃当前缓冲的全部数据，回一个错误后继续读
            int discarded = actualReadableBytes();
            in.skipBytes(discarded);
            log.warn("Protocol error from {}: {} (discarded {} bytes)",
                    ctx.channel().remoteAddress(), e.getMessage(), discarded);
            out.add(Command.malformed());
        }
    }

    private Command decodeCommand(ByteBuf in) {
        byte typeByte = in.readByte();
        if (typeByte != ASTERISK_BYTE) {
            throw new ProtocolException("expected '*', got '" + (char) typeByte + "'");
        }

        int count = readLength(in, MAX_ARRAY_LENGTH);
        if (count <= 0) {
            throw new ProtocolException("invalid multibulk length " + count);
        }

        String name = readBulkString(in);
        List<String> args = new ArrayList<>(Math.min(count - 1, 16));
        for (int i = 1; i < count; i++) {
            args.add(readBulkString(in));
        }
        return Command.of(name, args);
    }

    // $<length>\r\n<data>\r\n
    private String readBulkString(ByteBuf in) {
        byte type = in.readByte();
        if (type != DOLLAR_BYTE) {
            throw new ProtocolException("expected '$', got '" + (char) type + "'");
        }
        int length = readLength(in, MAX_BULK_LENGTH);

        // 数据没到齐时 readSlice 直接回滚，不会提前按声明的长度分配内存
        ByteBuf content = in.readSlice(length);
        readCRLF(in);
        return content.toString(StandardCharsets.UTF_8);
    }

    // 只接受 [0, max]，先检查范围再转 int
    private int readLength(ByteBuf in, int max) {
        long value = Long.parseLong(readLine(in));
        if (value < 0 || value > max) {
            throw new ProtocolException("invalid length " + value);
        }
        return (int) value;
    }

    // 读取到 \r\n 为止
    private String readLine(ByteBuf in) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            byte b = in.readByte();
            if (b == CR) {
                byte next = in.readByte();
                if (next == LF) {
                    return sb.toString();
                }
                sb.append((char) b).append((char) next);
            } else {
                sb.append((char) b);
            }
            if (sb.length() > MAX_LINE_LENGTH) {
                throw new ProtocolException("line too long");
            }
        }
    }

    private void readCRLF(ByteBuf in) {
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new ProtocolException("expected CRLF after bulk data");
        }
    }

    static class ProtocolException extends RuntimeException {
        ProtocolException(String message) {
            super(message);
        }
    }
}
