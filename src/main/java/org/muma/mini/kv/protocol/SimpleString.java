package org.muma.mini.kv.protocol;

// 简单字符串 (+)，内容不能包含 CR / LF
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString PONG = new SimpleString("PONG");

    public SimpleString {
        if (!isValid(content)) {
            throw new IllegalArgumentException("simple string must not contain CR or LF");
        }
    }

    public static boolean isValid(String content) {
        return content != null && content.indexOf('\r') < 0 && content.indexOf('\n') < 0;
    }
}
