package org.muma.mini.kv.protocol;

// 错误 (-)
public record ErrorMessage(String content) implements RedisMessage {
}
