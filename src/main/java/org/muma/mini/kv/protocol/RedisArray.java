package org.muma.mini.kv.protocol;

import java.util.Arrays;
import java.util.List;

// 数组 (*)，元素只允许是 BulkString；elements 为 null 表示 *-1
public record RedisArray(BulkString[] elements) implements RedisMessage {

    public static RedisArray of(String... items) {
        BulkString[] elements = new BulkString[items.length];
        for (int i = 0; i < items.length; i++) {
            elements[i] = new BulkString(items[i]);
        }
        return new RedisArray(elements);
    }

    public List<String> asStrings() {
        return elements == null ? List.of() : Arrays.stream(elements).map(BulkString::asString).toList();
    }
}
