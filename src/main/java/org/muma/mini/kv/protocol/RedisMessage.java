package org.muma.mini.kv.protocol;

import java.nio.charset.StandardCharsets;

// 密封接口，回复类型只有这四种
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, BulkString, RedisArray {

    default byte[] toBytes(String content) {
        return content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8);
    }
}
