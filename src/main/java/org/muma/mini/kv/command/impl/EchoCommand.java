package org.muma.mini.kv.command.impl;

import org.muma.mini.kv.command.Command;
import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.config.ConfigStore;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

public class EchoCommand implements RedisCommand {

    static final ErrorMessage INVALID_MESSAGE = new ErrorMessage("ERR echo message must not contain CR or LF");

    @Override
    public RedisMessage execute(StorageEngine storage, ConfigStore config, Command command) {
        if (command.argCount() != 1) {
            return errorArgs("echo");
        }
        String message = command.arg(0);
        // 回复是 Simple String，内容里的 CRLF 会被客户端当成下一条回复
        if (!SimpleString.isValid(message)) {
            return INVALID_MESSAGE;
        }
        return new SimpleString(message);
    }
}
