package org.muma.mini.kv.command.impl;

import org.muma.mini.kv.command.Command;
import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.config.ConfigStore;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

public class GetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, ConfigStore config, Command command) {
        if (command.argCount() != 1) {
            return errorArgs("get");
        }

        String value = storage.get(command.arg(0));
        return value == null ? BulkString.NIL : new BulkString(value);
    }
}
