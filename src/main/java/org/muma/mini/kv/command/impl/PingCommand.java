package org.muma.mini.kv.command.impl;

import org.muma.mini.kv.command.Command;
import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.config.ConfigStore;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

// 参数一律忽略
public class PingCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, ConfigStore config, Command command) {
        return SimpleString.PONG;
    }
}
