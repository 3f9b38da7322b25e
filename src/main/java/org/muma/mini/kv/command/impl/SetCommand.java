package org.muma.mini.kv.command.impl;

import org.muma.mini.kv.command.Command;
import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.config.ConfigStore;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

import java.util.Locale;

public class SetCommand implements RedisCommand {

    // 超过这个值 now + ttl 会溢出
    private static final long MAX_TTL_MILLIS = Long.MAX_VALUE / 2;

    @Override
    public RedisMessage execute(StorageEngine storage, ConfigStore config, Command command) {
        // 格式: SET key value [EX seconds | PX milliseconds]
        if (command.argCount() < 2) {
            return errorArgs("set");
        }

        String key = command.arg(0);
        String value = command.arg(1);

        // --- 1. 参数解析阶段 ---
        long ttlMillis = -1;
        for (int i = 2; i < command.argCount(); i++) {
            String opt = command.arg(i).toUpperCase(Locale.ROOT);
            if (!opt.equals("PX") && !opt.equals("EX")) {
                return errorSyntax();
            }
            if (ttlMillis != -1 || i + 1 >= command.argCount()) {
                return errorSyntax();
            }
            long amount;
            try {
                amount = Long.parseLong(command.arg(++i));
            } catch (NumberFormatException e) {
                return errorInt();
            }
            long unit = opt.equals("EX") ? 1000L : 1L;
            if (amount <= 0 || amount > MAX_TTL_MILLIS / unit) {
                return new ErrorMessage("ERR invalid expire time in set");
            }
            ttlMillis = amount * unit;
        }

        // --- 2. 写入阶段 ---
        if (ttlMillis != -1) {
            storage.set(key, value, ttlMillis);
        } else {
            storage.set(key, value);
        }
        return SimpleString.OK;
    }
}
