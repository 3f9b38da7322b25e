package org.muma.mini.kv.command.impl;

import org.muma.mini.kv.command.Command;
import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.config.ConfigStore;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

import java.util.Locale;

/**
 * CONFIG GET parameter / CONFIG SET parameter value
 */
public class ConfigCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, ConfigStore config, Command command) {
        if (command.argCount() < 1) {
            return errorArgs("config");
        }

        String subcommand = command.arg(0).toLowerCase(Locale.ROOT);
        return switch (subcommand) {
            case "get" -> configGet(config, command);
            case "set" -> configSet(config, command);
            default -> new ErrorMessage("ERR unknown subcommand");
        };
    }

    private RedisMessage configGet(ConfigStore config, Command command) {
        if (command.argCount() != 2) {
            return errorArgs("config|get");
        }
        String parameter = command.arg(1);
        String value = config.get(parameter);
        if (value == null) {
            return BulkString.NIL;
        }
        return RedisArray.of(parameter, value);
    }

    private RedisMessage configSet(ConfigStore config, Command command) {
        if (command.argCount() != 3) {
            return errorArgs("config|set");
        }
        config.set(command.arg(1), command.arg(2));
        return SimpleString.OK;
    }
}
