package org.muma.mini.kv.command;

import org.muma.mini.kv.command.impl.ConfigCommand;
import org.muma.mini.kv.command.impl.EchoCommand;
import org.muma.mini.kv.command.impl.GetCommand;
import org.muma.mini.kv.command.impl.PingCommand;
import org.muma.mini.kv.command.impl.SetCommand;
import org.muma.mini.kv.config.ConfigStore;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 命令分发器
 * 无状态，所有连接共享同一个实例；共享的只有 storage 和 config。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    static final ErrorMessage UNKNOWN_COMMAND = new ErrorMessage("ERR unknown command");

    private static final long SLOW_COMMAND_MS = 10;

    private final StorageEngine storage;
    private final ConfigStore config;

    private final RedisCommand ping = new PingCommand();
    private final RedisCommand echo = new EchoCommand();
    private final RedisCommand set = new SetCommand();
    private final RedisCommand get = new GetCommand();
    private final RedisCommand configCommand = new ConfigCommand();

    public CommandDispatcher(StorageEngine storage, ConfigStore config) {
        this.storage = storage;
        this.config = config;
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(Command command) {
        // 1. 查找命令
        RedisCommand handler = switch (command.type()) {
            case PING -> ping;
            case ECHO -> echo;
            case SET -> set;
            case GET -> get;
            case CONFIG -> configCommand;
            case UNKNOWN -> null;
        };

        if (handler == null) {
            log.warn("Command not found: '{}'", command.name());
            return UNKNOWN_COMMAND;
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = handler.execute(storage, config, command);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > SLOW_COMMAND_MS) {
                log.warn("Slow command detected: {} cost {}ms", command.name(), duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", command.name(), duration);
            }
            return response;

        } catch (IllegalArgumentException e) {
            // 预期内的业务错误
            log.warn("Command execution failed (Client Error): {} - {}", command.name(), e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (RuntimeException e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", command.name(), e);
            return new ErrorMessage("ERR internal server error");
        }
    }
}
