package org.muma.mini.kv.command;

import org.muma.mini.kv.config.ConfigStore;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

public interface RedisCommand {

    // 执行命令，传入共享存储、运行时配置和解析好的命令
    RedisMessage execute(StorageEngine storage, ConfigStore config, Command command);

    /**
     * 辅助工具：快速构建参数个数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：快速构建数值错误
     */
    default ErrorMessage errorInt() {
        return new ErrorMessage("ERR value is not an integer or out of range");
    }

    default ErrorMessage errorSyntax() {
        return new ErrorMessage("ERR syntax error");
    }
}
