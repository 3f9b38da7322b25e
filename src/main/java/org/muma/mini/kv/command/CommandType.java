package org.muma.mini.kv.command;

import java.util.Locale;

/**
 * 支持的命令种类，由解码器在解析帧时确定
 */
public enum CommandType {
    PING,
    ECHO,
    SET,
    GET,
    CONFIG,
    UNKNOWN;

    public static CommandType fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "ping" -> PING;
            case "echo" -> ECHO;
            case "set" -> SET;
            case "get" -> GET;
            case "config" -> CONFIG;
            default -> UNKNOWN;
        };
    }
}
