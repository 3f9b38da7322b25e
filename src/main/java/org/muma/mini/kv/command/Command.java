package org.muma.mini.kv.command;

import java.util.List;
import java.util.Locale;

/**
 * 一帧解析出来的命令：小写的命令名 + 有序参数
 *
 * @param type 命令种类
 * @param name 小写命令名，无法解析的帧为空串
 * @param args 参数，不含命令名本身
 */
public record Command(CommandType type, String name, List<String> args) {

    public Command {
        args = List.copyOf(args);
    }

    public static Command of(String name, List<String> args) {
        String lower = name.toLowerCase(Locale.ROOT);
        return new Command(CommandType.fromName(lower), lower, args);
    }

    public static Command of(String name, String... args) {
        return of(name, List.of(args));
    }

    // 协议错误的帧
    public static Command malformed() {
        return new Command(CommandType.UNKNOWN, "", List.of());
    }

    public int argCount() {
        return args.size();
    }

    public String arg(int index) {
        return args.get(index);
    }
}
