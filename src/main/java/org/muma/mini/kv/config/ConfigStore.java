package org.muma.mini.kv.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 运行时配置参数 (CONFIG GET / CONFIG SET)
 * 与数据存储相互独立，不校验参数名，未知参数也照常保存。
 */
public class ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

    public static final String DIR = "dir";
    public static final String DB_FILENAME = "dbfilename";

    private final Map<String, String> params = new ConcurrentHashMap<>();

    public ConfigStore() {
    }

    /**
     * 用启动配置预置 dir / dbfilename，未设置的参数不写入
     */
    public static ConfigStore from(MiniKvConfig config) {
        ConfigStore store = new ConfigStore();
        if (config.getDir() != null) {
            store.set(DIR, config.getDir());
        }
        if (config.getDbFilename() != null) {
            store.set(DB_FILENAME, config.getDbFilename());
        }
        return store;
    }

    public String get(String param) {
        return params.get(param);
    }

    public void set(String param, String value) {
        String old = params.put(param, value);
        log.debug("Config parameter {} changed: {} -> {}", param, old, value);
    }
}
