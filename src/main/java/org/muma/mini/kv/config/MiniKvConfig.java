package org.muma.mini.kv.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 启动配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (mini-kv.properties) > 默认值
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "mini-kv.properties";

    // --- Core Settings ---
    private int port = 6379;
    private int workerThreads = 10; // 0 = Netty default (2 * cores)
    private int maxClients = 10000;
    private long expireCycleMs = MemoryStorageEngine.DEFAULT_EXPIRE_CYCLE_MS;

    // --- Persistence (只保存，不落盘) ---
    private String dir;
    private String dbFilename;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    /**
     * 按优先级组装完整配置
     */
    public static MiniKvConfig load(String[] args) {
        MiniKvConfig config = new MiniKvConfig();
        config.configFilePath = findConfigPath(args);
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(System.getenv());
        config.parseArgs(args);
        log.info("MiniKvConfig initialized: {}", config);
        return config;
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return DEFAULT_CONFIG_FILE;
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            boolean hasValue = i + 1 < args.length;
            if ("--config".equals(arg) && hasValue) {
                this.configFilePath = args[++i];
            } else if ("--port".equals(arg) && hasValue) {
                this.port = parseInt("--port", args[++i], this.port);
            } else if ("--dir".equals(arg) && hasValue) {
                this.dir = args[++i];
            } else if ("--dbfilename".equals(arg) && hasValue) {
                this.dbFilename = args[++i];
            } else if ("--worker-threads".equals(arg) && hasValue) {
                this.workerThreads = parseInt("--worker-threads", args[++i], this.workerThreads);
            } else {
                log.warn("Ignoring unrecognized argument: {}", arg);
            }
        }
        if (dir != null && dbFilename != null) {
            log.info("Using directory: {}, database filename: {}", dir, dbFilename);
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);
        this.maxClients = getInt(props, "server.max_clients", this.maxClients);
        this.expireCycleMs = getLong(props, "server.expire_cycle_ms", this.expireCycleMs);

        this.dir = props.getProperty("dir", this.dir);
        this.dbFilename = props.getProperty("dbfilename", this.dbFilename);
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("KV_PORT");
        if (envPort != null) {
            this.port = parseInt("KV_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envDir = env.get("KV_DIR");
        if (envDir != null) {
            this.dir = envDir;
            log.info("Dir overridden by ENV: {}", this.dir);
        }

        String envDbFilename = env.get("KV_DBFILENAME");
        if (envDbFilename != null) {
            this.dbFilename = envDbFilename;
            log.info("Dbfilename overridden by ENV: {}", this.dbFilename);
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 先按 classpath 资源加载
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 再尝试文件系统路径
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val.trim(), defaultValue) : defaultValue;
    }

    private long getLong(Properties props, String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", key, val, defaultValue);
            return defaultValue;
        }
    }

    private int parseInt(String name, String value, int defaultValue) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", name, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", workerThreads=" + workerThreads + ", maxClients=" + maxClients
                + ", dir=" + dir + ", dbfilename=" + dbFilename + "}";
    }
}
