package org.muma.mini.kv.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MiniKvConfigTest {

    @Test
    void testDefaults() {
        MiniKvConfig config = new MiniKvConfig();
        assertEquals(6379, config.getPort());
        assertEquals(10, config.getWorkerThreads());
        assertNull(config.getDir());
        assertNull(config.getDbFilename());
    }

    @Test
    void testParseArgs() {
        MiniKvConfig config = new MiniKvConfig();
        config.parseArgs(new String[]{"--dir", "/tmp/redis-files", "--dbfilename", "dump.rdb",
                "--port", "6380", "--worker-threads", "4"});

        assertEquals("/tmp/redis-files", config.getDir());
        assertEquals("dump.rdb", config.getDbFilename());
        assertEquals(6380, config.getPort());
        assertEquals(4, config.getWorkerThreads());
    }

    @Test
    void testInvalidPortKeepsDefault() {
        MiniKvConfig config = new MiniKvConfig();
        config.parseArgs(new String[]{"--port", "abc", "--dir"});
        assertEquals(6379, config.getPort());
        assertNull(config.getDir(), "Flag without value is ignored");
    }

    @Test
    void testLoadFromClasspathProperties() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("test-kv.properties");

        assertEquals(7000, config.getPort());
        assertEquals(4, config.getWorkerThreads());
        assertEquals(10000, config.getMaxClients(), "Invalid value falls back to default");
        assertEquals("/data/kv", config.getDir());
        assertEquals("test.rdb", config.getDbFilename());
        // 超过 int 范围的值不能被截断
        assertEquals(5_000_000_000L, config.getExpireCycleMs());
    }

    @Test
    void testMissingConfigFileUsesDefaults() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("does-not-exist.properties");
        assertEquals(6379, config.getPort());
    }

    @Test
    void testPrecedenceArgsOverEnvOverFile() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("test-kv.properties");
        config.applyEnvOverrides(Map.of("KV_PORT", "7100", "KV_DIR", "/env/dir"));
        config.parseArgs(new String[]{"--port", "7200"});

        assertEquals(7200, config.getPort());
        assertEquals("/env/dir", config.getDir());
        assertEquals("test.rdb", config.getDbFilename());
    }
}
