package org.muma.mini.kv.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class MiniKvConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        MiniKvConfig config = new MiniKvConfig();

        assertEquals(6379, config.getPort());
        assertTrue(config.isAppendOnly());
        assertEquals(MiniKvConfig.AppendFsync.PERIODIC, config.getAppendFsync());
        assertEquals(5000, config.getAppendFsyncIntervalMs());
        assertEquals(Path.of(".", "appendonly.aof"), config.getAppendFilePath());
        assertFalse(config.isAofLoadTruncated());
    }

    @Test
    void testParseSize() {
        assertEquals(100, MiniKvConfig.parseSize("100"));
        assertEquals(100, MiniKvConfig.parseSize("100b"));
        assertEquals(2048, MiniKvConfig.parseSize("2kb"));
        assertEquals(64L * 1024 * 1024, MiniKvConfig.parseSize("64MB"));
        assertEquals(1024L * 1024 * 1024, MiniKvConfig.parseSize(" 1gb "));
        assertThrows(NumberFormatException.class, () -> MiniKvConfig.parseSize("lots"));
    }

    @Test
    void testLoadConfigFile() throws IOException {
        Path file = tempDir.resolve("kv.properties");
        Files.writeString(file, String.join("\n",
                "server.port=7001",
                "appendonly=no",
                "appendfsync=always",
                "appenddirname=/data/kv",
                "appendfilename=kv.aof",
                "aof-load-truncated=yes",
                "auto-aof-rewrite-percentage=0",
                "auto-aof-rewrite-min-size=1mb"));

        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig(file.toString());

        assertEquals(7001, config.getPort());
        assertFalse(config.isAppendOnly());
        assertEquals(MiniKvConfig.AppendFsync.ALWAYS, config.getAppendFsync());
        assertEquals(Path.of("/data/kv", "kv.aof"), config.getAppendFilePath());
        assertTrue(config.isAofLoadTruncated());
        assertEquals(0, config.getAofRewritePercentage());
        assertEquals(1024 * 1024, config.getAofRewriteMinSize());
    }

    @Test
    void testFileOnDiskWinsOverClasspathDefault() throws IOException {
        // 与 classpath 中默认配置同名的文件 (相对当前目录)
        Path local = Path.of(MiniKvConfig.DEFAULT_CONFIG_FILE);
        assumeFalse(Files.exists(local));
        Files.writeString(local, "server.port=7100\n");
        try {
            MiniKvConfig config = new MiniKvConfig();
            config.load(new String[]{"--config", MiniKvConfig.DEFAULT_CONFIG_FILE}, Map.of());

            assertEquals(7100, config.getPort());
        } finally {
            Files.deleteIfExists(local);
        }
    }

    @Test
    void testClasspathDefaultUsedWithoutLocalFile() {
        assumeFalse(Files.exists(Path.of(MiniKvConfig.DEFAULT_CONFIG_FILE)));

        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig(MiniKvConfig.DEFAULT_CONFIG_FILE);

        assertEquals(6379, config.getPort());
        assertEquals(64L * 1024 * 1024, config.getAofRewriteMinSize());
    }

    @Test
    void testNonPositiveFsyncIntervalIsRejected() throws IOException {
        Path file = tempDir.resolve("kv.properties");
        Files.writeString(file, "appendfsync-interval-ms=0\n");

        MiniKvConfig config = new MiniKvConfig();
        assertThrows(IllegalArgumentException.class, () -> config.loadConfig(file.toString()));

        Files.writeString(file, "appendfsync-interval-ms=-5\n");
        assertThrows(IllegalArgumentException.class, () -> config.loadConfig(file.toString()));
    }

    @Test
    void testMissingConfigFileKeepsDefaults() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig(tempDir.resolve("nope.properties").toString());

        assertEquals(6379, config.getPort());
    }

    @Test
    void testPrecedenceArgsOverEnvOverFile() throws IOException {
        Path file = tempDir.resolve("kv.properties");
        Files.writeString(file, "server.port=7001\nappenddirname=/from/file\n");

        MiniKvConfig config = new MiniKvConfig();
        config.load(new String[]{"--config", file.toString(), "--port", "7003"},
                Map.of("MINIKV_PORT", "7002", "MINIKV_APPEND_DIR", "/from/env"));

        assertEquals(7003, config.getPort());
        assertEquals("/from/env", config.getAppendDir());
    }

    @Test
    void testArgs() {
        MiniKvConfig config = new MiniKvConfig();
        config.parseArgs(new String[]{"--port", "0", "--dir", "/tmp/kv", "--appendonly", "no", "--bogus", "x"});

        assertEquals(0, config.getPort());
        assertEquals("/tmp/kv", config.getAppendDir());
        assertFalse(config.isAppendOnly());
    }

    @Test
    void testInvalidValuesAreRejected() {
        MiniKvConfig config = new MiniKvConfig();

        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--appendonly", "maybe"}));
        assertThrows(IllegalArgumentException.class, () -> config.applyEnvOverrides(Map.of("MINIKV_PORT", "x")));
    }
}
