package org.muma.mini.kv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (mini-kv.properties) > 默认值
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);
    private static final MiniKvConfig INSTANCE = new MiniKvConfig();

    public static final String DEFAULT_CONFIG_FILE = "mini-kv.properties";

    // --- Core Settings ---
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default
    private int commandThreads = 0; // 0 = CPU 核数

    // --- Persistence (AOF) ---
    private boolean appendOnly = true;
    private AppendFsync appendFsync = AppendFsync.PERIODIC;
    private long appendFsyncIntervalMs = 5000;
    private String appendDir = ".";
    private String appendFilename = "appendonly.aof";
    // 文件尾部半条命令时是否截断后继续启动
    private boolean aofLoadTruncated = false;

    // --- Rewrite Config ---
    // 默认 100% (即大小翻倍时重写)，0 表示关闭自动重写
    private int aofRewritePercentage = 100;
    // 默认 64MB (小于这个大小不重写)
    private long aofRewriteMinSize = 64L * 1024 * 1024;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // --- Enums ---
    public enum AppendFsync {
        // 每次追加都 force
        ALWAYS,
        // 后台定时 force (appendfsync-interval-ms)
        PERIODIC,
        // 交给操作系统
        NO
    }

    public MiniKvConfig() {
    }

    // --- Singleton Access ---
    public static MiniKvConfig getInstance() {
        return INSTANCE;
    }

    public Path getAppendFilePath() {
        return Path.of(appendDir, appendFilename);
    }

    // --- Loading Logic ---

    /**
     * 完整加载流程: 先找 --config，再依次叠加 配置文件 / 环境变量 / 命令行
     */
    public void load(String[] args, Map<String, String> env) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                this.configFilePath = args[i + 1];
            }
        }
        loadConfig(configFilePath);
        applyEnvOverrides(env);
        parseArgs(args);
        log.info("MiniKvConfig initialized: {}", this);
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring dangling argument: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> i++;
                case "--port" -> this.port = parseInt("--port", args[++i]);
                case "--dir" -> this.appendDir = args[++i];
                case "--appendonly" -> this.appendOnly = parseYesNo("--appendonly", args[++i]);
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);
        this.commandThreads = getInt(props, "server.command_threads", this.commandThreads);

        // 2. Persistence
        loadPersistenceConfig(props);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        // 文件系统优先，同名的 classpath 默认配置只在找不到文件时使用
        Path file = Path.of(path);
        if (Files.isRegularFile(file)) {
            try (InputStream fis = Files.newInputStream(file)) {
                props.load(fis);
                log.info("Loaded config from file: {}", file.toAbsolutePath());
            } catch (IOException e) {
                log.error("Error loading config file: {}", path, e);
            }
            return props;
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                log.warn("Config file not found: {}, using defaults.", path);
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("MINIKV_PORT");
        if (envPort != null) {
            this.port = parseInt("MINIKV_PORT", envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envDir = env.get("MINIKV_APPEND_DIR");
        if (envDir != null) {
            this.appendDir = envDir;
            log.info("AOF dir overridden by ENV: {}", this.appendDir);
        }
    }

    private void loadPersistenceConfig(Properties props) {
        this.appendOnly = parseYesNo("appendonly", getString(props, "appendonly", appendOnly ? "yes" : "no"));

        String fsync = getString(props, "appendfsync", appendFsync.name());
        try {
            this.appendFsync = AppendFsync.valueOf(fsync.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid appendfsync value '{}', using default PERIODIC.", fsync);
        }
        this.appendFsyncIntervalMs = getLong(props, "appendfsync-interval-ms", this.appendFsyncIntervalMs);
        if (appendFsyncIntervalMs <= 0) {
            throw new IllegalArgumentException("Invalid value for appendfsync-interval-ms: " + appendFsyncIntervalMs);
        }

        this.appendDir = getString(props, "appenddirname", this.appendDir);
        this.appendFilename = getString(props, "appendfilename", this.appendFilename);
        this.aofLoadTruncated = parseYesNo("aof-load-truncated",
                getString(props, "aof-load-truncated", aofLoadTruncated ? "yes" : "no"));

        // 解析 Rewrite 配置
        String percentage = getString(props, "auto-aof-rewrite-percentage", String.valueOf(aofRewritePercentage));
        try {
            this.aofRewritePercentage = Integer.parseInt(percentage.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid auto-aof-rewrite-percentage '{}', using default {}.", percentage, aofRewritePercentage);
        }

        String minSize = props.getProperty("auto-aof-rewrite-min-size");
        if (minSize != null) {
            try {
                this.aofRewriteMinSize = parseSize(minSize);
            } catch (NumberFormatException e) {
                log.warn("Invalid auto-aof-rewrite-min-size '{}', using default 64MB.", minSize);
            }
        }
    }

    // 辅助：解析带单位的大小 (64mb, 1gb)
    static long parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase(Locale.ROOT).trim();
        long multiplier = 1;
        if (s.endsWith("kb")) {
            multiplier = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("mb")) {
            multiplier = 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("gb")) {
            multiplier = 1024 * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("b")) {
            s = s.substring(0, s.length() - 1);
        }
        return Long.parseLong(s.trim()) * multiplier;
    }

    private static boolean parseYesNo(String name, String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "yes", "true" -> true;
            case "no", "false" -> false;
            default -> throw new IllegalArgumentException("Invalid value for " + name + ": " + value);
        };
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val) : defaultValue;
    }

    private long getLong(Properties props, String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + val, e);
        }
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", aof=" + appendOnly + ", file=" + getAppendFilePath()
                + ", fsync=" + appendFsync + "}";
    }
}
