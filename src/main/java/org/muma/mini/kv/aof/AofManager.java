package org.muma.mini.kv.aof;

import org.muma.mini.kv.common.SnapshotEntry;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.utils.RespCodecUtil;
import org.muma.mini.kv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * AOF 核心管理器
 * 负责单个 AOF 文件的打开、重放、追加、定时刷盘、重写和关闭。
 * <p>
 * 所有文件操作都在 AOF 锁 ({@link #lock}) 内完成，跨连接的追加因此有唯一的全局顺序。
 * 写命令通过 {@link #execute} 在同一把锁内"先执行、后追加"，保证日志顺序与内存修改顺序一致。
 * 加锁顺序固定为 AOF 锁 -> 存储锁。
 */
public class AofManager {

    private static final Logger log = LoggerFactory.getLogger(AofManager.class);

    private final MiniKvConfig config;
    private final StorageEngine storage; // Rewrite 需要访问内存
    private final Path path;

    private final AofDiskWriter diskWriter;
    private final AofLoader loader;
    private final AofRewriter rewriter;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile AofState state = AofState.LOADING;

    // 定时刷盘线程 (start 之后才创建)
    private ScheduledExecutorService fsyncExecutor;

    // Rewrite 专用单线程池，状态标志位防止重复提交
    private final ExecutorService rewriteExecutor = Executors.newSingleThreadExecutor(
            ThreadUtils.namedThreadFactory("AOF-Rewriter")
    );
    private final AtomicBoolean rewriteScheduled = new AtomicBoolean(false);

    // 统计数据：用于判断是否触发自动 Rewrite (受 lock 保护)
    private long lastRewriteSize = 0;
    private long currentAofSize = 0;

    public AofManager(MiniKvConfig config, StorageEngine storage) {
        this(config, storage, new AofDiskWriter(), new AofRewriter());
    }

    AofManager(MiniKvConfig config, StorageEngine storage, AofDiskWriter diskWriter, AofRewriter rewriter) {
        this.config = config;
        this.storage = storage;
        this.path = config.getAppendFilePath();
        this.diskWriter = diskWriter;
        this.loader = new AofLoader(config.isAofLoadTruncated());
        this.rewriter = rewriter;
    }

    /**
     * 打开或创建 AOF 文件，不做重放
     */
    public void open() throws IOException {
        lock.lock();
        try {
            diskWriter.open(path);
            currentAofSize = diskWriter.size();
            lastRewriteSize = currentAofSize;
            state = AofState.LOADING;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 从头重放 AOF，每条命令调用一次 apply。
     * 必须在对外服务之前完成；任何错误都应终止启动。
     */
    public long replay(Consumer<RedisArray> apply) throws IOException {
        lock.lock();
        try {
            long count = loader.load(path, apply);
            // aof-load-truncated 可能截短了文件
            currentAofSize = diskWriter.size();
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 进入 ACTIVE 状态，并按配置启动后台定时刷盘
     */
    public void start() {
        lock.lock();
        try {
            if (state == AofState.CLOSED) {
                throw new IllegalStateException("AOF already closed");
            }
            state = AofState.ACTIVE;

            if (config.getAppendFsync() == MiniKvConfig.AppendFsync.PERIODIC && fsyncExecutor == null) {
                long interval = config.getAppendFsyncIntervalMs();
                fsyncExecutor = Executors.newSingleThreadScheduledExecutor(
                        ThreadUtils.namedThreadFactory("AOF-Fsync")
                );
                fsyncExecutor.scheduleWithFixedDelay(this::flush, interval, interval, TimeUnit.MILLISECONDS);
            }
            log.info("AOF active: {} (fsync={}, size={} bytes)", path, config.getAppendFsync(), currentAofSize);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 写命令入口：在 AOF 锁内执行修改，成功 (非 ErrorMessage) 后追加到文件。
     */
    public RedisMessage execute(RedisArray command, Supplier<RedisMessage> execution) {
        lock.lock();
        try {
            RedisMessage result = execution.get();
            if (!(result instanceof ErrorMessage)) {
                appendLocked(command);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 追加命令，只写到 OS Cache，不强制刷盘 (ALWAYS 策略除外)
     */
    public void append(RedisArray command) {
        lock.lock();
        try {
            appendLocked(command);
        } finally {
            lock.unlock();
        }
    }

    private void appendLocked(RedisArray command) {
        if (state == AofState.CLOSED) {
            log.warn("AOF closed, dropping command: {}", command);
            return;
        }

        try {
            byte[] bytes = RespCodecUtil.encode(command);
            diskWriter.write(bytes);
            if (config.getAppendFsync() == MiniKvConfig.AppendFsync.ALWAYS) {
                diskWriter.force();
            }

            // 更新统计并检查 Rewrite
            currentAofSize += bytes.length;
            checkRewrite();
        } catch (IOException e) {
            // 可用性优先：命令照常返回结果，只是这一条没有持久化
            log.error("Failed to append AOF, command is not durable: {}", command, e);
        }
    }

    /**
     * 刷盘 (后台线程定时调用)
     */
    public void flush() {
        lock.lock();
        try {
            diskWriter.force();
        } catch (IOException e) {
            log.warn("AOF fsync failed", e);
        } finally {
            lock.unlock();
        }
    }

    // --- Rewrite ---

    /**
     * 用当前内存状态重写 AOF。
     * 整个过程持有 AOF 锁 (新的追加会等待)，存储锁只在取快照的瞬间持有。
     * 失败时旧 AOF 保持不变并重新打开。
     */
    public void rewrite() throws IOException {
        lock.lock();
        AofState previous = state;
        try {
            if (previous == AofState.CLOSED) {
                throw new IllegalStateException("AOF already closed");
            }
            state = AofState.REWRITING;
            log.info("AOF rewrite started. Current size: {}, last rewrite size: {}", currentAofSize, lastRewriteSize);

            List<SnapshotEntry> snapshot = storage.snapshot();
            diskWriter.close();
            try {
                rewriter.rewrite(snapshot, path);
            } finally {
                diskWriter.open(path);
            }

            currentAofSize = diskWriter.size();
            lastRewriteSize = currentAofSize;
        } finally {
            state = previous;
            lock.unlock();
        }
    }

    private void checkRewrite() {
        int percentage = config.getAofRewritePercentage();
        if (percentage <= 0 || state != AofState.ACTIVE || rewriteScheduled.get()) return;

        long baseSize = lastRewriteSize == 0 ? 1 : lastRewriteSize;
        long growth = ((currentAofSize - lastRewriteSize) * 100) / baseSize;

        if (currentAofSize > config.getAofRewriteMinSize() && growth >= percentage) {
            if (rewriteScheduled.compareAndSet(false, true)) {
                log.info("AOF rewrite triggered. Current size: {}, base size: {}", currentAofSize, lastRewriteSize);
                rewriteExecutor.submit(this::backgroundRewrite);
            }
        }
    }

    private void backgroundRewrite() {
        try {
            if (state == AofState.ACTIVE) {
                rewrite();
            }
        } catch (IOException | RuntimeException e) {
            log.error("Background AOF rewrite failed, keeping the previous file", e);
        } finally {
            rewriteScheduled.set(false);
        }
    }

    // --- 关闭 ---

    /**
     * 停止后台任务，刷盘并关闭文件。重复调用无副作用。
     */
    public void shutdown() {
        // 两个线程池都不能 shutdownNow：中断会让正在 force/写入的 FileChannel 被关闭
        if (fsyncExecutor != null) {
            fsyncExecutor.shutdown();
            awaitQuietly(fsyncExecutor, 5, "AOF fsync");
        }
        rewriteExecutor.shutdown();
        awaitQuietly(rewriteExecutor, 30, "AOF rewrite");

        lock.lock();
        try {
            if (state == AofState.CLOSED) return;
            state = AofState.CLOSED;
            diskWriter.close();
            log.info("AOF closed: {}", path);
        } catch (IOException e) {
            log.error("Error closing AOF file", e);
        } finally {
            lock.unlock();
        }
    }

    private void awaitQuietly(ExecutorService executor, long seconds, String name) {
        try {
            if (!executor.awaitTermination(seconds, TimeUnit.SECONDS)) {
                log.warn("{} still running after {}s, closing anyway", name, seconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public AofState getState() {
        return state;
    }

    long getCurrentAofSize() {
        lock.lock();
        try {
            return currentAofSize;
        } finally {
            lock.unlock();
        }
    }
}
