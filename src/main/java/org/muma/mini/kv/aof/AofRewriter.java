package org.muma.mini.kv.aof;

import org.muma.mini.kv.common.SnapshotEntry;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.utils.RespCodecUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

/**
 * AOF 重写引擎
 * 负责把存储快照转换为 RESP 写命令，写入临时文件后原子替换旧的 AOF。
 * <p>
 * String -> SET key value，Hash -> 每个 field 一条 HSET key field value。
 */
public class AofRewriter {

    private static final Logger log = LoggerFactory.getLogger(AofRewriter.class);

    private static final byte[] SET = "SET".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HSET = "HSET".getBytes(StandardCharsets.UTF_8);

    /**
     * 执行重写
     *
     * @param snapshot 存储快照
     * @param target   当前 AOF 文件，成功后被替换
     * @return 写入的命令条数
     */
    public long rewrite(List<SnapshotEntry> snapshot, Path target) throws IOException {
        long start = System.currentTimeMillis();
        Path tmp = tempFileFor(target);

        long count;
        try {
            count = writeCommands(snapshot, tmp);

            // 临时文件已经落盘，再原子替换，崩溃时旧文件要么完整保留要么被完整替换
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            syncDirectory(target.toAbsolutePath().getParent());
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }

        long duration = System.currentTimeMillis() - start;
        log.info("AOF rewrite finished. Keys: {}, Commands: {}, Size: {}, Duration: {} ms",
                snapshot.size(), count, Files.size(target), duration);
        return count;
    }

    static Path tempFileFor(Path target) {
        return target.resolveSibling(target.getFileName() + ".rewrite.tmp");
    }

    private long writeCommands(List<SnapshotEntry> snapshot, Path tmp) throws IOException {
        long count = 0;
        try (FileOutputStream fos = new FileOutputStream(tmp.toFile());
             BufferedOutputStream bos = new BufferedOutputStream(fos)) {

            for (SnapshotEntry entry : snapshot) {
                switch (entry.type()) {
                    case STRING -> {
                        bos.write(RespCodecUtil.encode(command(SET, entry.key(), entry.value())));
                        count++;
                    }
                    case HASH -> {
                        for (Map.Entry<String, byte[]> field : entry.fields().entrySet()) {
                            bos.write(RespCodecUtil.encode(hsetCommand(entry.key(), field.getKey(), field.getValue())));
                            count++;
                        }
                    }
                }
            }

            bos.flush();
            // 在关闭前强制刷盘，确保数据落盘
            fos.getFD().sync();
        }
        return count;
    }

    private RedisArray command(byte[] name, String key, byte[] value) {
        return new RedisArray(new RedisMessage[]{
                new BulkString(name), new BulkString(key), new BulkString(value)
        });
    }

    private RedisArray hsetCommand(String key, String field, byte[] value) {
        return new RedisArray(new RedisMessage[]{
                new BulkString(HSET), new BulkString(key), new BulkString(field), new BulkString(value)
        });
    }

    // rename 之后还要 fsync 目录本身，否则目录项可能丢失 (Linux)
    private void syncDirectory(Path dir) {
        if (dir == null) return;
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            // 部分平台 (Windows) 不支持打开目录
            log.debug("Directory fsync not supported for {}: {}", dir, e.getMessage());
        }
    }
}
