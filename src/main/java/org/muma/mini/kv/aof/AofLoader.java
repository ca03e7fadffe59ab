package org.muma.mini.kv.aof;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.CorruptedFrameException;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.TruncatedFrameException;
import org.muma.mini.kv.utils.RespCodecUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.function.Consumer;

/**
 * AOF 加载器 (Recovery)
 * 负责在启动时从头重放 AOF 文件。
 */
public class AofLoader {

    private static final Logger log = LoggerFactory.getLogger(AofLoader.class);

    private final boolean loadTruncated;

    /**
     * @param loadTruncated 文件尾部只有半条命令时，是否截掉这部分继续启动 (对应 aof-load-truncated)
     */
    public AofLoader(boolean loadTruncated) {
        this.loadTruncated = loadTruncated;
    }

    /**
     * 逐条解码并回调。
     *
     * @return 重放的命令条数
     * @throws IOException 读文件失败，或文件内容损坏 (启动必须终止)
     */
    public long load(Path file, Consumer<RedisArray> apply) throws IOException {
        if (!Files.exists(file)) {
            log.info("No AOF file found at {}, skipping load.", file.toAbsolutePath());
            return 0;
        }

        long fileSize = Files.size(file);
        log.info("Start loading AOF file: {} (Size: {} bytes)", file.getFileName(), fileSize);
        long startTime = System.currentTimeMillis();

        // 读取整个文件到 ByteBuf (注意：如果文件巨大，这里会占用同等大小的内存)
        byte[] bytes = Files.readAllBytes(file);
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);

        long count = 0;
        long lastLogTime = startTime;
        try {
            // 恰好在值的边界读完 = 正常 EOF
            while (buf.isReadable()) {
                int offset = buf.readerIndex();
                RedisMessage msg;
                try {
                    msg = RespCodecUtil.decode(buf, false);
                } catch (TruncatedFrameException e) {
                    if (!loadTruncated) {
                        throw new IOException("Truncated AOF record at offset " + offset + " of " + file
                                + " (set aof-load-truncated=yes to discard the incomplete tail)", e);
                    }
                    log.warn("AOF file {} ends with an incomplete record at offset {}, truncating {} bytes",
                            file.getFileName(), offset, bytes.length - offset);
                    truncate(file, offset);
                    break;
                } catch (CorruptedFrameException e) {
                    throw new IOException("Corrupted AOF record at offset " + offset + " of " + file, e);
                }

                if (!(msg instanceof RedisArray command) || command.size() == 0) {
                    throw new IOException("Unexpected AOF record at offset " + offset + ": " + msg);
                }

                apply.accept(command);
                count++;

                // 【进度监控】每 10万 条 且距上次超过 2秒 打印一次进度
                if (count % 100_000 == 0) {
                    long now = System.currentTimeMillis();
                    if (now - lastLogTime > 2000) {
                        log.info("AOF loading progress: {} commands processed...", count);
                        lastLogTime = now;
                    }
                }
            }
        } finally {
            buf.release();
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("AOF file {} loaded successfully. Total commands: {}. Duration: {} ms",
                file.getFileName(), count, duration);
        return count;
    }

    private void truncate(Path file, long size) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            channel.truncate(size);
            channel.force(true);
        }
    }
}
