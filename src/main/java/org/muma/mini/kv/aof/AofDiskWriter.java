package org.muma.mini.kv.aof;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * AOF 物理写入器
 * <p>
 * 只负责 FileChannel 的打开 / 追加 / 刷盘 / 关闭，本身不加锁，
 * 并发控制由 {@link AofManager} 的 AOF 锁保证。
 * write 只写到 OS Cache，落盘由 {@link #force()} 决定。
 */
public class AofDiskWriter {

    private static final Logger log = LoggerFactory.getLogger(AofDiskWriter.class);

    private FileChannel fileChannel;

    /**
     * 打开 (或创建) 文件，已有内容保留，之后的写入都追加在末尾
     */
    public void open(Path file) throws IOException {
        closeChannel(); // 关闭旧的

        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        this.fileChannel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);

        log.info("Opened AOF file: {} ({} bytes)", file.toAbsolutePath(), fileChannel.size());
    }

    public void write(byte[] content) throws IOException {
        if (!isOpen()) {
            throw new IOException("AOF file is not open");
        }
        ByteBuffer buf = ByteBuffer.wrap(content);
        while (buf.hasRemaining()) {
            fileChannel.write(buf);
        }
    }

    /**
     * 把 OS Cache 中的数据刷到磁盘
     */
    public void force() throws IOException {
        if (isOpen()) {
            fileChannel.force(false);
        }
    }

    public long size() throws IOException {
        return isOpen() ? fileChannel.size() : 0;
    }

    public boolean isOpen() {
        return fileChannel != null && fileChannel.isOpen();
    }

    public void close() throws IOException {
        if (fileChannel == null) return;
        try {
            if (fileChannel.isOpen()) {
                fileChannel.force(true);
            }
        } finally {
            fileChannel.close();
            fileChannel = null;
        }
    }

    private void closeChannel() {
        try {
            close();
        } catch (IOException e) {
            log.error("Error closing AOF channel", e);
        }
    }
}
