package org.muma.mini.kv.protocol;

import io.netty.handler.codec.CorruptedFrameException;

/**
 * 数据在一个 RESP 值的中间就结束了 (半包)。
 * <p>
 * 网络场景下 {@link RespDecoder} 会等待更多字节，不会看到这个异常；
 * 读 AOF 文件时出现它说明文件尾部被截断。
 */
public class TruncatedFrameException extends CorruptedFrameException {

    public TruncatedFrameException(String message) {
        super(message);
    }
}
