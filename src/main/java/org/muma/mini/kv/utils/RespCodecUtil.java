package org.muma.mini.kv.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.CorruptedFrameException;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.protocol.TruncatedFrameException;

import java.nio.charset.StandardCharsets;

/**
 * RESP 协议编解码工具类
 * <p>
 * 网络层 (RespDecoder / RespEncoder) 和 AOF (追加、加载、重写) 共用同一套逻辑。
 * decode 既可以跑在 ReplayingDecoder 的 ByteBuf 上 (数据不够时由 Netty 回滚重试)，
 * 也可以跑在普通 ByteBuf 上 (数据不够时抛 {@link TruncatedFrameException})。
 */
public final class RespCodecUtil {

    // RESP 协议常量
    public static final byte PLUS_BYTE = '+';
    public static final byte MINUS_BYTE = '-';
    public static final byte COLON_BYTE = ':';
    public static final byte DOLLAR_BYTE = '$';
    public static final byte ASTERISK_BYTE = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    // 与 Redis 的 proto-max-bulk-len 默认值一致
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;

    private RespCodecUtil() {
    }

    // ------------------------------------------------------------------ decode

    /**
     * 读取恰好一个完整的 RESP 值。
     *
     * @param requestMode true 时只接受客户端请求合法的类型 ('*' 和 '$')，其它前缀视为协议错误
     * @throws CorruptedFrameException 格式错误
     * @throws TruncatedFrameException 普通 ByteBuf 中数据不足一个完整的值
     */
    public static RedisMessage decode(ByteBuf in, boolean requestMode) {
        requireReadable(in, 1);
        byte type = in.readByte();
        return switch (type) {
            case ASTERISK_BYTE -> decodeArray(in, requestMode);
            case DOLLAR_BYTE -> decodeBulkString(in);
            case PLUS_BYTE -> {
                if (requestMode) throw unknownType(type);
                yield new SimpleString(readLine(in));
            }
            case MINUS_BYTE -> {
                if (requestMode) throw unknownType(type);
                yield new ErrorMessage(readLine(in));
            }
            case COLON_BYTE -> {
                if (requestMode) throw unknownType(type);
                yield new RedisInteger(readLong(in));
            }
            default -> throw unknownType(type);
        };
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private static RedisArray decodeArray(ByteBuf in, boolean requestMode) {
        long count = readLong(in);
        if (count < 0 || count > MAX_ARRAY_LENGTH) {
            throw new CorruptedFrameException("Protocol error: invalid multibulk length " + count);
        }

        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < count; i++) {
            elements[i] = decode(in, requestMode);
        }
        return new RedisArray(elements);
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private static BulkString decodeBulkString(ByteBuf in) {
        long length = readLong(in);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new CorruptedFrameException("Protocol error: invalid bulk length " + length);
        }

        requireReadable(in, (int) length + 2);
        // 先探测最后一个字节：ReplayingDecoder 的 buffer 在数据未到齐时会在这里回滚，避免按客户端声明的长度提前分配内存
        in.getByte(in.readerIndex() + (int) length + 1);
        byte[] content = new byte[(int) length];
        in.readBytes(content);

        // 末尾的 CRLF 只按长度跳过，不逐字节校验
        in.skipBytes(2);
        return new BulkString(content);
    }

    // 读取一行 (不含 \r\n)
    private static String readLine(ByteBuf in) {
        // ReplayingDecoder 的 buffer 找不到 LF 时会直接触发回滚
        int lfOffset = in.bytesBefore(LF);
        if (lfOffset < 0) {
            throw new TruncatedFrameException("Unexpected end of stream inside a line");
        }
        if (lfOffset == 0 || in.getByte(in.readerIndex() + lfOffset - 1) != CR) {
            throw new CorruptedFrameException("Protocol error: expected CRLF line terminator");
        }

        byte[] line = new byte[lfOffset - 1];
        in.readBytes(line);
        in.skipBytes(2);
        return new String(line, StandardCharsets.UTF_8);
    }

    private static long readLong(ByteBuf in) {
        String line = readLine(in);
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new CorruptedFrameException("Protocol error: invalid integer '" + line + "'", e);
        }
    }

    private static void requireReadable(ByteBuf in, int bytes) {
        // ReplayingDecoder 的 buffer 在未结束时 readableBytes() 返回一个极大值，所以这里只对普通 buffer 生效
        if (in.readableBytes() < bytes) {
            throw new TruncatedFrameException("Unexpected end of stream: need " + bytes
                    + " bytes, " + in.readableBytes() + " available");
        }
    }

    private static CorruptedFrameException unknownType(byte type) {
        return new CorruptedFrameException("Protocol error: unknown type byte '" + (char) type + "'");
    }

    // ------------------------------------------------------------------ encode

    /**
     * 编码为字节数组，用于 AOF 追加和重写
     */
    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            write(msg, buf);
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    /**
     * 递归写入任意 RedisMessage，不会失败
     */
    public static void write(RedisMessage msg, ByteBuf out) {
        if (msg instanceof SimpleString s) {
            writeLine(out, PLUS_BYTE, singleLine(s.content()));
        } else if (msg instanceof ErrorMessage e) {
            writeLine(out, MINUS_BYTE, singleLine(e.content()));
        } else if (msg instanceof RedisInteger i) {
            writeLine(out, COLON_BYTE, ascii(i.value()));
        } else if (msg instanceof BulkString b) {
            if (b.content() == null) {
                writeLine(out, DOLLAR_BYTE, NULL_LENGTH);
            } else {
                writeLine(out, DOLLAR_BYTE, ascii(b.content().length));
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            writeLine(out, ASTERISK_BYTE, ascii(a.elements().length));
            for (RedisMessage element : a.elements()) {
                write(element, out);
            }
        }
    }

    private static void writeLine(ByteBuf out, byte type, byte[] payload) {
        out.writeByte(type);
        out.writeBytes(payload);
        out.writeBytes(CRLF);
    }

    // '+' 和 '-' 的内容不能跨行，CR/LF 替换为空格 (与 Redis 相同)
    private static byte[] singleLine(String content) {
        return content.replace('\r', ' ').replace('\n', ' ').getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] ascii(long value) {
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }
}
