package org.muma.mini.kv.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.CorruptedFrameException;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.protocol.TruncatedFrameException;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespCodecUtilTest {

    private static String encode(RedisMessage msg) {
        return new String(RespCodecUtil.encode(msg), StandardCharsets.UTF_8);
    }

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    // --- 编码 ---

    @Test
    void testEncodeWireForms() {
        assertEquals("+OK\r\n", encode(SimpleString.OK));
        assertEquals("-ERR boom\r\n", encode(new ErrorMessage("ERR boom")));
        assertEquals(":42\r\n", encode(new RedisInteger(42)));
        assertEquals(":-7\r\n", encode(new RedisInteger(-7)));
        assertEquals("$5\r\nhello\r\n", encode(new BulkString("hello")));
        assertEquals("$0\r\n\r\n", encode(new BulkString("")));
        assertEquals("$-1\r\n", encode(BulkString.NULL));
        assertEquals("*0\r\n", encode(new RedisArray(new RedisMessage[0])));
        assertEquals("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n", encode(RedisArray.of("SET", "k", "v")));
    }

    @Test
    void testBulkLengthIsByteLength() {
        // "你好" 在 UTF-8 下是 6 个字节
        assertEquals("$6\r\n你好\r\n", encode(new BulkString("你好")));
    }

    @Test
    void testSingleLineRepliesCannotInjectFrames() {
        assertEquals("+a  :42\r\n", encode(new SimpleString("a\r\n:42")));
        assertEquals("-ERR x y\r\n", encode(new ErrorMessage("ERR x\ny")));

        // 编码后仍然是恰好一个值
        ByteBuf in = Unpooled.wrappedBuffer(RespCodecUtil.encode(new SimpleString("a\r\n:42")));
        assertEquals(new SimpleString("a  :42"), RespCodecUtil.decode(in, false));
        assertFalse(in.isReadable());
    }

    // --- 解码 ---

    @Test
    void testDecodeRequestArray() {
        ByteBuf in = buf("*2\r\n$3\r\nGET\r\n$3\r\nkey\r\n");
        RedisMessage msg = RespCodecUtil.decode(in, true);

        assertEquals(RedisArray.of("GET", "key"), msg);
        assertFalse(in.isReadable());
    }

    @Test
    void testBulkStringMayContainCrlf() {
        ByteBuf in = buf("$4\r\na\r\nb\r\n");
        BulkString bulk = (BulkString) RespCodecUtil.decode(in, true);
        assertEquals("a\r\nb", bulk.asString());
    }

    @Test
    void testTrailingBytesOfBulkAreNotValidated() {
        // 末尾两个字节只按长度跳过
        ByteBuf in = buf("$2\r\nokXX*0\r\n");
        assertEquals(new BulkString("ok"), RespCodecUtil.decode(in, true));
        assertEquals(new RedisArray(new RedisMessage[0]), RespCodecUtil.decode(in, true));
    }

    @Test
    void testNullBulkAndNestedArray() {
        ByteBuf in = buf("*2\r\n$-1\r\n*1\r\n$1\r\nx\r\n");
        RedisArray outer = (RedisArray) RespCodecUtil.decode(in, true);

        assertEquals(BulkString.NULL, outer.elements()[0]);
        assertTrue(((BulkString) outer.elements()[0]).isNull());
        assertEquals(RedisArray.of("x"), outer.elements()[1]);
    }

    @Test
    void testGeneralModeDecodesAllKinds() {
        ByteBuf in = buf("+PONG\r\n-ERR x\r\n:-12\r\n*2\r\n:1\r\n+a\r\n");

        assertEquals(SimpleString.PONG, RespCodecUtil.decode(in, false));
        assertEquals(new ErrorMessage("ERR x"), RespCodecUtil.decode(in, false));
        assertEquals(new RedisInteger(-12), RespCodecUtil.decode(in, false));
        assertEquals(new RedisArray(new RedisMessage[]{new RedisInteger(1), new SimpleString("a")}),
                RespCodecUtil.decode(in, false));
    }

    @Test
    void testRoundTrip() {
        RedisMessage complex = new RedisArray(new RedisMessage[]{
                new SimpleString("status"),
                new ErrorMessage("ERR nope"),
                new RedisInteger(Long.MIN_VALUE),
                new BulkString(new byte[]{0, 13, 10, (byte) 0xff}),
                BulkString.NULL,
                new RedisArray(new RedisMessage[0]),
                RedisArray.of("HSET", "h", "f", "v")
        });

        ByteBuf in = Unpooled.wrappedBuffer(RespCodecUtil.encode(complex));
        assertEquals(complex, RespCodecUtil.decode(in, false));
        assertFalse(in.isReadable());
    }

    // --- 错误 ---

    @Test
    void testRequestModeRejectsOtherTypes() {
        assertThrows(CorruptedFrameException.class, () -> RespCodecUtil.decode(buf("+PING\r\n"), true));
        assertThrows(CorruptedFrameException.class, () -> RespCodecUtil.decode(buf(":1\r\n"), true));
        // 嵌套在数组里也不行
        assertThrows(CorruptedFrameException.class, () -> RespCodecUtil.decode(buf("*1\r\n-ERR\r\n"), true));
    }

    @Test
    void testUnknownTypeByte() {
        CorruptedFrameException e = assertThrows(CorruptedFrameException.class,
                () -> RespCodecUtil.decode(buf("?what\r\n"), false));
        assertTrue(e.getMessage().contains("unknown type"));
    }

    @Test
    void testInvalidLengths() {
        assertThrows(CorruptedFrameException.class, () -> RespCodecUtil.decode(buf("$abc\r\n"), true));
        assertThrows(CorruptedFrameException.class, () -> RespCodecUtil.decode(buf("*-1\r\n"), true));
        assertThrows(CorruptedFrameException.class, () -> RespCodecUtil.decode(buf("$-5\r\n"), true));
        // 缺少 \r
        assertThrows(CorruptedFrameException.class, () -> RespCodecUtil.decode(buf("*1\n$1\r\na\r\n"), true));
    }

    @Test
    void testTruncatedFrames() {
        assertThrows(TruncatedFrameException.class, () -> RespCodecUtil.decode(buf("*2\r\n$3\r\nGET\r\n"), true));
        assertThrows(TruncatedFrameException.class, () -> RespCodecUtil.decode(buf("$10\r\nabc"), true));
        assertThrows(TruncatedFrameException.class, () -> RespCodecUtil.decode(buf("*3"), true));
    }
}
