package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    void testHalfPacketWaitsForMoreBytes() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        // 一条命令被拆成三段到达
        assertFalse(channel.writeInbound(buf("*3\r\n$3\r\nSE")));
        assertFalse(channel.writeInbound(buf("T\r\n$1\r\nk\r\n$5\r\nva")));
        assertTrue(channel.writeInbound(buf("lue\r\n")));

        RedisMessage msg = channel.readInbound();
        assertEquals(RedisArray.of("SET", "k", "value"), msg);
        assertNull(channel.readInbound());
        assertFalse(channel.finish());
    }

    @Test
    void testPipelinedCommands() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        channel.writeInbound(buf("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\na\r\n"));

        assertEquals(RedisArray.of("PING"), channel.readInbound());
        assertEquals(RedisArray.of("GET", "a"), channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    void testLargeBulkHeaderWithoutBodyWaits() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        // 声明 512MB 的 bulk，但正文迟迟不到：不能按声明的长度提前分配
        assertFalse(channel.writeInbound(buf("*1\r\n$536870912\r\n")));
        for (int i = 0; i < 16; i++) {
            assertFalse(channel.writeInbound(buf("12345678")));
        }

        assertNull(channel.readInbound());
        assertTrue(channel.isOpen());
    }

    @Test
    void testUnsupportedTypeIsDecodeFailure() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertThrows(CorruptedFrameException.class, () -> channel.writeInbound(buf("+PING\r\n")));
    }

    @Test
    void testEncoderWritesWireForm() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());

        assertTrue(channel.writeOutbound(new RedisArray(new RedisMessage[]{
                new RedisInteger(2), BulkString.NULL
        })));

        ByteBuf out = channel.readOutbound();
        try {
            assertEquals("*2\r\n:2\r\n$-1\r\n", out.toString(StandardCharsets.UTF_8));
        } finally {
            out.release();
        }
    }
}
