package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.muma.mini.kv.utils.RespCodecUtil;

public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        RespCodecUtil.write(msg, out);
    }
}
