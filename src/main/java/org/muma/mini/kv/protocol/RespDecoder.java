package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;
import org.muma.mini.kv.utils.RespCodecUtil;

import java.util.List;

/**
 * RESP 协议解码器 (客户端请求)
 * 状态机逻辑由 ReplayingDecoder 自动处理：数据不够时回滚 readerIndex，等下一批字节再重试。
 * <p>
 * 只接受 '*' 和 '$' 前缀，其它类型字节抛 CorruptedFrameException，由 handler 关闭连接。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        out.add(RespCodecUtil.decode(in, true));
    }
}
