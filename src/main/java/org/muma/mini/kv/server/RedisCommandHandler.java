package org.muma.mini.kv.server;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.handler.codec.DecoderException;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 连接级别的命令处理器
 * <p>
 * 无状态，所有连接共享一个实例。同一个 Channel 的消息总在同一个 executor 上按顺序处理，
 * 所以每个连接的响应顺序与请求顺序一致。
 */
@ChannelHandler.Sharable
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private final CommandDispatcher dispatcher;
    // 记录所有活跃连接，关闭时统一断开
    private final ChannelGroup clients;

    public RedisCommandHandler(CommandDispatcher dispatcher, ChannelGroup clients) {
        this.dispatcher = dispatcher;
        this.clients = clients;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        clients.add(ctx.channel());
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), clients.size());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), clients.size());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (msg instanceof RedisArray array) {
            handleCommand(ctx, array);
        } else {
            log.warn("Received non-array message: {}", msg);
            ctx.writeAndFlush(new ErrorMessage("ERR Protocol error: expected array"));
        }
    }

    private void handleCommand(ChannelHandlerContext ctx, RedisArray array) {
        // 空数组 (*0) 直接忽略，与 Redis 行为一致
        if (array.size() == 0) return;

        if (log.isDebugEnabled()) {
            String argsLog = Arrays.stream(array.elements()).map(this::convertToString).collect(Collectors.joining(" "));
            log.debug("Execute Command from {}: {}", ctx.channel().remoteAddress(), argsLog);
        }

        ctx.writeAndFlush(dispatcher.dispatch(array));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // 协议错误：只关闭当前连接
            log.warn("Protocol error from {}, closing connection: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Unexpected error on connection {}, closing", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    private String convertToString(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        return String.valueOf(msg);
    }
}
