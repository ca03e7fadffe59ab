package org.muma.mini.kv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.muma.mini.kv.aof.AofManager;
import org.muma.mini.kv.aof.AofState;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.server.RedisCommandHandler;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;
import org.muma.mini.kv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final MiniKvConfig config;
    private final StorageEngine storage;
    private final AofManager aofManager;
    private final CommandDispatcher dispatcher;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final ChannelGroup clients = new DefaultChannelGroup("mini-kv-clients", GlobalEventExecutor.INSTANCE);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    // 命令在独立线程组中执行，等锁时不会卡住 IO 线程
    private EventExecutorGroup commandGroup;
    private Channel serverChannel;

    public MiniKvServer(MiniKvConfig config) {
        this.config = config;
        this.storage = new MemoryStorageEngine();
        this.aofManager = config.isAppendOnly() ? new AofManager(config, storage) : null;
        this.dispatcher = new CommandDispatcher(storage, aofManager);
    }

    /**
     * 恢复数据并开始监听。AOF 加载或启动时的重写失败会直接抛出，进程不应继续启动。
     */
    public void start() throws IOException, InterruptedException {
        // 1. AOF 恢复数据 (Replay)，必须在 Netty 启动前完成
        if (aofManager != null) {
            aofManager.open();
            long replayed = aofManager.replay(dispatcher::replay);
            log.info("Replayed {} commands from AOF, {} keys in memory", replayed, storage.size());

            // 2. 启动时先压缩一次，之后的追加都基于最小化的文件
            aofManager.rewrite();
            aofManager.start();
        } else {
            log.warn("AOF disabled, data will not survive a restart");
        }

        // 3. 启动 Netty
        bossGroup = new NioEventLoopGroup(1, ThreadUtils.namedThreadFactory("kv-boss"));
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads(), ThreadUtils.namedThreadFactory("kv-io"));
        int commandThreads = config.getCommandThreads() > 0
                ? config.getCommandThreads()
                : Runtime.getRuntime().availableProcessors();
        commandGroup = new DefaultEventExecutorGroup(commandThreads, ThreadUtils.namedThreadFactory("kv-cmd"));

        RedisCommandHandler commandHandler = new RedisCommandHandler(dispatcher, clients);

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                .handler(new LoggingHandler(LogLevel.DEBUG))
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(commandGroup, commandHandler);
                    }
                });

        log.info("Starting Mini-KV server on port {}", config.getPort());
        serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        log.info("Mini-KV started successfully.");
    }

    /**
     * 实际绑定的端口 (配置为 0 时由系统分配)
     */
    public int getBoundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    /**
     * 优雅关闭：停止接收连接 -> 断开并排空现有连接 -> 最后一次重写 -> 关闭 AOF
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) return;
        log.info("Shutting down Mini-KV...");

        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        clients.close().awaitUninterruptibly();

        if (bossGroup != null) bossGroup.shutdownGracefully().syncUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully().syncUninterruptibly();
        if (commandGroup != null) {
            commandGroup.shutdownGracefully(0, 15, TimeUnit.SECONDS).syncUninterruptibly();
        }

        if (aofManager != null) {
            try {
                // 启动失败 (还没进入 ACTIVE) 时不能用不完整的内存覆盖 AOF
                if (aofManager.getState() == AofState.ACTIVE) {
                    aofManager.rewrite();
                }
            } catch (IOException | IllegalStateException e) {
                log.error("Final AOF rewrite failed, keeping the current file", e);
            }
            aofManager.shutdown();
        }
        log.info("Mini-KV stopped.");
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public StorageEngine getStorage() {
        return storage;
    }

    public static void main(String[] args) {
        // 1. 初始化配置并解析参数
        MiniKvConfig config = MiniKvConfig.getInstance();
        config.load(args, System.getenv());

        MiniKvServer server = new MiniKvServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "kv-shutdown"));

        try {
            server.start();
            server.awaitTermination();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            server.shutdown();
            System.exit(1);
        }
    }
}
