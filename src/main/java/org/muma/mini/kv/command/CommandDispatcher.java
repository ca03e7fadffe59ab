package org.muma.mini.kv.command;

import org.muma.mini.kv.aof.AofManager;
import org.muma.mini.kv.command.impl.hash.HDelCommand;
import org.muma.mini.kv.command.impl.hash.HGetAllCommand;
import org.muma.mini.kv.command.impl.hash.HGetCommand;
import org.muma.mini.kv.command.impl.hash.HSetCommand;
import org.muma.mini.kv.command.impl.key.DelCommand;
import org.muma.mini.kv.command.impl.key.KeysCommand;
import org.muma.mini.kv.command.impl.server.PingCommand;
import org.muma.mini.kv.command.impl.string.GetCommand;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令注册表与分发
 * <p>
 * 注册表在构造时一次性建好，之后只读，多个连接线程可以并发 dispatch。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;
    // 为 null 表示未开启 AOF
    private final AofManager aofManager;

    public CommandDispatcher(StorageEngine storage, AofManager aofManager) {
        this.storage = storage;
        this.aofManager = aofManager;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerGenericCommands();
        registerStringCommands();
        registerHashCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerGenericCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("DEL", new DelCommand());
        commandMap.put("KEYS", new KeysCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerHashCommands() {
        commandMap.put("HSET", new HSetCommand());
        commandMap.put("HGET", new HGetCommand());
        commandMap.put("HDEL", new HDelCommand());
        commandMap.put("HGETALL", new HGetAllCommand());
    }

    public RedisCommand lookup(String commandName) {
        return commandMap.get(commandName.toUpperCase(Locale.ROOT));
    }

    public Map<String, RedisCommand> getCommands() {
        return Collections.unmodifiableMap(commandMap);
    }

    /**
     * 客户端请求的分发逻辑，写命令成功后追加到 AOF
     */
    public RedisMessage dispatch(RedisArray args) {
        return dispatch(args, true);
    }

    /**
     * AOF 重放：与正常请求走同一套逻辑，但不会再次写入 AOF
     */
    public RedisMessage replay(RedisArray args) {
        RedisMessage result = dispatch(args, false);
        if (result instanceof ErrorMessage error) {
            log.warn("Replayed command returned an error: {} -> {}", args, error.content());
        }
        return result;
    }

    private RedisMessage dispatch(RedisArray args, boolean propagate) {
        RedisMessage[] elements = args.elements();
        if (elements.length == 0) {
            return new ErrorMessage("ERR Protocol error: empty command");
        }
        for (RedisMessage element : elements) {
            if (!(element instanceof BulkString bulk) || bulk.isNull()) {
                return new ErrorMessage("ERR Protocol error: expected bulk string arguments");
            }
        }

        // 1. 查找命令
        String commandName = ((BulkString) elements[0]).asString();
        RedisCommand command = lookup(commandName);

        if (command == null) {
            // 未知命令回复空的简单字符串，而不是错误
            log.warn("Command not found: {}", commandName);
            return SimpleString.EMPTY;
        }

        // 2. 参数个数校验
        if (!command.acceptsArgCount(elements.length)) {
            return RedisCommand.errorArgs(commandName.toLowerCase(Locale.ROOT));
        }

        // 3. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response;
            if (propagate && command.isWrite() && aofManager != null) {
                response = aofManager.execute(args, () -> command.execute(storage, args));
            } else {
                response = command.execute(storage, args);
            }

            // 记录慢日志 (比如超过 10ms)
            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > 10) {
                log.warn("Slow command detected: {} cost {}ms", commandName, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", commandName, duration);
            }

            return response;

        } catch (RuntimeException e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", commandName, e);
            return new ErrorMessage("ERR internal server error");
        }
    }
}
