package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

public interface RedisCommand {

    // 执行命令，传入存储引擎和完整参数 (elements[0] 是命令名)
    // 调用前 CommandDispatcher 已经校验过 arity 和参数类型
    RedisMessage execute(StorageEngine storage, RedisArray args);

    /**
     * 参数个数约定 (包含命令名本身，与 Redis COMMAND INFO 一致)
     * 正数: 必须恰好等于; 负数: 至少为其绝对值
     */
    int arity();

    // 默认不是写命令，所有 SET/HSET 等需要覆盖返回 true
    // 写命令执行成功后会被追加到 AOF
    default boolean isWrite() {
        return false;
    }

    default boolean acceptsArgCount(int count) {
        int arity = arity();
        return arity >= 0 ? count == arity : count >= -arity;
    }

    /**
     * 辅助工具：快速构建参数错误
     */
    static ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    default String stringArg(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).asString();
    }

    default byte[] bytesArg(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).content();
    }
}
