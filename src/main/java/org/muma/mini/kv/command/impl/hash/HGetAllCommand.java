package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

import java.util.Map;

public class HGetAllCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        Map<String, byte[]> all = storage.hgetAll(stringArg(args, 1));
        if (all == null) {
            return BulkString.NULL;
        }

        // 只返回 value，不带 field 名 (与标准 Redis 的 [f1, v1, f2, v2] 不同)
        RedisMessage[] result = new RedisMessage[all.size()];
        int i = 0;
        for (byte[] value : all.values()) {
            result[i++] = new BulkString(value);
        }
        return new RedisArray(result);
    }

    @Override
    public int arity() {
        return 2;
    }
}
