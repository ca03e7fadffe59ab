package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

import java.util.List;

public class KeysCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // KEYS pattern ("*" 或子串)
        List<String> keys = storage.keys(stringArg(args, 1));

        RedisMessage[] result = new RedisMessage[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            result[i] = new BulkString(keys.get(i));
        }
        return new RedisArray(result);
    }

    @Override
    public int arity() {
        return 2;
    }
}
