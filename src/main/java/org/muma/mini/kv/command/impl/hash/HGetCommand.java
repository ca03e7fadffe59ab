package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

public class HGetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        byte[] value = storage.hget(stringArg(args, 1), stringArg(args, 2));
        return value == null ? BulkString.NULL : new BulkString(value);
    }

    @Override
    public int arity() {
        return 3;
    }
}
