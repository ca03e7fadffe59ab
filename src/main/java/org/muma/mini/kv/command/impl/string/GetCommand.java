package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        byte[] value = storage.get(stringArg(args, 1));
        return value == null ? BulkString.NULL : new BulkString(value);
    }

    @Override
    public int arity() {
        return 2;
    }
}
