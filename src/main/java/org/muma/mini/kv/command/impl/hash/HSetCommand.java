package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

public class HSetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // HSET key field value (每次只写一个 field)
        storage.hset(stringArg(args, 1), stringArg(args, 2), bytesArg(args, 3));
        return SimpleString.OK;
    }

    @Override
    public int arity() {
        return 4;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
