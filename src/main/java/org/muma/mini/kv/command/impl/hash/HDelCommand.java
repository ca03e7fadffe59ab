package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

public class HDelCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // HDEL key field [field ...]
        List<String> fields = new ArrayList<>(args.size() - 2);
        for (int i = 2; i < args.size(); i++) {
            fields.add(stringArg(args, i));
        }
        return new RedisInteger(storage.hdel(stringArg(args, 1), fields));
    }

    @Override
    public int arity() {
        return -3;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
