package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

public class DelCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // 格式: DEL key [key ...]，String 和 Hash 两个 keyspace 都会按名字删除
        List<String> keys = new ArrayList<>(args.size() - 1);
        for (int i = 1; i < args.size(); i++) {
            keys.add(stringArg(args, i));
        }
        return new RedisInteger(storage.delete(keys));
    }

    @Override
    public int arity() {
        return -2;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
