package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

public class PingCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // PING [message]，多余参数忽略
        if (args.size() == 1) {
            return SimpleString.PONG;
        }
        return new SimpleString(stringArg(args, 1));
    }

    @Override
    public int arity() {
        return -1;
    }
}
