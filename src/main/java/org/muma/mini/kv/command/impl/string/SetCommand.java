package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // SET key value (不支持 NX/XX/EX/PX)
        storage.set(stringArg(args, 1), bytesArg(args, 2));
        return SimpleString.OK;
    }

    @Override
    public int arity() {
        return 3;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
