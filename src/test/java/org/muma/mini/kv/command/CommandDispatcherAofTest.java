package org.muma.mini.kv.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.muma.mini.kv.aof.AofManager;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 只有写命令才会经过 AofManager
 */
@ExtendWith(MockitoExtension.class)
class CommandDispatcherAofTest {

    @Mock
    private AofManager aofManager;

    private StorageEngine storage;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        dispatcher = new CommandDispatcher(storage, aofManager);
    }

    @SuppressWarnings("unchecked")
    private void passThrough() {
        when(aofManager.execute(any(), any())).thenAnswer(inv -> ((Supplier<RedisMessage>) inv.getArgument(1)).get());
    }

    @Test
    void testWriteCommandsGoThroughAof() {
        passThrough();

        assertEquals(SimpleString.OK, dispatcher.dispatch(RedisArray.of("SET", "k", "v")));
        dispatcher.dispatch(RedisArray.of("HSET", "h", "f", "v"));
        dispatcher.dispatch(RedisArray.of("HDEL", "h", "f"));
        dispatcher.dispatch(RedisArray.of("DEL", "k"));

        verify(aofManager).execute(eq(RedisArray.of("SET", "k", "v")), any());
        verify(aofManager).execute(eq(RedisArray.of("HSET", "h", "f", "v")), any());
        verify(aofManager).execute(eq(RedisArray.of("HDEL", "h", "f")), any());
        verify(aofManager).execute(eq(RedisArray.of("DEL", "k")), any());
        assertEquals(0, storage.size());
    }

    @Test
    void testReadCommandsSkipAof() {
        dispatcher.dispatch(RedisArray.of("GET", "k"));
        dispatcher.dispatch(RedisArray.of("HGET", "h", "f"));
        dispatcher.dispatch(RedisArray.of("HGETALL", "h"));
        dispatcher.dispatch(RedisArray.of("KEYS", "*"));
        dispatcher.dispatch(RedisArray.of("PING"));
        dispatcher.dispatch(RedisArray.of("UNKNOWN"));

        verifyNoInteractions(aofManager);
    }

    @Test
    void testRejectedWriteIsNotLogged() {
        dispatcher.dispatch(RedisArray.of("SET", "k"));
        verifyNoInteractions(aofManager);
    }

    @Test
    void testReplayDoesNotPropagate() {
        dispatcher.replay(RedisArray.of("SET", "k", "v"));

        verifyNoInteractions(aofManager);
        assertNotNull(storage.get("k"));
    }
}
