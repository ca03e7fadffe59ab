package org.muma.mini.kv.store.impl;

import org.muma.mini.kv.common.SnapshotEntry;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.utils.KeyPatternUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存存储引擎
 * <p>
 * 每个 keyspace 一把读写锁。需要同时访问两个 keyspace 的操作 (DEL / KEYS / 快照)
 * 固定按 String -> Hash 的顺序加锁，避免死锁。
 */
public class MemoryStorageEngine implements StorageEngine {

    // 1. String keyspace
    private final Map<String, byte[]> strings = new HashMap<>();
    private final ReadWriteLock stringLock = new ReentrantReadWriteLock();

    // 2. Hash keyspace (空 hash 会被立即移除)
    private final Map<String, Map<String, byte[]>> hashes = new HashMap<>();
    private final ReadWriteLock hashLock = new ReentrantReadWriteLock();

    // --- String ---

    @Override
    public byte[] get(String key) {
        Lock lock = stringLock.readLock();
        lock.lock();
        try {
            return strings.get(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, byte[] value) {
        Lock lock = stringLock.writeLock();
        lock.lock();
        try {
            strings.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    // --- Hash ---

    @Override
    public byte[] hget(String key, String field) {
        Lock lock = hashLock.readLock();
        lock.lock();
        try {
            Map<String, byte[]> hash = hashes.get(key);
            return hash == null ? null : hash.get(field);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void hset(String key, String field, byte[] value) {
        Lock lock = hashLock.writeLock();
        lock.lock();
        try {
            // 第一次写 field 时才创建 hash
            hashes.computeIfAbsent(key, k -> new HashMap<>()).put(field, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int hdel(String key, Collection<String> fields) {
        Lock lock = hashLock.writeLock();
        lock.lock();
        try {
            Map<String, byte[]> hash = hashes.get(key);
            if (hash == null) return 0;

            int deleted = 0;
            for (String field : fields) {
                if (hash.remove(field) != null) {
                    deleted++;
                }
            }
            if (hash.isEmpty()) {
                hashes.remove(key);
            }
            return deleted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, byte[]> hgetAll(String key) {
        Lock lock = hashLock.readLock();
        lock.lock();
        try {
            Map<String, byte[]> hash = hashes.get(key);
            return hash == null || hash.isEmpty() ? null : new LinkedHashMap<>(hash);
        } finally {
            lock.unlock();
        }
    }

    // --- 跨 keyspace ---

    @Override
    public int delete(Collection<String> keys) {
        Lock first = stringLock.writeLock();
        Lock second = hashLock.writeLock();
        first.lock();
        second.lock();
        try {
            int deleted = 0;
            for (String key : keys) {
                boolean removedString = strings.remove(key) != null;
                boolean removedHash = hashes.remove(key) != null;
                if (removedString || removedHash) {
                    deleted++;
                }
            }
            return deleted;
        } finally {
            second.unlock();
            first.unlock();
        }
    }

    @Override
    public List<String> keys(String pattern) {
        Lock first = stringLock.readLock();
        Lock second = hashLock.readLock();
        first.lock();
        second.lock();
        try {
            List<String> result = new ArrayList<>();
            for (String key : strings.keySet()) {
                if (KeyPatternUtil.matches(pattern, key)) {
                    result.add(key);
                }
            }
            for (Map.Entry<String, Map<String, byte[]>> entry : hashes.entrySet()) {
                for (String field : entry.getValue().keySet()) {
                    String flat = entry.getKey() + ":" + field;
                    if (KeyPatternUtil.matches(pattern, flat)) {
                        result.add(flat);
                    }
                }
            }
            return result;
        } finally {
            second.unlock();
            first.unlock();
        }
    }

    @Override
    public List<SnapshotEntry> snapshot() {
        Lock first = stringLock.readLock();
        Lock second = hashLock.readLock();
        first.lock();
        second.lock();
        try {
            List<SnapshotEntry> entries = new ArrayList<>(strings.size() + hashes.size());
            for (Map.Entry<String, byte[]> entry : strings.entrySet()) {
                entries.add(SnapshotEntry.ofString(entry.getKey(), entry.getValue()));
            }
            for (Map.Entry<String, Map<String, byte[]>> entry : hashes.entrySet()) {
                // value 数组写入后不会再被修改，这里只拷贝外层 Map
                entries.add(SnapshotEntry.ofHash(entry.getKey(), new LinkedHashMap<>(entry.getValue())));
            }
            return entries;
        } finally {
            second.unlock();
            first.unlock();
        }
    }

    @Override
    public int size() {
        Lock first = stringLock.readLock();
        Lock second = hashLock.readLock();
        first.lock();
        second.lock();
        try {
            return strings.size() + hashes.size();
        } finally {
            second.unlock();
            first.unlock();
        }
    }
}
