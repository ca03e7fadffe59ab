package org.muma.mini.kv.common;

import java.util.Map;

/**
 * 存储快照中的一条记录 (AOF 重写用)
 * STRING 类型只有 value，HASH 类型只有 fields。
 */
public record SnapshotEntry(String key, RedisDataType type, byte[] value, Map<String, byte[]> fields) {

    public static SnapshotEntry ofString(String key, byte[] value) {
        return new SnapshotEntry(key, RedisDataType.STRING, value, null);
    }

    public static SnapshotEntry ofHash(String key, Map<String, byte[]> fields) {
        return new SnapshotEntry(key, RedisDataType.HASH, null, fields);
    }
}
