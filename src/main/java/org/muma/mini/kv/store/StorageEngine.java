package org.muma.mini.kv.store;

import org.muma.mini.kv.common.SnapshotEntry;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 存储引擎
 * <p>
 * 两个互相独立的 keyspace：String (key -> value) 和 Hash (key -> field -> value)。
 * 同一个名字可以同时存在于两个 keyspace 中。所有访问都必须走这里的方法，
 * 锁由实现类持有，不对外暴露底层 Map。
 */
public interface StorageEngine {

    // --- String ---

    byte[] get(String key);

    void set(String key, byte[] value);

    // --- Hash ---

    byte[] hget(String key, String field);

    void hset(String key, String field, byte[] value);

    /**
     * @return 实际删除的 field 数量，hash 不存在时为 0
     */
    int hdel(String key, Collection<String> fields);

    /**
     * @return field -> value 的拷贝，hash 不存在 (或已空) 时返回 null
     */
    Map<String, byte[]> hgetAll(String key);

    // --- 跨 keyspace ---

    /**
     * 按名字同时在两个 keyspace 中删除
     *
     * @return 被删除的名字个数 (同一个名字在两个 keyspace 都存在时只计一次)
     */
    int delete(Collection<String> keys);

    /**
     * String key 原样返回，hash field 以 "hash:field" 形式返回。
     * pattern 为 "*" 匹配全部，否则按子串匹配。
     */
    List<String> keys(String pattern);

    /**
     * 两个 keyspace 的一致性快照 (AOF 重写用)
     */
    List<SnapshotEntry> snapshot();

    /**
     * String key 数 + Hash 数
     */
    int size();
}
