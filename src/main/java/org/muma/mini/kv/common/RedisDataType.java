package org.muma.mini.kv.common;

/**
 * 支持的数据类型，每种类型对应一个独立的 keyspace
 */
public enum RedisDataType {
    STRING,
    HASH
}
