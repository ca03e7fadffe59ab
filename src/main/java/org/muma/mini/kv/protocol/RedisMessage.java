package org.muma.mini.kv.protocol;

// 密封接口，限制实现类 (RESP2 的五种基本类型)
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {
}
