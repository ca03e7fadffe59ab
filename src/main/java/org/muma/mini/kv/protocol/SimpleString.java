package org.muma.mini.kv.protocol;

// 1. 简单字符串 (+)
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString PONG = new SimpleString("PONG");

    // 未知命令的回复 (空字符串，而不是错误)
    public static final SimpleString EMPTY = new SimpleString("");
}
