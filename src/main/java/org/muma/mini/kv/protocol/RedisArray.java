package org.muma.mini.kv.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

// 5. 数组 (*)
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public RedisArray {
        Objects.requireNonNull(elements, "elements");
    }

    public RedisArray(List<? extends RedisMessage> elements) {
        this(elements.toArray(new RedisMessage[0]));
    }

    /**
     * 用字符串快速构建命令: of("SET", "k", "v")
     */
    public static RedisArray of(String... parts) {
        RedisMessage[] msgs = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            msgs[i] = new BulkString(parts[i]);
        }
        return new RedisArray(msgs);
    }

    public int size() {
        return elements.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisArray other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return "RedisArray" + Arrays.toString(elements);
    }
}
