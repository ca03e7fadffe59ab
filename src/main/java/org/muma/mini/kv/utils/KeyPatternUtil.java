package org.muma.mini.kv.utils;

/**
 * KEYS 的匹配规则
 * <p>
 * 不是 glob：只有单独的 "*" 表示全部匹配，其它 pattern 都按子串包含来匹配。
 */
public final class KeyPatternUtil {

    public static final String MATCH_ALL = "*";

    private KeyPatternUtil() {
    }

    public static boolean matches(String pattern, String key) {
        if (MATCH_ALL.equals(pattern)) return true;
        return key.contains(pattern);
    }
}
