package org.muma.mini.kv.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyPatternUtilTest {

    @Test
    void testStarMatchesEverything() {
        assertTrue(KeyPatternUtil.matches("*", "anything"));
        assertTrue(KeyPatternUtil.matches("*", ""));
    }

    @Test
    void testOtherPatternsAreSubstrings() {
        assertTrue(KeyPatternUtil.matches("user", "user_1"));
        assertTrue(KeyPatternUtil.matches("er_", "user_1"));
        assertFalse(KeyPatternUtil.matches("order", "user_1"));
        // 不支持 glob，* 在中间时按字面量处理
        assertFalse(KeyPatternUtil.matches("u*1", "user_1"));
        assertTrue(KeyPatternUtil.matches("u*1", "key_u*1"));
    }
}
