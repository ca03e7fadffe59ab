package org.muma.mini.kv.aof;

/**
 * AOF 生命周期
 * <pre>
 * LOADING -> ACTIVE <-> REWRITING
 *               \-> CLOSED
 * </pre>
 */
public enum AofState {
    // 正在重放，尚未对外服务
    LOADING,
    // 正常追加，后台定时刷盘
    ACTIVE,
    // 重写中，追加被 AOF 锁挡住
    REWRITING,
    CLOSED
}
