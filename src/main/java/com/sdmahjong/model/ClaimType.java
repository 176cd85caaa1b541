package com.sdmahjong.model;

/**
 * 对别人出牌的响应类型，按优先级：胡 > 杠/碰 > 吃
 */
public enum ClaimType {
    WIN(3),      // 胡
    QUAD(2),     // 杠
    TRIPLET(2),  // 碰
    RUN(1);      // 吃

    private final int priority;

    ClaimType(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }
}
