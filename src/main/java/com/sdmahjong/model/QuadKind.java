package com.sdmahjong.model;

/**
 * 杠的来源
 */
public enum QuadKind {
    CONCEALED,            // 暗杠：手中 4 张
    EXPOSED_BY_DRAW,      // 明杠：手中 3 张，自摸到第 4 张
    EXPOSED_BY_UPGRADE,   // 加杠：已碰出的刻子 + 第 4 张
    EXPOSED_BY_CLAIM;     // 直杠：手中 3 张，杠别人打出的牌

    /**
     * 是否在自己回合内声明（不依赖别人的弃牌）
     */
    public boolean isSelfDeclared() {
        return this != EXPOSED_BY_CLAIM;
    }
}
