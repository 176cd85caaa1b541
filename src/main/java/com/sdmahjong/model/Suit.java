package com.sdmahjong.model;

/**
 * 麻将牌花色
 */
public enum Suit {
    WAN(0, 9, "万"),     // 万（1-9）
    TONG(9, 9, "筒"),    // 筒（1-9）
    TIAO(18, 9, "条"),   // 条（1-9）
    FENG(27, 4, "风"),   // 风牌（东南西北：1-4）
    JIAN(31, 3, "箭");   // 箭牌（中发白：1=中，2=发，3=白）

    private final int indexOffset;
    private final int maxRank;
    private final String label;

    Suit(int indexOffset, int maxRank, String label) {
        this.indexOffset = indexOffset;
        this.maxRank = maxRank;
        this.label = label;
    }

    public int getIndexOffset() {
        return indexOffset;
    }

    public int getMaxRank() {
        return maxRank;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 是否为数牌（万/筒/条），只有数牌可以组成顺子
     */
    public boolean isNumeric() {
        return this == WAN || this == TONG || this == TIAO;
    }
}
