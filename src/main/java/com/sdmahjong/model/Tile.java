package com.sdmahjong.model;

import java.util.Objects;

/**
 * 麻将牌（不可变值对象，按花色+点数判等）
 * <p>
 * 索引映射：万 0-8，筒 9-17，条 18-26，风 27-30，箭 31-33。
 */
public final class Tile implements Comparable<Tile> {

    /** 含字牌时的牌种总数 */
    public static final int KIND_COUNT = 34;

    private static final String[] FENG_NAMES = {"", "东", "南", "西", "北"};
    private static final String[] JIAN_NAMES = {"", "中", "发", "白"};

    private final Suit suit;      // 花色
    private final int rank;       // 点数（1-9 或字牌编号）

    public Tile(Suit suit, int rank) {
        if (suit == null) {
            throw new InvalidTileException("花色不能为空");
        }
        if (rank < 1 || rank > suit.getMaxRank()) {
            throw new InvalidTileException("点数超出范围：" + suit + " " + rank);
        }
        this.suit = suit;
        this.rank = rank;
    }

    public static Tile of(Suit suit, int rank) {
        return new Tile(suit, rank);
    }

    /**
     * 从稠密索引创建牌
     */
    public static Tile fromIndex(int index) {
        if (index < 0 || index >= KIND_COUNT) {
            throw new InvalidTileException("牌索引越界：" + index);
        }
        if (index < 27) {
            return new Tile(Suit.values()[index / 9], index % 9 + 1);
        }
        if (index < 31) {
            return new Tile(Suit.FENG, index - 27 + 1);
        }
        return new Tile(Suit.JIAN, index - 31 + 1);
    }

    public Suit getSuit() {
        return suit;
    }

    public int getRank() {
        return rank;
    }

    /**
     * 转换为稠密索引 0-33
     */
    public int getIndex() {
        return suit.getIndexOffset() + rank - 1;
    }

    public boolean isNumeric() {
        return suit.isNumeric();
    }

    /**
     * 是否可做将（小胡必须 2、5、8 做将，仅限万筒条）
     */
    public boolean isEyeEligible() {
        return suit.isNumeric() && (rank == 2 || rank == 5 || rank == 8);
    }

    /**
     * 显示名称
     */
    public String getDisplayName() {
        switch (suit) {
            case FENG:
                return FENG_NAMES[rank];
            case JIAN:
                return JIAN_NAMES[rank];
            default:
                return rank + suit.getLabel();
        }
    }

    /**
     * 排序：先按花色，再按点数（与索引顺序一致）
     */
    @Override
    public int compareTo(Tile other) {
        return Integer.compare(getIndex(), other.getIndex());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tile)) {
            return false;
        }
        Tile other = (Tile) o;
        return suit == other.suit && rank == other.rank;
    }

    @Override
    public int hashCode() {
        return Objects.hash(suit, rank);
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
