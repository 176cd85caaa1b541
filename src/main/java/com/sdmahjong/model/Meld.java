package com.sdmahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 面子（碰、吃、杠出的牌组），一经创建不可修改
 */
public final class Meld {

    private final MeldType type;
    private final List<Tile> tiles;
    private final QuadKind quadKind;    // 仅杠有值
    private final int sourceSeat;       // 被吃/碰/杠的出牌玩家，自己形成的为 -1

    private Meld(MeldType type, List<Tile> tiles, QuadKind quadKind, int sourceSeat) {
        List<Tile> sorted = new ArrayList<>(tiles);
        Collections.sort(sorted);
        this.type = type;
        this.tiles = Collections.unmodifiableList(sorted);
        this.quadKind = quadKind;
        this.sourceSeat = sourceSeat;
    }

    public static Meld triplet(Tile tile, int sourceSeat) {
        return new Meld(MeldType.TRIPLET, Collections.nCopies(3, tile), null, sourceSeat);
    }

    public static Meld run(List<Tile> tiles, int sourceSeat) {
        if (tiles.size() != 3) {
            throw new IllegalArgumentException("顺子必须是 3 张：" + tiles);
        }
        return new Meld(MeldType.RUN, tiles, null, sourceSeat);
    }

    public static Meld quad(Tile tile, QuadKind kind, int sourceSeat) {
        return new Meld(MeldType.QUAD, Collections.nCopies(4, tile), kind, sourceSeat);
    }

    /**
     * 加杠：把已碰出的刻子升级为杠
     */
    public Meld upgrade() {
        if (type != MeldType.TRIPLET) {
            throw new IllegalStateException("只有刻子可以加杠：" + this);
        }
        return new Meld(MeldType.QUAD, Collections.nCopies(4, tiles.get(0)),
            QuadKind.EXPOSED_BY_UPGRADE, sourceSeat);
    }

    public MeldType getType() {
        return type;
    }

    public List<Tile> getTiles() {
        return tiles;
    }

    public QuadKind getQuadKind() {
        return quadKind;
    }

    public int getSourceSeat() {
        return sourceSeat;
    }

    public int size() {
        return tiles.size();
    }

    public boolean isQuad() {
        return type == MeldType.QUAD;
    }

    /**
     * 是否是某种牌的刻子（加杠判断用）
     */
    public boolean isTripletOf(Tile tile) {
        return type == MeldType.TRIPLET && tiles.get(0).equals(tile);
    }

    @Override
    public String toString() {
        return type + (quadKind != null ? "(" + quadKind + ")" : "") + tiles;
    }
}
