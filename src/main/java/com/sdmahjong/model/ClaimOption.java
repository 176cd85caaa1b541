package com.sdmahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一个合法的操作选项：吃碰杠胡，或自己回合内的暗杠/明杠/加杠
 */
public final class ClaimOption {

    private final int seat;             // 操作玩家
    private final ClaimType type;
    private final Tile tile;            // 被吃碰杠胡的牌，自己杠时为杠的牌
    private final int sourceSeat;       // 出牌玩家，自己杠为 -1
    private final List<Tile> runTiles;  // 吃牌组合（含被吃的牌），其他类型为空
    private final QuadKind quadKind;    // 杠的来源，其他类型为 null

    private ClaimOption(int seat, ClaimType type, Tile tile, int sourceSeat,
                        List<Tile> runTiles, QuadKind quadKind) {
        this.seat = seat;
        this.type = type;
        this.tile = tile;
        this.sourceSeat = sourceSeat;
        this.runTiles = Collections.unmodifiableList(new ArrayList<>(runTiles));
        this.quadKind = quadKind;
    }

    public static ClaimOption win(int seat, Tile tile, int sourceSeat) {
        return new ClaimOption(seat, ClaimType.WIN, tile, sourceSeat, Collections.emptyList(), null);
    }

    public static ClaimOption triplet(int seat, Tile tile, int sourceSeat) {
        return new ClaimOption(seat, ClaimType.TRIPLET, tile, sourceSeat, Collections.emptyList(), null);
    }

    public static ClaimOption run(int seat, Tile tile, int sourceSeat, List<Tile> runTiles) {
        return new ClaimOption(seat, ClaimType.RUN, tile, sourceSeat, runTiles, null);
    }

    public static ClaimOption quad(int seat, Tile tile, int sourceSeat, QuadKind kind) {
        return new ClaimOption(seat, ClaimType.QUAD, tile, sourceSeat, Collections.emptyList(), kind);
    }

    public int getSeat() {
        return seat;
    }

    public ClaimType getType() {
        return type;
    }

    public Tile getTile() {
        return tile;
    }

    public int getSourceSeat() {
        return sourceSeat;
    }

    public List<Tile> getRunTiles() {
        return runTiles;
    }

    public QuadKind getQuadKind() {
        return quadKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClaimOption)) {
            return false;
        }
        ClaimOption other = (ClaimOption) o;
        return seat == other.seat
            && sourceSeat == other.sourceSeat
            && type == other.type
            && Objects.equals(tile, other.tile)
            && runTiles.equals(other.runTiles)
            && quadKind == other.quadKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(seat, type, tile, sourceSeat, runTiles, quadKind);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("座位").append(seat).append(' ').append(type).append(' ').append(tile);
        if (!runTiles.isEmpty()) {
            sb.append(' ').append(runTiles);
        }
        if (quadKind != null) {
            sb.append(' ').append(quadKind);
        }
        return sb.toString();
    }
}
