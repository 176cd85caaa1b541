package com.sdmahjong.engine;

import com.sdmahjong.model.IllegalHandSizeException;
import com.sdmahjong.model.Meld;
import com.sdmahjong.model.Tile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 座位（0-3），持有本局手牌、面子和个人弃牌记录。
 * 对外只读，修改只能经由 {@link GameEngine} 的状态转移
 */
public class PlayerSeat {

    private static final int MAX_COPIES = 4;

    private final int seat;                     // 位置（0-3），0 为庄家
    private final List<Tile> handTiles;         // 暗牌（含财神）
    private final List<Meld> melds;             // 吃、碰、杠出的牌
    private final List<Tile> discards;          // 个人出牌记录（被吃碰杠的牌也保留）

    PlayerSeat(int seat) {
        this.seat = seat;
        this.handTiles = new ArrayList<>();
        this.melds = new ArrayList<>();
        this.discards = new ArrayList<>();
    }

    public int getSeat() {
        return seat;
    }

    public boolean isDealer() {
        return seat == 0;
    }

    public List<Tile> getHandTiles() {
        return Collections.unmodifiableList(handTiles);
    }

    public List<Meld> getMelds() {
        return Collections.unmodifiableList(melds);
    }

    public List<Tile> getDiscards() {
        return Collections.unmodifiableList(discards);
    }

    public int getHandSize() {
        return handTiles.size();
    }

    /**
     * 添加手牌，同种牌不能超过 4 张
     */
    void addTile(Tile tile) {
        if (countOf(tile) >= MAX_COPIES) {
            throw new IllegalHandSizeException("座位 " + seat + " 手中已有 4 张 " + tile);
        }
        handTiles.add(tile);
    }

    /**
     * 移除一张手牌
     */
    boolean removeTile(Tile tile) {
        return handTiles.remove(tile);
    }

    void removeTiles(Tile tile, int count) {
        for (int i = 0; i < count; i++) {
            if (!handTiles.remove(tile)) {
                throw new IllegalStateException("座位 " + seat + " 手中没有足够的 " + tile);
            }
        }
    }

    public int countOf(Tile tile) {
        int count = 0;
        for (Tile t : handTiles) {
            if (t.equals(tile)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 手中的财神张数
     */
    public int wildcardCount(Tile wildcardTile) {
        return wildcardTile == null ? 0 : countOf(wildcardTile);
    }

    /**
     * 去掉财神后的自然牌
     */
    public List<Tile> naturalTiles(Tile wildcardTile) {
        List<Tile> natural = new ArrayList<>(handTiles.size());
        for (Tile t : handTiles) {
            if (!t.equals(wildcardTile)) {
                natural.add(t);
            }
        }
        return natural;
    }

    void addMeld(Meld meld) {
        melds.add(meld);
    }

    void replaceMeld(int index, Meld meld) {
        melds.set(index, meld);
    }

    public int quadCount() {
        int count = 0;
        for (Meld meld : melds) {
            if (meld.isQuad()) {
                count++;
            }
        }
        return count;
    }

    public int meldTileCount() {
        int count = 0;
        for (Meld meld : melds) {
            count += meld.size();
        }
        return count;
    }

    void addDiscard(Tile tile) {
        discards.add(tile);
    }

    /**
     * 手牌排序：财神排在最左边，其他牌按正常规则排序
     */
    void sortHand(Tile wildcardTile) {
        List<Tile> wildcards = new ArrayList<>();
        List<Tile> others = new ArrayList<>();
        for (Tile tile : handTiles) {
            if (tile.equals(wildcardTile)) {
                wildcards.add(tile);
            } else {
                others.add(tile);
            }
        }
        Collections.sort(others);
        handTiles.clear();
        handTiles.addAll(wildcards);
        handTiles.addAll(others);
    }
}
