package com.sdmahjong.engine;

import com.sdmahjong.model.Tile;

import java.util.Collection;

/**
 * 剩余张数估计：每种牌 4 张减去已见张数
 */
public final class TileTracker {

    private TileTracker() {
    }

    public static int remaining(Tile tile, Collection<Tile> visibleTiles) {
        int seen = 0;
        for (Tile t : visibleTiles) {
            if (t.equals(tile)) {
                seen++;
            }
        }
        return Math.max(0, 4 - seen);
    }
}
