package com.sdmahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 牌墙：按栈的方式从尾部摸牌（最后洗入的最先摸到）
 */
public class Wall {

    private final List<Tile> tiles;

    public Wall(List<Tile> tiles) {
        this.tiles = new ArrayList<>(tiles);
    }

    /**
     * 摸一张牌，牌墙已空返回 empty
     */
    public Optional<Tile> draw() {
        if (tiles.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(tiles.remove(tiles.size() - 1));
    }

    public int size() {
        return tiles.size();
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    public List<Tile> asUnmodifiableList() {
        return Collections.unmodifiableList(tiles);
    }

    @Override
    public String toString() {
        return "Wall(size=" + tiles.size() + ")";
    }
}
