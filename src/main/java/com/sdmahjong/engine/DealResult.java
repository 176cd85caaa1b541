package com.sdmahjong.engine;

import com.sdmahjong.model.Tile;
import com.sdmahjong.model.Wall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 发牌结果：四家手牌、财神牌和剩余牌墙
 */
public class DealResult {

    private final List<List<Tile>> hands;
    private final Tile wildcardTile;
    private final Wall wall;
    private final int populationSize;

    public DealResult(List<List<Tile>> hands, Tile wildcardTile, Wall wall, int populationSize) {
        List<List<Tile>> copy = new ArrayList<>(hands.size());
        for (List<Tile> hand : hands) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(hand)));
        }
        this.hands = Collections.unmodifiableList(copy);
        this.wildcardTile = wildcardTile;
        this.wall = wall;
        this.populationSize = populationSize;
    }

    public List<List<Tile>> getHands() {
        return hands;
    }

    public Tile getWildcardTile() {
        return wildcardTile;
    }

    public Wall getWall() {
        return wall;
    }

    public int getPopulationSize() {
        return populationSize;
    }
}
