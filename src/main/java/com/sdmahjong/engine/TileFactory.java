package com.sdmahjong.engine;

import com.sdmahjong.model.Tile;
import com.sdmahjong.model.TileAlphabet;
import com.sdmahjong.model.Wall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 麻将牌工厂 - 创建、洗牌、发牌
 */
public class TileFactory {

    private static final Logger log = LoggerFactory.getLogger(TileFactory.class);

    /** 庄家 14 + 闲家 13×3 + 财神 1 */
    public static final int DEAL_REQUIREMENT = 14 + 13 * 3 + 1;

    /**
     * 创建一副完整的山东麻将牌
     * 万、筒、条各36张（1-9，每张4张），共108张；
     * 含字牌时再加东南西北、中发白各4张，共136张
     */
    public static List<Tile> createFullDeck(TileAlphabet alphabet) {
        List<Tile> tiles = new ArrayList<>(alphabet.getKindCount() * 4);
        for (Tile kind : alphabet.kinds()) {
            for (int count = 0; count < 4; count++) {
                tiles.add(kind);
            }
        }
        return tiles;
    }

    /**
     * 按种子洗牌，同一种子得到同一顺序
     */
    public static void shuffle(List<Tile> tiles, long seed) {
        Collections.shuffle(tiles, new Random(seed));
    }

    /**
     * 创建整副牌、按种子洗牌并发牌
     */
    public static DealResult deal(TileAlphabet alphabet, long seed) {
        List<Tile> tiles = createFullDeck(alphabet);
        shuffle(tiles, seed);
        log.debug("牌墙洗牌完成，种子={}，共{}张", seed, tiles.size());
        return dealPreset(tiles);
    }

    /**
     * 按给定牌序发牌（不洗牌）。
     * 与洗牌后发牌一样从列表尾部取牌：庄家先取 14 张，其余三家各 13 张，
     * 再翻出一张作为财神，剩下的为牌墙。
     */
    public static DealResult dealPreset(List<Tile> orderedTiles) {
        if (orderedTiles.size() < DEAL_REQUIREMENT) {
            throw new InsufficientTilesException(
                "牌数不足以发牌：需要" + DEAL_REQUIREMENT + "张，实际" + orderedTiles.size() + "张");
        }
        Wall wall = new Wall(orderedTiles);
        List<List<Tile>> hands = new ArrayList<>(4);
        for (int i = 0; i < 4; i++) {
            int count = i == 0 ? 14 : 13;
            List<Tile> hand = new ArrayList<>(count);
            for (int j = 0; j < count; j++) {
                hand.add(wall.draw().get());
            }
            hands.add(hand);
        }
        // 开神：翻开一张作为财神，不再留在牌墙中
        Tile wildcard = wall.draw().get();
        return new DealResult(hands, wildcard, wall, orderedTiles.size());
    }
}
