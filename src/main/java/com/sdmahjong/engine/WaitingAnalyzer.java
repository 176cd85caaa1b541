package com.sdmahjong.engine;

import com.sdmahjong.model.IllegalHandSizeException;
import com.sdmahjong.model.Tile;
import com.sdmahjong.model.TileAlphabet;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 听牌计算：逐一假设再进一张，能胡的牌即为听牌
 */
public final class WaitingAnalyzer {

    private WaitingAnalyzer() {
    }

    /**
     * 计算听牌（108 张牌型）
     */
    public static Set<Tile> waitingTiles(List<Tile> naturalTiles, int wildcardCount) {
        return waitingTiles(naturalTiles, wildcardCount, TileAlphabet.NUMERIC_ONLY);
    }

    /**
     * 计算听牌：对字母表中每一种牌，假设加入一张后调用 {@link WinEvaluator}
     *
     * @param naturalTiles 手中的自然牌（不含财神），加上财神必须是 3n+1 张
     * @return 按索引排序的听牌集合，没听牌时为空
     */
    public static Set<Tile> waitingTiles(List<Tile> naturalTiles, int wildcardCount, TileAlphabet alphabet) {
        int[] counts = WinEvaluator.toCounts(naturalTiles);
        checkSize(naturalTiles.size() + wildcardCount);

        SortedSet<Tile> waiting = new TreeSet<>();
        for (Tile candidate : alphabet.kinds()) {
            int index = candidate.getIndex();
            counts[index]++;
            if (WinEvaluator.evaluate(counts, wildcardCount).isPresent()) {
                waiting.add(candidate);
            }
            counts[index]--;
        }
        return Collections.unmodifiableSortedSet(waiting);
    }

    /**
     * 计算听牌（实际手牌）：进张若是财神牌，按多一张财神计算
     */
    public static Set<Tile> waitingTilesForHand(List<Tile> handTiles, Tile wildcardTile, TileAlphabet alphabet) {
        int[] counts = WinEvaluator.toCounts(handTiles);
        int wildcards = 0;
        if (wildcardTile != null) {
            wildcards = counts[wildcardTile.getIndex()];
            counts[wildcardTile.getIndex()] = 0;
        }
        checkSize(handTiles.size());

        SortedSet<Tile> waiting = new TreeSet<>();
        for (Tile candidate : alphabet.kinds()) {
            boolean complete;
            if (candidate.equals(wildcardTile)) {
                complete = WinEvaluator.evaluate(counts, wildcards + 1).isPresent();
            } else {
                counts[candidate.getIndex()]++;
                complete = WinEvaluator.evaluate(counts, wildcards).isPresent();
                counts[candidate.getIndex()]--;
            }
            if (complete) {
                waiting.add(candidate);
            }
        }
        return Collections.unmodifiableSortedSet(waiting);
    }

    public static boolean isWaiting(List<Tile> handTiles, Tile wildcardTile, TileAlphabet alphabet) {
        return !waitingTilesForHand(handTiles, wildcardTile, alphabet).isEmpty();
    }

    // 再进一张满足 3n+2，即当前 3n+1（1、4、7、10、13）
    private static void checkSize(int size) {
        if (size < 1 || size > 13 || size % 3 != 1) {
            throw new IllegalHandSizeException("听牌计算的手牌张数必须是 3n+1（≤13），实际：" + size);
        }
    }
}
