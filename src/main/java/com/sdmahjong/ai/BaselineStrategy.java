package com.sdmahjong.ai;

import com.sdmahjong.engine.WaitingAnalyzer;
import com.sdmahjong.model.ClaimOption;
import com.sdmahjong.model.ClaimType;
import com.sdmahjong.model.Tile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 基础策略（不追求最优）：
 * 1. 财神不打（手中只剩财神时除外）
 * 2. 能听牌就打出后剩余听牌张数最多的那张
 * 3. 否则打最孤立的牌
 * 4. 能胡就胡，碰和杠都要，不吃
 */
public class BaselineStrategy implements SeatStrategy {

    @Override
    public Tile chooseDiscard(SeatView view) {
        List<Tile> hand = view.getHandTiles();
        Tile wildcard = view.getWildcardTile();

        List<Tile> candidates = new ArrayList<>();
        for (Tile tile : hand) {
            if (!tile.equals(wildcard) && !candidates.contains(tile)) {
                candidates.add(tile);
            }
        }
        if (candidates.isEmpty()) {
            // 碰吃后手中只剩财神
            return wildcard;
        }

        Tile bestWaiting = null;
        int bestOuts = -1;
        for (Tile candidate : candidates) {
            List<Tile> rest = new ArrayList<>(hand);
            rest.remove(candidate);
            Set<Tile> waiting = WaitingAnalyzer.waitingTilesForHand(rest, wildcard, view.getAlphabet());
            if (waiting.isEmpty()) {
                continue;
            }
            int outs = 0;
            for (Tile t : waiting) {
                outs += view.remaining(t);
            }
            if (outs > bestOuts) {
                bestOuts = outs;
                bestWaiting = candidate;
            }
        }
        if (bestWaiting != null) {
            return bestWaiting;
        }

        Tile mostIsolated = null;
        int lowestLinks = Integer.MAX_VALUE;
        for (Tile candidate : candidates) {
            int links = links(hand, candidate, wildcard);
            if (links < lowestLinks) {
                lowestLinks = links;
                mostIsolated = candidate;
            }
        }
        return mostIsolated;
    }

    @Override
    public boolean acceptClaim(SeatView view, ClaimOption option) {
        return option.getType() != ClaimType.RUN;
    }

    @Override
    public boolean acceptSelfQuad(SeatView view, ClaimOption option) {
        return true;
    }

    /**
     * 与这张牌有关联的其他手牌数：同种牌，以及同花色相差 2 以内的数牌
     */
    private int links(List<Tile> hand, Tile tile, Tile wildcard) {
        int links = -1;
        for (Tile other : hand) {
            if (other.equals(wildcard)) {
                continue;
            }
            if (other.equals(tile)) {
                links++;
            } else if (tile.isNumeric() && other.getSuit() == tile.getSuit()
                && Math.abs(other.getRank() - tile.getRank()) <= 2) {
                links++;
            }
        }
        return links;
    }
}
