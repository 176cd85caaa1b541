package com.sdmahjong.engine;

import com.sdmahjong.model.ClaimOption;
import com.sdmahjong.model.Meld;
import com.sdmahjong.model.QuadKind;
import com.sdmahjong.model.Tile;

import java.util.ArrayList;
import java.util.List;

/**
 * 操作检查器 - 检查玩家是否可以吃、碰、杠、胡。
 * 所有方法都是纯查询，不修改手牌、面子和牌墙。
 * 财神牌不参与吃碰杠：既不能被吃碰杠，也不能用手中的财神去吃碰杠。
 */
public final class ActionChecker {

    private ActionChecker() {
    }

    /**
     * 检查玩家是否可以碰牌
     * 碰：手牌中有 2 张相同的牌，可以碰任何其他玩家打出的牌
     */
    public static boolean canClaimTriplet(List<Tile> hand, Tile claimedTile, int claimantSeat,
                                          int discarderSeat, Tile wildcardTile) {
        if (claimantSeat == discarderSeat || claimedTile.equals(wildcardTile)) {
            return false;
        }
        return count(hand, claimedTile) >= 2;
    }

    /**
     * 检查玩家是否可以直杠
     * 直杠：手牌中有 3 张相同的牌，杠别人打出的牌
     */
    public static boolean canClaimQuad(List<Tile> hand, Tile claimedTile, int claimantSeat,
                                       int discarderSeat, Tile wildcardTile) {
        if (claimantSeat == discarderSeat || claimedTile.equals(wildcardTile)) {
            return false;
        }
        return count(hand, claimedTile) >= 3;
    }

    /**
     * 检查玩家是否可以吃牌，返回所有可能的吃牌组合
     * 吃：只能吃上家打出的牌（出牌者 - 吃牌者 ≡ 3 mod 4），且只有万筒条可以吃
     */
    public static List<List<Tile>> runOptions(List<Tile> hand, Tile claimedTile, int claimantSeat,
                                              int discarderSeat, Tile wildcardTile) {
        List<List<Tile>> results = new ArrayList<>();
        if (Math.floorMod(discarderSeat - claimantSeat, GameState.SEAT_COUNT) != 3) {
            return results;
        }
        if (!claimedTile.isNumeric() || claimedTile.equals(wildcardTile)) {
            return results;
        }

        int rank = claimedTile.getRank();
        // 吃头：x, x+1, x+2；吃中：x-1, x, x+1；吃尾：x-2, x-1, x
        for (int start = rank - 2; start <= rank; start++) {
            if (start < 1 || start + 2 > 9) {
                continue;
            }
            List<Tile> combo = new ArrayList<>(3);
            boolean ok = true;
            for (int r = start; r <= start + 2; r++) {
                Tile member = new Tile(claimedTile.getSuit(), r);
                if (r != rank && (member.equals(wildcardTile) || count(hand, member) == 0)) {
                    ok = false;
                    break;
                }
                combo.add(member);
            }
            if (ok) {
                results.add(combo);
            }
        }
        return results;
    }

    /**
     * 检查是否可以胡（别人打出的牌或抢杠的牌）
     */
    public static boolean canClaimWin(List<Tile> hand, Tile claimedTile, Tile wildcardTile) {
        List<Tile> test = new ArrayList<>(hand.size() + 1);
        test.addAll(hand);
        test.add(claimedTile);
        return WinEvaluator.evaluateHand(test, wildcardTile).isPresent();
    }

    /**
     * 暗杠：手牌中有 4 张相同的牌
     */
    public static boolean canQuadConcealed(List<Tile> hand, Tile tile, Tile wildcardTile) {
        return !tile.equals(wildcardTile) && count(hand, tile) >= 4;
    }

    /**
     * 明杠：摸牌前手中已有 3 张，刚摸到的是第 4 张
     *
     * @param handBeforeDraw 摸牌前的手牌
     */
    public static boolean canQuadByDraw(List<Tile> handBeforeDraw, Tile drawnTile, Tile wildcardTile) {
        return drawnTile != null && !drawnTile.equals(wildcardTile) && count(handBeforeDraw, drawnTile) == 3;
    }

    /**
     * 加杠：已碰出该牌的刻子，手中（或刚摸到）有第 4 张
     */
    public static boolean canQuadByUpgrade(List<Meld> melds, List<Tile> hand, Tile tile) {
        if (count(hand, tile) == 0) {
            return false;
        }
        for (Meld meld : melds) {
            if (meld.isTripletOf(tile)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 当前玩家出牌前可以声明的所有杠（暗杠 / 明杠 / 加杠）
     *
     * @param lastDrawnTile 本回合摸到的牌，吃碰后出牌时为 null
     */
    public static List<ClaimOption> selfQuadOptions(PlayerSeat seat, Tile lastDrawnTile, Tile wildcardTile) {
        List<ClaimOption> options = new ArrayList<>();
        List<Tile> hand = seat.getHandTiles();
        List<Tile> seen = new ArrayList<>();
        for (Tile tile : hand) {
            if (seen.contains(tile) || tile.equals(wildcardTile)) {
                continue;
            }
            seen.add(tile);
            if (canQuadConcealed(hand, tile, wildcardTile)) {
                // 第 4 张正是刚摸到的牌时为明杠，否则为暗杠
                QuadKind kind = QuadKind.CONCEALED;
                if (tile.equals(lastDrawnTile)) {
                    List<Tile> beforeDraw = new ArrayList<>(hand);
                    beforeDraw.remove(lastDrawnTile);
                    if (canQuadByDraw(beforeDraw, lastDrawnTile, wildcardTile)) {
                        kind = QuadKind.EXPOSED_BY_DRAW;
                    }
                }
                options.add(ClaimOption.quad(seat.getSeat(), tile, -1, kind));
            }
            if (canQuadByUpgrade(seat.getMelds(), hand, tile)) {
                options.add(ClaimOption.quad(seat.getSeat(), tile, -1, QuadKind.EXPOSED_BY_UPGRADE));
            }
        }
        return options;
    }

    /**
     * 某个玩家对一张打出的牌的全部合法操作
     */
    public static List<ClaimOption> claimOptions(PlayerSeat seat, Tile discardedTile, int discarderSeat,
                                                 Tile wildcardTile) {
        List<ClaimOption> options = new ArrayList<>();
        int claimant = seat.getSeat();
        if (claimant == discarderSeat) {
            return options;
        }
        List<Tile> hand = seat.getHandTiles();
        if (canClaimWin(hand, discardedTile, wildcardTile)) {
            options.add(ClaimOption.win(claimant, discardedTile, discarderSeat));
        }
        if (canClaimQuad(hand, discardedTile, claimant, discarderSeat, wildcardTile)) {
            options.add(ClaimOption.quad(claimant, discardedTile, discarderSeat, QuadKind.EXPOSED_BY_CLAIM));
        }
        if (canClaimTriplet(hand, discardedTile, claimant, discarderSeat, wildcardTile)) {
            options.add(ClaimOption.triplet(claimant, discardedTile, discarderSeat));
        }
        for (List<Tile> combo : runOptions(hand, discardedTile, claimant, discarderSeat, wildcardTile)) {
            options.add(ClaimOption.run(claimant, discardedTile, discarderSeat, combo));
        }
        return options;
    }

    /**
     * 按一手散牌（不含面子）查询某个座位对一张打出的牌的全部合法操作
     */
    public static List<ClaimOption> claimOptions(List<Tile> hand, int claimantSeat, Tile discardedTile,
                                                 int discarderSeat, Tile wildcardTile) {
        PlayerSeat seat = new PlayerSeat(claimantSeat);
        for (Tile tile : hand) {
            seat.addTile(tile);
        }
        return claimOptions(seat, discardedTile, discarderSeat, wildcardTile);
    }

    private static int count(List<Tile> hand, Tile tile) {
        int count = 0;
        for (Tile t : hand) {
            if (t.equals(tile)) {
                count++;
            }
        }
        return count;
    }
}
