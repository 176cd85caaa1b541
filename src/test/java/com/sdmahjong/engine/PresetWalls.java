package com.sdmahjong.engine;

import com.sdmahjong.model.Meld;
import com.sdmahjong.model.Tile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 测试用预设牌墙：按“庄家 14 张、三家各 13 张、财神、之后依次摸到的牌”写出，
 * 转换成 {@link TileFactory#dealPreset} 需要的顺序（从列表尾部取牌）
 */
public final class PresetWalls {

    /** 庄家起手：没有听牌，也不能胡 */
    public static final String DEALER = "2W 4W 5W 6W 8W 9W 1B 3B 7B 9B 1T 3T 5T 7T";
    /** 有一对 5万，可以碰 5万 */
    public static final String SEAT1 = "5W 5W 1B 1B 1B 2B 3B 4B 6B 7B 8B 2T 4T";
    /** 听 5万（345万 + 234条 + 567条 + 888条，5筒做将） */
    public static final String SEAT2 = "3W 4W 2T 3T 4T 5T 6T 7T 8T 8T 8T 5B 5B";
    public static final String SEAT3 = "1W 2W 3W 6W 7W 8W 4B 5B 6B 9B 9B 1T 6T";
    public static final String WILDCARD = "9T";

    private PresetWalls() {
    }

    public static List<Tile> build(String dealer, String seat1, String seat2, String seat3,
                                   String wildcard, String draws) {
        List<Tile> drawOrder = new ArrayList<>();
        drawOrder.addAll(TileCodes.parseAll(dealer));
        drawOrder.addAll(TileCodes.parseAll(seat1));
        drawOrder.addAll(TileCodes.parseAll(seat2));
        drawOrder.addAll(TileCodes.parseAll(seat3));
        drawOrder.add(TileCodes.parse(wildcard));
        drawOrder.addAll(TileCodes.parseAll(draws));
        Collections.reverse(drawOrder);
        return drawOrder;
    }

    /**
     * 把某个座位手中的三张同种牌直接摆成刻子（记为上家打出），
     * 用来构造已经碰过几次的残局；牌只在手牌和面子之间移动，总数不变
     */
    public static void exposeTriplets(GameState state, int seat, String codes) {
        PlayerSeat player = state.getSeat(seat);
        int sourceSeat = (seat + GameState.SEAT_COUNT - 1) % GameState.SEAT_COUNT;
        for (Tile tile : TileCodes.parseAll(codes)) {
            player.removeTiles(tile, 3);
            player.addMeld(Meld.triplet(tile, sourceSeat));
        }
    }

    /**
     * 默认四家手牌，牌墙为 draws
     */
    public static DealResult standardDeal(String draws) {
        return TileFactory.dealPreset(build(DEALER, SEAT1, SEAT2, SEAT3, WILDCARD, draws));
    }
}
