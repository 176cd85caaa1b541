package com.sdmahjong.ai;

import com.sdmahjong.engine.GameState;
import com.sdmahjong.engine.PlayerSeat;
import com.sdmahjong.engine.TileTracker;
import com.sdmahjong.model.Meld;
import com.sdmahjong.model.Tile;
import com.sdmahjong.model.TileAlphabet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 某个座位能看到的局面快照（只读）：自己的手牌和面子，
 * 四家的弃牌与明面子，财神牌，牌墙剩余张数
 */
public class SeatView {

    private final int seat;
    private final List<Tile> handTiles;
    private final List<Meld> melds;
    private final List<List<Tile>> discardLogs;     // 每家打过的牌（含被吃碰走的）
    private final List<List<Meld>> exposedMelds;    // 每家的面子
    private final List<Tile> discardPile;           // 牌池中的牌
    private final Tile wildcardTile;
    private final TileAlphabet alphabet;
    private final int wallSize;

    private SeatView(GameState state, int seat) {
        PlayerSeat own = state.getSeat(seat);
        this.seat = seat;
        this.handTiles = Collections.unmodifiableList(new ArrayList<>(own.getHandTiles()));
        this.melds = Collections.unmodifiableList(new ArrayList<>(own.getMelds()));
        List<List<Tile>> logs = new ArrayList<>();
        List<List<Meld>> exposed = new ArrayList<>();
        for (PlayerSeat other : state.getSeats()) {
            logs.add(Collections.unmodifiableList(new ArrayList<>(other.getDiscards())));
            exposed.add(Collections.unmodifiableList(new ArrayList<>(other.getMelds())));
        }
        this.discardLogs = Collections.unmodifiableList(logs);
        this.exposedMelds = Collections.unmodifiableList(exposed);
        this.discardPile = Collections.unmodifiableList(new ArrayList<>(state.getDiscardPile()));
        this.wildcardTile = state.getWildcardTile();
        this.alphabet = state.getAlphabet();
        this.wallSize = state.getWallSize();
    }

    public static SeatView of(GameState state, int seat) {
        return new SeatView(state, seat);
    }

    public int getSeat() {
        return seat;
    }

    public List<Tile> getHandTiles() {
        return handTiles;
    }

    public List<Meld> getMelds() {
        return melds;
    }

    public List<List<Tile>> getDiscardLogs() {
        return discardLogs;
    }

    public List<List<Meld>> getExposedMelds() {
        return exposedMelds;
    }

    public Tile getWildcardTile() {
        return wildcardTile;
    }

    public TileAlphabet getAlphabet() {
        return alphabet;
    }

    public int getWallSize() {
        return wallSize;
    }

    /**
     * 这个座位看得到的所有牌：自己的手牌、牌池、四家面子，以及翻出的财神牌
     */
    public List<Tile> visibleTiles() {
        List<Tile> visible = new ArrayList<>(handTiles);
        visible.addAll(discardPile);
        for (List<Meld> seatMelds : exposedMelds) {
            for (Meld meld : seatMelds) {
                visible.addAll(meld.getTiles());
            }
        }
        visible.add(wildcardTile);
        return visible;
    }

    /**
     * 某种牌在看不到的地方还剩几张
     */
    public int remaining(Tile tile) {
        return TileTracker.remaining(tile, visibleTiles());
    }
}
