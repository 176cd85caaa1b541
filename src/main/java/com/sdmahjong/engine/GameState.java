package com.sdmahjong.engine;

import com.sdmahjong.model.CompletionShape;
import com.sdmahjong.model.GamePhase;
import com.sdmahjong.model.TerminalReason;
import com.sdmahjong.model.Tile;
import com.sdmahjong.model.TileAlphabet;
import com.sdmahjong.model.Wall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一局的全部状态：四家手牌/面子/弃牌、牌墙、财神、回合阶段与结果。
 * 只由 {@link GameEngine} 的状态转移方法修改，对外只暴露查询方法；
 * 牌墙在构造时复制，不与发牌结果共享。
 */
public class GameState {

    public static final int SEAT_COUNT = 4;

    private final long seed;                    // 洗牌种子（预设牌墙为 -1）
    private final TileAlphabet alphabet;        // 108 / 136 张
    private final int populationSize;           // 全部牌数（守恒检查用）
    private final List<PlayerSeat> seats;       // 四个座位
    private final Wall wall;                    // 牌墙
    private final Tile wildcardTile;            // 财神牌（本局固定）
    private final List<Tile> discardPile;       // 牌池（被吃碰杠的牌会移出）

    private int currentSeat;                    // 当前行动玩家
    private GamePhase phase;                    // 回合阶段
    private Tile lastDiscardedTile;             // 最后打出的牌（或加杠的牌）
    private int lastDiscardSeat;                // 最后打牌的玩家
    private Tile lastDrawnTile;                 // 当前玩家最近一次摸到的牌，吃碰后为 null
    private boolean upgradePending;             // 加杠等待抢杠
    private int turnCount;                      // 已摸牌次数

    // === 结果 ===
    private TerminalReason terminalReason;
    private int winnerSeat;
    private CompletionShape completionShape;
    private int winningScore;

    GameState(long seed, TileAlphabet alphabet, int populationSize,
                     List<List<Tile>> hands, Wall wall, Tile wildcardTile) {
        if (hands.size() != SEAT_COUNT) {
            throw new IllegalArgumentException("必须是 4 家手牌：" + hands.size());
        }
        this.seed = seed;
        this.alphabet = alphabet;
        this.populationSize = populationSize;
        this.seats = new ArrayList<>(SEAT_COUNT);
        for (int i = 0; i < SEAT_COUNT; i++) {
            PlayerSeat seat = new PlayerSeat(i);
            for (Tile tile : hands.get(i)) {
                seat.addTile(tile);
            }
            seat.sortHand(wildcardTile);
            seats.add(seat);
        }
        this.wall = new Wall(wall.asUnmodifiableList());
        this.wildcardTile = wildcardTile;
        this.discardPile = new ArrayList<>();
        this.currentSeat = 0;
        this.phase = GamePhase.AWAITING_DISCARD;
        this.lastDiscardedTile = null;
        this.lastDiscardSeat = -1;
        this.lastDrawnTile = null;
        this.upgradePending = false;
        this.turnCount = 0;
        this.terminalReason = null;
        this.winnerSeat = -1;
        this.completionShape = null;
        this.winningScore = 0;
    }

    public long getSeed() {
        return seed;
    }

    public TileAlphabet getAlphabet() {
        return alphabet;
    }

    public int getPopulationSize() {
        return populationSize;
    }

    public List<PlayerSeat> getSeats() {
        return Collections.unmodifiableList(seats);
    }

    public PlayerSeat getSeat(int seat) {
        return seats.get(seat);
    }

    PlayerSeat getCurrentPlayer() {
        return seats.get(currentSeat);
    }

    Wall getWall() {
        return wall;
    }

    public int getWallSize() {
        return wall.size();
    }

    public boolean isWallEmpty() {
        return wall.isEmpty();
    }

    public Tile getWildcardTile() {
        return wildcardTile;
    }

    public List<Tile> getDiscardPile() {
        return Collections.unmodifiableList(discardPile);
    }

    void addToDiscardPile(Tile tile) {
        discardPile.add(tile);
    }

    /**
     * 被吃碰杠胡的牌从牌池移出（移除最后一张）
     */
    void takeFromDiscardPile(Tile tile) {
        int last = discardPile.lastIndexOf(tile);
        if (last < 0) {
            throw new IllegalStateException("牌池中没有 " + tile);
        }
        discardPile.remove(last);
    }

    public int getCurrentSeat() {
        return currentSeat;
    }

    void setCurrentSeat(int currentSeat) {
        this.currentSeat = currentSeat;
    }

    /**
     * 下一个玩家
     */
    void nextSeat() {
        currentSeat = (currentSeat + 1) % SEAT_COUNT;
    }

    public GamePhase getPhase() {
        return phase;
    }

    void setPhase(GamePhase phase) {
        this.phase = phase;
    }

    public boolean isTerminal() {
        return phase == GamePhase.TERMINAL;
    }

    public Tile getLastDiscardedTile() {
        return lastDiscardedTile;
    }

    void setLastDiscardedTile(Tile lastDiscardedTile) {
        this.lastDiscardedTile = lastDiscardedTile;
    }

    public int getLastDiscardSeat() {
        return lastDiscardSeat;
    }

    void setLastDiscardSeat(int lastDiscardSeat) {
        this.lastDiscardSeat = lastDiscardSeat;
    }

    public Tile getLastDrawnTile() {
        return lastDrawnTile;
    }

    void setLastDrawnTile(Tile lastDrawnTile) {
        this.lastDrawnTile = lastDrawnTile;
    }

    public boolean isUpgradePending() {
        return upgradePending;
    }

    void setUpgradePending(boolean upgradePending) {
        this.upgradePending = upgradePending;
    }

    public int getTurnCount() {
        return turnCount;
    }

    void incrementTurnCount() {
        turnCount++;
    }

    public TerminalReason getTerminalReason() {
        return terminalReason;
    }

    public int getWinnerSeat() {
        return winnerSeat;
    }

    public CompletionShape getCompletionShape() {
        return completionShape;
    }

    public int getWinningScore() {
        return winningScore;
    }

    /**
     * 结束本局
     */
    void finish(TerminalReason reason, int winnerSeat, CompletionShape shape, int score) {
        this.phase = GamePhase.TERMINAL;
        this.terminalReason = reason;
        this.winnerSeat = winnerSeat;
        this.completionShape = shape;
        this.winningScore = score;
    }

    /**
     * 当前在场的牌总数：牌墙 + 财神 + 手牌 + 面子 + 牌池，任何时刻都应等于全部牌数
     */
    public int countAllTiles() {
        int total = wall.size() + 1 + discardPile.size();
        for (PlayerSeat seat : seats) {
            total += seat.getHandSize() + seat.meldTileCount();
        }
        return total;
    }
}
