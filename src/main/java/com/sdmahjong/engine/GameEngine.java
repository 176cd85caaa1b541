package com.sdmahjong.engine;

import com.sdmahjong.model.ClaimOption;
import com.sdmahjong.model.ClaimType;
import com.sdmahjong.model.CompletionShape;
import com.sdmahjong.model.GamePhase;
import com.sdmahjong.model.Meld;
import com.sdmahjong.model.QuadKind;
import com.sdmahjong.model.TerminalReason;
import com.sdmahjong.model.Tile;
import com.sdmahjong.model.TileAlphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 游戏引擎 - 一局的回合状态机
 * <p>
 * 摸牌 → 出牌 → 其他玩家吃碰杠胡 → 下一家摸牌 / 结束。
 * 每个状态转移方法只修改传入的 {@link GameState} 并将其返回；
 * 出哪张牌、要不要吃碰杠由调用方决定。
 */
public class GameEngine {

    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    /**
     * 按种子洗牌发牌，开始一局
     */
    public GameState startRound(TileAlphabet alphabet, long seed) {
        return startRound(TileFactory.deal(alphabet, seed), alphabet, seed);
    }

    /**
     * 用已发好的牌开始一局。庄家（座位 0）拿 14 张，不摸牌直接出牌
     */
    public GameState startRound(DealResult deal, TileAlphabet alphabet, long seed) {
        GameState state = new GameState(seed, alphabet, deal.getPopulationSize(),
            deal.getHands(), deal.getWall(), deal.getWildcardTile());
        log.info("开局，种子={}，财神={}，牌墙剩余{}张", seed, state.getWildcardTile(), state.getWallSize());

        // 庄家起手即胡（天胡）按自摸处理
        PlayerSeat dealer = state.getSeat(0);
        Optional<CompletionShape> shape = WinEvaluator.evaluateHand(dealer.getHandTiles(), state.getWildcardTile());
        if (shape.isPresent()) {
            finishWin(state, 0, shape.get(), true);
        }
        verifyConservation(state);
        return state;
    }

    /**
     * 当前玩家摸牌；牌墙已空则荒庄，摸到即胡则自摸
     */
    public GameState applyDraw(GameState state) {
        requirePhase(state, GamePhase.AWAITING_DRAW);
        drawInto(state, state.getCurrentPlayer());
        state.incrementTurnCount();
        verifyConservation(state);
        return state;
    }

    /**
     * 当前玩家出牌前可以声明的杠
     */
    public List<ClaimOption> selfQuadOptions(GameState state) {
        if (state.getPhase() != GamePhase.AWAITING_DISCARD) {
            return new ArrayList<>();
        }
        return ActionChecker.selfQuadOptions(state.getCurrentPlayer(), state.getLastDrawnTile(),
            state.getWildcardTile());
    }

    /**
     * 当前玩家暗杠 / 明杠 / 加杠。
     * 加杠时若有人可以抢杠胡，先进入抢杠窗口；否则杠完从牌墙补一张
     */
    public GameState applySelfQuad(GameState state, ClaimOption option) {
        requirePhase(state, GamePhase.AWAITING_DISCARD);
        if (!selfQuadOptions(state).contains(option)) {
            log.warn("座位 {} 不能杠：{}", state.getCurrentSeat(), option);
            throw new IllegalActionException("不能杠：" + option);
        }
        PlayerSeat seat = state.getCurrentPlayer();
        Tile tile = option.getTile();

        if (option.getQuadKind() == QuadKind.EXPOSED_BY_UPGRADE) {
            if (hasRobbingWin(state, seat.getSeat(), tile)) {
                state.setUpgradePending(true);
                state.setLastDiscardedTile(tile);
                state.setLastDiscardSeat(seat.getSeat());
                state.setPhase(GamePhase.AWAITING_CLAIMS);
                log.debug("座位 {} 加杠 {}，等待抢杠", seat.getSeat(), tile);
                return state;
            }
            completeUpgrade(state, seat, tile);
        } else {
            seat.removeTiles(tile, 4);
            seat.addMeld(Meld.quad(tile, option.getQuadKind(), -1));
            log.debug("座位 {} {}：{}", seat.getSeat(), option.getQuadKind(), tile);
        }
        drawInto(state, seat);
        verifyConservation(state);
        return state;
    }

    /**
     * 当前玩家出牌，进入等待吃碰杠胡阶段。
     * 财神不能打出，除非手中只剩财神（碰/吃后可能出现）
     */
    public GameState applyDiscard(GameState state, Tile tile) {
        requirePhase(state, GamePhase.AWAITING_DISCARD);
        PlayerSeat seat = state.getCurrentPlayer();
        if (tile.equals(state.getWildcardTile()) && !seat.naturalTiles(state.getWildcardTile()).isEmpty()) {
            log.warn("座位 {} 不能打出财神：{}", seat.getSeat(), tile);
            throw new IllegalActionException("财神不能打出：" + tile);
        }
        if (!seat.removeTile(tile)) {
            log.warn("座位 {} 手中没有牌：{}", seat.getSeat(), tile);
            throw new IllegalActionException("手中没有这张牌：" + tile);
        }
        seat.addDiscard(tile);
        seat.sortHand(state.getWildcardTile());
        state.addToDiscardPile(tile);
        state.setLastDiscardedTile(tile);
        state.setLastDiscardSeat(seat.getSeat());
        state.setLastDrawnTile(null);
        state.setPhase(GamePhase.AWAITING_CLAIMS);
        log.debug("座位 {} 打出：{}", seat.getSeat(), tile);
        verifyConservation(state);
        return state;
    }

    /**
     * 其他玩家对最后一张牌的全部合法操作，按出牌者下家开始的顺序排列。
     * 抢杠窗口内只有胡
     */
    public List<ClaimOption> legalClaims(GameState state) {
        List<ClaimOption> options = new ArrayList<>();
        if (state.getPhase() != GamePhase.AWAITING_CLAIMS) {
            return options;
        }
        Tile tile = state.getLastDiscardedTile();
        int discarder = state.getLastDiscardSeat();
        for (int offset = 1; offset < GameState.SEAT_COUNT; offset++) {
            PlayerSeat seat = state.getSeat((discarder + offset) % GameState.SEAT_COUNT);
            if (state.isUpgradePending()) {
                if (ActionChecker.canClaimWin(seat.getHandTiles(), tile, state.getWildcardTile())) {
                    options.add(ClaimOption.win(seat.getSeat(), tile, discarder));
                }
            } else {
                options.addAll(ActionChecker.claimOptions(seat, tile, discarder, state.getWildcardTile()));
            }
        }
        return options;
    }

    /**
     * 从玩家选择要执行的操作中挑出最终生效的一个：
     * 胡 > 杠/碰 > 吃，同优先级按出牌者下家开始的顺序
     */
    public Optional<ClaimOption> resolveClaims(GameState state, Collection<ClaimOption> accepted) {
        int discarder = state.getLastDiscardSeat();
        ClaimOption best = null;
        for (ClaimOption option : accepted) {
            if (best == null || outranks(option, best, discarder)) {
                best = option;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * 选出优先级最高的操作执行，没人要则过
     */
    public GameState applyClaims(GameState state, Collection<ClaimOption> accepted) {
        Optional<ClaimOption> chosen = resolveClaims(state, accepted);
        if (chosen.isPresent()) {
            return applyClaim(state, chosen.get());
        }
        return applyPass(state);
    }

    /**
     * 执行一个吃碰杠胡
     */
    public GameState applyClaim(GameState state, ClaimOption option) {
        requirePhase(state, GamePhase.AWAITING_CLAIMS);
        if (!legalClaims(state).contains(option)) {
            log.warn("非法操作：{}", option);
            throw new IllegalActionException("操作不合法：" + option);
        }
        PlayerSeat claimant = state.getSeat(option.getSeat());
        Tile tile = option.getTile();

        if (option.getType() == ClaimType.WIN) {
            if (state.isUpgradePending()) {
                // 抢杠胡：加杠的牌从加杠者手中转给胡牌者
                state.getSeat(state.getLastDiscardSeat()).removeTile(tile);
                state.setUpgradePending(false);
                log.debug("座位 {} 抢杠胡：{}", claimant.getSeat(), tile);
            } else {
                state.takeFromDiscardPile(tile);
            }
            claimant.addTile(tile);
            CompletionShape shape = WinEvaluator.evaluateHand(claimant.getHandTiles(), state.getWildcardTile())
                .orElseThrow(() -> new IllegalStateException("胡牌判断前后不一致"));
            finishWin(state, claimant.getSeat(), shape, false);
            verifyConservation(state);
            return state;
        }

        state.takeFromDiscardPile(tile);
        state.setCurrentSeat(claimant.getSeat());
        state.setLastDrawnTile(null);
        switch (option.getType()) {
            case QUAD:
                claimant.removeTiles(tile, 3);
                claimant.addMeld(Meld.quad(tile, QuadKind.EXPOSED_BY_CLAIM, option.getSourceSeat()));
                log.debug("座位 {} 杠：{}", claimant.getSeat(), tile);
                drawInto(state, claimant);
                break;
            case TRIPLET:
                claimant.removeTiles(tile, 2);
                claimant.addMeld(Meld.triplet(tile, option.getSourceSeat()));
                state.setPhase(GamePhase.AWAITING_DISCARD);
                log.debug("座位 {} 碰：{}", claimant.getSeat(), tile);
                break;
            case RUN:
                for (Tile member : option.getRunTiles()) {
                    if (!member.equals(tile)) {
                        claimant.removeTiles(member, 1);
                    }
                }
                claimant.addMeld(Meld.run(option.getRunTiles(), option.getSourceSeat()));
                state.setPhase(GamePhase.AWAITING_DISCARD);
                log.debug("座位 {} 吃：{}", claimant.getSeat(), option.getRunTiles());
                break;
            default:
                throw new IllegalStateException("未知操作：" + option.getType());
        }
        verifyConservation(state);
        return state;
    }

    /**
     * 所有人都不要：轮到出牌者下家摸牌；抢杠窗口无人胡则完成加杠并补牌
     */
    public GameState applyPass(GameState state) {
        requirePhase(state, GamePhase.AWAITING_CLAIMS);
        if (state.isUpgradePending()) {
            state.setUpgradePending(false);
            PlayerSeat seat = state.getCurrentPlayer();
            completeUpgrade(state, seat, state.getLastDiscardedTile());
            state.setLastDiscardedTile(null);
            drawInto(state, seat);
        } else {
            state.nextSeat();
            state.setPhase(GamePhase.AWAITING_DRAW);
        }
        verifyConservation(state);
        return state;
    }

    /**
     * 强制荒庄（驱动层回合上限）
     */
    public GameState forceWallExhausted(GameState state) {
        if (!state.isTerminal()) {
            log.warn("达到回合上限（{}回合），强制荒庄", state.getTurnCount());
            state.finish(TerminalReason.WALL_EXHAUSTED, -1, null, 0);
        }
        return state;
    }

    // === 内部方法 ===

    /**
     * 从牌墙摸一张给指定玩家（正常摸牌或杠后补牌）
     */
    private void drawInto(GameState state, PlayerSeat seat) {
        Optional<Tile> drawn = state.getWall().draw();
        if (!drawn.isPresent()) {
            log.info("牌墙已空，荒庄");
            state.finish(TerminalReason.WALL_EXHAUSTED, -1, null, 0);
            return;
        }
        Tile tile = drawn.get();
        seat.addTile(tile);
        state.setLastDrawnTile(tile);
        log.debug("座位 {} 摸牌：{}", seat.getSeat(), tile);

        Optional<CompletionShape> shape = WinEvaluator.evaluateHand(seat.getHandTiles(), state.getWildcardTile());
        if (shape.isPresent()) {
            finishWin(state, seat.getSeat(), shape.get(), true);
            return;
        }
        state.setPhase(GamePhase.AWAITING_DISCARD);
    }

    private void completeUpgrade(GameState state, PlayerSeat seat, Tile tile) {
        List<Meld> melds = seat.getMelds();
        for (int i = 0; i < melds.size(); i++) {
            if (melds.get(i).isTripletOf(tile)) {
                seat.removeTiles(tile, 1);
                seat.replaceMeld(i, melds.get(i).upgrade());
                log.debug("座位 {} 加杠：{}", seat.getSeat(), tile);
                return;
            }
        }
        throw new IllegalStateException("座位 " + seat.getSeat() + " 没有可加杠的刻子：" + tile);
    }

    private boolean hasRobbingWin(GameState state, int upgrader, Tile tile) {
        for (PlayerSeat other : state.getSeats()) {
            if (other.getSeat() != upgrader
                && ActionChecker.canClaimWin(other.getHandTiles(), tile, state.getWildcardTile())) {
                return true;
            }
        }
        return false;
    }

    private void finishWin(GameState state, int winner, CompletionShape shape, boolean selfDraw) {
        PlayerSeat seat = state.getSeat(winner);
        int score = ScoreCalculator.score(shape, seat.quadCount(), selfDraw, seat.isDealer(),
            seat.wildcardCount(state.getWildcardTile()));
        state.setCurrentSeat(winner);
        state.finish(selfDraw ? TerminalReason.SELF_DRAW_WIN : TerminalReason.DISCARD_WIN, winner, shape, score);
        log.info("座位 {} {}！牌型={}，{}番", winner, selfDraw ? "自摸" : "胡牌", shape, score);
    }

    private boolean outranks(ClaimOption candidate, ClaimOption current, int discarder) {
        int p1 = candidate.getType().getPriority();
        int p2 = current.getType().getPriority();
        if (p1 != p2) {
            return p1 > p2;
        }
        return distance(discarder, candidate.getSeat()) < distance(discarder, current.getSeat());
    }

    private static int distance(int from, int to) {
        return Math.floorMod(to - from, GameState.SEAT_COUNT);
    }

    private void requirePhase(GameState state, GamePhase expected) {
        if (state.getPhase() != expected) {
            log.warn("当前阶段为 {}，不能执行需要 {} 的操作", state.getPhase(), expected);
            throw new IllegalActionException("当前阶段为 " + state.getPhase() + "，需要 " + expected);
        }
    }

    private void verifyConservation(GameState state) {
        int total = state.countAllTiles();
        if (total != state.getPopulationSize()) {
            throw new IllegalStateException("牌数不守恒：" + total + " != " + state.getPopulationSize());
        }
    }
}
