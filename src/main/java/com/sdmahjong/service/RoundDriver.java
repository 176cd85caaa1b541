package com.sdmahjong.service;

import com.sdmahjong.ai.SeatStrategy;
import com.sdmahjong.ai.SeatView;
import com.sdmahjong.engine.DealResult;
import com.sdmahjong.engine.GameEngine;
import com.sdmahjong.engine.GameState;
import com.sdmahjong.model.ClaimOption;
import com.sdmahjong.model.Tile;
import com.sdmahjong.model.TileAlphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 从开局一直打到结束的一局驱动：每个座位的决策交给对应的 {@link SeatStrategy}
 */
public class RoundDriver {

    private static final Logger log = LoggerFactory.getLogger(RoundDriver.class);

    private final GameEngine engine;
    private final List<SeatStrategy> strategies;
    private final int maxTurns;

    public RoundDriver(GameEngine engine, List<SeatStrategy> strategies, int maxTurns) {
        if (strategies.size() != GameState.SEAT_COUNT) {
            throw new IllegalArgumentException("需要 4 个座位策略：" + strategies.size());
        }
        this.engine = engine;
        this.strategies = new ArrayList<>(strategies);
        this.maxTurns = maxTurns;
    }

    public GameState play(TileAlphabet alphabet, long seed) {
        return playOut(engine.startRound(alphabet, seed));
    }

    public GameState play(DealResult deal, TileAlphabet alphabet, long seed) {
        return playOut(engine.startRound(deal, alphabet, seed));
    }

    /**
     * 推进到结束状态
     */
    public GameState playOut(GameState state) {
        while (!state.isTerminal()) {
            if (state.getTurnCount() >= maxTurns) {
                log.warn("种子 {} 达到回合上限 {}", state.getSeed(), maxTurns);
                engine.forceWallExhausted(state);
                break;
            }
            switch (state.getPhase()) {
                case AWAITING_DRAW:
                    engine.applyDraw(state);
                    break;
                case AWAITING_DISCARD:
                    takeTurn(state);
                    break;
                case AWAITING_CLAIMS:
                    collectClaims(state);
                    break;
                default:
                    throw new IllegalStateException("未知阶段：" + state.getPhase());
            }
        }
        return state;
    }

    private void takeTurn(GameState state) {
        int seat = state.getCurrentSeat();
        SeatStrategy strategy = strategies.get(seat);
        for (ClaimOption option : engine.selfQuadOptions(state)) {
            if (strategy.acceptSelfQuad(SeatView.of(state, seat), option)) {
                engine.applySelfQuad(state, option);
                return;
            }
        }
        Tile discard = strategy.chooseDiscard(SeatView.of(state, seat));
        engine.applyDiscard(state, discard);
    }

    private void collectClaims(GameState state) {
        List<ClaimOption> accepted = new ArrayList<>();
        for (ClaimOption option : engine.legalClaims(state)) {
            SeatView view = SeatView.of(state, option.getSeat());
            if (strategies.get(option.getSeat()).acceptClaim(view, option)) {
                accepted.add(option);
            }
        }
        engine.applyClaims(state, accepted);
    }
}
