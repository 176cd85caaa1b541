package com.sdmahjong.service;

import com.sdmahjong.engine.GameState;
import com.sdmahjong.model.ShapeType;
import com.sdmahjong.model.TerminalReason;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 批量模拟结果统计
 */
public class SimulationSummary {

    private int rounds;
    private final int[] winsPerSeat = new int[GameState.SEAT_COUNT];
    private int selfDrawWins;
    private int discardWins;
    private int wallExhausted;
    private long totalTurns;
    private long totalScore;
    private final Map<ShapeType, Integer> shapeCounts = new EnumMap<>(ShapeType.class);

    /**
     * 计入一局结束的结果
     */
    void record(GameState state) {
        rounds++;
        totalTurns += state.getTurnCount();
        TerminalReason reason = state.getTerminalReason();
        if (reason == TerminalReason.WALL_EXHAUSTED) {
            wallExhausted++;
            return;
        }
        if (reason == TerminalReason.SELF_DRAW_WIN) {
            selfDrawWins++;
        } else {
            discardWins++;
        }
        winsPerSeat[state.getWinnerSeat()]++;
        totalScore += state.getWinningScore();
        shapeCounts.merge(state.getCompletionShape().getType(), 1, Integer::sum);
    }

    public int getRounds() {
        return rounds;
    }

    public List<Integer> getWinsPerSeat() {
        List<Integer> wins = new ArrayList<>();
        for (int w : winsPerSeat) {
            wins.add(w);
        }
        return Collections.unmodifiableList(wins);
    }

    public int getSelfDrawWins() {
        return selfDrawWins;
    }

    public int getDiscardWins() {
        return discardWins;
    }

    public int getWallExhausted() {
        return wallExhausted;
    }

    public Map<ShapeType, Integer> getShapeCounts() {
        return Collections.unmodifiableMap(shapeCounts);
    }

    public double getAverageTurns() {
        return rounds == 0 ? 0 : (double) totalTurns / rounds;
    }

    /**
     * 胡牌局的平均番数
     */
    public double getAverageScore() {
        int wins = selfDrawWins + discardWins;
        return wins == 0 ? 0 : (double) totalScore / wins;
    }

    @Override
    public String toString() {
        return String.format("共%d局：自摸%d，点炮%d，荒庄%d，各家胡牌%s，平均%.1f回合，平均%.2f番",
            rounds, selfDrawWins, discardWins, wallExhausted, getWinsPerSeat(), getAverageTurns(), getAverageScore());
    }
}
