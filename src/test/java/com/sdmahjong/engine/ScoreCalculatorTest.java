package com.sdmahjong.engine;

import com.sdmahjong.model.CompletionShape;
import com.sdmahjong.model.ShapeType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ScoreCalculatorTest {

    @Test
    void baseScores() {
        assertEquals(4, ScoreCalculator.score(ShapeType.SEVEN_PAIRS, 0, false, false, 0));
        assertEquals(1, ScoreCalculator.score(ShapeType.STANDARD, 0, false, false, 0));
    }

    @Test
    void bonusesAreAdditive() {
        // 平胡 1 + 杠 2×2 + 自摸 1 + 庄家 1 + 财神 1×3
        assertEquals(10, ScoreCalculator.score(ShapeType.STANDARD, 2, true, true, 3));
        assertEquals(6, ScoreCalculator.score(CompletionShape.sevenPairs(), 0, true, false, 1));
    }

    @Test
    void remainingTiles_flooredAtZero() {
        assertEquals(4, TileTracker.remaining(TileCodes.parse("5W"), TileCodes.parseAll("1W 2W")));
        assertEquals(1, TileTracker.remaining(TileCodes.parse("5W"), TileCodes.parseAll("5W 5W 5W 1B")));
        assertEquals(0, TileTracker.remaining(TileCodes.parse("5W"),
            Arrays.asList(TileCodes.parse("5W"), TileCodes.parse("5W"), TileCodes.parse("5W"),
                TileCodes.parse("5W"), TileCodes.parse("5W"))));
    }
}
