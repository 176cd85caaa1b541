package com.sdmahjong.engine;

import com.sdmahjong.model.CompletionShape;
import com.sdmahjong.model.ShapeType;

/**
 * 计番
 * 山东麻将计番规则：七对 4 番，平胡 1 番；每个杠 +2，自摸 +1，庄家 +1，每张财神 +1
 */
public final class ScoreCalculator {

    public static final int SEVEN_PAIRS_BASE = 4;
    public static final int STANDARD_BASE = 1;
    public static final int PER_QUAD = 2;
    public static final int SELF_DRAW_BONUS = 1;
    public static final int DEALER_BONUS = 1;
    public static final int PER_WILDCARD = 1;

    private ScoreCalculator() {
    }

    public static int score(CompletionShape shape, int quadCount, boolean selfDraw,
                            boolean dealer, int wildcardCount) {
        return score(shape.getType(), quadCount, selfDraw, dealer, wildcardCount);
    }

    public static int score(ShapeType shape, int quadCount, boolean selfDraw,
                            boolean dealer, int wildcardCount) {
        int fan = shape == ShapeType.SEVEN_PAIRS ? SEVEN_PAIRS_BASE : STANDARD_BASE;
        fan += Math.max(0, quadCount) * PER_QUAD;
        if (selfDraw) {
            fan += SELF_DRAW_BONUS;
        }
        if (dealer) {
            fan += DEALER_BONUS;
        }
        fan += Math.max(0, wildcardCount) * PER_WILDCARD;
        return fan;
    }
}
