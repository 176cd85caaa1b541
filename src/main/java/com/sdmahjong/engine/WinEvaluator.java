package com.sdmahjong.engine;

import com.sdmahjong.model.CompletionShape;
import com.sdmahjong.model.IllegalHandSizeException;
import com.sdmahjong.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 胡牌判断器
 * 山东麻将胡牌规则：
 * 1. 七对：14 张暗牌组成 7 个对子，每张财神可补一个缺的对子
 * 2. 四扑一将：n 组顺子/刻子 + 1 对将，将牌必须是万筒条的 2、5、8
 * 3. 财神可以当任意牌补刻子、顺子或将（补出的将同样受 2、5、8 限制）
 * 两种牌型按顺序检查，先满足者即返回，不比较番数高低。
 */
public final class WinEvaluator {

    private static final Logger log = LoggerFactory.getLogger(WinEvaluator.class);

    private static final int MAX_HAND_SIZE = 14;

    private WinEvaluator() {
    }

    /**
     * 检查是否胡牌
     *
     * @param naturalTiles 手中的自然牌（不含财神）
     * @param wildcardCount 手中财神张数
     * @return 胡牌牌型；不能胡返回 empty
     */
    public static Optional<CompletionShape> evaluate(List<Tile> naturalTiles, int wildcardCount) {
        return evaluate(toCounts(naturalTiles), wildcardCount);
    }

    /**
     * 检查是否胡牌（手牌为实际牌，财神牌在手中的张数自动计为财神）
     */
    public static Optional<CompletionShape> evaluateHand(List<Tile> handTiles, Tile wildcardTile) {
        int[] counts = toCounts(handTiles);
        int wildcards = 0;
        if (wildcardTile != null) {
            wildcards = counts[wildcardTile.getIndex()];
            counts[wildcardTile.getIndex()] = 0;
        }
        return evaluate(counts, wildcards);
    }

    public static boolean isComplete(List<Tile> naturalTiles, int wildcardCount) {
        return evaluate(naturalTiles, wildcardCount).isPresent();
    }

    /**
     * 计数版入口，counts 长度为 {@link Tile#KIND_COUNT}，不会被修改
     */
    public static Optional<CompletionShape> evaluate(int[] counts, int wildcardCount) {
        if (wildcardCount < 0) {
            throw new IllegalHandSizeException("财神张数不能为负：" + wildcardCount);
        }
        int total = wildcardCount;
        for (int c : counts) {
            total += c;
        }
        // 张数约束：暗牌总数必须满足 3n+2，且不超过 14 张
        if (total < 2 || total > MAX_HAND_SIZE || total % 3 != 2) {
            throw new IllegalHandSizeException("胡牌判断的手牌张数必须是 3n+2（≤14），实际：" + total);
        }

        int[] work = counts.clone();

        if (total == MAX_HAND_SIZE && isSevenPairs(work, wildcardCount)) {
            log.debug("七对");
            return Optional.of(CompletionShape.sevenPairs());
        }

        Tile eye = findStandardEye(work, wildcardCount, (total - 2) / 3);
        if (eye != null) {
            log.debug("四扑一将，将={}", eye);
            return Optional.of(CompletionShape.standard(eye));
        }
        return Optional.empty();
    }

    /**
     * 七对：自然对子数 + 财神数 ≥ 7
     */
    private static boolean isSevenPairs(int[] counts, int wildcardCount) {
        int pairs = 0;
        for (int c : counts) {
            pairs += c / 2;
        }
        return pairs + wildcardCount >= 7;
    }

    /**
     * 枚举 2、5、8 将，去掉将后剩余牌全部拆成面子
     * 将的三种来源：两张自然牌 / 一张自然牌 + 一张财神 / 两张财神
     */
    private static Tile findStandardEye(int[] counts, int wildcardCount, int groupsNeeded) {
        for (int index = 0; index < 27; index++) {
            Tile candidate = Tile.fromIndex(index);
            if (!candidate.isEyeEligible()) {
                continue;
            }
            int have = counts[index];
            for (int natural = Math.min(2, have); natural >= 0; natural--) {
                int wild = 2 - natural;
                if (wild > wildcardCount) {
                    continue;
                }
                counts[index] -= natural;
                boolean ok = formGroups(counts, wildcardCount - wild, groupsNeeded);
                counts[index] += natural;
                if (ok) {
                    return candidate;
                }
            }
        }
        return null;
    }

    /**
     * 检查“剩余牌 + 剩余财神”能否恰好拆成 groupsNeeded 组面子（AAA/ABC）。
     * 每次只从索引最小的一张牌开始组面子，回溯时显式恢复计数。
     */
    static boolean formGroups(int[] counts, int wildcards, int groupsNeeded) {
        int index = firstNonZero(counts);

        // 已经没有自然牌了：剩余的面子全靠财神凑
        if (index < 0) {
            return wildcards >= groupsNeeded * 3;
        }
        // 面子已够但还有自然牌剩余
        if (groupsNeeded == 0) {
            return false;
        }

        // 尝试一：刻子 AAA（缺的用财神补）
        int use = Math.min(3, counts[index]);
        int need = 3 - use;
        if (need <= wildcards) {
            counts[index] -= use;
            boolean ok = formGroups(counts, wildcards - need, groupsNeeded - 1);
            counts[index] += use;
            if (ok) {
                return true;
            }
        }

        // 尝试二：万筒条的顺子 ABC。
        // 比当前牌小的位置已经没有自然牌，只能由财神充当
        if (index < 27) {
            int rank = index % 9 + 1;
            for (int start = Math.max(1, rank - 2); start <= Math.min(rank, 7); start++) {
                int base = index - (rank - start);
                int[] used = new int[3];
                int have = 0;
                for (int k = 0; k < 3; k++) {
                    if (base + k >= index && counts[base + k] > 0) {
                        used[k] = 1;
                        have++;
                    }
                }
                int missing = 3 - have;
                if (missing > wildcards) {
                    continue;
                }
                for (int k = 0; k < 3; k++) {
                    counts[base + k] -= used[k];
                }
                boolean ok = formGroups(counts, wildcards - missing, groupsNeeded - 1);
                for (int k = 0; k < 3; k++) {
                    counts[base + k] += used[k];
                }
                if (ok) {
                    return true;
                }
            }
        }

        // 无法通过任何一种拆分
        return false;
    }

    private static int firstNonZero(int[] counts) {
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 将牌列表转换为“计数数组”
     */
    static int[] toCounts(List<Tile> tiles) {
        int[] counts = new int[Tile.KIND_COUNT];
        for (Tile tile : tiles) {
            counts[tile.getIndex()]++;
        }
        return counts;
    }
}
