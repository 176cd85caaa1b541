package com.sdmahjong.engine;

import com.sdmahjong.model.CompletionShape;
import com.sdmahjong.model.ShapeType;
import com.sdmahjong.model.Suit;
import com.sdmahjong.model.Tile;
import com.sdmahjong.model.TileAlphabet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 用固定种子随机生成的手牌检查胡牌判断和听牌计算
 */
public class RandomHandsTest {

    private static final int CASES = 3000;

    private static final List<Tile> EYE_TILES = new ArrayList<>();

    static {
        for (Tile tile : TileAlphabet.NUMERIC_ONLY.kinds()) {
            if (tile.isEyeEligible()) {
                EYE_TILES.add(tile);
            }
        }
    }

    @Test
    void groupsPlusEye_alwaysComplete() {
        Random random = new Random(20240101L);
        for (int i = 0; i < CASES; i++) {
            TileAlphabet alphabet = random.nextBoolean() ? TileAlphabet.NUMERIC_ONLY : TileAlphabet.WITH_HONORS;
            List<Tile> hand = completeHand(random, alphabet, 1 + random.nextInt(4));

            Optional<CompletionShape> shape = WinEvaluator.evaluate(hand, 0);
            assertTrue(shape.isPresent(), "应能胡：" + hand);
            if (shape.get().getType() == ShapeType.STANDARD) {
                assertTrue(shape.get().getEye().isEyeEligible(), "将必须是 2/5/8：" + hand);
            }
        }
    }

    @Test
    void groupsPlusEye_withWildcardsReplacingTiles_stillComplete() {
        Random random = new Random(7L);
        for (int i = 0; i < CASES; i++) {
            TileAlphabet alphabet = random.nextBoolean() ? TileAlphabet.NUMERIC_ONLY : TileAlphabet.WITH_HONORS;
            List<Tile> hand = completeHand(random, alphabet, 1 + random.nextInt(4));
            int wildcards = 1 + random.nextInt(Math.min(3, hand.size()));
            Collections.shuffle(hand, random);
            List<Tile> natural = new ArrayList<>(hand.subList(wildcards, hand.size()));

            assertTrue(WinEvaluator.isComplete(natural, wildcards),
                "财神替换 " + wildcards + " 张后应能胡：" + natural);
        }
    }

    @Test
    void waitingSet_agreesWithEvaluator_onHandsOneShort() {
        Random random = new Random(99L);
        for (int i = 0; i < CASES; i++) {
            TileAlphabet alphabet = random.nextBoolean() ? TileAlphabet.NUMERIC_ONLY : TileAlphabet.WITH_HONORS;
            List<Tile> hand = completeHand(random, alphabet, 1 + random.nextInt(4));
            Collections.shuffle(hand, random);
            int wildcards = random.nextInt(3);
            List<Tile> natural = new ArrayList<>(hand.subList(wildcards, hand.size()));
            if (natural.isEmpty()) {
                continue;
            }
            Tile removed = natural.remove(random.nextInt(natural.size()));

            Set<Tile> waiting = WaitingAnalyzer.waitingTiles(natural, wildcards, alphabet);
            assertTrue(waiting.contains(removed), "拿掉的牌应在听牌中：" + natural + " 缺 " + removed);
            assertWaitingConsistent(natural, wildcards, alphabet, waiting);
        }
    }

    @Test
    void waitingSet_agreesWithEvaluator_onRandomDeals() {
        Random random = new Random(4242L);
        for (int i = 0; i < CASES; i++) {
            TileAlphabet alphabet = random.nextBoolean() ? TileAlphabet.NUMERIC_ONLY : TileAlphabet.WITH_HONORS;
            List<Tile> deck = TileFactory.createFullDeck(alphabet);
            Collections.shuffle(deck, random);
            int size = 3 * (1 + random.nextInt(4)) + 1;
            int wildcards = random.nextInt(3);
            List<Tile> natural = new ArrayList<>(deck.subList(0, size - wildcards));

            Set<Tile> waiting = WaitingAnalyzer.waitingTiles(natural, wildcards, alphabet);
            assertWaitingConsistent(natural, wildcards, alphabet, waiting);
        }
    }

    private static void assertWaitingConsistent(List<Tile> natural, int wildcards, TileAlphabet alphabet,
                                                Set<Tile> waiting) {
        for (Tile candidate : alphabet.kinds()) {
            List<Tile> withCandidate = new ArrayList<>(natural);
            withCandidate.add(candidate);
            assertEquals(WinEvaluator.isComplete(withCandidate, wildcards), waiting.contains(candidate),
                natural + " + " + wildcards + " 财神，进张 " + candidate);
        }
    }

    /**
     * 随机生成 groups 组面子（顺子或刻子）加一对 2/5/8 将，同种牌不超过 4 张
     */
    private static List<Tile> completeHand(Random random, TileAlphabet alphabet, int groups) {
        while (true) {
            int[] counts = new int[Tile.KIND_COUNT];
            List<Tile> hand = new ArrayList<>();
            Tile eye = EYE_TILES.get(random.nextInt(EYE_TILES.size()));
            add(hand, counts, eye, 2);
            for (int g = 0; g < groups; g++) {
                if (random.nextBoolean()) {
                    Tile kind = alphabet.kinds().get(random.nextInt(alphabet.getKindCount()));
                    add(hand, counts, kind, 3);
                } else {
                    Suit suit = Suit.values()[random.nextInt(3)];
                    int start = 1 + random.nextInt(7);
                    for (int rank = start; rank < start + 3; rank++) {
                        add(hand, counts, Tile.of(suit, rank), 1);
                    }
                }
            }
            if (withinFourCopies(counts)) {
                return hand;
            }
        }
    }

    private static void add(List<Tile> hand, int[] counts, Tile tile, int copies) {
        for (int i = 0; i < copies; i++) {
            hand.add(tile);
        }
        counts[tile.getIndex()] += copies;
    }

    private static boolean withinFourCopies(int[] counts) {
        for (int c : counts) {
            if (c > 4) {
                return false;
            }
        }
        return true;
    }
}
