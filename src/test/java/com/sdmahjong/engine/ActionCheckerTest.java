package com.sdmahjong.engine;

import com.sdmahjong.model.ClaimOption;
import com.sdmahjong.model.ClaimType;
import com.sdmahjong.model.Meld;
import com.sdmahjong.model.QuadKind;
import com.sdmahjong.model.Tile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ActionCheckerTest {

    private static Tile t(String code) {
        return TileCodes.parse(code);
    }

    private static PlayerSeat seat(int index, String codes) {
        PlayerSeat seat = new PlayerSeat(index);
        for (Tile tile : TileCodes.parseAll(codes)) {
            seat.addTile(tile);
        }
        return seat;
    }

    @Test
    void triplet_needsTwoCopies() {
        List<Tile> two = TileCodes.parseAll("3B 3B 1W 9T");
        List<Tile> one = TileCodes.parseAll("3B 1W 9T 9T");

        assertTrue(ActionChecker.canClaimTriplet(two, t("3B"), 2, 0, null));
        assertFalse(ActionChecker.canClaimTriplet(one, t("3B"), 2, 0, null));
        // 不能碰自己打出的牌
        assertFalse(ActionChecker.canClaimTriplet(two, t("3B"), 0, 0, null));
        // 财神不参与碰
        assertFalse(ActionChecker.canClaimTriplet(two, t("3B"), 2, 0, t("3B")));
    }

    @Test
    void quadClaim_needsThreeCopies() {
        assertTrue(ActionChecker.canClaimQuad(TileCodes.parseAll("7W 7W 7W 1B"), t("7W"), 3, 1, null));
        assertFalse(ActionChecker.canClaimQuad(TileCodes.parseAll("7W 7W 1B 1B"), t("7W"), 3, 1, null));
    }

    @Test
    void run_onlyFromPrecedingSeat() {
        List<Tile> hand = TileCodes.parseAll("4W 6W 1B 2B");
        // 座位 1 的上家是座位 0
        assertEquals(1, ActionChecker.runOptions(hand, t("5W"), 1, 0, null).size());
        // 座位 0 打出的牌，座位 2 不能吃
        assertTrue(ActionChecker.runOptions(hand, t("5W"), 2, 0, null).isEmpty());
        assertTrue(ActionChecker.runOptions(hand, t("5W"), 3, 0, null).isEmpty());
        // 座位 3 打出，座位 0 可以吃
        assertEquals(1, ActionChecker.runOptions(hand, t("5W"), 0, 3, null).size());
    }

    @Test
    void run_returnsAllCombinations() {
        List<List<Tile>> options = ActionChecker.runOptions(
            TileCodes.parseAll("3W 4W 6W 7W"), t("5W"), 1, 0, null);

        assertEquals(3, options.size());
        assertEquals(TileCodes.parseAll("3W 4W 5W"), options.get(0));
        assertEquals(TileCodes.parseAll("4W 5W 6W"), options.get(1));
        assertEquals(TileCodes.parseAll("5W 6W 7W"), options.get(2));
    }

    @Test
    void run_excludesHonorsAndWildcards() {
        assertTrue(ActionChecker.runOptions(TileCodes.parseAll("E W"), t("S"), 1, 0, null).isEmpty());
        // 6万 是财神，不能用来吃
        List<List<Tile>> options = ActionChecker.runOptions(
            TileCodes.parseAll("3W 4W 6W 7W"), t("5W"), 1, 0, t("6W"));
        assertEquals(Arrays.asList(TileCodes.parseAll("3W 4W 5W")), options);
    }

    @Test
    void checks_doNotModifyHand() {
        List<Tile> hand = new ArrayList<>(TileCodes.parseAll("3W 4W 6W 7W 5B 5B 5B 2T 2T 2T 8T 8T 9T"));
        List<Tile> before = new ArrayList<>(hand);

        ActionChecker.runOptions(hand, t("5W"), 1, 0, null);
        ActionChecker.canClaimWin(hand, t("5W"), null);
        ActionChecker.canClaimQuad(hand, t("5B"), 1, 0, null);

        assertEquals(before, hand);
    }

    @Test
    void win_onDiscard() {
        List<Tile> hand = TileCodes.parseAll("1W 2W 3W 4W 5W 6W 7W 8W 9W 1B 2B 3B 5T");
        assertTrue(ActionChecker.canClaimWin(hand, t("5T"), null));
        assertFalse(ActionChecker.canClaimWin(hand, t("4T"), null));
    }

    @Test
    void selfQuad_kindDependsOnDrawnTile() {
        PlayerSeat drawn = seat(1, "7B 7B 7B 7B 1W 2W 3W 4W 5W 6W 2T");
        assertEquals(Arrays.asList(ClaimOption.quad(1, t("7B"), -1, QuadKind.EXPOSED_BY_DRAW)),
            ActionChecker.selfQuadOptions(drawn, t("7B"), null));

        PlayerSeat concealed = seat(1, "7B 7B 7B 7B 1W 2W 3W 4W 5W 6W 2T");
        assertEquals(Arrays.asList(ClaimOption.quad(1, t("7B"), -1, QuadKind.CONCEALED)),
            ActionChecker.selfQuadOptions(concealed, t("2T"), null));
    }

    @Test
    void selfQuad_upgradeFromExposedTriplet() {
        PlayerSeat seat = seat(2, "2W 1B 2B 3B 4T 5T 6T 9T");
        seat.addMeld(Meld.triplet(t("2W"), 1));

        List<ClaimOption> options = ActionChecker.selfQuadOptions(seat, t("2W"), null);

        assertEquals(1, options.size());
        assertEquals(ClaimType.QUAD, options.get(0).getType());
        assertEquals(QuadKind.EXPOSED_BY_UPGRADE, options.get(0).getQuadKind());
        assertFalse(ActionChecker.canQuadByUpgrade(seat.getMelds(), seat.getHandTiles(), t("1B")));
    }

    @Test
    void wildcardKind_neverQuads() {
        PlayerSeat seat = seat(0, "9T 9T 9T 1W 2W 3W 4W 5W 6W 7W 8W");
        assertTrue(ActionChecker.selfQuadOptions(seat, t("9T"), t("9T")).isEmpty());
        assertFalse(ActionChecker.canQuadByDraw(TileCodes.parseAll("9T 9T 9T"), t("9T"), t("9T")));
        assertTrue(ActionChecker.canQuadByDraw(TileCodes.parseAll("9T 9T 9T"), t("9T"), null));
    }

    @Test
    void claimOptions_listsEveryLegalClaim() {
        PlayerSeat claimant = seat(1, "4W 4W 4W 5W 6W 2B 2B 3B 4B 7T 8T 9T 1T");

        List<ClaimOption> options = ActionChecker.claimOptions(claimant, t("4W"), 0, null);

        assertTrue(options.contains(ClaimOption.quad(1, t("4W"), 0, QuadKind.EXPOSED_BY_CLAIM)));
        assertTrue(options.contains(ClaimOption.triplet(1, t("4W"), 0)));
        assertTrue(options.contains(ClaimOption.run(1, t("4W"), 0, TileCodes.parseAll("4W 5W 6W"))));
        assertTrue(ActionChecker.claimOptions(claimant, t("4W"), 1, null).isEmpty());
    }
}
