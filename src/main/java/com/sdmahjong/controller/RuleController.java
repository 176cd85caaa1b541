package com.sdmahjong.controller;

import com.sdmahjong.engine.ActionChecker;
import com.sdmahjong.engine.ScoreCalculator;
import com.sdmahjong.engine.TileCodes;
import com.sdmahjong.engine.WaitingAnalyzer;
import com.sdmahjong.engine.WinEvaluator;
import com.sdmahjong.model.ClaimOption;
import com.sdmahjong.model.CompletionShape;
import com.sdmahjong.model.ShapeType;
import com.sdmahjong.model.Tile;
import com.sdmahjong.model.TileAlphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 规则查询接口（无状态）：胡牌判断、听牌、吃碰杠胡选项、计分
 */
@Controller
public class RuleController {

    private static final Logger log = LoggerFactory.getLogger(RuleController.class);

    /**
     * 胡牌判断
     */
    @PostMapping("/api/rules/win-check")
    @ResponseBody
    public Map<String, Object> winCheck(@RequestBody WinCheckRequest request) {
        List<Tile> tiles = TileCodes.parseAll(request.getTiles());
        Optional<CompletionShape> shape = WinEvaluator.evaluate(tiles, request.getWildcards());
        log.debug("胡牌判断：{} + {}张财神 -> {}", tiles, request.getWildcards(), shape);

        Map<String, Object> response = new HashMap<>();
        response.put("complete", shape.isPresent());
        response.put("shape", shape.map(s -> s.getType().name()).orElse(null));
        Tile eye = shape.map(CompletionShape::getEye).orElse(null);
        response.put("eye", eye == null ? null : eye.getDisplayName());
        return response;
    }

    /**
     * 听牌分析
     */
    @PostMapping("/api/rules/waiting")
    @ResponseBody
    public Map<String, Object> waiting(@RequestBody WaitingRequest request) {
        List<Tile> tiles = TileCodes.parseAll(request.getTiles());
        TileAlphabet alphabet = TileAlphabet.of(request.isIncludeHonors());
        List<String> labels = new ArrayList<>();
        for (Tile tile : WaitingAnalyzer.waitingTiles(tiles, request.getWildcards(), alphabet)) {
            labels.add(tile.getDisplayName());
        }
        Map<String, Object> response = new HashMap<>();
        response.put("waiting", labels);
        return response;
    }

    /**
     * 某个座位对一张打出的牌可以做的操作
     */
    @PostMapping("/api/rules/claims")
    @ResponseBody
    public List<Map<String, Object>> claims(@RequestBody ClaimsRequest request) {
        List<Tile> hand = TileCodes.parseAll(request.getTiles());
        Tile claimed = TileCodes.parse(request.getClaimedTile());
        Tile wildcard = request.getWildcardTile() == null ? null : TileCodes.parse(request.getWildcardTile());

        List<Map<String, Object>> response = new ArrayList<>();
        for (ClaimOption option : ActionChecker.claimOptions(hand, request.getClaimantSeat(), claimed,
            request.getDiscarderSeat(), wildcard)) {
            Map<String, Object> item = new HashMap<>();
            item.put("type", option.getType().name());
            item.put("tile", option.getTile().getDisplayName());
            if (!option.getRunTiles().isEmpty()) {
                List<String> run = new ArrayList<>();
                for (Tile t : option.getRunTiles()) {
                    run.add(t.getDisplayName());
                }
                item.put("runTiles", run);
            }
            if (option.getQuadKind() != null) {
                item.put("quadKind", option.getQuadKind().name());
            }
            response.add(item);
        }
        return response;
    }

    /**
     * 计算番数
     */
    @PostMapping("/api/rules/score")
    @ResponseBody
    public Map<String, Object> score(@RequestBody ScoreRequest request) {
        if (request.getShape() == null) {
            throw new IllegalArgumentException("缺少牌型");
        }
        int score = ScoreCalculator.score(request.getShape(), request.getQuadCount(), request.isSelfDraw(),
            request.isDealer(), request.getWildcards());
        Map<String, Object> response = new HashMap<>();
        response.put("score", score);
        return response;
    }

    // === 请求对象 ===

    public static class WinCheckRequest {
        private List<String> tiles = new ArrayList<>();
        private int wildcards;

        public List<String> getTiles() { return tiles; }
        public void setTiles(List<String> tiles) { this.tiles = tiles; }
        public int getWildcards() { return wildcards; }
        public void setWildcards(int wildcards) { this.wildcards = wildcards; }
    }

    public static class WaitingRequest {
        private List<String> tiles = new ArrayList<>();
        private int wildcards;
        private boolean includeHonors;

        public List<String> getTiles() { return tiles; }
        public void setTiles(List<String> tiles) { this.tiles = tiles; }
        public int getWildcards() { return wildcards; }
        public void setWildcards(int wildcards) { this.wildcards = wildcards; }
        public boolean isIncludeHonors() { return includeHonors; }
        public void setIncludeHonors(boolean includeHonors) { this.includeHonors = includeHonors; }
    }

    public static class ClaimsRequest {
        private List<String> tiles = new ArrayList<>();
        private String claimedTile;
        private String wildcardTile;
        private int claimantSeat;
        private int discarderSeat;

        public List<String> getTiles() { return tiles; }
        public void setTiles(List<String> tiles) { this.tiles = tiles; }
        public String getClaimedTile() { return claimedTile; }
        public void setClaimedTile(String claimedTile) { this.claimedTile = claimedTile; }
        public String getWildcardTile() { return wildcardTile; }
        public void setWildcardTile(String wildcardTile) { this.wildcardTile = wildcardTile; }
        public int getClaimantSeat() { return claimantSeat; }
        public void setClaimantSeat(int claimantSeat) { this.claimantSeat = claimantSeat; }
        public int getDiscarderSeat() { return discarderSeat; }
        public void setDiscarderSeat(int discarderSeat) { this.discarderSeat = discarderSeat; }
    }

    public static class ScoreRequest {
        private ShapeType shape;
        private int quadCount;
        private boolean selfDraw;
        private boolean dealer;
        private int wildcards;

        public ShapeType getShape() { return shape; }
        public void setShape(ShapeType shape) { this.shape = shape; }
        public int getQuadCount() { return quadCount; }
        public void setQuadCount(int quadCount) { this.quadCount = quadCount; }
        public boolean isSelfDraw() { return selfDraw; }
        public void setSelfDraw(boolean selfDraw) { this.selfDraw = selfDraw; }
        public boolean isDealer() { return dealer; }
        public void setDealer(boolean dealer) { this.dealer = dealer; }
        public int getWildcards() { return wildcards; }
        public void setWildcards(int wildcards) { this.wildcards = wildcards; }
    }
}
