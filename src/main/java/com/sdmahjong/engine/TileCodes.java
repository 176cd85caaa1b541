package com.sdmahjong.engine;

import com.sdmahjong.model.InvalidTileException;
import com.sdmahjong.model.Suit;
import com.sdmahjong.model.Tile;

import java.util.ArrayList;
import java.util.List;

/**
 * 牌码解析，用于预设牌墙、测试手牌和 HTTP 查询。
 * <ul>
 *   <li>万：1W～9W</li>
 *   <li>筒：1B～9B</li>
 *   <li>条：1T～9T</li>
 *   <li>风：E=东 S=南 W=西 N=北</li>
 *   <li>箭：Z=中 F=发 P=白</li>
 * </ul>
 * 也接受显示名称（如 "3万"、"东"）。
 */
public final class TileCodes {

    private static final String FENG_CODES = "ESWN";
    private static final String JIAN_CODES = "ZFP";
    private static final String FENG_LABELS = "东南西北";
    private static final String JIAN_LABELS = "中发白";

    private TileCodes() {
    }

    /**
     * 解析单张牌码
     */
    public static Tile parse(String code) {
        if (code == null || code.trim().isEmpty()) {
            throw new InvalidTileException("牌码为空");
        }
        String s = code.trim().toUpperCase();
        if (s.length() == 1) {
            char c = s.charAt(0);
            int feng = FENG_CODES.indexOf(c) >= 0 ? FENG_CODES.indexOf(c) : FENG_LABELS.indexOf(c);
            if (feng >= 0) {
                return new Tile(Suit.FENG, feng + 1);
            }
            int jian = JIAN_CODES.indexOf(c) >= 0 ? JIAN_CODES.indexOf(c) : JIAN_LABELS.indexOf(c);
            if (jian >= 0) {
                return new Tile(Suit.JIAN, jian + 1);
            }
            throw new InvalidTileException("无法识别的牌码：" + code);
        }
        if (s.length() == 2 && s.charAt(0) >= '1' && s.charAt(0) <= '9') {
            int rank = s.charAt(0) - '0';
            switch (s.charAt(1)) {
                case 'W':
                case '万':
                    return new Tile(Suit.WAN, rank);
                case 'B':
                case '筒':
                    return new Tile(Suit.TONG, rank);
                case 'T':
                case '条':
                    return new Tile(Suit.TIAO, rank);
                default:
                    break;
            }
        }
        throw new InvalidTileException("无法识别的牌码：" + code);
    }

    /**
     * 解析空白分隔的一串牌码，如 "1W 2W 3W E E"
     */
    public static List<Tile> parseAll(String codes) {
        List<Tile> tiles = new ArrayList<>();
        if (codes == null) {
            return tiles;
        }
        for (String code : codes.trim().split("\\s+")) {
            if (!code.isEmpty()) {
                tiles.add(parse(code));
            }
        }
        return tiles;
    }

    public static List<Tile> parseAll(List<String> codes) {
        List<Tile> tiles = new ArrayList<>(codes.size());
        for (String code : codes) {
            tiles.add(parse(code));
        }
        return tiles;
    }

    /**
     * 牌 -> 牌码
     */
    public static String toCode(Tile tile) {
        switch (tile.getSuit()) {
            case WAN:
                return tile.getRank() + "W";
            case TONG:
                return tile.getRank() + "B";
            case TIAO:
                return tile.getRank() + "T";
            case FENG:
                return String.valueOf(FENG_CODES.charAt(tile.getRank() - 1));
            default:
                return String.valueOf(JIAN_CODES.charAt(tile.getRank() - 1));
        }
    }
}
