package com.sdmahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 牌种字母表：108 张（仅数牌，27 种）或 136 张（含字牌，34 种）
 */
public enum TileAlphabet {
    NUMERIC_ONLY(27),
    WITH_HONORS(34);

    private final int kindCount;
    private final List<Tile> kinds;

    TileAlphabet(int kindCount) {
        this.kindCount = kindCount;
        List<Tile> list = new ArrayList<>(kindCount);
        for (int i = 0; i < kindCount; i++) {
            list.add(Tile.fromIndex(i));
        }
        this.kinds = Collections.unmodifiableList(list);
    }

    public int getKindCount() {
        return kindCount;
    }

    /**
     * 按索引升序排列的全部牌种
     */
    public List<Tile> kinds() {
        return kinds;
    }

    public boolean contains(Tile tile) {
        return tile.getIndex() < kindCount;
    }

    public static TileAlphabet of(boolean includeHonors) {
        return includeHonors ? WITH_HONORS : NUMERIC_ONLY;
    }
}
