package com.sdmahjong.model;

import java.util.Objects;

/**
 * 胡牌结果：牌型，四扑一将时附带将牌
 */
public final class CompletionShape {

    private static final CompletionShape SEVEN_PAIRS = new CompletionShape(ShapeType.SEVEN_PAIRS, null);

    private final ShapeType type;
    private final Tile eye;

    private CompletionShape(ShapeType type, Tile eye) {
        this.type = type;
        this.eye = eye;
    }

    public static CompletionShape sevenPairs() {
        return SEVEN_PAIRS;
    }

    public static CompletionShape standard(Tile eye) {
        return new CompletionShape(ShapeType.STANDARD, Objects.requireNonNull(eye, "eye"));
    }

    public ShapeType getType() {
        return type;
    }

    /**
     * 将牌，七对为 null
     */
    public Tile getEye() {
        return eye;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompletionShape)) {
            return false;
        }
        CompletionShape other = (CompletionShape) o;
        return type == other.type && Objects.equals(eye, other.eye);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, eye);
    }

    @Override
    public String toString() {
        return type == ShapeType.SEVEN_PAIRS ? "七对" : "平胡(将=" + eye + ")";
    }
}
