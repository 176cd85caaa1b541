package com.sdmahjong.model;

/**
 * 本局结束原因
 */
public enum TerminalReason {
    SELF_DRAW_WIN,      // 自摸
    DISCARD_WIN,        // 点炮（含抢杠胡）
    WALL_EXHAUSTED      // 荒庄
}
