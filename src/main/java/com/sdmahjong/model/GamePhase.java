package com.sdmahjong.model;

/**
 * 一局中的回合阶段
 */
public enum GamePhase {
    AWAITING_DRAW,      // 等待当前玩家摸牌
    AWAITING_DISCARD,   // 等待当前玩家出牌（可先暗杠/明杠/加杠）
    AWAITING_CLAIMS,    // 有人出牌（或加杠）后，等待其他玩家吃碰杠胡
    TERMINAL            // 本局结束
}
