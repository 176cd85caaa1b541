package com.sdmahjong.model;

/**
 * 胡牌牌型
 */
public enum ShapeType {
    SEVEN_PAIRS,    // 七对
    STANDARD        // 四扑一将（平胡）
}
