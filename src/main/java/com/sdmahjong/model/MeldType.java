package com.sdmahjong.model;

/**
 * 面子类型
 */
public enum MeldType {
    TRIPLET,    // 刻子（碰）
    RUN,        // 顺子（吃）
    QUAD        // 杠
}
