package com.sdmahjong.model;

/**
 * 非法牌：索引越界、点数超出花色范围或无法识别的牌码
 */
public class InvalidTileException extends RuntimeException {

    public InvalidTileException(String message) {
        super(message);
    }
}
