package com.sdmahjong.engine;

/**
 * 牌数不足以发牌（配置错误）
 */
public class InsufficientTilesException extends RuntimeException {

    public InsufficientTilesException(String message) {
        super(message);
    }
}
