package com.sdmahjong.model;

/**
 * 手牌张数或同种牌张数不合法（调用方编程错误）
 */
public class IllegalHandSizeException extends RuntimeException {

    public IllegalHandSizeException(String message) {
        super(message);
    }
}
