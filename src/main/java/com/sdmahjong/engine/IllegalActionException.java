package com.sdmahjong.engine;

/**
 * 状态机拒绝的操作：阶段不对、手中没有这张牌、操作不合法
 */
public class IllegalActionException extends RuntimeException {

    public IllegalActionException(String message) {
        super(message);
    }
}
