package com.sdmahjong.ai;

import com.sdmahjong.model.ClaimOption;
import com.sdmahjong.model.Tile;

/**
 * 座位决策：出哪张牌、要不要吃碰杠胡
 */
public interface SeatStrategy {

    /**
     * 选择要打出的牌，不能是财神
     */
    Tile chooseDiscard(SeatView view);

    /**
     * 是否执行别人打出的牌上的一个操作
     */
    boolean acceptClaim(SeatView view, ClaimOption option);

    /**
     * 出牌前是否声明这个杠
     */
    boolean acceptSelfQuad(SeatView view, ClaimOption option);
}
