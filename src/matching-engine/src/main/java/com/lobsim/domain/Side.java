package com.lobsim.domain;

/**
 * Side of an order. BUY orders rest on the bid side, SELL orders on the ask side.
 */
public enum Side {
    BUY,
    SELL;

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }
}
