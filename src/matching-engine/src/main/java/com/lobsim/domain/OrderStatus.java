package com.lobsim.domain;

/**
 * Order lifecycle.
 *
 * LIMIT:  PENDING -> RESTING -> FILLED | CANCELLED
 * MARKET: PENDING -> FILLED (partial or full) | REJECTED
 */
public enum OrderStatus {
    PENDING,
    RESTING,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }
}
