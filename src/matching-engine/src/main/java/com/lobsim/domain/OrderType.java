package com.lobsim.domain;

/**
 * LIMIT orders carry a price and may rest. MARKET orders ignore price and never rest.
 */
public enum OrderType {
    LIMIT,
    MARKET
}
