package com.lobsim.participants;

import com.lobsim.domain.Fill;
import com.lobsim.matching.TradingVenue;

/**
 * A simulated trader. The driver calls {@link #act(TradingVenue)} once per tick
 * and routes every fill on the participant's orders to {@link #onFill(Fill)}.
 */
public interface MarketParticipant {

    /**
     * Owner identifier stamped on every order this participant submits.
     */
    String getName();

    void act(TradingVenue venue);

    default void onFill(Fill fill) {
    }
}
