package com.lobsim.participants;

import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * The stock roster: one market maker quoting around mid, plus three random
 * traders with different temperaments.
 */
public final class DefaultParticipants {

    private DefaultParticipants() {
    }

    public static List<MarketParticipant> create(Random random, Clock clock) {
        return List.of(
                new MarketMaker("MM1", random),
                new RandomTrader("AggressiveTrader", 3.0, 0.4, 30, 30, random, clock),
                new RandomTrader("PassiveTrader", 8.0, 0.2, 20, 15, random, clock),
                new RandomTrader("SmallTrader", 2.0, 0.8, 10, 10, random, clock));
    }
}
