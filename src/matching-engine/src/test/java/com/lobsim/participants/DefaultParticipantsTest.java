package com.lobsim.participants;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DefaultParticipantsTest {

    @Test
    void rosterIsOneMakerAndThreeTraders() {
        List<MarketParticipant> roster = DefaultParticipants.create(new Random(1), Clock.systemUTC());

        assertEquals(List.of("MM1", "AggressiveTrader", "PassiveTrader", "SmallTrader"),
                roster.stream().map(MarketParticipant::getName).collect(Collectors.toList()));
        assertInstanceOf(MarketMaker.class, roster.get(0));
        assertTrue(roster.subList(1, 4).stream().allMatch(p -> p instanceof RandomTrader));
    }
}
