package com.lobsim.logging;

import com.lobsim.domain.BookLevel;
import com.lobsim.domain.OrderId;
import com.lobsim.domain.Side;
import com.lobsim.domain.Trade;
import com.lobsim.simulation.MarketSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeriodicStatsLoggerTest {

    @Test
    void formatsLevels() {
        String formatted = PeriodicStatsLogger.formatLevels(
                List.of(new BookLevel(99.5, 10, 1), new BookLevel(99.0, 25, 2)));

        assertEquals("99.50x10 99.00x25", formatted);
        assertEquals("", PeriodicStatsLogger.formatLevels(List.of()));
    }

    @Test
    void formatsTrades() {
        String formatted = PeriodicStatsLogger.formatTrades(List.of(
                new Trade(2, 0, 100.5, 3, Side.BUY, new OrderId(3), new OrderId(1)),
                new Trade(1, 0, 100.0, 7, Side.SELL, new OrderId(4), new OrderId(2))));

        assertEquals("BUY 3@100.50, SELL 7@100.00", formatted);
    }

    @Test
    void summariesReadCountersAndSnapshot() {
        MatchingStats stats = new MatchingStats();
        stats.buyOrdersReceived.addAndGet(5);
        stats.tradesExecuted.addAndGet(2);
        PeriodicStatsLogger logger = new PeriodicStatsLogger(stats, () -> MarketSnapshot.initial(100.0), 1);

        assertDoesNotThrow(logger::logSummary);
        assertDoesNotThrow(logger::logShutdownSummary);
        logger.stop();
    }
}
