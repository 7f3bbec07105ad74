package com.lobsim.participants;

import com.lobsim.domain.BookLevel;
import com.lobsim.domain.BookSnapshot;
import com.lobsim.domain.Fill;
import com.lobsim.domain.OrderId;
import com.lobsim.domain.OrderType;
import com.lobsim.domain.Side;
import com.lobsim.matching.MatchingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class MarketMakerTest {

    private MatchingEngine engine;
    private MarketMaker maker;

    @BeforeEach
    void setUp() {
        engine = new MatchingEngine(100.0, Clock.systemUTC());
        maker = new MarketMaker("MM1", new Random(7));
    }

    @Test
    void quotesLadderAroundMid() {
        maker.act(engine);

        BookSnapshot book = engine.getBook();
        assertEquals(List.of(99.5, 99.17, 98.83), prices(book.getBids()));
        assertEquals(List.of(100.5, 100.83, 101.17), prices(book.getAsks()));
        for (BookLevel level : book.getBids()) {
            assertTrue(level.quantity() >= 5 && level.quantity() <= 15);
        }
        assertEquals(6, maker.getActiveOrders().size());
        assertEquals(100.0, maker.getLastMidPrice());
    }

    @Test
    void cancelsAndRequotesEveryTick() {
        MatchingEngine venue = spy(engine);

        maker.act(venue);
        Set<OrderId> first = maker.getActiveOrders();
        maker.act(venue);
        Set<OrderId> second = maker.getActiveOrders();

        verify(venue, times(6)).cancel(any(OrderId.class));
        verify(venue, times(12)).submit(any(Side.class), eq(OrderType.LIMIT), anyDouble(), anyLong(), eq("MM1"));
        assertTrue(second.stream().noneMatch(first::contains));
        assertEquals(6, venue.getOrderBook().getOrderCount(), "Old quotes are gone");
    }

    @Test
    void longInventoryWidensSpreadAndShadesBidsDown() {
        maker.onFill(fill(Side.BUY, 40, 0));
        assertEquals(40, maker.getInventory());

        maker.act(engine);

        assertEquals(99.45, engine.getBestBid().getAsDouble(), 1e-9);
        assertEquals(100.51, engine.getBestAsk().getAsDouble(), 1e-9);
    }

    @Test
    void shortInventoryShadesAsksUp() {
        maker.onFill(fill(Side.SELL, 40, 0));
        assertEquals(-40, maker.getInventory());

        maker.act(engine);

        assertEquals(99.49, engine.getBestBid().getAsDouble(), 1e-9);
        assertEquals(100.55, engine.getBestAsk().getAsDouble(), 1e-9);
    }

    @Test
    void volatilityIsPopulationStdDevOverWindow() {
        assertEquals(0.0, maker.calculateVolatility(), "Needs two samples");

        maker.updatePriceHistory(99.0);
        maker.updatePriceHistory(101.0);
        assertEquals(1.0, maker.calculateVolatility(), 1e-12);
        assertEquals(1.5, maker.calculateSpread(maker.calculateVolatility()), 1e-12);

        for (int i = 0; i < 10; i++) {
            maker.updatePriceHistory(100.0);
        }
        assertEquals(0.0, maker.calculateVolatility(), 1e-12, "Old samples leave the window");
    }

    @Test
    void partialFillKeepsOrderTracked() {
        maker.act(engine);
        OrderId quoted = maker.getActiveOrders().iterator().next();

        maker.onFill(new Fill(quoted, "MM1", Side.SELL, 100.5, 2, 3, false, 0));
        assertTrue(maker.getActiveOrders().contains(quoted));

        maker.onFill(new Fill(quoted, "MM1", Side.SELL, 100.5, 3, 0, false, 0));
        assertFalse(maker.getActiveOrders().contains(quoted));
        assertEquals(-5, maker.getInventory());
    }

    @Test
    void tradesAgainstQuotesUpdateInventory() {
        engine.addFillListener(maker::onFill);
        maker.act(engine);

        engine.submit(Side.BUY, OrderType.MARKET, 0, 3, "taker");

        assertEquals(-3, maker.getInventory());
    }

    @Test
    void ignoresFillsOnOtherOwnersOrders() {
        maker.onFill(new Fill(new OrderId(5), "taker", Side.BUY, 100.0, 7, 0, true, 0));

        assertEquals(0, maker.getInventory());
    }

    @Test
    void skipsNonPositivePrices() {
        MatchingEngine cheap = new MatchingEngine(0.5, Clock.systemUTC());

        maker.act(cheap);

        assertTrue(cheap.getBook().getBids().isEmpty());
        assertEquals(3, cheap.getBook().getAsks().size());
    }

    @Test
    void rejectsInconsistentParameters() {
        assertThrows(IllegalArgumentException.class,
                () -> new MarketMaker("bad", 1.0, 100, 3, 20, 10, 10, 0.05, 0.5, new Random()));
        assertThrows(IllegalArgumentException.class,
                () -> new MarketMaker("bad", 1.0, 0, 3, 5, 15, 10, 0.05, 0.5, new Random()));
    }

    @Test
    void roundsToCents() {
        assertEquals(99.17, MarketMaker.roundToCents(99.16666), 1e-12);
        assertEquals(100.0, MarketMaker.roundToCents(99.999), 1e-12);
    }

    private static Fill fill(Side side, long qty, long remaining) {
        return new Fill(new OrderId(999), "MM1", side, 100.0, qty, remaining, false, 0);
    }

    private static List<Double> prices(List<BookLevel> levels) {
        return levels.stream().map(BookLevel::price).collect(Collectors.toList());
    }
}
