package com.lobsim.simulation;

import com.lobsim.domain.OrderType;
import com.lobsim.domain.Side;
import com.lobsim.logging.MatchingStats;
import com.lobsim.matching.InvalidOrderException;
import com.lobsim.matching.MatchingEngine;
import com.lobsim.metrics.MetricsRegistry;
import com.lobsim.participants.MarketParticipant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EngineCommandHandlerTest {

    @Mock
    private MarketParticipant first;

    @Mock
    private MarketParticipant second;

    private MatchingEngine engine;
    private MatchingStats stats;
    private RecordingVenue venue;
    private EngineCommandHandler handler;

    @BeforeEach
    void setUp() {
        engine = new MatchingEngine();
        stats = new MatchingStats();
        MetricsRegistry metrics = new MetricsRegistry();
        venue = new RecordingVenue(engine, stats, metrics, false);
        handler = new EngineCommandHandler(engine, venue, List.of(first, second), stats, metrics, 5);
    }

    @Test
    void tickRunsParticipantsInRosterOrder() {
        handler.onEvent(tick(), 0, true);

        InOrder order = inOrder(first, second);
        order.verify(first).act(venue);
        order.verify(second).act(venue);
        assertEquals(1, stats.ticksProcessed.get());
    }

    @Test
    void failingParticipantDoesNotStopTheTick() {
        when(first.getName()).thenReturn("broken");
        doThrow(new InvalidOrderException("invalid_price", "bad price")).when(first).act(any());

        handler.onEvent(tick(), 0, true);

        verify(second).act(venue);
    }

    @Test
    void unexpectedParticipantErrorIsContained() {
        when(first.getName()).thenReturn("broken");
        doThrow(new IllegalStateException("boom")).when(first).act(any());

        assertDoesNotThrow(() -> handler.onEvent(tick(), 7, true));
        verify(second).act(venue);
    }

    @Test
    void submitReachesEngineAndClearsSlot() {
        EngineCommand command = submit(Side.BUY, OrderType.LIMIT, 99.5, 10, "seed");

        handler.onEvent(command, 0, true);

        assertEquals(99.5, engine.getBestBid().getAsDouble());
        assertEquals(1, stats.buyOrdersReceived.get());
        assertNull(command.type);
        assertNull(command.owner);
        assertEquals(0, command.quantity);
    }

    @Test
    void invalidSubmitIsCountedNotThrown() {
        assertDoesNotThrow(() -> handler.onEvent(submit(Side.SELL, OrderType.LIMIT, 100.0, 0, "seed"), 0, true));

        assertEquals(1, stats.ordersInvalid.get());
        assertTrue(engine.getBook().isEmpty());
    }

    @Test
    void cancelCommandRemovesOrder() {
        handler.onEvent(submit(Side.SELL, OrderType.LIMIT, 101.0, 10, "seed"), 0, true);
        long id = engine.getOrderBook().getBestAsk().peekFirst().getId().value();

        EngineCommand cancel = new EngineCommand();
        cancel.type = EngineCommand.Type.CANCEL;
        cancel.receivedNanos = System.nanoTime();
        cancel.orderId = id;
        handler.onEvent(cancel, 1, true);

        assertTrue(engine.getBook().isEmpty());
        assertEquals(1, stats.cancelsSucceeded.get());
    }

    @Test
    void snapshotPublishedOnlyAtEndOfBatch() {
        handler.onEvent(submit(Side.BUY, OrderType.LIMIT, 99.0, 10, "seed"), 0, false);
        assertTrue(handler.getSnapshot().getBook().isEmpty());

        handler.onEvent(submit(Side.SELL, OrderType.LIMIT, 99.0, 4, "seed"), 1, true);

        MarketSnapshot snapshot = handler.getSnapshot();
        assertEquals(1, snapshot.getTradeCount());
        assertEquals(1, snapshot.getRestingOrders());
        assertEquals(99.0, snapshot.getLastTradePrice());
        assertEquals(1, snapshot.getRecentTrades().size());
        assertEquals(6, snapshot.getBook().totalBidQuantity());
    }

    @Test
    void emptySlotIsIgnored() {
        handler.onEvent(new EngineCommand(), 0, true);

        assertEquals(0, stats.ticksProcessed.get());
        assertEquals(100.0, handler.getSnapshot().getMidPrice());
    }

    @Test
    void commandLabelsIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("tick", EngineCommandHandler.commandLabel(EngineCommand.Type.TICK));
            assertEquals("submit", EngineCommandHandler.commandLabel(EngineCommand.Type.SUBMIT));
            assertEquals("cancel", EngineCommandHandler.commandLabel(EngineCommand.Type.CANCEL));
        } finally {
            Locale.setDefault(previous);
        }
    }

    private static EngineCommand tick() {
        EngineCommand command = new EngineCommand();
        command.type = EngineCommand.Type.TICK;
        command.receivedNanos = System.nanoTime();
        return command;
    }

    private static EngineCommand submit(Side side, OrderType type, double price, long qty, String owner) {
        EngineCommand command = new EngineCommand();
        command.type = EngineCommand.Type.SUBMIT;
        command.receivedNanos = System.nanoTime();
        command.side = side;
        command.orderType = type;
        command.price = price;
        command.quantity = qty;
        command.owner = owner;
        return command;
    }
}
