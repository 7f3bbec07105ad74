package com.lobsim.simulation;

import com.lmax.disruptor.EventHandler;
import com.lobsim.domain.OrderId;
import com.lobsim.domain.OrderRequest;
import com.lobsim.domain.OrderBook;
import com.lobsim.logging.MatchingStats;
import com.lobsim.matching.InvalidOrderException;
import com.lobsim.matching.MatchingEngine;
import com.lobsim.metrics.MetricsRegistry;
import com.lobsim.participants.MarketParticipant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * The single-threaded command processor. Implements EventHandler&lt;EngineCommand&gt;.
 *
 * This handler runs on a SINGLE thread managed by the Disruptor's BatchEventProcessor
 * and is the only code that touches the matching engine. Every submit, cancel and
 * tick runs to completion before the next command, so the whole engine state is one
 * unit of mutual exclusion without any locks.
 *
 * Processing per command:
 * 1. TICK: every participant acts once, in roster order
 * 2. SUBMIT: the order goes to the engine through the recording venue
 * 3. CANCEL: the order id is cancelled through the recording venue
 * 4. Record command duration
 * 5. On endOfBatch: update book gauges and publish a fresh MarketSnapshot
 */
public class EngineCommandHandler implements EventHandler<EngineCommand> {

    private static final Logger logger = LoggerFactory.getLogger(EngineCommandHandler.class);

    private static final int RECENT_TRADES = 10;

    private final MatchingEngine engine;
    private final RecordingVenue venue;
    private final List<MarketParticipant> participants;
    private final MatchingStats stats;
    private final MetricsRegistry metrics;
    private final int summaryDepth;

    private volatile MarketSnapshot snapshot;

    public EngineCommandHandler(MatchingEngine engine, RecordingVenue venue,
                                List<MarketParticipant> participants, MatchingStats stats,
                                MetricsRegistry metrics, int summaryDepth) {
        this.engine = engine;
        this.venue = venue;
        this.participants = List.copyOf(participants);
        this.stats = stats;
        this.metrics = metrics;
        this.summaryDepth = summaryDepth;
        this.snapshot = MarketSnapshot.initial(engine.getMidPrice());
    }

    @Override
    public void onEvent(EngineCommand command, long sequence, boolean endOfBatch) {
        if (command.type == null) {
            // Slot was cleared or never populated -- skip
            return;
        }

        try {
            String commandName = commandLabel(command.type);
            switch (command.type) {
                case TICK -> tick(sequence);
                case SUBMIT -> submit(command.toOrderRequest());
                case CANCEL -> cancel(command.orderId);
            }
            metrics.commandDuration.labelValues(commandName)
                    .observe(nanosToSeconds(System.nanoTime() - command.receivedNanos));
        } catch (Exception e) {
            logger.error("Error processing command sequence {}: {}", sequence, e.getMessage(), e);
        } finally {
            // Clear the slot to prevent stale data
            command.clear();

            if (endOfBatch) {
                publishSnapshot();
            }
        }
    }

    private void tick(long sequence) {
        stats.ticksProcessed.incrementAndGet();
        for (MarketParticipant participant : participants) {
            try {
                participant.act(venue);
            } catch (InvalidOrderException e) {
                logger.warn("Participant submitted an invalid order",
                        keyValue("event", "ORDER_INVALID"),
                        keyValue("owner", participant.getName()),
                        keyValue("reason", e.getReason()),
                        keyValue("detail", e.getMessage()));
            } catch (RuntimeException e) {
                logger.error("Participant {} failed on tick {}: {}",
                        participant.getName(), sequence, e.getMessage(), e);
            }
        }
    }

    private void submit(OrderRequest request) {
        try {
            venue.submit(request);
        } catch (InvalidOrderException e) {
            logger.warn("Rejected invalid order",
                    keyValue("event", "ORDER_INVALID"),
                    keyValue("owner", request.getOwner()),
                    keyValue("reason", e.getReason()),
                    keyValue("detail", e.getMessage()));
        }
    }

    private void cancel(long orderId) {
        if (!venue.cancel(new OrderId(orderId))) {
            logger.debug("Cancel for unknown order {}", orderId);
        }
    }

    private void publishSnapshot() {
        OrderBook book = engine.getOrderBook();

        metrics.orderbookDepth.labelValues("bid").set(book.getBidDepth());
        metrics.orderbookDepth.labelValues("ask").set(book.getAskDepth());
        metrics.orderbookPriceLevels.labelValues("bid").set(book.getBidLevelCount());
        metrics.orderbookPriceLevels.labelValues("ask").set(book.getAskLevelCount());
        metrics.midPrice.set(engine.getMidPrice());
        metrics.lastTradePrice.set(engine.getLastTradePrice());

        snapshot = new MarketSnapshot(
                engine.getBook(summaryDepth),
                engine.getMidPrice(),
                engine.getLastTradePrice(),
                engine.getTradeLog().size(),
                book.getOrderCount(),
                engine.getRecentTrades(RECENT_TRADES));
    }

    /**
     * Latest snapshot published by the engine thread. Safe to call from any thread.
     */
    public MarketSnapshot getSnapshot() {
        return snapshot;
    }

    static String commandLabel(EngineCommand.Type type) {
        return type.name().toLowerCase(Locale.ROOT);
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}
