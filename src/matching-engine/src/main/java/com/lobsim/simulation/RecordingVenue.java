package com.lobsim.simulation;

import com.lobsim.domain.BookSnapshot;
import com.lobsim.domain.OrderId;
import com.lobsim.domain.OrderRequest;
import com.lobsim.domain.OrderType;
import com.lobsim.domain.Side;
import com.lobsim.domain.Trade;
import com.lobsim.logging.MatchingStats;
import com.lobsim.matching.InvalidOrderException;
import com.lobsim.matching.MatchingEngine;
import com.lobsim.matching.SubmitResult;
import com.lobsim.matching.TradingVenue;
import com.lobsim.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * TradingVenue decorator that counts order flow and executions on the way
 * through to the engine. Participants and external submissions both go
 * through here, so stats and metrics see everything.
 */
public class RecordingVenue implements TradingVenue {

    private static final Logger logger = LoggerFactory.getLogger(RecordingVenue.class);

    private final MatchingEngine engine;
    private final MatchingStats stats;
    private final MetricsRegistry metrics;
    private final boolean detailedLogging;

    public RecordingVenue(MatchingEngine engine, MatchingStats stats, MetricsRegistry metrics,
                          boolean detailedLogging) {
        this.engine = engine;
        this.stats = stats;
        this.metrics = metrics;
        this.detailedLogging = detailedLogging;
    }

    public SubmitResult submit(OrderRequest request) {
        return submit(request.getSide(), request.getType(), request.getPrice(),
                request.getQuantity(), request.getOwner());
    }

    @Override
    public SubmitResult submit(Side side, OrderType type, double price, long quantity, String owner) {
        SubmitResult result;
        try {
            result = engine.submit(side, type, price, quantity, owner);
        } catch (InvalidOrderException e) {
            stats.ordersInvalid.incrementAndGet();
            metrics.ordersRejectedTotal.labelValues(e.getReason()).inc();
            throw e;
        }

        if (side == Side.BUY) {
            stats.buyOrdersReceived.incrementAndGet();
        } else {
            stats.sellOrdersReceived.incrementAndGet();
        }
        if (type == OrderType.MARKET) {
            stats.marketOrdersReceived.incrementAndGet();
        }
        metrics.ordersReceivedTotal.labelValues(label(side), label(type)).inc();

        if (!result.isAccepted()) {
            stats.ordersRejected.incrementAndGet();
            metrics.ordersRejectedTotal.labelValues("no_liquidity").inc();
            if (detailedLogging) {
                logger.info("Market order rejected",
                        keyValue("event", "ORDER_REJECTED"),
                        keyValue("owner", owner),
                        keyValue("side", side),
                        keyValue("quantity", quantity));
            }
            return result;
        }

        for (Trade trade : result.getTrades()) {
            recordTrade(trade);
        }
        return result;
    }

    @Override
    public boolean cancel(OrderId orderId) {
        boolean cancelled = engine.cancel(orderId);
        if (cancelled) {
            stats.cancelsSucceeded.incrementAndGet();
            metrics.cancelsTotal.labelValues("cancelled").inc();
        } else {
            stats.cancelsFailed.incrementAndGet();
            metrics.cancelsTotal.labelValues("unknown").inc();
        }
        return cancelled;
    }

    @Override
    public BookSnapshot getBook() {
        return engine.getBook();
    }

    @Override
    public double getMidPrice() {
        return engine.getMidPrice();
    }

    @Override
    public List<Trade> getTradeLog() {
        return engine.getTradeLog();
    }

    private void recordTrade(Trade trade) {
        stats.tradesExecuted.incrementAndGet();
        stats.volumeTraded.addAndGet(trade.getQuantity());
        metrics.tradesTotal.inc();
        metrics.tradedVolumeTotal.inc(trade.getQuantity());

        if (detailedLogging) {
            logger.info("Trade executed",
                    keyValue("event", "TRADE_EXECUTED"),
                    keyValue("seq", trade.getSequence()),
                    keyValue("price", trade.getPrice()),
                    keyValue("quantity", trade.getQuantity()),
                    keyValue("aggressor", trade.getSide()),
                    keyValue("buyOrderId", trade.getBuyOrderId().value()),
                    keyValue("sellOrderId", trade.getSellOrderId().value()));
        }
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
