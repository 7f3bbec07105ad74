package com.lobsim.logging;

import com.lobsim.domain.BookLevel;
import com.lobsim.domain.Trade;
import com.lobsim.simulation.MarketSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs aggregate statistics and the top of the book every N seconds on a separate
 * daemon thread. Reads only the counters and the published snapshot, never the
 * engine itself.
 */
public class PeriodicStatsLogger {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicStatsLogger.class);

    private final MatchingStats stats;
    private final Supplier<MarketSnapshot> snapshotSource;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private long lastOrders;
    private long lastTrades;
    private long lastVolume;
    private long lastRejected;

    public PeriodicStatsLogger(MatchingStats stats, Supplier<MarketSnapshot> snapshotSource,
                               int intervalSeconds) {
        this.stats = stats;
        this.snapshotSource = snapshotSource;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "periodic-stats-logger");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::logSummary, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        logger.info("Periodic stats logger started",
                keyValue("event", "STATS_LOGGER_STARTED"),
                keyValue("intervalSeconds", intervalSeconds));
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Log a final lifetime summary on shutdown.
     */
    public void logShutdownSummary() {
        MarketSnapshot snapshot = snapshotSource.get();
        long totalOrders = stats.buyOrdersReceived.get() + stats.sellOrdersReceived.get();

        logger.info("Shutdown summary",
                keyValue("event", "SHUTDOWN_SUMMARY"),
                keyValue("ticks", stats.ticksProcessed.get()),
                keyValue("totalOrders", totalOrders),
                keyValue("marketOrders", stats.marketOrdersReceived.get()),
                keyValue("totalTrades", stats.tradesExecuted.get()),
                keyValue("totalVolume", stats.volumeTraded.get()),
                keyValue("totalRejected", stats.ordersRejected.get()),
                keyValue("totalInvalid", stats.ordersInvalid.get()),
                keyValue("cancels", stats.cancelsSucceeded.get()),
                keyValue("lastTradePrice", snapshot.getLastTradePrice()),
                keyValue("midPrice", snapshot.getMidPrice()));
    }

    void logSummary() {
        try {
            long currentOrders = stats.buyOrdersReceived.get() + stats.sellOrdersReceived.get();
            long currentTrades = stats.tradesExecuted.get();
            long currentVolume = stats.volumeTraded.get();
            long currentRejected = stats.ordersRejected.get();

            long deltaOrders = currentOrders - lastOrders;
            long deltaTrades = currentTrades - lastTrades;
            long deltaVolume = currentVolume - lastVolume;
            long deltaRejected = currentRejected - lastRejected;

            lastOrders = currentOrders;
            lastTrades = currentTrades;
            lastVolume = currentVolume;
            lastRejected = currentRejected;

            MarketSnapshot snapshot = snapshotSource.get();

            logger.info("Periodic summary",
                    keyValue("event", "PERIODIC_SUMMARY"),
                    keyValue("intervalSeconds", intervalSeconds),
                    keyValue("orders", deltaOrders),
                    keyValue("trades", deltaTrades),
                    keyValue("volume", deltaVolume),
                    keyValue("rejected", deltaRejected),
                    keyValue("restingOrders", snapshot.getRestingOrders()),
                    keyValue("midPrice", String.format(Locale.ROOT, "%.4f", snapshot.getMidPrice())),
                    keyValue("lastTradePrice", snapshot.getLastTradePrice()),
                    keyValue("bids", formatLevels(snapshot.getBook().getBids())),
                    keyValue("asks", formatLevels(snapshot.getBook().getAsks())),
                    keyValue("recentTrades", formatTrades(snapshot.getRecentTrades())));
        } catch (Exception e) {
            logger.error("Error in periodic stats logging", e);
        }
    }

    static String formatLevels(List<BookLevel> levels) {
        return levels.stream()
                .map(l -> String.format(Locale.ROOT, "%.2fx%d", l.price(), l.quantity()))
                .collect(Collectors.joining(" "));
    }

    static String formatTrades(List<Trade> trades) {
        return trades.stream()
                .map(t -> String.format(Locale.ROOT, "%s %d@%.2f", t.getSide(), t.getQuantity(), t.getPrice()))
                .collect(Collectors.joining(", "));
    }
}
