package com.lobsim.metrics;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.io.IOException;

/**
 * All Prometheus metrics for the simulator, defined in one place.
 * Metrics live in a private registry so several instances can coexist (tests).
 */
public class MetricsRegistry {

    // ---- Order flow ----
    public final Counter ordersReceivedTotal;
    // name: lob_orders_received_total{side,type}

    public final Counter ordersRejectedTotal;
    // name: lob_orders_rejected_total{reason}

    public final Counter cancelsTotal;
    // name: lob_cancels_total{result}

    // ---- Executions ----
    public final Counter tradesTotal;
    // name: lob_trades_total

    public final Counter tradedVolumeTotal;
    // name: lob_traded_volume_total

    public final Histogram commandDuration;
    // name: lob_command_duration_seconds{command}

    // ---- Order book health ----
    public final Gauge orderbookDepth;
    // name: lob_orderbook_depth{side}

    public final Gauge orderbookPriceLevels;
    // name: lob_orderbook_price_levels{side}

    public final Gauge midPrice;
    // name: lob_mid_price

    public final Gauge lastTradePrice;
    // name: lob_last_trade_price

    private final PrometheusRegistry registry;
    private HTTPServer httpServer;

    public MetricsRegistry() {
        registry = new PrometheusRegistry();

        ordersReceivedTotal = Counter.builder()
                .name("lob_orders_received_total")
                .help("Orders submitted to the engine")
                .labelNames("side", "type")
                .register(registry);

        ordersRejectedTotal = Counter.builder()
                .name("lob_orders_rejected_total")
                .help("Orders rejected, by reason")
                .labelNames("reason")
                .register(registry);

        cancelsTotal = Counter.builder()
                .name("lob_cancels_total")
                .help("Cancel requests, by result")
                .labelNames("result")
                .register(registry);

        tradesTotal = Counter.builder()
                .name("lob_trades_total")
                .help("Trades executed")
                .register(registry);

        tradedVolumeTotal = Counter.builder()
                .name("lob_traded_volume_total")
                .help("Quantity executed across all trades")
                .register(registry);

        commandDuration = Histogram.builder()
                .name("lob_command_duration_seconds")
                .help("Time from command publish to processing complete")
                .labelNames("command")
                .classicOnly()
                .classicUpperBounds(0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5)
                .register(registry);

        orderbookDepth = Gauge.builder()
                .name("lob_orderbook_depth")
                .help("Current resting orders")
                .labelNames("side")
                .register(registry);

        orderbookPriceLevels = Gauge.builder()
                .name("lob_orderbook_price_levels")
                .help("Distinct price levels")
                .labelNames("side")
                .register(registry);

        midPrice = Gauge.builder()
                .name("lob_mid_price")
                .help("Current mid price (last trade price when one side is empty)")
                .register(registry);

        lastTradePrice = Gauge.builder()
                .name("lob_last_trade_price")
                .help("Price of the most recent trade")
                .register(registry);
    }

    /**
     * Register JVM metrics and start the Prometheus HTTP server on the given port.
     * Exposes /metrics for scraping.
     */
    public void startHttpServer(int port) throws IOException {
        JvmMetrics.builder().register(registry);
        httpServer = HTTPServer.builder()
                .port(port)
                .registry(registry)
                .buildAndStart();
    }

    /**
     * Stop the Prometheus HTTP server.
     */
    public void close() {
        if (httpServer != null) {
            httpServer.close();
        }
    }
}
