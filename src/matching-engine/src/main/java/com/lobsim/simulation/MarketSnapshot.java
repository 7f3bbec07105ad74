package com.lobsim.simulation;

import com.lobsim.domain.BookSnapshot;
import com.lobsim.domain.Trade;

import java.util.List;

/**
 * Immutable view of the market published by the engine thread for readers on
 * other threads (the periodic stats logger).
 */
public class MarketSnapshot {

    private final BookSnapshot book;
    private final double midPrice;
    private final double lastTradePrice;
    private final long tradeCount;
    private final long restingOrders;
    private final List<Trade> recentTrades;

    public MarketSnapshot(BookSnapshot book, double midPrice, double lastTradePrice,
                          long tradeCount, long restingOrders, List<Trade> recentTrades) {
        this.book = book;
        this.midPrice = midPrice;
        this.lastTradePrice = lastTradePrice;
        this.tradeCount = tradeCount;
        this.restingOrders = restingOrders;
        this.recentTrades = List.copyOf(recentTrades);
    }

    public static MarketSnapshot initial(double initialPrice) {
        return new MarketSnapshot(BookSnapshot.empty(), initialPrice, initialPrice, 0, 0, List.of());
    }

    public BookSnapshot getBook() {
        return book;
    }

    public double getMidPrice() {
        return midPrice;
    }

    public double getLastTradePrice() {
        return lastTradePrice;
    }

    public long getTradeCount() {
        return tradeCount;
    }

    public long getRestingOrders() {
        return restingOrders;
    }

    /**
     * Most recent trades, newest first.
     */
    public List<Trade> getRecentTrades() {
        return recentTrades;
    }
}
