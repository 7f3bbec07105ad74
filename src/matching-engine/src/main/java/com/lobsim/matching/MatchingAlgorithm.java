package com.lobsim.matching;

import com.lobsim.domain.Order;
import com.lobsim.domain.OrderBook;
import com.lobsim.domain.Side;

/**
 * Interface for order matching algorithms.
 * A matching algorithm walks an order book and reports every execution it
 * performs through an {@link ExecutionCallback}. Book state is already
 * updated for an execution when its callback fires.
 */
public interface MatchingAlgorithm {

    /**
     * Execute an incoming market order against the opposite side until it is
     * filled or the opposite side runs dry. The market order never rests.
     */
    void executeMarket(OrderBook book, Order incoming, ExecutionCallback callback);

    /**
     * Match resting orders while the best bid is priced at or above the best ask.
     */
    void matchCrossed(OrderBook book, ExecutionCallback callback);

    interface ExecutionCallback {
        void onExecution(Order buy, Order sell, double price, long quantity, Side aggressor);
    }
}
