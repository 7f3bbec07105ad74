package com.lobsim.matching;

import com.lobsim.domain.Order;
import com.lobsim.domain.OrderBook;
import com.lobsim.domain.PriceLevel;
import com.lobsim.domain.Side;

/**
 * Price-time priority matching algorithm.
 *
 * Price priority: best price on the opposite side is matched first
 * (lowest ask for a buy, highest bid for a sell).
 *
 * Time priority: within the same price level, the order that arrived
 * earliest is matched first (FIFO per level).
 *
 * Trade price is always the passive quote: the resting order's price for a
 * market order, the ask's price for a cross between two resting limits.
 *
 * Time complexity: O(F log P) where P = price levels, F = fills.
 */
public class PriceTimePriorityMatcher implements MatchingAlgorithm {

    @Override
    public void executeMarket(OrderBook book, Order incoming, ExecutionCallback callback) {
        Side restingSide = incoming.getSide().opposite();

        while (incoming.getRemainingQuantity() > 0) {
            PriceLevel level = book.getBest(restingSide);
            if (level == null) {
                break;  // opposite side exhausted, remainder is dropped
            }

            Order resting = level.peekFirst();
            long fillQty = Math.min(incoming.getRemainingQuantity(),
                                    resting.getRemainingQuantity());

            incoming.fill(fillQty);
            resting.fill(fillQty);
            level.reduceQuantity(fillQty);

            if (resting.isFilled()) {
                book.removeFilledHead(restingSide, level);
            }

            double price = level.getPrice().value();
            if (incoming.getSide() == Side.BUY) {
                callback.onExecution(incoming, resting, price, fillQty, Side.BUY);
            } else {
                callback.onExecution(resting, incoming, price, fillQty, Side.SELL);
            }
        }
    }

    @Override
    public void matchCrossed(OrderBook book, ExecutionCallback callback) {
        while (book.isCrossed()) {
            PriceLevel bidLevel = book.getBestBid();
            PriceLevel askLevel = book.getBestAsk();
            Order bid = bidLevel.peekFirst();
            Order ask = askLevel.peekFirst();

            long fillQty = Math.min(bid.getRemainingQuantity(), ask.getRemainingQuantity());
            double price = askLevel.getPrice().value();
            // Whichever order arrived later completed the cross.
            Side aggressor = bid.getTimestamp() > ask.getTimestamp() ? Side.BUY : Side.SELL;

            bid.fill(fillQty);
            ask.fill(fillQty);
            bidLevel.reduceQuantity(fillQty);
            askLevel.reduceQuantity(fillQty);

            if (bid.isFilled()) {
                book.removeFilledHead(Side.BUY, bidLevel);
            }
            if (ask.isFilled()) {
                book.removeFilledHead(Side.SELL, askLevel);
            }

            callback.onExecution(bid, ask, price, fillQty, aggressor);
        }
    }
}
