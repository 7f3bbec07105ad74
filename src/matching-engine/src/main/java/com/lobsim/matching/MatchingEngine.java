package com.lobsim.matching;

import com.lobsim.domain.BookSnapshot;
import com.lobsim.domain.Fill;
import com.lobsim.domain.Order;
import com.lobsim.domain.OrderBook;
import com.lobsim.domain.OrderId;
import com.lobsim.domain.OrderRequest;
import com.lobsim.domain.OrderStatus;
import com.lobsim.domain.OrderType;
import com.lobsim.domain.Price;
import com.lobsim.domain.PriceLevel;
import com.lobsim.domain.Side;
import com.lobsim.domain.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single-instrument matching engine.
 *
 * Owns the order book (both priced queues plus the live-order index), the
 * append-only trade log and the order id sequence. Every public mutation runs
 * to completion before returning, so the book is never left crossed between
 * calls.
 *
 * Not thread-safe. The caller serializes all access; in the simulation this is
 * the Disruptor consumer thread.
 */
public class MatchingEngine implements TradingVenue {

    private static final Logger logger = LoggerFactory.getLogger(MatchingEngine.class);

    public static final double DEFAULT_INITIAL_PRICE = 100.0;

    private final OrderBook book;
    private final MatchingAlgorithm matcher;
    private final Clock clock;
    private final List<Trade> trades;
    private final List<Trade> tradesView;
    private final List<FillListener> fillListeners;
    private final List<Fill> pendingFills;

    private long nextOrderId = 1;
    private long lastTimestamp = Long.MIN_VALUE;
    private long tradeSequence;
    private long totalTradedQuantity;
    private double lastTradePrice;

    public MatchingEngine() {
        this(DEFAULT_INITIAL_PRICE, Clock.systemUTC());
    }

    public MatchingEngine(double initialPrice, Clock clock) {
        this(new OrderBook(), new PriceTimePriorityMatcher(), initialPrice, clock);
    }

    public MatchingEngine(OrderBook book, MatchingAlgorithm matcher,
                          double initialPrice, Clock clock) {
        this.book = book;
        this.matcher = matcher;
        this.clock = clock;
        this.lastTradePrice = initialPrice;
        this.trades = new ArrayList<>();
        this.tradesView = Collections.unmodifiableList(trades);
        this.fillListeners = new CopyOnWriteArrayList<>();
        this.pendingFills = new ArrayList<>();
    }

    public void addFillListener(FillListener listener) {
        fillListeners.add(listener);
    }

    public SubmitResult submit(OrderRequest request) {
        return submit(request.getSide(), request.getType(), request.getPrice(),
                request.getQuantity(), request.getOwner());
    }

    @Override
    public SubmitResult submit(Side side, OrderType type, double price, long quantity, String owner) {
        validate(side, type, price, quantity, owner);

        Order order = new Order(new OrderId(nextOrderId++), side, type, new Price(price),
                quantity, nextTimestamp(), owner);

        List<Trade> produced = new ArrayList<>();
        MatchingAlgorithm.ExecutionCallback callback =
                (buy, sell, px, qty, aggressor) -> recordExecution(buy, sell, px, qty, aggressor, produced);

        if (type == OrderType.MARKET) {
            if (!book.hasLiquidity(side.opposite())) {
                order.setStatus(OrderStatus.REJECTED);
                logger.debug("Rejected market order {} from {}: no {} liquidity",
                        order.getId(), owner, side.opposite());
                return SubmitResult.rejected();
            }
            matcher.executeMarket(book, order, callback);
            // Whatever did not execute is dropped.
            order.setStatus(OrderStatus.FILLED);
        } else {
            book.addOrder(order);
            matcher.matchCrossed(book, callback);
        }

        dispatchFills();
        return SubmitResult.accepted(order.getId(), order.getStatus(), produced,
                order.getFilledQuantity());
    }

    /**
     * Cancel a resting order, removing its full remaining quantity.
     *
     * @return false if the id is unknown, already filled or already cancelled
     */
    @Override
    public boolean cancel(OrderId orderId) {
        Order order = book.removeOrder(orderId);
        if (order == null) {
            return false;
        }
        order.setStatus(OrderStatus.CANCELLED);
        return true;
    }

    public boolean cancel(long orderId) {
        return cancel(new OrderId(orderId));
    }

    @Override
    public BookSnapshot getBook() {
        return book.snapshot();
    }

    /**
     * Depth view limited to the best {@code depth} levels on each side.
     */
    public BookSnapshot getBook(int depth) {
        return book.snapshot(depth);
    }

    /**
     * Midpoint of best bid and best ask when both sides are populated, otherwise
     * the last traded price (the initial price before the first trade).
     */
    @Override
    public double getMidPrice() {
        PriceLevel bestBid = book.getBestBid();
        PriceLevel bestAsk = book.getBestAsk();
        if (bestBid != null && bestAsk != null) {
            return (bestBid.getPrice().value() + bestAsk.getPrice().value()) / 2;
        }
        return lastTradePrice;
    }

    @Override
    public List<Trade> getTradeLog() {
        return tradesView;
    }

    /**
     * The newest {@code count} trades, newest first.
     */
    public List<Trade> getRecentTrades(int count) {
        int n = Math.min(Math.max(count, 0), trades.size());
        List<Trade> recent = new ArrayList<>(n);
        for (int i = trades.size() - 1; i >= trades.size() - n; i--) {
            recent.add(trades.get(i));
        }
        return recent;
    }

    /**
     * Look up a live (resting) order.
     */
    public Optional<Order> getOrder(OrderId orderId) {
        return Optional.ofNullable(book.getOrder(orderId));
    }

    public OptionalDouble getBestBid() {
        PriceLevel level = book.getBestBid();
        return level == null ? OptionalDouble.empty() : OptionalDouble.of(level.getPrice().value());
    }

    public OptionalDouble getBestAsk() {
        PriceLevel level = book.getBestAsk();
        return level == null ? OptionalDouble.empty() : OptionalDouble.of(level.getPrice().value());
    }

    public double getLastTradePrice() {
        return lastTradePrice;
    }

    public long getTotalTradedQuantity() {
        return totalTradedQuantity;
    }

    public OrderBook getOrderBook() {
        return book;
    }

    private void validate(Side side, OrderType type, double price, long quantity, String owner) {
        if (side == null) {
            throw new InvalidOrderException("missing_side", "Side is required");
        }
        if (type == null) {
            throw new InvalidOrderException("missing_type", "Order type is required");
        }
        if (owner == null) {
            throw new InvalidOrderException("missing_owner", "Owner is required");
        }
        if (quantity <= 0) {
            throw new InvalidOrderException("invalid_quantity",
                    "Quantity must be positive: " + quantity);
        }
        if (type == OrderType.LIMIT && !Price.of(price).isValid()) {
            throw new InvalidOrderException("invalid_price",
                    "Limit price must be finite and positive: " + price);
        }
    }

    /**
     * Strictly increasing monotonic timestamp, so no two orders share a time priority.
     */
    private long nextTimestamp() {
        long now = System.nanoTime();
        lastTimestamp = lastTimestamp == Long.MIN_VALUE ? now : Math.max(now, lastTimestamp + 1);
        return lastTimestamp;
    }

    private void recordExecution(Order buy, Order sell, double price, long quantity,
                                 Side aggressor, List<Trade> produced) {
        long now = clock.millis();
        Trade trade = new Trade(++tradeSequence, now, price, quantity, aggressor,
                buy.getId(), sell.getId());
        trades.add(trade);
        produced.add(trade);
        lastTradePrice = price;
        totalTradedQuantity += quantity;

        pendingFills.add(new Fill(buy.getId(), buy.getOwner(), Side.BUY, price, quantity,
                buy.getRemainingQuantity(), aggressor == Side.BUY, now));
        pendingFills.add(new Fill(sell.getId(), sell.getOwner(), Side.SELL, price, quantity,
                sell.getRemainingQuantity(), aggressor == Side.SELL, now));
    }

    /**
     * Deliver fills collected during the last submission. Runs after matching has
     * finished so listeners always observe an uncrossed book.
     */
    private void dispatchFills() {
        if (pendingFills.isEmpty()) {
            return;
        }
        List<Fill> fills = new ArrayList<>(pendingFills);
        pendingFills.clear();
        for (Fill fill : fills) {
            for (FillListener listener : fillListeners) {
                try {
                    listener.onFill(fill);
                } catch (RuntimeException e) {
                    logger.error("Fill listener failed for order {}: {}",
                            fill.getOrderId(), e.getMessage(), e);
                }
            }
        }
    }
}
