package com.lobsim.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory order book for the simulated instrument.
 *
 * Bids: TreeMap with Comparator.reverseOrder() so firstKey() = highest bid.
 * Asks: TreeMap with natural ordering so firstKey() = lowest ask.
 * Order index: HashMap for O(1) lookup by orderId (used for cancels).
 *
 * Only resting LIMIT orders live here. Not thread-safe.
 */
public class OrderBook {

    private final TreeMap<Price, PriceLevel> bids;
    private final TreeMap<Price, PriceLevel> asks;
    private final HashMap<OrderId, Order> orderIndex;

    public OrderBook() {
        this.bids = new TreeMap<>(Comparator.reverseOrder());
        this.asks = new TreeMap<>();
        this.orderIndex = new HashMap<>();
    }

    /**
     * Add an order to the appropriate side of the book.
     * BUY orders go to bids, SELL orders go to asks.
     */
    public void addOrder(Order order) {
        if (order.getType() != OrderType.LIMIT) {
            throw new IllegalArgumentException("Only limit orders can rest: " + order);
        }
        PriceLevel level = sideOf(order.getSide())
                .computeIfAbsent(order.getLimitPrice(), PriceLevel::new);
        level.addOrder(order);
        orderIndex.put(order.getId(), order);
        order.setStatus(OrderStatus.RESTING);
    }

    /**
     * Remove an order by orderId. Looks up in the index, removes from the
     * appropriate price level, and cleans up empty levels.
     *
     * @return the removed order, or null if no such order is resting
     */
    public Order removeOrder(OrderId orderId) {
        Order order = orderIndex.remove(orderId);
        if (order == null) {
            return null;
        }
        TreeMap<Price, PriceLevel> side = sideOf(order.getSide());
        PriceLevel level = side.get(order.getLimitPrice());
        if (level != null) {
            level.removeOrder(order);
            if (level.isEmpty()) {
                side.remove(order.getLimitPrice());
            }
        }
        return order;
    }

    /**
     * Drop the head of a level after it has been completely filled.
     * Removes the level itself once it holds no more orders.
     */
    public void removeFilledHead(Side side, PriceLevel level) {
        Order head = level.pollFirst();
        if (head != null) {
            orderIndex.remove(head.getId());
        }
        if (level.isEmpty()) {
            sideOf(side).remove(level.getPrice());
        }
    }

    public PriceLevel getBestBid() {
        Map.Entry<Price, PriceLevel> entry = bids.firstEntry();
        return entry != null ? entry.getValue() : null;
    }

    public PriceLevel getBestAsk() {
        Map.Entry<Price, PriceLevel> entry = asks.firstEntry();
        return entry != null ? entry.getValue() : null;
    }

    /**
     * Best level on the given side, or null if that side is empty.
     */
    public PriceLevel getBest(Side side) {
        return side == Side.BUY ? getBestBid() : getBestAsk();
    }

    public boolean hasLiquidity(Side side) {
        return !sideOf(side).isEmpty();
    }

    /**
     * True when the best bid is priced at or above the best ask.
     */
    public boolean isCrossed() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return false;
        }
        return bids.firstKey().compareTo(asks.firstKey()) >= 0;
    }

    public Order getOrder(OrderId orderId) {
        return orderIndex.get(orderId);
    }

    /**
     * Aggregated depth for both sides, limited to {@code maxLevels} per side.
     */
    public BookSnapshot snapshot(int maxLevels) {
        return new BookSnapshot(levels(bids, maxLevels), levels(asks, maxLevels));
    }

    public BookSnapshot snapshot() {
        return snapshot(Integer.MAX_VALUE);
    }

    private static List<BookLevel> levels(TreeMap<Price, PriceLevel> side, int maxLevels) {
        if (side.isEmpty() || maxLevels <= 0) {
            return Collections.emptyList();
        }
        List<BookLevel> result = new ArrayList<>(Math.min(side.size(), maxLevels));
        for (PriceLevel level : side.values()) {
            if (result.size() == maxLevels) {
                break;
            }
            result.add(new BookLevel(level.getPrice().value(), level.getTotalQuantity(),
                    level.getOrderCount()));
        }
        return result;
    }

    /**
     * Total number of resting orders on the bid side across all price levels.
     */
    public int getBidDepth() {
        int depth = 0;
        for (PriceLevel level : bids.values()) {
            depth += level.getOrderCount();
        }
        return depth;
    }

    /**
     * Total number of resting orders on the ask side across all price levels.
     */
    public int getAskDepth() {
        int depth = 0;
        for (PriceLevel level : asks.values()) {
            depth += level.getOrderCount();
        }
        return depth;
    }

    public int getBidLevelCount() {
        return bids.size();
    }

    public int getAskLevelCount() {
        return asks.size();
    }

    public int getOrderCount() {
        return orderIndex.size();
    }

    private TreeMap<Price, PriceLevel> sideOf(Side side) {
        return side == Side.BUY ? bids : asks;
    }
}
