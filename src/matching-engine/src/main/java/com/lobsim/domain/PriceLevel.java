package com.lobsim.domain;

import java.util.Iterator;
import java.util.LinkedHashMap;

/**
 * FIFO queue of orders at a single price point.
 * Orders are matched in time priority (first-in, first-out). Backed by an
 * insertion-ordered map so a cancel removes its order without scanning the level.
 */
public class PriceLevel {

    private final Price price;
    private final LinkedHashMap<OrderId, Order> orders;
    private long totalQuantity;

    public PriceLevel(Price price) {
        this.price = price;
        this.orders = new LinkedHashMap<>();
        this.totalQuantity = 0;
    }

    public void addOrder(Order order) {
        orders.put(order.getId(), order);
        totalQuantity += order.getRemainingQuantity();
    }

    public Order peekFirst() {
        Iterator<Order> it = orders.values().iterator();
        return it.hasNext() ? it.next() : null;
    }

    public Order pollFirst() {
        Order order = peekFirst();
        if (order != null) {
            orders.remove(order.getId());
            totalQuantity -= order.getRemainingQuantity();
        }
        return order;
    }

    /**
     * Remove a specific order. Used for cancel operations.
     * Returns false if the order is not queued at this level.
     */
    public boolean removeOrder(Order order) {
        if (orders.remove(order.getId()) != null) {
            totalQuantity -= order.getRemainingQuantity();
            return true;
        }
        return false;
    }

    /**
     * Account for a fill on an order queued at this level. Must be called
     * with the same quantity passed to {@link Order#fill(long)}.
     */
    public void reduceQuantity(long qty) {
        totalQuantity -= qty;
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public long getTotalQuantity() {
        return totalQuantity;
    }

    public int getOrderCount() {
        return orders.size();
    }

    public Price getPrice() {
        return price;
    }
}
