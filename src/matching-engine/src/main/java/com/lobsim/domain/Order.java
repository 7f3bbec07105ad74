package com.lobsim.domain;

/**
 * Order entity with fill tracking. Mutable: remainingQuantity, filledQuantity,
 * and status change as the order is matched or cancelled.
 *
 * MARKET orders have no limit price ({@link #getLimitPrice()} returns null).
 */
public class Order {

    private final OrderId id;
    private final Side side;
    private final OrderType type;
    private final Price limitPrice;
    private final long originalQuantity;
    private long remainingQuantity;
    private long filledQuantity;
    private final long timestamp;          // monotonic nanos, time priority
    private final String owner;
    private OrderStatus status;

    public Order(OrderId id, Side side, OrderType type, Price limitPrice,
                 long quantity, long timestamp, String owner) {
        this.id = id;
        this.side = side;
        this.type = type;
        this.limitPrice = type == OrderType.MARKET ? null : limitPrice;
        this.originalQuantity = quantity;
        this.remainingQuantity = quantity;
        this.filledQuantity = 0;
        this.timestamp = timestamp;
        this.owner = owner;
        this.status = OrderStatus.PENDING;
    }

    /**
     * Fill this order by the given quantity. Reduces remainingQuantity and
     * increases filledQuantity. Status moves to FILLED once nothing remains;
     * a partial fill leaves the status untouched.
     */
    public void fill(long qty) {
        if (qty <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + qty);
        }
        if (qty > remainingQuantity) {
            throw new IllegalArgumentException(
                "Fill quantity " + qty + " exceeds remaining " + remainingQuantity);
        }
        remainingQuantity -= qty;
        filledQuantity += qty;
        if (remainingQuantity == 0) {
            status = OrderStatus.FILLED;
        }
    }

    public boolean isFilled() {
        return remainingQuantity == 0;
    }

    public OrderId getId() {
        return id;
    }

    public Side getSide() {
        return side;
    }

    public OrderType getType() {
        return type;
    }

    public Price getLimitPrice() {
        return limitPrice;
    }

    public long getOriginalQuantity() {
        return originalQuantity;
    }

    public long getRemainingQuantity() {
        return remainingQuantity;
    }

    public long getFilledQuantity() {
        return filledQuantity;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getOwner() {
        return owner;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public void setStatus(OrderStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", side=" + side +
                ", type=" + type +
                ", price=" + limitPrice +
                ", remaining=" + remainingQuantity +
                ", owner='" + owner + '\'' +
                ", status=" + status +
                '}';
    }
}
