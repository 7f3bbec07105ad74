package com.lobsim.domain;

/**
 * Immutable record of one execution between a buy order and a sell order.
 *
 * The execution price is always the passive order's price: the resting order's
 * price for market orders, the ask's price when two resting limits cross.
 * {@code side} names the aggressor.
 */
public class Trade {

    private final long sequence;
    private final long timestamp;          // epoch millis
    private final double price;
    private final long quantity;
    private final Side side;
    private final OrderId buyOrderId;
    private final OrderId sellOrderId;

    public Trade(long sequence, long timestamp, double price, long quantity, Side side,
                 OrderId buyOrderId, OrderId sellOrderId) {
        this.sequence = sequence;
        this.timestamp = timestamp;
        this.price = price;
        this.quantity = quantity;
        this.side = side;
        this.buyOrderId = buyOrderId;
        this.sellOrderId = sellOrderId;
    }

    public long getSequence() {
        return sequence;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    public Side getSide() {
        return side;
    }

    public OrderId getBuyOrderId() {
        return buyOrderId;
    }

    public OrderId getSellOrderId() {
        return sellOrderId;
    }

    @Override
    public String toString() {
        return "Trade{" +
                "seq=" + sequence +
                ", price=" + price +
                ", qty=" + quantity +
                ", side=" + side +
                ", buy=" + buyOrderId +
                ", sell=" + sellOrderId +
                '}';
    }
}
