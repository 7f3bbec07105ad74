package com.lobsim.domain;

/**
 * One leg of a trade, as seen by the order on that leg.
 * Every trade produces a buy-side fill and a sell-side fill.
 */
public class Fill {

    private final OrderId orderId;
    private final String owner;
    private final Side side;
    private final double price;
    private final long quantity;
    private final long remainingQuantity;
    private final boolean aggressor;
    private final long timestamp;

    public Fill(OrderId orderId, String owner, Side side, double price, long quantity,
                long remainingQuantity, boolean aggressor, long timestamp) {
        this.orderId = orderId;
        this.owner = owner;
        this.side = side;
        this.price = price;
        this.quantity = quantity;
        this.remainingQuantity = remainingQuantity;
        this.aggressor = aggressor;
        this.timestamp = timestamp;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public String getOwner() {
        return owner;
    }

    public Side getSide() {
        return side;
    }

    public double getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    /**
     * Quantity left on the order after this fill. Zero means the order is done.
     * For market orders any remainder is discarded once execution stops.
     */
    public long getRemainingQuantity() {
        return remainingQuantity;
    }

    public boolean isComplete() {
        return remainingQuantity == 0;
    }

    public boolean isAggressor() {
        return aggressor;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
