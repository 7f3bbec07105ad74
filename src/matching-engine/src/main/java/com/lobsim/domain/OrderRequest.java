package com.lobsim.domain;

/**
 * An order instruction before the engine admits it: no id, no timestamp.
 */
public class OrderRequest {

    private final Side side;
    private final OrderType type;
    private final double price;
    private final long quantity;
    private final String owner;

    public OrderRequest(Side side, OrderType type, double price, long quantity, String owner) {
        this.side = side;
        this.type = type;
        this.price = price;
        this.quantity = quantity;
        this.owner = owner;
    }

    public static OrderRequest limit(Side side, double price, long quantity, String owner) {
        return new OrderRequest(side, OrderType.LIMIT, price, quantity, owner);
    }

    public static OrderRequest market(Side side, long quantity, String owner) {
        return new OrderRequest(side, OrderType.MARKET, 0.0, quantity, owner);
    }

    public Side getSide() {
        return side;
    }

    public OrderType getType() {
        return type;
    }

    public double getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    public String getOwner() {
        return owner;
    }

    @Override
    public String toString() {
        return "OrderRequest{" +
                "side=" + side +
                ", type=" + type +
                ", price=" + price +
                ", quantity=" + quantity +
                ", owner='" + owner + '\'' +
                '}';
    }
}
