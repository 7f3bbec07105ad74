package com.lobsim.simulation;

import com.lobsim.domain.OrderRequest;
import com.lobsim.domain.OrderType;
import com.lobsim.domain.Side;

/**
 * Pre-allocated mutable command slot in the Disruptor ring buffer.
 *
 * Fields are public for direct access from the translator and handler.
 * The clear() method resets all fields after processing, preventing stale
 * data in the ring buffer slot.
 */
public class EngineCommand {

    public enum Type {
        TICK,
        SUBMIT,
        CANCEL
    }

    public Type type;
    public long receivedNanos;     // System.nanoTime() when the command was published
    public Side side;
    public OrderType orderType;
    public double price;
    public long quantity;
    public String owner;
    public long orderId;           // CANCEL only

    public OrderRequest toOrderRequest() {
        return new OrderRequest(side, orderType, price, quantity, owner);
    }

    /**
     * Reset all fields to defaults. Called after the command has been processed.
     */
    public void clear() {
        type = null;
        receivedNanos = 0;
        side = null;
        orderType = null;
        price = 0;
        quantity = 0;
        owner = null;
        orderId = 0;
    }
}
