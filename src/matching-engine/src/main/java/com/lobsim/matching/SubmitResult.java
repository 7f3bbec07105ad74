package com.lobsim.matching;

import com.lobsim.domain.OrderId;
import com.lobsim.domain.OrderStatus;
import com.lobsim.domain.Trade;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one submission: whether it was accepted, the id it was given,
 * and the trades it produced.
 * A rejected submission carries no id and no trades.
 */
public class SubmitResult {

    private final boolean accepted;
    private final OrderId orderId;
    private final OrderStatus status;
    private final List<Trade> trades;
    private final long filledQuantity;

    private SubmitResult(boolean accepted, OrderId orderId, OrderStatus status,
                         List<Trade> trades, long filledQuantity) {
        this.accepted = accepted;
        this.orderId = orderId;
        this.status = status;
        this.trades = List.copyOf(trades);
        this.filledQuantity = filledQuantity;
    }

    static SubmitResult accepted(OrderId orderId, OrderStatus status,
                                 List<Trade> trades, long filledQuantity) {
        return new SubmitResult(true, orderId, status, trades, filledQuantity);
    }

    static SubmitResult rejected() {
        return new SubmitResult(false, null, OrderStatus.REJECTED, List.of(), 0);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public Optional<OrderId> getOrderId() {
        return Optional.ofNullable(orderId);
    }

    public OrderStatus getStatus() {
        return status;
    }

    public List<Trade> getTrades() {
        return trades;
    }

    public long getFilledQuantity() {
        return filledQuantity;
    }

    public boolean hasTrades() {
        return !trades.isEmpty();
    }

    @Override
    public String toString() {
        return "SubmitResult{" +
                "accepted=" + accepted +
                ", orderId=" + orderId +
                ", status=" + status +
                ", trades=" + trades.size() +
                ", filled=" + filledQuantity +
                '}';
    }
}
