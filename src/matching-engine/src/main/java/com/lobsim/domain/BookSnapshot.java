package com.lobsim.domain;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Immutable depth view of both sides of the book.
 * Bids are ordered highest price first, asks lowest price first.
 */
public class BookSnapshot {

    private static final BookSnapshot EMPTY = new BookSnapshot(List.of(), List.of());

    private final List<BookLevel> bids;
    private final List<BookLevel> asks;

    public BookSnapshot(List<BookLevel> bids, List<BookLevel> asks) {
        this.bids = List.copyOf(bids);
        this.asks = List.copyOf(asks);
    }

    public static BookSnapshot empty() {
        return EMPTY;
    }

    public List<BookLevel> getBids() {
        return bids;
    }

    public List<BookLevel> getAsks() {
        return asks;
    }

    public OptionalDouble bestBid() {
        return bids.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(bids.get(0).price());
    }

    public OptionalDouble bestAsk() {
        return asks.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(asks.get(0).price());
    }

    public long totalBidQuantity() {
        return bids.stream().mapToLong(BookLevel::quantity).sum();
    }

    public long totalAskQuantity() {
        return asks.stream().mapToLong(BookLevel::quantity).sum();
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }

    @Override
    public String toString() {
        return "BookSnapshot{bids=" + bids + ", asks=" + asks + '}';
    }
}
