package com.lobsim.domain;

/**
 * Value object wrapping the engine-assigned sequential order identifier.
 * Ids start at 1 and are never reused.
 */
public record OrderId(long value) implements Comparable<OrderId> {

    @Override
    public int compareTo(OrderId other) {
        return Long.compare(this.value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
