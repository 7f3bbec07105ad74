package com.lobsim.domain;

/**
 * Value object representing a limit price in quote units.
 * Example: 99.87 is a price just below the default reference of 100.0.
 */
public record Price(double value) implements Comparable<Price> {

    public static Price of(double value) {
        return new Price(value);
    }

    public boolean isValid() {
        return Double.isFinite(value) && value > 0;
    }

    @Override
    public int compareTo(Price other) {
        return Double.compare(this.value, other.value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
