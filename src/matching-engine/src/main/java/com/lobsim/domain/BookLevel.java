package com.lobsim.domain;

/**
 * Aggregated resting quantity at one price.
 */
public record BookLevel(double price, long quantity, int orderCount) {}
