package com.lobsim.logging;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters shared between the engine thread (writer) and the
 * periodic stats logger thread (reader).
 */
public class MatchingStats {

    public final AtomicLong buyOrdersReceived = new AtomicLong();
    public final AtomicLong sellOrdersReceived = new AtomicLong();
    public final AtomicLong marketOrdersReceived = new AtomicLong();
    public final AtomicLong ordersRejected = new AtomicLong();
    public final AtomicLong ordersInvalid = new AtomicLong();
    public final AtomicLong cancelsSucceeded = new AtomicLong();
    public final AtomicLong cancelsFailed = new AtomicLong();
    public final AtomicLong tradesExecuted = new AtomicLong();
    public final AtomicLong volumeTraded = new AtomicLong();
    public final AtomicLong ticksProcessed = new AtomicLong();
}
