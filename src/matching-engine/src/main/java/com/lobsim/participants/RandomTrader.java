package com.lobsim.participants;

import com.lobsim.domain.Fill;
import com.lobsim.domain.OrderId;
import com.lobsim.domain.OrderStatus;
import com.lobsim.domain.OrderType;
import com.lobsim.domain.Side;
import com.lobsim.matching.SubmitResult;
import com.lobsim.matching.TradingVenue;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Random;
import java.util.Set;

/**
 * Noise trader. Order arrivals follow a Poisson process with the configured mean
 * gap; sizes follow a power law (many small orders, few large ones). Limit prices
 * are drawn near mid, buys clustered just below it and sells further above it.
 */
public class RandomTrader implements MarketParticipant {

    private static final double SIZE_ALPHA = 2.5;
    private static final int BUY_BETA_A = 2;
    private static final int BUY_BETA_B = 5;

    private final String name;
    private final double meanSecondsBetweenTrades;
    private final double marketOrderProbability;
    private final int maxOrderSize;
    private final int priceRangeBps;
    private final Random random;
    private final Clock clock;

    private final Set<OrderId> activeOrders = new LinkedHashSet<>();
    private long lastTradeMillis;

    public RandomTrader(String name, double meanSecondsBetweenTrades, double marketOrderProbability,
                        int maxOrderSize, int priceRangeBps, Random random, Clock clock) {
        if (meanSecondsBetweenTrades <= 0 || maxOrderSize <= 0 || priceRangeBps < 0) {
            throw new IllegalArgumentException("Invalid random trader parameters for " + name);
        }
        this.name = name;
        this.meanSecondsBetweenTrades = meanSecondsBetweenTrades;
        this.marketOrderProbability = marketOrderProbability;
        this.maxOrderSize = maxOrderSize;
        this.priceRangeBps = priceRangeBps;
        this.random = random;
        this.clock = clock;
        this.lastTradeMillis = clock.millis();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void act(TradingVenue venue) {
        if (!shouldTrade()) {
            return;
        }

        double midPrice = venue.getMidPrice();
        Side side = random.nextBoolean() ? Side.BUY : Side.SELL;
        long size = generateOrderSize();

        if (random.nextDouble() < marketOrderProbability) {
            venue.submit(side, OrderType.MARKET, 0.0, size, name);
        } else {
            double price = generateLimitPrice(midPrice, side);
            SubmitResult result = venue.submit(side, OrderType.LIMIT, price, size, name);
            if (result.getStatus() == OrderStatus.RESTING) {
                result.getOrderId().ifPresent(activeOrders::add);
            }
        }

        lastTradeMillis = clock.millis();
    }

    @Override
    public void onFill(Fill fill) {
        if (name.equals(fill.getOwner()) && fill.isComplete()) {
            activeOrders.remove(fill.getOrderId());
        }
    }

    /**
     * Probability of trading grows with the time since the last order:
     * {@code 1 - exp(-elapsed / mean)}.
     */
    boolean shouldTrade() {
        double elapsedSeconds = (clock.millis() - lastTradeMillis) / 1000.0;
        double probability = 1 - Math.exp(-elapsedSeconds / meanSecondsBetweenTrades);
        return random.nextDouble() < probability;
    }

    long generateOrderSize() {
        double u = Math.pow(random.nextDouble(), 1.0 / SIZE_ALPHA);
        return Math.max(1, (long) (u * maxOrderSize));
    }

    double generateLimitPrice(double midPrice, Side side) {
        double deviation = side == Side.BUY
                ? beta(BUY_BETA_A, BUY_BETA_B)
                : beta(BUY_BETA_B, BUY_BETA_A);
        double adjustment = deviation * priceRangeBps / 10_000.0 * midPrice;
        double price = side == Side.BUY ? midPrice - adjustment : midPrice + adjustment;
        return MarketMaker.roundToCents(price);
    }

    /**
     * Beta(a, b) for integer shapes: the a-th smallest of a + b - 1 uniforms.
     */
    private double beta(int a, int b) {
        double[] samples = new double[a + b - 1];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = random.nextDouble();
        }
        Arrays.sort(samples);
        return samples[a - 1];
    }

    public Set<OrderId> getActiveOrders() {
        return Set.copyOf(activeOrders);
    }
}
