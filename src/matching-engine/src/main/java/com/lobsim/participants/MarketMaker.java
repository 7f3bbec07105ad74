package com.lobsim.participants;

import com.lobsim.domain.Fill;
import com.lobsim.domain.OrderId;
import com.lobsim.domain.OrderStatus;
import com.lobsim.domain.OrderType;
import com.lobsim.domain.Side;
import com.lobsim.matching.SubmitResult;
import com.lobsim.matching.TradingVenue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Random;
import java.util.Set;

/**
 * Quotes a ladder of bids and asks around the mid price.
 *
 * Every tick the maker pulls all of its resting quotes and requotes. The spread
 * starts at {@code baseSpread} and widens with recent mid-price volatility and
 * with the size of its inventory relative to {@code inventoryLimit}. A long
 * inventory shades bids down, a short one shades asks up.
 */
public class MarketMaker implements MarketParticipant {

    private static final Logger logger = LoggerFactory.getLogger(MarketMaker.class);

    private static final double INVENTORY_SKEW = 0.1;

    private final String name;
    private final double baseSpread;
    private final int inventoryLimit;
    private final int numLevels;
    private final int minSize;
    private final int maxSize;
    private final int volatilityWindow;
    private final double inventoryRiskFactor;
    private final double volatilitySensitivity;
    private final Random random;

    private final Set<OrderId> activeOrders = new LinkedHashSet<>();
    private final Deque<Double> priceHistory = new ArrayDeque<>();
    private long inventory;
    private double lastMidPrice = Double.NaN;

    public MarketMaker(String name, Random random) {
        this(name, 1.0, 100, 3, 5, 15, 10, 0.05, 0.5, random);
    }

    public MarketMaker(String name, double baseSpread, int inventoryLimit, int numLevels,
                       int minSize, int maxSize, int volatilityWindow,
                       double inventoryRiskFactor, double volatilitySensitivity, Random random) {
        if (inventoryLimit <= 0 || numLevels <= 0 || minSize <= 0 || maxSize < minSize) {
            throw new IllegalArgumentException("Invalid market maker parameters for " + name);
        }
        this.name = name;
        this.baseSpread = baseSpread;
        this.inventoryLimit = inventoryLimit;
        this.numLevels = numLevels;
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.volatilityWindow = volatilityWindow;
        this.inventoryRiskFactor = inventoryRiskFactor;
        this.volatilitySensitivity = volatilitySensitivity;
        this.random = random;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void act(TradingVenue venue) {
        cancelAllOrders(venue);

        double midPrice = venue.getMidPrice();
        updatePriceHistory(midPrice);

        double spread = calculateSpread(calculateVolatility());
        placeQuotes(venue, midPrice, spread);

        lastMidPrice = midPrice;
    }

    @Override
    public void onFill(Fill fill) {
        if (!name.equals(fill.getOwner())) {
            return;
        }
        if (fill.getSide() == Side.BUY) {
            inventory += fill.getQuantity();
        } else {
            inventory -= fill.getQuantity();
        }
        if (fill.isComplete()) {
            activeOrders.remove(fill.getOrderId());
        }
    }

    void cancelAllOrders(TradingVenue venue) {
        for (OrderId orderId : activeOrders) {
            venue.cancel(orderId);
        }
        activeOrders.clear();
    }

    void updatePriceHistory(double midPrice) {
        priceHistory.addLast(midPrice);
        while (priceHistory.size() > volatilityWindow) {
            priceHistory.removeFirst();
        }
    }

    /**
     * Population standard deviation of the recent mid prices; 0 with fewer than two samples.
     */
    double calculateVolatility() {
        if (priceHistory.size() < 2) {
            return 0.0;
        }
        double mean = 0.0;
        for (double p : priceHistory) {
            mean += p;
        }
        mean /= priceHistory.size();
        double sumSq = 0.0;
        for (double p : priceHistory) {
            sumSq += (p - mean) * (p - mean);
        }
        return Math.sqrt(sumSq / priceHistory.size());
    }

    double calculateSpread(double volatility) {
        double volComponent = volatilitySensitivity * volatility;
        double invFactor = (double) Math.abs(inventory) / inventoryLimit;
        double invComponent = invFactor * inventoryRiskFactor * baseSpread;
        return baseSpread + volComponent + invComponent;
    }

    private void placeQuotes(TradingVenue venue, double midPrice, double spread) {
        double halfSpread = spread / 2.0;

        for (int level = 0; level < numLevels; level++) {
            double offset = halfSpread + level * (spread / numLevels);

            double bidPrice = roundToCents(midPrice - offset);
            double askPrice = roundToCents(midPrice + offset);
            long size = minSize + random.nextInt(maxSize - minSize + 1);

            if (inventory > 0) {
                bidPrice -= ((double) inventory / inventoryLimit) * INVENTORY_SKEW;
            } else if (inventory < 0) {
                askPrice += ((double) -inventory / inventoryLimit) * INVENTORY_SKEW;
            }

            quote(venue, Side.BUY, bidPrice, size);
            quote(venue, Side.SELL, askPrice, size);
        }
    }

    private void quote(TradingVenue venue, Side side, double price, long size) {
        if (price <= 0) {
            logger.debug("{} skipping {} quote at non-positive price {}", name, side, price);
            return;
        }
        SubmitResult result = venue.submit(side, OrderType.LIMIT, price, size, name);
        if (result.getStatus() == OrderStatus.RESTING) {
            result.getOrderId().ifPresent(activeOrders::add);
        }
    }

    static double roundToCents(double price) {
        return Math.round(price * 100.0) / 100.0;
    }

    public long getInventory() {
        return inventory;
    }

    public double getLastMidPrice() {
        return lastMidPrice;
    }

    public Set<OrderId> getActiveOrders() {
        return Set.copyOf(activeOrders);
    }
}
