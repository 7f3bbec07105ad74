package com.lobsim.matching;

import com.lobsim.domain.BookSnapshot;
import com.lobsim.domain.OrderId;
import com.lobsim.domain.OrderType;
import com.lobsim.domain.Side;
import com.lobsim.domain.Trade;

import java.util.List;

/**
 * The view of the market that participants act on.
 */
public interface TradingVenue {

    /**
     * Submit an order. MARKET orders ignore {@code price}.
     *
     * @throws InvalidOrderException if the quantity is not positive or a limit price is
     *                               not a finite positive number
     */
    SubmitResult submit(Side side, OrderType type, double price, long quantity, String owner);

    boolean cancel(OrderId orderId);

    BookSnapshot getBook();

    double getMidPrice();

    List<Trade> getTradeLog();
}
