package com.algoexec.broker;

import com.algoexec.event.EodEvent;
import com.algoexec.event.ExecutionEvent;
import com.algoexec.event.MarketDataEvent;
import com.algoexec.event.OrderEvent;
import java.time.Instant;

/**
 * The engine's only route to a broker, simulated or real. The engine loop calls it for
 * every ORDER event and forwards market, execution and end-of-day events to it.
 *
 * <p>Two implementations exist, selected by {@code algoexec.mode}:
 * <ul>
 *   <li>{@code BacktestBrokerGateway}: fills against the simulator</li>
 *   <li>{@code LiveBrokerClient}: routes to the broker through a {@link BrokerTransport}</li>
 * </ul>
 */
public interface BrokerGateway {

    /** Connects (live) or publishes the opening account (backtest). Must precede any order. */
    void start();

    /**
     * Routes an accepted order.
     *
     * @throws com.algoexec.exception.BrokerException if the broker is not ready
     */
    void placeOrder(OrderEvent event);

    default void onMarketData(MarketDataEvent event) {}

    default void onExecution(ExecutionEvent event) {}

    default void onEndOfDay(EodEvent event) {}

    /** Ends the session: liquidation in backtests, final account summary and disconnect live. */
    void stop(Instant timestamp);
}
