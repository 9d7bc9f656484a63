package com.algoexec.strategy;

import com.algoexec.event.MarketDataEvent;
import com.algoexec.event.SignalEvent;
import java.util.List;

/**
 * Plug-in point for signal generation. Strategies are Spring beans; the engine calls each
 * of them for every market-data batch and enqueues whatever signals they return.
 */
public interface Strategy {

    String getName();

    List<SignalEvent> onMarketData(MarketDataEvent event);
}
