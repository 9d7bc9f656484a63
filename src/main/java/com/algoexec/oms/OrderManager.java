package com.algoexec.oms;

import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.Instrument;
import com.algoexec.domain.model.Order;
import com.algoexec.domain.model.Position;
import com.algoexec.domain.model.TradeInstruction;
import com.algoexec.event.EngineEventQueue;
import com.algoexec.event.OrderEvent;
import com.algoexec.event.SignalEvent;
import com.algoexec.exception.ConfigurationException;
import com.algoexec.instrument.InstrumentRegistry;
import com.algoexec.marketdata.OrderBook;
import com.algoexec.observability.EngineMetricsService;
import com.algoexec.portfolio.PortfolioServer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns strategy signals into orders, all or nothing.
 *
 * <p>A signal is dropped when any of its tickers has a working order or a fill awaiting a
 * position refresh, when an exit has no position to close, or when the combined capital
 * requirement exceeds free capital ({@code availableFunds - requiredInitialMargin}).
 * Futures require {@code |q| x initial margin}; equities require {@code |q| x price}.
 *
 * <p>Rejections are business outcomes: they are logged and counted, never thrown.
 */
@Service
public class OrderManager {

    private static final Logger log = LoggerFactory.getLogger(OrderManager.class);

    static final int QUANTITY_SCALE = 4;

    private final InstrumentRegistry instrumentRegistry;
    private final OrderBook orderBook;
    private final PortfolioServer portfolioServer;
    private final EngineEventQueue eventQueue;
    private final EngineMetricsService metricsService;

    public OrderManager(
            InstrumentRegistry instrumentRegistry,
            OrderBook orderBook,
            PortfolioServer portfolioServer,
            EngineEventQueue eventQueue,
            EngineMetricsService metricsService) {
        this.instrumentRegistry = instrumentRegistry;
        this.orderBook = orderBook;
        this.portfolioServer = portfolioServer;
        this.eventQueue = eventQueue;
        this.metricsService = metricsService;
    }

    /**
     * Validates the signal and enqueues one {@link OrderEvent} per instruction, or none.
     *
     * @return the enqueued order events; empty when the signal was rejected
     * @throws com.algoexec.exception.InstrumentNotFoundException for a ticker outside the registry
     * @throws com.algoexec.exception.PriceNotFoundException for a ticker without market data
     */
    public List<OrderEvent> onSignal(SignalEvent signal) {
        Set<String> busy = portfolioServer.getActiveOrderTickers();
        for (String ticker : signal.tickers()) {
            if (busy.contains(ticker)) {
                return reject(signal, "ticker " + ticker + " has an active order or pending fill");
            }
        }

        Optional<AccountSnapshot> account = portfolioServer.getAccount();
        if (account.isEmpty()) {
            return reject(signal, "no account details received yet");
        }

        List<OrderEvent> orders = new ArrayList<>();
        BigDecimal totalRequirement = BigDecimal.ZERO;
        for (TradeInstruction instruction : signal.getInstructions()) {
            Instrument instrument = instrumentRegistry.get(instruction.getTicker());
            requireTradable(instrument);
            BigDecimal price = orderBook.requirePrice(instrument.getTicker());

            Optional<BigDecimal> quantity = resolveQuantity(signal, instruction, instrument, price);
            if (quantity.isEmpty()) {
                return reject(signal, "could not size " + instruction.getAction() + " " + instruction.getTicker());
            }

            Order order = Order.of(
                    instrument,
                    instruction.getAction(),
                    quantity.get(),
                    instruction.getOrderType(),
                    instruction.getLimitPrice(),
                    instruction.getAuxPrice());
            totalRequirement = totalRequirement.add(requirement(instrument, order, price));
            orders.add(new OrderEvent(signal.getTimestamp(), instruction.getTradeId(), instruction.getLegId(), order));
        }

        BigDecimal freeCapital = account.get().freeCapital();
        if (freeCapital.compareTo(totalRequirement) < 0) {
            return reject(signal, "requirement " + totalRequirement + " exceeds free capital " + freeCapital);
        }

        orders.forEach(eventQueue::put);
        log.info("Signal accepted at {}: {} orders for {}", signal.getTimestamp(), orders.size(), signal.tickers());
        return orders;
    }

    /** Capital a single order ties up: margin for futures, quoted price for equities. */
    BigDecimal requirement(Instrument instrument, Order order, BigDecimal price) {
        BigDecimal quantity = order.quantity().abs();
        if (instrument.isFuture()) {
            return quantity.multiply(instrument.getInitialMargin());
        }
        return quantity.multiply(price);
    }

    private Optional<BigDecimal> resolveQuantity(
            SignalEvent signal, TradeInstruction instruction, Instrument instrument, BigDecimal price) {
        if (instruction.getQuantity() != null) {
            return Optional.of(instruction.getQuantity().abs());
        }
        if (instruction.getAction().isExit()) {
            return portfolioServer
                    .getPosition(instrument.getTicker())
                    .filter(p -> !p.isFlat())
                    .map(Position::getQuantity)
                    .map(BigDecimal::abs);
        }
        BigDecimal capital = signal.getTradeCapital();
        if (capital == null || capital.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal unitValue = price.multiply(instrument.contractMultiplier());
        BigDecimal sized = capital.multiply(instruction.getWeight().abs())
                .divide(unitValue, QUANTITY_SCALE, RoundingMode.DOWN);
        return sized.signum() > 0 ? Optional.of(sized) : Optional.empty();
    }

    private List<OrderEvent> reject(SignalEvent signal, String reason) {
        log.info("Signal at {} for {} rejected: {}", signal.getTimestamp(), signal.tickers(), reason);
        metricsService.recordSignalRejected();
        return List.of();
    }

    private static void requireTradable(Instrument instrument) {
        if (!instrument.isEquity() && !instrument.isFuture()) {
            throw new ConfigurationException(
                    "Security type " + instrument.getSecurityType() + " is not tradable: " + instrument.getTicker());
        }
    }
}
