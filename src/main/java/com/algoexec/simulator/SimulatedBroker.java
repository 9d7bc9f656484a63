package com.algoexec.simulator;

import com.algoexec.domain.enums.Action;
import com.algoexec.domain.enums.BrokerSide;
import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.Execution;
import com.algoexec.domain.model.Instrument;
import com.algoexec.domain.model.MarketData;
import com.algoexec.domain.model.Order;
import com.algoexec.domain.model.Position;
import com.algoexec.event.EngineEventQueue;
import com.algoexec.event.ExecutionEvent;
import com.algoexec.exception.ConfigurationException;
import com.algoexec.marketdata.OrderBook;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backtest execution simulator: fills orders against the order book and keeps the
 * simulated position book and account.
 *
 * <p>Available funds is the only stateful cash figure. Equities move their full notional
 * through funds. Futures only pay commission on entry; their PnL reaches funds either at
 * end-of-day settlement ({@link #markToMarket}) or when the position is reduced. Required
 * margin, unrealized PnL and net liquidation are recomputed from the positions after every
 * change, so {@code netLiquidation = availableFunds + sum(liquidation value)} always holds.
 *
 * <p>Position netting is size-weighted and direction aware:
 * <ul>
 *   <li>open or add: fill values accumulate into the total cost; the reported average cost
 *       is total cost over quantity, rounded to 4 dp only when a snapshot is taken</li>
 *   <li>partial reduce: average cost unchanged, the closed part realizes PnL</li>
 *   <li>close: the position is removed</li>
 *   <li>flip: the old position closes, the residual opens at the fill value</li>
 * </ul>
 *
 * <p>Not thread-safe; owned by the backtest engine thread.
 */
public class SimulatedBroker {

    private static final Logger log = LoggerFactory.getLogger(SimulatedBroker.class);

    static final int COST_SCALE = 4;
    private static final int MONEY_SCALE = 8;

    private final OrderBook orderBook;
    private final EngineEventQueue eventQueue;
    private final BigDecimal initialCapital;
    private final BigDecimal defaultSlippageFactor;

    private final Map<String, Holding> holdings = new LinkedHashMap<>();
    private final Map<String, Execution> lastTrades = new LinkedHashMap<>();

    private BigDecimal availableFunds;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal totalFees = BigDecimal.ZERO;
    private AccountSnapshot account;

    public SimulatedBroker(
            OrderBook orderBook,
            EngineEventQueue eventQueue,
            BigDecimal initialCapital,
            BigDecimal defaultSlippageFactor) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new ConfigurationException("Backtest capital must be > 0");
        }
        this.orderBook = orderBook;
        this.eventQueue = eventQueue;
        this.initialCapital = initialCapital;
        this.defaultSlippageFactor = defaultSlippageFactor == null ? BigDecimal.ZERO : defaultSlippageFactor;
        this.availableFunds = initialCapital;
        this.account = revalue(null);
    }

    /**
     * Fills {@code order} at the current price plus slippage, updates the position and the
     * account, and enqueues an {@link ExecutionEvent}.
     *
     * @throws ConfigurationException if the instrument is neither an equity nor a future
     * @throws com.algoexec.exception.PriceNotFoundException if the order book has no price
     */
    public Execution placeOrder(
            Instant timestamp, long tradeId, long legId, Action action, Instrument instrument, Order order) {
        requireTradable(instrument);
        if (order.getAction() != action) {
            throw new IllegalArgumentException(
                    "Order action " + order.getAction() + " does not match " + action + " for " + instrument.getTicker());
        }
        BigDecimal marketPrice = orderBook.requirePrice(instrument.getTicker());
        BigDecimal fillPrice = marketPrice.add(slippage(instrument).multiply(BigDecimal.valueOf(action.sign())));
        return execute(timestamp, tradeId, legId, action, instrument, order, fillPrice, order.commission());
    }

    /**
     * Settles each future's PnL change since the last settlement into available funds and
     * refreshes market prices. Records no trade.
     */
    public AccountSnapshot markToMarket(Instant timestamp) {
        for (Holding holding : holdings.values()) {
            Optional<BigDecimal> price = orderBook.currentPrice(holding.instrument.getTicker());
            price.ifPresent(p -> holding.marketPrice = p);
            if (holding.instrument.isFuture()) {
                BigDecimal unrealized = holding.unrealizedPnl();
                BigDecimal delta = unrealized.subtract(holding.settledPnl);
                availableFunds = availableFunds.add(delta);
                holding.settledPnl = unrealized;
                log.debug("Settled {} for {} (unrealized {})", delta, holding.instrument.getTicker(), unrealized);
            }
        }
        account = revalue(timestamp);
        log.info(
                "Mark-to-market at {}: funds={} margin={} netLiquidation={}",
                timestamp,
                account.getAvailableFunds(),
                account.getRequiredInitialMargin(),
                account.getNetLiquidation());
        return account;
    }

    /** Refreshes market prices and the account without settling anything. */
    public AccountSnapshot updateValuation(Instant timestamp) {
        for (Holding holding : holdings.values()) {
            orderBook.currentPrice(holding.instrument.getTicker()).ifPresent(p -> holding.marketPrice = p);
        }
        account = revalue(timestamp);
        return account;
    }

    /** True when available funds no longer cover required initial margin. Only reports. */
    public boolean checkMarginCall() {
        boolean marginCall = availableFunds.compareTo(requiredMargin()) < 0;
        if (marginCall) {
            log.warn("Margin call: available funds {} below required margin {}", availableFunds, requiredMargin());
        }
        return marginCall;
    }

    /**
     * Closes every open position at the current price with no slippage and no fee, reusing
     * the instrument's last trade and leg ids. Each execution is stamped with the time of
     * the instrument's latest market data, or {@code timestamp} when there is none.
     * Returns one execution per instrument.
     */
    public List<Execution> liquidatePositions(Instant timestamp) {
        List<Execution> executions = new ArrayList<>();
        for (Holding holding : new ArrayList<>(holdings.values())) {
            Instrument instrument = holding.instrument;
            BigDecimal price = orderBook.requirePrice(instrument.getTicker());
            Action action = holding.quantity.signum() > 0 ? Action.SELL : Action.COVER;
            Order order = Order.market(instrument, action, holding.quantity.abs());
            Execution last = lastTrades.get(instrument.getTicker());
            long tradeId = last != null ? last.getTradeId() : 0L;
            long legId = last != null ? last.getLegId() : 0L;
            Instant at = orderBook.latest(instrument.getTicker()).map(MarketData::getTimestamp).orElse(timestamp);
            executions.add(execute(at, tradeId, legId, action, instrument, order, price, BigDecimal.ZERO));
        }
        log.info("Liquidated {} positions at {}", executions.size(), timestamp);
        return executions;
    }

    public Map<String, Position> getPositions() {
        Map<String, Position> positions = new LinkedHashMap<>();
        holdings.forEach((ticker, holding) -> positions.put(ticker, holding.toPosition()));
        return Collections.unmodifiableMap(positions);
    }

    /** Current position, or a flat position if the ticker is not held. */
    public Position getPosition(String ticker) {
        Holding holding = holdings.get(ticker);
        return holding == null ? Position.flat(ticker) : holding.toPosition();
    }

    public AccountSnapshot getAccount() {
        return account;
    }

    public Map<String, Execution> getLastTrades() {
        return Collections.unmodifiableMap(lastTrades);
    }

    public BigDecimal getEquityValue() {
        return account.getNetLiquidation();
    }

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    public BigDecimal getTotalFees() {
        return totalFees;
    }

    private Execution execute(
            Instant timestamp,
            long tradeId,
            long legId,
            Action action,
            Instrument instrument,
            Order order,
            BigDecimal fillPrice,
            BigDecimal fees) {
        BigDecimal quantity = order.quantity();
        BigDecimal unitValue = fillPrice.multiply(instrument.contractMultiplier());
        BigDecimal notional = unitValue.multiply(quantity);

        availableFunds = availableFunds.subtract(fees);
        totalFees = totalFees.add(fees);
        if (instrument.isEquity()) {
            availableFunds = availableFunds.subtract(notional);
        }
        BigDecimal closingPnl = applyFill(instrument, quantity, unitValue);

        Execution execution = Execution.builder()
                .timestamp(timestamp)
                .tradeId(tradeId)
                .legId(legId)
                .ticker(instrument.getTicker())
                .quantity(quantity)
                .fillPrice(fillPrice)
                .notional(notional)
                .action(action)
                .fees(fees)
                .build();
        lastTrades.put(instrument.getTicker(), execution);
        account = revalue(timestamp);

        log.debug(
                "Filled {} {} {} @ {} (fees {}, realized {}), funds now {}",
                action,
                quantity,
                instrument.getTicker(),
                fillPrice,
                fees,
                closingPnl,
                availableFunds);
        eventQueue.put(new ExecutionEvent(execution));
        return execution;
    }

    /** Nets a signed fill into the position book. Returns the PnL realized by the fill. */
    private BigDecimal applyFill(Instrument instrument, BigDecimal quantity, BigDecimal unitValue) {
        String ticker = instrument.getTicker();
        BigDecimal marketPrice = orderBook.currentPrice(ticker).orElse(null);
        Holding holding = holdings.get(ticker);
        if (holding == null) {
            holdings.put(ticker, new Holding(instrument, quantity, unitValue.multiply(quantity), marketPrice));
            return BigDecimal.ZERO;
        }
        holding.marketPrice = marketPrice;

        BigDecimal previous = holding.quantity;
        if (previous.signum() == quantity.signum()) {
            holding.totalCost = holding.totalCost.add(unitValue.multiply(quantity));
            holding.quantity = previous.add(quantity);
            return BigDecimal.ZERO;
        }

        boolean partial = quantity.abs().compareTo(previous.abs()) < 0;
        BigDecimal closedQuantity = partial ? quantity.negate() : previous;
        BigDecimal closedCost = partial
                ? holding.totalCost.multiply(quantity.abs()).divide(previous.abs(), MONEY_SCALE, RoundingMode.HALF_UP)
                : holding.totalCost;
        BigDecimal pnl = unitValue.multiply(closedQuantity).subtract(closedCost);
        BigDecimal settledShare = partial
                ? holding.settledPnl.multiply(quantity.abs()).divide(previous.abs(), MONEY_SCALE, RoundingMode.HALF_UP)
                : holding.settledPnl;
        if (instrument.isFuture()) {
            availableFunds = availableFunds.add(pnl).subtract(settledShare);
        }
        holding.settledPnl = holding.settledPnl.subtract(settledShare);
        holding.realizedPnl = holding.realizedPnl.add(pnl);
        realizedPnl = realizedPnl.add(pnl);

        BigDecimal remaining = previous.add(quantity);
        if (remaining.signum() == 0) {
            holdings.remove(ticker);
        } else if (!partial) {
            holding.quantity = remaining;
            holding.totalCost = unitValue.multiply(remaining);
            holding.settledPnl = BigDecimal.ZERO;
        } else {
            holding.quantity = remaining;
            holding.totalCost = holding.totalCost.subtract(closedCost);
        }
        return pnl;
    }

    private AccountSnapshot revalue(Instant timestamp) {
        BigDecimal margin = BigDecimal.ZERO;
        BigDecimal unrealized = BigDecimal.ZERO;
        BigDecimal liquidationValue = BigDecimal.ZERO;
        for (Holding holding : holdings.values()) {
            BigDecimal pnl = holding.unrealizedPnl();
            unrealized = unrealized.add(pnl);
            if (holding.instrument.isFuture()) {
                margin = margin.add(holding.quantity.abs().multiply(holding.instrument.getInitialMargin()));
                liquidationValue = liquidationValue.add(pnl.subtract(holding.settledPnl));
            } else {
                liquidationValue = liquidationValue.add(holding.marketValue());
            }
        }
        return AccountSnapshot.builder()
                .timestamp(timestamp)
                .availableFunds(availableFunds)
                .requiredInitialMargin(margin)
                .netLiquidation(availableFunds.add(liquidationValue))
                .unrealizedPnl(unrealized)
                .realizedPnl(realizedPnl)
                .build();
    }

    private BigDecimal requiredMargin() {
        return holdings.values().stream()
                .filter(h -> h.instrument.isFuture())
                .map(h -> h.quantity.abs().multiply(h.instrument.getInitialMargin()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private BigDecimal slippage(Instrument instrument) {
        BigDecimal factor =
                instrument.getSlippageFactor() != null ? instrument.getSlippageFactor() : defaultSlippageFactor;
        return instrument.getTickSize().multiply(factor);
    }

    private static void requireTradable(Instrument instrument) {
        if (!instrument.isEquity() && !instrument.isFuture()) {
            throw new ConfigurationException(
                    "Security type " + instrument.getSecurityType() + " is not tradable: " + instrument.getTicker());
        }
    }

    /** Mutable per-instrument state behind the immutable {@link Position} snapshots. */
    private static final class Holding {

        private final Instrument instrument;
        private BigDecimal quantity;

        /** Signed sum of fill value still held: unit value x quantity over the open fills. */
        private BigDecimal totalCost;

        private BigDecimal marketPrice;
        private BigDecimal realizedPnl = BigDecimal.ZERO;

        /** Portion of the unrealized PnL already credited to funds by mark-to-market. */
        private BigDecimal settledPnl = BigDecimal.ZERO;

        private Holding(Instrument instrument, BigDecimal quantity, BigDecimal totalCost, BigDecimal marketPrice) {
            this.instrument = instrument;
            this.quantity = quantity;
            this.totalCost = totalCost;
            this.marketPrice = marketPrice;
        }

        private BigDecimal averageCost() {
            return totalCost.divide(quantity, COST_SCALE, RoundingMode.HALF_UP);
        }

        private BigDecimal marketValue() {
            if (marketPrice == null) {
                return totalCost;
            }
            return marketPrice.multiply(instrument.contractMultiplier()).multiply(quantity);
        }

        private BigDecimal unrealizedPnl() {
            return marketValue().subtract(totalCost);
        }

        private Position toPosition() {
            return Position.builder()
                    .ticker(instrument.getTicker())
                    .securityType(instrument.getSecurityType())
                    .side(BrokerSide.of(quantity))
                    .quantity(quantity)
                    .averageCost(averageCost())
                    .priceMultiplier(instrument.getPriceMultiplier())
                    .quantityMultiplier(instrument.getQuantityMultiplier())
                    .initialMargin(instrument.getInitialMargin())
                    .marketPrice(marketPrice)
                    .unrealizedPnl(unrealizedPnl())
                    .realizedPnl(realizedPnl)
                    .build();
        }
    }
}
