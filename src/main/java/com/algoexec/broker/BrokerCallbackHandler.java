package com.algoexec.broker;

import com.algoexec.domain.enums.ActiveOrderStatus;
import com.algoexec.domain.enums.BrokerSide;
import com.algoexec.domain.enums.ConnectionState;
import com.algoexec.domain.enums.OrderType;
import com.algoexec.domain.enums.SecurityType;
import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.ActiveOrder;
import com.algoexec.domain.model.Instrument;
import com.algoexec.domain.model.Position;
import com.algoexec.instrument.InstrumentRegistry;
import com.algoexec.observability.EngineMetricsService;
import com.algoexec.performance.PerformanceRecorder;
import com.algoexec.portfolio.PortfolioServer;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Receives every broker callback and turns it into engine state.
 *
 * <p>Callbacks run on the transport's reader thread. Portfolio mutations are posted to the
 * {@link PortfolioMailbox}; handshake progress is signalled through per-stage latches that
 * {@link LiveBrokerClient} waits on.
 *
 * <p>Account values arrive one key at a time. They are buffered and published as a single
 * {@link AccountSnapshot} once the stream has been quiet for the debounce interval, or
 * immediately when the broker signals the end of the account download.
 */
public class BrokerCallbackHandler implements BrokerCallbacks {

    private static final Logger log = LoggerFactory.getLogger(BrokerCallbackHandler.class);

    static final int WRONG_ENDPOINT = 502;
    static final int CONTRACT_NOT_FOUND = 200;
    static final String CURRENCY_KEY = "Currency";
    private static final Set<Integer> INFORMATIONAL = Set.of(2104, 2106, 2107, 2108, 2158);

    /** Whole-portfolio figures: the Full* keys carry no intraday discounts or credits. */
    private static final Map<String, AccountField> ACCOUNT_FIELDS = Map.of(
            "NetLiquidation", AccountSnapshot.AccountSnapshotBuilder::netLiquidation,
            "FullAvailableFunds", AccountSnapshot.AccountSnapshotBuilder::availableFunds,
            "FullInitMarginReq", AccountSnapshot.AccountSnapshotBuilder::requiredInitialMargin,
            "UnrealizedPnL", AccountSnapshot.AccountSnapshotBuilder::unrealizedPnl,
            "RealizedPnL", AccountSnapshot.AccountSnapshotBuilder::realizedPnl,
            "FullMaintMarginReq", AccountSnapshot.AccountSnapshotBuilder::maintenanceMargin,
            "ExcessLiquidity", AccountSnapshot.AccountSnapshotBuilder::excessLiquidity,
            "BuyingPower", AccountSnapshot.AccountSnapshotBuilder::buyingPower,
            "FuturesPNL", AccountSnapshot.AccountSnapshotBuilder::futuresPnl,
            "TotalCashBalance", AccountSnapshot.AccountSnapshotBuilder::totalCashBalance);

    private final PortfolioMailbox mailbox;
    private final PortfolioServer portfolioServer;
    private final ContractValidator contractValidator;
    private final OrderIdAllocator orderIdAllocator;
    private final PerformanceRecorder performanceRecorder;
    private final EngineMetricsService metricsService;
    private final InstrumentRegistry instrumentRegistry;
    private final ProcessTerminator processTerminator;
    private final TaskScheduler taskScheduler;
    private final Duration accountDebounce;

    private final AtomicReference<ConnectionState> connectionState =
            new AtomicReference<>(ConnectionState.DISCONNECTED);
    private volatile Map<HandshakeStage, CountDownLatch> handshakeLatches = newLatches();

    private final Object accountLock = new Object();
    private final Map<String, BigDecimal> accountValues = new LinkedHashMap<>();
    private String accountCurrency;
    private ScheduledFuture<?> pendingAccountFlush;

    private final Map<Integer, Map<String, String>> accountSummaries = new ConcurrentHashMap<>();
    private final Map<Integer, CompletableFuture<Map<String, String>>> accountSummaryWaiters =
            new ConcurrentHashMap<>();

    public BrokerCallbackHandler(
            PortfolioMailbox mailbox,
            PortfolioServer portfolioServer,
            ContractValidator contractValidator,
            OrderIdAllocator orderIdAllocator,
            PerformanceRecorder performanceRecorder,
            EngineMetricsService metricsService,
            InstrumentRegistry instrumentRegistry,
            ProcessTerminator processTerminator,
            TaskScheduler taskScheduler,
            Duration accountDebounce) {
        this.mailbox = mailbox;
        this.portfolioServer = portfolioServer;
        this.contractValidator = contractValidator;
        this.orderIdAllocator = orderIdAllocator;
        this.performanceRecorder = performanceRecorder;
        this.metricsService = metricsService;
        this.instrumentRegistry = instrumentRegistry;
        this.processTerminator = processTerminator;
        this.taskScheduler = taskScheduler;
        this.accountDebounce = accountDebounce;
    }

    // ---- Session state ----

    /** Arms fresh handshake latches and moves to CONNECTING. */
    public void beginHandshake() {
        handshakeLatches = newLatches();
        connectionState.set(ConnectionState.CONNECTING);
    }

    public boolean awaitStage(HandshakeStage stage, Duration timeout) throws InterruptedException {
        return handshakeLatches.get(stage).await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void markReady() {
        connectionState.set(ConnectionState.READY);
    }

    public void markDisconnected() {
        connectionState.set(ConnectionState.DISCONNECTED);
    }

    public ConnectionState getConnectionState() {
        return connectionState.get();
    }

    /** Registers interest in the summary for {@code reqId}; completes on accountSummaryEnd. */
    public CompletableFuture<Map<String, String>> expectAccountSummary(int reqId) {
        CompletableFuture<Map<String, String>> waiter = new CompletableFuture<>();
        accountSummaries.put(reqId, new LinkedHashMap<>());
        accountSummaryWaiters.put(reqId, waiter);
        return waiter;
    }

    // ---- Connection ----

    @Override
    public void connectAck() {
        log.info("Broker connection acknowledged");
        handshakeLatches.get(HandshakeStage.CONNECT_ACK).countDown();
    }

    @Override
    public void connectionClosed() {
        connectionState.set(ConnectionState.DISCONNECTED);
        log.warn("Broker connection closed; orders are refused until reconnect");
    }

    @Override
    public void nextValidId(int orderId) {
        orderIdAllocator.reset(orderId);
        handshakeLatches.get(HandshakeStage.NEXT_VALID_ID).countDown();
    }

    // ---- Contracts ----

    @Override
    public void contractDetails(int reqId, String symbol) {
        log.debug("Contract details for {} (request {})", symbol, reqId);
        contractValidator.onContractDetails(reqId);
    }

    @Override
    public void contractDetailsEnd(int reqId) {
        contractValidator.onContractDetailsEnd(reqId);
    }

    // ---- Account ----

    @Override
    public void updateAccountValue(String key, String value, String currency, String account) {
        if (CURRENCY_KEY.equals(key)) {
            if (value != null && !value.isBlank()) {
                synchronized (accountLock) {
                    accountCurrency = value;
                }
            }
            return;
        }
        if (!ACCOUNT_FIELDS.containsKey(key)) {
            return;
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric account value {}={}", key, value);
            return;
        }
        synchronized (accountLock) {
            accountValues.put(key, parsed);
            if (pendingAccountFlush != null) {
                pendingAccountFlush.cancel(false);
            }
            pendingAccountFlush =
                    taskScheduler.schedule(this::flushAccountValues, Instant.now().plus(accountDebounce));
        }
    }

    @Override
    public void accountDownloadEnd(String account) {
        log.info("Account download complete for {}", account);
        flushAccountValues();
        handshakeLatches.get(HandshakeStage.ACCOUNT_DOWNLOAD).countDown();
    }

    @Override
    public void updatePortfolio(PortfolioReport report) {
        Position position = toPosition(report);
        mailbox.post("position " + report.getSymbol(), () -> portfolioServer.updatePositions(List.of(position)));
    }

    @Override
    public void accountSummary(int reqId, String account, String tag, String value, String currency) {
        Map<String, String> values = accountSummaries.get(reqId);
        if (values == null) {
            log.debug("Unsolicited account summary {} for request {}", tag, reqId);
            return;
        }
        synchronized (values) {
            values.put(tag, value == null ? "" : value);
        }
    }

    @Override
    public void accountSummaryEnd(int reqId) {
        Map<String, String> values = accountSummaries.remove(reqId);
        CompletableFuture<Map<String, String>> waiter = accountSummaryWaiters.remove(reqId);
        if (values == null) {
            return;
        }
        Map<String, String> snapshot;
        synchronized (values) {
            snapshot = Map.copyOf(values);
        }
        performanceRecorder.recordAccountSummary(snapshot);
        log.info("Account summary received: {}", snapshot);
        if (waiter != null) {
            waiter.complete(snapshot);
        }
    }

    // ---- Orders ----

    @Override
    public void openOrder(OpenOrderReport report) {
        ActiveOrder order = ActiveOrder.builder()
                .orderId(report.getOrderId())
                .permId(report.getPermId())
                .clientId(report.getClientId())
                .parentId(report.getParentId())
                .account(report.getAccount())
                .ticker(report.getSymbol())
                .securityType(parse(report.getSecurityType(), SecurityType::fromBrokerCode))
                .venue(report.getExchange())
                .side(parse(report.getAction(), BrokerSide::fromBrokerAction))
                .orderType(parse(report.getOrderType(), OrderType::fromBrokerCode))
                .totalQuantity(report.getTotalQuantity())
                .limitPrice(report.getLimitPrice())
                .auxPrice(report.getAuxPrice())
                .status(parse(report.getStatus(), ActiveOrderStatus::fromBrokerName))
                .build();
        mailbox.post("open order " + report.getOrderId(), () -> portfolioServer.updateOrders(List.of(order)));
    }

    @Override
    public void openOrderEnd() {
        log.info("Open orders download complete");
        handshakeLatches.get(HandshakeStage.OPEN_ORDERS).countDown();
    }

    @Override
    public void orderStatus(OrderStatusReport report) {
        ActiveOrder order = ActiveOrder.builder()
                .orderId(report.getOrderId())
                .permId(report.getPermId())
                .clientId(report.getClientId())
                .parentId(report.getParentId())
                .status(parse(report.getStatus(), ActiveOrderStatus::fromBrokerName))
                .filledQuantity(report.getFilled())
                .remainingQuantity(report.getRemaining())
                .averageFillPrice(report.getAverageFillPrice())
                .lastFillPrice(report.getLastFillPrice())
                .whyHeld(report.getWhyHeld())
                .build();
        mailbox.post("order status " + report.getOrderId(), () -> portfolioServer.updateOrders(List.of(order)));
    }

    // ---- Executions ----

    @Override
    public void execDetails(int reqId, ExecutionReport report) {
        performanceRecorder.recordLiveExecution(report);
        metricsService.recordExecution();
    }

    @Override
    public void commissionReport(String execId, BigDecimal commission, String currency) {
        performanceRecorder.recordCommission(execId, commission);
    }

    // ---- Errors ----

    @Override
    public void error(int id, int code, String message) {
        if (code == WRONG_ENDPOINT) {
            log.error("Broker endpoint unreachable or wrong port (code {}): {}", code, message);
            processTerminator.terminate(1, "Broker error " + code + ": " + message);
        } else if (code == CONTRACT_NOT_FOUND) {
            log.warn("Contract not found for request {}: {}", id, message);
            contractValidator.onContractNotFound(id);
        } else if (INFORMATIONAL.contains(code)) {
            log.debug("Broker notice {}: {}", code, message);
        } else {
            log.warn("Broker error {} for id {}: {}", code, id, message);
        }
    }

    /** Builds and publishes one snapshot from the buffered account values. */
    void flushAccountValues() {
        AccountSnapshot snapshot;
        synchronized (accountLock) {
            if (pendingAccountFlush != null) {
                pendingAccountFlush.cancel(false);
                pendingAccountFlush = null;
            }
            if (accountValues.isEmpty()) {
                return;
            }
            AccountSnapshot.AccountSnapshotBuilder builder =
                    AccountSnapshot.builder().timestamp(Instant.now()).currency(accountCurrency);
            accountValues.forEach((key, value) -> ACCOUNT_FIELDS.get(key).apply(builder, value));
            snapshot = builder.build();
        }
        mailbox.post("account details", () -> {
            portfolioServer.updateAccountDetails(snapshot);
            performanceRecorder.recordAccount(snapshot);
            performanceRecorder.recordEquity(snapshot.getTimestamp(), snapshot.getNetLiquidation());
        });
    }

    private Position toPosition(PortfolioReport report) {
        Optional<Instrument> instrument = instrumentRegistry.find(report.getSymbol());
        BigDecimal quantity = report.getPosition() == null ? BigDecimal.ZERO : report.getPosition();
        return Position.builder()
                .ticker(report.getSymbol())
                .securityType(parse(report.getSecurityType(), SecurityType::fromBrokerCode))
                .side(BrokerSide.of(quantity))
                .quantity(quantity)
                .averageCost(report.getAverageCost())
                .priceMultiplier(instrument.map(Instrument::getPriceMultiplier).orElse(BigDecimal.ONE))
                .quantityMultiplier(instrument.map(Instrument::getQuantityMultiplier).orElse(BigDecimal.ONE))
                .initialMargin(instrument.map(Instrument::getInitialMargin).orElse(BigDecimal.ZERO))
                .marketPrice(report.getMarketPrice())
                .unrealizedPnl(report.getUnrealizedPnl())
                .realizedPnl(report.getRealizedPnl())
                .build();
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unrecognised broker value '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static Map<HandshakeStage, CountDownLatch> newLatches() {
        Map<HandshakeStage, CountDownLatch> latches = new EnumMap<>(HandshakeStage.class);
        for (HandshakeStage stage : HandshakeStage.values()) {
            latches.put(stage, new CountDownLatch(1));
        }
        return latches;
    }

    @FunctionalInterface
    private interface AccountField {
        AccountSnapshot.AccountSnapshotBuilder apply(AccountSnapshot.AccountSnapshotBuilder builder, BigDecimal value);
    }
}
