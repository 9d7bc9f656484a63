package com.algoexec.portfolio;

import com.algoexec.domain.enums.ActiveOrderStatus;
import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.ActiveOrder;
import com.algoexec.domain.model.Position;
import com.algoexec.event.EventPublisherHelper;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Consolidated view of positions, working orders and account figures.
 *
 * <p>Fed by the backtest gateway or, in live mode, by the broker callback handler through
 * the portfolio mailbox. Every accepted change publishes a typed Spring event with an
 * immutable snapshot.
 *
 * <p>A filled order leaves the active set and its ticker stays "pending refresh" until
 * the next position update for that ticker arrives; until then the order manager treats
 * the ticker as busy. Re-delivered terminal statuses for orders already removed are
 * ignored, so duplicate broker callbacks do not mark a ticker twice or emit events.
 */
@Service
public class PortfolioServer {

    private static final Logger log = LoggerFactory.getLogger(PortfolioServer.class);

    private final EventPublisherHelper eventPublisherHelper;

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final Map<Integer, ActiveOrder> activeOrders = new ConcurrentHashMap<>();
    private final Set<String> pendingRefresh = ConcurrentHashMap.newKeySet();
    private volatile AccountSnapshot account;

    public PortfolioServer(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public synchronized void updatePositions(Collection<Position> updates) {
        for (Position position : updates) {
            String ticker = position.getTicker();
            pendingRefresh.remove(ticker);
            if (position.isFlat()) {
                positions.remove(ticker);
            } else {
                positions.put(ticker, position);
            }
        }
        log.info("Positions updated ({} received): {}", updates.size(), positions.keySet());
        eventPublisherHelper.publishPositionUpdate(this, positions);
    }

    public synchronized void updateOrders(Collection<ActiveOrder> updates) {
        boolean changed = false;
        for (ActiveOrder update : updates) {
            changed |= applyOrderUpdate(update);
        }
        if (!changed) {
            log.debug("Order updates produced no change");
            return;
        }
        log.info("Active orders: {} pending refresh: {}", activeOrders.keySet(), pendingRefresh);
        eventPublisherHelper.publishOrderUpdate(this, activeOrders);
    }

    public synchronized void updateAccountDetails(AccountSnapshot snapshot) {
        this.account = snapshot;
        log.info(
                "Account updated: funds={} margin={} netLiquidation={}",
                snapshot.getAvailableFunds(),
                snapshot.getRequiredInitialMargin(),
                snapshot.getNetLiquidation());
        eventPublisherHelper.publishAccountDetailUpdate(this, snapshot);
    }

    /** Tickers the order manager must not trade: working orders plus fills awaiting a position update. */
    public Set<String> getActiveOrderTickers() {
        Set<String> tickers = new LinkedHashSet<>();
        activeOrders.values().stream()
                .map(ActiveOrder::getTicker)
                .filter(t -> t != null)
                .forEach(tickers::add);
        tickers.addAll(pendingRefresh);
        return Set.copyOf(tickers);
    }

    public Map<String, Position> getPositions() {
        return Map.copyOf(positions);
    }

    public Optional<Position> getPosition(String ticker) {
        return Optional.ofNullable(positions.get(ticker));
    }

    public Map<Integer, ActiveOrder> getActiveOrders() {
        return Map.copyOf(activeOrders);
    }

    public Optional<AccountSnapshot> getAccount() {
        return Optional.ofNullable(account);
    }

    public Set<String> getPendingRefreshTickers() {
        return Set.copyOf(pendingRefresh);
    }

    private boolean applyOrderUpdate(ActiveOrder update) {
        int orderId = update.getOrderId();
        ActiveOrder existing = activeOrders.get(orderId);
        ActiveOrderStatus status = update.getStatus();

        if (status != null && status.isTerminal()) {
            if (existing == null) {
                log.debug("Ignoring {} for order {} already out of the active set", status, orderId);
                return false;
            }
            activeOrders.remove(orderId);
            if (status == ActiveOrderStatus.FILLED) {
                String ticker = update.getTicker() != null ? update.getTicker() : existing.getTicker();
                if (ticker != null) {
                    pendingRefresh.add(ticker);
                }
                log.info("Order {} filled for {}, awaiting position refresh", orderId, ticker);
            } else {
                log.info("Order {} {} and removed", orderId, status);
            }
            return true;
        }

        ActiveOrder merged = existing == null ? update : existing.merge(update);
        activeOrders.put(orderId, merged);
        return !merged.equals(existing);
    }

    /** Snapshot of the whole portfolio for the REST view. */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("positions", positions.size());
        summary.put("activeOrders", activeOrders.size());
        summary.put("pendingRefresh", getPendingRefreshTickers());
        return summary;
    }
}
