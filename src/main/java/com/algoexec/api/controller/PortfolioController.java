package com.algoexec.api.controller;

import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.ActiveOrder;
import com.algoexec.domain.model.Position;
import com.algoexec.exception.ResourceNotFoundException;
import com.algoexec.portfolio.PortfolioServer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the portfolio server for dashboards.
 *
 * <ul>
 *   <li>GET /api/portfolio -- counts and pending-refresh tickers</li>
 *   <li>GET /api/portfolio/positions -- open positions, sorted by ticker</li>
 *   <li>GET /api/portfolio/positions/{ticker} -- one position, 404 if flat</li>
 *   <li>GET /api/portfolio/orders -- working orders, sorted by order id</li>
 *   <li>GET /api/portfolio/account -- latest account snapshot, 404 before the first one</li>
 *   <li>GET /api/portfolio/active-tickers -- tickers the order manager treats as busy</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/portfolio")
public class PortfolioController {

    private final PortfolioServer portfolioServer;

    public PortfolioController(PortfolioServer portfolioServer) {
        this.portfolioServer = portfolioServer;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> summary() {
        return ResponseEntity.ok(portfolioServer.summary());
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> listPositions() {
        List<Position> positions = new ArrayList<>(portfolioServer.getPositions().values());
        positions.sort(Comparator.comparing(Position::getTicker));
        return ResponseEntity.ok(positions);
    }

    @GetMapping("/positions/{ticker}")
    public ResponseEntity<Position> getPosition(@PathVariable String ticker) {
        return ResponseEntity.ok(portfolioServer
                .getPosition(ticker)
                .orElseThrow(() -> new ResourceNotFoundException("Position", ticker)));
    }

    @GetMapping("/orders")
    public ResponseEntity<List<ActiveOrder>> listOrders() {
        List<ActiveOrder> orders = new ArrayList<>(portfolioServer.getActiveOrders().values());
        orders.sort(Comparator.comparingInt(ActiveOrder::getOrderId));
        return ResponseEntity.ok(orders);
    }

    @GetMapping("/account")
    public ResponseEntity<AccountSnapshot> getAccount() {
        return ResponseEntity.ok(
                portfolioServer.getAccount().orElseThrow(() -> new ResourceNotFoundException("Account", "current")));
    }

    @GetMapping("/active-tickers")
    public ResponseEntity<Set<String>> activeTickers() {
        return ResponseEntity.ok(new TreeSet<>(portfolioServer.getActiveOrderTickers()));
    }
}
