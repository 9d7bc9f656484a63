package com.algoexec.unit.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.algoexec.domain.enums.ActiveOrderStatus;
import com.algoexec.domain.enums.BrokerSide;
import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.ActiveOrder;
import com.algoexec.domain.model.Position;
import com.algoexec.event.EventPublisherHelper;
import com.algoexec.portfolio.PortfolioServer;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PortfolioServerTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private PortfolioServer server;

    @BeforeEach
    void setUp() {
        server = new PortfolioServer(eventPublisherHelper);
    }

    @Test
    void updatePositions_storesAndRemovesFlat() {
        server.updatePositions(List.of(position("AAPL", "10"), position("HE", "-1")));
        server.updatePositions(List.of(Position.flat("AAPL")));

        assertThat(server.getPositions()).containsOnlyKeys("HE");
        assertThat(server.getPosition("AAPL")).isEmpty();
        verify(eventPublisherHelper, times(2)).publishPositionUpdate(any(), anyMap());
    }

    @Test
    void filledOrder_keepsTickerBusyUntilPositionUpdate() {
        server.updateOrders(List.of(order(1, "AAPL", ActiveOrderStatus.SUBMITTED)));
        assertThat(server.getActiveOrderTickers()).containsExactly("AAPL");

        server.updateOrders(List.of(ActiveOrder.builder()
                .orderId(1)
                .status(ActiveOrderStatus.FILLED)
                .build()));

        assertThat(server.getActiveOrders()).isEmpty();
        assertThat(server.getPendingRefreshTickers()).containsExactly("AAPL");
        assertThat(server.getActiveOrderTickers()).containsExactly("AAPL");

        server.updatePositions(List.of(position("AAPL", "10")));

        assertThat(server.getActiveOrderTickers()).isEmpty();
    }

    @Test
    void positionUpdate_clearsPendingEvenWhenUnchanged() {
        server.updatePositions(List.of(position("AAPL", "10")));
        server.updateOrders(List.of(order(2, "AAPL", ActiveOrderStatus.SUBMITTED)));
        server.updateOrders(List.of(order(2, "AAPL", ActiveOrderStatus.FILLED)));

        server.updatePositions(List.of(position("AAPL", "10")));

        assertThat(server.getPendingRefreshTickers()).isEmpty();
    }

    @Test
    void redeliveredTerminalStatus_isIgnored() {
        server.updateOrders(List.of(order(3, "AAPL", ActiveOrderStatus.SUBMITTED)));
        server.updateOrders(List.of(order(3, "AAPL", ActiveOrderStatus.FILLED)));
        server.updatePositions(List.of(position("AAPL", "10")));

        server.updateOrders(List.of(order(3, "AAPL", ActiveOrderStatus.FILLED)));

        assertThat(server.getPendingRefreshTickers()).isEmpty();
        verify(eventPublisherHelper, times(2)).publishOrderUpdate(any(), anyMap());
    }

    @Test
    void cancelledOrder_isRemovedWithoutPendingRefresh() {
        server.updateOrders(List.of(order(4, "HE", ActiveOrderStatus.PRE_SUBMITTED)));

        server.updateOrders(List.of(order(4, "HE", ActiveOrderStatus.CANCELLED)));

        assertThat(server.getActiveOrders()).isEmpty();
        assertThat(server.getActiveOrderTickers()).isEmpty();
    }

    @Test
    void repeatedIdenticalStatus_publishesOnce() {
        server.updateOrders(List.of(order(5, "AAPL", ActiveOrderStatus.SUBMITTED)));
        server.updateOrders(List.of(order(5, "AAPL", ActiveOrderStatus.SUBMITTED)));

        verify(eventPublisherHelper, times(1)).publishOrderUpdate(any(), anyMap());
    }

    @Test
    void statusUpdates_mergeIntoTheOpenOrder() {
        server.updateOrders(List.of(ActiveOrder.builder()
                .orderId(6)
                .ticker("AAPL")
                .side(BrokerSide.SELL)
                .totalQuantity(BigDecimal.TEN)
                .status(ActiveOrderStatus.SUBMITTED)
                .build()));

        server.updateOrders(List.of(ActiveOrder.builder()
                .orderId(6)
                .status(ActiveOrderStatus.SUBMITTED)
                .filledQuantity(new BigDecimal("3"))
                .build()));

        ActiveOrder merged = server.getActiveOrders().get(6);
        assertThat(merged.getTicker()).isEqualTo("AAPL");
        assertThat(merged.getFilledQuantity()).isEqualByComparingTo("3");
    }

    @Test
    void updateAccountDetails_publishes() {
        AccountSnapshot account = AccountSnapshot.builder()
                .availableFunds(new BigDecimal("1000"))
                .requiredInitialMargin(new BigDecimal("400"))
                .netLiquidation(new BigDecimal("1200"))
                .build();

        server.updateAccountDetails(account);

        assertThat(server.getAccount()).contains(account);
        verify(eventPublisherHelper).publishAccountDetailUpdate(server, account);
        verify(eventPublisherHelper, never()).publishOrderUpdate(any(), anyMap());
    }

    @Test
    void summary_countsEverything() {
        server.updatePositions(List.of(position("AAPL", "10")));
        server.updateOrders(List.of(order(7, "HE", ActiveOrderStatus.SUBMITTED)));

        assertThat(server.summary())
                .containsEntry("positions", 1)
                .containsEntry("activeOrders", 1)
                .containsKey("pendingRefresh");
    }

    private static Position position(String ticker, String quantity) {
        BigDecimal q = new BigDecimal(quantity);
        return Position.builder()
                .ticker(ticker)
                .side(BrokerSide.of(q))
                .quantity(q)
                .averageCost(new BigDecimal("100"))
                .build();
    }

    private static ActiveOrder order(int id, String ticker, ActiveOrderStatus status) {
        return ActiveOrder.builder().orderId(id).ticker(ticker).status(status).build();
    }
}
