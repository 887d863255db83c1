package com.pairarb.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.pairarb.config.PaperBrokerProperties;
import com.pairarb.domain.enums.OrderStatus;
import com.pairarb.domain.model.Instrument;
import com.pairarb.event.ExecutionEventPublisher;
import com.pairarb.event.OrderUpdateEvent;
import com.pairarb.exception.BrokerException;
import com.pairarb.simulator.InMemoryMarketDataProvider;
import com.pairarb.simulator.PaperBrokerGateway;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for PaperBrokerGateway covering immediate fills at the taker price,
 * rejection without a price, and manual fills when auto-fill is off.
 */
class PaperBrokerGatewayTest {

    private static final Instrument X = Instrument.crypto("XSTK", "GATE");
    private static final Instant T0 = Instant.parse("2026-03-02T15:00:00Z");

    private ExecutionEventPublisher executionEventPublisher;
    private PaperBrokerProperties paperBrokerProperties;
    private InMemoryMarketDataProvider marketData;
    private PaperBrokerGateway paperBroker;

    @BeforeEach
    void setUp() {
        executionEventPublisher = mock(ExecutionEventPublisher.class);
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        marketData = new InMemoryMarketDataProvider(executionEventPublisher, clock);
        marketData.updateQuote(X, new BigDecimal("99"), new BigDecimal("100"), new BigDecimal("99.5"));
        paperBrokerProperties = new PaperBrokerProperties();
        paperBroker = new PaperBrokerGateway(marketData, executionEventPublisher, paperBrokerProperties, clock);
    }

    private List<OrderUpdateEvent> publishedEvents() {
        ArgumentCaptor<OrderUpdateEvent> captor = ArgumentCaptor.forClass(OrderUpdateEvent.class);
        verify(executionEventPublisher, atLeastOnce()).publishOrderUpdate(captor.capture());
        return captor.getAllValues();
    }

    @Nested
    @DisplayName("Auto-Fill")
    class AutoFill {

        @Test
        @DisplayName("Buy is acknowledged, then filled at the best ask with a fee")
        void buyFillsAtAsk() {
            String orderId = paperBroker.submitMarketOrder(X, new BigDecimal("10"), "PX-1");

            List<OrderUpdateEvent> events = publishedEvents();
            assertThat(events).extracting(OrderUpdateEvent::getStatus)
                    .containsExactly(OrderStatus.SUBMITTED, OrderStatus.FILLED);
            OrderUpdateEvent fill = events.get(1);
            assertThat(fill.getOrderId()).isEqualTo(orderId);
            assertThat(fill.getTag()).isEqualTo("PX-1");
            assertThat(fill.getFillQuantity()).isEqualByComparingTo("10");
            assertThat(fill.getFillPrice()).isEqualByComparingTo("100");
            assertThat(fill.getFee()).isEqualByComparingTo("1.000");
            assertThat(paperBroker.getOrderStatus(orderId)).contains(OrderStatus.FILLED);
        }

        @Test
        @DisplayName("Sell fills at the best bid")
        void sellFillsAtBid() {
            paperBroker.submitMarketOrder(X, new BigDecimal("-5"), "PX-1");

            OrderUpdateEvent fill = publishedEvents().get(1);
            assertThat(fill.getFillQuantity()).isEqualByComparingTo("-5");
            assertThat(fill.getFillPrice()).isEqualByComparingTo("99");
        }

        @Test
        @DisplayName("No price rejects the order as INVALID")
        void noPriceRejects() {
            Instrument unpriced = Instrument.crypto("NOPX", "GATE");

            String orderId = paperBroker.submitMarketOrder(unpriced, BigDecimal.ONE, "PX-1");

            assertThat(publishedEvents()).extracting(OrderUpdateEvent::getStatus)
                    .containsExactly(OrderStatus.SUBMITTED, OrderStatus.INVALID);
            assertThat(paperBroker.getOrderStatus(orderId)).contains(OrderStatus.INVALID);
        }

        @Test
        @DisplayName("Zero quantity is refused synchronously")
        void zeroQuantity() {
            assertThatThrownBy(() -> paperBroker.submitMarketOrder(X, BigDecimal.ZERO, "PX-1"))
                    .isInstanceOf(BrokerException.class);
        }
    }

    @Nested
    @DisplayName("Manual Fills")
    class ManualFills {

        @BeforeEach
        void disableAutoFill() {
            paperBrokerProperties.setAutoFill(false);
        }

        @Test
        @DisplayName("Orders rest until filled, and partial fills accumulate")
        void partialThenComplete() {
            String orderId = paperBroker.submitMarketOrder(X, new BigDecimal("10"), "PX-1");
            assertThat(paperBroker.getOpenOrderIds()).containsExactly(orderId);

            paperBroker.fill(orderId, new BigDecimal("4"), new BigDecimal("100"));
            assertThat(paperBroker.getOrderStatus(orderId)).contains(OrderStatus.PARTIALLY_FILLED);
            paperBroker.fill(orderId, new BigDecimal("6"), new BigDecimal("101"));

            assertThat(paperBroker.getOrderStatus(orderId)).contains(OrderStatus.FILLED);
            assertThat(paperBroker.getOpenOrderIds()).isEmpty();
            assertThat(publishedEvents()).extracting(OrderUpdateEvent::getStatus)
                    .containsExactly(OrderStatus.SUBMITTED, OrderStatus.PARTIALLY_FILLED, OrderStatus.FILLED);
        }

        @Test
        @DisplayName("Overfill is refused")
        void overfill() {
            String orderId = paperBroker.submitMarketOrder(X, new BigDecimal("10"), "PX-1");

            assertThatThrownBy(() -> paperBroker.fill(orderId, new BigDecimal("11"), new BigDecimal("100")))
                    .isInstanceOf(BrokerException.class);
        }

        @Test
        @DisplayName("fillAll fills every resting order at the current price")
        void fillAll() {
            paperBroker.submitMarketOrder(X, new BigDecimal("10"), "PX-1");
            paperBroker.submitMarketOrder(X, new BigDecimal("-3"), "PX-2");

            assertThat(paperBroker.fillAll()).isEqualTo(2);
            assertThat(paperBroker.getOpenOrderIds()).isEmpty();
        }

        @Test
        @DisplayName("Canceled order cannot be filled afterwards")
        void cancelCloses() {
            String orderId = paperBroker.submitMarketOrder(X, new BigDecimal("10"), "PX-1");

            paperBroker.cancel(orderId);

            assertThat(paperBroker.getOrderStatus(orderId)).contains(OrderStatus.CANCELED);
            assertThatThrownBy(() -> paperBroker.fill(orderId, BigDecimal.ONE, new BigDecimal("100")))
                    .isInstanceOf(BrokerException.class);
        }
    }
}
