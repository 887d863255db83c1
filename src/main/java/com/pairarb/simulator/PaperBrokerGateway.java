package com.pairarb.simulator;

import com.pairarb.broker.OrderGateway;
import com.pairarb.config.PaperBrokerProperties;
import com.pairarb.domain.enums.OrderStatus;
import com.pairarb.domain.model.Instrument;
import com.pairarb.event.ExecutionEventPublisher;
import com.pairarb.event.OrderUpdateEvent;
import com.pairarb.exception.BrokerException;
import com.pairarb.marketdata.MarketDataProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Paper trading implementation of {@link OrderGateway}.
 *
 * <p>Every submission is acknowledged immediately. With auto-fill on (the default), a
 * market order then fills in full at the current taker price (best ask for buys, best bid
 * for sells, last price as fallback), or is rejected as INVALID when no price is known.
 * With auto-fill off, orders rest until {@link #fill}, {@link #fillAll}, {@link #reject}
 * or {@link #cancel} is called.
 *
 * <p>Order events are published synchronously, so with auto-fill the whole lifecycle
 * completes before {@link #submitMarketOrder} returns.
 */
@Service
public class PaperBrokerGateway implements OrderGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperBrokerGateway.class);

    private final MarketDataProvider marketDataProvider;
    private final ExecutionEventPublisher executionEventPublisher;
    private final PaperBrokerProperties paperBrokerProperties;
    private final Clock clock;

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, PaperOrder> orders = new ConcurrentHashMap<>();

    public PaperBrokerGateway(
            MarketDataProvider marketDataProvider,
            ExecutionEventPublisher executionEventPublisher,
            PaperBrokerProperties paperBrokerProperties,
            Clock clock) {
        this.marketDataProvider = marketDataProvider;
        this.executionEventPublisher = executionEventPublisher;
        this.paperBrokerProperties = paperBrokerProperties;
        this.clock = clock;
    }

    @Override
    public String submitMarketOrder(Instrument instrument, BigDecimal signedQuantity, String tag) {
        if (signedQuantity == null || signedQuantity.signum() == 0) {
            throw new BrokerException("Paper order for " + instrument + " needs a non-zero quantity");
        }
        String orderId = "PAPER-" + sequence.incrementAndGet();
        PaperOrder order = new PaperOrder(orderId, instrument, signedQuantity, tag);
        orders.put(orderId, order);

        log.debug("Paper order {} accepted: {} {} tag={}", orderId, instrument, signedQuantity, tag);
        executionEventPublisher.publishOrderUpdate(
                OrderUpdateEvent.acknowledged(this, orderId, instrument, signedQuantity, tag, clock.instant()));

        if (paperBrokerProperties.isAutoFill()) {
            BigDecimal price = marketDataProvider.takerPrice(instrument, signedQuantity.signum() > 0);
            if (price.signum() > 0) {
                fill(orderId, signedQuantity, price);
            } else {
                reject(orderId, "No price available for " + instrument);
            }
        }
        return orderId;
    }

    /**
     * Fills part or all of a resting order.
     *
     * @param fillQuantity signed quantity, same sign as the order, at most the unfilled remainder
     * @throws BrokerException if the order is unknown, closed, or the quantity does not fit
     */
    public void fill(String orderId, BigDecimal fillQuantity, BigDecimal price) {
        PaperOrder order = openOrder(orderId);
        BigDecimal unfilled = order.quantity.subtract(order.filled);
        if (fillQuantity.signum() != order.quantity.signum() || fillQuantity.abs().compareTo(unfilled.abs()) > 0) {
            throw new BrokerException("Fill " + fillQuantity + " does not fit order " + orderId + " with " + unfilled
                    + " unfilled");
        }
        order.filled = order.filled.add(fillQuantity);
        boolean complete = order.filled.compareTo(order.quantity) == 0;
        order.status = complete ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
        BigDecimal fee = fillQuantity.abs().multiply(price).multiply(paperBrokerProperties.getFeeRate());

        log.debug("Paper order {} filled {} @ {} (fee {}), complete={}", orderId, fillQuantity, price, fee, complete);
        executionEventPublisher.publishOrderUpdate(OrderUpdateEvent.fill(
                this, orderId, order.instrument, order.quantity, fillQuantity, price, fee, complete, order.tag,
                clock.instant()));
    }

    /** Fills every resting order's remainder at the current taker price. Returns how many were filled. */
    public int fillAll() {
        int filled = 0;
        for (PaperOrder order : new ArrayList<>(orders.values())) {
            if (order.status.isTerminal()) {
                continue;
            }
            BigDecimal price = marketDataProvider.takerPrice(order.instrument, order.quantity.signum() > 0);
            if (price.signum() <= 0) {
                log.warn("Paper order {} left resting: no price for {}", order.orderId, order.instrument);
                continue;
            }
            fill(order.orderId, order.quantity.subtract(order.filled), price);
            filled++;
        }
        return filled;
    }

    public void reject(String orderId, String reason) {
        close(orderId, OrderStatus.INVALID, reason);
    }

    public void cancel(String orderId) {
        close(orderId, OrderStatus.CANCELED, "Canceled");
    }

    private void close(String orderId, OrderStatus status, String reason) {
        PaperOrder order = openOrder(orderId);
        order.status = status;
        log.debug("Paper order {} {}: {}", orderId, status, reason);
        executionEventPublisher.publishOrderUpdate(OrderUpdateEvent.failed(
                this, orderId, order.instrument, status, order.quantity, order.tag, reason, clock.instant()));
    }

    /** IDs of orders that are neither filled nor closed, in submission order. */
    public List<String> getOpenOrderIds() {
        return orders.values().stream()
                .filter(o -> !o.status.isTerminal())
                .map(o -> o.orderId)
                .sorted((a, b) -> Long.compare(sequenceOf(a), sequenceOf(b)))
                .toList();
    }

    public Optional<OrderStatus> getOrderStatus(String orderId) {
        return Optional.ofNullable(orders.get(orderId)).map(o -> o.status);
    }

    public int getOrderCount() {
        return orders.size();
    }

    public void reset() {
        orders.clear();
        log.info("Paper broker reset");
    }

    private PaperOrder openOrder(String orderId) {
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            throw new BrokerException("Unknown paper order " + orderId);
        }
        if (order.status.isTerminal()) {
            throw new BrokerException("Paper order " + orderId + " is already " + order.status);
        }
        return order;
    }

    private static long sequenceOf(String orderId) {
        return Long.parseLong(orderId.substring(orderId.indexOf('-') + 1));
    }

    private static final class PaperOrder {

        private final String orderId;
        private final Instrument instrument;
        private final BigDecimal quantity;
        private final String tag;
        private BigDecimal filled = BigDecimal.ZERO;
        private OrderStatus status = OrderStatus.SUBMITTED;

        private PaperOrder(String orderId, Instrument instrument, BigDecimal quantity, String tag) {
            this.orderId = orderId;
            this.instrument = instrument;
            this.quantity = quantity;
            this.tag = tag;
        }
    }
}
