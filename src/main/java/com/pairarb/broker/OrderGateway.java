package com.pairarb.broker;

import com.pairarb.domain.model.Instrument;
import java.math.BigDecimal;

/**
 * Outbound order submission. Every component that sends orders goes through this
 * interface, never through a venue-specific client.
 *
 * <p>Submission is fire-and-forget: the call returns once the order has been handed to
 * the venue, and every later state change (acknowledgment, fills, cancel, rejection)
 * arrives as a {@link com.pairarb.event.OrderUpdateEvent} carrying the same tag.
 * An implementation may deliver the first event synchronously, before this method returns.
 */
public interface OrderGateway {

    /**
     * Submits a market order.
     *
     * @param instrument     the instrument to trade
     * @param signedQuantity positive to buy, negative to sell; never zero
     * @param tag            opaque routing tag, echoed verbatim on every order event
     * @return the venue-assigned order ID
     * @throws com.pairarb.exception.BrokerException if the venue refuses the submission outright
     */
    String submitMarketOrder(Instrument instrument, BigDecimal signedQuantity, String tag);
}
