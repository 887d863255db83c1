package com.pairarb.event;

import com.pairarb.domain.model.Instrument;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published when cached quotes or depth for an instrument change.
 *
 * <p>The event only names the instrument; listeners read the new state from the
 * {@link com.pairarb.marketdata.MarketDataProvider}. The execution manager uses it to
 * run every active target that trades the instrument.
 */
public class MarketTickEvent extends ApplicationEvent {

    private final Instrument instrument;
    private final Instant receivedAt;

    public MarketTickEvent(Object source, Instrument instrument, Instant receivedAt) {
        super(source);
        this.instrument = instrument;
        this.receivedAt = receivedAt;
    }

    public Instrument getInstrument() {
        return instrument;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }
}
