package com.pairarb.calendar;

import com.pairarb.domain.model.Instrument;
import java.time.Instant;

/** Answers whether an instrument's market is accepting orders at a given instant. */
public interface MarketSessionGate {

    boolean isMarketOpen(Instrument instrument, Instant now);
}
