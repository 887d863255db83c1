package com.pairarb.marketdata;

import com.pairarb.domain.model.Instrument;
import com.pairarb.domain.model.OrderBookDepth;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Read-only view of cached market state for the instruments the core trades.
 *
 * <p>Every method is a synchronous read of already-received data and must not block.
 * Missing prices are reported as {@link BigDecimal#ZERO}, never as null.
 */
public interface MarketDataProvider {

    BigDecimal bestBid(Instrument instrument);

    BigDecimal bestAsk(Instrument instrument);

    /** Price of the most recent trade, or zero if none has been seen. */
    BigDecimal lastPrice(Instrument instrument);

    /**
     * Order book snapshot, if this instrument's feed carries depth.
     * An empty Optional or a snapshot with an empty side both mean "best prices only".
     */
    Optional<OrderBookDepth> depth(Instrument instrument);

    /** Minimum tradable increment. Non-positive means no increment restriction. */
    BigDecimal lotSize(Instrument instrument);

    /** True once at least one quote or trade has been received for the instrument. */
    boolean hasData(Instrument instrument);

    /**
     * Price a taker pays when buying (best ask) or receives when selling (best bid),
     * falling back to the last trade price when the quote side is empty.
     */
    default BigDecimal takerPrice(Instrument instrument, boolean buying) {
        BigDecimal quote = buying ? bestAsk(instrument) : bestBid(instrument);
        if (quote != null && quote.signum() > 0) {
            return quote;
        }
        BigDecimal last = lastPrice(instrument);
        return last != null ? last : BigDecimal.ZERO;
    }

    /** Last trade price, else the best bid, else the best ask. Used for valuing remainders. */
    default BigDecimal referencePrice(Instrument instrument) {
        BigDecimal last = lastPrice(instrument);
        if (last != null && last.signum() > 0) {
            return last;
        }
        BigDecimal bid = bestBid(instrument);
        if (bid != null && bid.signum() > 0) {
            return bid;
        }
        BigDecimal ask = bestAsk(instrument);
        return ask != null ? ask : BigDecimal.ZERO;
    }

    /** True when the instrument has data and a positive reference price. */
    default boolean hasValidPrice(Instrument instrument) {
        return hasData(instrument) && referencePrice(instrument).signum() > 0;
    }
}
