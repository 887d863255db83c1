package com.pairarb.domain.model;

import java.util.List;

/**
 * Order book snapshot for one instrument.
 *
 * <p>Bids are ordered best (highest) first, asks best (lowest) first. A snapshot with
 * an empty side is treated as "no depth" by the matcher, which then falls back to
 * best prices for that instrument.
 */
public record OrderBookDepth(List<DepthItem> bids, List<DepthItem> asks) {

    public OrderBookDepth {
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    /** True when both sides carry at least one level. */
    public boolean isUsable() {
        return !bids.isEmpty() && !asks.isEmpty();
    }

    /** Levels a taker walks when buying (asks) or selling (bids). */
    public List<DepthItem> takerLevels(boolean buying) {
        return buying ? asks : bids;
    }
}
