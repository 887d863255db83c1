package com.pairarb.domain.enums;

/** Asset class of an instrument. Decides which trading session rules apply. */
public enum AssetClass {
    /** Trades around the clock. */
    CRYPTO,

    /** Trades during exchange hours, optionally including pre- and post-market. */
    EQUITY
}
