package com.pairarb.domain.model;

import com.pairarb.domain.enums.AssetClass;

/**
 * A tradable instrument, identified by symbol and market.
 *
 * <p>Prices, depth and lot size are not part of the identity; they are read from the
 * {@link com.pairarb.marketdata.MarketDataProvider} at the time they are needed.
 *
 * @param symbol     ticker on its market, e.g. "AAPLX" or "AAPL"
 * @param market     venue name, e.g. "GATE" or "NASDAQ"
 * @param assetClass decides which session rules apply
 */
public record Instrument(String symbol, String market, AssetClass assetClass) {

    public static Instrument crypto(String symbol, String market) {
        return new Instrument(symbol, market, AssetClass.CRYPTO);
    }

    public static Instrument equity(String symbol, String market) {
        return new Instrument(symbol, market, AssetClass.EQUITY);
    }

    @Override
    public String toString() {
        return symbol + "@" + market;
    }
}
