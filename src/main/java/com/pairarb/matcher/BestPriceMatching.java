package com.pairarb.matcher;

import com.pairarb.domain.Lots;
import com.pairarb.domain.Spreads;
import com.pairarb.domain.enums.MatchingStrategy;
import com.pairarb.domain.model.MatchResult;
import com.pairarb.marketdata.MarketDataProvider;
import java.math.BigDecimal;

/**
 * Neither instrument exposes depth. Both are treated as unlimited at their best taker
 * prices (last trade price when the quote side is empty), and each leg is sized
 * independently as target notional divided by its own price, rounded down to whole lots.
 */
public record BestPriceMatching() implements MatchingAlgorithm {

    @Override
    public MatchingStrategy strategy() {
        return MatchingStrategy.BEST_PRICES;
    }

    @Override
    public MatchResult match(MatchRequest request, MarketDataProvider marketData) {
        boolean buysFirst = request.buysFirstLeg();
        BigDecimal price1 = marketData.takerPrice(request.instrument1(), buysFirst);
        BigDecimal price2 = marketData.takerPrice(request.instrument2(), !buysFirst);
        if (!DualDepthMatching.isPositive(price1) || !DualDepthMatching.isPositive(price2)) {
            return MatchResult.notExecutable(
                    strategy(), "Non-positive best price: " + request.instrument1() + "=" + price1 + ", "
                            + request.instrument2() + "=" + price2);
        }

        BigDecimal spreadPct = buysFirst ? Spreads.spreadPct(price1, price2) : Spreads.spreadPct(price2, price1);
        if (!Spreads.meetsThreshold(spreadPct, request.minSpreadPct())) {
            return MatchResult.notExecutable(strategy(), "Best-price spread " + spreadPct + "% below minimum");
        }

        BigDecimal target = request.targetNotional();
        BigDecimal quantity1 = Lots.roundDown(target.divide(price1, Spreads.MC), marketData.lotSize(request.instrument1()));
        BigDecimal quantity2 = Lots.roundDown(target.divide(price2, Spreads.MC), marketData.lotSize(request.instrument2()));
        if (quantity1.signum() == 0 || quantity2.signum() == 0) {
            return MatchResult.notExecutable(strategy(), "Target notional below one lot on a leg");
        }

        MatchAccumulator acc = new MatchAccumulator(request, strategy());
        acc.add(price1, price2, quantity1, quantity2, spreadPct);
        return acc.toResult(acc.buyValue(), true);
    }
}
