package com.pairarb.matcher;

import com.pairarb.domain.Lots;
import com.pairarb.domain.Spreads;
import com.pairarb.domain.enums.MatchingStrategy;
import com.pairarb.domain.model.Leg;
import com.pairarb.domain.model.MatchLevel;
import com.pairarb.domain.model.MatchResult;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Running totals for one matching call, kept in (instrument 1, instrument 2) order with
 * unsigned quantities. Turned into a signed {@link MatchResult} at the end.
 */
final class MatchAccumulator {

    private final MatchRequest request;
    private final MatchingStrategy strategy;
    private final boolean buysFirstLeg;
    private final List<MatchLevel> levels = new ArrayList<>();

    private BigDecimal quantity1 = BigDecimal.ZERO;
    private BigDecimal quantity2 = BigDecimal.ZERO;
    private BigDecimal value1 = BigDecimal.ZERO;
    private BigDecimal value2 = BigDecimal.ZERO;
    private BigDecimal weightedSpread = BigDecimal.ZERO;

    MatchAccumulator(MatchRequest request, MatchingStrategy strategy) {
        this.request = request;
        this.strategy = strategy;
        this.buysFirstLeg = request.buysFirstLeg();
    }

    void add(BigDecimal price1, BigDecimal price2, BigDecimal qty1, BigDecimal qty2, BigDecimal spreadPct) {
        BigDecimal levelValue1 = qty1.multiply(price1);
        BigDecimal levelValue2 = qty2.multiply(price2);
        quantity1 = quantity1.add(qty1);
        quantity2 = quantity2.add(qty2);
        value1 = value1.add(levelValue1);
        value2 = value2.add(levelValue2);
        weightedSpread = weightedSpread.add(spreadPct.multiply(qty1));
        levels.add(MatchLevel.builder()
                .price1(price1)
                .price2(price2)
                .quantity1(qty1)
                .quantity2(qty2)
                .notional(buysFirstLeg ? levelValue1 : levelValue2)
                .spreadPct(spreadPct)
                .build());
    }

    /**
     * Resizes leg 2 as one hedge at a single price, worth leg 1's accumulated value
     * rounded down to whole lots. Per-level quantities stay as diagnostics.
     */
    void hedgeSecondLeg(BigDecimal price2, BigDecimal lot2) {
        quantity2 = Lots.roundDown(value1.divide(price2, Spreads.MC), lot2);
        value2 = quantity2.multiply(price2);
    }

    BigDecimal buyValue() {
        return buysFirstLeg ? value1 : value2;
    }

    BigDecimal sellValue() {
        return buysFirstLeg ? value2 : value1;
    }

    BigDecimal value1() {
        return value1;
    }

    /** True while either leg is still without quantity. */
    boolean isEmpty() {
        return quantity1.signum() == 0 || quantity2.signum() == 0;
    }

    boolean hasLevels() {
        return !levels.isEmpty();
    }

    /**
     * @param sizedNotional the notional the walk was sized against, compared with the target
     * @param reachedTarget whether the walk stopped because no further lot fitted the target
     */
    MatchResult toResult(BigDecimal sizedNotional, boolean reachedTarget) {
        BigDecimal fees = request.fees();
        BigDecimal buyQuantity = buysFirstLeg ? quantity1 : quantity2;
        BigDecimal sellQuantity = buysFirstLeg ? quantity2 : quantity1;
        BigDecimal totalBuy = buyValue().add(fees);
        BigDecimal totalSell = sellValue().subtract(fees);

        return MatchResult.builder()
                .leg1(new Leg(request.instrument1(), buysFirstLeg ? quantity1 : quantity1.negate()))
                .leg2(new Leg(request.instrument2(), buysFirstLeg ? quantity2.negate() : quantity2))
                .matchedLevels(List.copyOf(levels))
                .totalBuyNotional(totalBuy)
                .totalSellNotional(totalSell)
                .avgBuyPrice(totalBuy.divide(buyQuantity, Spreads.MC))
                .avgSellPrice(totalSell.divide(sellQuantity, Spreads.MC))
                .avgSpreadPct(weightedSpread.divide(quantity1, Spreads.MC))
                .reachedTarget(reachedTarget)
                .remainingNotional(request.targetNotional().subtract(sizedNotional).max(BigDecimal.ZERO))
                .executable(true)
                .usedStrategy(strategy)
                .build();
    }
}
