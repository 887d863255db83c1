package com.pairarb.matcher;

import com.pairarb.domain.Lots;
import com.pairarb.domain.Spreads;
import com.pairarb.domain.enums.MatchingStrategy;
import com.pairarb.domain.model.DepthItem;
import com.pairarb.domain.model.Instrument;
import com.pairarb.domain.model.MatchResult;
import com.pairarb.domain.model.OrderBookDepth;
import com.pairarb.marketdata.MarketDataProvider;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One instrument exposes depth; the other is assumed to have unlimited size at its best
 * price (falling back to the last trade price).
 *
 * <p>Walks the depth side level by level and stops at the first level whose spread against
 * the fixed counter price misses the threshold. The target notional is measured on the
 * depth side. The counter leg is sized once at the end as the depth side's matched value
 * divided by the counter price, rounded down to whole lots.
 *
 * @param depthOnSecond true when only instrument 2 has depth; the walk then runs on the
 *                      swapped request and the legs are swapped back before returning
 */
public record SingleDepthMatching(boolean depthOnSecond) implements MatchingAlgorithm {

    private static final Logger log = LoggerFactory.getLogger(SingleDepthMatching.class);

    @Override
    public MatchingStrategy strategy() {
        return MatchingStrategy.SINGLE_DEPTH;
    }

    @Override
    public MatchResult match(MatchRequest request, MarketDataProvider marketData) {
        if (depthOnSecond) {
            return matchDepthFirst(request.swapped(), marketData).swapped();
        }
        return matchDepthFirst(request, marketData);
    }

    private MatchResult matchDepthFirst(MatchRequest request, MarketDataProvider marketData) {
        Instrument depthInstrument = request.instrument1();
        Instrument counterInstrument = request.instrument2();
        Optional<OrderBookDepth> book = marketData.depth(depthInstrument).filter(OrderBookDepth::isUsable);
        if (book.isEmpty()) {
            return MatchResult.notExecutable(strategy(), "Order book depth missing for " + depthInstrument);
        }

        boolean buysDepthSide = request.buysFirstLeg();
        BigDecimal counterPrice = marketData.takerPrice(counterInstrument, !buysDepthSide);
        if (!DualDepthMatching.isPositive(counterPrice)) {
            log.debug("Invalid counter price for {}: {}", counterInstrument, counterPrice);
            return MatchResult.notExecutable(strategy(), "Non-positive price for " + counterInstrument);
        }

        BigDecimal depthLot = marketData.lotSize(depthInstrument);
        BigDecimal counterLot = marketData.lotSize(counterInstrument);
        BigDecimal target = request.targetNotional();

        MatchAccumulator acc = new MatchAccumulator(request, strategy());
        BigDecimal lastPrice = null;
        boolean reachedTarget = false;

        for (DepthItem level : book.get().takerLevels(buysDepthSide)) {
            BigDecimal price = level.getPrice();
            if (!DualDepthMatching.isPositive(price)) {
                return MatchResult.notExecutable(strategy(), "Non-positive price in order book of " + depthInstrument);
            }
            BigDecimal spreadPct = buysDepthSide
                    ? Spreads.spreadPct(price, counterPrice)
                    : Spreads.spreadPct(counterPrice, price);
            if (!Spreads.meetsThreshold(spreadPct, request.minSpreadPct())) {
                log.debug("Single-depth level rejected: {}@{} vs {}@{}, spread={}%, min={}%",
                        depthInstrument, price, counterInstrument, counterPrice, spreadPct, request.minSpreadPct());
                break;
            }

            BigDecimal remaining = target.subtract(acc.value1()).max(BigDecimal.ZERO);
            BigDecimal byNotional = Lots.roundDown(remaining.divide(price, Spreads.MC), depthLot);
            if (byNotional.signum() == 0) {
                reachedTarget = true;
                break;
            }
            BigDecimal available = Lots.roundDown(level.getSize() != null ? level.getSize() : BigDecimal.ZERO, depthLot);
            BigDecimal quantity = available.min(byNotional);
            if (quantity.signum() == 0) {
                continue;
            }

            BigDecimal counterQuantity = quantity.multiply(price).divide(counterPrice, Spreads.MC);
            acc.add(price, counterPrice, quantity, counterQuantity, spreadPct);
            lastPrice = price;
        }

        if (!acc.hasLevels()) {
            return MatchResult.notExecutable(strategy(), "No order book level meets the minimum spread");
        }
        acc.hedgeSecondLeg(counterPrice, counterLot);
        if (acc.isEmpty()) {
            return MatchResult.notExecutable(strategy(), "Hedge quantity for " + counterInstrument + " below one lot");
        }
        if (!reachedTarget) {
            reachedTarget = DualDepthMatching.noFurtherLotFits(target.subtract(acc.value1()), lastPrice, depthLot);
        }
        return acc.toResult(acc.value1(), reachedTarget);
    }
}
