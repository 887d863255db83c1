package com.pairarb.matcher;

import com.pairarb.domain.Lots;
import com.pairarb.domain.Spreads;
import com.pairarb.domain.enums.MatchingStrategy;
import com.pairarb.domain.model.DepthItem;
import com.pairarb.domain.model.MatchResult;
import com.pairarb.domain.model.OrderBookDepth;
import com.pairarb.marketdata.MarketDataProvider;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Both instruments expose depth. Walks the bought leg's asks and the sold leg's bids with
 * one cursor each.
 *
 * <p>At each price pair whose spread meets the threshold, the bought quantity is the
 * smaller of the level's size and what the remaining target notional buys; the sold
 * quantity is the market value of everything bought so far minus everything sold so far,
 * divided by the sell price. Carrying that imbalance from level to level keeps the two
 * legs' values within one lot of each other across the whole walk. When the sell level
 * is too thin, it caps the pair and the bought quantity is recomputed from it.
 *
 * <p>A pair that misses the threshold advances the sell cursor. The walk ends when the
 * target is reached or either book runs out.
 */
public record DualDepthMatching() implements MatchingAlgorithm {

    private static final Logger log = LoggerFactory.getLogger(DualDepthMatching.class);

    @Override
    public MatchingStrategy strategy() {
        return MatchingStrategy.DUAL_DEPTH;
    }

    @Override
    public MatchResult match(MatchRequest request, MarketDataProvider marketData) {
        Optional<OrderBookDepth> book1 = marketData.depth(request.instrument1()).filter(OrderBookDepth::isUsable);
        Optional<OrderBookDepth> book2 = marketData.depth(request.instrument2()).filter(OrderBookDepth::isUsable);
        if (book1.isEmpty() || book2.isEmpty()) {
            return MatchResult.notExecutable(strategy(), "Order book depth missing on one or both legs");
        }

        boolean buysFirst = request.buysFirstLeg();
        List<DepthItem> buyLevels = buysFirst ? book1.get().asks() : book2.get().asks();
        List<DepthItem> sellLevels = buysFirst ? book2.get().bids() : book1.get().bids();
        BigDecimal buyLot = marketData.lotSize(buysFirst ? request.instrument1() : request.instrument2());
        BigDecimal sellLot = marketData.lotSize(buysFirst ? request.instrument2() : request.instrument1());

        BigDecimal[] buyLeft = sizes(buyLevels);
        BigDecimal[] sellLeft = sizes(sellLevels);

        MatchAccumulator acc = new MatchAccumulator(request, strategy());
        BigDecimal target = request.targetNotional();
        BigDecimal lastBuyPrice = null;
        boolean reachedTarget = false;
        boolean spreadAccepted = false;
        int b = 0;
        int s = 0;

        while (b < buyLevels.size() && s < sellLevels.size()) {
            BigDecimal buyPrice = buyLevels.get(b).getPrice();
            BigDecimal sellPrice = sellLevels.get(s).getPrice();
            if (!isPositive(buyPrice) || !isPositive(sellPrice)) {
                return MatchResult.notExecutable(strategy(), "Non-positive price in order book");
            }

            BigDecimal spreadPct = Spreads.spreadPct(buyPrice, sellPrice);
            if (!Spreads.meetsThreshold(spreadPct, request.minSpreadPct())) {
                log.debug("Dual-depth pair rejected: buy={}, sell={}, spread={}%, min={}%",
                        buyPrice, sellPrice, spreadPct, request.minSpreadPct());
                s++;
                continue;
            }
            spreadAccepted = true;

            BigDecimal availableBuy = Lots.roundDown(buyLeft[b], buyLot);
            BigDecimal availableSell = Lots.roundDown(sellLeft[s], sellLot);
            if (availableBuy.signum() == 0) {
                b++;
                continue;
            }
            if (availableSell.signum() == 0) {
                s++;
                continue;
            }

            BigDecimal remaining = target.subtract(acc.buyValue());
            BigDecimal byNotional = Lots.roundDown(remaining.max(BigDecimal.ZERO).divide(buyPrice, Spreads.MC), buyLot);
            if (byNotional.signum() == 0) {
                reachedTarget = true;
                break;
            }

            BigDecimal buyQty = availableBuy.min(byNotional);
            BigDecimal hedgeValue = acc.buyValue().add(buyQty.multiply(buyPrice)).subtract(acc.sellValue());
            BigDecimal sellQty = Lots.roundDown(hedgeValue.max(BigDecimal.ZERO).divide(sellPrice, Spreads.MC), sellLot);
            if (sellQty.compareTo(availableSell) > 0) {
                sellQty = availableSell;
                BigDecimal cappedValue = acc.sellValue().add(sellQty.multiply(sellPrice)).subtract(acc.buyValue());
                buyQty = Lots.roundDown(cappedValue.max(BigDecimal.ZERO).divide(buyPrice, Spreads.MC), buyLot)
                        .min(availableBuy);
            }
            if (buyQty.signum() == 0) {
                break;
            }

            if (buysFirst) {
                acc.add(buyPrice, sellPrice, buyQty, sellQty, spreadPct);
            } else {
                acc.add(sellPrice, buyPrice, sellQty, buyQty, spreadPct);
            }
            lastBuyPrice = buyPrice;

            buyLeft[b] = buyLeft[b].subtract(buyQty);
            sellLeft[s] = sellLeft[s].subtract(sellQty);
            if (Lots.roundDown(buyLeft[b], buyLot).signum() == 0) {
                b++;
            }
            if (Lots.roundDown(sellLeft[s], sellLot).signum() == 0) {
                s++;
            }
        }

        if (acc.isEmpty()) {
            return MatchResult.notExecutable(
                    strategy(),
                    spreadAccepted ? "Matched quantity below one lot" : "No price pair meets the minimum spread");
        }
        if (!reachedTarget) {
            reachedTarget = noFurtherLotFits(target.subtract(acc.buyValue()), lastBuyPrice, buyLot);
        }
        return acc.toResult(acc.buyValue(), reachedTarget);
    }

    static boolean noFurtherLotFits(BigDecimal remaining, BigDecimal price, BigDecimal lot) {
        if (remaining.signum() <= 0) {
            return true;
        }
        return Lots.roundDown(remaining.divide(price, Spreads.MC), lot).signum() == 0;
    }

    static boolean isPositive(BigDecimal price) {
        return price != null && price.signum() > 0;
    }

    private static BigDecimal[] sizes(List<DepthItem> levels) {
        BigDecimal[] sizes = new BigDecimal[levels.size()];
        for (int i = 0; i < sizes.length; i++) {
            BigDecimal size = levels.get(i).getSize();
            sizes[i] = size != null ? size : BigDecimal.ZERO;
        }
        return sizes;
    }
}
