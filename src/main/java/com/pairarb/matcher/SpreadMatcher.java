package com.pairarb.matcher;

import com.pairarb.config.ExecutionProperties;
import com.pairarb.domain.enums.MatchingStrategy;
import com.pairarb.domain.model.Instrument;
import com.pairarb.domain.model.Leg;
import com.pairarb.domain.model.MatchResult;
import com.pairarb.domain.model.OrderBookDepth;
import com.pairarb.marketdata.MarketDataProvider;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes the largest executable, market-value-hedged, lot-aligned quantity pair for two
 * instruments within a minimum spread.
 *
 * <p>The variant is chosen once per call from the depth each side exposes:
 * <ul>
 *   <li>both sides have depth: {@link DualDepthMatching}</li>
 *   <li>one side has depth: {@link SingleDepthMatching}</li>
 *   <li>neither: {@link BestPriceMatching}</li>
 * </ul>
 * A configured {@link MatchingStrategy} other than AUTO_DETECT forces a variant; when the
 * forced variant's depth is missing, the call is not executable.
 *
 * <p>"Nothing to trade" is always a return value. This method is called on every tick and
 * never throws for bad prices, thin books or spreads below the threshold.
 */
@Service
public class SpreadMatcher {

    private static final Logger log = LoggerFactory.getLogger(SpreadMatcher.class);

    private final MarketDataProvider marketDataProvider;
    private final ExecutionProperties executionProperties;

    public SpreadMatcher(MarketDataProvider marketDataProvider, ExecutionProperties executionProperties) {
        this.marketDataProvider = marketDataProvider;
        this.executionProperties = executionProperties;
    }

    /** Matches with the configured strategy. */
    public MatchResult matchPair(MatchRequest request) {
        return matchPair(request, executionProperties.getMatchingStrategy());
    }

    public MatchResult matchPair(MatchRequest request, MatchingStrategy strategy) {
        BigDecimal target = request.targetNotional();
        if (target == null || target.signum() < 0) {
            return MatchResult.notExecutable(strategy, "Target notional must be zero or positive");
        }
        if (target.signum() == 0) {
            return zeroTarget(request, strategy);
        }

        Optional<MatchingAlgorithm> algorithm = select(request, strategy);
        if (algorithm.isEmpty()) {
            log.debug("No matching variant for {}/{} under strategy {}",
                    request.instrument1(), request.instrument2(), strategy);
            return MatchResult.notExecutable(strategy, "Order book depth required by " + strategy + " is unavailable");
        }

        MatchResult result = algorithm.get().match(request, marketDataProvider);
        if (result.isExecutable()) {
            log.debug(
                    "Matched {}/{} via {}: leg1={}, leg2={}, avgSpread={}%, reachedTarget={}, remaining={}",
                    request.instrument1(),
                    request.instrument2(),
                    result.getUsedStrategy(),
                    result.getLeg1().quantity(),
                    result.getLeg2().quantity(),
                    result.getAvgSpreadPct(),
                    result.isReachedTarget(),
                    result.getRemainingNotional());
        } else {
            log.debug("Not executable {}/{} via {}: {}",
                    request.instrument1(), request.instrument2(), result.getUsedStrategy(), result.getRejectReason());
        }
        return result;
    }

    /**
     * Picks the variant for one call. Empty when a forced strategy's depth is missing.
     */
    public Optional<MatchingAlgorithm> select(MatchRequest request, MatchingStrategy strategy) {
        boolean depth1 = hasDepth(request.instrument1());
        boolean depth2 = hasDepth(request.instrument2());

        return switch (strategy) {
            case DUAL_DEPTH -> depth1 && depth2 ? Optional.of(new DualDepthMatching()) : Optional.empty();
            case SINGLE_DEPTH -> depth1
                    ? Optional.of(new SingleDepthMatching(false))
                    : depth2 ? Optional.of(new SingleDepthMatching(true)) : Optional.empty();
            case BEST_PRICES -> Optional.of(new BestPriceMatching());
            case AUTO_DETECT -> {
                if (depth1 && depth2) {
                    yield Optional.of(new DualDepthMatching());
                }
                if (depth1 || depth2) {
                    yield Optional.of(new SingleDepthMatching(!depth1));
                }
                yield Optional.of(new BestPriceMatching());
            }
        };
    }

    private boolean hasDepth(Instrument instrument) {
        return marketDataProvider.depth(instrument).map(OrderBookDepth::isUsable).orElse(false);
    }

    private MatchResult zeroTarget(MatchRequest request, MatchingStrategy strategy) {
        return MatchResult.builder()
                .leg1(new Leg(request.instrument1(), BigDecimal.ZERO))
                .leg2(new Leg(request.instrument2(), BigDecimal.ZERO))
                .totalBuyNotional(BigDecimal.ZERO)
                .totalSellNotional(BigDecimal.ZERO)
                .avgSpreadPct(BigDecimal.ZERO)
                .reachedTarget(true)
                .executable(true)
                .usedStrategy(strategy)
                .build();
    }
}
