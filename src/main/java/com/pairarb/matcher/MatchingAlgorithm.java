package com.pairarb.matcher;

import com.pairarb.domain.enums.MatchingStrategy;
import com.pairarb.domain.model.MatchResult;
import com.pairarb.marketdata.MarketDataProvider;

/**
 * One of the three ways a pair can be matched, chosen once per call by
 * {@link SpreadMatcher} from the depth each instrument exposes.
 *
 * <p>Implementations are stateless. They never throw for "no opportunity" conditions
 * and report them as a non-executable {@link MatchResult} instead.
 */
public sealed interface MatchingAlgorithm permits DualDepthMatching, SingleDepthMatching, BestPriceMatching {

    MatchResult match(MatchRequest request, MarketDataProvider marketData);

    MatchingStrategy strategy();
}
