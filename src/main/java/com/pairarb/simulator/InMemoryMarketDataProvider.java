package com.pairarb.simulator;

import com.pairarb.domain.model.Instrument;
import com.pairarb.domain.model.OrderBookDepth;
import com.pairarb.event.ExecutionEventPublisher;
import com.pairarb.marketdata.MarketDataProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Market data cache fed by hand (replay, tests, paper trading).
 *
 * <p>Every quote or depth update replaces the instrument's cached state and publishes a
 * {@link com.pairarb.event.MarketTickEvent} for it. Lot sizes are static reference data
 * and do not publish ticks.
 */
@Component
public class InMemoryMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMarketDataProvider.class);

    private final ExecutionEventPublisher executionEventPublisher;
    private final Clock clock;

    private final Map<Instrument, Quote> quotes = new ConcurrentHashMap<>();
    private final Map<Instrument, BigDecimal> lotSizes = new ConcurrentHashMap<>();

    public InMemoryMarketDataProvider(ExecutionEventPublisher executionEventPublisher, Clock clock) {
        this.executionEventPublisher = executionEventPublisher;
        this.clock = clock;
    }

    public void setLotSize(Instrument instrument, BigDecimal lotSize) {
        lotSizes.put(instrument, lotSize);
    }

    /** Replaces best bid, best ask and last price, keeping any cached depth. */
    public void updateQuote(Instrument instrument, BigDecimal bid, BigDecimal ask, BigDecimal last) {
        quotes.compute(instrument, (key, previous) ->
                new Quote(orZero(bid), orZero(ask), orZero(last), previous != null ? previous.depth() : null));
        log.debug("Quote {}: bid={}, ask={}, last={}", instrument, bid, ask, last);
        executionEventPublisher.publishTick(this, instrument, clock.instant());
    }

    /**
     * Replaces the order book. Best bid and ask follow the book's top levels; the last
     * price is kept.
     */
    public void updateDepth(Instrument instrument, OrderBookDepth depth) {
        quotes.compute(instrument, (key, previous) -> {
            BigDecimal bid = depth.bids().isEmpty() ? BigDecimal.ZERO : depth.bids().get(0).getPrice();
            BigDecimal ask = depth.asks().isEmpty() ? BigDecimal.ZERO : depth.asks().get(0).getPrice();
            BigDecimal last = previous != null ? previous.last() : BigDecimal.ZERO;
            return new Quote(bid, ask, last, depth);
        });
        log.debug("Depth {}: {} bids, {} asks", instrument, depth.bids().size(), depth.asks().size());
        executionEventPublisher.publishTick(this, instrument, clock.instant());
    }

    /** Drops the order book, leaving best prices only. */
    public void clearDepth(Instrument instrument) {
        quotes.computeIfPresent(instrument, (key, previous) ->
                new Quote(previous.bid(), previous.ask(), previous.last(), null));
    }

    public void clear() {
        quotes.clear();
        lotSizes.clear();
    }

    @Override
    public BigDecimal bestBid(Instrument instrument) {
        Quote quote = quotes.get(instrument);
        return quote != null ? quote.bid() : BigDecimal.ZERO;
    }

    @Override
    public BigDecimal bestAsk(Instrument instrument) {
        Quote quote = quotes.get(instrument);
        return quote != null ? quote.ask() : BigDecimal.ZERO;
    }

    @Override
    public BigDecimal lastPrice(Instrument instrument) {
        Quote quote = quotes.get(instrument);
        return quote != null ? quote.last() : BigDecimal.ZERO;
    }

    @Override
    public Optional<OrderBookDepth> depth(Instrument instrument) {
        Quote quote = quotes.get(instrument);
        return quote != null ? Optional.ofNullable(quote.depth()) : Optional.empty();
    }

    /** Defaults to 1 for instruments without a configured lot size. */
    @Override
    public BigDecimal lotSize(Instrument instrument) {
        return lotSizes.getOrDefault(instrument, BigDecimal.ONE);
    }

    @Override
    public boolean hasData(Instrument instrument) {
        return quotes.containsKey(instrument);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private record Quote(BigDecimal bid, BigDecimal ask, BigDecimal last, OrderBookDepth depth) {}
}
