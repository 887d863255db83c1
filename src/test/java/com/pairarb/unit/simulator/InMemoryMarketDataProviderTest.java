package com.pairarb.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.pairarb.domain.model.DepthItem;
import com.pairarb.domain.model.Instrument;
import com.pairarb.domain.model.OrderBookDepth;
import com.pairarb.event.ExecutionEventPublisher;
import com.pairarb.simulator.InMemoryMarketDataProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryMarketDataProviderTest {

    private static final Instrument X = Instrument.crypto("XSTK", "GATE");
    private static final Instant T0 = Instant.parse("2026-03-02T15:00:00Z");

    private ExecutionEventPublisher executionEventPublisher;
    private InMemoryMarketDataProvider marketData;

    @BeforeEach
    void setUp() {
        executionEventPublisher = mock(ExecutionEventPublisher.class);
        marketData = new InMemoryMarketDataProvider(executionEventPublisher, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Unknown instrument has no data, zero prices and a lot size of one")
    void unknownInstrument() {
        assertThat(marketData.hasData(X)).isFalse();
        assertThat(marketData.bestBid(X)).isEqualByComparingTo("0");
        assertThat(marketData.depth(X)).isEmpty();
        assertThat(marketData.lotSize(X)).isEqualByComparingTo("1");
        assertThat(marketData.hasValidPrice(X)).isFalse();
    }

    @Test
    @DisplayName("Quote update is cached and announced as a tick")
    void quoteUpdate() {
        marketData.updateQuote(X, new BigDecimal("99"), new BigDecimal("100"), new BigDecimal("99.5"));

        assertThat(marketData.takerPrice(X, true)).isEqualByComparingTo("100");
        assertThat(marketData.takerPrice(X, false)).isEqualByComparingTo("99");
        assertThat(marketData.referencePrice(X)).isEqualByComparingTo("99.5");
        verify(executionEventPublisher).publishTick(any(), eq(X), eq(T0));
    }

    @Test
    @DisplayName("Depth update sets the top of book and keeps the last price")
    void depthUpdate() {
        marketData.updateQuote(X, null, null, new BigDecimal("99.5"));
        OrderBookDepth depth = new OrderBookDepth(
                List.of(DepthItem.of("99", "10"), DepthItem.of("98", "10")), List.of(DepthItem.of("100", "5")));

        marketData.updateDepth(X, depth);

        assertThat(marketData.bestBid(X)).isEqualByComparingTo("99");
        assertThat(marketData.bestAsk(X)).isEqualByComparingTo("100");
        assertThat(marketData.lastPrice(X)).isEqualByComparingTo("99.5");
        assertThat(marketData.depth(X)).contains(depth);

        marketData.clearDepth(X);
        assertThat(marketData.depth(X)).isEmpty();
        assertThat(marketData.bestBid(X)).isEqualByComparingTo("99");
    }
}
