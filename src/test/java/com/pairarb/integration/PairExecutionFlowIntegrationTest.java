package com.pairarb.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.pairarb.config.PaperBrokerProperties;
import com.pairarb.domain.enums.ExecutionStatus;
import com.pairarb.domain.enums.SpreadDirection;
import com.pairarb.domain.model.ExecutionTargetId;
import com.pairarb.domain.model.ExecutionTargetSnapshot;
import com.pairarb.domain.model.Instrument;
import com.pairarb.event.ExecutionEventType;
import com.pairarb.observability.ExecutionHistoryRecorder;
import com.pairarb.oms.ExecutionManager;
import com.pairarb.oms.ExecutionTargetRequest;
import com.pairarb.simulator.InMemoryMarketDataProvider;
import com.pairarb.simulator.PaperBrokerGateway;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * End-to-end flow through the Spring context: market data ticks drive the execution
 * manager, the paper broker answers with synchronous order events, and the history
 * recorder and metrics see every transition.
 */
@SpringBootTest
class PairExecutionFlowIntegrationTest {

    private static final Instrument X = Instrument.crypto("XSTK", "GATE");
    private static final Instrument Y = Instrument.crypto("XSTK", "BINANCE");

    @Autowired
    private ExecutionManager executionManager;

    @Autowired
    private InMemoryMarketDataProvider marketData;

    @Autowired
    private PaperBrokerGateway paperBroker;

    @Autowired
    private PaperBrokerProperties paperBrokerProperties;

    @Autowired
    private ExecutionHistoryRecorder historyRecorder;

    @Autowired
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        paperBroker.reset();
        historyRecorder.clear();
        marketData.clear();
        marketData.setLotSize(X, BigDecimal.ONE);
        marketData.setLotSize(Y, BigDecimal.ONE);
        quote(X, "99", "100", "100");
        quote(Y, "102", "102.5", "102");
    }

    @AfterEach
    void tearDown() {
        paperBrokerProperties.setAutoFill(true);
        executionManager.getActiveTargets().forEach(t -> executionManager.cancel(t.id()));
    }

    private void quote(Instrument instrument, String bid, String ask, String last) {
        marketData.updateQuote(instrument, new BigDecimal(bid), new BigDecimal(ask), new BigDecimal(last));
    }

    private ExecutionTargetId createTarget(String opportunityKey) {
        return executionManager
                .createTarget(ExecutionTargetRequest.builder()
                        .opportunityKey(opportunityKey)
                        .instrument1(X)
                        .instrument2(Y)
                        .targetQuantity1(new BigDecimal("10"))
                        .targetQuantity2(new BigDecimal("-10"))
                        .direction(SpreadDirection.LONG_SPREAD)
                        .expectedSpreadPct(new BigDecimal("1.0"))
                        .timeout(Duration.ofMinutes(5))
                        .build())
                .id();
    }

    private double counter(String name, String tagKey, String tagValue) {
        Counter counter = meterRegistry.find(name).tag(tagKey, tagValue).counter();
        return counter != null ? counter.count() : 0;
    }

    @Test
    @DisplayName("Ticks fill the pair, sweep the one-lot remainder and close the target as FILLED")
    void pairFillsAfterSweep() {
        double filledBefore = counter("execution.targets.completed", "status", "filled");
        ExecutionTargetId id = createTarget("flow-filled");

        // first tick: pair slice 10 / -9 fills immediately
        quote(X, "99", "100", "100");
        assertThat(executionManager.getTarget(id).orElseThrow().status()).isEqualTo(ExecutionStatus.PARTIALLY_FILLED);

        // second tick: the one share left on Y is swept
        quote(Y, "102", "102.5", "102");

        assertThat(executionManager.hasActiveExecution("flow-filled")).isFalse();
        ExecutionTargetSnapshot done = historyRecorder.latest(id).orElseThrow();
        assertThat(done.status()).isEqualTo(ExecutionStatus.FILLED);
        assertThat(done.filledQuantity().leg1()).isEqualByComparingTo("10");
        assertThat(done.filledQuantity().leg2()).isEqualByComparingTo("-10");
        assertThat(done.totalFee()).isEqualByComparingTo("2.020");
        assertThat(done.orderGroups()).hasSize(2);
        assertThat(done.orderGroups().get(0).realizedSpreadPct()).isNotNull();

        List<ExecutionEventType> types = historyRecorder.getHistory(id).stream()
                .map(ExecutionHistoryRecorder.Entry::eventType)
                .toList();
        assertThat(types).contains(
                ExecutionEventType.CREATED,
                ExecutionEventType.SUBMITTED,
                ExecutionEventType.PARTIALLY_FILLED,
                ExecutionEventType.SWEEP_SUBMITTED,
                ExecutionEventType.FILLED);
        assertThat(counter("execution.targets.completed", "status", "filled")).isEqualTo(filledBefore + 1);
    }

    @Test
    @DisplayName("Rejected leg fails the target only after its counter leg fills, and that fill is kept")
    void rejectedLegFailsTargetOnceCounterLegFinishes() {
        paperBrokerProperties.setAutoFill(false);
        double droppedBefore = counter("execution.events.dropped", "reason", "retired_target");
        ExecutionTargetId id = createTarget("flow-rejected");

        quote(X, "99", "100", "100");
        List<String> resting = paperBroker.getOpenOrderIds();
        assertThat(resting).hasSize(2);
        assertThat(executionManager.getTarget(id).orElseThrow().status()).isEqualTo(ExecutionStatus.SUBMITTED);

        paperBroker.reject(resting.get(0), "Insufficient margin");

        assertThat(executionManager.hasActiveExecution("flow-rejected")).isTrue();
        quote(Y, "102", "102.5", "102");
        assertThat(paperBroker.getOrderCount()).isEqualTo(2);

        assertThat(paperBroker.fillAll()).isEqualTo(1);

        ExecutionTargetSnapshot failed = historyRecorder.latest(id).orElseThrow();
        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.filledQuantity().leg1()).isEqualByComparingTo("0");
        assertThat(failed.filledQuantity().leg2()).isEqualByComparingTo("-9");
        assertThat(counter("execution.events.dropped", "reason", "retired_target")).isEqualTo(droppedBefore);
    }

    @Test
    @DisplayName("Spread below the minimum leaves the target waiting without orders")
    void noTradeBelowMinimumSpread() {
        quote(Y, "100.5", "101", "100.5");
        ExecutionTargetId id = createTarget("flow-waiting");

        quote(X, "99", "100", "100");

        assertThat(paperBroker.getOrderCount()).isZero();
        ExecutionTargetSnapshot snapshot = executionManager.getTarget(id).orElseThrow();
        assertThat(snapshot.status()).isEqualTo(ExecutionStatus.NEW);
        assertThat(snapshot.anchorTime()).isNotNull();

        ExecutionTargetSnapshot canceled = executionManager.cancel(id);
        assertThat(canceled.status()).isEqualTo(ExecutionStatus.CANCELED);
    }
}
