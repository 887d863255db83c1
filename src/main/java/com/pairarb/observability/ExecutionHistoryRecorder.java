package com.pairarb.observability;

import com.pairarb.config.MonitoringProperties;
import com.pairarb.domain.model.ExecutionTargetId;
import com.pairarb.domain.model.ExecutionTargetSnapshot;
import com.pairarb.event.ExecutionEventType;
import com.pairarb.event.ExecutionTargetEvent;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * In-memory history of execution target snapshots, fed by {@link ExecutionTargetEvent}s.
 *
 * <p>In realtime mode every notification is recorded; in batch mode only terminal ones,
 * so a batch run keeps one final snapshot per target. Entries are kept newest first in a
 * ring buffer of {@code pairarb.monitoring.history-capacity} entries.
 */
@Service
public class ExecutionHistoryRecorder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHistoryRecorder.class);

    private final MonitoringProperties monitoringProperties;

    private final ConcurrentLinkedDeque<Entry> ringBuffer = new ConcurrentLinkedDeque<>();

    public ExecutionHistoryRecorder(MonitoringProperties monitoringProperties) {
        this.monitoringProperties = monitoringProperties;
    }

    /** One recorded notification. */
    public record Entry(ExecutionEventType eventType, ExecutionTargetSnapshot snapshot, String message) {}

    @EventListener
    @Order(10)
    public void onExecutionTargetEvent(ExecutionTargetEvent event) {
        if (monitoringProperties.isBatchMode() && !event.getEventType().isTerminal()) {
            return;
        }
        ringBuffer.addFirst(new Entry(event.getEventType(), event.getSnapshot(), event.getMessage()));
        while (ringBuffer.size() > monitoringProperties.getHistoryCapacity()) {
            ringBuffer.removeLast();
        }
        if (event.getEventType().isTerminal()) {
            ExecutionTargetSnapshot snapshot = event.getSnapshot();
            log.info(
                    "Target {} closed {}: filled={}, target={}, fees={}",
                    snapshot.id(),
                    snapshot.status(),
                    snapshot.filledQuantity(),
                    snapshot.targetQuantity(),
                    snapshot.totalFee());
        }
    }

    /** All recorded entries, newest first. */
    public List<Entry> getHistory() {
        return List.copyOf(ringBuffer);
    }

    /** Entries of one target, newest first. */
    public List<Entry> getHistory(ExecutionTargetId id) {
        return ringBuffer.stream().filter(e -> e.snapshot().id().equals(id)).toList();
    }

    public Optional<ExecutionTargetSnapshot> latest(ExecutionTargetId id) {
        return ringBuffer.stream()
                .filter(e -> e.snapshot().id().equals(id))
                .findFirst()
                .map(Entry::snapshot);
    }

    public int size() {
        return ringBuffer.size();
    }

    public void clear() {
        ringBuffer.clear();
    }
}
