package com.pairarb.oms;

import com.pairarb.domain.model.ExecutionTarget;
import com.pairarb.domain.model.ExecutionTargetId;
import com.pairarb.exception.BusinessException;
import com.pairarb.exception.ErrorCode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sole owner of the active execution targets.
 *
 * <p>Targets are keyed by an {@link ExecutionTargetId} minted here from a monotonic
 * counter, and indexed by opportunity key so the same opportunity cannot run twice.
 * A target leaves the registry when it reaches a terminal status.
 *
 * <p>Every read and write of target state goes through {@link #withLock} or {@link #runLocked}. The lock is
 * reentrant because an order gateway may deliver order events synchronously from inside
 * a submission made while the lock is held.
 */
@Component
public class ExecutionTargetRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTargetRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<ExecutionTargetId, ExecutionTarget> activeTargets = new LinkedHashMap<>();
    private final Map<String, ExecutionTargetId> byOpportunityKey = new HashMap<>();

    /** Last minted ID value. IDs at or below it that are not active have been retired. */
    private long lastId = 0;

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public ExecutionTargetId mintId() {
        return withLock(() -> new ExecutionTargetId(++lastId));
    }

    /**
     * @throws BusinessException with {@link ErrorCode#DUPLICATE_TARGET} if a target for the same
     *                           opportunity is already active
     */
    public void register(ExecutionTarget target) {
        runLocked(() -> {
            ExecutionTargetId existing = byOpportunityKey.get(target.getOpportunityKey());
            if (existing != null) {
                throw new BusinessException(
                        ErrorCode.DUPLICATE_TARGET,
                        "Opportunity " + target.getOpportunityKey() + " already has active target " + existing,
                        Map.of("opportunityKey", target.getOpportunityKey(), "targetId", existing.toString()));
            }
            activeTargets.put(target.getId(), target);
            byOpportunityKey.put(target.getOpportunityKey(), target.getId());
            log.debug("Registered target {} for opportunity {}", target.getId(), target.getOpportunityKey());
        });
    }

    public Optional<ExecutionTarget> find(ExecutionTargetId id) {
        return withLock(() -> Optional.ofNullable(activeTargets.get(id)));
    }

    public Optional<ExecutionTarget> findByOpportunityKey(String opportunityKey) {
        return withLock(() -> Optional.ofNullable(byOpportunityKey.get(opportunityKey)).map(activeTargets::get));
    }

    /** Removes a target. Returns false if it was not active. */
    public boolean retire(ExecutionTargetId id) {
        return withLock(() -> {
            ExecutionTarget removed = activeTargets.remove(id);
            if (removed == null) {
                return false;
            }
            byOpportunityKey.remove(removed.getOpportunityKey());
            log.debug("Retired target {} with status {}", id, removed.getStatus());
            return true;
        });
    }

    /** True when the ID was minted here but its target is no longer active. */
    public boolean wasRetired(ExecutionTargetId id) {
        return withLock(() -> id.value() > 0 && id.value() <= lastId && !activeTargets.containsKey(id));
    }

    /** Copy of the active targets in registration order. */
    public List<ExecutionTarget> activeTargets() {
        return withLock(() -> new ArrayList<>(activeTargets.values()));
    }

    public int size() {
        return withLock(activeTargets::size);
    }
}
