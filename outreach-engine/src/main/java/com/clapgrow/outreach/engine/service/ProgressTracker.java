package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.model.ProgressSnapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Live progress of running campaigns, keyed by campaign id.
 * Snapshots are immutable and replaced atomically, so readers never see a partial update.
 */
@Component
public class ProgressTracker {

    private final ConcurrentHashMap<Long, ProgressSnapshot> progress = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProgressTracker(Clock clock) {
        this.clock = clock;
    }

    public ProgressSnapshot start(Long campaignId, int totalTargets) {
        ProgressSnapshot snapshot = ProgressSnapshot.start(campaignId, totalTargets, clock.instant());
        progress.put(campaignId, snapshot);
        return snapshot;
    }

    /**
     * Apply an update to the campaign's snapshot. No-op when no run is tracked.
     */
    public Optional<ProgressSnapshot> update(Long campaignId, UnaryOperator<ProgressSnapshot> change) {
        return Optional.ofNullable(progress.computeIfPresent(campaignId, (id, current) -> change.apply(current)));
    }

    public Optional<ProgressSnapshot> get(Long campaignId) {
        return Optional.ofNullable(progress.get(campaignId));
    }

    /**
     * Remove the campaign's entry.
     *
     * @return the last snapshot, marked completed
     */
    public Optional<ProgressSnapshot> finish(Long campaignId) {
        return Optional.ofNullable(progress.remove(campaignId)).map(ProgressSnapshot::completed);
    }

    public boolean isRunning(Long campaignId) {
        return progress.containsKey(campaignId);
    }
}
