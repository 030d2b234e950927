package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.model.ProgressSnapshot;
import com.clapgrow.outreach.engine.model.ProgressStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    private final ProgressTracker tracker = new ProgressTracker(
        new MutableClock(Instant.parse("2024-03-11T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void testStartUpdateFinish_TracksRunLifecycle() {
        tracker.start(5L, 4);
        tracker.update(5L, snapshot -> snapshot.withCurrentTarget(100L));
        assertEquals(100L, tracker.get(5L).orElseThrow().currentTargetId());

        tracker.update(5L, ProgressSnapshot::recordSent);
        tracker.update(5L, ProgressSnapshot::recordFailed);

        ProgressSnapshot running = tracker.get(5L).orElseThrow();
        assertEquals(2, running.processed());
        assertEquals(1, running.sent());
        assertEquals(1, running.failed());
        assertNull(running.currentTargetId());
        assertEquals(50.0, running.percentComplete());
        assertEquals(ProgressStatus.RUNNING, running.status());
        assertTrue(tracker.isRunning(5L));

        ProgressSnapshot finished = tracker.finish(5L).orElseThrow();
        assertEquals(ProgressStatus.COMPLETED, finished.status());
        assertEquals(2, finished.processed());
        assertFalse(tracker.isRunning(5L));
        assertTrue(tracker.get(5L).isEmpty());
    }

    @Test
    void testUpdate_WithoutRun_Ignored() {
        Optional<ProgressSnapshot> updated = tracker.update(9L, ProgressSnapshot::recordSent);

        assertTrue(updated.isEmpty());
        assertTrue(tracker.finish(9L).isEmpty());
    }

    @Test
    void testPercentComplete_OneThird_TwoDecimals() {
        tracker.start(3L, 3);
        tracker.update(3L, ProgressSnapshot::recordSent);

        assertEquals(33.33, tracker.get(3L).orElseThrow().percentComplete());
    }
}
