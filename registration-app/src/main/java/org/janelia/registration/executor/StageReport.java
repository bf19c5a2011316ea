package org.janelia.registration.executor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.janelia.registration.checkpoint.CheckpointKey;

/**
 * Outcome of running one stage: which keys were skipped, completed, failed, or cancelled.
 *
 * @author Eric Trautman
 */
public class StageReport {

    private final String stageName;
    private final List<CheckpointKey> skippedKeys;
    private final List<CheckpointKey> completedKeys;
    private final Map<CheckpointKey, Throwable> failures;
    private final List<CheckpointKey> cancelledKeys;

    public StageReport(final String stageName) {
        this.stageName = stageName;
        this.skippedKeys = new ArrayList<>();
        this.completedKeys = new ArrayList<>();
        this.failures = new TreeMap<>();
        this.cancelledKeys = new ArrayList<>();
    }

    public String getStageName() {
        return stageName;
    }

    public int getTotalCount() {
        return skippedKeys.size() + completedKeys.size() + failures.size() + cancelledKeys.size();
    }

    public List<CheckpointKey> getSkippedKeys() {
        return Collections.unmodifiableList(skippedKeys);
    }

    public List<CheckpointKey> getCompletedKeys() {
        return Collections.unmodifiableList(completedKeys);
    }

    public Map<CheckpointKey, Throwable> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public List<CheckpointKey> getCancelledKeys() {
        return Collections.unmodifiableList(cancelledKeys);
    }

    /**
     * @return true if every key of the stage has a checkpoint.
     */
    public boolean isSuccessful() {
        return failures.isEmpty() && cancelledKeys.isEmpty();
    }

    void addSkipped(final CheckpointKey key) {
        skippedKeys.add(key);
    }

    void addCompleted(final CheckpointKey key) {
        completedKeys.add(key);
    }

    void addFailure(final CheckpointKey key,
                    final Throwable cause) {
        failures.put(key, cause);
    }

    void addCancelled(final CheckpointKey key) {
        cancelledKeys.add(key);
    }

    @Override
    public String toString() {
        return stageName + ": " + getTotalCount() + " units, " + skippedKeys.size() + " skipped, " +
               completedKeys.size() + " completed, " + failures.size() + " failed, " +
               cancelledKeys.size() + " cancelled";
    }
}
