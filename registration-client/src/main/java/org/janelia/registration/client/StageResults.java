package org.janelia.registration.client;

import java.util.List;
import java.util.Map;

import org.janelia.registration.checkpoint.CheckpointKey;
import org.janelia.registration.executor.StageReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts unsuccessful stage reports into client failures so that the client exits with a non-zero status.
 *
 * @author Eric Trautman
 */
public class StageResults {

    /**
     * @throws IllegalStateException
     *   if any unit of the reported stages failed or was cancelled.
     */
    public static void verify(final List<StageReport> reports)
            throws IllegalStateException {

        int unsuccessfulCount = 0;
        for (final StageReport report : reports) {
            logFailures(report);
            unsuccessfulCount += report.getFailures().size() + report.getCancelledKeys().size();
        }

        if (unsuccessfulCount > 0) {
            throw new IllegalStateException(unsuccessfulCount + " units did not complete, " +
                                            "rerun the same command to retry them");
        }
    }

    public static void logFailures(final StageReport report) {
        LOG.info("logFailures: {}", report);
        for (final Map.Entry<CheckpointKey, Throwable> failure : report.getFailures().entrySet()) {
            LOG.error("logFailures: {} failed for {}", report.getStageName(), failure.getKey(), failure.getValue());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StageResults.class);
}
