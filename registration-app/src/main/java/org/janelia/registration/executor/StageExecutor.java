package org.janelia.registration.executor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.janelia.registration.checkpoint.CheckpointKey;
import org.janelia.registration.checkpoint.CheckpointStore;
import org.janelia.registration.grid.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.Uninterruptibles;

/**
 * Applies a {@link UnitOfWork} to every key of a stage with bounded concurrency.
 *
 * Keys that already have a checkpoint are skipped.
 * Each call to {@link #run} uses its own fixed thread pool and
 * does not return until every dispatched unit has finished or failed.
 * Unit failures are recorded in the returned {@link StageReport} and never affect other units.
 *
 * @author Eric Trautman
 */
public class StageExecutor {

    private enum Outcome { COMPLETED, CANCELLED }

    private final CheckpointStore checkpointStore;
    private final int maxConcurrency;
    private final AtomicBoolean cancelled;

    public StageExecutor(final CheckpointStore checkpointStore,
                         final int maxConcurrency)
            throws InvalidConfigurationException {
        if (maxConcurrency < 1) {
            throw new InvalidConfigurationException("max concurrency " + maxConcurrency + " must be at least 1");
        }
        this.checkpointStore = checkpointStore;
        this.maxConcurrency = maxConcurrency;
        this.cancelled = new AtomicBoolean(false);
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Stops dispatching units.  Units that are already running finish normally,
     * units that have not started are reported as cancelled.
     */
    public void cancel() {
        LOG.info("cancel: no further units will be started");
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs the unit of work for every key that does not have a checkpoint.
     *
     * @param  stageName   name used for logging and reporting.
     * @param  keys        checkpoint keys of the stage (duplicates are ignored).
     * @param  unitOfWork  function that computes and stores one key's checkpoint.
     *
     * @return report of what happened to each key.
     *
     * @throws InterruptedException
     *   if the calling thread is interrupted while waiting for the units.
     *   Units that are already running are allowed to finish before this is thrown,
     *   units that have not started are cancelled.
     *   The interrupt status of the calling thread is restored.
     */
    public StageReport run(final String stageName,
                           final Collection<CheckpointKey> keys,
                           final UnitOfWork unitOfWork)
            throws InterruptedException {

        final Stopwatch stopwatch = Stopwatch.createStarted();
        final StageReport report = new StageReport(stageName);

        final List<CheckpointKey> pendingKeys = new ArrayList<>();
        for (final CheckpointKey key : new LinkedHashSet<>(keys)) {
            if (checkpointStore.exists(key)) {
                report.addSkipped(key);
            } else if (cancelled.get()) {
                report.addCancelled(key);
            } else {
                pendingKeys.add(key);
            }
        }

        LOG.info("run: entry, stage {} has {} units, {} already have checkpoints, dispatching {} with {} workers",
                 stageName, keys.size(), report.getSkippedKeys().size(), pendingKeys.size(), maxConcurrency);

        if (pendingKeys.size() > 0) {

            final int threadCount = Math.min(maxConcurrency, pendingKeys.size());
            final ExecutorService taskExecutor = Executors.newFixedThreadPool(threadCount);
            final List<Future<Outcome>> futures = new ArrayList<>(pendingKeys.size());
            for (final CheckpointKey key : pendingKeys) {
                futures.add(taskExecutor.submit(() -> {
                    if (cancelled.get()) {
                        return Outcome.CANCELLED;
                    }
                    unitOfWork.process(key);
                    return Outcome.COMPLETED;
                }));
            }
            taskExecutor.shutdown();

            try {
                for (final Future<Outcome> future : futures) {
                    waitFor(future);
                }
            } catch (final InterruptedException e) {
                // running units are never interrupted, they finish and keep their checkpoints
                LOG.warn("run: {} interrupted, waiting for running units to finish", stageName);
                cancel();
                Uninterruptibles.awaitTerminationUninterruptibly(taskExecutor);
                recordOutcomes(stageName, pendingKeys, futures, report);
                LOG.warn("run: {} stopped after interrupt, {}, elapsed time is {}", stageName, report, stopwatch);
                Thread.currentThread().interrupt();
                throw e;
            }

            recordOutcomes(stageName, pendingKeys, futures, report);
        }

        LOG.info("run: exit, {}, elapsed time is {}", report, stopwatch);

        return report;
    }

    private static void waitFor(final Future<Outcome> future)
            throws InterruptedException {
        try {
            future.get();
        } catch (final ExecutionException e) {
            LOG.debug("waitFor: unit failed, cause is recorded with the stage outcomes");
        }
    }

    private static void recordOutcomes(final String stageName,
                                       final List<CheckpointKey> pendingKeys,
                                       final List<Future<Outcome>> futures,
                                       final StageReport report) {
        for (int i = 0; i < futures.size(); i++) {
            final CheckpointKey key = pendingKeys.get(i);
            try {
                if (Uninterruptibles.getUninterruptibly(futures.get(i)) == Outcome.CANCELLED) {
                    report.addCancelled(key);
                } else {
                    report.addCompleted(key);
                }
            } catch (final ExecutionException e) {
                final Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.error("run: {} unit for {} failed", stageName, key, cause);
                report.addFailure(key, cause);
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StageExecutor.class);
}
