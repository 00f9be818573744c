package io.harvestmesh.runtime;

import io.harvestmesh.config.HarvestSettings;
import io.harvestmesh.model.TaskStatus;
import io.harvestmesh.observability.AuditLogger;
import io.harvestmesh.storage.HarvestStore;
import io.harvestmesh.storage.TaskQueue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Time-based crash recovery. Every sweep only touches rows whose staleness threshold has
 * already passed, so it can interleave freely with live claims.
 */
public final class Reaper {
    private static final int MAX_LOGGED_TASK_IDS = 50;

    private final HarvestStore store;
    private final AuditLogger audit;
    private final HarvestSettings settings;
    private final LongSupplier clock;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    public Reaper(HarvestStore store, AuditLogger audit, HarvestSettings settings) {
        this(store, audit, settings, System::currentTimeMillis);
    }

    public Reaper(HarvestStore store, AuditLogger audit, HarvestSettings settings, LongSupplier clock) {
        this.store = store;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
    }

    public SweepSummary sweep() {
        return sweep(clock.getAsLong());
    }

    public SweepSummary sweep(long nowMs) {
        List<TaskQueue.ReclaimedTask> reclaimed = store.tasks().reclaimStale(nowMs - settings.staleTaskMs(), settings.reaperBatchLimit());
        int returned = 0;
        int failed = 0;
        for (TaskQueue.ReclaimedTask t : reclaimed) {
            if (t.status() == TaskStatus.FAILED) {
                failed++;
            } else {
                returned++;
            }
        }
        int proxiesReleased = store.proxies().reclaimStale(nowMs - settings.staleProxyLockMs());
        int workersStopped = store.workers().markDead(nowMs - settings.deadWorkerMs());
        int exhausted = store.tasks().failExhausted();
        SweepSummary summary = new SweepSummary(returned, failed, proxiesReleased, workersStopped, exhausted);

        if (summary.total() > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("tasks_reclaimed", returned);
            details.put("tasks_failed", failed);
            details.put("proxies_released", proxiesReleased);
            details.put("workers_stopped", workersStopped);
            details.put("exhausted_failed", exhausted);
            details.put("task_ids", reclaimed.stream()
                    .limit(MAX_LOGGED_TASK_IDS)
                    .map(TaskQueue.ReclaimedTask::taskId)
                    .toList());
            audit.log(AuditLogger.AuditEvent.of("reaper.sweep", "reaper", "store", "reclaimed", details));
        }
        return summary;
    }

    /**
     * Sweeps on the reaper interval until {@link #requestStop()}.
     *
     * @return number of sweeps performed
     */
    public int run() {
        int sweeps = 0;
        while (true) {
            try {
                sweep();
                sweeps++;
            } catch (RuntimeException e) {
                audit.log(AuditLogger.AuditEvent.of("reaper.sweep", "reaper", "store", "error",
                        Map.of("error", String.valueOf(e.getMessage()), "type", e.getClass().getSimpleName())));
            }
            try {
                if (stopSignal.await(settings.reaperIntervalMs(), TimeUnit.MILLISECONDS)) {
                    return sweeps;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return sweeps;
            }
        }
    }

    public void requestStop() {
        stopSignal.countDown();
    }

    public record SweepSummary(
            int tasksReclaimed,
            int tasksFailed,
            int proxiesReleased,
            int workersStopped,
            int exhaustedFailed
    ) {
        public int total() {
            return tasksReclaimed + tasksFailed + proxiesReleased + workersStopped + exhaustedFailed;
        }
    }
}
