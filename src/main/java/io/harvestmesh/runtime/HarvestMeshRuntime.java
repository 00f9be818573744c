package io.harvestmesh.runtime;

import io.harvestmesh.config.HarvestMeshConfig;
import io.harvestmesh.config.HarvestSettings;
import io.harvestmesh.observability.AuditLogger;
import io.harvestmesh.processing.PageProcessor;
import io.harvestmesh.storage.Database;
import io.harvestmesh.storage.HarvestStore;
import io.harvestmesh.storage.StoreStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the store, the event log and the settings of one process, and runs worker lanes or the
 * reaper on top of them.
 */
public final class HarvestMeshRuntime {
    private final HarvestMeshConfig config;
    private final HarvestSettings settings;
    private final Database database;
    private final HarvestStore store;
    private final AuditLogger audit;
    private final List<WorkerLoop> activeLoops = new CopyOnWriteArrayList<>();
    private final List<Reaper> activeReapers = new CopyOnWriteArrayList<>();

    public HarvestMeshRuntime(HarvestMeshConfig config, HarvestSettings settings) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.store = HarvestStore.open(database, settings.proxyBlockThreshold(), settings.maxTaskAttempts());
        this.audit = new AuditLogger(config.auditFile());
    }

    public static HarvestMeshRuntime load(HarvestMeshConfig config, Map<String, String> env) {
        return new HarvestMeshRuntime(config, HarvestSettings.load(config, env));
    }

    public HarvestMeshConfig config() {
        return config;
    }

    public HarvestSettings settings() {
        return settings;
    }

    public HarvestStore store() {
        return store;
    }

    public AuditLogger audit() {
        return audit;
    }

    public void init() {
        database.init();
    }

    /**
     * Runs {@code workerLanes} worker loops until each of them drains the queue or
     * {@link #requestShutdown()} is called. Heartbeats for all lanes come from one scheduler.
     * When a lane fails, the others are asked to stop and are awaited before the scheduler is
     * shut down; the first failure is then rethrown.
     */
    public WorkersOutcome runWorkers(PageProcessor processor) {
        int lanes = settings.workerLanes();
        String runId = WorkerIdentity.newRunId();
        audit.log(AuditLogger.AuditEvent.of("settings.load", settings.programId(), "settings", "ok",
                Map.of("run_id", runId, "settings", settings)));

        List<WorkerLoop> loops = new ArrayList<>(lanes);
        for (int lane = 0; lane < lanes; lane++) {
            String workerId = WorkerIdentity.forLane(settings.programId(), runId, lane).workerId();
            loops.add(new WorkerLoop(workerId, store, processor, audit, settings));
        }
        activeLoops.addAll(loops);

        AtomicInteger threadSeq = new AtomicInteger();
        ExecutorService laneExecutor = Executors.newFixedThreadPool(lanes, r -> {
            Thread t = new Thread(r, "harvestmesh-lane-" + threadSeq.getAndIncrement());
            t.setDaemon(false);
            return t;
        });
        ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "harvestmesh-heartbeat");
            t.setDaemon(true);
            return t;
        });
        try {
            CompletionService<WorkerLoop.LoopSummary> finished = new ExecutorCompletionService<>(laneExecutor);
            for (WorkerLoop loop : loops) {
                finished.submit(loop::run);
            }
            heartbeats.scheduleAtFixedRate(() -> heartbeatAll(loops),
                    settings.heartbeatIntervalMs(), settings.heartbeatIntervalMs(), TimeUnit.MILLISECONDS);

            List<WorkerLoop.LoopSummary> summaries = new ArrayList<>(lanes);
            RuntimeException failure = null;
            for (int done = 0; done < lanes; done++) {
                try {
                    summaries.add(awaitNextLane(finished, loops));
                } catch (RuntimeException e) {
                    if (failure == null) {
                        failure = e;
                        // the lanes still running keep heartbeating until they have exited
                        loops.forEach(WorkerLoop::requestStop);
                        audit.log(AuditLogger.AuditEvent.of("worker.lane.error", settings.programId(), "run:" + runId, "error",
                                Map.of("error", String.valueOf(e.getMessage()))));
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
            return new WorkersOutcome(runId, lanes, summaries);
        } finally {
            heartbeats.shutdownNow();
            laneExecutor.shutdown();
            activeLoops.removeAll(loops);
        }
    }

    public Reaper.SweepSummary sweepOnce() {
        return new Reaper(store, audit, settings).sweep();
    }

    /**
     * Sweeps on the reaper interval until {@link #requestShutdown()}.
     */
    public int runReaper() {
        Reaper reaper = new Reaper(store, audit, settings);
        activeReapers.add(reaper);
        try {
            return reaper.run();
        } finally {
            activeReapers.remove(reaper);
        }
    }

    public StoreStats.Snapshot status() {
        return store.stats().load(
                System.currentTimeMillis(),
                settings.staleTaskMs(),
                settings.staleProxyLockMs(),
                settings.deadWorkerMs()
        );
    }

    /**
     * Lanes finish their current attempt and release their proxy; the reaper stops after its
     * current sweep.
     */
    public void requestShutdown() {
        activeLoops.forEach(WorkerLoop::requestStop);
        activeReapers.forEach(Reaper::requestStop);
    }

    private void heartbeatAll(List<WorkerLoop> loops) {
        for (WorkerLoop loop : loops) {
            try {
                loop.heartbeat();
            } catch (RuntimeException e) {
                audit.log(AuditLogger.AuditEvent.of("worker.heartbeat.error", loop.workerId(), "worker:" + loop.workerId(), "error",
                        Map.of("error", String.valueOf(e.getMessage()))));
            }
        }
    }

    /**
     * Waits for the next lane to finish, in completion order. An interrupt asks every lane to stop but keeps waiting, so
     * the heartbeat scheduler outlives the lanes; the interrupt flag is restored afterwards.
     */
    private static WorkerLoop.LoopSummary awaitNextLane(CompletionService<WorkerLoop.LoopSummary> finished,
                                                        List<WorkerLoop> loops) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return finished.take().get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    loops.forEach(WorkerLoop::requestStop);
                } catch (ExecutionException e) {
                    throw new RuntimeException("Worker lane failed", e.getCause());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public record WorkersOutcome(String runId, int lanes, List<WorkerLoop.LoopSummary> summaries) {
        public int completed() {
            return summaries.stream().mapToInt(WorkerLoop.LoopSummary::completed).sum();
        }
    }
}
