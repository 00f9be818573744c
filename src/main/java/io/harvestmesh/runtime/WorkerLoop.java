package io.harvestmesh.runtime;

import io.harvestmesh.config.HarvestMeshConfig;
import io.harvestmesh.config.HarvestSettings;
import io.harvestmesh.model.ListingRecord;
import io.harvestmesh.model.ProxyLease;
import io.harvestmesh.model.ResultStatus;
import io.harvestmesh.model.TaskLease;
import io.harvestmesh.model.TaskStatus;
import io.harvestmesh.observability.AuditLogger;
import io.harvestmesh.policy.OutcomePolicy;
import io.harvestmesh.processing.Classification;
import io.harvestmesh.processing.PageProcessor;
import io.harvestmesh.processing.ProcessingOutcome;
import io.harvestmesh.processing.ProcessingSession;
import io.harvestmesh.storage.HarvestStore;
import io.harvestmesh.storage.ProxyPool;
import io.harvestmesh.storage.TaskQueue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * One worker lane: claim a task, make sure a proxy and a processing session are held, process,
 * apply {@link OutcomePolicy}, record. The proxy and session survive across tasks until a
 * decision asks for rotation or the loop ends.
 *
 * <p>Not thread-safe apart from {@link #requestStop()} and {@link #heartbeat()}, which the
 * runtime calls from other threads.
 */
public final class WorkerLoop implements AutoCloseable {
    private final String workerId;
    private final HarvestStore store;
    private final PageProcessor processor;
    private final AuditLogger audit;
    private final HarvestSettings settings;
    private final LongSupplier clock;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Object lifecycle = new Object();

    private volatile boolean exited;
    private ProxyLease heldProxy;
    private ProcessingSession session;

    public WorkerLoop(String workerId, HarvestStore store, PageProcessor processor, AuditLogger audit,
                      HarvestSettings settings) {
        this(workerId, store, processor, audit, settings, System::currentTimeMillis);
    }

    public WorkerLoop(String workerId, HarvestStore store, PageProcessor processor, AuditLogger audit,
                      HarvestSettings settings, LongSupplier clock) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        this.workerId = workerId;
        this.store = store;
        this.processor = processor;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
    }

    public String workerId() {
        return workerId;
    }

    public Optional<ProxyLease> heldProxy() {
        return Optional.ofNullable(heldProxy);
    }

    /**
     * Runs until the queue is drained or {@link #requestStop()} is called. The attempt in
     * flight when the stop arrives is finished and recorded before the loop exits.
     */
    public LoopSummary run() {
        register();
        int completed = 0;
        int retried = 0;
        int failed = 0;
        int errors = 0;
        String exitReason = "stopped";
        try {
            lane:
            while (!stopRequested()) {
                IterationOutcome outcome;
                try {
                    outcome = runOnce();
                } catch (RuntimeException e) {
                    errors++;
                    audit.log(AuditLogger.AuditEvent.of("worker.iteration.error", workerId, "worker:" + workerId, "error",
                            Map.of("error", String.valueOf(e.getMessage()), "type", e.getClass().getSimpleName())));
                    releaseHeld();
                    if (!pause(settings.errorBackoffMs())) {
                        break;
                    }
                    continue;
                }
                switch (outcome.state()) {
                    case DRAINED -> {
                        exitReason = "drained";
                        return new LoopSummary(workerId, completed, retried, failed, errors, exitReason);
                    }
                    case NO_PROXY -> {
                        if (!pause(settings.noProxyBackoffMs())) {
                            break lane;
                        }
                    }
                    case COMPLETED -> completed++;
                    case RETRIED -> retried++;
                    case FAILED -> failed++;
                    case STALE_LEASE -> {
                        // reaper already took the task back
                    }
                }
            }
            return new LoopSummary(workerId, completed, retried, failed, errors, exitReason);
        } finally {
            synchronized (lifecycle) {
                exited = true;
            }
            close();
            store.workers().markStopped(workerId);
            audit.log(AuditLogger.AuditEvent.of("worker.stop", workerId, "worker:" + workerId, exitReason,
                    Map.of("completed", completed, "retried", retried, "failed", failed, "errors", errors)));
        }
    }

    /**
     * One claim-process-record cycle.
     */
    public IterationOutcome runOnce() {
        Optional<TaskLease> claimed = store.tasks().claim(workerId, clock.getAsLong());
        if (claimed.isEmpty()) {
            return IterationOutcome.drained(workerId);
        }
        TaskLease task = claimed.get();
        audit.log(AuditLogger.AuditEvent.forTask("task.claim", workerId, "ok", task.taskId(), task.itemId(),
                Map.of("attempts", task.attempts(), "max_attempts", task.maxAttempts())));
        try {
            if (!ensureProxy()) {
                store.tasks().release(task.taskId(), workerId);
                audit.log(AuditLogger.AuditEvent.forTask("proxy.unavailable", workerId, "backoff", task.taskId(), task.itemId(),
                        Map.of("backoff_ms", settings.noProxyBackoffMs())));
                return new IterationOutcome(workerId, IterationState.NO_PROXY, task.taskId(), task.itemId(), null, null, null, false);
            }
            ProxyLease proxy = heldProxy;
            ProcessingOutcome outcome = process(task);
            OutcomePolicy.Decision decision = OutcomePolicy.decide(outcome);
            IterationState state = decision.terminal()
                    ? recordTerminal(task, outcome, decision.resultStatus())
                    : recordRetry(task, outcome);
            if (decision.rotateProxy()) {
                rotate(task, outcome.classification());
            }
            return new IterationOutcome(
                    workerId,
                    state,
                    task.taskId(),
                    task.itemId(),
                    outcome.classification(),
                    outcome.then(),
                    proxy.proxyId(),
                    decision.rotateProxy()
            );
        } catch (RuntimeException | Error e) {
            try {
                store.tasks().release(task.taskId(), workerId);
            } catch (RuntimeException releaseError) {
                e.addSuppressed(releaseError);
            }
            throw e;
        }
    }

    /**
     * Refreshes this worker's heartbeat and the lock time of the proxy it holds.
     */
    public void heartbeat() {
        synchronized (lifecycle) {
            if (exited) {
                return;
            }
            long now = clock.getAsLong();
            store.workers().heartbeat(workerId, now);
            store.proxies().touchHeldBy(workerId, now);
        }
    }

    public void requestStop() {
        stopSignal.countDown();
    }

    public boolean stopRequested() {
        return stopSignal.getCount() == 0L;
    }

    public boolean exited() {
        return exited;
    }

    /**
     * Releases the held proxy and session. Safe to call more than once.
     */
    @Override
    public void close() {
        releaseHeld();
    }

    /**
     * Registers the worker row, retrying with the error backoff while the store is busy or not
     * yet reachable. A stop request during the backoff gives up.
     */
    private void register() {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= HarvestMeshConfig.REGISTER_ATTEMPTS; attempt++) {
            try {
                store.workers().register(workerId, clock.getAsLong());
                audit.log(AuditLogger.AuditEvent.of("worker.register", workerId, "worker:" + workerId, "ok",
                        Map.of("attempt", attempt)));
                return;
            } catch (RuntimeException e) {
                last = e;
                audit.log(AuditLogger.AuditEvent.of("worker.register", workerId, "worker:" + workerId, "retry",
                        Map.of("attempt", attempt, "error", String.valueOf(e.getMessage()))));
            }
            if (attempt < HarvestMeshConfig.REGISTER_ATTEMPTS && !pause(settings.errorBackoffMs())) {
                break;
            }
        }
        synchronized (lifecycle) {
            exited = true;
        }
        throw new RuntimeException("Failed to register worker " + workerId, last);
    }

    private boolean ensureProxy() {
        if (heldProxy != null && session != null) {
            return true;
        }
        Optional<ProxyLease> claimed = store.proxies().claim(workerId, clock.getAsLong());
        if (claimed.isEmpty()) {
            return false;
        }
        ProxyLease proxy = claimed.get();
        heldProxy = proxy;
        try {
            session = processor.openSession(proxy.endpoint());
        } catch (Exception e) {
            releaseHeld();
            throw new RuntimeException("Failed to open processing session on proxy " + proxy.proxyId(), e);
        }
        audit.log(AuditLogger.AuditEvent.of("proxy.claim", workerId, "proxy:" + proxy.proxyId(), "ok",
                Map.of("proxy", proxy.proxy(), "uses_count", proxy.usesCount(), "blocks_count", proxy.blocksCount())));
        return true;
    }

    private ProcessingOutcome process(TaskLease task) {
        try {
            ProcessingOutcome outcome = session.process(task);
            return outcome == null ? ProcessingOutcome.unexpected("processor returned no outcome") : outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProcessingOutcome.unexpected("processing interrupted");
        } catch (Exception e) {
            return ProcessingOutcome.unexpected(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private IterationState recordTerminal(TaskLease task, ProcessingOutcome outcome, ResultStatus resultStatus) {
        long now = clock.getAsLong();
        ListingRecord record = resultStatus == ResultStatus.SUCCESS ? outcome.record() : null;
        store.results().upsert(task.itemId(), record, resultStatus, null, workerId, task.attempts(), now);
        boolean applied = store.tasks().recordSuccess(task.taskId(), workerId, now);
        if (!applied) {
            audit.log(AuditLogger.AuditEvent.forTask("task.stale_lease", workerId, "result_kept", task.taskId(), task.itemId(),
                    Map.of("result_status", resultStatus.value())));
            return IterationState.STALE_LEASE;
        }
        store.workers().recordOutcome(workerId, true);
        audit.log(AuditLogger.AuditEvent.forTask("task.complete", workerId, resultStatus.value(), task.taskId(), task.itemId(),
                Map.of("classification", outcome.effective().value(), "attempts", task.attempts())));
        return IterationState.COMPLETED;
    }

    private IterationState recordRetry(TaskLease task, ProcessingOutcome outcome) {
        TaskQueue.AttemptOutcome attempt = store.tasks().recordAttemptFailure(task.taskId(), workerId, clock.getAsLong());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("classification", outcome.classification().value());
        if (outcome.then() != null) {
            details.put("then", outcome.then().value());
        }
        details.put("failure_reason", outcome.failureReason());
        if (!attempt.applied()) {
            audit.log(AuditLogger.AuditEvent.forTask("task.stale_lease", workerId, "ignored", task.taskId(), task.itemId(), details));
            return IterationState.STALE_LEASE;
        }
        store.workers().recordOutcome(workerId, false);
        details.put("attempts", attempt.attempts());
        details.put("max_attempts", attempt.maxAttempts());
        if (attempt.status() == TaskStatus.FAILED) {
            audit.log(AuditLogger.AuditEvent.forTask("task.failed", workerId, "failed", task.taskId(), task.itemId(), details));
            return IterationState.FAILED;
        }
        audit.log(AuditLogger.AuditEvent.forTask("task.retry", workerId, "pending", task.taskId(), task.itemId(), details));
        return IterationState.RETRIED;
    }

    private void rotate(TaskLease task, Classification reason) {
        ProxyLease proxy = heldProxy;
        if (proxy == null) {
            closeSession();
            return;
        }
        ProxyPool.BlockOutcome block;
        try {
            block = store.proxies().markBlocked(proxy.proxyId(), workerId, clock.getAsLong());
        } catch (RuntimeException e) {
            try {
                releaseHeld();
            } catch (RuntimeException releaseError) {
                e.addSuppressed(releaseError);
            }
            throw e;
        }
        closeSession();
        heldProxy = null;
        audit.log(AuditLogger.AuditEvent.forTask("proxy.rotate", workerId, reason.value(), task.taskId(), task.itemId(),
                Map.of("proxy_id", proxy.proxyId(), "blocks_count", block.blocksCount())));
        if (block.blocked()) {
            audit.log(AuditLogger.AuditEvent.of("proxy.blocked", workerId, "proxy:" + proxy.proxyId(), "blocked",
                    Map.of("proxy", proxy.proxy(), "blocks_count", block.blocksCount())));
        }
    }

    private void releaseHeld() {
        ProxyLease proxy = heldProxy;
        closeSession();
        heldProxy = null;
        if (proxy != null) {
            store.proxies().release(proxy.proxyId(), workerId, clock.getAsLong());
        }
    }

    private void closeSession() {
        ProcessingSession current = session;
        session = null;
        if (current != null) {
            current.close();
        }
    }

    private boolean pause(long millis) {
        try {
            return !stopSignal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public enum IterationState {
        DRAINED,
        NO_PROXY,
        COMPLETED,
        RETRIED,
        FAILED,
        STALE_LEASE
    }

    public record IterationOutcome(
            String workerId,
            IterationState state,
            Long taskId,
            Long itemId,
            Classification classification,
            Classification then,
            Long proxyId,
            boolean rotated
    ) {
        static IterationOutcome drained(String workerId) {
            return new IterationOutcome(workerId, IterationState.DRAINED, null, null, null, null, null, false);
        }
    }

    public record LoopSummary(String workerId, int completed, int retried, int failed, int errors, String exitReason) {
    }
}
