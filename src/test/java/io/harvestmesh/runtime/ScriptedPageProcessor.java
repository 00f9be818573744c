package io.harvestmesh.runtime;

import io.harvestmesh.model.ProxyEndpoint;
import io.harvestmesh.model.TaskLease;
import io.harvestmesh.processing.PageProcessor;
import io.harvestmesh.processing.ProcessingOutcome;
import io.harvestmesh.processing.ProcessingSession;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory processor for worker tests. Scripted steps are consumed in order; once they run out
 * the fallback answers.
 */
final class ScriptedPageProcessor implements PageProcessor {
    private final Deque<Function<TaskLease, ProcessingOutcome>> steps = new ArrayDeque<>();
    private final Function<TaskLease, ProcessingOutcome> fallback;
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();
    private final List<String> proxies = new CopyOnWriteArrayList<>();
    private final List<Long> items = new CopyOnWriteArrayList<>();

    ScriptedPageProcessor(Function<TaskLease, ProcessingOutcome> fallback) {
        this.fallback = fallback;
    }

    static ScriptedPageProcessor alwaysFound() {
        return new ScriptedPageProcessor(task -> ProcessingOutcome.contentFound(null));
    }

    synchronized ScriptedPageProcessor then(ProcessingOutcome outcome) {
        steps.addLast(task -> outcome);
        return this;
    }

    synchronized ScriptedPageProcessor thenThrow(RuntimeException error) {
        steps.addLast(task -> {
            throw error;
        });
        return this;
    }

    int opened() {
        return opened.get();
    }

    int closed() {
        return closed.get();
    }

    List<String> proxies() {
        return proxies;
    }

    List<Long> items() {
        return items;
    }

    @Override
    public ProcessingSession openSession(ProxyEndpoint proxy) {
        opened.incrementAndGet();
        proxies.add(proxy.connection());
        return new ProcessingSession() {
            @Override
            public ProcessingOutcome process(TaskLease task) {
                items.add(task.itemId());
                return next().apply(task);
            }

            @Override
            public void close() {
                closed.incrementAndGet();
            }
        };
    }

    private synchronized Function<TaskLease, ProcessingOutcome> next() {
        Function<TaskLease, ProcessingOutcome> step = steps.pollFirst();
        return step == null ? fallback : step;
    }
}
