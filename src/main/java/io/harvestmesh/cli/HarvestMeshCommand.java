package io.harvestmesh.cli;

import io.harvestmesh.config.HarvestMeshConfig;
import io.harvestmesh.config.HarvestSettings;
import io.harvestmesh.processing.ScriptPageProcessor;
import io.harvestmesh.runtime.HarvestMeshRuntime;
import io.harvestmesh.runtime.Reaper;
import io.harvestmesh.storage.StoreStats;
import io.harvestmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

@Command(
        name = "harvestmesh",
        mixinStandardHelpOptions = true,
        description = "HarvestMesh distributed extraction workers",
        subcommands = {
                HarvestMeshCommand.InitCommand.class,
                HarvestMeshCommand.WorkerCommand.class,
                HarvestMeshCommand.ReaperCommand.class,
                HarvestMeshCommand.StatusCommand.class,
                HarvestMeshCommand.SettingsCommand.class
        }
)
public final class HarvestMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = HarvestMeshConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | worker | reaper | status | settings");
    }

    HarvestMeshRuntime runtime() {
        return runtime(UnaryOperator.identity());
    }

    HarvestMeshRuntime runtime(UnaryOperator<HarvestSettings> overrides) {
        HarvestMeshConfig config = HarvestMeshConfig.fromRoot(root);
        HarvestSettings settings = overrides.apply(HarvestSettings.load(config, System.getenv()));
        return new HarvestMeshRuntime(config, settings);
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        HarvestMeshCommand parent;

        @Override
        public Integer call() {
            HarvestMeshRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized HarvestMesh at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "worker", description = "Run worker lanes until the queue drains or the process is stopped")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        HarvestMeshCommand parent;

        @Option(names = {"--processor-command"}, required = true, arity = "1..*",
                description = "Extraction command; the item id is appended as last argument")
        List<String> processorCommand;

        @Option(names = {"--lanes"}, description = "Concurrent worker lanes (default from settings)")
        Integer lanes;

        @Option(names = {"--program-id"}, description = "Program id used in worker identities")
        String programId;

        @Option(names = {"--graceful-timeout-ms"}, defaultValue = "0",
                description = "How long shutdown waits for in-flight attempts; 0 means processing timeout + 5s")
        long gracefulTimeoutMs;

        @Override
        public Integer call() {
            HarvestMeshRuntime runtime = parent.runtime(s -> {
                HarvestSettings out = s.withProgramId(programId);
                return lanes == null ? out : out.withWorkerLanes(lanes);
            });
            runtime.init();
            ScriptPageProcessor processor = new ScriptPageProcessor(processorCommand, runtime.settings().processingTimeoutMs());
            long graceful = gracefulTimeoutMs > 0 ? gracefulTimeoutMs : runtime.settings().processingTimeoutMs() + 5_000L;

            CountDownLatch finished = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                runtime.requestShutdown();
                try {
                    finished.await(graceful, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "harvestmesh-shutdown-hook"));
            try {
                HarvestMeshRuntime.WorkersOutcome outcome = runtime.runWorkers(processor);
                System.out.println(Jsons.toJson(outcome));
                return 0;
            } finally {
                finished.countDown();
            }
        }
    }

    @Command(name = "reaper", description = "Reclaim stale task and proxy leases and stop dead workers")
    static final class ReaperCommand implements Callable<Integer> {
        @ParentCommand
        HarvestMeshCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run a single sweep and exit")
        boolean once;

        @Override
        public Integer call() {
            HarvestMeshRuntime runtime = parent.runtime();
            runtime.init();
            if (once) {
                Reaper.SweepSummary summary = runtime.sweepOnce();
                System.out.println(Jsons.toJson(summary));
                return 0;
            }
            Runtime.getRuntime().addShutdownHook(new Thread(runtime::requestShutdown, "harvestmesh-reaper-shutdown-hook"));
            int sweeps = runtime.runReaper();
            System.out.println(Jsons.toJson(new ReaperRun(sweeps)));
            return 0;
        }
    }

    @Command(name = "status", description = "Counts by status and stuck resources")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        HarvestMeshCommand parent;

        @Override
        public Integer call() {
            HarvestMeshRuntime runtime = parent.runtime();
            runtime.init();
            StoreStats.Snapshot snapshot = runtime.status();
            System.out.println(Jsons.toJson(snapshot));
            return snapshot.health().healthy() ? 0 : 2;
        }
    }

    @Command(name = "settings", description = "Print effective settings after file and environment overrides")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        HarvestMeshCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().settings()));
            return 0;
        }
    }

    record ReaperRun(int sweeps) {
    }
}
