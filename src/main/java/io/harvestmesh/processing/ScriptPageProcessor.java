package io.harvestmesh.processing;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.harvestmesh.model.ListingRecord;
import io.harvestmesh.model.ProxyEndpoint;
import io.harvestmesh.model.TaskLease;
import io.harvestmesh.util.Jsons;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external extraction command once per task attempt.
 *
 * <p>The item id is appended as the last argument and the proxy connection string is passed in
 * {@code HARVESTMESH_PROXY}. The command prints one JSON object on stdout:
 * <pre>{"classification": "content_found", "then": null, "record": {...}, "failure_reason": null}</pre>
 * Spawn errors, timeouts, non-zero exits and unreadable output become {@code unexpected}.
 */
public final class ScriptPageProcessor implements PageProcessor {
    public static final String PROXY_ENV = "HARVESTMESH_PROXY";
    static final int MAX_OUTPUT_BYTES = 16 * 1024 * 1024;
    private static final int MAX_ERROR_CHARS = 512;
    private static final long STDOUT_DRAIN_MS = 5_000L;
    private static final Executor STDOUT_READER = r -> {
        Thread t = new Thread(r, "harvestmesh-processor-stdout");
        t.setDaemon(true);
        t.start();
    };

    private final List<String> command;
    private final long timeoutMs;

    public ScriptPageProcessor(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("processor command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public ProcessingSession openSession(ProxyEndpoint proxy) {
        return new ScriptSession(proxy);
    }

    private ProcessingOutcome run(ProxyEndpoint proxy, long itemId) {
        List<String> argv = new ArrayList<>(command);
        argv.add(Long.toString(itemId));
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        if (proxy != null) {
            pb.environment().put(PROXY_ENV, proxy.connection());
        }
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ProcessingOutcome.unexpected("processor spawn failed: " + e.getMessage());
        }

        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> readCapped(process.getInputStream()), STDOUT_READER);
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return ProcessingOutcome.unexpected("processor timeout after " + Duration.ofMillis(timeoutMs));
            }
            byte[] bytes = stdout.get(STDOUT_DRAIN_MS, TimeUnit.MILLISECONDS);
            String output = new String(bytes, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                return ProcessingOutcome.unexpected("processor exit=" + process.exitValue() + " output=" + truncate(output));
            }
            if (bytes.length > MAX_OUTPUT_BYTES) {
                return ProcessingOutcome.unexpected("processor output exceeds " + MAX_OUTPUT_BYTES + " bytes");
            }
            return parseOutput(output);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ProcessingOutcome.unexpected("processor interrupted");
        } catch (IOException e) {
            process.destroyForcibly();
            return ProcessingOutcome.unexpected("processor execution failed: " + e.getMessage());
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            return ProcessingOutcome.unexpected("processor output unreadable: " + cause.getMessage());
        }
    }

    /**
     * Drains the whole stream so the child never blocks on a full pipe, keeping at most
     * one byte past {@link #MAX_OUTPUT_BYTES} so an oversized answer can be told apart.
     */
    static byte[] readCapped(InputStream in) {
        ByteArrayOutputStream kept = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        try (in) {
            int n;
            while ((n = in.read(buf)) != -1) {
                int room = MAX_OUTPUT_BYTES + 1 - kept.size();
                if (room > 0) {
                    kept.write(buf, 0, Math.min(room, n));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read processor output", e);
        }
        return kept.toByteArray();
    }

    static ProcessingOutcome parseOutput(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return ProcessingOutcome.unexpected("processor produced no output");
        }
        ScriptOutput out;
        Classification classification;
        Classification then;
        try {
            out = Jsons.mapper().readValue(stdout.strip(), ScriptOutput.class);
            classification = Classification.fromValue(out.classification());
            then = out.then() == null || out.then().isBlank() ? null : Classification.fromValue(out.then());
        } catch (IOException | IllegalArgumentException e) {
            return ProcessingOutcome.unexpected("unreadable processor output: " + truncate(stdout));
        }
        Classification effective = then == null ? classification : then;
        ListingRecord record = effective == Classification.CONTENT_FOUND && out.record() != null
                ? out.record().toListingRecord()
                : null;
        if (effective == Classification.CONTENT_FOUND && record == null) {
            record = ListingRecord.empty();
        }
        try {
            return new ProcessingOutcome(classification, then, record, out.failureReason());
        } catch (IllegalArgumentException e) {
            return ProcessingOutcome.unexpected(e.getMessage());
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    private final class ScriptSession implements ProcessingSession {
        private final ProxyEndpoint proxy;

        private ScriptSession(ProxyEndpoint proxy) {
            this.proxy = proxy;
        }

        @Override
        public ProcessingOutcome process(TaskLease task) {
            return run(proxy, task.itemId());
        }

        @Override
        public void close() {
            // one process per attempt, nothing held between tasks
        }
    }

    record ScriptOutput(
            String classification,
            String then,
            ScriptRecord record,
            @JsonProperty("failure_reason") String failureReason
    ) {
    }

    record ScriptRecord(
            String title,
            String description,
            Map<String, String> characteristics,
            BigDecimal price,
            @JsonProperty("published_at") String publishedAt,
            @JsonProperty("seller_name") String sellerName,
            @JsonProperty("seller_profile_url") String sellerProfileUrl,
            @JsonProperty("location_address") String locationAddress,
            @JsonProperty("location_metro") String locationMetro,
            @JsonProperty("location_region") String locationRegion,
            @JsonProperty("views_total") Integer viewsTotal
    ) {
        ListingRecord toListingRecord() {
            return new ListingRecord(title, description, characteristics, price, publishedAt, sellerName,
                    sellerProfileUrl, locationAddress, locationMetro, locationRegion, viewsTotal);
        }
    }
}
