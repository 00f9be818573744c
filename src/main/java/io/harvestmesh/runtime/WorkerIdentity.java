package io.harvestmesh.runtime;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * {@code programId:hostname:pid:runId:lane}. The run id is fresh per process start, so a
 * recycled pid on the same host never produces an identity that was used before.
 */
public record WorkerIdentity(String programId, String hostname, long pid, String runId, int lane) {
    public WorkerIdentity {
        if (programId == null || programId.isBlank()) {
            throw new IllegalArgumentException("programId must not be blank");
        }
        if (lane < 0) {
            throw new IllegalArgumentException("lane must be >= 0");
        }
    }

    public static String newRunId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public static WorkerIdentity forLane(String programId, String runId, int lane) {
        return new WorkerIdentity(programId, localHostname(), ProcessHandle.current().pid(), runId, lane);
    }

    public String workerId() {
        return programId + ":" + hostname + ":" + pid + ":" + runId + ":" + lane;
    }

    @Override
    public String toString() {
        return workerId();
    }

    static String localHostname() {
        String env = System.getenv("HOSTNAME");
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }
}
