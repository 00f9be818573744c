/**
 * Runtime orchestration package.
 *
 * <p>{@link io.harvestmesh.runtime.HarvestMeshRuntime} runs worker lanes with a shared heartbeat
 * scheduler and hosts the {@link io.harvestmesh.runtime.Reaper}. All coordination state lives in
 * the store; nothing here is authoritative between calls.
 */
package io.harvestmesh.runtime;
