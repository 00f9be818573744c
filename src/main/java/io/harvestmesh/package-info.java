/**
 * HarvestMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.harvestmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.harvestmesh.cli.HarvestMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.harvestmesh.runtime.WorkerLoop} claims, processes and records tasks for one lane.</li>
 *   <li>{@code io.harvestmesh.storage.LeaseManager} is the claim primitive behind the task queue and the proxy pool.</li>
 * </ul>
 */
package io.harvestmesh;
