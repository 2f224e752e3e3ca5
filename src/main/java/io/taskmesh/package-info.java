/**
 * TaskMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskmesh.cli.TaskMeshCommand} maps commands to runtime operations.</li>
 *   <li>{@code io.taskmesh.runtime.TaskMeshRuntime} is the operation facade agents call.</li>
 *   <li>{@code io.taskmesh.storage.TaskStore} is the authoritative persistence layer.</li>
 *   <li>{@code io.taskmesh.agent.AgentWorker} is the recover/match/lock/execute loop.</li>
 * </ul>
 */
package io.taskmesh;
