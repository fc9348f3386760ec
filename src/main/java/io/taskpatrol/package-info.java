/**
 * TaskPatrol source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskpatrol.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskpatrol.cli.TaskPatrolCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.taskpatrol.runtime.TaskPatrolRuntime} wires the engine and exposes the trigger API.</li>
 *   <li>{@code io.taskpatrol.engine.ExecutionWorker} runs the per-execution state machine.</li>
 *   <li>{@code io.taskpatrol.storage.ExecutionStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.taskpatrol;
