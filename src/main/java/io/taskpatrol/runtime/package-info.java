/**
 * Runtime orchestration package.
 *
 * <p>{@link io.taskpatrol.runtime.TaskPatrolRuntime} owns task and credential management, manual
 * triggers, execution history queries, and the background scheduler, reconciler and worker pool.
 */
package io.taskpatrol.runtime;
