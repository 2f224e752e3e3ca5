/**
 * Operation facade.
 *
 * <p>{@link io.taskmesh.runtime.TaskMeshRuntime} wires the store, lock manager, wait
 * coordinator, recovery journal and audit log, and retries transient store failures. The CLI
 * and the agent loop call nothing below it except the journal it hands out.
 */
package io.taskmesh.runtime;
