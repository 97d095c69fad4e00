/**
 * Runtime orchestration package.
 *
 * <p>{@link io.cronrelay.runtime.SchedulerRuntime} drives one evaluation pass: reclaim stuck jobs,
 * fetch candidates, evaluate, dispatch and record terminal state per job.
 * {@link io.cronrelay.runtime.TriggerService} wraps a pass in a root ledger entry for the periodic
 * timer and the on-demand trigger.
 */
package io.cronrelay.runtime;
