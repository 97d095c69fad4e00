/**
 * CronRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.cronrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.cronrelay.cli.CronRelayCommand} maps commands and the HTTP trigger endpoint to runtime APIs.</li>
 *   <li>{@code io.cronrelay.runtime.SchedulerRuntime} drives one evaluation pass: reclaim, fetch, evaluate, dispatch, record.</li>
 *   <li>{@code io.cronrelay.ledger.ExecutionLedger} allocates execution ids and threads parent/root lineage.</li>
 *   <li>{@code io.cronrelay.storage.JobStore} is the only writer of scheduled job rows.</li>
 * </ul>
 */
package io.cronrelay;
