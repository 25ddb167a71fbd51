/**
 * Latest-Wins Debounce Operator
 * =============================================================================
 *
 * <p>{@link com.questrail.debounce.core.DebounceLatest} consumes a stream of
 * values and, for each one, schedules a single task that waits out the debounce
 * window and then runs the action. A newer value cancels whatever task is still
 * pending or running, so only the latest value's action is allowed to finish.</p>
 *
 * <pre>
 *   value ─▶ SCHEDULED ──delay──▶ RUNNING ──▶ COMPLETED
 *                │                   │
 *                └──── superseded / teardown ──▶ CANCELLED
 *                                    └── action failure ──▶ FAILED (fatal)
 * </pre>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>At most one action runs at any instant; a new action never starts
 *       before every earlier task is terminal.</li>
 *   <li>Cancellation is cooperative. A running action observes it at its next
 *       {@link com.questrail.debounce.core.TaskContext#delay} or explicit check.</li>
 *   <li>Cancellation is never reported as a failure.</li>
 * </ul>
 */
package com.questrail.debounce.core;
