package com.questrail.debounce.core;

/**
 * Lifecycle of a {@link PendingTask}.
 *
 * <pre>
 *   SCHEDULED ──▶ RUNNING ──▶ COMPLETED
 *       │            │
 *       │            ├──────▶ FAILED
 *       ▼            ▼
 *   CANCELLED ◀──────┘
 * </pre>
 *
 * Terminal states never change.
 */
public enum TaskState
{
    /** Waiting out the debounce delay. */
    SCHEDULED,
    /** The action has been invoked and has not settled yet. */
    RUNNING,
    COMPLETED,
    /** Superseded by a newer value, or torn down with the pipeline. */
    CANCELLED,
    /** The action raised something other than a cancellation signal. */
    FAILED;

    public boolean isTerminal()
    {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
