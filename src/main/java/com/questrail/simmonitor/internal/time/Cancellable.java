package com.questrail.simmonitor.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a requirement deadline or coordinator timer.
 *
 * <p>
 * Cancelling is always safe: a handle may be cancelled before it fires, after
 * it fired, or more than once. Requirement nodes never rely on the return
 * value to decide whether a timeout was observed; they guard expiry with
 * their own lock (see {@code TimedRequirementNode}).
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if this call prevented the task from running;
     *         {@code false} if it already ran or was cancelled earlier.
     */
    boolean cancel();
}
