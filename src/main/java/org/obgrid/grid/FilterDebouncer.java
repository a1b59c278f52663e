package org.obgrid.grid;

import java.util.Objects;

import org.obgrid.Subscription;

/** Coalesces rapid filter input: each submitted action replaces the pending one and restarts the delay */
public class FilterDebouncer {
	private final GridScheduler theScheduler;
	private final long theDelay;
	private Runnable thePending;
	private Subscription theScheduled;

	/**
	 * @param scheduler The scheduler to run the actions with
	 * @param delayMillis The quiet period after the last submission before the action runs
	 */
	public FilterDebouncer(GridScheduler scheduler, long delayMillis) {
		if (delayMillis < 0)
			throw new IllegalArgumentException("Negative delay: " + delayMillis);
		theScheduler = Objects.requireNonNull(scheduler, "scheduler");
		theDelay = delayMillis;
	}

	/** @return The quiet period after the last submission before the action runs, in milliseconds */
	public long getDelay() {
		return theDelay;
	}

	/** @return Whether an action is waiting to run */
	public boolean isPending() {
		return thePending != null;
	}

	/**
	 * Cancels any pending action and schedules the given one
	 *
	 * @param action The action to run after the delay
	 */
	public void submit(Runnable action) {
		cancel();
		Runnable pending = Objects.requireNonNull(action, "action");
		thePending = pending;
		// The scheduler may run the task synchronously
		Subscription scheduled = theScheduler.schedule(() -> {
			if (thePending != pending)
				return;
			thePending = null;
			theScheduled = null;
			pending.run();
		}, theDelay);
		if (thePending == pending)
			theScheduled = scheduled;
	}

	/**
	 * Runs the pending action now
	 *
	 * @return Whether there was an action pending
	 */
	public boolean flush() {
		Runnable pending = thePending;
		if (pending == null)
			return false;
		cancel();
		pending.run();
		return true;
	}

	/**
	 * Discards the pending action
	 *
	 * @return Whether there was an action pending
	 */
	public boolean cancel() {
		boolean wasPending = thePending != null;
		thePending = null;
		Subscription.unsubscribe(theScheduled);
		theScheduled = null;
		return wasPending;
	}
}
