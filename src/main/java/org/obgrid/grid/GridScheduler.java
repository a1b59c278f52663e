package org.obgrid.grid;

import org.obgrid.Subscription;

/** Runs delayed tasks on the grid's thread, used to debounce filter text */
@FunctionalInterface
public interface GridScheduler {
	/** Runs each task immediately on the calling thread, ignoring the delay */
	GridScheduler IMMEDIATE = (task, delay) -> {
		task.run();
		return Subscription.NONE;
	};

	/**
	 * @param task The task to run
	 * @param delayMillis The delay before the task runs, in milliseconds
	 * @return A subscription that prevents the task from running if it has not yet
	 */
	Subscription schedule(Runnable task, long delayMillis);
}
