package org.obgrid.grid.swing;

import java.awt.EventQueue;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Utilities for running grid work on the AWT event dispatch thread */
public class SwingGridUtils {
	private static final ConcurrentLinkedQueue<Runnable> EDT_EVENTS = new ConcurrentLinkedQueue<>();

	private SwingGridUtils() {}

	/**
	 * Executes a task on the AWT/Swing event thread. If this thread *is* the AWT/Swing event thread and no other tasks are waiting, the task
	 * will be executed inline
	 *
	 * @param task The task to execute on the AWT {@link EventQueue}
	 */
	public static void onEQ(Runnable task) {
		boolean queueEmpty = EDT_EVENTS.isEmpty();
		// If the queue is not empty, we need to add the task to the queue instead of running it inline to avoid ordering problems
		if (!queueEmpty || !EventQueue.isDispatchThread()) {
			EDT_EVENTS.add(task);
			if (queueEmpty)
				EventQueue.invokeLater(SwingGridUtils::emptyEdtEvents);
		} else
			task.run();
	}

	private static void emptyEdtEvents() {
		Runnable task = EDT_EVENTS.poll();
		while (task != null) {
			try {
				task.run();
			} catch (RuntimeException e) {
				e.printStackTrace();
			}
			task = EDT_EVENTS.poll();
		}
	}
}
