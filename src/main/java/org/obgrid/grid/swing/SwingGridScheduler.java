package org.obgrid.grid.swing;

import javax.swing.Timer;

import org.obgrid.Subscription;
import org.obgrid.grid.GridScheduler;

/** Runs a grid's delayed tasks with Swing {@link Timer}s, which fire on the event dispatch thread */
public class SwingGridScheduler implements GridScheduler {
	/** The shared instance */
	public static final SwingGridScheduler INSTANCE = new SwingGridScheduler();

	@Override
	public Subscription schedule(Runnable task, long delayMillis) {
		Timer timer = new Timer((int) Math.min(Integer.MAX_VALUE, delayMillis), evt -> task.run());
		timer.setRepeats(false);
		timer.start();
		return timer::stop;
	}

	@Override
	public String toString() {
		return "Swing timers";
	}
}
