package org.obgrid.grid.swing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.awt.EventQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import org.obgrid.Subscription;

/** Tests {@link SwingGridScheduler} and {@link SwingGridUtils} */
public class SwingGridSchedulerTest {
	/** Scheduled tasks run once, on the event thread */
	@Test
	public void schedule() throws InterruptedException {
		CountDownLatch latch = new CountDownLatch(1);
		AtomicBoolean onEdt = new AtomicBoolean();
		AtomicInteger runs = new AtomicInteger();
		SwingGridScheduler.INSTANCE.schedule(() -> {
			onEdt.set(EventQueue.isDispatchThread());
			runs.incrementAndGet();
			latch.countDown();
		}, 20);
		assertTrue(latch.await(5, TimeUnit.SECONDS));
		assertTrue(onEdt.get());
		Thread.sleep(100);
		assertEquals(1, runs.get());
	}

	/** Unsubscribing stops a task from running */
	@Test
	public void cancel() throws InterruptedException {
		AtomicInteger runs = new AtomicInteger();
		Subscription sub = SwingGridScheduler.INSTANCE.schedule(runs::incrementAndGet, 200);
		sub.unsubscribe();
		Thread.sleep(400);
		assertEquals(0, runs.get());
	}

	/** Tasks posted from other threads run on the event thread, in order */
	@Test
	public void onEQ() throws InterruptedException {
		int count = 100;
		CountDownLatch latch = new CountDownLatch(count);
		StringBuilder order = new StringBuilder();
		AtomicBoolean allOnEdt = new AtomicBoolean(true);
		for (int i = 0; i < count; i++) {
			int index = i;
			SwingGridUtils.onEQ(() -> {
				if (!EventQueue.isDispatchThread())
					allOnEdt.set(false);
				order.append(index % 10);
				latch.countDown();
			});
		}
		assertTrue(latch.await(5, TimeUnit.SECONDS));
		assertTrue(allOnEdt.get());
		StringBuilder expected = new StringBuilder();
		for (int i = 0; i < count; i++)
			expected.append(i % 10);
		assertEquals(expected.toString(), order.toString());
	}
}
