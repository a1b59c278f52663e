package org.obgrid;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/** Tests observable classes in the org.obgrid package */
public class ObservableTest {
	/** Tests basic {@link SimpleObservable} firing and unsubscription */
	@Test
	public void simpleObservable() {
		SimpleObservable<Integer> obs = new SimpleObservable<>();
		int[] received = new int[] { 0 };
		Subscription sub = obs.act(value -> received[0] = value);
		assertTrue(obs.hasListeners());
		for (int i = 1; i < 10; i++) {
			obs.onNext(i);
			assertEquals(i, received[0]);
		}
		sub.unsubscribe();
		assertFalse(obs.hasListeners());
		obs.onNext(100);
		assertEquals(9, received[0]);
	}

	/** Tests that a listener may unsubscribe itself while being notified without affecting the other listeners */
	@Test
	public void unsubscribeWhileFiring() {
		SimpleObservable<Integer> obs = new SimpleObservable<>();
		int[] counts = new int[2];
		Subscription[] self = new Subscription[1];
		self[0] = obs.act(value -> {
			counts[0]++;
			self[0].unsubscribe();
		});
		obs.act(value -> counts[1]++);
		obs.onNext(1);
		obs.onNext(2);
		assertEquals(1, counts[0]);
		assertEquals(2, counts[1]);
	}

	/** Tests completion of a {@link SimpleObservable} */
	@Test
	public void completion() {
		SimpleObservable<Integer> obs = new SimpleObservable<>();
		boolean[] completed = new boolean[2];
		obs.subscribe(new Observer<Integer>() {
			@Override
			public <V extends Integer> void onNext(V value) {}

			@Override
			public void onCompleted(Object cause) {
				completed[0] = true;
			}
		});
		obs.onCompleted(null);
		assertTrue(completed[0]);
		assertFalse(obs.isAlive());
		assertFalse(obs.hasListeners());

		// Subscribing to a completed observable completes the observer immediately
		Subscription sub = obs.subscribe(new Observer<Integer>() {
			@Override
			public <V extends Integer> void onNext(V value) {}

			@Override
			public void onCompleted(Object cause) {
				completed[1] = true;
			}
		});
		assertTrue(completed[1]);
		assertTrue(sub == Subscription.NONE);
	}

	/** Firing on a completed observable is an error */
	@Test(expected = IllegalStateException.class)
	public void fireAfterCompletion() {
		SimpleObservable<Integer> obs = new SimpleObservable<>();
		obs.onCompleted(null);
		obs.onNext(1);
	}

	/** Tests {@link Subscription#forAll(Subscription...)} */
	@Test
	public void forAll() {
		int[] count = new int[1];
		Subscription all = Subscription.forAll(() -> count[0]++, null, () -> count[0]++);
		all.unsubscribe();
		assertEquals(2, count[0]);
		all.unsubscribe();
		assertEquals(2, count[0]);
	}
}
