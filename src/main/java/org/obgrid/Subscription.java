package org.obgrid;

import java.util.Collection;

/** A subscription to an {@link Observable}, or any other registration that can be undone, such as a scheduled task */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
	/** A subscription that does nothing on {@link #unsubscribe()} */
	static Subscription NONE = () -> {};

	/** Unsubscribes the observer for this subscription from the observable */
	void unsubscribe();

	@Override
	default void close() {
		unsubscribe();
	}

	/**
	 * @param subs The subscriptions to bundle
	 * @return A single subscription whose {@link #unsubscribe()} method unsubscribes all of the given subscriptions
	 */
	static Subscription forAll(Subscription... subs) {
		Subscription[] copy = subs.clone();
		return () -> {
			for (int s = 0; s < copy.length; s++) {
				if (unsubscribe(copy[s]))
					copy[s] = null;
			}
		};
	}

	/**
	 * @param subs The subscriptions to bundle
	 * @return A single subscription whose {@link #unsubscribe()} method unsubscribes all of the given subscriptions
	 */
	static Subscription forAll(Collection<? extends Subscription> subs) {
		return forAll(subs.toArray(new Subscription[subs.size()]));
	}

	/**
	 * @param sub The subscription to unsubscribe
	 * @return If the subscription was non-null
	 */
	static boolean unsubscribe(Subscription sub) {
		if (sub != null) {
			sub.unsubscribe();
			return true;
		} else
			return false;
	}
}
