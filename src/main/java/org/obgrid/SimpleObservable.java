package org.obgrid;

import java.util.ArrayList;
import java.util.List;

/**
 * A simple observable that can be controlled directly. This class is not thread-safe; like everything in the grid it is meant to be
 * driven from a single (UI) thread.
 *
 * @param <T> The type of values from this observable
 */
public class SimpleObservable<T> implements Observable<T>, Observer<T> {
	private final List<Observer<? super T>> theListeners;
	private boolean isAlive;

	/** Creates a simple observable */
	public SimpleObservable() {
		theListeners = new ArrayList<>();
		isAlive = true;
	}

	/** @return Whether this observable has not been {@link #onCompleted(Object) completed} */
	public boolean isAlive() {
		return isAlive;
	}

	/** @return Whether any observers are currently subscribed to this observable */
	public boolean hasListeners() {
		return !theListeners.isEmpty();
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		if (!isAlive) {
			observer.onCompleted(null);
			return Subscription.NONE;
		}
		theListeners.add(observer);
		boolean[] removed = new boolean[1];
		return () -> {
			if (removed[0])
				return;
			removed[0] = true;
			// Remove by identity, the same lambda may have been subscribed twice
			for (int i = 0; i < theListeners.size(); i++) {
				if (theListeners.get(i) == observer) {
					theListeners.remove(i);
					break;
				}
			}
		};
	}

	@Override
	public <V extends T> void onNext(V value) {
		if (!isAlive)
			throw new IllegalStateException("Firing a value on a completed observable");
		// Listeners may subscribe or unsubscribe as a result of the value; those changes apply to the next value
		Object[] listeners = theListeners.toArray();
		for (Object listener : listeners)
			((Observer<? super T>) listener).onNext(value);
	}

	@Override
	public void onCompleted(Object cause) {
		if (!isAlive)
			return;
		isAlive = false;
		Object[] listeners = theListeners.toArray();
		theListeners.clear();
		for (Object listener : listeners)
			((Observer<? super T>) listener).onCompleted(cause);
	}

	/** @return An observable that fires events from this SimpleObservable but cannot be used to initiate events */
	public Observable<T> readOnly() {
		return this::subscribe;
	}
}
