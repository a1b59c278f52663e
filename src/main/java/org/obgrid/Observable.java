package org.obgrid;

import java.util.function.Consumer;

/**
 * A stream of values that a grid component publishes for observation. All grid observables fire on the thread that drives the grid,
 * which is the UI thread for any real host.
 *
 * @param <T> The type of values this observable provides
 */
public interface Observable<T> {
	/**
	 * Subscribes to this observable such that the given observer will be notified of any new values on this observable.
	 *
	 * @param observer The observer to be notified when new values are available from this observable
	 * @return A subscription that, when invoked, will cease notifications to the observer
	 */
	Subscription subscribe(Observer<? super T> observer);

	/**
	 * @param action The action to perform for each new value
	 * @return The subscription for the action
	 */
	default Subscription act(Consumer<? super T> action) {
		return subscribe(new Observer<T>() {
			@Override
			public <V extends T> void onNext(V value) {
				action.accept(value);
			}

			@Override
			public void onCompleted(Object cause) {
			}

			@Override
			public String toString() {
				return action.toString();
			}
		});
	}
}
