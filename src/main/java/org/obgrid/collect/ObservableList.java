package org.obgrid.collect;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.obgrid.Observable;

/**
 * A list that publishes its modifications. A grid whose item source is an ObservableList re-derives its rows whenever the list fires;
 * for any other list the host must ask the grid to refresh itself.
 *
 * @param <E> The type of elements in the list
 */
public interface ObservableList<E> extends List<E> {
	/** @return An observable firing an event for each modification to this list */
	Observable<CollectionChangeEvent<E>> changes();

	/**
	 * Signals that the content of the element at the given index was modified in place, without the element being replaced
	 *
	 * @param index The index of the modified element
	 * @param cause The cause of the modification, may be null
	 */
	void update(int index, Object cause);

	/**
	 * @param <E> The type of elements for the list
	 * @return A new, empty observable list
	 */
	static <E> ObservableList<E> create() {
		return new SimpleObservableList<>();
	}

	/**
	 * @param <E> The type of elements for the list
	 * @param values The initial content for the list
	 * @return A new observable list with the given content
	 */
	static <E> ObservableList<E> of(Collection<? extends E> values) {
		SimpleObservableList<E> list = new SimpleObservableList<>();
		list.addAll(values);
		return list;
	}

	/**
	 * @param <E> The type of elements for the list
	 * @param values The initial content for the list
	 * @return A new observable list with the given content
	 */
	@SafeVarargs
	static <E> ObservableList<E> of(E... values) {
		return of(Arrays.asList(values));
	}
}
