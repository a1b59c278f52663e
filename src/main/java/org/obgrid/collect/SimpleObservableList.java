package org.obgrid.collect;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.RandomAccess;

import org.obgrid.Observable;
import org.obgrid.SimpleObservable;
import org.obgrid.collect.CollectionChangeEvent.ElementChange;

/**
 * Default {@link ObservableList} implementation, backed by an {@link ArrayList}. Bulk additions and {@link #clear()} fire a single event.
 *
 * @param <E> The type of elements in the list
 */
public class SimpleObservableList<E> extends AbstractList<E> implements ObservableList<E>, RandomAccess {
	private final ArrayList<E> theValues;
	private final SimpleObservable<CollectionChangeEvent<E>> theChanges;

	/** Creates an empty list */
	public SimpleObservableList() {
		theValues = new ArrayList<>();
		theChanges = new SimpleObservable<>();
	}

	@Override
	public Observable<CollectionChangeEvent<E>> changes() {
		return theChanges.readOnly();
	}

	@Override
	public int size() {
		return theValues.size();
	}

	@Override
	public E get(int index) {
		return theValues.get(index);
	}

	@Override
	public E set(int index, E element) {
		E old = theValues.set(index, element);
		fire(CollectionChangeType.set, Collections.singletonList(new ElementChange<>(element, old, index)), null);
		return old;
	}

	@Override
	public void add(int index, E element) {
		theValues.add(index, element);
		modCount++;
		fire(CollectionChangeType.add, Collections.singletonList(new ElementChange<>(element, null, index)), null);
	}

	@Override
	public boolean addAll(Collection<? extends E> c) {
		return addAll(theValues.size(), c);
	}

	@Override
	public boolean addAll(int index, Collection<? extends E> c) {
		if (c.isEmpty())
			return false;
		List<ElementChange<E>> changes = new ArrayList<>(c.size());
		int i = index;
		for (E value : c)
			changes.add(new ElementChange<>(value, null, i++));
		theValues.addAll(index, c);
		modCount++;
		fire(CollectionChangeType.add, changes, null);
		return true;
	}

	@Override
	public E remove(int index) {
		E old = theValues.remove(index);
		modCount++;
		fire(CollectionChangeType.remove, Collections.singletonList(new ElementChange<>(old, null, index)), null);
		return old;
	}

	@Override
	public void clear() {
		if (theValues.isEmpty())
			return;
		theValues.clear();
		modCount++;
		fire(CollectionChangeType.reset, Collections.emptyList(), null);
	}

	/**
	 * Replaces the entire content of this list, firing a single {@link CollectionChangeType#reset reset} event
	 *
	 * @param values The new content for the list
	 */
	public void reset(Collection<? extends E> values) {
		theValues.clear();
		theValues.addAll(values);
		modCount++;
		fire(CollectionChangeType.reset, Collections.emptyList(), null);
	}

	@Override
	public void update(int index, Object cause) {
		E value = theValues.get(index);
		fire(CollectionChangeType.set, Collections.singletonList(new ElementChange<>(value, value, index)), cause);
	}

	private void fire(CollectionChangeType type, List<ElementChange<E>> elements, Object cause) {
		if (theChanges.hasListeners())
			theChanges.onNext(new CollectionChangeEvent<>(type, elements, cause));
	}
}
