package org.obgrid.collect;

import java.util.AbstractList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a set of changes to a collection with a common {@link CollectionChangeType type}.
 *
 * @param <E> The type of element in the changed collection
 */
public class CollectionChangeEvent<E> {
	/**
	 * Represents a change to a single element in a collection
	 *
	 * @param <E> The type of the value
	 */
	public static class ElementChange<E> {
		/** The new value of the element (or the removed value for {@link CollectionChangeType#remove removals}) */
		public final E newValue;
		/** The old value of the element, if the event is of type {@link CollectionChangeType#set} */
		public final E oldValue;
		/** The index of the element in the collection */
		public final int index;

		/**
		 * @param value The new value of the element
		 * @param oldValue The old value of the element, if the event is of type {@link CollectionChangeType#set}
		 * @param index The index of the element in the collection
		 */
		public ElementChange(E value, E oldValue, int index) {
			if (index < 0)
				throw new IndexOutOfBoundsException("" + index);
			this.newValue = value;
			this.oldValue = oldValue;
			this.index = index;
		}

		@Override
		public String toString() {
			return new StringBuilder().append(index).append(':').append(oldValue).append('/').append(newValue).toString();
		}
	}

	/** The type of the changes that this event represents */
	public final CollectionChangeType type;

	/** The elements added, removed, or changed, in ascending index order. Empty for {@link CollectionChangeType#reset} */
	public final List<ElementChange<E>> elements;

	private final Object theCause;

	/**
	 * @param aType The common type of the changes
	 * @param elements The changes
	 * @param cause The cause of the event, may be null
	 */
	public CollectionChangeEvent(CollectionChangeType aType, List<ElementChange<E>> elements, Object cause) {
		type = aType;
		this.elements = Collections.unmodifiableList(elements);
		theCause = cause;
	}

	/** @return The cause of the event, may be null */
	public Object getCause() {
		return theCause;
	}

	/** @return A list of the new values of this change's {@link #elements} */
	public List<E> getValues() {
		return new AbstractList<E>() {
			@Override
			public int size() {
				return elements.size();
			}

			@Override
			public E get(int index) {
				return elements.get(index).newValue;
			}
		};
	}

	/** @return The indexes of this change's {@link #elements} */
	public int[] getIndexes() {
		int[] indexes = new int[elements.size()];
		for (int i = 0; i < indexes.length; i++)
			indexes[i] = elements.get(i).index;
		return indexes;
	}

	@Override
	public String toString() {
		StringBuilder ret = new StringBuilder();
		ret.append(type);
		if (type == CollectionChangeType.reset)
			return ret.toString();
		ret.append(" (\n");
		for (ElementChange<E> elChange : elements) {
			ret.append("\t[").append(elChange.index).append("]: ");
			if (type == CollectionChangeType.set)
				ret.append(elChange.oldValue).append("->");
			ret.append(elChange.newValue).append('\n');
		}
		ret.append(')');
		return ret.toString();
	}
}
