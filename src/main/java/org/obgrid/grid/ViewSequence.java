package org.obgrid.grid;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * The immutable, ordered sequence of entries a grid displays, derived from its source by a {@link SortFilterGroupPipeline}
 *
 * @param <R> The type of the grid's items
 */
public class ViewSequence<R> extends AbstractList<ViewEntry<R>> implements RandomAccess {
	private final List<ViewEntry<R>> theEntries;
	private final int theItemCount;
	private final int theSourceSize;

	ViewSequence(List<ViewEntry<R>> entries, int sourceSize) {
		theEntries = Collections.unmodifiableList(entries);
		int items = 0;
		for (ViewEntry<R> entry : entries) {
			if (!entry.isGroupHeader())
				items++;
		}
		theItemCount = items;
		theSourceSize = sourceSize;
	}

	/**
	 * @param <R> The type of the grid's items
	 * @return An empty sequence
	 */
	public static <R> ViewSequence<R> empty() {
		return new ViewSequence<>(Collections.emptyList(), 0);
	}

	@Override
	public ViewEntry<R> get(int index) {
		return theEntries.get(index);
	}

	@Override
	public int size() {
		return theEntries.size();
	}

	/** @return The number of item (non-header) entries in this sequence */
	public int getItemCount() {
		return theItemCount;
	}

	/** @return The size of the source this sequence was derived from */
	public int getSourceSize() {
		return theSourceSize;
	}

	/**
	 * @param item The item to find
	 * @return The index of the item's entry in this sequence, or -1 if the item is not displayed
	 */
	public int indexOfItem(Object item) {
		for (int i = 0; i < theEntries.size(); i++) {
			ViewEntry<R> entry = theEntries.get(i);
			if (!entry.isGroupHeader() && Objects.equals(entry.getItem(), item))
				return i;
		}
		return -1;
	}

	/** @return The items of this sequence's item entries, in order */
	public List<R> getItems() {
		List<R> items = new ArrayList<>(theItemCount);
		for (ViewEntry<R> entry : theEntries) {
			if (!entry.isGroupHeader())
				items.add(entry.getItem());
		}
		return Collections.unmodifiableList(items);
	}
}
