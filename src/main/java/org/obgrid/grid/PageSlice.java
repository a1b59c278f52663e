package org.obgrid.grid;

import java.util.AbstractList;
import java.util.RandomAccess;

/**
 * A contiguous view of the entries of a {@link ViewSequence} displayed on one page
 *
 * @param <R> The type of the grid's items
 */
public class PageSlice<R> extends AbstractList<ViewEntry<R>> implements RandomAccess {
	private final ViewSequence<R> theView;
	private final int theOffset;
	private final int theSize;
	private final int thePageIndex;
	private final int thePageCount;

	PageSlice(ViewSequence<R> view, int offset, int size, int pageIndex, int pageCount) {
		theView = view;
		theOffset = offset;
		theSize = size;
		thePageIndex = pageIndex;
		thePageCount = pageCount;
	}

	@Override
	public ViewEntry<R> get(int index) {
		if (index < 0 || index >= theSize)
			throw new IndexOutOfBoundsException(index + " of " + theSize);
		return theView.get(theOffset + index);
	}

	@Override
	public int size() {
		return theSize;
	}

	/** @return The sequence this slice is a view of */
	public ViewSequence<R> getView() {
		return theView;
	}

	/** @return The index in the view sequence of this slice's first entry */
	public int getOffset() {
		return theOffset;
	}

	/** @return The index of this slice's page */
	public int getPageIndex() {
		return thePageIndex;
	}

	/** @return The number of pages of the view sequence */
	public int getPageCount() {
		return thePageCount;
	}

	/** @return The number of entries in the whole view sequence */
	public int getTotalEntries() {
		return theView.size();
	}

	/**
	 * @param sliceIndex The index of an entry in this slice
	 * @return The index of the entry in the view sequence
	 */
	public int toViewIndex(int sliceIndex) {
		return theOffset + sliceIndex;
	}

	/**
	 * @param viewIndex The index of an entry in the view sequence
	 * @return The index of the entry in this slice, or -1 if the entry is not on this page
	 */
	public int toSliceIndex(int viewIndex) {
		int index = viewIndex - theOffset;
		return (index >= 0 && index < theSize) ? index : -1;
	}
}
