package org.obgrid.grid;

import org.obgrid.Observable;
import org.obgrid.SimpleObservable;

/**
 * <p>
 * Divides a {@link ViewSequence} into pages of a fixed size and tracks the current page.
 * </p>
 * <p>
 * A page size of zero disables paging; the controller then exposes the whole sequence as a single page. The current page index is
 * always within <code>[0, pageCount-1]</code>, where the page count is at least 1; it is clamped whenever the sequence shrinks or the
 * page size grows.
 * </p>
 *
 * @param <R> The type of the grid's items
 */
public class PaginationController<R> {
	private PageState theState;
	private ViewSequence<R> theView;
	private PageSlice<R> theSlice;
	private final SimpleObservable<PageChangeEvent> theChanges;

	/**
	 * @param pageSize The number of entries per page, or 0 to disable paging
	 */
	public PaginationController(int pageSize) {
		if (pageSize < 0)
			throw new IllegalArgumentException("Negative page size: " + pageSize);
		theState = pageSize == 0 ? PageState.UNPAGED : PageState.of(pageSize, 0);
		theView = ViewSequence.empty();
		theSlice = slice(theView, theState);
		theChanges = new SimpleObservable<>();
	}

	/**
	 * @param <R> The type of the grid's items
	 * @param view The sequence to slice
	 * @param state The paging state
	 * @return The entries of the state's page, with the state's index clamped to the sequence
	 */
	public static <R> PageSlice<R> slice(ViewSequence<R> view, PageState state) {
		if (!state.isPaged())
			return new PageSlice<>(view, 0, view.size(), 0, 1);
		PageState clamped = state.clamp(view.size());
		int offset = clamped.getPageIndex() * clamped.getPageSize();
		int size = Math.min(clamped.getPageSize(), view.size() - offset);
		return new PageSlice<>(view, offset, size, clamped.getPageIndex(), clamped.getPageCount(view.size()));
	}

	/** @return The current paging state */
	public PageState getState() {
		return theState;
	}

	/** @return Whether paging is enabled */
	public boolean isEnabled() {
		return theState.isPaged();
	}

	/** @return The number of entries per page, or 0 if paging is disabled */
	public int getPageSize() {
		return theState.getPageSize();
	}

	/** @return The index of the current page */
	public int getPageIndex() {
		return theState.getPageIndex();
	}

	/** @return The number of pages, at least 1 */
	public int getPageCount() {
		return theSlice.getPageCount();
	}

	/** @return The entries of the current page */
	public PageSlice<R> getSlice() {
		return theSlice;
	}

	/** @return An observable firing when the page index, page count or page size changes */
	public Observable<PageChangeEvent> changes() {
		return theChanges.readOnly();
	}

	/**
	 * Re-slices after the view sequence is rebuilt, clamping the page index if the sequence shrank
	 *
	 * @param view The new view sequence
	 * @return The new current page
	 */
	public PageSlice<R> update(ViewSequence<R> view) {
		theView = view;
		apply(theState);
		return theSlice;
	}

	/**
	 * @param pageSize The number of entries per page, or 0 to disable paging
	 * @return Whether the page size changed
	 * @throws IllegalArgumentException If the page size is negative
	 */
	public boolean setPageSize(int pageSize) throws IllegalArgumentException {
		if (pageSize < 0)
			throw new IllegalArgumentException("Negative page size: " + pageSize);
		if (pageSize == theState.getPageSize())
			return false;
		int oldIndex = theState.getPageIndex();
		if (pageSize == 0)
			apply(PageState.UNPAGED);
		else {
			// Keep the first entry of the old page on the new page
			int firstEntry = oldIndex * theState.getPageSize();
			apply(PageState.of(pageSize, firstEntry / pageSize));
		}
		return true;
	}

	/**
	 * @param pageIndex The index of the page to display
	 * @return Whether the current page changed
	 * @throws IllegalArgumentException If no such page exists
	 */
	public boolean goTo(int pageIndex) throws IllegalArgumentException {
		if (pageIndex < 0 || pageIndex >= getPageCount())
			throw new IllegalArgumentException("No page " + pageIndex + " of " + getPageCount());
		if (pageIndex == theState.getPageIndex())
			return false;
		apply(PageState.of(theState.getPageSize(), pageIndex));
		return true;
	}

	/** @return Whether the current page changed */
	public boolean first() {
		return goTo(0);
	}

	/** @return Whether the current page changed */
	public boolean previous() {
		if (theState.getPageIndex() == 0)
			return false;
		return goTo(theState.getPageIndex() - 1);
	}

	/** @return Whether the current page changed */
	public boolean next() {
		if (theState.getPageIndex() >= getPageCount() - 1)
			return false;
		return goTo(theState.getPageIndex() + 1);
	}

	/** @return Whether the current page changed */
	public boolean last() {
		return goTo(getPageCount() - 1);
	}

	/**
	 * @param viewIndex The index of an entry in the view sequence
	 * @return The index of the page holding the entry
	 */
	public int pageOf(int viewIndex) {
		if (viewIndex < 0 || viewIndex >= theView.size())
			throw new IndexOutOfBoundsException(viewIndex + " of " + theView.size());
		return isEnabled() ? viewIndex / theState.getPageSize() : 0;
	}

	private void apply(PageState state) {
		PageSlice<R> oldSlice = theSlice;
		int oldSize = theState.getPageSize();
		theState = state.clamp(theView.size());
		theSlice = slice(theView, theState);
		if (oldSlice.getPageIndex() != theSlice.getPageIndex() || oldSlice.getPageCount() != theSlice.getPageCount()
			|| oldSize != theState.getPageSize())
			theChanges.onNext(new PageChangeEvent(oldSlice.getPageIndex(), theSlice.getPageIndex(), theSlice.getPageCount(),
				theState.getPageSize()));
	}
}
