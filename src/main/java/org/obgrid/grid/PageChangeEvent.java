package org.obgrid.grid;

/** Fired by a {@link PaginationController} when its page index, page count or page size changes */
public class PageChangeEvent {
	private final int theOldPageIndex;
	private final int thePageIndex;
	private final int thePageCount;
	private final int thePageSize;

	/**
	 * @param oldPageIndex The index of the previous page
	 * @param pageIndex The index of the current page
	 * @param pageCount The number of pages
	 * @param pageSize The number of entries per page, or 0 if paging is disabled
	 */
	public PageChangeEvent(int oldPageIndex, int pageIndex, int pageCount, int pageSize) {
		theOldPageIndex = oldPageIndex;
		thePageIndex = pageIndex;
		thePageCount = pageCount;
		thePageSize = pageSize;
	}

	/** @return The index of the previous page */
	public int getOldPageIndex() {
		return theOldPageIndex;
	}

	/** @return The index of the current page */
	public int getPageIndex() {
		return thePageIndex;
	}

	/** @return The number of pages */
	public int getPageCount() {
		return thePageCount;
	}

	/** @return The number of entries per page, or 0 if paging is disabled */
	public int getPageSize() {
		return thePageSize;
	}

	/** @return Whether the displayed page moved, as opposed to only the page count changing */
	public boolean isPageChanged() {
		return theOldPageIndex != thePageIndex;
	}

	@Override
	public String toString() {
		return "page " + theOldPageIndex + "->" + thePageIndex + " of " + thePageCount;
	}
}
