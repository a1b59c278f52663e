package org.obgrid.grid;

/** Immutable paging configuration: a page size and the index of the current page */
public final class PageState {
	/** Paging disabled: one page holding the whole sequence */
	public static final PageState UNPAGED = new PageState(0, 0);

	private final int thePageSize;
	private final int thePageIndex;

	private PageState(int pageSize, int pageIndex) {
		thePageSize = pageSize;
		thePageIndex = pageIndex;
	}

	/**
	 * @param pageSize The number of entries per page
	 * @param pageIndex The index of the current page
	 * @return The page state
	 * @throws IllegalArgumentException If the page size is less than 1 or the index is negative
	 */
	public static PageState of(int pageSize, int pageIndex) throws IllegalArgumentException {
		if (pageSize < 1)
			throw new IllegalArgumentException("Page size must be at least 1: " + pageSize);
		else if (pageIndex < 0)
			throw new IllegalArgumentException("Negative page index: " + pageIndex);
		return new PageState(pageSize, pageIndex);
	}

	/** @return The number of entries per page, or 0 if paging is disabled */
	public int getPageSize() {
		return thePageSize;
	}

	/** @return The index of the current page */
	public int getPageIndex() {
		return thePageIndex;
	}

	/** @return Whether paging is enabled */
	public boolean isPaged() {
		return thePageSize > 0;
	}

	/**
	 * @param totalEntries The number of entries to page
	 * @return The number of pages needed to display the entries, at least 1
	 */
	public int getPageCount(int totalEntries) {
		if (thePageSize == 0 || totalEntries == 0)
			return 1;
		return (totalEntries + thePageSize - 1) / thePageSize;
	}

	/**
	 * @param totalEntries The number of entries to page
	 * @return A page state like this one, with its index clamped to the pages available for the entries
	 */
	public PageState clamp(int totalEntries) {
		int max = getPageCount(totalEntries) - 1;
		if (thePageIndex <= max)
			return this;
		return new PageState(thePageSize, max);
	}

	@Override
	public int hashCode() {
		return thePageSize * 31 + thePageIndex;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof PageState && thePageSize == ((PageState) obj).thePageSize && thePageIndex == ((PageState) obj).thePageIndex;
	}

	@Override
	public String toString() {
		return isPaged() ? ("page " + thePageIndex + " (" + thePageSize + "/page)") : "unpaged";
	}
}
