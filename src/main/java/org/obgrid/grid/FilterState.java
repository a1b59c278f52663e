package org.obgrid.grid;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** An immutable map of column ID to the {@link ColumnFilter} applied to that column. Filters of different columns are conjoined. */
public final class FilterState {
	/** The state with no filters */
	public static final FilterState NONE = new FilterState(Collections.emptyMap());

	private final Map<String, ColumnFilter> theFilters;

	private FilterState(Map<String, ColumnFilter> filters) {
		theFilters = filters;
	}

	/**
	 * @param columnId The ID of the column to filter
	 * @param filter The filter for the column, or null to remove the column's filter
	 * @return A filter state like this one, but with the given filter for the column
	 */
	public FilterState with(String columnId, ColumnFilter filter) {
		if (filter == null)
			return without(columnId);
		Map<String, ColumnFilter> filters = new LinkedHashMap<>(theFilters);
		filters.put(columnId, filter);
		return new FilterState(Collections.unmodifiableMap(filters));
	}

	/**
	 * @param columnId The ID of the column to un-filter
	 * @return A filter state like this one, but without any filter for the column
	 */
	public FilterState without(String columnId) {
		if (!theFilters.containsKey(columnId))
			return this;
		else if (theFilters.size() == 1)
			return NONE;
		Map<String, ColumnFilter> filters = new LinkedHashMap<>(theFilters);
		filters.remove(columnId);
		return new FilterState(Collections.unmodifiableMap(filters));
	}

	/**
	 * @param columnId The ID of the column
	 * @return The filter for the column, or null if the column is not filtered
	 */
	public ColumnFilter get(String columnId) {
		return theFilters.get(columnId);
	}

	/**
	 * @param columnId The ID of the column
	 * @return Whether the column has a filter that excludes anything
	 */
	public boolean isFiltered(String columnId) {
		ColumnFilter filter = theFilters.get(columnId);
		return filter != null && filter.isActive();
	}

	/** @return Whether any column has a filter that excludes anything */
	public boolean isActive() {
		for (ColumnFilter filter : theFilters.values()) {
			if (filter.isActive())
				return true;
		}
		return false;
	}

	/** @return All column filters in this state, by column ID */
	public Map<String, ColumnFilter> getFilters() {
		return theFilters;
	}

	@Override
	public int hashCode() {
		return theFilters.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FilterState && theFilters.equals(((FilterState) obj).theFilters);
	}

	@Override
	public String toString() {
		return theFilters.toString();
	}
}
