package org.obgrid.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import org.obgrid.util.TypeTokens;

/**
 * <p>
 * Derives a {@link ViewSequence} from a grid's source items: filters them, partitions them into groups, sorts them, and flattens the
 * result, interleaving group headers if requested.
 * </p>
 * <p>
 * A column getter that throws for an item makes that item's value "absent" in the column. An absent value passes every filter and sorts
 * after every other value (nulls included) regardless of direction. Each such fault is reported to this pipeline's fault sink and the
 * first of each rebuild is printed as a warning.
 * </p>
 *
 * @param <R> The type of the grid's items
 */
public class SortFilterGroupPipeline<R> {
	private static final Object ABSENT = new Object() {
		@Override
		public String toString() {
			return "(absent)";
		}
	};

	private final NullOrdering theNullOrdering;
	private final Consumer<? super ValueAccessException> theFaultSink;
	private ValueAccessException theFirstFault;
	private int theFaultCount;

	/** Creates a pipeline sorting nulls first and discarding faults */
	public SortFilterGroupPipeline() {
		this(NullOrdering.FIRST, null);
	}

	/**
	 * @param nullOrdering Where null values sort, independent of sort direction
	 * @param faultSink Receives getter faults, may be null
	 */
	public SortFilterGroupPipeline(NullOrdering nullOrdering, Consumer<? super ValueAccessException> faultSink) {
		theNullOrdering = Objects.requireNonNull(nullOrdering, "nullOrdering");
		theFaultSink = faultSink;
	}

	/** @return Where null values sort */
	public NullOrdering getNullOrdering() {
		return theNullOrdering;
	}

	/**
	 * @param rawItems The grid's source items
	 * @param columns The grid's columns
	 * @param sort The sort to apply
	 * @param filter The filters to apply
	 * @param group The grouping to apply
	 * @return The derived view sequence
	 * @throws java.util.NoSuchElementException If any of the states refer to a column not in the column set
	 */
	public ViewSequence<R> rebuild(List<? extends R> rawItems, ColumnSet<R> columns, SortState sort, FilterState filter,
		GroupState group) {
		theFirstFault = null;
		theFaultCount = 0;
		try {
			List<ColumnModel<R, ?>> filterColumns = new ArrayList<>();
			List<ColumnFilter> filters = new ArrayList<>();
			collectFilters(columns, filter, null, filterColumns, filters);
			List<ColumnModel<R, ?>> sortColumns = new ArrayList<>(sort.getKeys().size());
			boolean[] descending = new boolean[sort.getKeys().size()];
			for (int k = 0; k < descending.length; k++) {
				SortKey key = sort.getKeys().get(k);
				sortColumns.add(columns.get(key.getColumnId()));
				descending[k] = key.getDirection() == SortDirection.DESCENDING;
			}
			ColumnModel<R, ?> groupColumn = group.isActive() ? columns.get(group.getColumnId()) : null;

			// Filter and partition, preserving first-seen group order
			Map<Object, List<Row<R>>> groups = new LinkedHashMap<>();
			for (int i = 0; i < rawItems.size(); i++) {
				R item = rawItems.get(i);
				if (!accepts(item, filterColumns, filters))
					continue;
				Object key = null;
				if (groupColumn != null) {
					key = read(groupColumn, item);
					if (key == ABSENT)
						key = null;
				}
				Object[] sortValues = new Object[sortColumns.size()];
				for (int k = 0; k < sortValues.length; k++)
					sortValues[k] = read(sortColumns.get(k), item);
				groups.computeIfAbsent(key, __ -> new ArrayList<>()).add(new Row<>(item, i, sortValues));
			}

			// List.sort is stable
			Comparator<Row<R>> sorter = sortColumns.isEmpty() ? null : sorter(sortColumns, descending);
			List<ViewEntry<R>> entries = new ArrayList<>();
			for (Map.Entry<Object, List<Row<R>>> g : groups.entrySet()) {
				List<Row<R>> rows = g.getValue();
				if (sorter != null)
					rows.sort(sorter);
				boolean collapsed = false;
				if (groupColumn != null && group.isShowingHeaders()) {
					collapsed = group.isCollapsed(g.getKey());
					entries.add(new ViewEntry.GroupHeader<>(groupColumn.getId(), g.getKey(), displayText(groupColumn, g.getKey()),
						rows.size(), collapsed));
				}
				if (!collapsed) {
					for (Row<R> row : rows)
						entries.add(new ViewEntry.Item<>(row.item, row.sourceIndex, groupColumn == null ? null : g.getKey()));
				}
			}
			return new ViewSequence<>(entries, rawItems.size());
		} finally {
			if (theFirstFault != null) {
				System.err.println("Warning: " + theFaultCount + " value access fault(s) while deriving rows; first: "
					+ theFirstFault.getMessage());
			}
		}
	}

	/**
	 * Computes the values offered in a column's filter list: the distinct values of the column among the items passing every
	 * <b>other</b> column's filter. The column's own filter affects only which candidates are {@link FilterCandidate#isSelected()
	 * selected}.
	 *
	 * @param rawItems The grid's source items
	 * @param columns The grid's columns
	 * @param filter The current filters
	 * @param columnId The ID of the column to get the candidates for
	 * @return The filter candidates for the column, sorted by display text
	 */
	public List<FilterCandidate> filterCandidates(List<? extends R> rawItems, ColumnSet<R> columns, FilterState filter,
		String columnId) {
		ColumnModel<R, ?> column = columns.get(columnId);
		theFirstFault = null;
		theFaultCount = 0;
		List<ColumnModel<R, ?>> filterColumns = new ArrayList<>();
		List<ColumnFilter> filters = new ArrayList<>();
		collectFilters(columns, filter, columnId, filterColumns, filters);
		Map<Object, int[]> counts = new LinkedHashMap<>();
		for (R item : rawItems) {
			if (!accepts(item, filterColumns, filters))
				continue;
			Object value = read(column, item);
			if (value == ABSENT)
				continue;
			counts.computeIfAbsent(value, __ -> new int[1])[0]++;
		}
		ColumnFilter own = filter.get(columnId);
		List<FilterCandidate> candidates = new ArrayList<>(counts.size());
		for (Map.Entry<Object, int[]> entry : counts.entrySet()) {
			Object value = entry.getKey();
			boolean selected = own == null || !own.isActive() || own.accepts(value, column.format(value));
			candidates.add(new FilterCandidate(value, displayText(column, value), entry.getValue()[0], selected));
		}
		Collections.sort(candidates, (c1, c2) -> {
			int comp = String.CASE_INSENSITIVE_ORDER.compare(c1.getDisplayText(), c2.getDisplayText());
			if (comp == 0)
				comp = c1.getDisplayText().compareTo(c2.getDisplayText());
			return comp;
		});
		return Collections.unmodifiableList(candidates);
	}

	/**
	 * @param column The column to compare the values of
	 * @param v1 The first value, not null
	 * @param v2 The second value, not null
	 * @return The comparison of the values in ascending order
	 */
	static int compareValues(ColumnModel<?, ?> column, Object v1, Object v2) {
		if (column.getComparator() != null)
			return ((Comparator<Object>) (Comparator<?>) column.getComparator()).compare(v1, v2);
		else if (v1 instanceof Comparable && TypeTokens.isComparable(column.getType()))
			return ((Comparable<Object>) v1).compareTo(v2);
		else if (v1 instanceof Comparable && v1.getClass() == v2.getClass())
			return ((Comparable<Object>) v1).compareTo(v2);
		else
			return column.format(v1).compareTo(column.format(v2));
	}

	private Comparator<Row<R>> sorter(List<ColumnModel<R, ?>> sortColumns, boolean[] descending) {
		int nullSign = theNullOrdering == NullOrdering.FIRST ? -1 : 1;
		return (r1, r2) -> {
			for (int k = 0; k < descending.length; k++) {
				Object v1 = r1.sortValues[k];
				Object v2 = r2.sortValues[k];
				int comp;
				if (v1 == v2)
					comp = 0;
				else if (v1 == ABSENT)
					comp = 1;
				else if (v2 == ABSENT)
					comp = -1;
				else if (v1 == null)
					comp = nullSign;
				else if (v2 == null)
					comp = -nullSign;
				else {
					comp = compareValues(sortColumns.get(k), v1, v2);
					if (descending[k])
						comp = -comp;
				}
				if (comp != 0)
					return comp;
			}
			return 0;
		};
	}

	private void collectFilters(ColumnSet<R> columns, FilterState filter, String exclude, List<ColumnModel<R, ?>> filterColumns,
		List<ColumnFilter> filters) {
		for (Map.Entry<String, ColumnFilter> f : filter.getFilters().entrySet()) {
			if (!f.getValue().isActive() || f.getKey().equals(exclude))
				continue;
			filterColumns.add(columns.get(f.getKey()));
			filters.add(f.getValue());
		}
	}

	private boolean accepts(R item, List<ColumnModel<R, ?>> filterColumns, List<ColumnFilter> filters) {
		for (int f = 0; f < filters.size(); f++) {
			ColumnModel<R, ?> column = filterColumns.get(f);
			ColumnFilter filter = filters.get(f);
			Object value = read(column, item);
			if (value == ABSENT)
				continue;
			String text = filter.getText() == null ? null : column.format(value);
			if (!filter.accepts(value, text))
				return false;
		}
		return true;
	}

	private Object read(ColumnModel<R, ?> column, R item) {
		try {
			return column.getValue(item);
		} catch (RuntimeException e) {
			ValueAccessException fault = new ValueAccessException(column.getId(), item, e);
			if (theFirstFault == null)
				theFirstFault = fault;
			theFaultCount++;
			if (theFaultSink != null)
				theFaultSink.accept(fault);
			return ABSENT;
		}
	}

	private static String displayText(ColumnModel<?, ?> column, Object value) {
		return value == null ? FilterCandidate.EMPTY_TEXT : column.format(value);
	}

	private static class Row<R> {
		final R item;
		final int sourceIndex;
		final Object[] sortValues;

		Row(R item, int sourceIndex, Object[] sortValues) {
			this.item = item;
			this.sourceIndex = sourceIndex;
			this.sortValues = sortValues;
		}
	}
}
