package org.obgrid.grid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import org.obgrid.Observable;
import org.obgrid.SimpleObservable;
import org.obgrid.Subscription;
import org.obgrid.collect.ObservableList;

/**
 * <p>
 * A data grid's presentation engine. The grid derives its rows from a source list through a {@link SortFilterGroupPipeline}, divides
 * them into pages with a {@link PaginationController}, binds the rows near the viewport to reusable containers with a
 * {@link RowVirtualizer}, sizes its columns with a {@link ColumnLayoutEngine}, and edits cells with a {@link CellEditController}.
 * </p>
 * <p>
 * If the source is an {@link ObservableList}, the grid re-derives its rows whenever the source changes, and a committed edit is
 * published to the source as an {@link ObservableList#update(int, Object) update} of the edited item. For any other list the host must
 * call {@link #refresh()} after modifying the source.
 * </p>
 * <p>
 * A grid is not thread-safe. All its methods must be called on the UI thread.
 * </p>
 *
 * @param <R> The type of the grid's items
 */
public class DataGrid<R> {
	/**
	 * Builds a {@link DataGrid}
	 *
	 * @param <R> The type of the grid's items
	 */
	public static class Builder<R> {
		private final List<R> theSource;
		private final ColumnSet<R> theColumns;
		private GridOptions theOptions;
		private TextMeasurer theMeasurer;
		private ThemeProvider theTheme;
		private GridScheduler theScheduler;
		private RowPresenter<R> thePresenter;

		Builder(List<R> source) {
			theSource = Objects.requireNonNull(source, "source");
			theColumns = new ColumnSet<>();
			theOptions = GridOptions.DEFAULT;
			theTheme = ThemeProvider.DEFAULT;
			theScheduler = GridScheduler.IMMEDIATE;
		}

		/**
		 * @param column The column to add to the grid
		 * @return This builder
		 */
		public Builder<R> withColumn(ColumnModel<R, ?> column) {
			theColumns.add(column);
			return this;
		}

		/**
		 * @param columns The columns to add to the grid
		 * @return This builder
		 */
		public Builder<R> withColumns(Collection<? extends ColumnModel<R, ?>> columns) {
			for (ColumnModel<R, ?> column : columns)
				theColumns.add(column);
			return this;
		}

		/**
		 * @param options The options for the grid
		 * @return This builder
		 */
		public Builder<R> withOptions(GridOptions options) {
			theOptions = Objects.requireNonNull(options, "options");
			return this;
		}

		/**
		 * @param measurer Measures header and cell text for column sizing
		 * @return This builder
		 */
		public Builder<R> withMeasurer(TextMeasurer measurer) {
			theMeasurer = measurer;
			return this;
		}

		/**
		 * @param theme Supplies the grid's fonts and colors
		 * @return This builder
		 */
		public Builder<R> withTheme(ThemeProvider theme) {
			theTheme = Objects.requireNonNull(theme, "theme");
			return this;
		}

		/**
		 * @param scheduler Runs the filter text debounce. By default, filter text is applied immediately.
		 * @return This builder
		 */
		public Builder<R> withScheduler(GridScheduler scheduler) {
			theScheduler = Objects.requireNonNull(scheduler, "scheduler");
			return this;
		}

		/**
		 * @param presenter The host presenter for the grid's rows
		 * @return This builder
		 */
		public Builder<R> withPresenter(RowPresenter<R> presenter) {
			thePresenter = presenter;
			return this;
		}

		/** @return The new grid */
		public DataGrid<R> build() {
			if (theMeasurer == null)
				throw new IllegalStateException("A text measurer is required");
			return new DataGrid<>(this);
		}
	}

	/**
	 * @param <R> The type of the grid's items
	 * @param source The source items for the grid
	 * @return A builder for the grid
	 */
	public static <R> Builder<R> build(List<R> source) {
		return new Builder<>(source);
	}

	private final List<R> theSource;
	private final ColumnSet<R> theColumns;
	private final GridOptions theOptions;
	private final SortFilterGroupPipeline<R> thePipeline;
	private final PaginationController<R> thePagination;
	private final ColumnLayoutEngine<R> theLayout;
	private final RowVirtualizer<R> theVirtualizer;
	private final CellEditController<R> theEditor;
	private final EditHistory<R> theHistory;
	private final SelectionModel<R> theSelection;
	private final FilterDebouncer theDebouncer;

	private final SimpleObservable<ValueAccessException> theFaults;
	private final SimpleObservable<SortChangeEvent> theSortChanges;
	private final SimpleObservable<FilterChangeEvent> theFilterChanges;
	private final SimpleObservable<ViewSequence<R>> theViewChanges;
	private final SimpleObservable<ColumnWidths> theOverflows;
	private final Subscription theSubscriptions;

	private SortState theSort;
	private FilterState theFilter;
	private GroupState theGroup;
	private ViewSequence<R> theView;
	private int theViewportWidth;
	private int theViewportHeight;
	private boolean isRefreshing;
	private boolean isDisposed;

	DataGrid(Builder<R> builder) {
		theSource = builder.theSource;
		theColumns = builder.theColumns;
		theOptions = builder.theOptions;
		theFaults = new SimpleObservable<>();
		theSortChanges = new SimpleObservable<>();
		theFilterChanges = new SimpleObservable<>();
		theViewChanges = new SimpleObservable<>();
		theOverflows = new SimpleObservable<>();
		thePipeline = new SortFilterGroupPipeline<>(theOptions.getNullOrdering(), theFaults::onNext);
		thePagination = new PaginationController<>(theOptions.getPageSize());
		theLayout = new ColumnLayoutEngine<>(builder.theMeasurer, builder.theTheme, theOptions.getCellPadding());
		theVirtualizer = new RowVirtualizer<>(theColumns, theLayout, builder.thePresenter, theOptions.getRowHeight(),
			theOptions.getBufferSize(), theOptions.isVirtualized(), theFaults::onNext);
		theEditor = new CellEditController<>(theColumns, theVirtualizer, theFaults::onNext);
		theEditor.setReadOnly(theOptions.isReadOnly());
		theHistory = new EditHistory<>(theOptions.getUndoLimit());
		theSelection = new SelectionModel<>(theOptions.getSelectionMode());
		theDebouncer = new FilterDebouncer(builder.theScheduler, theOptions.getFilterDebounce());
		theSort = SortState.NONE;
		theFilter = FilterState.NONE;
		theGroup = GroupState.NONE;
		theView = ViewSequence.empty();

		List<Subscription> subs = new ArrayList<>();
		if (theSource instanceof ObservableList)
			subs.add(((ObservableList<R>) theSource).changes().act(evt -> refresh()));
		subs.add(theColumns.changes().act(evt -> columnsChanged()));
		subs.add(theColumns.columnChanges().act(this::columnChanged));
		subs.add(theLayout.changes().act(widths -> {
			if (widths.isOverflowing())
				theOverflows.onNext(widths);
		}));
		subs.add(theEditor.commits().act(this::editCommitted));
		theSubscriptions = Subscription.forAll(subs);

		theLayout.resolve(theColumns.getAll(), 0);
		refresh();
	}

	/** @return The grid's source items */
	public List<R> getSource() {
		return theSource;
	}

	/** @return The grid's columns */
	public ColumnSet<R> getColumns() {
		return theColumns;
	}

	/** @return The grid's options */
	public GridOptions getOptions() {
		return theOptions;
	}

	/** @return The current view sequence: all rows passing the filters, sorted and grouped */
	public ViewSequence<R> getView() {
		return theView;
	}

	/** @return The rows the grid displays: the current page if paging is enabled, otherwise the whole view sequence */
	public List<ViewEntry<R>> getEffectiveSequence() {
		if (thePagination.isEnabled())
			return thePagination.getSlice();
		return theView;
	}

	/** @return The grid's pagination */
	public PaginationController<R> getPagination() {
		return thePagination;
	}

	/** @return The grid's column layout */
	public ColumnLayoutEngine<R> getLayout() {
		return theLayout;
	}

	/** @return The grid's row virtualizer */
	public RowVirtualizer<R> getVirtualizer() {
		return theVirtualizer;
	}

	/** @return The grid's cell editing */
	public CellEditController<R> getEditController() {
		return theEditor;
	}

	/** @return The grid's edit history */
	public EditHistory<R> getHistory() {
		return theHistory;
	}

	/** @return The grid's selection */
	public SelectionModel<R> getSelection() {
		return theSelection;
	}

	/** @return An observable firing each value access fault encountered by the grid */
	public Observable<ValueAccessException> faults() {
		return theFaults.readOnly();
	}

	/** @return An observable firing when the sort changes */
	public Observable<SortChangeEvent> sortChanges() {
		return theSortChanges.readOnly();
	}

	/** @return An observable firing when the filters change */
	public Observable<FilterChangeEvent> filterChanges() {
		return theFilterChanges.readOnly();
	}

	/** @return An observable firing when the page, page count or page size changes */
	public Observable<PageChangeEvent> pageChanges() {
		return thePagination.changes();
	}

	/** @return An observable firing the new view sequence each time it is rebuilt */
	public Observable<ViewSequence<R>> viewChanges() {
		return theViewChanges.readOnly();
	}

	/** @return An observable firing each layout whose columns are wider than the viewport */
	public Observable<ColumnWidths> layoutOverflows() {
		return theOverflows.readOnly();
	}

	/** @return An observable firing for each committed edit */
	public Observable<EditCommitEvent<R>> editCommits() {
		return theEditor.commits();
	}

	/** @return An observable firing for each cancelled edit */
	public Observable<EditCancelEvent<R>> editCancels() {
		return theEditor.cancels();
	}

	/** @return An observable firing for each selection change */
	public Observable<SelectionChangeEvent<R>> selectionChanges() {
		return theSelection.changes();
	}

	/** Re-derives the grid's rows from its source */
	public void refresh() {
		checkAlive();
		if (isRefreshing)
			throw new GridInvariantException("Re-entrant refresh");
		isRefreshing = true;
		try {
			theView = thePipeline.rebuild(theSource, theColumns, theSort, theFilter, theGroup);
			theSelection.retain(theSource);
			int oldPage = thePagination.getPageIndex();
			thePagination.update(theView);
			boolean pageChanged = thePagination.getPageIndex() != oldPage;
			if (pageChanged)
				theEditor.cancel();
			theVirtualizer.setSequence(getEffectiveSequence(), pageChanged);
		} finally {
			isRefreshing = false;
		}
		theViewChanges.onNext(theView);
	}

	// Sorting

	/** @return The current sort */
	public SortState getSort() {
		return theSort;
	}

	/**
	 * @param sort The sort for the grid
	 * @throws NoSuchElementException If the sort refers to a column not in the grid
	 * @throws IllegalArgumentException If the sort refers to a column that is not sortable
	 */
	public void setSort(SortState sort) throws NoSuchElementException, IllegalArgumentException {
		for (SortKey key : sort.getKeys()) {
			if (!theColumns.get(key.getColumnId()).isSortable())
				throw new IllegalArgumentException("Column " + key.getColumnId() + " is not sortable");
		}
		if (sort.equals(theSort))
			return;
		SortState old = theSort;
		theSort = sort;
		refresh();
		theSortChanges.onNext(new SortChangeEvent(old, sort));
	}

	/**
	 * Cycles the sort of a column (unsorted, ascending, descending), replacing any other column's sort
	 *
	 * @param columnId The ID of the column
	 * @return Whether the column was sortable
	 */
	public boolean toggleSort(String columnId) {
		return toggleSort(columnId, false);
	}

	/**
	 * Cycles the sort of a column (unsorted, ascending, descending)
	 *
	 * @param columnId The ID of the column
	 * @param additive Whether to keep the other columns' sort as more significant keys
	 * @return Whether the column was sortable
	 */
	public boolean toggleSort(String columnId, boolean additive) {
		if (!theColumns.get(columnId).isSortable())
			return false;
		setSort(theSort.toggle(columnId, additive));
		return true;
	}

	/** Removes all sorting */
	public void clearSort() {
		setSort(SortState.NONE);
	}

	/**
	 * @param columnId The ID of the column
	 * @return The sort indicator for the column's header: "▲", "▼", or ""
	 */
	public String getSortIndicator(String columnId) {
		return theSort.getIndicator(columnId);
	}

	// Filtering

	/** @return The current filters */
	public FilterState getFilter() {
		return theFilter;
	}

	/**
	 * @param filter The filters for the grid
	 * @throws NoSuchElementException If the filters refer to a column not in the grid
	 * @throws IllegalArgumentException If an active filter refers to a column that is not filterable
	 */
	public void setFilter(FilterState filter) throws NoSuchElementException, IllegalArgumentException {
		for (String columnId : filter.getFilters().keySet()) {
			if (!theColumns.get(columnId).isFilterable() && filter.isFiltered(columnId))
				throw new IllegalArgumentException("Column " + columnId + " is not filterable");
		}
		if (filter.equals(theFilter))
			return;
		FilterState old = theFilter;
		theFilter = filter;
		refresh();
		theFilterChanges.onNext(new FilterChangeEvent(old, filter, theView.getItemCount()));
	}

	/**
	 * @param columnId The ID of the column to filter
	 * @param filter The filter for the column, or null to remove the column's filter
	 */
	public void setFilter(String columnId, ColumnFilter filter) {
		setFilter(theFilter.with(columnId, filter));
	}

	/**
	 * @param columnId The ID of the column to un-filter
	 */
	public void clearFilter(String columnId) {
		theColumns.get(columnId);
		setFilter(theFilter.without(columnId));
	}

	/** Removes all filters */
	public void clearFilters() {
		theDebouncer.cancel();
		setFilter(FilterState.NONE);
	}

	/**
	 * Filters a column by text as the user types. The filter is applied after the debounce delay, each call restarting the delay.
	 *
	 * @param columnId The ID of the column to filter
	 * @param text The text to search for in the column's formatted values
	 */
	public void setFilterText(String columnId, String text) {
		if (!theColumns.get(columnId).isFilterable())
			throw new IllegalArgumentException("Column " + columnId + " is not filterable");
		ColumnFilter filter = ColumnFilter.text(text);
		theDebouncer.submit(() -> {
			// The column may have been removed while the text was waiting
			if (theColumns.find(columnId) != null)
				setFilter(columnId, filter.isActive() ? filter : null);
		});
	}

	/**
	 * Applies any filter text waiting on the debounce delay immediately
	 *
	 * @return Whether any filter text was waiting
	 */
	public boolean flushFilterText() {
		return theDebouncer.flush();
	}

	/**
	 * @param columnId The ID of the column
	 * @return The values to offer in the column's filter list
	 * @see SortFilterGroupPipeline#filterCandidates(List, ColumnSet, FilterState, String)
	 */
	public List<FilterCandidate> getFilterCandidates(String columnId) {
		return thePipeline.filterCandidates(theSource, theColumns, theFilter, columnId);
	}

	// Grouping

	/** @return The current grouping */
	public GroupState getGroup() {
		return theGroup;
	}

	/**
	 * @param group The grouping for the grid
	 */
	public void setGroup(GroupState group) {
		if (group.isActive())
			theColumns.get(group.getColumnId());
		if (group.equals(theGroup))
			return;
		theGroup = group;
		refresh();
	}

	/**
	 * @param columnId The ID of the column to group by, or null to remove grouping
	 */
	public void groupBy(String columnId) {
		setGroup(columnId == null ? GroupState.NONE : GroupState.by(columnId));
	}

	/**
	 * Collapses or expands a group
	 *
	 * @param key The key of the group
	 * @return Whether the group is now collapsed
	 */
	public boolean toggleGroup(Object key) {
		if (!theGroup.isActive())
			throw new IllegalStateException("Not grouped");
		boolean collapse = !theGroup.isCollapsed(key);
		setGroup(collapse ? theGroup.collapse(key) : theGroup.expand(key));
		return collapse;
	}

	// Paging

	/**
	 * @param pageSize The number of rows per page, or 0 to disable paging
	 */
	public void setPageSize(int pageSize) {
		if (thePagination.getPageSize() == pageSize)
			return;
		theEditor.cancel();
		thePagination.setPageSize(pageSize);
		theVirtualizer.setSequence(getEffectiveSequence(), true);
	}

	/**
	 * @param pageIndex The index of the page to display
	 * @return Whether the page changed
	 * @throws IllegalArgumentException If no such page exists
	 */
	public boolean goToPage(int pageIndex) throws IllegalArgumentException {
		if (pageIndex < 0 || pageIndex >= thePagination.getPageCount())
			throw new IllegalArgumentException("No page " + pageIndex + " of " + thePagination.getPageCount());
		else if (pageIndex == thePagination.getPageIndex())
			return false;
		// A page switch abandons the open edit
		theEditor.cancel();
		thePagination.goTo(pageIndex);
		theVirtualizer.setSequence(getEffectiveSequence(), true);
		return true;
	}

	/** @return Whether the page changed */
	public boolean nextPage() {
		if (thePagination.getPageIndex() >= thePagination.getPageCount() - 1)
			return false;
		return goToPage(thePagination.getPageIndex() + 1);
	}

	/** @return Whether the page changed */
	public boolean previousPage() {
		if (thePagination.getPageIndex() == 0)
			return false;
		return goToPage(thePagination.getPageIndex() - 1);
	}

	/** @return Whether the page changed */
	public boolean firstPage() {
		return goToPage(0);
	}

	/** @return Whether the page changed */
	public boolean lastPage() {
		return goToPage(thePagination.getPageCount() - 1);
	}

	// Viewport

	/**
	 * @param width The width of the grid's viewport, in pixels
	 * @param height The height of the grid's viewport, in pixels
	 */
	public void setViewport(int width, int height) {
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Negative viewport: " + width + "x" + height);
		theViewportWidth = width;
		theViewportHeight = height;
		theLayout.resolve(theColumns.getAll(), width);
		theVirtualizer.onViewportChanged(theVirtualizer.getScrollOffset(), height);
	}

	/** @return The width of the grid's viewport */
	public int getViewportWidth() {
		return theViewportWidth;
	}

	/** @return The height of the grid's viewport */
	public int getViewportHeight() {
		return theViewportHeight;
	}

	/**
	 * @param scrollOffset The vertical scroll offset, in pixels
	 */
	public void scrollTo(long scrollOffset) {
		theVirtualizer.onViewportChanged(scrollOffset, theViewportHeight);
	}

	/**
	 * Scrolls so that the row at the given index of the effective sequence is in view
	 *
	 * @param index The index of the row in the effective sequence
	 */
	public void scrollToIndex(int index) {
		theVirtualizer.scrollTo(theVirtualizer.scrollOffsetFor(index));
	}

	/**
	 * Brings an item into view, switching pages if needed
	 *
	 * @param item The item to show
	 * @return Whether the item is displayed by the grid
	 */
	public boolean scrollTo(R item) {
		int viewIndex = theView.indexOfItem(item);
		if (viewIndex < 0)
			return false;
		int index = viewIndex;
		if (thePagination.isEnabled()) {
			goToPage(thePagination.pageOf(viewIndex));
			index = thePagination.getSlice().toSliceIndex(viewIndex);
		}
		scrollToIndex(index);
		return true;
	}

	// Columns

	/**
	 * Sets the width of a column as if the user dragged its edge. The column's sizing becomes {@link SizingPolicy#FIXED FIXED}.
	 *
	 * @param columnId The ID of the column to resize
	 * @param width The requested width
	 * @return The column's new resolved width
	 */
	public int resizeColumn(String columnId, int width) {
		ColumnModel<R, ?> column = theColumns.get(columnId);
		column.setFixedWidth(column.clamp(Math.max(0, width)));
		column.setSizingPolicy(SizingPolicy.FIXED);
		return theLayout.getWidths().getWidth(columnId);
	}

	/**
	 * @param columnId The ID of the column
	 * @param visible Whether the column should be displayed
	 */
	public void setColumnVisible(String columnId, boolean visible) {
		theColumns.get(columnId).setVisible(visible);
	}

	/**
	 * @param columnId The ID of the column
	 * @return The column's aggregate over the rows passing the filters, or null if the column has no aggregate
	 */
	public Object getAggregate(String columnId) {
		return theColumns.get(columnId).aggregate(theView.getItems());
	}

	/**
	 * @param columnId The ID of the column
	 * @return The display text of the column's aggregate
	 */
	public String getAggregateText(String columnId) {
		ColumnModel<R, ?> column = theColumns.get(columnId);
		return column.formatAggregate(column.aggregate(theView.getItems()));
	}

	// Editing

	/**
	 * @param index The index of the row in the effective sequence
	 * @param columnId The ID of the column to edit
	 * @return Whether the edit was opened
	 */
	public boolean beginEdit(int index, String columnId) {
		return theEditor.beginEdit(index, columnId);
	}

	/**
	 * @param value The value the user has entered in the editor
	 * @return Whether an edit is open to receive the value
	 */
	public boolean setPendingValue(Object value) {
		return theEditor.setPendingValue(value);
	}

	/** @return The result of committing the open edit */
	public EditResult commitEdit() {
		return theEditor.commit();
	}

	/** @return Whether an edit was open */
	public boolean cancelEdit() {
		return theEditor.cancel();
	}

	/** @return Whether there is an edit to undo */
	public boolean canUndo() {
		return theHistory.canUndo();
	}

	/** @return Whether there is an undone edit to redo */
	public boolean canRedo() {
		return theHistory.canRedo();
	}

	/** @return Whether an edit was undone */
	public boolean undo() {
		theEditor.cancel();
		EditHistory.Operation op = theHistory.undo();
		if (op == null)
			return false;
		itemsChanged(op.getItems(), op);
		return true;
	}

	/** @return Whether an edit was redone */
	public boolean redo() {
		theEditor.cancel();
		EditHistory.Operation op = theHistory.redo();
		if (op == null)
			return false;
		itemsChanged(op.getItems(), op);
		return true;
	}

	// Selection

	/**
	 * @param item The item to select (or toggle, in {@link SelectionMode#MULTIPLE MULTIPLE} mode)
	 * @return Whether the selection changed
	 */
	public boolean select(R item) {
		return theSelection.select(item);
	}

	/** @return Whether anything was selected */
	public boolean clearSelection() {
		return theSelection.clear();
	}

	/** Releases the grid's rows and stops listening to its source and columns */
	public void dispose() {
		if (isDisposed)
			return;
		theDebouncer.cancel();
		theEditor.dispose();
		theVirtualizer.dispose();
		theSubscriptions.unsubscribe();
		isDisposed = true;
	}

	private void editCommitted(EditCommitEvent<R> evt) {
		theHistory.record(evt.getItem(), evt.getColumn(), evt.getOldValue(), evt.getNewValue());
		itemsChanged(Collections.singletonList(evt.getItem()), evt);
	}

	private void itemsChanged(List<?> items, Object cause) {
		if (theSource instanceof ObservableList) {
			ObservableList<R> source = (ObservableList<R>) theSource;
			for (Object item : items) {
				int index = source.indexOf(item);
				if (index >= 0)
					source.update(index, cause);
			}
		} else
			theVirtualizer.refreshAll();
	}

	private void columnsChanged() {
		EditSession<R> session = theEditor.getSession();
		if (session != null && theColumns.find(session.getColumnId()) == null)
			theEditor.cancel();
		// Forget the state of removed columns
		SortState sort = theSort;
		for (SortKey key : sort.getKeys()) {
			if (theColumns.find(key.getColumnId()) == null)
				sort = sort.without(key.getColumnId());
		}
		FilterState filter = theFilter;
		for (String columnId : theFilter.getFilters().keySet()) {
			if (theColumns.find(columnId) == null)
				filter = filter.without(columnId);
		}
		GroupState group = theGroup;
		if (group.isActive() && theColumns.find(group.getColumnId()) == null)
			group = GroupState.NONE;
		theLayout.resolve(theColumns.getAll(), theViewportWidth);
		if (!sort.equals(theSort) || !filter.equals(theFilter) || !group.equals(theGroup)) {
			theSort = sort;
			theFilter = filter;
			theGroup = group;
			refresh();
		} else
			theVirtualizer.refreshAll();
	}

	private void columnChanged(ColumnModel<R, ?> column) {
		EditSession<R> session = theEditor.getSession();
		if (session != null && session.getColumn() == column && !column.isVisible())
			theEditor.cancel();
		theLayout.resolve(theColumns.getAll(), theViewportWidth);
		theVirtualizer.refreshAll();
	}

	private void checkAlive() {
		if (isDisposed)
			throw new IllegalStateException("This grid has been disposed");
	}
}
