package org.obgrid.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import org.obgrid.Subscription;

/**
 * <p>
 * Maps a possibly huge sequence of entries onto a small pool of reusable {@link RowContainer}s: only the rows in the viewport, plus a
 * buffer on each side, are bound to containers at any time.
 * </p>
 * <p>
 * When the viewport moves, containers bound outside the new window are re-bound in place to the uncovered indexes of the window, lowest
 * first. Containers are created lazily, at most {@link VirtualWindow#getCapacity() capacity} of them, and are never destroyed until
 * {@link #dispose()}. The work per scroll step is proportional to the window, not the sequence.
 * </p>
 * <p>
 * Each batch of bindings ends with exactly one {@link RowPresenter#layout(List) layout} pass, followed by a measurement of
 * {@link SizingPolicy#AUTO AUTO} columns.
 * </p>
 *
 * @param <R> The type of the grid's items
 */
public class RowVirtualizer<R> {
	/**
	 * Notified before a container's binding changes, so that state attached to the container's current row can be released
	 *
	 * @param <R> The type of the grid's items
	 */
	public interface RebindListener<R> {
		/**
		 * @param container The container whose binding is about to change
		 * @param newIndex The index the container will be bound to, or -1 if it is being unbound
		 * @param newEntry The entry the container will display, or null if it is being unbound
		 */
		void beforeRebind(RowContainer<R> container, int newIndex, ViewEntry<R> newEntry);
	}

	private final ColumnSet<R> theColumns;
	private final ColumnLayoutEngine<R> theLayout;
	private final RowPresenter<R> thePresenter;
	private final int theRowHeight;
	private final int theBuffer;
	private final boolean isVirtualized;
	private final Consumer<? super ValueAccessException> theFaultSink;
	private final List<RowContainer<R>> thePool;
	private final Map<Integer, RowContainer<R>> theBound;
	private final List<RebindListener<R>> theRebindListeners;
	private final Subscription theWidthSub;
	private List<? extends ViewEntry<R>> theSequence;
	private long theScrollOffset;
	private int theViewportHeight;
	private VirtualWindow theWindow;
	private boolean isDisposed;

	/**
	 * @param columns The grid's columns
	 * @param layout The layout engine supplying column widths
	 * @param presenter The host presenter for the containers
	 * @param rowHeight The height of each row, in pixels
	 * @param buffer The number of rows to keep bound beyond each end of the viewport
	 * @param virtualized Whether to window the sequence at all. If false, every entry of the sequence is bound.
	 * @param faultSink Receives getter faults, may be null
	 */
	public RowVirtualizer(ColumnSet<R> columns, ColumnLayoutEngine<R> layout, RowPresenter<R> presenter, int rowHeight, int buffer,
		boolean virtualized, Consumer<? super ValueAccessException> faultSink) {
		if (rowHeight <= 0)
			throw new IllegalArgumentException("Row height must be positive: " + rowHeight);
		else if (buffer < 0)
			throw new IllegalArgumentException("Negative buffer: " + buffer);
		theColumns = Objects.requireNonNull(columns, "columns");
		theLayout = Objects.requireNonNull(layout, "layout");
		thePresenter = presenter == null ? RowPresenter.none() : presenter;
		theRowHeight = rowHeight;
		theBuffer = buffer;
		isVirtualized = virtualized;
		theFaultSink = faultSink;
		thePool = new ArrayList<>();
		theBound = new HashMap<>();
		theRebindListeners = new ArrayList<>();
		theSequence = Collections.emptyList();
		theWindow = new VirtualWindow(0, 1, buffer, 0);
		theWidthSub = layout.changes().act(this::applyWidths);
	}

	/** @return The height of each row, in pixels */
	public int getRowHeight() {
		return theRowHeight;
	}

	/** @return The number of rows kept bound beyond each end of the viewport */
	public int getBuffer() {
		return theBuffer;
	}

	/** @return Whether this virtualizer binds only a window of the sequence, as opposed to every entry */
	public boolean isVirtualized() {
		return isVirtualized;
	}

	/** @return The sequence currently being windowed */
	public List<? extends ViewEntry<R>> getSequence() {
		return theSequence;
	}

	/** @return The current scroll offset, in pixels */
	public long getScrollOffset() {
		return theScrollOffset;
	}

	/** @return The current viewport height, in pixels */
	public int getViewportHeight() {
		return theViewportHeight;
	}

	/** @return The current window */
	public VirtualWindow getWindow() {
		return theWindow;
	}

	/** @return The number of containers needed for the current viewport */
	public int getCapacity() {
		return theWindow.getCapacity();
	}

	/** @return The number of containers created so far */
	public int getPoolSize() {
		return thePool.size();
	}

	/** @return The height of the whole sequence, in pixels */
	public long getTotalHeight() {
		return (long) theSequence.size() * theRowHeight;
	}

	/**
	 * @param listener The listener to notify before containers are re-bound
	 * @return A subscription to remove the listener
	 */
	public Subscription addRebindListener(RebindListener<R> listener) {
		theRebindListeners.add(listener);
		return () -> theRebindListeners.remove(listener);
	}

	/**
	 * @param index The index in the effective sequence
	 * @return The container bound to the index, or null if the index is not in the window
	 */
	public RowContainer<R> getContainer(int index) {
		return theBound.get(index);
	}

	/** @return All bound containers, in index order */
	public List<RowContainer<R>> getBoundContainers() {
		List<RowContainer<R>> bound = new ArrayList<>(theBound.values());
		bound.sort(Comparator.comparingInt(RowContainer::getIndex));
		return bound;
	}

	/** @return All containers in the pool, bound or not */
	public List<RowContainer<R>> getPool() {
		return Collections.unmodifiableList(thePool);
	}

	/**
	 * Replaces the windowed sequence, re-binding every bound container to its index's new entry
	 *
	 * @param sequence The new effective sequence
	 * @param resetWindow Whether to scroll back to the top, as for a page change
	 */
	public void setSequence(List<? extends ViewEntry<R>> sequence, boolean resetWindow) {
		checkAlive();
		theSequence = Objects.requireNonNull(sequence, "sequence");
		if (resetWindow)
			theScrollOffset = 0;
		theScrollOffset = clampOffset(theScrollOffset);
		reconcile(true);
	}

	/**
	 * @param scrollOffset The new scroll offset, in pixels
	 * @param viewportHeight The new viewport height, in pixels
	 */
	public void onViewportChanged(long scrollOffset, int viewportHeight) {
		checkAlive();
		if (scrollOffset < 0)
			throw new IllegalArgumentException("Negative scroll offset: " + scrollOffset);
		else if (viewportHeight < 0)
			throw new IllegalArgumentException("Negative viewport height: " + viewportHeight);
		theViewportHeight = viewportHeight;
		theScrollOffset = clampOffset(scrollOffset);
		reconcile(false);
	}

	/**
	 * @param scrollOffset The new scroll offset, in pixels
	 */
	public void scrollTo(long scrollOffset) {
		onViewportChanged(scrollOffset, theViewportHeight);
	}

	/**
	 * @param index The index of a row in the effective sequence
	 * @return The scroll offset that brings the row into view with the least movement
	 */
	public long scrollOffsetFor(int index) {
		if (index < 0 || index >= theSequence.size())
			throw new IndexOutOfBoundsException(index + " of " + theSequence.size());
		long top = (long) index * theRowHeight;
		if (top < theScrollOffset)
			return top;
		else if (top + theRowHeight > theScrollOffset + theViewportHeight)
			return clampOffset(Math.max(0, top + theRowHeight - theViewportHeight));
		else
			return theScrollOffset;
	}

	/**
	 * Re-reads a single cell of a bound row
	 *
	 * @param index The index of the row in the effective sequence
	 * @param columnId The ID of the column to refresh
	 * @return Whether the row was bound and refreshed
	 */
	public boolean refreshCell(int index, String columnId) {
		RowContainer<R> container = theBound.get(index);
		if (container == null)
			return false;
		readCell(container, theColumns.get(columnId));
		thePresenter.cellChanged(container, columnId);
		return true;
	}

	/** Re-reads every cell of every bound row, without changing any binding */
	public void refreshAll() {
		checkAlive();
		for (RowContainer<R> container : getBoundContainers()) {
			readCells(container);
			thePresenter.bound(container);
		}
		if (!theBound.isEmpty()) {
			thePresenter.layout(getBoundContainers());
			theLayout.measureAutoColumns(theColumns.getAll(), thePool, theLayout.getWidths().getViewportWidth());
		}
	}

	/** Releases all containers. This virtualizer cannot be used afterward. */
	public void dispose() {
		if (isDisposed)
			return;
		isDisposed = true;
		theWidthSub.unsubscribe();
		for (RowContainer<R> container : thePool) {
			if (container.isBound())
				release(container);
			thePresenter.disposed(container);
		}
		thePool.clear();
		theBound.clear();
	}

	void restoreCell(RowContainer<R> container, String columnId, Object value) {
		if (!container.isBound())
			return;
		ColumnModel<R, ?> column = theColumns.get(columnId);
		container.setCell(columnId, value, column.format(value), false);
		thePresenter.cellChanged(container, columnId);
	}

	private void reconcile(boolean rebindAll) {
		if (isVirtualized)
			theWindow = VirtualWindow.compute(theScrollOffset, theViewportHeight, theRowHeight, theBuffer, theSequence.size());
		else
			theWindow = new VirtualWindow(0, theSequence.size(), 0, theSequence.size());
		int start = theWindow.getDesiredStart();
		int end = theWindow.getDesiredEnd();
		boolean[] covered = new boolean[end - start];
		List<RowContainer<R>> stale = new ArrayList<>();
		List<RowContainer<R>> free = new ArrayList<>();
		boolean changed = false;
		for (RowContainer<R> container : thePool) {
			int index = container.getIndex();
			if (index < 0)
				free.add(container);
			else if (index >= start && index < end) {
				if (covered[index - start])
					throw new GridInvariantException("Index " + index + " is bound to more than one container");
				covered[index - start] = true;
				if (rebindAll) {
					bind(container, index);
					changed = true;
				}
			} else
				stale.add(container);
		}

		int uncovered = 0;
		for (RowContainer<R> container : stale) {
			while (uncovered < covered.length && covered[uncovered])
				uncovered++;
			if (uncovered < covered.length) {
				covered[uncovered] = true;
				bind(container, start + uncovered);
			} else
				release(container);
			changed = true;
		}
		for (; uncovered < covered.length; uncovered++) {
			if (covered[uncovered])
				continue;
			RowContainer<R> container;
			if (!free.isEmpty())
				container = free.remove(0);
			else if (thePool.size() < theWindow.getCapacity())
				container = create();
			else
				throw new GridInvariantException("Window " + theWindow + " needs more than " + thePool.size() + " containers");
			covered[uncovered] = true;
			bind(container, start + uncovered);
			changed = true;
		}
		if (theBound.size() != end - start)
			throw new GridInvariantException(theBound.size() + " containers bound for window " + theWindow);

		if (changed) {
			thePresenter.layout(getBoundContainers());
			theLayout.measureAutoColumns(theColumns.getAll(), thePool, theLayout.getWidths().getViewportWidth());
		}
	}

	private RowContainer<R> create() {
		RowContainer<R> container = new RowContainer<>(thePool.size());
		thePool.add(container);
		container.setVisual(thePresenter.create(container));
		return container;
	}

	private void bind(RowContainer<R> container, int index) {
		if (index < 0 || index >= theSequence.size())
			throw new GridInvariantException("Binding to index " + index + " of " + theSequence.size());
		ViewEntry<R> entry = theSequence.get(index);
		for (RebindListener<R> listener : theRebindListeners.toArray(new RebindListener[theRebindListeners.size()]))
			listener.beforeRebind(container, index, entry);
		if (container.isBound())
			theBound.remove(container.getIndex());
		container.bind(index, entry);
		theBound.put(index, container);
		readCells(container);
		container.setWidths(theLayout.getWidths());
		thePresenter.bound(container);
	}

	private void release(RowContainer<R> container) {
		for (RebindListener<R> listener : theRebindListeners.toArray(new RebindListener[theRebindListeners.size()]))
			listener.beforeRebind(container, -1, null);
		theBound.remove(container.getIndex());
		container.unbind();
		thePresenter.unbound(container);
	}

	private void readCells(RowContainer<R> container) {
		if (container.getEntry().isGroupHeader())
			return;
		for (ColumnModel<R, ?> column : theColumns.getVisible())
			readCell(container, column);
	}

	private void readCell(RowContainer<R> container, ColumnModel<R, ?> column) {
		if (container.getEntry().isGroupHeader())
			return;
		R item = container.getItem();
		try {
			Object value = column.getValue(item);
			container.setCell(column.getId(), value, column.format(value), false);
		} catch (RuntimeException e) {
			container.setCell(column.getId(), null, "", true);
			if (theFaultSink != null)
				theFaultSink.accept(new ValueAccessException(column.getId(), item, e));
		}
	}

	private void applyWidths(ColumnWidths widths) {
		for (RowContainer<R> container : thePool) {
			container.setWidths(widths);
			if (container.isBound())
				thePresenter.widthsChanged(container);
		}
	}

	private long clampOffset(long offset) {
		long max = Math.max(0, getTotalHeight() - theViewportHeight);
		return Math.min(offset, max);
	}

	private void checkAlive() {
		if (isDisposed)
			throw new IllegalStateException("This virtualizer has been disposed");
	}
}
