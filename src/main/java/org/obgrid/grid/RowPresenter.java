package org.obgrid.grid;

import java.util.List;

/**
 * The host's side of row virtualization. The {@link RowVirtualizer} tells the presenter when it creates, binds and releases
 * {@link RowContainer}s; the presenter builds and updates the visual for each.
 *
 * @param <R> The type of the grid's items
 */
public interface RowPresenter<R> {
	/**
	 * @param <R> The type of the grid's items
	 * @return A presenter that creates no visuals
	 */
	static <R> RowPresenter<R> none() {
		return container -> null;
	}

	/**
	 * Called exactly once per container, when it is created. Handlers attached to the visual here live as long as the container; they
	 * should find the row they act on through the container, whose binding changes.
	 *
	 * @param container The new container
	 * @return The host visual for the container, may be null
	 */
	Object create(RowContainer<R> container);

	/**
	 * Called when a container is bound to an index, or re-bound with new content
	 *
	 * @param container The bound container
	 */
	default void bound(RowContainer<R> container) {}

	/**
	 * Called when a container is released because the window shrank
	 *
	 * @param container The unbound container
	 */
	default void unbound(RowContainer<R> container) {}

	/**
	 * Called when a single cell of a bound container is refreshed
	 *
	 * @param container The container
	 * @param columnId The ID of the column whose cell was refreshed
	 */
	default void cellChanged(RowContainer<R> container, String columnId) {}

	/**
	 * Called when the column widths of a bound container change
	 *
	 * @param container The container
	 */
	default void widthsChanged(RowContainer<R> container) {}

	/**
	 * Called once after a batch of bindings, so the host can measure and arrange all rows in one pass
	 *
	 * @param bound All bound containers, in index order
	 */
	default void layout(List<RowContainer<R>> bound) {}

	/**
	 * Called when a container is discarded as its virtualizer is disposed
	 *
	 * @param container The container
	 */
	default void disposed(RowContainer<R> container) {}
}
