package org.obgrid.grid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.obgrid.Observable;
import org.obgrid.SimpleObservable;

/**
 * The selected items of a grid. Selection is by item, so it survives sorting, filtering and paging; items that leave the grid's source
 * are {@link #retain(Collection) pruned}.
 *
 * @param <R> The type of the grid's items
 */
public class SelectionModel<R> {
	private SelectionMode theMode;
	private final LinkedHashSet<R> theSelection;
	private final SimpleObservable<SelectionChangeEvent<R>> theChanges;

	/**
	 * @param mode The selection mode
	 */
	public SelectionModel(SelectionMode mode) {
		theMode = Objects.requireNonNull(mode, "mode");
		theSelection = new LinkedHashSet<>();
		theChanges = new SimpleObservable<>();
	}

	/** @return The selection mode */
	public SelectionMode getMode() {
		return theMode;
	}

	/**
	 * Changes the selection mode, trimming the selection to what the new mode allows
	 *
	 * @param mode The new selection mode
	 * @return This model
	 */
	public SelectionModel<R> setMode(SelectionMode mode) {
		theMode = Objects.requireNonNull(mode, "mode");
		if (mode == SelectionMode.NONE)
			clear();
		else if (mode == SelectionMode.SINGLE && theSelection.size() > 1) {
			List<R> removed = new ArrayList<>(theSelection.size() - 1);
			Iterator<R> iter = theSelection.iterator();
			iter.next();
			while (iter.hasNext()) {
				removed.add(iter.next());
				iter.remove();
			}
			fire(Collections.emptyList(), removed);
		}
		return this;
	}

	/** @return The selected items, in the order they were selected */
	public List<R> getSelection() {
		return Collections.unmodifiableList(new ArrayList<>(theSelection));
	}

	/** @return The first selected item, or null if nothing is selected */
	public R getSelected() {
		return theSelection.isEmpty() ? null : theSelection.iterator().next();
	}

	/**
	 * @param item The item to test
	 * @return Whether the item is selected
	 */
	public boolean isSelected(R item) {
		return theSelection.contains(item);
	}

	/** @return An observable firing for each change to the selection */
	public Observable<SelectionChangeEvent<R>> changes() {
		return theChanges.readOnly();
	}

	/**
	 * The selection gesture: in {@link SelectionMode#SINGLE SINGLE} mode, selects only the item; in {@link SelectionMode#MULTIPLE
	 * MULTIPLE} mode, toggles the item's selection; in {@link SelectionMode#NONE NONE} mode, does nothing.
	 *
	 * @param item The item to select
	 * @return Whether the selection changed
	 */
	public boolean select(R item) {
		switch (theMode) {
		case NONE:
			return false;
		case SINGLE:
			if (theSelection.size() == 1 && theSelection.contains(item))
				return false;
			List<R> removed = new ArrayList<>(theSelection);
			theSelection.clear();
			theSelection.add(item);
			fire(Collections.singletonList(item), removed);
			return true;
		case MULTIPLE:
			return setSelected(item, !theSelection.contains(item));
		default:
			throw new IllegalStateException("Unrecognized selection mode: " + theMode);
		}
	}

	/**
	 * @param item The item to select or deselect
	 * @param selected Whether the item should be selected
	 * @return Whether the selection changed
	 */
	public boolean setSelected(R item, boolean selected) {
		if (!selected) {
			if (!theSelection.remove(item))
				return false;
			fire(Collections.emptyList(), Collections.singletonList(item));
			return true;
		} else if (theMode == SelectionMode.NONE || theSelection.contains(item))
			return false;
		else if (theMode == SelectionMode.SINGLE)
			return select(item);
		theSelection.add(item);
		fire(Collections.singletonList(item), Collections.emptyList());
		return true;
	}

	/** @return Whether anything was selected */
	public boolean clear() {
		if (theSelection.isEmpty())
			return false;
		List<R> removed = new ArrayList<>(theSelection);
		theSelection.clear();
		fire(Collections.emptyList(), removed);
		return true;
	}

	/**
	 * Deselects items no longer present in the source
	 *
	 * @param source The grid's source items
	 * @return Whether any items were deselected
	 */
	public boolean retain(Collection<? extends R> source) {
		if (theSelection.isEmpty())
			return false;
		Set<?> present = source instanceof Set ? (Set<?>) source : new HashSet<>(source);
		List<R> removed = null;
		Iterator<R> iter = theSelection.iterator();
		while (iter.hasNext()) {
			R selected = iter.next();
			if (!present.contains(selected)) {
				if (removed == null)
					removed = new ArrayList<>();
				removed.add(selected);
				iter.remove();
			}
		}
		if (removed == null)
			return false;
		fire(Collections.emptyList(), removed);
		return true;
	}

	private void fire(List<R> added, List<R> removed) {
		theChanges.onNext(new SelectionChangeEvent<>(Collections.unmodifiableList(added), Collections.unmodifiableList(removed),
			getSelection()));
	}
}
