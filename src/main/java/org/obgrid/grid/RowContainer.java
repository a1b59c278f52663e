package org.obgrid.grid;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A reusable row slot owned by a {@link RowVirtualizer}. A container is either unbound or bound to one index of the grid's effective
 * sequence, holding the entry at that index and its cell values. Only the virtualizer changes a container's binding.
 *
 * @param <R> The type of the grid's items
 */
public class RowContainer<R> {
	private final int theSlot;
	private Object theVisual;
	private int theIndex;
	private ViewEntry<R> theEntry;
	private final Map<String, Object> theValues;
	private final Map<String, String> theTexts;
	private final Set<String> theAbsentValues;
	private ColumnWidths theWidths;
	private int theBindCount;

	RowContainer(int slot) {
		theSlot = slot;
		theIndex = -1;
		theValues = new LinkedHashMap<>();
		theTexts = new LinkedHashMap<>();
		theAbsentValues = new HashSet<>();
		theWidths = ColumnWidths.EMPTY;
	}

	/** @return The position of this container in its virtualizer's pool */
	public int getSlot() {
		return theSlot;
	}

	/** @return The host visual created for this container */
	public Object getVisual() {
		return theVisual;
	}

	/** @return The index in the effective sequence this container is bound to, or -1 if it is unbound */
	public int getIndex() {
		return theIndex;
	}

	/** @return Whether this container is bound to an index */
	public boolean isBound() {
		return theIndex >= 0;
	}

	/** @return The entry this container displays, or null if it is unbound */
	public ViewEntry<R> getEntry() {
		return theEntry;
	}

	/** @return The item this container displays, or null if it is unbound or displays a group header */
	public R getItem() {
		return theEntry == null ? null : theEntry.getItem();
	}

	/**
	 * @param columnId The ID of the column
	 * @return The value displayed in the column's cell, or null if the value is absent
	 */
	public Object getCellValue(String columnId) {
		return theValues.get(columnId);
	}

	/**
	 * @param columnId The ID of the column
	 * @return The text displayed in the column's cell
	 */
	public String getCellText(String columnId) {
		String text = theTexts.get(columnId);
		return text == null ? "" : text;
	}

	/**
	 * @param columnId The ID of the column
	 * @return Whether the column's getter failed for this container's item
	 */
	public boolean isValueAbsent(String columnId) {
		return theAbsentValues.contains(columnId);
	}

	/** @return The displayed cell values by column ID */
	public Map<String, Object> getCellValues() {
		return Collections.unmodifiableMap(theValues);
	}

	/** @return The column widths applied to this container */
	public ColumnWidths getWidths() {
		return theWidths;
	}

	/** @return The number of times this container has been bound, for diagnostics */
	public int getBindCount() {
		return theBindCount;
	}

	void setVisual(Object visual) {
		theVisual = visual;
	}

	void bind(int index, ViewEntry<R> entry) {
		theIndex = index;
		theEntry = entry;
		theValues.clear();
		theTexts.clear();
		theAbsentValues.clear();
		theBindCount++;
	}

	void setCell(String columnId, Object value, String text, boolean absent) {
		theValues.put(columnId, value);
		theTexts.put(columnId, text);
		if (absent)
			theAbsentValues.add(columnId);
		else
			theAbsentValues.remove(columnId);
	}

	void unbind() {
		theIndex = -1;
		theEntry = null;
		theValues.clear();
		theTexts.clear();
		theAbsentValues.clear();
	}

	void setWidths(ColumnWidths widths) {
		theWidths = widths;
	}

	@Override
	public String toString() {
		return "row#" + theSlot + (isBound() ? ("@" + theIndex + ": " + theEntry) : " (unbound)");
	}
}
