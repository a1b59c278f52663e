package org.obgrid.grid.swing;

import java.util.ArrayList;
import java.util.List;

import javax.swing.event.TableModelEvent;
import javax.swing.event.TableModelListener;
import javax.swing.table.TableModel;

import org.obgrid.Subscription;
import org.obgrid.grid.ColumnModel;
import org.obgrid.grid.DataGrid;
import org.obgrid.grid.EditResult;
import org.obgrid.grid.ViewEntry;
import org.obgrid.util.TypeTokens;

/**
 * A swing table model exposing the rows a {@link DataGrid} displays (the current page, if paging is enabled) and its visible columns.
 * Edits made through {@link #setValueAt(Object, int, int)} go through the grid's edit controller, so they are validated and recorded for
 * undo like any other edit.
 *
 * @param <R> The type of the grid's items
 */
public class GridTableModel<R> implements TableModel {
	private final DataGrid<R> theGrid;
	private final List<TableModelListener> theListeners;
	private final Subscription theGridSub;
	private List<ColumnModel<R, ?>> theColumns;
	private EditResult theLastEditResult;

	/**
	 * @param grid The grid to expose
	 */
	public GridTableModel(DataGrid<R> grid) {
		theGrid = grid;
		theListeners = new ArrayList<>();
		theColumns = grid.getColumns().getVisible();
		theGridSub = Subscription.forAll(//
			grid.viewChanges().act(v -> SwingGridUtils.onEQ(() -> fire(new TableModelEvent(this)))),
			grid.pageChanges().act(p -> SwingGridUtils.onEQ(() -> fire(new TableModelEvent(this)))),
			grid.sortChanges().act(s -> SwingGridUtils.onEQ(this::columnsChanged)),
			grid.getColumns().changes().act(c -> SwingGridUtils.onEQ(this::columnsChanged)),
			grid.getColumns().columnChanges().act(c -> SwingGridUtils.onEQ(this::columnsChanged)));
	}

	/** @return The grid this model exposes */
	public DataGrid<R> getGrid() {
		return theGrid;
	}

	/** @return The result of the last edit made through {@link #setValueAt(Object, int, int)}, or null */
	public EditResult getLastEditResult() {
		return theLastEditResult;
	}

	/**
	 * @param columnIndex The index of the column in this model
	 * @return The grid column at the index
	 */
	public ColumnModel<R, ?> getColumn(int columnIndex) {
		return theColumns.get(columnIndex);
	}

	/**
	 * @param rowIndex The index of the row in this model
	 * @return The grid entry at the index
	 */
	public ViewEntry<R> getEntry(int rowIndex) {
		return theGrid.getEffectiveSequence().get(rowIndex);
	}

	@Override
	public int getRowCount() {
		return theGrid.getEffectiveSequence().size();
	}

	@Override
	public int getColumnCount() {
		return theColumns.size();
	}

	@Override
	public String getColumnName(int columnIndex) {
		ColumnModel<R, ?> column = theColumns.get(columnIndex);
		String indicator = theGrid.getSortIndicator(column.getId());
		return indicator.isEmpty() ? column.getHeader() : (column.getHeader() + " " + indicator);
	}

	@Override
	public Class<?> getColumnClass(int columnIndex) {
		return TypeTokens.getRawType(theColumns.get(columnIndex).getType());
	}

	@Override
	public boolean isCellEditable(int rowIndex, int columnIndex) {
		if (theGrid.getEditController().isReadOnly())
			return false;
		ViewEntry<R> entry = getEntry(rowIndex);
		if (entry.isGroupHeader())
			return false;
		ColumnModel<R, Object> column = (ColumnModel<R, Object>) theColumns.get(columnIndex);
		try {
			return column.isEditable(entry.getItem(), column.getValue(entry.getItem()));
		} catch (RuntimeException e) {
			return false; // An unreadable cell is not editable
		}
	}

	@Override
	public Object getValueAt(int rowIndex, int columnIndex) {
		ViewEntry<R> entry = getEntry(rowIndex);
		if (entry.isGroupHeader())
			return columnIndex == 0 ? entry.toString() : null;
		try {
			return theColumns.get(columnIndex).getValue(entry.getItem());
		} catch (RuntimeException e) {
			return null; // Absent value
		}
	}

	@Override
	public void setValueAt(Object aValue, int rowIndex, int columnIndex) {
		// JTable may call this with stale indexes after the model changes
		if (rowIndex >= getRowCount() || columnIndex >= getColumnCount())
			return;
		String columnId = theColumns.get(columnIndex).getId();
		theGrid.scrollToIndex(rowIndex);
		if (!theGrid.beginEdit(rowIndex, columnId)) {
			theLastEditResult = null;
			return;
		}
		theGrid.setPendingValue(aValue);
		theLastEditResult = theGrid.commitEdit();
		if (!theLastEditResult.isCommitted()) {
			System.err.println("Warning: edit of " + columnId + " rejected: " + theLastEditResult);
			theGrid.cancelEdit();
		}
	}

	@Override
	public void addTableModelListener(TableModelListener l) {
		SwingGridUtils.onEQ(() -> theListeners.add(l));
	}

	@Override
	public void removeTableModelListener(TableModelListener l) {
		SwingGridUtils.onEQ(() -> theListeners.remove(l));
	}

	/** Stops listening to the grid */
	public void dispose() {
		theGridSub.unsubscribe();
	}

	private void columnsChanged() {
		theColumns = theGrid.getColumns().getVisible();
		fire(new TableModelEvent(this, TableModelEvent.HEADER_ROW));
	}

	void fire(TableModelEvent tableEvt) {
		for (TableModelListener listener : theListeners.toArray(new TableModelListener[theListeners.size()]))
			listener.tableChanged(tableEvt);
	}
}
