package org.obgrid.grid;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Records committed cell edits so they can be undone and redone. Edits made between {@link #beginBatch(String)} and {@link #endBatch()}
 * are undone and redone together.
 *
 * @param <R> The type of the grid's items
 */
public class EditHistory<R> {
	/** An undoable operation */
	public static abstract class Operation {
		private final String theDescription;

		Operation(String description) {
			theDescription = description;
		}

		/** @return A description of the operation for display, e.g. "Edit Email" */
		public String getDescription() {
			return theDescription;
		}

		abstract void undo();

		abstract void redo();

		/** @return The items affected by the operation */
		public abstract List<Object> getItems();

		@Override
		public String toString() {
			return theDescription;
		}
	}

	/**
	 * A single cell edit
	 *
	 * @param <R> The type of the grid's items
	 */
	public static class CellEdit<R> extends Operation {
		private final R theItem;
		private final ColumnModel<R, ?> theColumn;
		private final Object theOldValue;
		private final Object theNewValue;

		CellEdit(R item, ColumnModel<R, ?> column, Object oldValue, Object newValue) {
			super("Edit " + column.getHeader());
			theItem = item;
			theColumn = column;
			theOldValue = oldValue;
			theNewValue = newValue;
		}

		/** @return The edited item */
		public R getItem() {
			return theItem;
		}

		/** @return The edited column */
		public ColumnModel<R, ?> getColumn() {
			return theColumn;
		}

		/** @return The value before the edit */
		public Object getOldValue() {
			return theOldValue;
		}

		/** @return The value after the edit */
		public Object getNewValue() {
			return theNewValue;
		}

		@Override
		void undo() {
			theColumn.setValue(theItem, theOldValue);
		}

		@Override
		void redo() {
			theColumn.setValue(theItem, theNewValue);
		}

		@Override
		public List<Object> getItems() {
			return Collections.singletonList(theItem);
		}
	}

	/** Several operations undone and redone together */
	public static class Batch extends Operation {
		private final List<Operation> theOperations;

		Batch(String description, List<Operation> operations) {
			super(description);
			theOperations = Collections.unmodifiableList(operations);
		}

		/** @return The operations in the batch, in the order they were performed */
		public List<Operation> getOperations() {
			return theOperations;
		}

		@Override
		void undo() {
			for (int i = theOperations.size() - 1; i >= 0; i--)
				theOperations.get(i).undo();
		}

		@Override
		void redo() {
			for (Operation op : theOperations)
				op.redo();
		}

		@Override
		public List<Object> getItems() {
			List<Object> items = new ArrayList<>();
			for (Operation op : theOperations) {
				for (Object item : op.getItems()) {
					if (!items.contains(item))
						items.add(item);
				}
			}
			return items;
		}
	}

	private final int theLimit;
	private final Deque<Operation> theUndoStack;
	private final Deque<Operation> theRedoStack;
	private String theBatchDescription;
	private List<Operation> theBatch;

	/**
	 * @param limit The maximum number of operations to remember, or 0 to remember nothing
	 */
	public EditHistory(int limit) {
		if (limit < 0)
			throw new IllegalArgumentException("Negative undo limit: " + limit);
		theLimit = limit;
		theUndoStack = new ArrayDeque<>();
		theRedoStack = new ArrayDeque<>();
	}

	/** @return The maximum number of operations remembered */
	public int getLimit() {
		return theLimit;
	}

	/**
	 * Records a committed edit
	 *
	 * @param item The edited item
	 * @param column The edited column
	 * @param oldValue The value before the edit
	 * @param newValue The value after the edit
	 */
	public void record(R item, ColumnModel<R, ?> column, Object oldValue, Object newValue) {
		CellEdit<R> edit = new CellEdit<>(item, column, oldValue, newValue);
		if (theBatch != null)
			theBatch.add(edit);
		else
			push(edit);
	}

	/** @return Whether there is an operation to undo */
	public boolean canUndo() {
		return !theUndoStack.isEmpty();
	}

	/** @return Whether there is an operation to redo */
	public boolean canRedo() {
		return !theRedoStack.isEmpty();
	}

	/** @return The description of the operation {@link #undo()} would undo, or null */
	public String getUndoDescription() {
		return theUndoStack.isEmpty() ? null : theUndoStack.peek().getDescription();
	}

	/** @return The description of the operation {@link #redo()} would redo, or null */
	public String getRedoDescription() {
		return theRedoStack.isEmpty() ? null : theRedoStack.peek().getDescription();
	}

	/**
	 * Undoes the most recent operation. If a setter throws, the operation stays on the undo stack.
	 *
	 * @return The undone operation, or null if there was nothing to undo
	 */
	public Operation undo() {
		checkNoBatch();
		Operation op = theUndoStack.peek();
		if (op == null)
			return null;
		op.undo();
		theUndoStack.pop();
		theRedoStack.push(op);
		return op;
	}

	/**
	 * Redoes the most recently undone operation. If a setter throws, the operation stays on the redo stack.
	 *
	 * @return The redone operation, or null if there was nothing to redo
	 */
	public Operation redo() {
		checkNoBatch();
		Operation op = theRedoStack.peek();
		if (op == null)
			return null;
		op.redo();
		theRedoStack.pop();
		theUndoStack.push(op);
		return op;
	}

	/**
	 * Starts grouping recorded edits into a single operation
	 *
	 * @param description The description for the batch
	 */
	public void beginBatch(String description) {
		if (theBatch != null)
			throw new IllegalStateException("A batch is already open: " + theBatchDescription);
		theBatchDescription = description;
		theBatch = new ArrayList<>();
	}

	/** @return Whether a batch is open */
	public boolean isBatching() {
		return theBatch != null;
	}

	/**
	 * Closes the open batch, recording its edits as one operation if there were any
	 *
	 * @return The recorded batch, or null if it was empty
	 */
	public Batch endBatch() {
		if (theBatch == null)
			throw new IllegalStateException("No batch is open");
		List<Operation> ops = theBatch;
		String description = theBatchDescription;
		theBatch = null;
		theBatchDescription = null;
		if (ops.isEmpty())
			return null;
		Batch batch = new Batch(description, ops);
		push(batch);
		return batch;
	}

	/**
	 * Closes the open batch, undoing its edits without recording them
	 *
	 * @return The discarded batch, or null if it was empty
	 */
	public Batch cancelBatch() {
		if (theBatch == null)
			throw new IllegalStateException("No batch is open");
		List<Operation> ops = theBatch;
		String description = theBatchDescription;
		theBatch = null;
		theBatchDescription = null;
		if (ops.isEmpty())
			return null;
		Batch batch = new Batch(description, ops);
		batch.undo();
		return batch;
	}

	/** Forgets all recorded operations */
	public void clear() {
		theUndoStack.clear();
		theRedoStack.clear();
	}

	private void push(Operation op) {
		if (theLimit == 0)
			return;
		theRedoStack.clear();
		theUndoStack.push(op);
		while (theUndoStack.size() > theLimit)
			theUndoStack.removeLast();
	}

	private void checkNoBatch() {
		if (theBatch != null)
			throw new IllegalStateException("Cannot undo or redo while a batch is open: " + theBatchDescription);
	}
}
