package org.obgrid.grid;

import java.util.Objects;

/** Immutable configuration for a {@link DataGrid} */
public final class GridOptions {
	/** Default height of a row, in pixels */
	public static final int DEFAULT_ROW_HEIGHT = 44;
	/** Default number of rows bound beyond each end of the viewport */
	public static final int DEFAULT_BUFFER_SIZE = 5;
	/** Default quiet period before filter text is applied, in milliseconds */
	public static final long DEFAULT_FILTER_DEBOUNCE = 100;
	/** Default total horizontal padding of a header or cell, in pixels */
	public static final int DEFAULT_CELL_PADDING = 16;
	/** Default number of edits remembered for undo */
	public static final int DEFAULT_UNDO_LIMIT = 100;

	/** The default options */
	public static final GridOptions DEFAULT = build().build();

	/** Builds {@link GridOptions} */
	public static class Builder {
		private int theRowHeight = DEFAULT_ROW_HEIGHT;
		private int theBufferSize = DEFAULT_BUFFER_SIZE;
		private int thePageSize;
		private boolean isVirtualized = true;
		private long theFilterDebounce = DEFAULT_FILTER_DEBOUNCE;
		private SelectionMode theSelectionMode = SelectionMode.SINGLE;
		private NullOrdering theNullOrdering = NullOrdering.FIRST;
		private int theCellPadding = DEFAULT_CELL_PADDING;
		private int theUndoLimit = DEFAULT_UNDO_LIMIT;
		private boolean isReadOnly;

		Builder() {}

		Builder(GridOptions options) {
			theRowHeight = options.theRowHeight;
			theBufferSize = options.theBufferSize;
			thePageSize = options.thePageSize;
			isVirtualized = options.isVirtualized;
			theFilterDebounce = options.theFilterDebounce;
			theSelectionMode = options.theSelectionMode;
			theNullOrdering = options.theNullOrdering;
			theCellPadding = options.theCellPadding;
			theUndoLimit = options.theUndoLimit;
			isReadOnly = options.isReadOnly;
		}

		/**
		 * @param rowHeight The height of each row, in pixels
		 * @return This builder
		 */
		public Builder withRowHeight(int rowHeight) {
			if (rowHeight <= 0)
				throw new IllegalArgumentException("Row height must be positive: " + rowHeight);
			theRowHeight = rowHeight;
			return this;
		}

		/**
		 * @param bufferSize The number of rows to bind beyond each end of the viewport
		 * @return This builder
		 */
		public Builder withBufferSize(int bufferSize) {
			if (bufferSize < 0)
				throw new IllegalArgumentException("Negative buffer size: " + bufferSize);
			theBufferSize = bufferSize;
			return this;
		}

		/**
		 * @param pageSize The number of rows per page, or 0 to disable paging
		 * @return This builder
		 */
		public Builder withPageSize(int pageSize) {
			if (pageSize < 0)
				throw new IllegalArgumentException("Negative page size: " + pageSize);
			thePageSize = pageSize;
			return this;
		}

		/**
		 * @param virtualized Whether to bind only the rows near the viewport, as opposed to all rows
		 * @return This builder
		 */
		public Builder withVirtualization(boolean virtualized) {
			isVirtualized = virtualized;
			return this;
		}

		/**
		 * @param millis The quiet period before filter text is applied
		 * @return This builder
		 */
		public Builder withFilterDebounce(long millis) {
			if (millis < 0)
				throw new IllegalArgumentException("Negative debounce: " + millis);
			theFilterDebounce = millis;
			return this;
		}

		/**
		 * @param mode The selection mode
		 * @return This builder
		 */
		public Builder withSelectionMode(SelectionMode mode) {
			theSelectionMode = Objects.requireNonNull(mode, "mode");
			return this;
		}

		/**
		 * @param ordering Where null values sort
		 * @return This builder
		 */
		public Builder withNullOrdering(NullOrdering ordering) {
			theNullOrdering = Objects.requireNonNull(ordering, "ordering");
			return this;
		}

		/**
		 * @param padding The total horizontal padding of a header or cell, in pixels
		 * @return This builder
		 */
		public Builder withCellPadding(int padding) {
			if (padding < 0)
				throw new IllegalArgumentException("Negative padding: " + padding);
			theCellPadding = padding;
			return this;
		}

		/**
		 * @param limit The number of edits to remember for undo, or 0 to disable undo
		 * @return This builder
		 */
		public Builder withUndoLimit(int limit) {
			if (limit < 0)
				throw new IllegalArgumentException("Negative undo limit: " + limit);
			theUndoLimit = limit;
			return this;
		}

		/**
		 * @param readOnly Whether to disable all editing
		 * @return This builder
		 */
		public Builder readOnly(boolean readOnly) {
			isReadOnly = readOnly;
			return this;
		}

		/** @return The options */
		public GridOptions build() {
			return new GridOptions(this);
		}
	}

	/** @return A builder for grid options, starting with the defaults */
	public static Builder build() {
		return new Builder();
	}

	private final int theRowHeight;
	private final int theBufferSize;
	private final int thePageSize;
	private final boolean isVirtualized;
	private final long theFilterDebounce;
	private final SelectionMode theSelectionMode;
	private final NullOrdering theNullOrdering;
	private final int theCellPadding;
	private final int theUndoLimit;
	private final boolean isReadOnly;

	private GridOptions(Builder builder) {
		theRowHeight = builder.theRowHeight;
		theBufferSize = builder.theBufferSize;
		thePageSize = builder.thePageSize;
		isVirtualized = builder.isVirtualized;
		theFilterDebounce = builder.theFilterDebounce;
		theSelectionMode = builder.theSelectionMode;
		theNullOrdering = builder.theNullOrdering;
		theCellPadding = builder.theCellPadding;
		theUndoLimit = builder.theUndoLimit;
		isReadOnly = builder.isReadOnly;
	}

	/** @return A builder starting with these options */
	public Builder copy() {
		return new Builder(this);
	}

	/** @return The height of each row, in pixels */
	public int getRowHeight() {
		return theRowHeight;
	}

	/** @return The number of rows bound beyond each end of the viewport */
	public int getBufferSize() {
		return theBufferSize;
	}

	/** @return The initial number of rows per page, or 0 if paging is disabled */
	public int getPageSize() {
		return thePageSize;
	}

	/** @return Whether only the rows near the viewport are bound */
	public boolean isVirtualized() {
		return isVirtualized;
	}

	/** @return The quiet period before filter text is applied, in milliseconds */
	public long getFilterDebounce() {
		return theFilterDebounce;
	}

	/** @return The selection mode */
	public SelectionMode getSelectionMode() {
		return theSelectionMode;
	}

	/** @return Where null values sort */
	public NullOrdering getNullOrdering() {
		return theNullOrdering;
	}

	/** @return The total horizontal padding of a header or cell, in pixels */
	public int getCellPadding() {
		return theCellPadding;
	}

	/** @return The number of edits remembered for undo */
	public int getUndoLimit() {
		return theUndoLimit;
	}

	/** @return Whether all editing is disabled */
	public boolean isReadOnly() {
		return isReadOnly;
	}

	@Override
	public String toString() {
		return "rowHeight=" + theRowHeight + ", buffer=" + theBufferSize + ", pageSize=" + thePageSize + ", virtualized=" + isVirtualized
			+ ", debounce=" + theFilterDebounce + "ms, selection=" + theSelectionMode + ", nulls=" + theNullOrdering + ", padding="
			+ theCellPadding + ", undo=" + theUndoLimit + (isReadOnly ? ", read-only" : "");
	}
}
