package org.obgrid.grid;

/**
 * The range of a sequence a {@link RowVirtualizer} keeps bound to containers: the visible rows plus a buffer on each side
 */
public final class VirtualWindow {
	private final int theStartIndex;
	private final int theVisibleCount;
	private final int theBuffer;
	private final int theSequenceSize;

	/**
	 * @param startIndex The index of the first (possibly partially) visible row
	 * @param visibleCount The number of rows that may be visible at once
	 * @param buffer The number of rows to keep bound beyond each end of the visible rows
	 * @param sequenceSize The size of the sequence being windowed
	 */
	public VirtualWindow(int startIndex, int visibleCount, int buffer, int sequenceSize) {
		if (startIndex < 0)
			throw new IllegalArgumentException("Negative start index: " + startIndex);
		theStartIndex = startIndex;
		theVisibleCount = visibleCount;
		theBuffer = buffer;
		theSequenceSize = sequenceSize;
	}

	/**
	 * @param scrollOffset The scroll offset of the viewport, in pixels
	 * @param viewportHeight The height of the viewport, in pixels
	 * @param rowHeight The height of each row, in pixels
	 * @param buffer The number of rows to keep bound beyond each end of the visible rows
	 * @param sequenceSize The size of the sequence being windowed
	 * @return The window for the viewport
	 */
	public static VirtualWindow compute(long scrollOffset, int viewportHeight, int rowHeight, int buffer, int sequenceSize) {
		int first = (int) Math.min(scrollOffset / rowHeight, Integer.MAX_VALUE);
		int visibleCount = (viewportHeight + rowHeight - 1) / rowHeight + 1;
		return new VirtualWindow(first, visibleCount, buffer, sequenceSize);
	}

	/** @return The index of the first (possibly partially) visible row */
	public int getStartIndex() {
		return theStartIndex;
	}

	/** @return The number of rows that may be visible at once */
	public int getVisibleCount() {
		return theVisibleCount;
	}

	/** @return The number of rows kept bound beyond each end of the visible rows */
	public int getBuffer() {
		return theBuffer;
	}

	/** @return The size of the windowed sequence */
	public int getSequenceSize() {
		return theSequenceSize;
	}

	/** @return The first index that should be bound (inclusive) */
	public int getDesiredStart() {
		return Math.min(Math.max(0, theStartIndex - theBuffer), theSequenceSize);
	}

	/** @return The last index that should be bound (exclusive) */
	public int getDesiredEnd() {
		return Math.max(getDesiredStart(), (int) Math.min(theSequenceSize, (long) theStartIndex + theVisibleCount + theBuffer));
	}

	/** @return The number of containers needed to bind any window of this size */
	public int getCapacity() {
		return theVisibleCount + theBuffer * 2;
	}

	/**
	 * @param index The index to test
	 * @return Whether the given index should be bound
	 */
	public boolean contains(int index) {
		return index >= getDesiredStart() && index < getDesiredEnd();
	}

	@Override
	public String toString() {
		return "[" + getDesiredStart() + ", " + getDesiredEnd() + ") of " + theSequenceSize;
	}
}
