package org.obgrid.grid;

/**
 * An entry in a {@link ViewSequence}: either an {@link Item item} from the grid's source or a synthetic {@link GroupHeader group header}
 *
 * @param <R> The type of the grid's items
 */
public abstract class ViewEntry<R> {
	ViewEntry() {}

	/** @return Whether this entry is a group header rather than an item */
	public abstract boolean isGroupHeader();

	/** @return The item of this entry, or null for a group header */
	public abstract R getItem();

	/**
	 * An entry representing an item of the grid's source
	 *
	 * @param <R> The type of the grid's items
	 */
	public static final class Item<R> extends ViewEntry<R> {
		private final R theItem;
		private final int theSourceIndex;
		private final Object theGroupKey;

		Item(R item, int sourceIndex, Object groupKey) {
			theItem = item;
			theSourceIndex = sourceIndex;
			theGroupKey = groupKey;
		}

		@Override
		public boolean isGroupHeader() {
			return false;
		}

		@Override
		public R getItem() {
			return theItem;
		}

		/** @return The index of the item in the grid's source at the time of the rebuild */
		public int getSourceIndex() {
			return theSourceIndex;
		}

		/** @return The key of the group this item belongs to, or null if the sequence is not grouped */
		public Object getGroupKey() {
			return theGroupKey;
		}

		@Override
		public String toString() {
			return String.valueOf(theItem);
		}
	}

	/**
	 * A synthetic entry preceding the items of a group
	 *
	 * @param <R> The type of the grid's items
	 */
	public static final class GroupHeader<R> extends ViewEntry<R> {
		private final String theColumnId;
		private final Object theKey;
		private final String theText;
		private final int theItemCount;
		private final boolean isCollapsed;

		GroupHeader(String columnId, Object key, String text, int itemCount, boolean collapsed) {
			theColumnId = columnId;
			theKey = key;
			theText = text;
			theItemCount = itemCount;
			isCollapsed = collapsed;
		}

		@Override
		public boolean isGroupHeader() {
			return true;
		}

		@Override
		public R getItem() {
			return null;
		}

		/** @return The ID of the column the sequence is grouped by */
		public String getColumnId() {
			return theColumnId;
		}

		/** @return The group key, may be null */
		public Object getKey() {
			return theKey;
		}

		/** @return The display text of the group key */
		public String getText() {
			return theText;
		}

		/** @return The number of items in the group, whether or not it is collapsed */
		public int getItemCount() {
			return theItemCount;
		}

		/** @return Whether the group's items are omitted from the sequence */
		public boolean isCollapsed() {
			return isCollapsed;
		}

		@Override
		public String toString() {
			return (isCollapsed ? "+ " : "- ") + theText + " (" + theItemCount + ")";
		}
	}
}
