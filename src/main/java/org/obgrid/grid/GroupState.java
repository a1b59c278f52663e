package org.obgrid.grid;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/** Immutable grouping configuration: the column to group by, whether group headers are shown, and which groups are collapsed */
public final class GroupState {
	/** The ungrouped state */
	public static final GroupState NONE = new GroupState(null, false, Collections.emptySet());

	private final String theColumnId;
	private final boolean isShowingHeaders;
	private final Set<Object> theCollapsedKeys;

	private GroupState(String columnId, boolean showHeaders, Set<Object> collapsedKeys) {
		theColumnId = columnId;
		isShowingHeaders = showHeaders;
		theCollapsedKeys = collapsedKeys;
	}

	/**
	 * @param columnId The ID of the column to group by
	 * @return A group state grouping by the given column, with headers shown and no groups collapsed
	 */
	public static GroupState by(String columnId) {
		return new GroupState(Objects.requireNonNull(columnId, "columnId"), true, Collections.emptySet());
	}

	/** @return The ID of the column to group by, or null if not grouped */
	public String getColumnId() {
		return theColumnId;
	}

	/** @return Whether this state groups anything */
	public boolean isActive() {
		return theColumnId != null;
	}

	/** @return Whether header entries are interleaved before each group's items */
	public boolean isShowingHeaders() {
		return isShowingHeaders;
	}

	/**
	 * @param showHeaders Whether to interleave header entries before each group's items
	 * @return A group state like this one, with the given header setting
	 */
	public GroupState withHeaders(boolean showHeaders) {
		if (!isActive() || showHeaders == isShowingHeaders)
			return this;
		return new GroupState(theColumnId, showHeaders, theCollapsedKeys);
	}

	/**
	 * @param key The group key to test
	 * @return Whether the group with the given key is collapsed
	 */
	public boolean isCollapsed(Object key) {
		return theCollapsedKeys.contains(key);
	}

	/** @return The keys of the collapsed groups */
	public Set<Object> getCollapsedKeys() {
		return theCollapsedKeys;
	}

	/**
	 * A collapsed group shows its header but omits its items
	 *
	 * @param key The key of the group to collapse, may be null
	 * @return A group state like this one, with the given group collapsed
	 */
	public GroupState collapse(Object key) {
		if (!isActive())
			throw new IllegalStateException("Not grouped");
		if (theCollapsedKeys.contains(key))
			return this;
		Set<Object> keys = new HashSet<>(theCollapsedKeys);
		keys.add(key);
		return new GroupState(theColumnId, isShowingHeaders, Collections.unmodifiableSet(keys));
	}

	/**
	 * @param key The key of the group to expand, may be null
	 * @return A group state like this one, with the given group expanded
	 */
	public GroupState expand(Object key) {
		if (!theCollapsedKeys.contains(key))
			return this;
		Set<Object> keys = new HashSet<>(theCollapsedKeys);
		keys.remove(key);
		return new GroupState(theColumnId, isShowingHeaders, Collections.unmodifiableSet(keys));
	}

	@Override
	public int hashCode() {
		return Objects.hash(theColumnId, isShowingHeaders, theCollapsedKeys);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof GroupState))
			return false;
		GroupState other = (GroupState) obj;
		return Objects.equals(theColumnId, other.theColumnId) && isShowingHeaders == other.isShowingHeaders
			&& theCollapsedKeys.equals(other.theCollapsedKeys);
	}

	@Override
	public String toString() {
		if (!isActive())
			return "ungrouped";
		return "groupBy(" + theColumnId + ")" + (theCollapsedKeys.isEmpty() ? "" : "-" + theCollapsedKeys);
	}
}
