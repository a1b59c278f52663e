package org.obgrid.grid;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * <p>
 * A filter on the values of a single column. A filter is one of:
 * <ul>
 * <li>a set of accepted values, in which null is a value like any other</li>
 * <li>a predicate on the column value</li>
 * <li>a case-insensitive substring match against the column's formatted text</li>
 * </ul>
 * </p>
 * <p>
 * An accepted-value filter with no values and a text filter with no text accept everything, the same as having no filter.
 * </p>
 */
public abstract class ColumnFilter {
	/**
	 * @param values The values to accept, may contain null
	 * @return A filter accepting only the given values
	 */
	public static ColumnFilter values(Collection<?> values) {
		return new ValueFilter(new HashSet<>(values));
	}

	/**
	 * @param values The values to accept, may contain null
	 * @return A filter accepting only the given values
	 */
	public static ColumnFilter values(Object... values) {
		Set<Object> set = new HashSet<>();
		Collections.addAll(set, values);
		return new ValueFilter(set);
	}

	/**
	 * @param <C> The type of the column values
	 * @param type The type of the column values, for the predicate's sake
	 * @param test The test for column values
	 * @return A filter accepting only values passing the test
	 */
	public static <C> ColumnFilter predicate(Class<C> type, Predicate<? super C> test) {
		return new PredicateFilter(value -> test.test((C) value));
	}

	/**
	 * @param text The text to search for in the formatted column value
	 * @return A filter accepting only values whose formatted text contains the given text, ignoring case
	 */
	public static ColumnFilter text(String text) {
		return new TextFilter(text == null ? "" : text);
	}

	ColumnFilter() {}

	/** @return Whether this filter excludes anything */
	public abstract boolean isActive();

	/**
	 * @param value The column value to test
	 * @param text The formatted text of the value
	 * @return Whether this filter accepts the value
	 */
	public abstract boolean accepts(Object value, String text);

	/** @return The accepted values of this filter, or null if this is not an accepted-value filter */
	public Set<Object> getAcceptedValues() {
		return null;
	}

	/** @return The search text of this filter, or null if this is not a text filter */
	public String getText() {
		return null;
	}

	static class ValueFilter extends ColumnFilter {
		private final Set<Object> theValues;

		ValueFilter(Set<Object> values) {
			theValues = Collections.unmodifiableSet(values);
		}

		@Override
		public boolean isActive() {
			return !theValues.isEmpty();
		}

		@Override
		public boolean accepts(Object value, String text) {
			return theValues.isEmpty() || theValues.contains(value);
		}

		@Override
		public Set<Object> getAcceptedValues() {
			return theValues;
		}

		@Override
		public int hashCode() {
			return theValues.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ValueFilter && theValues.equals(((ValueFilter) obj).theValues);
		}

		@Override
		public String toString() {
			return "in" + theValues;
		}
	}

	static class PredicateFilter extends ColumnFilter {
		private final Predicate<Object> theTest;

		PredicateFilter(Predicate<Object> test) {
			theTest = Objects.requireNonNull(test, "test");
		}

		@Override
		public boolean isActive() {
			return true;
		}

		@Override
		public boolean accepts(Object value, String text) {
			return theTest.test(value);
		}

		@Override
		public String toString() {
			return "matches(" + theTest + ")";
		}
	}

	static class TextFilter extends ColumnFilter {
		private final String theText;
		private final String theLowerText;

		TextFilter(String text) {
			theText = text;
			theLowerText = text.trim().toLowerCase(Locale.ROOT);
		}

		@Override
		public boolean isActive() {
			return !theLowerText.isEmpty();
		}

		@Override
		public boolean accepts(Object value, String text) {
			if (theLowerText.isEmpty())
				return true;
			return text != null && text.toLowerCase(Locale.ROOT).contains(theLowerText);
		}

		@Override
		public String getText() {
			return theText;
		}

		@Override
		public int hashCode() {
			return theLowerText.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof TextFilter && theLowerText.equals(((TextFilter) obj).theLowerText);
		}

		@Override
		public String toString() {
			return "contains(" + theText + ")";
		}
	}
}
