package org.obgrid.grid;

import java.text.Format;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.Function;

import org.obgrid.Observable;
import org.obgrid.SimpleObservable;
import org.obgrid.util.TypeTokens;

import com.google.common.reflect.TypeToken;

/**
 * <p>
 * Declares a column of a {@link DataGrid}: how to read (and optionally write) the column's value from an item, how the column is sized,
 * and what the user may do with it.
 * </p>
 * <p>
 * A column's identity, accessors and capabilities are fixed when it is {@link Builder#build() built}. Its header and width-affecting
 * fields may be changed by the host afterward, which fires a {@link #changes() change}. The resolved pixel width is owned by the
 * {@link ColumnLayoutEngine} and cannot be set by the host.
 * </p>
 *
 * @param <R> The type of the grid's items
 * @param <C> The type of the column's values
 */
public class ColumnModel<R, C> {
	/** Default minimum width of a column, in pixels */
	public static final int DEFAULT_MIN_WIDTH = 20;

	/**
	 * Builds a {@link ColumnModel}
	 *
	 * @param <R> The type of the grid's items
	 * @param <C> The type of the column's values
	 */
	public static class Builder<R, C> {
		private final String theId;
		private final TypeToken<C> theType;
		private final Function<? super R, ? extends C> theGetter;
		private String theHeader;
		private BiConsumer<? super R, ? super C> theSetter;
		private BiPredicate<? super R, ? super C> theEditability;
		private boolean isEditable;
		private CellValidator<? super R, ? super C> theValidator;
		private Comparator<? super C> theComparator;
		private Function<? super C, String> theFormatter;
		private boolean isSortable;
		private boolean isFilterable;
		private boolean isVisible;
		private SizingPolicy thePolicy;
		private int theMinWidth;
		private int theMaxWidth;
		private int theFixedWidth;
		private double theFillWeight;
		private AggregateType theAggregate;
		private Format theAggregateFormat;

		Builder(String id, TypeToken<C> type, Function<? super R, ? extends C> getter) {
			if (id == null || id.isEmpty())
				throw new IllegalArgumentException("A column must have an ID");
			theId = id;
			theType = Objects.requireNonNull(type, "type");
			theGetter = Objects.requireNonNull(getter, "A column must have a value getter");
			theHeader = id;
			isSortable = true;
			isFilterable = true;
			isVisible = true;
			thePolicy = SizingPolicy.AUTO;
			theMinWidth = DEFAULT_MIN_WIDTH;
			theMaxWidth = Integer.MAX_VALUE;
			theFixedWidth = -1;
			theFillWeight = 1;
			theAggregate = AggregateType.NONE;
		}

		/**
		 * @param header The header text for the column
		 * @return This builder
		 */
		public Builder<R, C> withHeader(String header) {
			theHeader = header == null ? "" : header;
			return this;
		}

		/**
		 * Makes the column editable, writing edited values with the given setter
		 *
		 * @param setter Writes a column value into an item
		 * @return This builder
		 */
		public Builder<R, C> mutateAttribute(BiConsumer<? super R, ? super C> setter) {
			theSetter = setter;
			isEditable = setter != null;
			return this;
		}

		/**
		 * @param editable Determines whether a particular cell of this column may be edited
		 * @return This builder
		 */
		public Builder<R, C> editableIf(BiPredicate<? super R, ? super C> editable) {
			theEditability = editable;
			return this;
		}

		/**
		 * Makes the column read-only, while retaining any setter (e.g. for undo)
		 *
		 * @return This builder
		 */
		public Builder<R, C> immutable() {
			isEditable = false;
			return this;
		}

		/**
		 * @param validator Validates edited values before they are written
		 * @return This builder
		 */
		public Builder<R, C> filterAccept(CellValidator<? super R, ? super C> validator) {
			theValidator = validator;
			return this;
		}

		/**
		 * @param comparator The ordering for this column's values, instead of their natural ordering
		 * @return This builder
		 */
		public Builder<R, C> withComparator(Comparator<? super C> comparator) {
			theComparator = comparator;
			return this;
		}

		/**
		 * @param format Formats this column's values for display, text filtering, and measurement
		 * @return This builder
		 */
		public Builder<R, C> formatText(Function<? super C, String> format) {
			theFormatter = format;
			return this;
		}

		/**
		 * @param sortable Whether the user may sort by this column
		 * @return This builder
		 */
		public Builder<R, C> sortable(boolean sortable) {
			isSortable = sortable;
			return this;
		}

		/**
		 * @param filterable Whether the user may filter by this column
		 * @return This builder
		 */
		public Builder<R, C> filterable(boolean filterable) {
			isFilterable = filterable;
			return this;
		}

		/**
		 * @param visible Whether the column is initially visible
		 * @return This builder
		 */
		public Builder<R, C> visible(boolean visible) {
			isVisible = visible;
			return this;
		}

		/** @return This builder, sizing its column by content */
		public Builder<R, C> auto() {
			thePolicy = SizingPolicy.AUTO;
			return this;
		}

		/**
		 * @param width The fixed width for the column
		 * @return This builder
		 */
		public Builder<R, C> fixed(int width) {
			if (width < 0)
				throw new IllegalArgumentException("Negative width: " + width);
			thePolicy = SizingPolicy.FIXED;
			theFixedWidth = width;
			return this;
		}

		/** @return This builder, sizing its column to its header */
		public Builder<R, C> fitHeader() {
			thePolicy = SizingPolicy.FIT_HEADER;
			return this;
		}

		/** @return This builder, sizing its column with a default-weighted share of the remaining width */
		public Builder<R, C> fill() {
			return fill(1);
		}

		/**
		 * @param weight The weight of the column's share of the remaining width
		 * @return This builder
		 */
		public Builder<R, C> fill(double weight) {
			if (!(weight > 0))
				throw new IllegalArgumentException("Fill weight must be positive: " + weight);
			thePolicy = SizingPolicy.FILL;
			theFillWeight = weight;
			return this;
		}

		/**
		 * @param minWidth The minimum width for the column
		 * @param maxWidth The maximum width for the column
		 * @return This builder
		 */
		public Builder<R, C> withWidths(int minWidth, int maxWidth) {
			checkWidths(minWidth, maxWidth);
			theMinWidth = minWidth;
			theMaxWidth = maxWidth;
			return this;
		}

		/**
		 * @param aggregate The aggregate to compute for the column
		 * @return This builder
		 */
		public Builder<R, C> withAggregate(AggregateType aggregate) {
			return withAggregate(aggregate, null);
		}

		/**
		 * @param aggregate The aggregate to compute for the column
		 * @param format The format for the aggregate value, may be null
		 * @return This builder
		 */
		public Builder<R, C> withAggregate(AggregateType aggregate, Format format) {
			theAggregate = aggregate == null ? AggregateType.NONE : aggregate;
			theAggregateFormat = format;
			return this;
		}

		/** @return The new column */
		public ColumnModel<R, C> build() {
			return new ColumnModel<>(this);
		}
	}

	/**
	 * @param <R> The type of the grid's items
	 * @param <C> The type of the column's values
	 * @param id The ID of the column
	 * @param type The type of the column's values
	 * @param getter Reads the column's value from an item
	 * @return A builder for the column
	 */
	public static <R, C> Builder<R, C> build(String id, Class<C> type, Function<? super R, ? extends C> getter) {
		return new Builder<>(id, TypeTokens.of(type), getter);
	}

	/**
	 * @param <R> The type of the grid's items
	 * @param <C> The type of the column's values
	 * @param id The ID of the column
	 * @param type The type of the column's values
	 * @param getter Reads the column's value from an item
	 * @return A builder for the column
	 */
	public static <R, C> Builder<R, C> build(String id, TypeToken<C> type, Function<? super R, ? extends C> getter) {
		return new Builder<>(id, type, getter);
	}

	private final String theId;
	private final TypeToken<C> theType;
	private final Function<? super R, ? extends C> theGetter;
	private final BiConsumer<? super R, ? super C> theSetter;
	private final BiPredicate<? super R, ? super C> theEditability;
	private final boolean isEditable;
	private final CellValidator<? super R, ? super C> theValidator;
	private final Comparator<? super C> theComparator;
	private final Function<? super C, String> theFormatter;
	private final boolean isSortable;
	private final boolean isFilterable;

	private String theHeader;
	private boolean isVisible;
	private SizingPolicy thePolicy;
	private int theMinWidth;
	private int theMaxWidth;
	private int theFixedWidth;
	private double theFillWeight;
	private AggregateType theAggregate;
	private Format theAggregateFormat;

	private int theActualWidth;
	private final SimpleObservable<ColumnModel<R, C>> theChanges;

	ColumnModel(Builder<R, C> builder) {
		theId = builder.theId;
		theType = builder.theType;
		theGetter = builder.theGetter;
		theSetter = builder.theSetter;
		theEditability = builder.theEditability;
		isEditable = builder.isEditable;
		theValidator = builder.theValidator;
		theComparator = builder.theComparator;
		theFormatter = builder.theFormatter;
		isSortable = builder.isSortable;
		isFilterable = builder.isFilterable;
		theHeader = builder.theHeader;
		isVisible = builder.isVisible;
		thePolicy = builder.thePolicy;
		theMinWidth = builder.theMinWidth;
		theMaxWidth = builder.theMaxWidth;
		theFixedWidth = builder.theFixedWidth;
		theFillWeight = builder.theFillWeight;
		theAggregate = builder.theAggregate;
		theAggregateFormat = builder.theAggregateFormat;
		theChanges = new SimpleObservable<>();
	}

	/** @return The unique ID of this column within its grid */
	public String getId() {
		return theId;
	}

	/** @return The type of this column's values */
	public TypeToken<C> getType() {
		return theType;
	}

	/** @return The header text of this column */
	public String getHeader() {
		return theHeader;
	}

	/** @return Whether the user may sort by this column */
	public boolean isSortable() {
		return isSortable;
	}

	/** @return Whether the user may filter by this column */
	public boolean isFilterable() {
		return isFilterable;
	}

	/** @return Whether this column's cells may be edited */
	public boolean isEditable() {
		return isEditable && theSetter != null;
	}

	/**
	 * @param item The item to test
	 * @param value The item's current value in this column
	 * @return Whether the given item's cell in this column may be edited
	 */
	public boolean isEditable(R item, C value) {
		if (!isEditable())
			return false;
		return theEditability == null || theEditability.test(item, value);
	}

	/** @return Whether this column can write values into items, regardless of whether the user may edit it */
	public boolean hasSetter() {
		return theSetter != null;
	}

	/** @return Whether this column is currently displayed */
	public boolean isVisible() {
		return isVisible;
	}

	/** @return This column's sizing policy */
	public SizingPolicy getSizingPolicy() {
		return thePolicy;
	}

	/** @return The minimum width of this column */
	public int getMinWidth() {
		return theMinWidth;
	}

	/** @return The maximum width of this column */
	public int getMaxWidth() {
		return theMaxWidth;
	}

	/** @return The declared width of this column for the {@link SizingPolicy#FIXED FIXED} policy, or -1 if none was declared */
	public int getFixedWidth() {
		return theFixedWidth;
	}

	/** @return The weight of this column's share of remaining width under the {@link SizingPolicy#FILL FILL} policy */
	public double getFillWeight() {
		return theFillWeight;
	}

	/** @return The aggregate computed for this column */
	public AggregateType getAggregateType() {
		return theAggregate;
	}

	/** @return The comparator for this column's values, or null to use natural ordering */
	public Comparator<? super C> getComparator() {
		return theComparator;
	}

	/** @return The width most recently resolved for this column by the layout engine */
	public int getActualWidth() {
		return theActualWidth;
	}

	/** @return An observable firing this column whenever its header or a width-affecting property changes */
	public Observable<ColumnModel<R, C>> changes() {
		return theChanges.readOnly();
	}

	/**
	 * @param item The item to get the value of
	 * @return This column's value for the item
	 * @throws RuntimeException Whatever the getter throws
	 */
	public C getValue(R item) {
		return theGetter.apply(item);
	}

	/**
	 * @param item The item to write the value into
	 * @param value The value to write
	 * @throws UnsupportedOperationException If this column has no setter
	 * @throws ClassCastException If the value is not of this column's type
	 */
	public void setValue(R item, Object value) {
		if (theSetter == null)
			throw new UnsupportedOperationException("Column " + theId + " is read-only");
		theSetter.accept(item, TypeTokens.cast(theType, value));
	}

	/**
	 * @param item The item that would receive the value
	 * @param value The value to test
	 * @return null if the value may be written to the item in this column, or a message describing why it may not
	 */
	public String validate(R item, Object value) {
		if (value != null && !TypeTokens.isInstance(theType, value))
			return "Value " + value + " is not a valid " + TypeTokens.getSimpleName(theType);
		if (theValidator == null)
			return null;
		return theValidator.validate(item, (C) value);
	}

	/**
	 * @param value The value to format
	 * @return The display text for the value
	 */
	public String format(Object value) {
		if (value == null)
			return "";
		else if (theFormatter != null && TypeTokens.isInstance(theType, value))
			return theFormatter.apply((C) value);
		else
			return String.valueOf(value);
	}

	/**
	 * @param width The width to clamp
	 * @return The given width, clamped to this column's minimum and maximum
	 */
	public int clamp(int width) {
		return Math.max(theMinWidth, Math.min(theMaxWidth, width));
	}

	/**
	 * Computes this column's aggregate. Items whose getter throws are skipped.
	 *
	 * @param items The items to aggregate
	 * @return The aggregate value, or null if this column has no aggregate
	 */
	public Object aggregate(Iterable<? extends R> items) {
		if (theAggregate == AggregateType.NONE)
			return null;
		List<Object> values = new ArrayList<>();
		for (R item : items) {
			try {
				values.add(theGetter.apply(item));
			} catch (RuntimeException e) {
				if (theAggregate == AggregateType.COUNT)
					values.add(null);
			}
		}
		return theAggregate.aggregate(values);
	}

	/**
	 * @param value The aggregate value to format
	 * @return The display text for the aggregate
	 */
	public String formatAggregate(Object value) {
		if (value == null)
			return "";
		else if (theAggregateFormat != null)
			return theAggregateFormat.format(value);
		else
			return value.toString();
	}

	/**
	 * @param header The header text for this column
	 * @return This column
	 */
	public ColumnModel<R, C> setHeader(String header) {
		String h = header == null ? "" : header;
		if (!h.equals(theHeader)) {
			theHeader = h;
			fireChanged();
		}
		return this;
	}

	/**
	 * @param visible Whether this column should be displayed
	 * @return This column
	 */
	public ColumnModel<R, C> setVisible(boolean visible) {
		if (visible != isVisible) {
			isVisible = visible;
			fireChanged();
		}
		return this;
	}

	/**
	 * @param policy The sizing policy for this column
	 * @return This column
	 */
	public ColumnModel<R, C> setSizingPolicy(SizingPolicy policy) {
		if (policy != thePolicy) {
			thePolicy = Objects.requireNonNull(policy, "policy");
			fireChanged();
		}
		return this;
	}

	/**
	 * @param width The declared width for the {@link SizingPolicy#FIXED FIXED} policy
	 * @return This column
	 */
	public ColumnModel<R, C> setFixedWidth(int width) {
		if (width < 0)
			throw new IllegalArgumentException("Negative width: " + width);
		if (width != theFixedWidth) {
			theFixedWidth = width;
			fireChanged();
		}
		return this;
	}

	/**
	 * @param minWidth The minimum width for this column
	 * @param maxWidth The maximum width for this column
	 * @return This column
	 */
	public ColumnModel<R, C> setWidths(int minWidth, int maxWidth) {
		checkWidths(minWidth, maxWidth);
		if (minWidth != theMinWidth || maxWidth != theMaxWidth) {
			theMinWidth = minWidth;
			theMaxWidth = maxWidth;
			fireChanged();
		}
		return this;
	}

	/**
	 * @param weight The weight of this column's share of remaining width
	 * @return This column
	 */
	public ColumnModel<R, C> setFillWeight(double weight) {
		if (!(weight > 0))
			throw new IllegalArgumentException("Fill weight must be positive: " + weight);
		if (weight != theFillWeight) {
			theFillWeight = weight;
			fireChanged();
		}
		return this;
	}

	/**
	 * @param aggregate The aggregate to compute for this column
	 * @param format The format for the aggregate value, may be null
	 * @return This column
	 */
	public ColumnModel<R, C> setAggregate(AggregateType aggregate, Format format) {
		theAggregate = aggregate == null ? AggregateType.NONE : aggregate;
		theAggregateFormat = format;
		return this;
	}

	void setActualWidth(int width) {
		theActualWidth = width;
	}

	private void fireChanged() {
		theChanges.onNext(this);
	}

	static void checkWidths(int minWidth, int maxWidth) {
		if (minWidth < 0)
			throw new IllegalArgumentException("Negative minimum width: " + minWidth);
		else if (maxWidth < minWidth)
			throw new IllegalArgumentException("Maximum width " + maxWidth + " is less than minimum " + minWidth);
	}

	@Override
	public String toString() {
		return theId;
	}
}
