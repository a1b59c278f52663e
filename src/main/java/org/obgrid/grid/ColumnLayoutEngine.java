package org.obgrid.grid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.obgrid.Observable;
import org.obgrid.SimpleObservable;

/**
 * <p>
 * Resolves the pixel width of each column of a grid for a viewport width. Columns are resolved by policy in this order:
 * <ol>
 * <li>{@link SizingPolicy#FIXED FIXED}: the declared width</li>
 * <li>{@link SizingPolicy#FIT_HEADER FIT_HEADER}: the width of the header text in the theme's header font, plus padding</li>
 * <li>{@link SizingPolicy#AUTO AUTO}: the header width until {@link #measureAutoColumns(List, Collection, int) content is measured},
 * then the wider of the header and the widest measured cell</li>
 * <li>{@link SizingPolicy#FILL FILL}: a share of the remaining width in proportion to the column's weight</li>
 * </ol>
 * Every width is clamped to its column's minimum and maximum. Hidden columns have zero width.
 * </p>
 * <p>
 * Fill shares are whole pixels, with the rounding remainder handed out so that all widths add up to the viewport exactly (unless a
 * minimum or maximum interferes). If there is no width remaining for fill columns, they get their minimum widths and the result is
 * {@link ColumnWidths#isOverflowing() overflowing}.
 * </p>
 * <p>
 * This engine is the only writer of {@link ColumnModel#getActualWidth() resolved widths}.
 * </p>
 *
 * @param <R> The type of the grid's items
 */
public class ColumnLayoutEngine<R> {
	private final TextMeasurer theMeasurer;
	private final ThemeProvider theTheme;
	private final int theCellPadding;
	private final Map<String, Integer> theContentWidths;
	private ColumnWidths theWidths;
	private final SimpleObservable<ColumnWidths> theChanges;

	/**
	 * @param measurer Measures text
	 * @param theme Supplies fonts
	 * @param cellPadding The total horizontal padding around text in a header or cell
	 */
	public ColumnLayoutEngine(TextMeasurer measurer, ThemeProvider theme, int cellPadding) {
		theMeasurer = Objects.requireNonNull(measurer, "measurer");
		theTheme = Objects.requireNonNull(theme, "theme");
		if (cellPadding < 0)
			throw new IllegalArgumentException("Negative padding: " + cellPadding);
		theCellPadding = cellPadding;
		theContentWidths = new HashMap<>();
		theWidths = ColumnWidths.EMPTY;
		theChanges = new SimpleObservable<>();
	}

	/** @return The most recently resolved widths */
	public ColumnWidths getWidths() {
		return theWidths;
	}

	/** @return An observable firing the new widths whenever a resolution changes them */
	public Observable<ColumnWidths> changes() {
		return theChanges.readOnly();
	}

	/**
	 * @param columns The grid's columns, in display order
	 * @param viewportWidth The width available to the columns
	 * @return The resolved widths
	 */
	public ColumnWidths resolve(List<? extends ColumnModel<R, ?>> columns, int viewportWidth) {
		if (viewportWidth < 0)
			throw new IllegalArgumentException("Negative viewport width: " + viewportWidth);
		Map<String, Integer> widths = new LinkedHashMap<>();
		List<ColumnModel<R, ?>> fills = new ArrayList<>();
		int used = 0;
		for (ColumnModel<R, ?> column : columns) {
			int width;
			if (!column.isVisible())
				width = 0;
			else {
				switch (column.getSizingPolicy()) {
				case FIXED:
					width = column.clamp(column.getFixedWidth() < 0 ? column.getMinWidth() : column.getFixedWidth());
					break;
				case FIT_HEADER:
					width = column.clamp(headerWidth(column));
					break;
				case AUTO:
					Integer content = theContentWidths.get(column.getId());
					width = column.clamp(Math.max(headerWidth(column), content == null ? 0 : content));
					break;
				case FILL:
					fills.add(column);
					width = 0;
					break;
				default:
					throw new IllegalStateException("Unrecognized sizing policy: " + column.getSizingPolicy());
				}
			}
			widths.put(column.getId(), width);
			used += width;
		}
		if (!fills.isEmpty())
			distributeFill(fills, viewportWidth - used, widths);

		ColumnWidths resolved = new ColumnWidths(widths, viewportWidth);
		for (ColumnModel<R, ?> column : columns)
			column.setActualWidth(resolved.getWidth(column.getId()));
		if (!resolved.equals(theWidths)) {
			theWidths = resolved;
			theChanges.onNext(resolved);
		}
		return resolved;
	}

	/**
	 * Measures the displayed text of {@link SizingPolicy#AUTO AUTO} columns in the given rows and re-resolves the layout if any column
	 * needs to grow. Measured content widths only grow, so columns don't jitter as rows scroll in and out of view.
	 *
	 * @param columns The grid's columns, in display order
	 * @param rows The bound rows to measure
	 * @param viewportWidth The width available to the columns
	 * @return The resolved widths
	 */
	public ColumnWidths measureAutoColumns(List<? extends ColumnModel<R, ?>> columns, Collection<? extends RowContainer<R>> rows,
		int viewportWidth) {
		boolean changed = false;
		for (ColumnModel<R, ?> column : columns) {
			if (!column.isVisible() || column.getSizingPolicy() != SizingPolicy.AUTO)
				continue;
			int max = 0;
			for (RowContainer<R> row : rows) {
				if (!row.isBound() || row.getEntry().isGroupHeader())
					continue;
				max = Math.max(max, theMeasurer.measure(row.getCellText(column.getId()), theTheme.getCellFont()) + theCellPadding);
			}
			Integer old = theContentWidths.get(column.getId());
			if (old == null || max > old) {
				theContentWidths.put(column.getId(), max);
				changed = true;
			}
		}
		if (changed || theWidths.getViewportWidth() != viewportWidth)
			return resolve(columns, viewportWidth);
		return theWidths;
	}

	/**
	 * Discards measured content widths, e.g. when the grid's content is replaced
	 *
	 * @param columnId The ID of the column to forget the content width of, or null for all columns
	 */
	public void clearMeasurements(String columnId) {
		if (columnId == null)
			theContentWidths.clear();
		else
			theContentWidths.remove(columnId);
	}

	int headerWidth(ColumnModel<R, ?> column) {
		return theMeasurer.measure(column.getHeader(), theTheme.getHeaderFont()) + theCellPadding;
	}

	private static <R> void distributeFill(List<ColumnModel<R, ?>> fills, int remaining, Map<String, Integer> widths) {
		if (remaining <= 0) {
			for (ColumnModel<R, ?> column : fills)
				widths.put(column.getId(), column.getMinWidth());
			return;
		}
		// Columns whose share violates their min or max are pinned there, and the rest re-share what's left
		List<ColumnModel<R, ?>> sharing = new ArrayList<>(fills);
		boolean pinned;
		do {
			pinned = false;
			double totalWeight = 0;
			for (ColumnModel<R, ?> column : sharing)
				totalWeight += column.getFillWeight();
			for (int i = 0; i < sharing.size(); i++) {
				ColumnModel<R, ?> column = sharing.get(i);
				double share = remaining * column.getFillWeight() / totalWeight;
				int clamped = column.clamp((int) share);
				if (share < column.getMinWidth() || share > column.getMaxWidth()) {
					widths.put(column.getId(), clamped);
					remaining -= clamped;
					sharing.remove(i);
					pinned = true;
					break;
				}
			}
		} while (pinned && !sharing.isEmpty() && remaining > 0);
		if (sharing.isEmpty())
			return;
		else if (remaining <= 0) {
			for (ColumnModel<R, ?> column : sharing)
				widths.put(column.getId(), column.getMinWidth());
			return;
		}

		double totalWeight = 0;
		for (ColumnModel<R, ?> column : sharing)
			totalWeight += column.getFillWeight();
		int[] shares = new int[sharing.size()];
		double[] fractions = new double[sharing.size()];
		int assigned = 0;
		for (int i = 0; i < shares.length; i++) {
			double share = remaining * sharing.get(i).getFillWeight() / totalWeight;
			shares[i] = (int) Math.floor(share);
			fractions[i] = share - shares[i];
			assigned += shares[i];
		}
		// Largest remainders get the leftover pixels, earlier columns first on ties
		for (int leftover = remaining - assigned; leftover > 0; leftover--) {
			int best = 0;
			for (int i = 1; i < fractions.length; i++) {
				if (fractions[i] > fractions[best])
					best = i;
			}
			shares[best]++;
			fractions[best] = -1;
		}
		for (int i = 0; i < shares.length; i++)
			widths.put(sharing.get(i).getId(), shares[i]);
	}
}
