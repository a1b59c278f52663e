package org.obgrid.grid;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;

import org.obgrid.util.TypeTokens;

/** Summary functions a column can display in its footer */
public enum AggregateType {
	/** No aggregate */
	NONE {
		@Override
		public Object aggregate(Collection<?> values) {
			return null;
		}
	},
	/** Sum of the values convertible to numbers */
	SUM {
		@Override
		public Object aggregate(Collection<?> values) {
			BigDecimal sum = BigDecimal.ZERO;
			for (Object value : values) {
				BigDecimal d = TypeTokens.toDecimal(value);
				if (d != null)
					sum = sum.add(d);
			}
			return sum;
		}
	},
	/** Average of the values convertible to numbers, null if there are none */
	AVERAGE {
		@Override
		public Object aggregate(Collection<?> values) {
			BigDecimal sum = BigDecimal.ZERO;
			int count = 0;
			for (Object value : values) {
				BigDecimal d = TypeTokens.toDecimal(value);
				if (d != null) {
					sum = sum.add(d);
					count++;
				}
			}
			return count == 0 ? null : sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
		}
	},
	/** Number of items, including those with null values */
	COUNT {
		@Override
		public Object aggregate(Collection<?> values) {
			return values.size();
		}
	},
	/** Smallest non-null comparable value */
	MIN {
		@Override
		public Object aggregate(Collection<?> values) {
			return extreme(values, -1);
		}
	},
	/** Largest non-null comparable value */
	MAX {
		@Override
		public Object aggregate(Collection<?> values) {
			return extreme(values, 1);
		}
	};

	/**
	 * @param values The column values of the items to aggregate
	 * @return The aggregate value
	 */
	public abstract Object aggregate(Collection<?> values);

	static Object extreme(Collection<?> values, int sign) {
		Comparable<Object> best = null;
		for (Object value : values) {
			if (!(value instanceof Comparable))
				continue;
			Comparable<Object> c = (Comparable<Object>) value;
			if (best == null)
				best = c;
			else if (best.getClass() != c.getClass())
				continue; // Values of different types can't be ordered together. Keep the first kind encountered.
			else if (Integer.signum(c.compareTo(best)) == sign)
				best = c;
		}
		return best;
	}
}
