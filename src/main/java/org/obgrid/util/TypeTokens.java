package org.obgrid.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;

import com.google.common.reflect.TypeToken;

/** Type utilities used to validate and compare column values */
public class TypeTokens {
	/** The type of {@link Object} */
	public static final TypeToken<Object> OBJECT = TypeToken.of(Object.class);

	private TypeTokens() {}

	/**
	 * @param <T> The compile-time type
	 * @param type The class to get the type for
	 * @return The type token for the (wrapped) class
	 */
	public static <T> TypeToken<T> of(Class<T> type) {
		return TypeToken.of(wrap(type));
	}

	/**
	 * @param <T> The compile-time type
	 * @param type The type to get the raw type of
	 * @return The raw class of the type
	 */
	public static <T> Class<T> getRawType(TypeToken<T> type) {
		return (Class<T>) getRawType(type.getType());
	}

	/**
	 * @param t The type to get the raw type of
	 * @return The raw class of the type
	 */
	public static Class<?> getRawType(Type t) {
		if (t instanceof Class)
			return (Class<?>) t;
		else if (t instanceof ParameterizedType)
			return getRawType(((ParameterizedType) t).getRawType());
		else if (t instanceof GenericArrayType)
			return TypeToken.of(t).getRawType();
		else if (t instanceof TypeVariable) {
			Type[] bounds = ((TypeVariable<?>) t).getBounds();
			return bounds.length == 0 ? Object.class : getRawType(bounds[0]);
		} else if (t instanceof WildcardType) {
			Type[] bounds = ((WildcardType) t).getUpperBounds();
			return bounds.length == 0 ? Object.class : getRawType(bounds[0]);
		} else
			return Object.class;
	}

	/**
	 * @param type The type to wrap
	 * @return The non-primitive wrapper class corresponding to the given primitive type, or the input if it is not primitive
	 */
	public static <T> Class<T> wrap(Class<T> type) {
		if (!type.isPrimitive())
			return type;
		else if (type == boolean.class)
			return (Class<T>) Boolean.class;
		else if (type == int.class)
			return (Class<T>) Integer.class;
		else if (type == long.class)
			return (Class<T>) Long.class;
		else if (type == double.class)
			return (Class<T>) Double.class;
		else if (type == float.class)
			return (Class<T>) Float.class;
		else if (type == byte.class)
			return (Class<T>) Byte.class;
		else if (type == short.class)
			return (Class<T>) Short.class;
		else if (type == char.class)
			return (Class<T>) Character.class;
		else if (type == void.class)
			return (Class<T>) Void.class;
		else
			throw new IllegalStateException("Unrecognized primitive type: " + type);
	}

	/**
	 * Checks the value against the type's raw type
	 *
	 * @param type The type to check against
	 * @param value The value to check
	 * @return Whether the given value is an instance of the given type
	 */
	public static boolean isInstance(TypeToken<?> type, Object value) {
		if (value == null)
			return false;
		else if (type.equals(OBJECT))
			return true;
		return wrap(getRawType(type)).isInstance(value);
	}

	/**
	 * @param <T> The compile-time type to cast to
	 * @param type The type to cast to
	 * @param value The value to cast
	 * @return The value as an instance of the given type
	 * @throws ClassCastException If the given value is not null, nor an instance of the given type
	 */
	public static <T> T cast(TypeToken<T> type, Object value) throws ClassCastException {
		if (value != null && !isInstance(type, value))
			throw new ClassCastException("Cannot cast instance of " + value.getClass().getName() + " to " + type);
		return (T) value;
	}

	/**
	 * @param type The type to test
	 * @return Whether values of the type have a natural ordering
	 */
	public static boolean isComparable(TypeToken<?> type) {
		return Comparable.class.isAssignableFrom(wrap(getRawType(type)));
	}

	/**
	 * @param value The value to convert
	 * @return The value as a {@link BigDecimal}, or null if it is not a number or a string parseable as one
	 */
	public static BigDecimal toDecimal(Object value) {
		if (value == null)
			return null;
		else if (value instanceof BigDecimal)
			return (BigDecimal) value;
		else if (value instanceof BigInteger)
			return new BigDecimal((BigInteger) value);
		else if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
		} else if (value instanceof Number)
			return BigDecimal.valueOf(((Number) value).longValue());
		try {
			return new BigDecimal(value.toString().trim());
		} catch (NumberFormatException e) {
			return null;
		}
	}

	/**
	 * @param type The type to print
	 * @return The simple name of the type, e.g. "List&lt;String&gt;"
	 */
	public static String getSimpleName(TypeToken<?> type) {
		Type t = type.getType();
		if (t instanceof Class)
			return ((Class<?>) t).getSimpleName();
		StringBuilder str = new StringBuilder();
		if (t instanceof ParameterizedType) {
			ParameterizedType pt = (ParameterizedType) t;
			str.append(getRawType(pt).getSimpleName()).append('<');
			Type[] args = pt.getActualTypeArguments();
			for (int i = 0; i < args.length; i++) {
				if (i > 0)
					str.append(", ");
				str.append(getSimpleName(TypeToken.of(args[i])));
			}
			str.append('>');
		} else
			str.append(t.getTypeName());
		return str.toString();
	}
}
