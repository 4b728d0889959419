package io.vena.strata.util;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Type-coercing equality used to decide whether a field assignment is a real change.
 *
 * <p>
 * Values loaded from a database often come back with a different Java type than
 * the one the application sets (a <code>Long</code> where the application uses <code>Integer</code>,
 * a numeric <code>String</code> where it uses a number). Treating such values as equal keeps
 * no-op assignments out of the changeset.
 *
 * <p>
 * The rules:
 * <ul>
 *     <li>
 *         <code>null</code> equals any "empty" value: <code>false</code>, zero, the empty string,
 *         and empty collections, maps and arrays.
 *     </li>
 *     <li>
 *         If either side is a {@link Boolean}, the other side is compared by its {@link #isTruthy truthiness}.
 *     </li>
 *     <li>
 *         Numbers, and strings that parse as numbers, compare by numeric value.
 *         A number and a non-numeric string compare as strings.
 *     </li>
 *     <li>
 *         Arrays compare deeply; everything else uses {@link Object#equals}.
 *     </li>
 * </ul>
 *
 * Note that this means, for example, that setting a field from <code>null</code> to <code>0</code>
 * is not considered a change.
 */
public final class LooseEquality {

	public static boolean looselyEqual(@Nullable Object a, @Nullable Object b) {
		if (a == b) {
			return true;
		} else if (a == null) {
			return isEmpty(b);
		} else if (b == null) {
			return isEmpty(a);
		} else if (a instanceof Boolean || b instanceof Boolean) {
			return isTruthy(a) == isTruthy(b);
		} else if (a instanceof Number x && b instanceof Number y) {
			return numbersEqual(x, y);
		} else if (a instanceof Number x && b instanceof CharSequence s) {
			return numberEqualsString(x, s.toString());
		} else if (a instanceof CharSequence s && b instanceof Number y) {
			return numberEqualsString(y, s.toString());
		} else if (a instanceof CharSequence s && b instanceof CharSequence t) {
			BigDecimal x = numericValue(s.toString());
			BigDecimal y = numericValue(t.toString());
			if (x != null && y != null) {
				return x.compareTo(y) == 0;
			} else {
				return s.toString().equals(t.toString());
			}
		} else if (a.getClass().isArray() && b.getClass().isArray()) {
			return Objects.deepEquals(a, b);
		} else {
			return a.equals(b);
		}
	}

	/**
	 * @return false for null, <code>false</code>, zero, <code>""</code>, <code>"0"</code>,
	 * and empty collections, maps and arrays; true for everything else.
	 */
	public static boolean isTruthy(@Nullable Object value) {
		if (value == null) {
			return false;
		} else if (value instanceof Boolean b) {
			return b;
		} else if (value instanceof CharSequence s) {
			return !(s.length() == 0 || "0".contentEquals(s));
		} else {
			return !isEmpty(value);
		}
	}

	private static boolean isEmpty(Object value) {
		if (value instanceof Boolean b) {
			return !b;
		} else if (value instanceof Number n) {
			return numbersEqual(n, 0);
		} else if (value instanceof CharSequence s) {
			return s.length() == 0;
		} else if (value instanceof Collection<?> c) {
			return c.isEmpty();
		} else if (value instanceof Map<?, ?> m) {
			return m.isEmpty();
		} else if (value.getClass().isArray()) {
			return Array.getLength(value) == 0;
		} else {
			return false;
		}
	}

	private static boolean numberEqualsString(Number number, String string) {
		BigDecimal parsed = numericValue(string);
		if (parsed == null) {
			return number.toString().equals(string);
		} else {
			return numbersEqual(number, parsed);
		}
	}

	private static boolean numbersEqual(Number x, Number y) {
		BigDecimal a = exactValue(x);
		BigDecimal b = exactValue(y);
		if (a == null || b == null) {
			// NaN or infinity
			return x.doubleValue() == y.doubleValue();
		} else {
			return a.compareTo(b) == 0;
		}
	}

	private static @Nullable BigDecimal exactValue(Number number) {
		if (number instanceof BigDecimal d) {
			return d;
		} else if (number instanceof Double || number instanceof Float) {
			double d = number.doubleValue();
			return (Double.isNaN(d) || Double.isInfinite(d))? null : BigDecimal.valueOf(d);
		} else {
			return numericValue(number.toString());
		}
	}

	private static @Nullable BigDecimal numericValue(String string) {
		String trimmed = string.trim();
		if (trimmed.isEmpty()) {
			return null;
		}
		try {
			return new BigDecimal(trimmed);
		} catch (NumberFormatException e) {
			return null;
		}
	}

}
