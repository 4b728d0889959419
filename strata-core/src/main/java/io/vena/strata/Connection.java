package io.vena.strata;

import org.jetbrains.annotations.Nullable;

/**
 * The part of a database connection that entities need:
 * converting boolean field values into the representation the database stores.
 */
@FunctionalInterface
public interface Connection {
	@Nullable Object convertBoolean(@Nullable Object value);

	/**
	 * For databases without a boolean column type: stores <code>1</code> and <code>0</code>.
	 */
	static Connection numericBooleans() {
		return value -> (value == null)? null : (Boolean.TRUE.equals(value)? 1 : 0);
	}

	/**
	 * For databases that store booleans natively.
	 */
	static Connection nativeBooleans() {
		return value -> value;
	}
}
