package io.vena.strata.metadata;

/**
 * How a field's value is represented in storage.
 * Governs the conversions applied by the write payload and by entity snapshots.
 */
public enum FieldType {
	/**
	 * Stored as-is.
	 */
	PLAIN,

	/**
	 * A list or map, stored in flattened form.
	 */
	ARRAY,

	/**
	 * An arbitrary structured value, stored in flattened form.
	 * This is the only type whose column may hold an entity.
	 */
	OBJECT,

	/**
	 * Large text, stored compressed.
	 */
	COMPRESSED_TEXT,

	/**
	 * Stored in whatever representation the {@link io.vena.strata.Connection Connection} prefers.
	 */
	BOOLEAN,

	/**
	 * One of a fixed list of values, stored as its integer code.
	 */
	ENUMERATED,
}
