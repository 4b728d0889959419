package io.vena.strata;

import io.vena.strata.exceptions.DeserializationException;
import io.vena.strata.exceptions.SerializationException;
import org.jetbrains.annotations.Nullable;

/**
 * Converts entity data to and from bytes.
 * Used for structured ({@link io.vena.strata.metadata.FieldType#ARRAY ARRAY} and
 * {@link io.vena.strata.metadata.FieldType#OBJECT OBJECT}) field values,
 * and for whole-entity {@link EntitySnapshot snapshots}.
 *
 * <p>
 * Implementations must be thread-safe.
 */
public interface EntitySerializer {
	/**
	 * @throws SerializationException if <code>value</code> can't be represented
	 */
	byte[] flatten(Object value);

	/**
	 * Inverse of {@link #flatten}.
	 *
	 * @throws DeserializationException if <code>bytes</code> doesn't describe a <code>type</code>
	 */
	<T> T restore(byte[] bytes, Class<T> type);

	/**
	 * Coerces a value read back from a snapshot into the declared type of its field.
	 * Snapshot formats don't necessarily preserve Java types;
	 * a long might come back as an int, or a byte array as a string.
	 *
	 * @throws DeserializationException if <code>raw</code> can't be converted
	 */
	@Nullable <T> T convert(@Nullable Object raw, Class<T> type);

	byte[] writeSnapshot(EntitySnapshot snapshot);

	EntitySnapshot readSnapshot(byte[] bytes);
}
