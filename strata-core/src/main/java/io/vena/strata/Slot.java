package io.vena.strata;

import org.jetbrains.annotations.Nullable;

/**
 * The contents of one field or reference of an {@link Entity}:
 * either {@link NotLoaded not loaded}, or {@link Loaded loaded} with a possibly-null value.
 *
 * <p>
 * This distinction lets an entity tell "we know this column is NULL" apart from
 * "we never fetched this column".
 */
public sealed interface Slot permits Slot.NotLoaded, Slot.Loaded {

	static Slot notLoaded() {
		return NotLoaded.INSTANCE;
	}

	static Slot loaded(@Nullable Object value) {
		return (value == null)? Loaded.NULL : new Loaded(value);
	}

	static Slot loadedNull() {
		return Loaded.NULL;
	}

	boolean isLoaded();

	/**
	 * @return the value, or null if the slot holds null or is not loaded
	 */
	@Nullable Object value();

	default boolean hasValue() {
		return value() != null;
	}

	enum NotLoaded implements Slot {
		INSTANCE;

		@Override public boolean isLoaded() { return false; }
		@Override public @Nullable Object value() { return null; }
		@Override public String toString() { return "NotLoaded"; }
	}

	record Loaded(@Nullable Object value) implements Slot {
		static final Loaded NULL = new Loaded(null);

		@Override public boolean isLoaded() { return true; }
	}
}
