package io.vena.strata.metadata;

import io.vena.strata.Entity;

/**
 * Replaces the built-in behaviour of {@link Entity#setValue} for one field of one entity class.
 *
 * <p>
 * To actually store something, implementations should call {@link Entity#setField},
 * which bypasses the hook but still records the change.
 */
@FunctionalInterface
public interface FieldMutator<E extends Entity> {
	void set(E entity, Object value);
}
