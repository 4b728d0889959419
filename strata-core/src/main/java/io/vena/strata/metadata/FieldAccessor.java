package io.vena.strata.metadata;

import io.vena.strata.Entity;

/**
 * Replaces the built-in behaviour of {@link Entity#getValue} for one field of one entity class.
 *
 * <p>
 * Implementations usually compute something from {@link Entity#getField}, which bypasses the hook.
 */
@FunctionalInterface
public interface FieldAccessor<E extends Entity> {
	Object get(E entity);
}
