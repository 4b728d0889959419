package io.vena.strata;

import io.vena.strata.metadata.RelationDescriptor;
import org.jetbrains.annotations.Nullable;

/**
 * Fetches the value of a lazily loaded relation.
 */
@FunctionalInterface
public interface RelationLoader {
	/**
	 * @return an {@link Entity} for a to-one relation, an {@link EntityCollection} for a to-many relation,
	 * or null if there's nothing related
	 */
	@Nullable Object load(Entity owner, RelationDescriptor relation);
}
