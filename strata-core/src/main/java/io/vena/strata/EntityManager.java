package io.vena.strata;

import io.vena.strata.metadata.ClassDescriptor;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The persistence layer that owns a set of entity classes.
 *
 * <p>
 * An {@link Entity} calls its manager during construction to learn its schema,
 * its object id, and any row data staged for it; and afterward to load lazy relations,
 * to detach itself, and to reach the {@link Connection} and {@link EntitySerializer}.
 */
public interface EntityManager {
	/**
	 * @throws IllegalArgumentException if <code>entityType</code> isn't managed here
	 */
	ClassDescriptor classDescriptorFor(Class<? extends Entity> entityType);

	/**
	 * Returns and forgets the row data staged for the next instance of <code>entityType</code>
	 * to be constructed. A value of null in the returned map means the column is NULL.
	 *
	 * @return the staged data, or empty if the instance being constructed is new
	 */
	Optional<Map<String, Object>> takeStagedData(Class<? extends Entity> entityType);

	/**
	 * Stops tracking <code>entity</code>.
	 */
	void detach(Entity entity);

	/**
	 * Fetches the value of the named relation of <code>entity</code>. May block.
	 *
	 * @return an {@link Entity}, an {@link EntityCollection}, or null
	 */
	@Nullable Object loadRelation(Entity entity, String relationName);

	Connection connection();

	EntitySerializer serializer();

	/**
	 * @return a fresh object id, unique within this process
	 */
	long nextOid();
}
