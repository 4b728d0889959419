package io.vena.strata;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide lookup of the {@link EntityManager} that owns each entity class.
 *
 * <p>
 * Only needed where there's no entity instance to ask, which is when restoring
 * an entity with {@link Entity#fromBytes}.
 */
public final class EntityManagers {
	private static final Map<Class<? extends Entity>, EntityManager> managers = new ConcurrentHashMap<>();

	/**
	 * Makes <code>manager</code> the owner of <code>entityType</code>, replacing any previous owner.
	 */
	public static void bind(Class<? extends Entity> entityType, EntityManager manager) {
		EntityManager old = managers.put(entityType, manager);
		if (old != null && old != manager) {
			LOGGER.debug("Rebinding {} from {} to {}", entityType.getSimpleName(), old, manager);
		}
	}

	public static void unbind(Class<? extends Entity> entityType) {
		managers.remove(entityType);
	}

	/**
	 * @throws IllegalStateException if no manager is bound to <code>entityType</code>
	 */
	public static EntityManager forType(Class<? extends Entity> entityType) {
		EntityManager result = managers.get(entityType);
		if (result == null) {
			throw new IllegalStateException("No EntityManager bound to " + entityType.getName());
		} else {
			return result;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EntityManagers.class);
}
