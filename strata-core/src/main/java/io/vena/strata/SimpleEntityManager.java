package io.vena.strata;

import io.vena.strata.metadata.ClassDescriptor;
import io.vena.strata.metadata.RelationDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import lombok.Builder;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.strata.LifecycleState.DETACHED;
import static io.vena.strata.LifecycleState.MANAGED;
import static io.vena.strata.util.ReflectionHelpers.construct;
import static java.util.Objects.requireNonNull;

/**
 * An {@link EntityManager} that keeps everything in memory.
 * Relations are loaded by {@link RelationLoader}s registered per relation;
 * there is no database.
 *
 * <p>
 * Useful on its own for tests, and as the base of the bookkeeping a real manager needs.
 */
public class SimpleEntityManager implements EntityManager {
	private final Connection connection;
	private final @Nullable EntitySerializer serializer;
	private final LongSupplier oidGenerator;

	private final Map<Class<? extends Entity>, ClassDescriptor> descriptors = new ConcurrentHashMap<>();
	private final Map<Class<? extends Entity>, Map<String, Object>> staged = new ConcurrentHashMap<>();
	private final Map<LoaderKey, RelationLoader> loaders = new ConcurrentHashMap<>();
	private final Set<Entity> managed = Collections.newSetFromMap(new ConcurrentHashMap<>());

	/**
	 * @param connection defaults to {@link Connection#numericBooleans()}
	 * @param serializer may be omitted if no entity needs one
	 * @param oidGenerator defaults to {@link ObjectIds#next()}
	 */
	@Builder
	private SimpleEntityManager(@Nullable Connection connection, @Nullable EntitySerializer serializer, @Nullable LongSupplier oidGenerator) {
		this.connection = (connection == null)? Connection.numericBooleans() : connection;
		this.serializer = serializer;
		this.oidGenerator = (oidGenerator == null)? ObjectIds::next : oidGenerator;
	}

	/**
	 * Also makes this the manager {@link EntityManagers#bind bound} to the descriptor's entity type.
	 */
	public SimpleEntityManager register(ClassDescriptor descriptor) {
		descriptors.put(descriptor.entityType(), descriptor);
		EntityManagers.bind(descriptor.entityType(), this);
		LOGGER.debug("Registered {}", descriptor);
		return this;
	}

	public SimpleEntityManager registerLoader(Class<? extends Entity> entityType, String relationName, RelationLoader loader) {
		ClassDescriptor descriptor = classDescriptorFor(entityType);
		descriptor.getRelation(relationName); // Throws if there's no such relation
		loaders.put(new LoaderKey(entityType, relationName), requireNonNull(loader));
		return this;
	}

	/**
	 * @return a {@link LifecycleState#NEW NEW} instance of <code>entityType</code>, not yet tracked
	 */
	public <E extends Entity> E create(Class<E> entityType) {
		return construct(entityType, this);
	}

	/**
	 * Builds an instance of <code>entityType</code> from row data, as though it had been read from the database.
	 *
	 * @return a {@link LifecycleState#MANAGED MANAGED} entity, tracked by this manager
	 */
	public <E extends Entity> E hydrate(Class<E> entityType, Map<String, ?> data) {
		classDescriptorFor(entityType);
		Map<String, Object> copy = new LinkedHashMap<>(data);
		if (staged.putIfAbsent(entityType, copy) != null) {
			throw new IllegalStateException("Already hydrating an instance of " + entityType.getSimpleName());
		}
		E result;
		try {
			result = construct(entityType, this);
		} finally {
			// In case the constructor threw before taking it
			staged.remove(entityType, copy);
		}
		managed.add(result);
		return result;
	}

	/**
	 * Starts tracking <code>entity</code> and marks it {@link LifecycleState#MANAGED MANAGED}.
	 *
	 * @throws IllegalArgumentException if <code>entity</code> belongs to a different manager
	 */
	public void manage(Entity entity) {
		if (entity.getManager() != this) {
			throw new IllegalArgumentException(entity + " belongs to a different manager");
		}
		managed.add(entity);
		entity.setState(MANAGED);
	}

	public boolean isManaged(Entity entity) {
		return managed.contains(entity);
	}

	@Override
	public ClassDescriptor classDescriptorFor(Class<? extends Entity> entityType) {
		ClassDescriptor result = descriptors.get(entityType);
		if (result == null) {
			throw new IllegalArgumentException("Unregistered entity class " + entityType.getName());
		} else {
			return result;
		}
	}

	@Override
	public Optional<Map<String, Object>> takeStagedData(Class<? extends Entity> entityType) {
		return Optional.ofNullable(staged.remove(entityType));
	}

	/**
	 * A {@link LifecycleState#MANAGED MANAGED} entity becomes {@link LifecycleState#DETACHED DETACHED};
	 * other states are left alone.
	 */
	@Override
	public void detach(Entity entity) {
		if (managed.remove(entity)) {
			LOGGER.debug("Detached {}", entity);
		}
		if (entity.getState() == MANAGED) {
			entity.setState(DETACHED);
		}
	}

	@Override
	public @Nullable Object loadRelation(Entity entity, String relationName) {
		RelationLoader loader = loaders.get(new LoaderKey(entity.getClass(), relationName));
		if (loader == null) {
			LOGGER.debug("No loader for {}.{}; treating as empty", entity.getClass().getSimpleName(), relationName);
			return null;
		}
		RelationDescriptor relation = entity.getClassDescriptor().getRelation(relationName);
		return loader.load(entity, relation);
	}

	@Override
	public Connection connection() {
		return connection;
	}

	/**
	 * @throws IllegalStateException if this manager was built without a serializer
	 */
	@Override
	public EntitySerializer serializer() {
		if (serializer == null) {
			throw new IllegalStateException("No EntitySerializer configured");
		} else {
			return serializer;
		}
	}

	@Override
	public long nextOid() {
		return oidGenerator.getAsLong();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this));
	}

	private record LoaderKey(Class<? extends Entity> entityType, String relationName) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(SimpleEntityManager.class);
}
