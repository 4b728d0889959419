package io.vena.strata;

import io.vena.strata.exceptions.DeserializationException;
import io.vena.strata.exceptions.InvalidDescriptorException;
import io.vena.strata.exceptions.InvalidFieldException;
import io.vena.strata.exceptions.InvalidReferenceException;
import io.vena.strata.exceptions.InvalidStateException;
import io.vena.strata.exceptions.UnknownFieldException;
import io.vena.strata.exceptions.UnknownReferenceException;
import io.vena.strata.metadata.ClassDescriptor;
import io.vena.strata.metadata.FieldAccessor;
import io.vena.strata.metadata.FieldMutator;
import io.vena.strata.metadata.FieldType;
import io.vena.strata.metadata.OwningSide;
import io.vena.strata.metadata.RelationDescriptor;
import io.vena.strata.util.Compression;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.strata.LifecycleState.LOCKED;
import static io.vena.strata.LifecycleState.MANAGED;
import static io.vena.strata.LifecycleState.NEW;
import static io.vena.strata.util.LooseEquality.looselyEqual;
import static io.vena.strata.util.ReflectionHelpers.construct;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Base class for objects whose state is persisted in a relational database by an {@link EntityManager}.
 *
 * <p>
 * An entity keeps four things in step:
 * <ol>
 *     <li>
 *         its {@link LifecycleState lifecycle state};
 *     </li>
 *     <li>
 *         its {@link #identity() identity}, the values of its identifier fields;
 *     </li>
 *     <li>
 *         its fields and references, each of which may be loaded or not (see {@link Slot});
 *     </li>
 *     <li>
 *         its changeset, the assignments made since the last synchronization with the database,
 *         from which {@link #buildWritePayload()} computes what to write.
 *     </li>
 * </ol>
 *
 * <p>
 * Subclasses must have a non-private constructor taking just an {@link EntityManager},
 * which passes it to {@link #Entity(EntityManager) ours}.
 *
 * <p>
 * Entities are not thread-safe. An entity should have one owner at a time,
 * typically the unit of work of its manager.
 *
 * @see ClassDescriptor
 */
public abstract class Entity {
	private final long oid;
	private final EntityManager manager;
	private final ClassDescriptor classDescriptor;
	private LifecycleState state;

	private final Map<String, Object> identity = new LinkedHashMap<>();
	private final Map<String, Slot> fields = new LinkedHashMap<>();
	private final Map<String, Slot> references = new LinkedHashMap<>();
	private final Map<String, List<Change>> modified = new LinkedHashMap<>();

	/**
	 * If the manager has staged row data for this class, the new entity is hydrated
	 * from it and starts out {@link LifecycleState#MANAGED MANAGED};
	 * otherwise it starts out {@link LifecycleState#NEW NEW} with nothing loaded.
	 */
	protected Entity(EntityManager manager) {
		this.manager = requireNonNull(manager);
		this.classDescriptor = manager.classDescriptorFor(getClass());
		this.oid = manager.nextOid();
		Optional<Map<String, Object>> staged = manager.takeStagedData(getClass());
		if (staged.isPresent()) {
			staged.get().forEach((name, value) -> fields.put(name, Slot.loaded(value)));
			extractIdentifier();
			this.state = MANAGED;
			LOGGER.trace("Hydrated {} with {}", this, fields.keySet());
		} else {
			this.state = NEW;
		}
	}

	public final long getOid() {
		return oid;
	}

	public final String getEntityName() {
		return getClass().getName();
	}

	public final ClassDescriptor getClassDescriptor() {
		return classDescriptor;
	}

	public final EntityManager getManager() {
		return manager;
	}

	/////////////////
	//
	//  Identity & state
	//

	public final LifecycleState getState() {
		return state;
	}

	/**
	 * Intended for the {@link EntityManager}.
	 *
	 * @throws InvalidStateException if <code>newState</code> is null
	 */
	public final void setState(LifecycleState newState) {
		if (newState == null) {
			throw new InvalidStateException("Lifecycle state of " + this + " can't be null");
		}
		if (newState != state) {
			LOGGER.debug("{}: {} -> {}", this, state, newState);
			state = newState;
		}
	}

	public final boolean isNew() {
		return state == NEW;
	}

	/**
	 * @return an unmodifiable copy of the identifier values known so far.
	 * For a composite identifier, a field that's part of the key but has no value maps to null.
	 */
	public final Map<String, Object> identity() {
		return unmodifiableMap(new LinkedHashMap<>(identity));
	}

	/**
	 * Records the identifier the database assigned to this entity, typically after an insert.
	 * The entity is then considered synchronized: its changeset is cleared,
	 * and if it was {@link LifecycleState#NEW NEW}, it becomes {@link LifecycleState#MANAGED MANAGED}.
	 *
	 * @param id the value of the single identifier field, or for composite identifiers,
	 *           a {@link Map} from identifier field name to value
	 * @throws InvalidFieldException if a map key is not an identifier field
	 */
	public final void assignIdentifier(Object id) {
		if (id instanceof Map<?, ?> composite) {
			for (Entry<?, ?> entry: composite.entrySet()) {
				String name = String.valueOf(entry.getKey());
				if (!classDescriptor.isIdentifier(name)) {
					throw new InvalidFieldException("\"" + name + "\" is not an identifier field of " + getClass().getSimpleName());
				}
				identity.put(name, entry.getValue());
				fields.put(name, Slot.loaded(entry.getValue()));
			}
		} else {
			String name = classDescriptor.singleIdentifierFieldName();
			identity.put(name, id);
			fields.put(name, Slot.loaded(id));
		}
		modified.clear();
		LOGGER.debug("{}: assigned identifier {}", this, identity);
		if (state == NEW) {
			setState(MANAGED);
		}
	}

	/**
	 * A missing single-field identifier means the identity isn't known yet, so it's left out;
	 * a composite identifier always reserves a slot for every key field.
	 */
	private void extractIdentifier() {
		if (classDescriptor.isIdentifierComposite()) {
			for (String name: classDescriptor.identifierFieldNames()) {
				identity.put(name, slot(fields, name).value());
			}
		} else {
			String name = classDescriptor.singleIdentifierFieldName();
			Object value = slot(fields, name).value();
			if (value != null) {
				identity.put(name, value);
			}
		}
	}

	/////////////////
	//
	//  Fields & references
	//

	/**
	 * @return true if <code>name</code> is a loaded field or a loaded reference, even if its value is null
	 */
	public final boolean isLoaded(String name) {
		return slot(fields, name).isLoaded() || slot(references, name).isLoaded();
	}

	/**
	 * Returns a loaded field or reference, bypassing custom accessors and never loading anything.
	 *
	 * @throws UnknownFieldException if <code>name</code> is not loaded
	 */
	public final @Nullable Object getField(String name) {
		Slot slot = fields.get(name);
		if (slot == null) {
			slot = references.get(name);
		}
		if (slot == null) {
			throw new UnknownFieldException("\"" + name + "\" is not loaded in " + this);
		} else {
			return slot.value();
		}
	}

	/**
	 * Returns the value of a field or relation, running its custom accessor if it has one.
	 *
	 * <p>
	 * Fields that weren't loaded read as null; they are never fetched individually.
	 * Relations that weren't loaded are fetched from the {@link EntityManager} if they're
	 * {@link RelationDescriptor#lazilyLoaded() lazily loaded}, in which case this may block;
	 * otherwise they read as null.
	 *
	 * @throws InvalidFieldException if <code>name</code> is neither a field nor a relation
	 */
	public final @Nullable Object getValue(String name) {
		Optional<FieldAccessor<?>> accessor = classDescriptor.customAccessor(name);
		if (accessor.isPresent()) {
			@SuppressWarnings("unchecked")
			FieldAccessor<Entity> hook = (FieldAccessor<Entity>) accessor.get();
			return hook.get(this);
		}

		Slot slot = fields.get(name);
		if (slot != null) {
			return slot.value();
		}
		slot = references.get(name);
		if (slot != null) {
			return slot.value();
		}

		if (classDescriptor.hasField(name)) {
			return null;
		} else if (classDescriptor.hasRelation(name)) {
			RelationDescriptor relation = classDescriptor.getRelation(name);
			if (relation.lazilyLoaded()) {
				LOGGER.debug("{}: loading relation \"{}\"", this, name);
				Object loaded = manager.loadRelation(this, name);
				references.put(name, Slot.loaded(loaded));
				return loaded;
			} else {
				return null;
			}
		} else {
			throw invalidField(name);
		}
	}

	/**
	 * Assigns a field or relation, running its custom mutator if it has one,
	 * and otherwise behaving like {@link #setField}.
	 *
	 * @throws InvalidFieldException if <code>name</code> is neither a field nor a relation
	 */
	public final void setValue(String name, @Nullable Object value) {
		Optional<FieldMutator<?>> mutator = classDescriptor.customMutator(name);
		if (mutator.isPresent()) {
			@SuppressWarnings("unchecked")
			FieldMutator<Entity> hook = (FieldMutator<Entity>) mutator.get();
			hook.set(this, value);
		} else {
			setField(name, value);
		}
	}

	/**
	 * Assigns a field or relation, bypassing custom mutators.
	 *
	 * <p>
	 * For a field, the assignment is recorded in the changeset unless the new value is
	 * {@link io.vena.strata.util.LooseEquality loosely equal} to the current one
	 * (an unloaded field counts as null). While the entity is {@link LifecycleState#NEW NEW},
	 * assigning an identifier field also updates the {@link #identity()}.
	 *
	 * <p>
	 * For a relation, this is {@link #setReference}.
	 *
	 * @throws InvalidFieldException if <code>name</code> is neither a field nor a relation
	 */
	public final void setField(String name, @Nullable Object value) {
		if (classDescriptor.hasField(name)) {
			Object old = slot(fields, name).value();
			if (!looselyEqual(old, value)) {
				fields.put(name, Slot.loaded(value));
				modified.computeIfAbsent(name, __ -> new ArrayList<>()).add(new Change(old, value));
				if (isNew() && classDescriptor.isIdentifier(name)) {
					identity.put(name, value);
				}
				LOGGER.trace("{}.{}: {} -> {}", this, name, old, value);
			}
		} else if (classDescriptor.hasRelation(name)) {
			setReference(name, value);
		} else {
			throw invalidField(name);
		}
	}

	/**
	 * Assigns a relation. A null <code>value</code> records that there is no related entity.
	 *
	 * <p>
	 * Besides caching <code>value</code>, this keeps the join columns consistent:
	 * <ul>
	 *     <li>
	 *         For a one-to-one relation whose key is held here, the local field is set to the
	 *         related entity's foreign field, or to the related entity itself when the
	 *         relation joins on its identifier (to be resolved when it's written).
	 *     </li>
	 *     <li>
	 *         For a one-to-one relation whose key is held by the other side,
	 *         <strong>the related entity is modified</strong>: its foreign field is set to <code>this</code>.
	 *     </li>
	 *     <li>
	 *         For a one-to-many relation that already has a collection,
	 *         the existing collection's contents are replaced and the existing collection is kept.
	 *     </li>
	 * </ul>
	 *
	 * @throws InvalidReferenceException if <code>value</code> has the wrong shape for the relation
	 * @throws InvalidFieldException if there's no relation called <code>name</code>
	 */
	public final void setReference(String name, @Nullable Object value) {
		if (value == null) {
			references.put(name, Slot.loadedNull());
			return;
		}

		RelationDescriptor relation = classDescriptor.getRelation(name);
		switch (relation.shape()) {
			case ONE_TO_MANY: {
				if (!(value instanceof EntityCollection<?> collection)) {
					throw InvalidReferenceException.oneToMany(name, value);
				}
				if (slot(references, name).value() instanceof EntityCollection<?> existing) {
					@SuppressWarnings("unchecked")
					EntityCollection<Entity> target = (EntityCollection<Entity>) existing;
					target.setData(collection.getData());
					return;
				}
				break;
			}
			case ONE_TO_ONE: {
				if (!(value instanceof Entity related)) {
					throw InvalidReferenceException.oneToOne(name, value);
				}
				if (relation.owningSide() == OwningSide.LOCAL) {
					String foreignField = relation.foreignField();
					String relatedKey = related.getClassDescriptor().identifierFieldNames().get(0);
					if (foreignField != null && !foreignField.isEmpty() && !foreignField.equals(relatedKey)) {
						setValue(relation.localField(), related.getField(foreignField));
					} else {
						setValue(relation.localField(), related);
					}
				} else {
					related.setValue(relation.foreignField(), this);
				}
				break;
			}
			case MANY_TO_MANY: {
				if (!(value instanceof EntityCollection)) {
					throw InvalidReferenceException.manyToMany(name, value);
				}
				break;
			}
		}
		references.put(name, Slot.loaded(value));
	}

	/**
	 * Checks for a value without loading anything.
	 *
	 * @return true if <code>name</code> is a loaded non-null field, a known identifier value,
	 * or a loaded non-null reference
	 */
	public final boolean contains(String name) {
		Slot field = fields.get(name);
		if (field != null) {
			return field.hasValue();
		}
		if (identity.get(name) != null) {
			return true;
		}
		return slot(references, name).hasValue();
	}

	/**
	 * Empties a loaded field or reference. Does nothing if <code>name</code> isn't loaded.
	 *
	 * <p>
	 * A field becomes an empty list rather than null. A single-entity reference becomes null;
	 * the related entity itself is left for the manager to deal with when this one is saved.
	 * A collection reference is cleared in place.
	 */
	public final void remove(String name) {
		if (slot(fields, name).isLoaded()) {
			fields.put(name, Slot.loaded(List.of()));
		} else if (slot(references, name).isLoaded()) {
			Object value = references.get(name).value();
			if (value instanceof Entity) {
				references.put(name, Slot.loadedNull());
			} else if (value instanceof EntityCollection<?> collection) {
				collection.clear();
			}
		}
	}

	public final boolean hasReference(String name) {
		return slot(references, name).isLoaded();
	}

	/**
	 * @return the loaded reference, which may be null
	 * @throws UnknownReferenceException if the reference has never been loaded or set
	 */
	public final @Nullable Object getReference(String name) {
		Slot slot = references.get(name);
		if (slot == null) {
			throw new UnknownReferenceException("Unknown reference \"" + name + "\" in " + this);
		} else {
			return slot.value();
		}
	}

	/**
	 * @return an unmodifiable copy of all loaded references, with null for those known to be empty
	 */
	public final Map<String, Object> allReferences() {
		Map<String, Object> result = new LinkedHashMap<>();
		references.forEach((name, slot) -> result.put(name, slot.value()));
		return unmodifiableMap(result);
	}

	/**
	 * Caches a collection loaded by the manager, with no checks and no side effects.
	 */
	public final void setRelatedCollection(String alias, EntityCollection<?> collection) {
		references.put(alias, Slot.loaded(requireNonNull(collection)));
	}

	/**
	 * @return an unmodifiable copy of the loaded fields, with null for those known to be null
	 */
	public final Map<String, Object> getData() {
		Map<String, Object> result = new LinkedHashMap<>();
		fields.forEach((name, slot) -> result.put(name, slot.value()));
		return unmodifiableMap(result);
	}

	private InvalidFieldException invalidField(String name) {
		return new InvalidFieldException("Invalid field \"" + name + "\" for " + getClass().getSimpleName());
	}

	private static Slot slot(Map<String, Slot> map, String name) {
		return map.getOrDefault(name, Slot.notLoaded());
	}

	/////////////////
	//
	//  Changeset
	//

	public final boolean isModified() {
		return !modified.isEmpty();
	}

	/**
	 * @return an unmodifiable copy of the changeset: for each modified field,
	 * its assignments in the order they happened
	 */
	public final Map<String, List<Change>> getModified() {
		Map<String, List<Change>> result = new LinkedHashMap<>();
		modified.forEach((name, changes) -> result.put(name, unmodifiableList(new ArrayList<>(changes))));
		return unmodifiableMap(result);
	}

	/**
	 * Computes the column values to write for the modified fields, converted to their storage form.
	 *
	 * <p>
	 * Under single-table or joined-table inheritance, the discriminator column is included too
	 * whenever the stored discriminator doesn't already identify this class,
	 * and the entity's own discriminator field is updated to match.
	 *
	 * <p>
	 * The changeset itself is not cleared; that happens on {@link #assignIdentifier}.
	 */
	public final Map<String, Object> buildWritePayload() {
		Map<String, Object> payload = new LinkedHashMap<>();
		for (String name: modified.keySet()) {
			Object value = slot(fields, name).value();
			payload.put(name, (value == null)? null : encodeForWrite(name, value));
		}

		if (classDescriptor.inheritanceKind().usesDiscriminator()) {
			String column = classDescriptor.discriminatorColumn();
			Object discriminator = discriminatorValue();
			Object old = getValue(column);
			if (old == null || !String.valueOf(old).equals(String.valueOf(discriminator))) {
				payload.put(column, discriminator);
				fields.put(column, Slot.loaded(discriminator));
			}
		}

		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{}: write payload {}", this, payload.keySet());
		}
		return payload;
	}

	private Object encodeForWrite(String name, Object value) {
		switch (classDescriptor.fieldType(name)) {
			case ARRAY:
			case OBJECT:
				return manager.serializer().flatten(value);
			case COMPRESSED_TEXT:
				return Compression.deflate(value.toString(), Compression.WRITE_LEVEL);
			case BOOLEAN:
				return manager.connection().convertBoolean(value);
			case ENUMERATED:
				return classDescriptor.enumCodeOf(name, value);
			default:
				return value;
		}
	}

	private Object discriminatorValue() {
		for (Entry<Object, Class<? extends Entity>> entry: classDescriptor.discriminatorMap().entrySet()) {
			if (entry.getValue() == getClass()) {
				return entry.getKey();
			}
		}
		throw new InvalidDescriptorException("No discriminator value for " + getClass().getSimpleName() + " in " + classDescriptor.discriminatorMap());
	}

	/////////////////
	//
	//  Serialization
	//

	/**
	 * Captures this entity's state, minus its references, using the manager's {@link EntitySerializer}.
	 *
	 * <p>
	 * Fields known to be null are left out, and so are entities held in columns that aren't
	 * {@link FieldType#OBJECT OBJECT} columns; both come back as not loaded.
	 *
	 * @see #fromBytes
	 */
	public final byte[] toBytes() {
		Map<String, Slot> captured = new LinkedHashMap<>(fields);
		identity.forEach((name, value) -> {
			if (value != null) {
				captured.put(name, Slot.loaded(value));
			}
		});

		Map<String, Object> encoded = new LinkedHashMap<>();
		for (Entry<String, Slot> entry: captured.entrySet()) {
			String name = entry.getKey();
			Object value = entry.getValue().value();
			FieldType type = classDescriptor.fieldType(name);
			if (value == null) {
				continue;
			} else if (value instanceof Entity && type != FieldType.OBJECT) {
				LOGGER.trace("{}: not capturing entity-valued field \"{}\"", this, name);
				continue;
			}
			encoded.put(name, encodeForSnapshot(name, type, value));
		}

		EntitySnapshot snapshot = new EntitySnapshot(
			getEntityName(),
			state,
			oid,
			encoded,
			identity,
			new ArrayList<>(modified.keySet()));
		return manager.serializer().writeSnapshot(snapshot);
	}

	private Object encodeForSnapshot(String name, FieldType type, Object value) {
		switch (type) {
			case ARRAY:
			case OBJECT:
				return manager.serializer().flatten(value);
			case COMPRESSED_TEXT:
				return Compression.deflate(value.toString());
			case ENUMERATED:
				return classDescriptor.enumCodeOf(name, value);
			default:
				return value;
		}
	}

	/**
	 * Reconstructs an entity captured by {@link #toBytes()}.
	 *
	 * <p>
	 * The result is a new object: it gets a new {@link #getOid() oid}, and its descriptor and manager
	 * are looked up afresh through {@link EntityManagers}. Its state, fields and identity are those
	 * that were captured; its references are not loaded. Fields that had unsaved changes are still
	 * in the changeset, though their previous values are lost.
	 *
	 * @param entityType the class that was captured, or a superclass of it
	 * @throws DeserializationException if <code>bytes</code> isn't a snapshot of an <code>entityType</code>
	 */
	public static <E extends Entity> E fromBytes(Class<E> entityType, byte[] bytes) {
		EntitySnapshot snapshot = EntityManagers.forType(entityType).serializer().readSnapshot(bytes);
		Class<? extends E> actualType = snapshotType(entityType, snapshot);
		EntityManager manager = EntityManagers.forType(actualType);
		E result = construct(actualType, manager);
		((Entity) result).restore(snapshot);
		LOGGER.debug("Restored {} from snapshot of oid {}", result, snapshot.oid());
		return result;
	}

	private static <E extends Entity> Class<? extends E> snapshotType(Class<E> entityType, EntitySnapshot snapshot) {
		if (entityType.getName().equals(snapshot.type())) {
			return entityType;
		}
		Class<?> actual;
		try {
			actual = Class.forName(snapshot.type(), false, entityType.getClassLoader());
		} catch (ClassNotFoundException e) {
			throw new DeserializationException("Unknown entity class in snapshot: " + snapshot.type(), e);
		}
		if (entityType.isAssignableFrom(actual)) {
			return actual.asSubclass(entityType);
		} else {
			throw new DeserializationException("Snapshot of " + snapshot.type() + " is not a " + entityType.getName());
		}
	}

	private void restore(EntitySnapshot snapshot) {
		EntitySerializer serializer = manager.serializer();
		setState(snapshot.state());

		fields.clear();
		snapshot.fields().forEach((name, raw) ->
			fields.put(name, Slot.loaded(decodeFromSnapshot(serializer, name, raw))));

		identity.clear();
		snapshot.identity().forEach((name, raw) ->
			identity.put(name, serializer.convert(raw, classDescriptor.fieldJavaType(name))));
		extractIdentifier();

		modified.clear();
		for (String name: snapshot.modified()) {
			Slot slot = slot(fields, name);
			modified.put(name, new ArrayList<>(List.of(new Change(null, slot.value()))));
		}
	}

	private Object decodeFromSnapshot(EntitySerializer serializer, String name, Object raw) {
		Class<?> javaType = classDescriptor.fieldJavaType(name);
		switch (classDescriptor.fieldType(name)) {
			case ARRAY:
			case OBJECT:
				return serializer.restore(serializer.convert(raw, byte[].class), javaType);
			case COMPRESSED_TEXT:
				return Compression.inflate(serializer.convert(raw, byte[].class));
			case ENUMERATED:
				return classDescriptor.enumValueOf(name, serializer.convert(raw, Integer.class));
			default:
				return serializer.convert(raw, javaType);
		}
	}

	/////////////////
	//
	//  Housekeeping
	//

	/**
	 * Detaches this entity from its manager and discards its data, after which it must not be used.
	 * Does nothing while the entity is {@link LifecycleState#LOCKED LOCKED}.
	 *
	 * @param deep if true, also frees every entity this one references, recursively
	 */
	public void free(boolean deep) {
		if (state == LOCKED) {
			LOGGER.debug("{}: not freeing while locked", this);
			return;
		}
		LOGGER.debug("{}: free(deep={})", this, deep);
		manager.detach(this);
		fields.clear();
		identity.clear();

		// Cleared before recursing so that cycles end here
		List<Object> referenced = new ArrayList<>();
		references.values().forEach(slot -> referenced.add(slot.value()));
		references.clear();
		if (deep) {
			for (Object value: referenced) {
				if (value instanceof Entity entity) {
					entity.free(true);
				} else if (value instanceof EntityCollection<?> collection) {
					collection.free(true);
				}
			}
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + oid + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Entity.class);
}
