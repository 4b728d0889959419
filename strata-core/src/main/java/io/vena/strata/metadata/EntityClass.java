package io.vena.strata.metadata;

import io.vena.strata.Entity;
import io.vena.strata.exceptions.InvalidDescriptorException;
import io.vena.strata.exceptions.InvalidFieldException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The standard immutable {@link ClassDescriptor}, assembled with a {@link Builder}.
 *
 * <p>
 * Custom accessors and mutators are registered here, once, when the class is described,
 * so looking one up is a plain map access with no reflection and no shared mutable cache.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class EntityClass implements ClassDescriptor {
	private final Class<? extends Entity> entityType;
	private final List<String> identifierFieldNames;
	private final Map<String, FieldDefinition> fields;
	private final Map<String, RelationDescriptor> relations;
	private final Map<String, FieldAccessor<?>> accessors;
	private final Map<String, FieldMutator<?>> mutators;
	private final InheritanceKind inheritanceKind;
	private final @Nullable String discriminatorColumn;
	private final Map<Object, Class<? extends Entity>> discriminatorMap;

	public static <E extends Entity> Builder<E> builder(Class<E> entityType) {
		return new Builder<>(entityType);
	}

	@Override public Class<? extends Entity> entityType() { return entityType; }
	@Override public List<String> identifierFieldNames() { return identifierFieldNames; }
	@Override public boolean hasField(String name) { return fields.containsKey(name); }
	@Override public boolean hasRelation(String name) { return relations.containsKey(name); }
	@Override public InheritanceKind inheritanceKind() { return inheritanceKind; }
	@Override public @Nullable String discriminatorColumn() { return discriminatorColumn; }
	@Override public Map<Object, Class<? extends Entity>> discriminatorMap() { return discriminatorMap; }

	@Override
	public RelationDescriptor getRelation(String name) {
		RelationDescriptor result = relations.get(name);
		if (result == null) {
			throw new InvalidFieldException("No relation \"" + name + "\" in " + entityType.getSimpleName());
		} else {
			return result;
		}
	}

	@Override
	public FieldType fieldType(String name) {
		FieldDefinition field = fields.get(name);
		return (field == null)? FieldType.PLAIN : field.type();
	}

	@Override
	public Class<?> fieldJavaType(String name) {
		FieldDefinition field = fields.get(name);
		return (field == null)? Object.class : field.javaType();
	}

	@Override
	public int enumCodeOf(String fieldName, Object value) {
		List<?> values = enumValues(fieldName);
		int code = values.indexOf(value);
		if (code == -1) {
			throw new InvalidDescriptorException("Value \"" + value + "\" is not one of " + values + " for " + describe(fieldName));
		}
		return code;
	}

	@Override
	public Object enumValueOf(String fieldName, int code) {
		List<?> values = enumValues(fieldName);
		if (0 <= code && code < values.size()) {
			return values.get(code);
		} else {
			throw new InvalidDescriptorException("Code " + code + " is out of range for " + describe(fieldName));
		}
	}

	private List<?> enumValues(String fieldName) {
		FieldDefinition field = fields.get(fieldName);
		if (field == null || field.type() != FieldType.ENUMERATED) {
			throw new InvalidDescriptorException(describe(fieldName) + " is not an enumerated field");
		}
		return field.enumValues();
	}

	@Override
	public Optional<FieldAccessor<?>> customAccessor(String name) {
		return Optional.ofNullable(accessors.get(name));
	}

	@Override
	public Optional<FieldMutator<?>> customMutator(String name) {
		return Optional.ofNullable(mutators.get(name));
	}

	private String describe(String fieldName) {
		return entityType.getSimpleName() + "." + fieldName;
	}

	@Override
	public String toString() {
		return "EntityClass(" + entityType.getSimpleName() + ")";
	}

	public static final class Builder<E extends Entity> {
		private final Class<E> entityType;
		private List<String> identifierFieldNames = emptyList();
		private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
		private final Map<String, RelationDescriptor> relations = new LinkedHashMap<>();
		private final Map<String, FieldAccessor<?>> accessors = new LinkedHashMap<>();
		private final Map<String, FieldMutator<?>> mutators = new LinkedHashMap<>();
		private InheritanceKind inheritanceKind = InheritanceKind.NONE;
		private String discriminatorColumn = null;
		private Map<Object, Class<? extends Entity>> discriminatorMap = emptyMap();

		Builder(Class<E> entityType) {
			this.entityType = requireNonNull(entityType);
		}

		public Builder<E> identifier(String... fieldNames) {
			this.identifierFieldNames = List.of(fieldNames);
			return this;
		}

		public Builder<E> field(String name) {
			return field(name, FieldType.PLAIN, Object.class);
		}

		public Builder<E> field(String name, Class<?> javaType) {
			return field(name, FieldType.PLAIN, javaType);
		}

		public Builder<E> field(String name, FieldType type, Class<?> javaType) {
			if (type == FieldType.ENUMERATED) {
				throw new InvalidDescriptorException("Use enumField to declare " + entityType.getSimpleName() + "." + name);
			}
			return addField(new FieldDefinition(name, type, javaType, emptyList()));
		}

		public Builder<E> booleanField(String name) {
			return field(name, FieldType.BOOLEAN, Boolean.class);
		}

		public Builder<E> arrayField(String name, Class<?> javaType) {
			return field(name, FieldType.ARRAY, javaType);
		}

		public Builder<E> objectField(String name, Class<?> javaType) {
			return field(name, FieldType.OBJECT, javaType);
		}

		public Builder<E> compressedTextField(String name) {
			return field(name, FieldType.COMPRESSED_TEXT, String.class);
		}

		/**
		 * @param values the allowed values; each one's code is its position in this list
		 */
		public Builder<E> enumField(String name, List<?> values) {
			if (values.isEmpty()) {
				throw new InvalidDescriptorException("Enumerated field " + entityType.getSimpleName() + "." + name + " has no values");
			}
			return addField(new FieldDefinition(name, FieldType.ENUMERATED, Object.class, List.copyOf(values)));
		}

		public <T extends Enum<T>> Builder<E> enumField(String name, Class<T> enumType) {
			return addField(new FieldDefinition(name, FieldType.ENUMERATED, enumType, Arrays.asList(enumType.getEnumConstants())));
		}

		private Builder<E> addField(FieldDefinition field) {
			FieldDefinition old = fields.put(field.name(), field);
			if (old == null) {
				return this;
			} else {
				throw new InvalidDescriptorException("Field \"" + field.name() + "\" declared twice in " + entityType.getSimpleName());
			}
		}

		public Builder<E> relation(RelationDescriptor relation) {
			RelationDescriptor old = relations.put(relation.name(), relation);
			if (old == null) {
				return this;
			} else {
				throw new InvalidDescriptorException("Relation \"" + relation.name() + "\" declared twice in " + entityType.getSimpleName());
			}
		}

		/**
		 * A lazily loaded one-to-one relation.
		 *
		 * @param foreignField null to join on the related entity's identifier
		 */
		public Builder<E> oneToOne(String name, Class<? extends Entity> targetType, OwningSide owningSide, @Nullable String localField, @Nullable String foreignField) {
			return relation(new RelationDescriptor(name, targetType, RelationShape.ONE_TO_ONE, owningSide, true, localField, foreignField));
		}

		/**
		 * A lazily loaded one-to-many relation, keyed by the related entity's <code>foreignField</code>.
		 */
		public Builder<E> oneToMany(String name, Class<? extends Entity> targetType, @Nullable String localField, String foreignField) {
			return relation(new RelationDescriptor(name, targetType, RelationShape.ONE_TO_MANY, OwningSide.FOREIGN, true, localField, foreignField));
		}

		/**
		 * A lazily loaded many-to-many relation through an association table.
		 */
		public Builder<E> manyToMany(String name, Class<? extends Entity> targetType) {
			return relation(new RelationDescriptor(name, targetType, RelationShape.MANY_TO_MANY, OwningSide.LOCAL, true, null, null));
		}

		public Builder<E> accessor(String name, FieldAccessor<E> accessor) {
			accessors.put(name, requireNonNull(accessor));
			return this;
		}

		public Builder<E> mutator(String name, FieldMutator<E> mutator) {
			mutators.put(name, requireNonNull(mutator));
			return this;
		}

		/**
		 * @param discriminatorMap discriminator value to concrete class, shared by every class in the hierarchy
		 */
		public Builder<E> inheritance(InheritanceKind kind, String discriminatorColumn, Map<Object, Class<? extends Entity>> discriminatorMap) {
			this.inheritanceKind = requireNonNull(kind);
			this.discriminatorColumn = discriminatorColumn;
			this.discriminatorMap = new LinkedHashMap<>(discriminatorMap);
			return this;
		}

		/**
		 * Can be called more than once.
		 *
		 * @throws InvalidDescriptorException if the description is inconsistent
		 */
		public EntityClass build() {
			validate();
			return new EntityClass(
				entityType,
				identifierFieldNames,
				unmodifiableMap(new LinkedHashMap<>(fields)),
				unmodifiableMap(new LinkedHashMap<>(relations)),
				unmodifiableMap(new LinkedHashMap<>(accessors)),
				unmodifiableMap(new LinkedHashMap<>(mutators)),
				inheritanceKind,
				discriminatorColumn,
				unmodifiableMap(new LinkedHashMap<>(discriminatorMap)));
		}

		private void validate() {
			String className = entityType.getSimpleName();
			if (identifierFieldNames.isEmpty()) {
				throw new InvalidDescriptorException(className + " has no identifier");
			}
			for (String name: identifierFieldNames) {
				if (!fields.containsKey(name)) {
					throw new InvalidDescriptorException("Identifier \"" + name + "\" is not a field of " + className);
				}
			}
			for (RelationDescriptor relation: relations.values()) {
				if (fields.containsKey(relation.name())) {
					throw new InvalidDescriptorException("\"" + relation.name() + "\" is both a field and a relation of " + className);
				}
				if (relation.shape() == RelationShape.ONE_TO_ONE) {
					if (relation.owningSide() == OwningSide.LOCAL && !fields.containsKey(relation.localField())) {
						throw new InvalidDescriptorException("Relation \"" + relation.name() + "\" of " + className + " needs a local field; got " + relation.localField());
					} else if (relation.owningSide() == OwningSide.FOREIGN && relation.foreignField() == null) {
						throw new InvalidDescriptorException("Relation \"" + relation.name() + "\" of " + className + " needs a foreign field");
					}
				}
			}
			for (String name: accessors.keySet()) {
				checkDeclared(name, "accessor");
			}
			for (String name: mutators.keySet()) {
				checkDeclared(name, "mutator");
			}
			if (inheritanceKind.usesDiscriminator()) {
				if (discriminatorColumn == null || !fields.containsKey(discriminatorColumn)) {
					throw new InvalidDescriptorException("Discriminator column of " + className + " must be a declared field; got " + discriminatorColumn);
				}
				if (!discriminatorMap.containsValue(entityType)) {
					throw new InvalidDescriptorException("Discriminator map " + discriminatorMap + " has no entry for " + className);
				}
			}
		}

		private void checkDeclared(String name, String hookKind) {
			if (!fields.containsKey(name) && !relations.containsKey(name)) {
				throw new InvalidDescriptorException("Custom " + hookKind + " for undeclared \"" + name + "\" in " + entityType.getSimpleName());
			}
		}
	}
}
