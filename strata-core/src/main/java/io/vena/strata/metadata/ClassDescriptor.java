package io.vena.strata.metadata;

import io.vena.strata.Entity;
import io.vena.strata.exceptions.InvalidDescriptorException;
import io.vena.strata.exceptions.InvalidFieldException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The schema of one entity class: its fields, relations, identifier and inheritance mapping.
 *
 * <p>
 * Descriptors are immutable and shared by every instance of the class they describe.
 * Entities hold a reference to their descriptor; they never copy or modify it.
 *
 * @see EntityClass
 */
public interface ClassDescriptor {
	Class<? extends Entity> entityType();

	/**
	 * @return the identifier field names, in key order. Never empty.
	 */
	List<String> identifierFieldNames();

	default boolean isIdentifierComposite() {
		return identifierFieldNames().size() > 1;
	}

	default boolean isIdentifier(String fieldName) {
		return identifierFieldNames().contains(fieldName);
	}

	/**
	 * @throws IllegalStateException if the identifier is composite
	 */
	default String singleIdentifierFieldName() {
		List<String> names = identifierFieldNames();
		if (names.size() == 1) {
			return names.get(0);
		} else {
			throw new IllegalStateException(entityType().getSimpleName() + " has a composite identifier " + names);
		}
	}

	boolean hasField(String name);

	boolean hasRelation(String name);

	/**
	 * @throws InvalidFieldException if there's no such relation
	 */
	RelationDescriptor getRelation(String name);

	/**
	 * @return the storage type of the given field, or {@link FieldType#PLAIN} if the field is not declared
	 */
	FieldType fieldType(String name);

	/**
	 * @return the in-memory type of the given field, or <code>Object.class</code> if the field is not declared
	 */
	Class<?> fieldJavaType(String name);

	/**
	 * @throws InvalidDescriptorException if the field is not enumerated or <code>value</code> is not one of its values
	 */
	int enumCodeOf(String fieldName, Object value);

	/**
	 * @throws InvalidDescriptorException if the field is not enumerated or <code>code</code> is out of range
	 */
	Object enumValueOf(String fieldName, int code);

	Optional<FieldAccessor<?>> customAccessor(String name);

	Optional<FieldMutator<?>> customMutator(String name);

	InheritanceKind inheritanceKind();

	/**
	 * @return the discriminator column, or null when {@link #inheritanceKind()} is {@link InheritanceKind#NONE NONE}
	 */
	@Nullable String discriminatorColumn();

	/**
	 * @return discriminator value to concrete entity class
	 */
	Map<Object, Class<? extends Entity>> discriminatorMap();
}
