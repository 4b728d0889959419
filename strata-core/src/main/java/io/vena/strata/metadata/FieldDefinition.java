package io.vena.strata.metadata;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * @param javaType the type a value of this field takes in memory; used to restore snapshots
 * @param enumValues for {@link FieldType#ENUMERATED} fields, the allowed values in code order; otherwise empty
 */
public record FieldDefinition(
	String name,
	FieldType type,
	Class<?> javaType,
	List<?> enumValues
) {
	public FieldDefinition {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(javaType);
		enumValues = List.copyOf(enumValues);
	}
}
