package io.vena.strata.metadata;

import io.vena.strata.Entity;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Describes an association from one entity class to another.
 *
 * @param localField the field of the declaring entity involved in the join
 * @param foreignField the field of the related entity involved in the join;
 *                     for a {@link OwningSide#LOCAL LOCAL} one-to-one relation, null means
 *                     the related entity's identifier.
 */
public record RelationDescriptor(
	String name,
	Class<? extends Entity> targetType,
	RelationShape shape,
	OwningSide owningSide,
	boolean lazilyLoaded,
	@Nullable String localField,
	@Nullable String foreignField
) {
	public RelationDescriptor {
		requireNonNull(name);
		requireNonNull(targetType);
		requireNonNull(shape);
		requireNonNull(owningSide);
	}

	public RelationDescriptor withLazilyLoaded(boolean lazilyLoaded) {
		return new RelationDescriptor(name, targetType, shape, owningSide, lazilyLoaded, localField, foreignField);
	}

	public boolean isToMany() {
		return shape.isToMany();
	}
}
