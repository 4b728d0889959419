package io.vena.strata.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when the value assigned to a relation doesn't have the shape the relation requires:
 * a collection for to-many relations, a single entity for to-one relations.
 */
@Getter
@Accessors(fluent = true)
public class InvalidReferenceException extends IllegalArgumentException {
	private final Kind kind;

	public enum Kind {
		ONE_TO_MANY,
		ONE_TO_ONE,
		MANY_TO_MANY,
	}

	public InvalidReferenceException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public static InvalidReferenceException oneToMany(String relationName, Object value) {
		return new InvalidReferenceException(Kind.ONE_TO_MANY,
			"One-to-many relation \"" + relationName + "\" requires an EntityCollection; got " + describe(value));
	}

	public static InvalidReferenceException oneToOne(String relationName, Object value) {
		return new InvalidReferenceException(Kind.ONE_TO_ONE,
			"One-to-one relation \"" + relationName + "\" requires a single Entity; got " + describe(value));
	}

	public static InvalidReferenceException manyToMany(String relationName, Object value) {
		return new InvalidReferenceException(Kind.MANY_TO_MANY,
			"Many-to-many relation \"" + relationName + "\" requires an EntityCollection; got " + describe(value));
	}

	private static String describe(Object value) {
		return value.getClass().getSimpleName();
	}
}
