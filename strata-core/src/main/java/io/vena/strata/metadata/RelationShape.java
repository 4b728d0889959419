package io.vena.strata.metadata;

public enum RelationShape {
	ONE_TO_ONE,
	ONE_TO_MANY,
	MANY_TO_MANY,

	;

	public boolean isToMany() {
		return this != ONE_TO_ONE;
	}
}
