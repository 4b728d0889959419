package io.vena.strata.metadata;

/**
 * Which end of a relation holds the foreign key column.
 */
public enum OwningSide {
	/**
	 * This entity's table holds the key (the relation's local field refers to the other entity).
	 */
	LOCAL,

	/**
	 * The other entity's table holds the key (its foreign field refers back to this entity).
	 */
	FOREIGN,
}
