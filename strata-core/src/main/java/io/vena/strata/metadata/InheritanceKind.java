package io.vena.strata.metadata;

public enum InheritanceKind {
	NONE,
	SINGLE_TABLE,
	JOINED_TABLE,

	;

	/**
	 * @return true if rows written for this kind of mapping carry a discriminator column
	 */
	public boolean usesDiscriminator() {
		return this != NONE;
	}
}
