package io.vena.strata.exceptions;

/**
 * Thrown when a name given to an entity accessor or mutator is declared
 * neither as a field nor as a relation of the entity's class.
 */
public class InvalidFieldException extends IllegalArgumentException {
	public InvalidFieldException(String message) { super(message); }
	public InvalidFieldException(String message, Throwable cause) { super(message, cause); }
	public InvalidFieldException(Throwable cause) { super(cause); }
}
