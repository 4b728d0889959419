package io.vena.strata.exceptions;

/**
 * Thrown by the hook-free, non-loading field accessor when the requested name
 * is neither a loaded field nor a loaded reference.
 * This indicates a programming error in code that assumed the value was already present.
 */
public class UnknownFieldException extends IllegalArgumentException {
	public UnknownFieldException(String message) { super(message); }
	public UnknownFieldException(String message, Throwable cause) { super(message, cause); }
	public UnknownFieldException(Throwable cause) { super(cause); }
}
