package io.vena.strata.exceptions;

public class UnknownReferenceException extends IllegalArgumentException {
	public UnknownReferenceException(String message) { super(message); }
	public UnknownReferenceException(String message, Throwable cause) { super(message, cause); }
	public UnknownReferenceException(Throwable cause) { super(cause); }
}
