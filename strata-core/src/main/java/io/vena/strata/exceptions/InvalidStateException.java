package io.vena.strata.exceptions;

public class InvalidStateException extends IllegalArgumentException {
	public InvalidStateException(String message) { super(message); }
	public InvalidStateException(String message, Throwable cause) { super(message, cause); }
	public InvalidStateException(Throwable cause) { super(cause); }
}
