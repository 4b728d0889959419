package io.vena.strata.exceptions;

public class InvalidDescriptorException extends IllegalArgumentException {
	public InvalidDescriptorException(String message) { super(message); }
	public InvalidDescriptorException(String message, Throwable cause) { super(message, cause); }
	public InvalidDescriptorException(Throwable cause) { super(cause); }
}
