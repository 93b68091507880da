package io.vena.egraph.exceptions;

public class CyclicContainmentException extends IllegalArgumentException {
	public CyclicContainmentException(String message) { super(message); }
	public CyclicContainmentException(String message, Throwable cause) { super(message, cause); }
	public CyclicContainmentException(Throwable cause) { super(cause); }
}
