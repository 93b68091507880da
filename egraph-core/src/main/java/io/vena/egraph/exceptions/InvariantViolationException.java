package io.vena.egraph.exceptions;

/**
 * Indicates that the graph tree reached a state that its own bookkeeping
 * says is impossible, such as an element whose parent does not list it as a child.
 * Not recoverable: the tree should be considered corrupt.
 */
public class InvariantViolationException extends IllegalStateException {
	public InvariantViolationException(String message) { super(message); }
	public InvariantViolationException(String message, Throwable cause) { super(message, cause); }
	public InvariantViolationException(Throwable cause) { super(cause); }
}
