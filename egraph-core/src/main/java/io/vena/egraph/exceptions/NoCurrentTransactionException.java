package io.vena.egraph.exceptions;

import io.vena.egraph.TransformationTransaction;

/**
 * Thrown by {@link TransformationTransaction#apply} and {@link TransformationTransaction#cancel}
 * when no transaction has been started with {@link TransformationTransaction#begin()}.
 *
 * <p>
 * Checked, because the remedy is simple and belongs to the caller: call <code>begin</code> first.
 */
public class NoCurrentTransactionException extends Exception {
	public NoCurrentTransactionException(String message) { super(message); }
	public NoCurrentTransactionException(String message, Throwable cause) { super(message, cause); }
	public NoCurrentTransactionException(Throwable cause) { super(cause); }
}
