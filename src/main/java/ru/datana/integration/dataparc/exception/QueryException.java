package ru.datana.integration.dataparc.exception;

/**
 * Failure raised while talking to the historian store. The message carries the
 * underlying cause.
 */
public abstract class QueryException extends RuntimeException {
	private static final long serialVersionUID = 4817034418906521730L;

	protected QueryException(String message, Throwable cause) {
		super(message, cause);
	}
}
