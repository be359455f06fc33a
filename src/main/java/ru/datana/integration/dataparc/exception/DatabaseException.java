package ru.datana.integration.dataparc.exception;

/**
 * The store reported an error: rejected statement, login failure, transport error.
 */
public class DatabaseException extends QueryException {
	private static final long serialVersionUID = -3021583742105466513L;

	public DatabaseException(Throwable cause) {
		super("Database error occurred: %s".formatted(cause.getMessage()), cause);
	}
}
