package ru.datana.integration.dataparc.exception;

public class UnexpectedException extends QueryException {
	private static final long serialVersionUID = 6623010457783416120L;

	public UnexpectedException(Throwable cause) {
		super("An unexpected error occurred: %s".formatted(cause.getMessage()), cause);
	}
}
