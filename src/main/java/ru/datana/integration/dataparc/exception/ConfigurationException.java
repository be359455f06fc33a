package ru.datana.integration.dataparc.exception;

public class ConfigurationException extends RuntimeException {
	private static final long serialVersionUID = -1598457260339816252L;

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
