package ru.datana.integration.dataparc.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a fresh store connection. Callers own and close it.
 */
@FunctionalInterface
public interface ConnectionFactory {
	Connection open() throws SQLException;
}
