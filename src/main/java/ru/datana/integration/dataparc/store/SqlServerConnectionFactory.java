package ru.datana.integration.dataparc.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import ru.datana.integration.dataparc.config.ConnectorSettings;

/**
 * Opens connections to the DataParc SQL Server through the Microsoft JDBC driver.
 * The server may be given as {@code host}, {@code host:port} or {@code host\instance}.
 */
@Slf4j
@RequiredArgsConstructor
public class SqlServerConnectionFactory implements ConnectionFactory {
	private final ConnectorSettings settings;

	@Override
	public Connection open() throws SQLException {
		var url = buildUrl();
		log.debug("Opening connection to {} as {}", url, settings.getUser());
		var info = new Properties();
		info.setProperty("user", settings.getUser());
		info.setProperty("password", settings.getPassword());
		return DriverManager.getConnection(url, info);
	}

	String buildUrl() {
		return "jdbc:sqlserver://%s;databaseName=%s;loginTimeout=%d;encrypt=%s;trustServerCertificate=%s".formatted(
				settings.getServer(), settings.getDatabase(), settings.getLoginTimeout(), settings.isEncrypt(),
				settings.isTrustServerCertificate());
	}
}
