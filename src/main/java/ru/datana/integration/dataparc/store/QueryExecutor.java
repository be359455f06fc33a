package ru.datana.integration.dataparc.store;

import static ru.datana.integration.dataparc.util.LogConsts.IN_2;
import static ru.datana.integration.dataparc.util.LogConsts.OUT_1;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import ru.datana.integration.dataparc.exception.DatabaseException;
import ru.datana.integration.dataparc.exception.UnexpectedException;

/**
 * Runs one parameterized statement on its own connection. The connection,
 * statement and result set are closed on every exit path.
 */
@Slf4j
@RequiredArgsConstructor
public class QueryExecutor {
	private final ConnectionFactory connectionFactory;

	/**
	 * @param sql    statement with positional {@code ?} placeholders
	 * @param params values bound in order, never interpolated into {@code sql}
	 * @param mapper applied to every field-named record
	 * @return rows in store order, or a {@link DatabaseException} / {@link UnexpectedException} failure
	 */
	public <T> QueryOutcome<List<T>> execute(String sql, List<?> params, RowMapper<T> mapper) {
		log.debug(IN_2, sql, params);
		try (var connection = connectionFactory.open();
				var statement = connection.prepareStatement(sql)) {
			bind(statement, params);
			try (var resultSet = statement.executeQuery()) {
				var rows = readAll(resultSet, mapper);
				log.debug(OUT_1, "%d row(s)".formatted(rows.size()));
				return QueryOutcome.success(rows);
			}
		} catch (SQLException e) {
			log.error("Store rejected [{}]: {}", sql, e.getMessage());
			return QueryOutcome.failure(new DatabaseException(e));
		} catch (RuntimeException e) {
			log.error("Unexpected failure running [{}]", sql, e);
			return QueryOutcome.failure(new UnexpectedException(e));
		}
	}

	private static void bind(PreparedStatement statement, List<?> params) throws SQLException {
		for (int i = 0; i < params.size(); i++) {
			statement.setObject(i + 1, params.get(i));
		}
	}

	private static <T> List<T> readAll(ResultSet resultSet, RowMapper<T> mapper) throws SQLException {
		var meta = resultSet.getMetaData();
		var columns = new String[meta.getColumnCount()];
		for (int i = 0; i < columns.length; i++) {
			columns[i] = meta.getColumnLabel(i + 1);
		}
		var rows = new ArrayList<T>();
		while (resultSet.next()) {
			Map<String, Object> record = new LinkedHashMap<>();
			for (int i = 0; i < columns.length; i++) {
				record.put(columns[i], resultSet.getObject(i + 1));
			}
			rows.add(mapper.map(record));
		}
		return rows;
	}
}
