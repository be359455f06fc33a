package ru.datana.integration.dataparc.store;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import ru.datana.integration.dataparc.model.TagRow;

/**
 * Result sets backed by in-memory rows, shaped like the SQL Server driver returns them.
 */
public final class JdbcMocks {
	private static final List<String> TAG_COLUMNS = List.of(TagRow.TAG_NAME, TagRow.TIMESTAMP, TagRow.VALUE,
			TagRow.QUALITY);

	private JdbcMocks() {
	}

	public static Map<String, Object> row(String tag, LocalDateTime timestamp, double value, int quality) {
		var row = new LinkedHashMap<String, Object>();
		row.put(TagRow.TAG_NAME, tag);
		row.put(TagRow.TIMESTAMP, Timestamp.valueOf(timestamp));
		row.put(TagRow.VALUE, value);
		row.put(TagRow.QUALITY, quality);
		return row;
	}

	public static ResultSet resultSet(List<Map<String, Object>> rows) throws SQLException {
		var columns = rows.isEmpty() ? TAG_COLUMNS : new ArrayList<>(rows.get(0).keySet());
		var meta = mock(ResultSetMetaData.class);
		lenient().when(meta.getColumnCount()).thenReturn(columns.size());
		lenient().when(meta.getColumnLabel(anyInt())).thenAnswer(inv -> columns.get(inv.<Integer>getArgument(0) - 1));

		var cursor = new AtomicInteger(-1);
		var resultSet = mock(ResultSet.class);
		lenient().when(resultSet.getMetaData()).thenReturn(meta);
		lenient().when(resultSet.next()).thenAnswer(inv -> cursor.incrementAndGet() < rows.size());
		lenient().when(resultSet.getObject(anyInt()))
				.thenAnswer(inv -> rows.get(cursor.get()).get(columns.get(inv.<Integer>getArgument(0) - 1)));
		return resultSet;
	}
}
