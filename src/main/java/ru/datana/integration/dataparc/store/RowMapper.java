package ru.datana.integration.dataparc.store;

import java.util.Map;

/**
 * Converts one field-named record into a typed value.
 */
@FunctionalInterface
public interface RowMapper<T> {
	T map(Map<String, Object> record);
}
