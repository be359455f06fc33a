package ru.datana.integration.dataparc.store;

import static lombok.AccessLevel.PRIVATE;

import java.util.function.Function;

import lombok.AllArgsConstructor;
import lombok.Value;
import ru.datana.integration.dataparc.exception.QueryException;

/**
 * Result of a single store call: either a value or exactly one failure.
 */
@Value
@AllArgsConstructor(access = PRIVATE)
public class QueryOutcome<T> {
	T value;
	QueryException failure;

	public static <T> QueryOutcome<T> success(T value) {
		return new QueryOutcome<>(value, null);
	}

	public static <T> QueryOutcome<T> failure(QueryException failure) {
		return new QueryOutcome<>(null, failure);
	}

	public boolean isSuccess() {
		return failure == null;
	}

	public <R> QueryOutcome<R> map(Function<? super T, ? extends R> mapper) {
		return isSuccess() ? success(mapper.apply(value)) : failure(failure);
	}
}
