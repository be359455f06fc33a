package ru.datana.integration.dataparc.service;

import static java.util.stream.Collectors.toList;
import static ru.datana.integration.dataparc.store.HistorianQueries.CHECK;
import static ru.datana.integration.dataparc.store.HistorianQueries.DELIMITER;
import static ru.datana.integration.dataparc.store.HistorianQueries.READ_AT_TIME_TAGS;
import static ru.datana.integration.dataparc.store.HistorianQueries.READ_INTERPOLATED_TAGS;
import static ru.datana.integration.dataparc.store.HistorianQueries.READ_LAST_TAGS;
import static ru.datana.integration.dataparc.store.HistorianQueries.READ_RAW_TAGS;
import static ru.datana.integration.dataparc.util.LogConsts.IN_0;
import static ru.datana.integration.dataparc.util.LogConsts.IN_1;
import static ru.datana.integration.dataparc.util.LogConsts.IN_2;
import static ru.datana.integration.dataparc.util.LogConsts.IN_3;
import static ru.datana.integration.dataparc.util.LogConsts.OUT_1;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Joiner;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import ru.datana.integration.dataparc.config.ConnectorSettings;
import ru.datana.integration.dataparc.exception.DatabaseException;
import ru.datana.integration.dataparc.exception.QueryException;
import ru.datana.integration.dataparc.model.TagMeasurement;
import ru.datana.integration.dataparc.model.TagRow;
import ru.datana.integration.dataparc.response.ResponseEnvelope;
import ru.datana.integration.dataparc.store.QueryExecutor;
import ru.datana.integration.dataparc.store.QueryOutcome;

/**
 * Read-only access to DataParc tag history. Every operation returns a
 * {@link ResponseEnvelope}: 400 for invalid input (no store call is made), 500
 * for store or unexpected failures, 200 with the tag-keyed result otherwise.
 * <p>
 * Time arguments are wall-clock times of the historian. Returned timestamps
 * carry the configured zone.
 */
@Slf4j
@RequiredArgsConstructor
public class DataParcConnector {
	static final String EMPTY_TAGS = "Tag list cannot be empty";
	static final String INVALID_RANGE = "Start time must be before end time";
	static final String INVALID_STEP = "Step size must be greater than zero";
	static final String EMPTY_TIMESTAMPS = "Timestamps list cannot be empty";

	static final DateTimeFormatter AT_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private static final Joiner JOINER = Joiner.on(DELIMITER);

	@Getter
	private final ConnectorSettings settings;
	private final QueryExecutor executor;

	public ResponseEnvelope<Void> checkConnection() {
		log.debug(IN_0);
		var outcome = executor.execute(CHECK, List.of(), record -> record);
		ResponseEnvelope<Void> response;
		if (outcome.isSuccess()) {
			response = ResponseEnvelope.ok(null, "Connection successful");
		} else if (outcome.getFailure() instanceof DatabaseException e) {
			response = ResponseEnvelope.serverError("Database connection failed: %s".formatted(e.getMessage()));
		} else {
			response = ResponseEnvelope.serverError(
					"Unexpected error during connection check: %s".formatted(outcome.getFailure().getMessage()));
		}
		log.debug(OUT_1, response.getMessage());
		return response;
	}

	/**
	 * Latest reading per tag. Tags the store has no reading for are absent.
	 */
	public ResponseEnvelope<Map<String, TagMeasurement>> fetchLatestValues(Collection<String> tags) {
		log.debug(IN_1, tags);
		var names = tagNames(tags);
		if (names.isEmpty()) {
			return ResponseEnvelope.badRequest(EMPTY_TAGS);
		}
		var outcome = executor.execute(READ_LAST_TAGS, List.of(JOINER.join(names)), TagRow::from)
				.map(this::latestByTag);
		return respond(outcome, "latest values");
	}

	/**
	 * Every stored sample in {@code [start, end]} per tag, in store order.
	 */
	public ResponseEnvelope<Map<String, List<TagMeasurement>>> fetchRawData(Collection<String> tags,
			LocalDateTime start, LocalDateTime end) {
		log.debug(IN_3, tags, start, end);
		var names = tagNames(tags);
		if (names.isEmpty()) {
			return ResponseEnvelope.badRequest(EMPTY_TAGS);
		}
		if (!isRange(start, end)) {
			return ResponseEnvelope.badRequest(INVALID_RANGE);
		}
		var outcome = executor.execute(READ_RAW_TAGS, Arrays.asList(JOINER.join(names), start, end), TagRow::from)
				.map(this::seriesByTag);
		return respond(outcome, "raw data");
	}

	/**
	 * Server-side interpolation over fixed steps.
	 *
	 * @param stepSize  step in seconds
	 * @param aggregate aggregation mode name, passed to the store as is
	 */
	public ResponseEnvelope<Map<String, List<TagMeasurement>>> fetchInterpolatedData(Collection<String> tags,
			LocalDateTime start, LocalDateTime end, int stepSize, String aggregate) {
		log.debug(IN_3, tags, "%s..%s".formatted(start, end), "%ds %s".formatted(stepSize, aggregate));
		var names = tagNames(tags);
		if (names.isEmpty()) {
			return ResponseEnvelope.badRequest(EMPTY_TAGS);
		}
		if (!isRange(start, end)) {
			return ResponseEnvelope.badRequest(INVALID_RANGE);
		}
		if (stepSize <= 0) {
			return ResponseEnvelope.badRequest(INVALID_STEP);
		}
		var params = Arrays.asList(JOINER.join(names), start, end, aggregate, stepSize);
		var outcome = executor.execute(READ_INTERPOLATED_TAGS, params, TagRow::from).map(this::seriesByTag);
		return respond(outcome, "interpolated data");
	}

	/**
	 * Values at the given instants. How a missing sample is resolved is up to the store.
	 */
	public ResponseEnvelope<Map<String, List<TagMeasurement>>> fetchDataAtTimes(Collection<String> tags,
			Collection<LocalDateTime> timestamps) {
		log.debug(IN_2, tags, timestamps);
		var names = tagNames(tags);
		if (names.isEmpty()) {
			return ResponseEnvelope.badRequest(EMPTY_TAGS);
		}
		var times = timestamps == null ? List.<String>of()
				: timestamps.stream().filter(Objects::nonNull).map(AT_TIME_FORMAT::format).collect(toList());
		if (times.isEmpty()) {
			return ResponseEnvelope.badRequest(EMPTY_TIMESTAMPS);
		}
		var params = List.of(JOINER.join(names), JOINER.join(times));
		var outcome = executor.execute(READ_AT_TIME_TAGS, params, TagRow::from).map(this::seriesByTag);
		return respond(outcome, "data at specified times");
	}

	private <T> ResponseEnvelope<T> respond(QueryOutcome<T> outcome, String subject) {
		ResponseEnvelope<T> response;
		if (outcome.isSuccess()) {
			response = ResponseEnvelope.ok(outcome.getValue(), "Successfully fetched %s".formatted(subject));
		} else {
			response = ResponseEnvelope.serverError(failureMessage(outcome.getFailure(), subject));
		}
		log.debug(OUT_1, response.getMessage());
		return response;
	}

	private static String failureMessage(QueryException failure, String subject) {
		var kind = failure instanceof DatabaseException ? "Database error" : "Unexpected error";
		return "%s while fetching %s: %s".formatted(kind, subject, failure.getMessage());
	}

	private Map<String, TagMeasurement> latestByTag(List<TagRow> rows) {
		var zone = settings.getTimezone();
		var result = new LinkedHashMap<String, TagMeasurement>();
		rows.forEach(row -> result.put(row.getTagName(), row.attach(zone)));
		return result;
	}

	private Map<String, List<TagMeasurement>> seriesByTag(List<TagRow> rows) {
		var zone = settings.getTimezone();
		var result = new LinkedHashMap<String, List<TagMeasurement>>();
		rows.forEach(row -> result.computeIfAbsent(row.getTagName(), k -> new ArrayList<>())
				.add(row.attach(zone)));
		return result;
	}

	/**
	 * Null and blank names are dropped; an empty result means nothing to ask the store for.
	 */
	private static List<String> tagNames(Collection<String> tags) {
		if (tags == null) {
			return List.of();
		}
		return tags.stream().filter(StringUtils::isNotBlank).collect(toList());
	}

	private static boolean isRange(LocalDateTime start, LocalDateTime end) {
		return start != null && end != null && start.isBefore(end);
	}
}
