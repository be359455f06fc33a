package ru.datana.integration.dataparc.controller;

import static org.springframework.format.annotation.DateTimeFormat.ISO.DATE_TIME;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import ru.datana.integration.dataparc.model.TagMeasurement;
import ru.datana.integration.dataparc.response.ResponseEnvelope;
import ru.datana.integration.dataparc.service.DataParcConnector;

/**
 * HTTP view of {@link DataParcConnector}. The HTTP status mirrors the envelope's status code.
 */
@RestController
@RequestMapping("dataparc")
@RequiredArgsConstructor
@Slf4j
public class TagDataController {
	private final DataParcConnector connector;

	@Operation(summary = "Check that the historian database is reachable")
	@ApiResponses(value = { @ApiResponse(responseCode = "200", description = "Connection successful"),
			@ApiResponse(responseCode = "500", description = "Database or unexpected error") })
	@GetMapping("/connection")
	public ResponseEntity<ResponseEnvelope<Void>> checkConnection() {
		log.debug("Check connection");
		return toEntity(connector.checkConnection());
	}

	@Operation(summary = "Latest value of every tag")
	@ApiResponses(value = { @ApiResponse(responseCode = "200", description = "Latest value per tag"),
			@ApiResponse(responseCode = "400", description = "Tag list is empty"),
			@ApiResponse(responseCode = "500", description = "Database or unexpected error") })
	@GetMapping("/tags/latest")
	public ResponseEntity<ResponseEnvelope<Map<String, TagMeasurement>>> latest(
			@Parameter(description = "Tag names", example = "Line1.Temp,Line1.Speed") @RequestParam(required = false) List<String> tags) {
		log.debug("Latest values of {}", tags);
		return toEntity(connector.fetchLatestValues(tags));
	}

	@Operation(summary = "Raw samples of every tag in a time range")
	@ApiResponses(value = { @ApiResponse(responseCode = "200", description = "Raw samples per tag"),
			@ApiResponse(responseCode = "400", description = "Tag list is empty or range is invalid"),
			@ApiResponse(responseCode = "500", description = "Database or unexpected error") })
	@GetMapping("/tags/raw")
	public ResponseEntity<ResponseEnvelope<Map<String, List<TagMeasurement>>>> raw(
			@RequestParam(required = false) List<String> tags,
			@Parameter(description = "Range start, historian local time", example = "2024-05-01T00:00:00") @RequestParam(required = false) @DateTimeFormat(iso = DATE_TIME) LocalDateTime start,
			@Parameter(description = "Range end, historian local time", example = "2024-05-02T00:00:00") @RequestParam(required = false) @DateTimeFormat(iso = DATE_TIME) LocalDateTime end) {
		log.debug("Raw data of {} between {} and {}", tags, start, end);
		return toEntity(connector.fetchRawData(tags, start, end));
	}

	@Operation(summary = "Interpolated or aggregated values of every tag over fixed steps")
	@ApiResponses(value = { @ApiResponse(responseCode = "200", description = "One value per step and tag"),
			@ApiResponse(responseCode = "400", description = "Tag list is empty, range is invalid or step is not positive"),
			@ApiResponse(responseCode = "500", description = "Database or unexpected error") })
	@GetMapping("/tags/interpolated")
	public ResponseEntity<ResponseEnvelope<Map<String, List<TagMeasurement>>>> interpolated(
			@RequestParam(required = false) List<String> tags,
			@RequestParam(required = false) @DateTimeFormat(iso = DATE_TIME) LocalDateTime start,
			@RequestParam(required = false) @DateTimeFormat(iso = DATE_TIME) LocalDateTime end,
			@Parameter(description = "Step in seconds", example = "60") @RequestParam int step,
			@Parameter(description = "Aggregation mode understood by the historian", example = "AVERAGE") @RequestParam String aggregate) {
		log.debug("Interpolated data of {} between {} and {}, {}s {}", tags, start, end, step, aggregate);
		return toEntity(connector.fetchInterpolatedData(tags, start, end, step, aggregate));
	}

	@Operation(summary = "Values of every tag at the given timestamps")
	@ApiResponses(value = { @ApiResponse(responseCode = "200", description = "Values per tag"),
			@ApiResponse(responseCode = "400", description = "Tag or timestamp list is empty"),
			@ApiResponse(responseCode = "500", description = "Database or unexpected error") })
	@GetMapping("/tags/at-times")
	public ResponseEntity<ResponseEnvelope<Map<String, List<TagMeasurement>>>> atTimes(
			@RequestParam(required = false) List<String> tags,
			@Parameter(description = "Timestamps, historian local time", example = "2024-05-01T08:00:00,2024-05-01T09:00:00") @RequestParam(required = false) @DateTimeFormat(iso = DATE_TIME) List<LocalDateTime> timestamps) {
		log.debug("Data of {} at {}", tags, timestamps);
		return toEntity(connector.fetchDataAtTimes(tags, timestamps));
	}

	private static <T> ResponseEntity<ResponseEnvelope<T>> toEntity(ResponseEnvelope<T> envelope) {
		return ResponseEntity.status(envelope.getStatusCode()).body(envelope);
	}
}
