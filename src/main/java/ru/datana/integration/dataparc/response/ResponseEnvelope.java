package ru.datana.integration.dataparc.response;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.ALWAYS;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Uniform outcome of every connector operation.
 *
 * @param <T> payload type, {@code null} for failures and for the connection check
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(ALWAYS)
@JsonPropertyOrder({ "status_code", "result", "message" })
public class ResponseEnvelope<T> {
	public static final int OK = 200;
	public static final int BAD_REQUEST = 400;
	public static final int SERVER_ERROR = 500;

	@Schema(description = "HTTP-style status", requiredMode = Schema.RequiredMode.REQUIRED, example = "200")
	@JsonProperty("status_code")
	int statusCode;
	@Schema(description = "Payload, absent on failure", requiredMode = Schema.RequiredMode.NOT_REQUIRED)
	T result;
	@Schema(description = "Outcome description", requiredMode = Schema.RequiredMode.REQUIRED, example = "Successfully fetched raw data")
	String message;

	public static <T> ResponseEnvelope<T> of(int statusCode, T result, String message) {
		return new ResponseEnvelope<>(statusCode, result, message);
	}

	public static <T> ResponseEnvelope<T> ok(T result, String message) {
		return of(OK, result, message);
	}

	public static <T> ResponseEnvelope<T> badRequest(String message) {
		return of(BAD_REQUEST, null, message);
	}

	public static <T> ResponseEnvelope<T> serverError(String message) {
		return of(SERVER_ERROR, null, message);
	}
}
