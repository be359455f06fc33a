package ru.datana.integration.dataparc.exception;

import static lombok.AccessLevel.PRIVATE;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import ru.datana.integration.dataparc.controller.TagDataController;
import ru.datana.integration.dataparc.response.ResponseEnvelope;

/**
 * Request binding failures never reach the connector; they are answered with a
 * 400 envelope so HTTP callers see one response shape.
 */
@RestControllerAdvice(basePackageClasses = TagDataController.class)
@NoArgsConstructor(access = PRIVATE)
@Slf4j
public class GlobalExceptionHandler {
	private static final String INVALID_VALUE_ERROR = "Invalid value for parameter '%s'";

	/**
	 * Override exception handler for MethodArgumentTypeMismatchException
	 */
	@ExceptionHandler
	public ResponseEntity<ResponseEnvelope<Void>> handle(MethodArgumentTypeMismatchException e) {
		log.debug("Bad parameter {}: {}", e.getName(), e.getMessage());
		return buildResponse(INVALID_VALUE_ERROR.formatted(e.getName()));
	}

	/**
	 * Override exception handler for MissingServletRequestParameterException
	 */
	@ExceptionHandler
	public ResponseEntity<ResponseEnvelope<Void>> handle(MissingServletRequestParameterException e) {
		return buildResponse(e.getMessage());
	}

	private static ResponseEntity<ResponseEnvelope<Void>> buildResponse(String message) {
		ResponseEnvelope<Void> envelope = ResponseEnvelope.badRequest(message);
		return ResponseEntity.badRequest().body(envelope);
	}
}
