package com.linkresolver.common.exception;

import com.linkresolver.common.dto.ErrorResponseDTO;
import com.linkresolver.common.util.SensitiveDataFilter;
import io.swagger.v3.oas.annotations.Hidden;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;

@RestControllerAdvice
@Order(1) // Lower priority to let SpringDoc handle its own exceptions first
@Hidden // Exclude from SpringDoc/OpenAPI scanning
@Slf4j
public class GlobalExceptionHandler {

	private static final String URI_PREFIX = "uri=";
	private static final String UNKNOWN_PATH = "unknown";
	private static final String FAVICON_PATH = "favicon.ico";
	private static final String SPRINGDOC_API_DOCS_PATH = "/v3/api-docs";
	private static final String SPRINGDOC_SWAGGER_UI_PATH = "/swagger-ui";

	private static final String UNEXPECTED_ERROR_MESSAGE = "An unexpected error occurred";
	private static final String INVALID_ARGUMENT_MESSAGE = "Invalid argument provided";
	private static final String UNKNOWN_ERROR_MESSAGE = "Unknown error";

	private static final String ERROR_CODE_NOT_FOUND = "NOT_FOUND";
	private static final String ERROR_CODE_RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
	private static final String ERROR_CODE_VALIDATION_ERROR = "VALIDATION_ERROR";
	private static final String ERROR_CODE_INVALID_ARGUMENT = "INVALID_ARGUMENT";
	private static final String ERROR_CODE_INTERNAL_ERROR = "INTERNAL_ERROR";

	private static final int MAX_MESSAGE_LENGTH = 200;
	private static final String MESSAGE_TRUNCATION_SUFFIX = "...";

	/**
	 * Raised by the resolve endpoint when its request rate limiter rejects a call.
	 */
	@ExceptionHandler(RateLimitExceededException.class)
	public ResponseEntity<ErrorResponseDTO> handleRateLimitExceededException(RateLimitExceededException ex, WebRequest request) {
		log.warn("Rate limit exceeded: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_RATE_LIMIT_EXCEEDED, ex.getMessage(), HttpStatus.TOO_MANY_REQUESTS, request);
	}

	@ExceptionHandler(ConstraintViolationException.class)
	public ResponseEntity<ErrorResponseDTO> handleConstraintViolationException(ConstraintViolationException ex, WebRequest request) {
		log.error("Validation error: {}", ex.getMessage());
		String message = ex.getConstraintViolations().stream()
			.map(violation -> violation.getMessage())
			.reduce((a, b) -> String.format("%s, %s", a, b))
			.orElse(ex.getMessage());
		return buildErrorResponse(ERROR_CODE_VALIDATION_ERROR, message, HttpStatus.BAD_REQUEST, request);
	}

	@ExceptionHandler(MissingServletRequestParameterException.class)
	public ResponseEntity<ErrorResponseDTO> handleMissingParameterException(MissingServletRequestParameterException ex, WebRequest request) {
		log.error("Missing request parameter: {}", ex.getParameterName());
		return buildErrorResponse(ERROR_CODE_VALIDATION_ERROR, ex.getMessage(), HttpStatus.BAD_REQUEST, request);
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ErrorResponseDTO> handleIllegalArgumentException(IllegalArgumentException ex, WebRequest request) {
		log.error("Illegal argument: {}", ex.getMessage());
		String message = ex.getMessage() != null ? ex.getMessage() : INVALID_ARGUMENT_MESSAGE;
		return buildErrorResponse(ERROR_CODE_INVALID_ARGUMENT, message, HttpStatus.BAD_REQUEST, request);
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ResponseEntity<?> handleNoResourceFoundException(NoResourceFoundException ex, WebRequest request) {
		String path = extractPath(request);

		if (path.contains(FAVICON_PATH) || isSpringDocPath(path)) {
			log.debug("Ignored resource not found: {}", path);
			return ResponseEntity.notFound().build();
		}

		log.warn("Resource not found: {}", path);
		return buildErrorResponse(ERROR_CODE_NOT_FOUND, ex.getMessage(), HttpStatus.NOT_FOUND, request);
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponseDTO> handleGenericException(Exception ex, WebRequest request) {
		// Don't expose full exception details to client
		String errorMessage = truncateMessage(SensitiveDataFilter.maskSensitiveData(ex.getMessage()));

		log.error("Unexpected error: {}", errorMessage != null ? errorMessage : UNKNOWN_ERROR_MESSAGE, ex);
		return buildErrorResponse(ERROR_CODE_INTERNAL_ERROR, UNEXPECTED_ERROR_MESSAGE, HttpStatus.INTERNAL_SERVER_ERROR, request);
	}

	private ResponseEntity<ErrorResponseDTO> buildErrorResponse(String errorCode, String message,
	                                                             HttpStatus status, WebRequest request) {
		ErrorResponseDTO error = ErrorResponseDTO.builder()
			.errorCode(errorCode)
			.message(message)
			.timestamp(LocalDateTime.now())
			.path(extractPath(request))
			.build();
		return new ResponseEntity<>(error, status);
	}

	private String extractPath(WebRequest request) {
		try {
			String description = request.getDescription(false);
			if (StringUtils.isEmpty(description)) {
				return UNKNOWN_PATH;
			}
			return description.replace(URI_PREFIX, "");
		} catch (Exception e) {
			log.warn("Failed to extract path from request", e);
			return UNKNOWN_PATH;
		}
	}

	private boolean isSpringDocPath(String path) {
		return path.contains(SPRINGDOC_API_DOCS_PATH) || path.contains(SPRINGDOC_SWAGGER_UI_PATH);
	}

	private String truncateMessage(String message) {
		if (message == null) {
			return null;
		}
		if (message.length() > MAX_MESSAGE_LENGTH) {
			return message.substring(0, MAX_MESSAGE_LENGTH) + MESSAGE_TRUNCATION_SUFFIX;
		}
		return message;
	}
}
