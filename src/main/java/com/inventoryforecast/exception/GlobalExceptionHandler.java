package com.inventoryforecast.exception;

import com.inventoryforecast.config.RequestIdFilter;
import com.inventoryforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_ERROR",
                     "One or more fields failed validation", null, request, fieldErrors, null);
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<ApiError> handleConstraintViolation(Exception ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", "VALIDATION_ERROR",
                     ex.getMessage(), null, request, null, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "MALFORMED_REQUEST",
                     "Request body could not be parsed", null, request, null, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format(Locale.ROOT, "Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", "TYPE_MISMATCH", msg, null, request, null, null);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleDataValidation(ValidationException ex, HttpServletRequest request) {
        log.warn("Validation failed | stage={} | {}", ex.getStage(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", ex, request, null);
    }

    @ExceptionHandler(TrainingException.class)
    public ResponseEntity<ApiError> handleTraining(TrainingException ex, HttpServletRequest request) {
        log.warn("Training rejected | {} | failures={}", ex.getMessage(), ex.getFailures());
        Map<String, String> details = new LinkedHashMap<>();
        ex.getFailures().forEach((kind, reason) -> details.put(kind.name(), reason));
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Training Failed", ex, request,
                     details.isEmpty() ? null : details);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ApiError> handleInsufficientData(InsufficientDataException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Data", ex, request, null);
    }

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ArtifactNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex, request, null);
    }

    @ExceptionHandler(HolidayReferenceUnavailableException.class)
    public ResponseEntity<ApiError> handleHolidayUnavailable(
            HolidayReferenceUnavailableException ex, HttpServletRequest request) {
        log.error("Holiday reference unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Holiday Reference Unavailable", ex, request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                     "An unexpected error occurred", null, request, null, null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String error, DemandForecastException ex,
                                           HttpServletRequest request, Map<String, String> details) {
        return build(status, error, ex.getErrorCode(), ex.getMessage(), ex, request, null, details);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String errorCode, String message,
            DemandForecastException source, HttpServletRequest request,
            List<ApiError.FieldError> fieldErrors, Map<String, String> details) {

        Object attribute = request.getAttribute(RequestIdFilter.MDC_KEY);
        String reqId = attribute != null ? attribute.toString() : request.getHeader(RequestIdFilter.HEADER);

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .stage(source != null ? source.getStage() : null)
            .path(request.getRequestURI())
            .requestId(reqId)
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .details(details)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
