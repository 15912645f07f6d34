package com.tony.theoryEngine.exception;

import com.tony.theoryEngine.model.dto.ApiError;
import com.tony.theoryEngine.model.dto.ApiErrorDetail;
import com.tony.theoryEngine.model.engine.ReasonCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .toList();
        return buildError(HttpStatus.BAD_REQUEST, ReasonCode.INVALID_CONFIGURATION, "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .issue(violation.getMessage())
                        .build())
                .toList();
        return buildError(HttpStatus.BAD_REQUEST, ReasonCode.INVALID_CONFIGURATION, "Validation failed", details, request, ex);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, ReasonCode.INVALID_CONFIGURATION, "Malformed request body", List.of(), request, ex);
    }

    @ExceptionHandler(TheoryConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(TheoryConfigurationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = List.of(ApiErrorDetail.builder()
                .field(ex.getField())
                .issue(ex.getMessage())
                .build());
        return buildError(HttpStatus.BAD_REQUEST, ex.getReasonCode(), ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(RunNotFoundException ex, HttpServletRequest request) {
        return buildError(HttpStatus.NOT_FOUND, ReasonCode.RUN_NOT_FOUND, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ApiError> handleUpstream(UpstreamUnavailableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, ReasonCode.UPSTREAM_UNAVAILABLE, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(OperationTimeoutException.class)
    public ResponseEntity<ApiError> handleTimeout(OperationTimeoutException ex, HttpServletRequest request) {
        return buildError(HttpStatus.GATEWAY_TIMEOUT, ReasonCode.OPERATION_TIMEOUT, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("❌ Erreur inattendue sur {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, ReasonCode.INTERNAL_ERROR, "Unexpected error", List.of(), request, ex);
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, ReasonCode reasonCode, String message,
                                                List<ApiErrorDetail> details, HttpServletRequest request, Exception ex) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .reasonCode(reasonCode)
                .message(message)
                .details(details)
                .build();
        if (status.is4xxClientError()) {
            log.info("{} {} -> {} [{}] {}", request.getMethod(), request.getRequestURI(), status.value(), reasonCode.getCode(), message);
        } else {
            log.warn("{} {} -> {} [{}] {}", request.getMethod(), request.getRequestURI(), status.value(), reasonCode.getCode(), message);
        }
        return ResponseEntity.status(status).body(error);
    }
}
