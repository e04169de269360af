package com.zomato.common.exception;

import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Maps exceptions to RFC 9457 ProblemDetail responses.
 *
 * <p>Response example:
 * <pre>{@code
 * {
 *   "type": "https://zomato.example/errors/menu_item_not_found",
 *   "title": "Menu item not found",
 *   "status": 404,
 *   "detail": "Menu item 999 not found"
 * }
 * }</pre></p>
 *
 * <p>INTERNAL_ERROR never leaks the underlying message to the client; the cause
 * is logged here instead.</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://zomato.example/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode == ErrorCode.INTERNAL_ERROR) {
            log.error("Internal error: {}", e.getMessage(), e.getCause() != null ? e.getCause() : e);
            return problem(errorCode, errorCode.getMessage());
        }
        log.warn("Business exception: code={}, detail={}", errorCode, e.getMessage());
        return problem(errorCode, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", detail);
        return problem(ErrorCode.INVALID_INPUT, detail.isEmpty() ? ErrorCode.INVALID_INPUT.getMessage() : detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemDetail> handleUnreadableInput(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return problem(ErrorCode.INVALID_INPUT, ErrorCode.INVALID_INPUT.getMessage());
    }

    // Resilience4j rate limiter on /api/**
    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceeded(RequestNotPermitted e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        return problem(ErrorCode.RATE_LIMIT_EXCEEDED, ErrorCode.RATE_LIMIT_EXCEEDED.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemDetail> handleNoRoute(NoResourceFoundException e) {
        return problem(ErrorCode.ROUTE_NOT_FOUND, ErrorCode.ROUTE_NOT_FOUND.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleException(Exception e) {
        log.error("Unexpected error", e);
        return problem(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage());
    }

    private ResponseEntity<ProblemDetail> problem(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        problem.setTitle(errorCode.getMessage());
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }

    private String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
