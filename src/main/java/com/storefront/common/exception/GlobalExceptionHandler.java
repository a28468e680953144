package com.storefront.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Maps exceptions to RFC 7807 problem responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://storefront.dev/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.error("Request failed with {}: {}", errorCode, e.getMessage(), e);
        } else {
            log.warn("Request rejected with {}: {}", errorCode, e.getMessage());
        }
        ProblemDetail problem = problem(errorCode, e.getMessage());
        if (e instanceof InsufficientStockException shortage) {
            problem.setProperty("available", shortage.getAvailable());
            problem.setProperty("requested", shortage.getRequested());
        }
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(problem(ErrorCode.INVALID_INPUT, detail));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemDetail> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(problem(ErrorCode.INVALID_INPUT, ErrorCode.INVALID_INPUT.getMessage()));
    }

    // Lock timeouts and deadlocks that outlived the settlement retries
    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ProblemDetail> handleConcurrencyFailure(ConcurrencyFailureException e) {
        log.warn("Concurrent update conflict: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(problem(ErrorCode.SERVICE_UNAVAILABLE, "Resource busy, retry the request"));
    }

    private static ProblemDetail problem(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase(Locale.ROOT)));
        problem.setProperty("code", errorCode.name());
        return problem;
    }
}
