package com.contacthub.backend.global.error;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(RetryableProblemException.class)
    public ResponseEntity<ProblemResponse> handleRetryableProblem(RetryableProblemException ex, HttpServletRequest request) {
        return ResponseEntity.status(ex.getHttpStatus())
                .header(HttpHeaders.RETRY_AFTER, Long.toString(ex.getRetryAfterSeconds()))
                .body(ProblemResponse.of(ex, request.getRequestURI()));
    }

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblem(ProblemException ex, HttpServletRequest request) {
        return ResponseEntity.status(ex.getHttpStatus())
                .body(ProblemResponse.of(ex, request.getRequestURI()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = ProblemResponse.of(status, message, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        ProblemResponse body = ProblemResponse.of(status, "VALIDATION_ERROR", detail, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemResponse body = ProblemResponse.of(status, "INVALID_PARAMETER", ex.getName() + " has an invalid value", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemResponse body = ProblemResponse.of(status, "MALFORMED_BODY", "Request body could not be read", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({DataAccessResourceFailureException.class, CannotCreateTransactionException.class})
    public ResponseEntity<ProblemResponse> handleDependencyUnavailable(Exception ex, HttpServletRequest request) {
        log.error("Backing store unavailable on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ProblemResponse.dependencyUnavailable(request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled failure on {}", request.getRequestURI(), ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemResponse body = ProblemResponse.of(status, "INTERNAL_ERROR", "Internal Server Error", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
