package com.sqlstage.web;

import com.sqlstage.api.ErrorResponse;
import com.sqlstage.service.ErrorKind;
import com.sqlstage.service.ExecutionFailedException;
import com.sqlstage.service.QueryServiceException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(QueryServiceException.class)
    public ResponseEntity<ErrorResponse> handleQueryServiceException(QueryServiceException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed: {} {}", ex.getKind(), ex.getMessage(), ex);
        } else {
            log.warn("Request rejected: {} {}", ex.getKind(), ex.getMessage());
        }

        ErrorResponse.ErrorResponseBuilder error = ErrorResponse.builder()
                .code(ex.getKind().name())
                .message(ex.getMessage())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID));
        if (ex instanceof ExecutionFailedException failed) {
            error.sqlState(failed.getSqlState()).vendorCode(failed.getVendorCode());
        } else if (ex.getCause() != null) {
            error.details(ex.getCause().getMessage());
        }
        return ResponseEntity.status(status).body(error.build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_FAILED")
                .message("Input validation failed")
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_FAILED")
                .message("Request body is missing or malformed")
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("INVALID_ARGUMENT")
                .message(ex.getMessage())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("NOT_FOUND")
                .message("Not found")
                .details(ex.getMessage())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);

        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("An unexpected error occurred")
                .details(ex.getMessage())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case EXECUTION_FAILED, INVALID_PAGE_INDEX -> HttpStatus.BAD_REQUEST;
            case RESULT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONNECTION_EXHAUSTED, NOT_CONNECTED, CACHE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case CONFIG_INVALID, RESULT_CORRUPT -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
