package com.clipfeed.sampler.api;

import com.clipfeed.sampler.api.dto.ErrorResponse;
import com.clipfeed.sampler.catalog.CatalogAbortedException;
import com.clipfeed.sampler.catalog.CatalogResponseException;
import com.clipfeed.sampler.catalog.CatalogUnavailableException;
import com.clipfeed.sampler.common.InvalidRequestException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(InvalidRequestException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        HttpMediaTypeNotSupportedException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request", request);
    }

    @ExceptionHandler({CatalogUnavailableException.class, CatalogAbortedException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "catalog_unavailable", ex.getMessage(), request);
    }

    @ExceptionHandler(CatalogResponseException.class)
    public ResponseEntity<ErrorResponse> handleCatalogError(CatalogResponseException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, "catalog_error", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        RequestIds ids = RequestIds.from(request);
        logger.error(
            "unexpected_exception request_id={} trace_id={} method={} path={}",
            ids.getRequestId(),
            ids.getTraceId(),
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        ErrorResponse body = new ErrorResponse("internal_error", "Unexpected error", ids.getTraceId(), ids.getRequestId());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).headers(ids.toHeaders()).body(body);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, HttpServletRequest request) {
        RequestIds ids = RequestIds.from(request);
        ErrorResponse body = new ErrorResponse(code, message, ids.getTraceId(), ids.getRequestId());
        return ResponseEntity.status(status).headers(ids.toHeaders()).body(body);
    }
}
