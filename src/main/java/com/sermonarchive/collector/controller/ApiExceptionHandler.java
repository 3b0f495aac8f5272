package com.sermonarchive.collector.controller;

import com.sermonarchive.collector.exception.IngestionAlreadyRunningException;
import com.sermonarchive.collector.exception.SermonNotFoundException;
import com.sermonarchive.collector.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> missingParameter(MissingServletRequestParameterException e) {
        return error(HttpStatus.BAD_REQUEST, "Missing " + e.getParameterName() + " parameter");
    }

    @ExceptionHandler(SermonNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(SermonNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "Sermon not found");
    }

    @ExceptionHandler(IngestionAlreadyRunningException.class)
    public ResponseEntity<Map<String, String>> conflict(IngestionAlreadyRunningException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(StoreUnavailableException e) {
        log.error("Metadata store unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Metadata store unavailable");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, String>> storeError(DataAccessException e) {
        log.error("Database error while serving request", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> unexpected(Exception e) {
        if (e instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.resolve(framework.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                return error(status, status.getReasonPhrase());
            }
        }
        log.error("Unhandled error while serving request", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
