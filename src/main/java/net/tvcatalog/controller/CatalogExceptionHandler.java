package net.tvcatalog.controller;

import lombok.extern.slf4j.Slf4j;
import net.tvcatalog.controller.support.ErrorResponseUtils;
import net.tvcatalog.exception.InvalidDateRangeException;
import net.tvcatalog.exception.PaginationException;
import net.tvcatalog.exception.ResourceNotFoundException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps request-scoped failures to {@code {"error": "..."}} responses.
 */
@RestControllerAdvice
@Slf4j
public class CatalogExceptionHandler {

    @ExceptionHandler(PaginationException.class)
    public ResponseEntity<Map<String, String>> handlePagination(PaginationException ex) {
        log.debug("Rejected pagination parameters: {}", ex.getMessage());
        return ErrorResponseUtils.badRequest(ex.getMessage());
    }

    @ExceptionHandler(InvalidDateRangeException.class)
    public ResponseEntity<Map<String, String>> handleDateRange(InvalidDateRangeException ex) {
        return ErrorResponseUtils.badRequest(ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ErrorResponseUtils.badRequest("invalid " + ex.getName());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ResourceNotFoundException ex) {
        return ErrorResponseUtils.notFound(ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, String>> handleDataAccess(DataAccessException ex) {
        log.error("Catalog store query failed: {}", ex.getMessage(), ex);
        return ErrorResponseUtils.error(HttpStatus.INTERNAL_SERVER_ERROR, "database error");
    }
}
