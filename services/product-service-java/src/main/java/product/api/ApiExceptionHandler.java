package product.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import product.api.dto.ErrorResponse;
import product.config.ProductServiceProperties;
import product.service.error.ConflictException;
import product.service.error.InternalErrorException;
import product.service.error.NotFoundException;
import product.service.error.Reason;
import product.service.error.ValidationException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String GENERIC_INTERNAL_MESSAGE = "unexpected failure";

    private final ProductServiceProperties properties;

    public ApiExceptionHandler(ProductServiceProperties properties) {
        this.properties = properties;
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.warn("Rejected product request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST.value(), ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        log.warn("Referenced entity missing: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND.value(), ex.getMessage());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex) {
        if (ex.getReason() == Reason.INTEGRITY_VIOLATION) {
            log.warn("Constraint violation while creating product", ex.getCause());
            return error(properties.getErrors().getIntegrityViolationStatus(), ex.getMessage());
        }
        log.warn("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT.value(), ex.getMessage());
    }

    @ExceptionHandler(InternalErrorException.class)
    public ResponseEntity<ErrorResponse> handleInternal(InternalErrorException ex) {
        log.error("Product creation failed", ex.getCause());
        return internalError(ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST.value(), "Invalid request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        // Spring MVC's own failures (405, 415, ...) keep their status.
        if (ex instanceof org.springframework.web.ErrorResponse mvc) {
            log.warn("Request failed: {}", ex.getMessage());
            var detail = mvc.getBody().getDetail();
            return error(mvc.getStatusCode().value(), detail == null ? ex.getMessage() : detail);
        }
        log.error("Unexpected error", ex);
        return internalError(ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> internalError(String detail) {
        var shown = properties.getErrors().isExposeInternalMessages() && detail != null
                ? detail
                : GENERIC_INTERNAL_MESSAGE;
        return error(HttpStatus.INTERNAL_SERVER_ERROR.value(), Reason.UNEXPECTED.getMessage() + ": " + shown);
    }

    private static ResponseEntity<ErrorResponse> error(int status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(message));
    }
}
