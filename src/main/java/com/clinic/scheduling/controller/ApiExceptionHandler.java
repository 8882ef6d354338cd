package com.clinic.scheduling.controller;

import com.clinic.scheduling.dto.ErrorResponse;
import com.clinic.scheduling.exception.ErrorKind;
import com.clinic.scheduling.exception.SchedulingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures to {@link ErrorResponse} bodies with one HTTP status per {@link ErrorKind}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<ErrorResponse> handleScheduling(SchedulingException e) {
        if (e.getKind() == ErrorKind.SLOT_UNAVAILABLE || e.getKind() == ErrorKind.SLOT_CONFLICT) {
            log.info("{}: {}", e.getKind(), e.getMessage());
        } else {
            log.debug("{}: {}", e.getKind(), e.getMessage());
        }
        return respond(e.getKind(), e.getMessage());
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.debug("Rejected malformed request: {}", e.getMessage());
        String message = e instanceof MissingServletRequestParameterException missing
                ? "Missing request parameter '" + missing.getParameterName() + "'."
                : e instanceof MethodArgumentTypeMismatchException mismatch
                ? "Invalid value for '" + mismatch.getName() + "'."
                : "Malformed request body.";
        return respond(ErrorKind.VALIDATION, message);
    }

    // a concurrent writer bumped the slot version between our read and our write
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return respond(ErrorKind.SLOT_UNAVAILABLE, "The slot was changed concurrently; query it again.");
    }

    // lock timeout or deadlock victim
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handlePessimisticLock(PessimisticLockingFailureException e) {
        log.warn("Lost a lock to a concurrent transaction: {}", e.getMessage());
        return respond(ErrorKind.SLOT_UNAVAILABLE, "The slot is being changed concurrently; query it again.");
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case SLOT_UNAVAILABLE, SLOT_CONFLICT -> HttpStatus.CONFLICT;
            case INVALID_STATE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UNAUTHENTICATED -> HttpStatus.UNAUTHORIZED;
        };
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorKind kind, String message) {
        return ResponseEntity.status(statusOf(kind)).body(new ErrorResponse(kind, message));
    }
}
