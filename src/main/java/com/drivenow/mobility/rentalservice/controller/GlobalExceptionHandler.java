
package com.drivenow.mobility.rentalservice.controller;


import com.drivenow.mobility.rentalservice.exception.ForbiddenException;
import com.drivenow.mobility.rentalservice.exception.ReservationConflictException;
import com.drivenow.mobility.rentalservice.exception.ReservationNotFoundException;
import com.drivenow.mobility.rentalservice.exception.ReservationValidationException;
import com.drivenow.mobility.rentalservice.exception.UnauthorizedException;
import com.drivenow.mobility.rentalservice.exception.VehicleNotFoundException;
import com.drivenow.mobility.rentalservice.service.lock.LockOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;


@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);


    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidationExceptions(MethodArgumentNotValidException ex, WebRequest request) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        err -> err.getDefaultMessage() != null ? err.getDefaultMessage() : "Invalid value",
                        (e1, e2) -> e1, LinkedHashMap::new));

        log.warn("Validation error on {}: {}", request.getDescription(false), errors);
        return buildProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Validation failed for request body",
                Map.of("errors", errors),
                request
        );
    }


    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Unreadable request body on {}: {}", request.getDescription(false), ex.getMostSpecificCause().getMessage());
        return buildProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Malformed request body: " + ex.getMostSpecificCause().getMessage(),
                null,
                request
        );
    }


    @ExceptionHandler({ReservationValidationException.class, IllegalArgumentException.class,
            MissingServletRequestParameterException.class, MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadRequest(Exception ex, WebRequest request) {
        log.warn("Rejected request on {}: {}", request.getDescription(false), ex.getMessage());
        return buildProblemDetail(
                HttpStatus.BAD_REQUEST,
                ex.getMessage(),
                null,
                request
        );
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ProblemDetail handleUnauthorized(UnauthorizedException ex, WebRequest request) {
        return buildProblemDetail(
                HttpStatus.UNAUTHORIZED,
                ex.getMessage(),
                null,
                request
        );
    }

    @ExceptionHandler(ForbiddenException.class)
    public ProblemDetail handleForbidden(ForbiddenException ex, WebRequest request) {
        return buildProblemDetail(
                HttpStatus.FORBIDDEN,
                ex.getMessage(),
                null,
                request
        );
    }

    @ExceptionHandler({VehicleNotFoundException.class, ReservationNotFoundException.class})
    public ProblemDetail handleNotFound(RuntimeException ex, WebRequest request) {
        return buildProblemDetail(
                HttpStatus.NOT_FOUND,
                ex.getMessage(),
                null,
                request
        );
    }

    @ExceptionHandler(ReservationConflictException.class)
    public ProblemDetail handleReservationConflict(ReservationConflictException ex, WebRequest request) {
        return buildProblemDetail(
                HttpStatus.CONFLICT,
                ex.getMessage(),
                null,
                request
        );
    }


    @ExceptionHandler(LockOperations.LockAcquisitionException.class)
    public ProblemDetail handleLockBusy(LockOperations.LockAcquisitionException ex, WebRequest request) {
        return buildProblemDetail(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Try Later - vehicle calendar is busy",
                Map.of("cause", ex.getMessage()),
                request
        );
    }


    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNoResource(NoResourceFoundException ex, WebRequest request) {
        return buildProblemDetail(
                HttpStatus.NOT_FOUND,
                "No resource at " + ex.getResourcePath(),
                null,
                request
        );
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ProblemDetail handleMethodNotSupported(HttpRequestMethodNotSupportedException ex, WebRequest request) {
        return buildProblemDetail(
                HttpStatus.METHOD_NOT_ALLOWED,
                ex.getMessage(),
                null,
                request
        );
    }


    @ExceptionHandler(Exception.class)
    public ProblemDetail handleAllOtherExceptions(Exception ex, WebRequest request) {
        log.error("Unhandled exception occurred", ex);

        return buildProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.",
                null,
                request
        );
    }


    private ProblemDetail buildProblemDetail(
            HttpStatus status,
            String detail,
            Map<String, ?> properties,
            WebRequest request) {

        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setProperty("timestamp", Instant.now());
        problem.setProperty("path", request.getDescription(false));

        if (properties != null && !properties.isEmpty()) {
            properties.forEach(problem::setProperty);
        }

        return problem;
    }
}
