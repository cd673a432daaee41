package org.tcgstats.metalens_api.core.config;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaValidationException;
import org.tcgstats.metalens_api.modules.meta_analytics.repository.MetaRowFetchException;

import java.net.URI;
import java.time.Duration;

@RestControllerAdvice
public class ProblemHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemHandler.class);

    private static final String PROBLEM_BASE = "https://api.tcgstats.org/problems/";

    // Anything thrown as ResponseStatusException becomes a Problem
    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handle(ResponseStatusException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        pd.setType(URI.create(PROBLEM_BASE + ex.getStatusCode().value()));
        var status = HttpStatus.resolve(ex.getStatusCode().value());
        pd.setTitle(status == null ? "Request Failed" : switch (status) {
            case NOT_FOUND -> "No Data Available";
            case BAD_REQUEST -> "Bad Request";
            default -> "Request Failed";
        });
        return pd;
    }

    @ExceptionHandler(MetaValidationException.class)
    public ProblemDetail invalidQuery(MetaValidationException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "invalid-query"));
        pd.setTitle("Invalid Query");
        return pd;
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail constraintViolation(ConstraintViolationException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail badParameter(Exception ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(MetaRowFetchException.class)
    public ResponseEntity<ProblemDetail> upstream(MetaRowFetchException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE,
                ex.getMessage() + ". Please retry later.");
        pd.setType(URI.create(PROBLEM_BASE + "upstream-unavailable"));
        pd.setTitle("Tournament Data Unavailable");

        var headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(Duration.ofSeconds(30).toSeconds()));
        return new ResponseEntity<>(pd, headers, HttpStatus.SERVICE_UNAVAILABLE);
    }

    // Catch any other unexpected exception as a 500 Problem (avoid leaking internals)
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unhandled error while serving meta analytics request", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact support.");
        pd.setType(URI.create(PROBLEM_BASE + "internal-error"));
        pd.setTitle("Internal Server Error");
        return pd;
    }
}
