package com.riskmgmt.quant.controller;

import com.riskmgmt.quant.exception.DistributionException;
import com.riskmgmt.quant.exception.InsufficientDataException;
import com.riskmgmt.quant.exception.InvalidParameterException;
import com.riskmgmt.quant.exception.QuantEngineException;
import com.riskmgmt.quant.exception.SimulationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine failures to HTTP responses with an {@code {"error", "parameter"}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<Map<String, String>> handleInvalidParameter(InvalidParameterException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<Map<String, String>> handleInsufficientData(InsufficientDataException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(DistributionException.class)
    public ResponseEntity<Map<String, String>> handleDistribution(DistributionException e) {
        log.error("Sampling failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler(SimulationCancelledException.class)
    public ResponseEntity<Map<String, String>> handleCancelled(SimulationCancelledException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Rejected unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body", "parameter", "body"));
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, QuantEngineException e) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("parameter", e.getParameter());
        return ResponseEntity.status(status).body(body);
    }
}
