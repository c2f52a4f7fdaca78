package com.community.movierating.controller;

import com.community.movierating.dto.CommonResponse;
import com.community.movierating.exception.ItemAlreadyPostedException;
import com.community.movierating.exception.RatingPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<CommonResponse<Void>> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(CommonResponse.error(400, e.getMessage()));
    }

    @ExceptionHandler(ItemAlreadyPostedException.class)
    public ResponseEntity<CommonResponse<Long>> handleAlreadyPosted(ItemAlreadyPostedException e) {
        log.warn("Conflict: {}", e.getMessage());
        return ResponseEntity.status(409).body(CommonResponse.of(409, e.getMessage(), e.getExistingMessageId()));
    }

    @ExceptionHandler(RatingPersistenceException.class)
    public ResponseEntity<CommonResponse<Void>> handlePersistence(RatingPersistenceException e) {
        log.error("Rating store failure", e);
        return ResponseEntity.status(503).body(CommonResponse.error(503, "Rating store unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommonResponse<Void>> handleUnexpected(Exception e) {
        log.error("Unexpected failure", e);
        return ResponseEntity.status(500).body(CommonResponse.error(500, "Internal server error"));
    }
}
