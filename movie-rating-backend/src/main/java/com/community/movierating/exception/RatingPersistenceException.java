package com.community.movierating.exception;

/**
 * The rating store could not complete a read or write.
 */
public class RatingPersistenceException extends RuntimeException {

    public RatingPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
