package com.platform.tripcleaning.store;

/**
 * A bulk write against the trip database failed. The in-flight transaction has been rolled back;
 * chunks committed earlier in the run remain stored.
 */
public class TripPersistenceException extends RuntimeException {

    public TripPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
