package com.powerscheduler.scheduler.scale;

/**
 * Raised when a decoded request carries a field that cannot be used.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
