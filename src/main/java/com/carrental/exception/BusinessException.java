package com.carrental.exception;

/**
 * A request that is well-formed but breaks a business rule (duplicate review, payment on a paid booking, ...).
 * The message is safe to show to the user.
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
