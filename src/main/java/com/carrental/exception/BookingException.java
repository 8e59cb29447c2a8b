package com.carrental.exception;

import java.util.List;

/**
 * Booking validation failure. Carries every problem found so the form can list them together.
 */
public class BookingException extends BusinessException {

    private final List<String> errors;

    public BookingException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public BookingException(List<String> errors) {
        super(String.join(" ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
