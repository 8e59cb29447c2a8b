package com.carrental.exception;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String what, Long id) {
        return new NotFoundException(what + " not found with id: " + id);
    }
}
