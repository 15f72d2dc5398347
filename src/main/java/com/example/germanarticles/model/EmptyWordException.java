package com.example.germanarticles.model;

/**
 * Raised when a lookup is requested for an empty or whitespace-only word.
 */
public class EmptyWordException extends IllegalArgumentException {

    public static final String MESSAGE = "Word cannot be empty";

    public EmptyWordException() {
        super(MESSAGE);
    }
}
