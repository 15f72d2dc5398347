package com.example.germanarticles.service;

/**
 * None of the model's candidates contained a JSON answer that could be parsed.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }
}
