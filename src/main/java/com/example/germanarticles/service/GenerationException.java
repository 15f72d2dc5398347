package com.example.germanarticles.service;

/**
 * Failure of the call to the generative model itself (network, quota, authentication, timeout).
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
