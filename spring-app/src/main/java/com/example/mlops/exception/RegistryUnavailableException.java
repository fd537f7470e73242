package com.example.mlops.exception;

/**
 * The model registry's persistence layer cannot be read or written.
 * This is the one fatal condition: without a trustworthy active pointer
 * nothing may be evaluated or promoted.
 */
public class RegistryUnavailableException extends RetrainException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
