package com.example.mlops.exception;

/** Fitting a candidate failed or produced metrics outside a sane numeric range. */
public class TrainingException extends RetrainException {

    public TrainingException(String message) {
        super(message);
    }

    public TrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
