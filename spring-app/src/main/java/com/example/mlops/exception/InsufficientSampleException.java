package com.example.mlops.exception;

/** Too few inference inputs to produce a stable drift estimate; the cycle is skipped. */
public class InsufficientSampleException extends RetrainException {
    private final int required;
    private final int actual;

    public InsufficientSampleException(int required, int actual) {
        this("Drift sample too small: " + actual + " < " + required, required, actual);
    }

    public InsufficientSampleException(String message, int required, int actual) {
        super(message);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
