package com.example.mlops.exception;

/**
 * Base type for failures raised inside the drift/retrain pipeline.
 * Job-level subclasses are caught at the coordinator boundary and recorded on the job.
 */
public class RetrainException extends RuntimeException {

    public RetrainException(String message) {
        super(message);
    }

    public RetrainException(String message, Throwable cause) {
        super(message, cause);
    }
}
