package com.example.mlops.exception;

/** The ingestion collaborator could not provide the requested data window. */
public class NotAvailableException extends RetrainException {
    private final String windowId;

    public NotAvailableException(String windowId, String message) {
        super("[" + windowId + "] " + message);
        this.windowId = windowId;
    }

    public NotAvailableException(String windowId, String message, Throwable cause) {
        super("[" + windowId + "] " + message, cause);
        this.windowId = windowId;
    }

    public String getWindowId() {
        return windowId;
    }
}
