package com.example.mlops.exception;

/** The serving side refused to route traffic to a promoted version. */
public class SwapException extends RetrainException {
    private final long version;

    public SwapException(long version, String message, Throwable cause) {
        super("Serving refused v" + version + ": " + message, cause);
        this.version = version;
    }

    public long getVersion() {
        return version;
    }
}
