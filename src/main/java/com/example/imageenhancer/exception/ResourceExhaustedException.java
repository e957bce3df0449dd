package com.example.imageenhancer.exception;

/**
 * Raised when the requested output raster does not fit the configured sample limit or the memory
 * available to the JVM. Callers are expected to retry with a smaller scale factor or input.
 */
public class ResourceExhaustedException extends IllegalStateException {

    public ResourceExhaustedException(String message) {
        super(message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
