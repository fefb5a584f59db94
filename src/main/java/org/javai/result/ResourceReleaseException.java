package org.javai.result;

/**
 * Thrown when closing a resource handed out by {@link Resources} fails with a checked
 * exception. The original exception is available as the cause.
 */
public class ResourceReleaseException extends RuntimeException {

    public ResourceReleaseException(AutoCloseable resource, Exception cause) {
        super("Failed to release " + resource.getClass().getName() + ": " + cause.getMessage(), cause);
    }
}
