package com.baselinesentinel.core.spi;

/**
 * A report could not be delivered to its sink.
 */
public class NotificationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
