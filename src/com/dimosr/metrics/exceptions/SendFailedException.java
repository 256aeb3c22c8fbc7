package com.dimosr.metrics.exceptions;

/**
 * An exception denoting that a batch of metrics could not be delivered to the collector
 * The batch can be sent again, after a new connection has been established
 */
public class SendFailedException extends RuntimeException {
    public SendFailedException(final String message, final Throwable e) {
        super(message, e);
    }
}
