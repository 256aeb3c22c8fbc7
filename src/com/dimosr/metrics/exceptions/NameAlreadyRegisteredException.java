package com.dimosr.metrics.exceptions;

/**
 * An exception denoting that a metric is already registered under the requested name
 */
public class NameAlreadyRegisteredException extends RuntimeException {
    public NameAlreadyRegisteredException(final String message) { super(message); }
}
