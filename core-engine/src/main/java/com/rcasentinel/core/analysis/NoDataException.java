package com.rcasentinel.core.analysis;

/**
 * Thrown when an analysis is requested without any metric data.
 *
 * @since 1.0.0
 */
public class NoDataException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public NoDataException(String message) {
        super(message);
    }
}
