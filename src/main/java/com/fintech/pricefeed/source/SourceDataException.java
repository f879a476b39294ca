package com.fintech.pricefeed.source;

/**
 * Raised by a source adapter when a response cannot be decoded into an observation.
 */
public class SourceDataException extends RuntimeException {

    public SourceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
