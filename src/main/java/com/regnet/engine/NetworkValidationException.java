package com.regnet.engine;

/**
 * Base class of every fatal validation failure. A run that throws one of
 * these writes no output.
 */
public abstract class NetworkValidationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    protected NetworkValidationException(String message) {
        super(message);
    }
}
