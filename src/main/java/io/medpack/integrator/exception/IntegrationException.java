package io.medpack.integrator.exception;

/**
 * Base class for every failure raised while integrating content packages.
 */
public class IntegrationException extends RuntimeException {

    public IntegrationException(final String message) {
        super(message);
    }

    public IntegrationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
