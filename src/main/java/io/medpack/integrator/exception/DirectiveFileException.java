package io.medpack.integrator.exception;

import java.nio.file.Path;

/**
 * Thrown when the directive file cannot be read or parsed.
 */
public class DirectiveFileException extends IntegrationException {

    public DirectiveFileException(final Path source, final String message, final Throwable cause) {
        super(source + ": " + message, cause);
    }
}
