package io.medpack.integrator.exception;

import java.nio.file.Path;

/**
 * Thrown when a content package cannot be read or parsed.
 */
public class PackageLoadException extends IntegrationException {

    private final Path source;

    public PackageLoadException(final Path source, final String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public PackageLoadException(final Path source, final String message, final Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public PackageLoadException(final String message) {
        super(message);
        this.source = null;
    }

    public PackageLoadException(final String message, final Throwable cause) {
        super(message, cause);
        this.source = null;
    }

    public Path getSource() {
        return source;
    }
}
