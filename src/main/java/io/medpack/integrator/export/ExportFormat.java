package io.medpack.integrator.export;

import org.jetbrains.annotations.Nullable;

/**
 * Supported export formats.
 */
public enum ExportFormat {
    XML("application/xml", "xml"),
    JSON("application/json", "json");

    private final String mimeType;
    private final String extension;

    ExportFormat(String mimeType, String extension) {
        this.mimeType = mimeType;
        this.extension = extension;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Parses format from string, case-insensitive.
     *
     * @param value The string value
     * @return Matching ExportFormat, XML when blank
     * @throws IllegalArgumentException if value doesn't match
     */
    public static ExportFormat fromString(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return XML;
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid export format: '" + value + "'. Valid values: xml, json"
            );
        }
    }
}
