package io.medpack.integrator.resolve;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes entity names so that the same concept authored by different packages compares equal.
 *
 * <p>Normalization steps:
 * <ul>
 *   <li>Remove bracketed and parenthesized qualifiers ({@code [Neuro] Blood Test}, {@code Blood Test (PSY)})</li>
 *   <li>Remove a leading {@code <packageTag>:} or {@code <packageTag>/} prefix</li>
 *   <li>Lowercase, trim, and collapse whitespace</li>
 * </ul>
 */
public final class NameNormalizer {

    private static final Pattern QUALIFIER = Pattern.compile("\\[[^\\]]*\\]|\\([^)]*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameNormalizer() {
    }

    /**
     * Normalizes a name authored by the given package.
     *
     * @param name       entity name (must not be null)
     * @param packageTag tag of the authoring package, or null when unknown
     * @return normalized name, possibly empty
     */
    @NotNull
    public static String normalize(@NotNull String name, @Nullable String packageTag) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        String result = QUALIFIER.matcher(name).replaceAll(" ").trim();
        if (packageTag != null && !packageTag.isBlank()) {
            String lower = result.toLowerCase(Locale.ROOT);
            String tag = packageTag.toLowerCase(Locale.ROOT);
            if (lower.startsWith(tag + ":") || lower.startsWith(tag + "/")) {
                result = result.substring(tag.length() + 1);
            }
        }
        return WHITESPACE.matcher(result.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }
}
