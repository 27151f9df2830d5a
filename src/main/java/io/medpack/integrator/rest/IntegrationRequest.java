package io.medpack.integrator.rest;

import io.medpack.integrator.directive.DirectiveFile;
import io.medpack.integrator.load.PackageDocument;
import jakarta.validation.constraints.NotEmpty;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Request body for {@code POST /integrations}.
 *
 * @param packages   complete packages, each in single-file form
 * @param directives curator directives; empty when absent
 * @param format     export format name ({@code xml} or {@code json}); configured default when absent
 */
public record IntegrationRequest(
    @NotEmpty(message = "at least one package is required") List<PackageDocument> packages,
    @Nullable DirectiveFile directives,
    @Nullable String format
) {

    public DirectiveFile directivesOrEmpty() {
        return directives != null ? directives : DirectiveFile.empty();
    }
}
