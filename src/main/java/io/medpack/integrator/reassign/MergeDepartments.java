package io.medpack.integrator.reassign;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Moves every disease and symptom of one department into another.
 */
public record MergeDepartments(
    @JsonProperty("source") @NotNull String source,
    @JsonProperty("target") @NotNull String target
) implements ReassignmentDirective {

    public MergeDepartments {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public String describe() {
        return "mergeDepartments " + source + " -> " + target;
    }
}
