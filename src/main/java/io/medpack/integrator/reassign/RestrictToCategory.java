package io.medpack.integrator.reassign;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Removes every disease of a department that carries none of the kept tags.
 *
 * @param department department to restrict
 * @param keepTags   category tags that keep a disease
 */
public record RestrictToCategory(
    @JsonProperty("department") @NotNull String department,
    @JsonProperty("keepTags") @NotNull Set<String> keepTags
) implements ReassignmentDirective {

    public RestrictToCategory {
        Objects.requireNonNull(department, "department must not be null");
        keepTags = keepTags == null ? Set.of() : Set.copyOf(keepTags);
    }

    @Override
    public String describe() {
        return "restrictToCategory " + department + " keep " + new TreeSet<>(keepTags);
    }
}
