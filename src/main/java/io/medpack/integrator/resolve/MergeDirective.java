package io.medpack.integrator.resolve;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.medpack.integrator.model.EntityKind;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Curator instruction to treat two entities as the same concept.
 *
 * <p>Ids may be plain ({@code blood_test}) or qualified by package tag ({@code neuro:blood_test}).
 * A plain id names every package's entity of that kind with that id.</p>
 *
 * @param kind   kind of both entities
 * @param source entity folded into the target's group
 * @param target entity whose group absorbs the source
 */
public record MergeDirective(
    @NotNull EntityKind kind,
    @NotNull String source,
    @NotNull String target
) {

    public MergeDirective {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    @JsonCreator
    public static MergeDirective of(
            @JsonProperty("kind") String kind,
            @JsonProperty("source") String source,
            @JsonProperty("target") String target) {
        return new MergeDirective(EntityKind.fromString(kind), source, target);
    }
}
