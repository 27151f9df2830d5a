package io.medpack.integrator.resolve;

import io.medpack.integrator.model.ContentGraph;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Result of identity resolution.
 *
 * @param graph               merged graph with canonical ids and rewritten references
 * @param index               authored id to canonical id mappings
 * @param candidateCount      entity definitions across all packages
 * @param mergedCount         definitions folded into another canonical entity
 * @param nearDuplicateCount  pairs flagged as near-duplicates
 * @param collisionCount      canonical entities re-identified
 * @param rewrittenReferences references changed by rewriting
 * @param processingTimeMs    wall-clock time spent resolving
 */
public record ResolutionResult(
    @NotNull ContentGraph graph,
    @NotNull CanonicalIdIndex index,
    int candidateCount,
    int mergedCount,
    int nearDuplicateCount,
    int collisionCount,
    int rewrittenReferences,
    long processingTimeMs
) {

    public ResolutionResult {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(index, "index must not be null");
    }

    /**
     * Formats the result for logging.
     */
    public String toLogString() {
        return String.format(
            "Identity resolution: %d definitions -> %d entities (%d merged, %d near-duplicates, %d collisions, %d references rewritten) in %dms",
            candidateCount, graph.size(), mergedCount, nearDuplicateCount, collisionCount,
            rewrittenReferences, processingTimeMs
        );
    }
}
