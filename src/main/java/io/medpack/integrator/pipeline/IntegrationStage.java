package io.medpack.integrator.pipeline;

import io.medpack.integrator.model.ContentGraph;
import org.jetbrains.annotations.NotNull;

/**
 * A pass over the content graph.
 *
 * <p>Each stage receives the current snapshot and returns the next one; it never modifies the
 * snapshot it was given. Decisions worth a curator's attention go to the run's report.</p>
 *
 * <h2>Stage Contract:</h2>
 * <ul>
 *   <li>Read the graph and the run settings</li>
 *   <li>Record decisions in {@link IntegrationContext#report()}</li>
 *   <li>Return a new snapshot, or the same one when nothing changed</li>
 * </ul>
 */
public interface IntegrationStage {

    /**
     * Applies this stage.
     *
     * @param graph   current snapshot
     * @param context settings, directives and report of the run
     * @return the next snapshot
     */
    ContentGraph apply(@NotNull ContentGraph graph, @NotNull IntegrationContext context);

    /**
     * Returns the name of this stage for logging.
     *
     * @return Stage name (e.g., "validate", "reassign", "prune")
     */
    String getName();

    /**
     * Checks if this stage should be skipped for the given run.
     *
     * <p>Default implementation always returns false.</p>
     */
    default boolean shouldSkip(@NotNull IntegrationContext context) {
        return false;
    }
}
