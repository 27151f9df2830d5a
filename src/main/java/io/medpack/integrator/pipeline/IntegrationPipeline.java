package io.medpack.integrator.pipeline;

import io.medpack.integrator.exception.ValidationFailedException;
import io.medpack.integrator.model.ContentGraph;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the graph through a fixed sequence of stages.
 *
 * <p>After every stage the report is checked; once it holds a hard violation the pipeline stops
 * and throws {@link ValidationFailedException}, so nothing downstream sees an invalid graph.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * IntegrationPipeline pipeline = IntegrationPipeline.builder()
 *     .addStage(new ConflictValidator())
 *     .addStage(new ReassignmentEngine())
 *     .addStage(new PruningPass())
 *     .build();
 *
 * ContentGraph result = pipeline.execute(graph, context);
 * }</pre>
 */
public class IntegrationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(IntegrationPipeline.class);

    static final String MDC_STAGE = "integration.stage";

    private final List<IntegrationStage> stages;

    private IntegrationPipeline(Builder builder) {
        this.stages = List.copyOf(builder.stages);
    }

    public List<IntegrationStage> getStages() {
        return stages;
    }

    /**
     * Executes all stages in order.
     *
     * @param graph   resolved graph
     * @param context run settings, directives and report
     * @return the graph after the last stage
     * @throws ValidationFailedException if a stage leaves hard violations in the report
     */
    public ContentGraph execute(@NotNull ContentGraph graph, @NotNull IntegrationContext context) {
        long startTime = System.currentTimeMillis();
        ContentGraph current = graph;
        for (IntegrationStage stage : stages) {
            current = executeStage(stage, current, context);
            if (context.report().hasHardViolations()) {
                logger.warn("Stopping after stage {}: {} hard violation(s)",
                    stage.getName(), context.report().getViolations().size());
                throw new ValidationFailedException(context.report().getViolations(), context.report());
            }
        }
        logger.info("Pipeline completed in {}ms: {}", System.currentTimeMillis() - startTime, current);
        return current;
    }

    private ContentGraph executeStage(IntegrationStage stage, ContentGraph graph, IntegrationContext context) {
        if (stage.shouldSkip(context)) {
            logger.debug("Skipping stage: {}", stage.getName());
            return graph;
        }

        MDC.put(MDC_STAGE, stage.getName());
        try {
            logger.debug("Executing stage: {}", stage.getName());
            long stageStart = System.currentTimeMillis();
            ContentGraph result = stage.apply(graph, context);
            logger.debug("Stage {} completed in {}ms", stage.getName(), System.currentTimeMillis() - stageStart);
            return result;
        } finally {
            MDC.remove(MDC_STAGE);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for IntegrationPipeline.
     */
    public static class Builder {
        private final List<IntegrationStage> stages = new ArrayList<>();

        /**
         * Adds a stage to the pipeline.
         * Stages are executed in the order they are added.
         */
        public Builder addStage(@NotNull IntegrationStage stage) {
            this.stages.add(stage);
            return this;
        }

        public IntegrationPipeline build() {
            return new IntegrationPipeline(this);
        }
    }
}
