package io.medpack.integrator.reassign;

import io.medpack.integrator.exception.UnknownDepartmentException;
import io.medpack.integrator.exception.UnknownEntityReferenceException;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.pipeline.IntegrationContext;
import io.medpack.integrator.pipeline.IntegrationStage;
import io.medpack.integrator.report.IntegrationReport;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Applies curator reassignment directives in declaration order.
 *
 * <p>Each directive sees the graph as left by the previous one. A department is known when it is
 * configured or when some disease or symptom belongs to it. The first failing directive aborts the
 * run; directives applied before it remain listed in the report.</p>
 */
@ApplicationScoped
public class ReassignmentEngine implements IntegrationStage {

    private static final Logger logger = LoggerFactory.getLogger(ReassignmentEngine.class);

    @Override
    public ContentGraph apply(@NotNull ContentGraph graph, @NotNull IntegrationContext context) {
        ContentGraph current = graph;
        List<ReassignmentDirective> directives = context.reassignments();
        for (int i = 0; i < directives.size(); i++) {
            current = apply(current, directives.get(i), i, context);
        }
        return current;
    }

    @Override
    public String getName() {
        return "reassign";
    }

    @Override
    public boolean shouldSkip(@NotNull IntegrationContext context) {
        return context.reassignments().isEmpty();
    }

    /**
     * Applies one directive.
     *
     * @throws UnknownEntityReferenceException if the directive names an entity that does not exist
     * @throws UnknownDepartmentException      if the directive names an unknown department
     */
    public ContentGraph apply(@NotNull ContentGraph graph, @NotNull ReassignmentDirective directive,
                              int index, @NotNull IntegrationContext context) {
        Set<String> knownDepartments = new TreeSet<>(context.settings().departments());
        knownDepartments.addAll(graph.departments());

        List<String> affected = new ArrayList<>();
        ContentGraph result;
        if (directive instanceof MoveToDepartment) {
            result = move(graph, (MoveToDepartment) directive, knownDepartments, affected);
        } else if (directive instanceof RestrictToCategory) {
            result = restrict(graph, (RestrictToCategory) directive, knownDepartments, affected, context.report());
        } else if (directive instanceof MergeDepartments) {
            result = mergeDepartments(graph, (MergeDepartments) directive, knownDepartments, affected);
        } else {
            throw new IllegalArgumentException("Unsupported directive: " + directive.getClass().getSimpleName());
        }

        context.report().addAppliedDirective(
            new IntegrationReport.AppliedDirective(index, directive.describe(), affected));
        logger.info("Applied directive #{} {} ({} entities affected)", index, directive.describe(), affected.size());
        return result;
    }

    private ContentGraph move(ContentGraph graph, MoveToDepartment directive, Set<String> knownDepartments,
                              List<String> affected) {
        requireDepartment(directive.department(), knownDepartments);
        EntityKind kind = directive.kind();

        if (kind != EntityKind.SYMPTOM) {
            Disease disease = graph.getDiseases().get(directive.entityId());
            if (disease != null) {
                affected.add(disease.getId());
                return graph.toBuilder().disease(disease.withDepartment(directive.department())).build();
            }
        }
        if (kind != EntityKind.DISEASE) {
            Symptom symptom = graph.getSymptoms().get(directive.entityId());
            if (symptom != null) {
                affected.add(symptom.getId());
                return graph.toBuilder().symptom(symptom.withDepartment(directive.department())).build();
            }
        }
        throw new UnknownEntityReferenceException(kind, directive.entityId());
    }

    private ContentGraph restrict(ContentGraph graph, RestrictToCategory directive, Set<String> knownDepartments,
                                  List<String> affected, IntegrationReport report) {
        requireDepartment(directive.department(), knownDepartments);
        ContentGraph.Builder builder = graph.toBuilder();
        for (Disease disease : graph.retainedDiseases()) {
            if (Objects.equals(directive.department(), disease.getDepartment())
                    && !disease.hasAnyTag(directive.keepTags())) {
                builder.markRemoved(disease.getId());
                affected.add(disease.getId());
                report.addRemovedDisease(disease.getId());
                logger.debug("Disease {} removed from {}: tags {} outside {}", disease.getId(),
                    directive.department(), disease.getTags(), directive.keepTags());
            }
        }
        return builder.build();
    }

    private ContentGraph mergeDepartments(ContentGraph graph, MergeDepartments directive, Set<String> knownDepartments,
                                          List<String> affected) {
        requireDepartment(directive.source(), knownDepartments);
        requireDepartment(directive.target(), knownDepartments);
        ContentGraph.Builder builder = graph.toBuilder();
        for (Disease disease : graph.getDiseases().values()) {
            if (directive.source().equals(disease.getDepartment())) {
                builder.disease(disease.withDepartment(directive.target()));
                affected.add(disease.getId());
            }
        }
        for (Symptom symptom : graph.getSymptoms().values()) {
            if (directive.source().equals(symptom.getDepartment())) {
                builder.symptom(symptom.withDepartment(directive.target()));
                affected.add(symptom.getId());
            }
        }
        return builder.build();
    }

    private static void requireDepartment(String department, Set<String> knownDepartments) {
        if (!knownDepartments.contains(department)) {
            throw new UnknownDepartmentException(department);
        }
    }
}
