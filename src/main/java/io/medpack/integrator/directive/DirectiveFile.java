package io.medpack.integrator.directive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.medpack.integrator.reassign.ReassignmentDirective;
import io.medpack.integrator.resolve.MergeDirective;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Curator directives for one integration run.
 *
 * <pre>{@code
 * {
 *   "merges": [{"kind": "examination", "source": "neuro:blood_test", "target": "psych:blood_test"}],
 *   "reassignments": [{"type": "restrictToCategory", "department": "Psychology", "keepTags": ["mental-health"]}],
 *   "departmentShares": {"Psychology": 0.2, "Neurology": 0.3}
 * }
 * }</pre>
 *
 * @param merges           explicit merge directives
 * @param reassignments    reassignment directives, in application order
 * @param departmentShares share of the total weight per department, overriding configuration
 */
public record DirectiveFile(
    @JsonProperty("merges") @NotNull List<MergeDirective> merges,
    @JsonProperty("reassignments") @NotNull List<ReassignmentDirective> reassignments,
    @JsonProperty("departmentShares") @NotNull Map<String, Double> departmentShares
) {

    @JsonCreator
    public DirectiveFile {
        merges = merges == null ? List.of() : List.copyOf(merges);
        reassignments = reassignments == null ? List.of() : List.copyOf(reassignments);
        departmentShares = departmentShares == null ? Map.of() : Map.copyOf(departmentShares);
    }

    public static DirectiveFile empty() {
        return new DirectiveFile(List.of(), List.of(), Map.of());
    }
}
