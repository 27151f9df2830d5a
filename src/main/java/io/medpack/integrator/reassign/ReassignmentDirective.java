package io.medpack.integrator.reassign;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Curator rule that changes department membership or removes diseases.
 *
 * <p>Directives are read from the {@code reassignments} array of the directive file and are told
 * apart by their {@code type} property.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MoveToDepartment.class, name = "moveToDepartment"),
    @JsonSubTypes.Type(value = RestrictToCategory.class, name = "restrictToCategory"),
    @JsonSubTypes.Type(value = MergeDepartments.class, name = "mergeDepartments")
})
public interface ReassignmentDirective {

    /**
     * One-line description for the report and logs.
     */
    String describe();
}
