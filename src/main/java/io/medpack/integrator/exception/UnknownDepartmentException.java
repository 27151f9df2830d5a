package io.medpack.integrator.exception;

/**
 * Thrown when a reassignment directive names a department neither configured nor used by content.
 */
public class UnknownDepartmentException extends IntegrationException {

    private final String department;

    public UnknownDepartmentException(final String department) {
        super("Unknown department '" + department + "'");
        this.department = department;
    }

    public String getDepartment() {
        return department;
    }
}
