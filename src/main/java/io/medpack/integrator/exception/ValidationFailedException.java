package io.medpack.integrator.exception;

import io.medpack.integrator.report.IntegrationReport;
import io.medpack.integrator.validate.Violation;

import java.util.List;

/**
 * Thrown when the content graph has hard violations and cannot be exported.
 */
public class ValidationFailedException extends IntegrationException {

    private final List<Violation> violations;
    private final transient IntegrationReport report;

    public ValidationFailedException(final List<Violation> violations, final IntegrationReport report) {
        super(violations.size() + " hard violation(s) found; nothing was exported");
        this.violations = List.copyOf(violations);
        this.report = report;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public IntegrationReport getReport() {
        return report;
    }
}
