package org.schemadiff.cli.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.schemadiff.migration.MigrationPlan;
import org.schemadiff.migration.MigrationStep;
import org.schemadiff.model.Change;
import org.schemadiff.model.CompatibilityIssue;
import org.schemadiff.model.CompatibilityReport;
import org.schemadiff.validate.ValidationError;
import org.schemadiff.validate.ValidationResult;

/**
 * Formats command results for the terminal, as plain text or pretty-printed JSON.
 */
public class ReportWriter {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public String toText(CompatibilityReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(report.isCompatible() ? "Compatible" : "Incompatible")
                .append(" (score ").append(report.getCompatibilityScore())
                .append(", threshold ").append(report.getMetadata().getOrDefault("threshold", "?")).append(")\n");
        sb.append("   ").append(report.getMetadata().getOrDefault("oldVersion", "?"))
                .append(" -> ").append(report.getMetadata().getOrDefault("newVersion", "?"))
                .append(" [").append(report.getMetadata().getOrDefault("format", "?")).append("]\n");

        if (report.getChanges().isEmpty()) {
            sb.append("No changes detected.\n");
            return sb.toString().stripTrailing();
        }

        sb.append("\nChanges:\n");
        for (Change change : report.getChanges()) {
            sb.append(String.format("  %-8s %-22s %s  %s%n", change.getSeverity(), change.getKind(),
                    change.getLocation(), change.getDescription()));
        }
        if (!report.getIssues().isEmpty()) {
            sb.append("\nIssues:\n");
            for (CompatibilityIssue issue : report.getIssues()) {
                sb.append("  - [").append(issue.getSeverity()).append("] ").append(issue.getDescription()).append('\n');
                if (issue.getHint() != null) {
                    sb.append("      hint: ").append(issue.getHint()).append('\n');
                }
            }
        }
        return sb.toString().stripTrailing();
    }

    public String toText(MigrationPlan plan) {
        StringBuilder sb = new StringBuilder();
        for (MigrationStep step : plan.getSteps()) {
            sb.append(String.format("%3d. [%s] %s%n", step.getOrder(), step.getPhase(), step.getInstruction()));
        }
        return sb.toString().stripTrailing();
    }

    public String toText(ValidationResult result) {
        StringBuilder sb = new StringBuilder(result.isValid() ? "Change set is valid" : "Change set is invalid");
        sb.append(" (").append(result.getContext().getOrDefault("total", "0")).append(" change(s))\n");
        for (ValidationError error : result.getErrors()) {
            sb.append("  - ").append(error.getCode()).append(": ").append(error.getMessage()).append('\n');
        }
        return sb.toString().stripTrailing();
    }
}
