package com.demo.underwriting.model;

public record ComplianceFinding(
        String ruleId,
        String description,
        RuleSeverity severity,
        String threshold,
        String observed,
        boolean passed,
        String citation
) {
}
