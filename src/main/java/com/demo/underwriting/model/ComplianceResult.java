package com.demo.underwriting.model;

import java.util.List;

public record ComplianceResult(List<ComplianceFinding> findings, ComplianceVerdict verdict) {

    public ComplianceResult {
        findings = List.copyOf(findings);
    }

    public static ComplianceResult of(List<ComplianceFinding> findings) {
        boolean hardFail = findings.stream().anyMatch(f -> !f.passed() && f.severity() == RuleSeverity.HARD);
        boolean softFail = findings.stream().anyMatch(f -> !f.passed() && f.severity() == RuleSeverity.SOFT);
        ComplianceVerdict verdict = hardFail ? ComplianceVerdict.NON_COMPLIANT
                : softFail ? ComplianceVerdict.NEEDS_REVIEW
                : ComplianceVerdict.COMPLIANT;
        return new ComplianceResult(findings, verdict);
    }

    public List<ComplianceFinding> failures() {
        return findings.stream().filter(f -> !f.passed()).toList();
    }
}
