package com.demo.underwriting.service.compliance;

import com.demo.underwriting.model.ApplicantRecord;
import com.demo.underwriting.model.ComplianceFinding;
import com.demo.underwriting.model.LoanRecord;
import com.demo.underwriting.model.LoanType;
import com.demo.underwriting.model.PropertyRecord;
import com.demo.underwriting.model.RuleSeverity;

import java.util.function.Function;

/**
 * One row of the compliance table: a pure predicate over the raw records and a
 * static threshold.
 *
 * @param citation guide the rule comes from, which may depend on the loan program
 */
public record ComplianceRule(
        String id,
        String description,
        RuleSeverity severity,
        Function<LoanType, String> citation,
        Check check
) {

    @FunctionalInterface
    public interface Check {
        Outcome apply(ApplicantRecord applicant, PropertyRecord property, LoanRecord loan);
    }

    /** Threshold and observed value as display strings, plus the verdict of the rule. */
    public record Outcome(String threshold, String observed, boolean passed) {
    }

    public ComplianceFinding evaluate(ApplicantRecord applicant, PropertyRecord property, LoanRecord loan) {
        Outcome o = check.apply(applicant, property, loan);
        return new ComplianceFinding(id, description, severity, o.threshold(), o.observed(), o.passed(),
                citation.apply(loan.loanType()));
    }
}
