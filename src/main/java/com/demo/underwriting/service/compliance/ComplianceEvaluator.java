package com.demo.underwriting.service.compliance;

import com.demo.underwriting.model.ApplicantRecord;
import com.demo.underwriting.model.ComplianceFinding;
import com.demo.underwriting.model.ComplianceResult;
import com.demo.underwriting.model.LoanRecord;
import com.demo.underwriting.model.PropertyRecord;
import com.demo.underwriting.service.RecordPreconditions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/** Runs every rule of the table on the raw records; findings come back in table order. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceEvaluator {

    private final ComplianceRuleTable table;

    public ComplianceResult evaluate(ApplicantRecord applicant, PropertyRecord property, LoanRecord loan) {
        RecordPreconditions.check(applicant, property, loan);

        List<ComplianceFinding> findings = new ArrayList<>(table.rules().size());
        for (ComplianceRule rule : table.rules()) {
            findings.add(rule.evaluate(applicant, property, loan));
        }
        ComplianceResult result = ComplianceResult.of(findings);
        if (!result.failures().isEmpty()) {
            log.debug("Compliance failures: {}", result.failures().stream().map(ComplianceFinding::ruleId).toList());
        }
        return result;
    }
}
