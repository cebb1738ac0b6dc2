package com.demo.underwriting.service;

import com.demo.underwriting.model.ApplicantRecord;
import com.demo.underwriting.model.ComplianceResult;
import com.demo.underwriting.model.EvidenceSummary;
import com.demo.underwriting.model.FeatureVector;
import com.demo.underwriting.model.LoanRecord;
import com.demo.underwriting.model.Platform;
import com.demo.underwriting.model.ProfileAnalysis;
import com.demo.underwriting.model.PropertyRecord;
import com.demo.underwriting.model.RiskAssessment;
import com.demo.underwriting.model.UnderwritingResult;
import com.demo.underwriting.service.compliance.ComplianceEvaluator;
import com.demo.underwriting.service.features.FeatureNormalizer;
import com.demo.underwriting.service.profile.EvidenceCollection;
import com.demo.underwriting.service.profile.ProfileEvidenceCollector;
import com.demo.underwriting.service.risk.RiskScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Evidence collection, feature extraction, risk scoring and compliance for one
 * application. Lost profile evidence degrades the result to traditional-only
 * scoring; invalid records abort the call with an
 * {@link com.demo.underwriting.exception.InputDefectException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UnderwritingPipeline {

    public static final String MDC_APPLICANT_REF = "applicantRef";

    static final String GROUPS_DROPPED_NOTE =
            "Profile evidence was collected but no profile-derived feature group could be computed;"
                    + " the assessment used traditional data only.";

    private final ProfileEvidenceCollector collector;
    private final FeatureNormalizer normalizer;
    private final RiskScorer scorer;
    private final ComplianceEvaluator compliance;

    public UnderwritingResult run(ApplicantRecord applicant, PropertyRecord property, LoanRecord loan) {
        RecordPreconditions.check(applicant, property, loan);

        MDC.put(MDC_APPLICANT_REF, HashUtil.applicantRef(applicant.fullName(), applicant.email()));
        try {
            log.info("Underwriting started: loanType={} purpose={} profiles={}",
                    loan.loanType(), loan.purpose(), applicant.socialProfiles().size());

            EvidenceCollection evidence = collector.collect(applicant.socialProfiles());
            FeatureVector features = normalizer.extract(applicant, property, loan, evidence.analyses());

            double dti = applicant.debtToIncome();
            double ltv = loan.loanToValue(property);
            RiskAssessment risk = scorer.score(features, dti, ltv);
            ComplianceResult rules = compliance.evaluate(applicant, property, loan);
            EvidenceSummary summary = summarize(evidence, features);

            log.info("Underwriting finished: tier={} composite={} verdict={} profilesAnalyzed={}",
                    risk.tier(), risk.compositeScore(), rules.verdict(), summary.profilesAnalyzed());
            return new UnderwritingResult(risk, rules, summary, features.asModelInput());
        } finally {
            MDC.remove(MDC_APPLICANT_REF);
        }
    }

    static EvidenceSummary summarize(EvidenceCollection evidence, FeatureVector features) {
        List<Platform> platforms = new ArrayList<>();
        Set<String> positives = new LinkedHashSet<>();
        Set<String> redFlags = new LinkedHashSet<>();
        for (ProfileAnalysis a : evidence.analyses()) {
            if (!platforms.contains(a.platform())) platforms.add(a.platform());
            positives.addAll(a.positiveIndicators());
            redFlags.addAll(a.redFlags());
        }

        String note = null;
        if (evidence.analyses().isEmpty()) {
            note = EvidenceSummary.TRADITIONAL_ONLY_NOTE;
        } else if (!features.hasProfileEvidence()) {
            note = GROUPS_DROPPED_NOTE;
        }
        return new EvidenceSummary(evidence.requested(), evidence.analyses().size(), platforms,
                new ArrayList<>(positives), new ArrayList<>(redFlags), evidence.warnings(),
                features.presentGroups(), features.absentGroups(), note);
    }
}
