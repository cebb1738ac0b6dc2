package com.demo.underwriting.service.features;

import com.demo.underwriting.model.ApplicantRecord;
import com.demo.underwriting.model.LoanRecord;
import com.demo.underwriting.model.ProfileAnalysis;
import com.demo.underwriting.model.PropertyRecord;

import java.util.List;

/** What a {@link FeatureProvider} reads: the raw records and the analyses relevant to its group. */
public record FeatureInput(
        ApplicantRecord applicant,
        PropertyRecord property,
        LoanRecord loan,
        List<ProfileAnalysis> analyses
) {
    public FeatureInput {
        analyses = analyses == null ? List.of() : List.copyOf(analyses);
    }

    public FeatureInput withAnalyses(List<ProfileAnalysis> only) {
        return new FeatureInput(applicant, property, loan, only);
    }
}
