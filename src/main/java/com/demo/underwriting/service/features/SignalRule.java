package com.demo.underwriting.service.features;

import com.demo.underwriting.model.FeatureName;

import java.util.List;

/**
 * Keyword lexicon for one profile-derived feature. Positive terms are matched
 * against positive indicators, negative terms against red flags, and both
 * against the narrative. Terms are lower-case.
 */
public record SignalRule(
        FeatureName feature,
        double baseline,
        List<String> positiveTerms,
        List<String> negativeTerms
) {
    public SignalRule {
        if (baseline < 0.0 || baseline > 1.0) {
            throw new IllegalArgumentException("baseline out of [0,1]: " + baseline);
        }
        positiveTerms = List.copyOf(positiveTerms);
        negativeTerms = List.copyOf(negativeTerms);
    }
}
