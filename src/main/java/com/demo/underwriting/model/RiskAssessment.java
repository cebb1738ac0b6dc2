package com.demo.underwriting.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sub-scores, composite and tier of one application. {@code subScores} and
 * {@code appliedWeights} contain FOURTH_FACTOR only when profile evidence was
 * present; the applied weights always sum to 1.
 */
public record RiskAssessment(
        Map<SubScore, Double> subScores,
        Map<SubScore, Double> appliedWeights,
        double compositeScore,
        RiskTier tier,
        List<RiskFactor> factors,
        double dtiRatio,
        double ltvRatio,
        Set<FeatureGroup> presentGroups,
        Set<FeatureGroup> absentGroups
) {
    public RiskAssessment {
        subScores = Collections.unmodifiableMap(new EnumMap<>(subScores));
        appliedWeights = Collections.unmodifiableMap(new EnumMap<>(appliedWeights));
        factors = List.copyOf(factors);
        presentGroups = FeatureGroup.orderedCopy(presentGroups);
        absentGroups = FeatureGroup.orderedCopy(absentGroups);
    }

    public boolean hasFourthFactor() {
        return subScores.containsKey(SubScore.FOURTH_FACTOR);
    }

    public List<RiskFactor> factorsFor(SubScore subScore) {
        return factors.stream().filter(f -> f.subScore() == subScore).toList();
    }
}
