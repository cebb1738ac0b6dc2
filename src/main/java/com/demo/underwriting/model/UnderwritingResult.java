package com.demo.underwriting.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Everything the pipeline hands back to its caller for one application. */
public record UnderwritingResult(
        RiskAssessment riskAssessment,
        ComplianceResult compliance,
        EvidenceSummary evidence,
        Map<String, Double> features
) {
    public UnderwritingResult {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }
}
