package com.demo.underwriting.model;

import java.util.List;
import java.util.Set;

/**
 * What profile evidence informed the assessment. {@code note} is set when no
 * profile could be analyzed.
 */
public record EvidenceSummary(
        int profilesRequested,
        int profilesAnalyzed,
        List<Platform> platformsAnalyzed,
        List<String> positiveIndicators,
        List<String> redFlags,
        List<EvidenceWarning> warnings,
        Set<FeatureGroup> presentGroups,
        Set<FeatureGroup> absentGroups,
        String note
) {
    public static final String TRADITIONAL_ONLY_NOTE =
            "No social profile evidence was available; the assessment used traditional data only.";

    public EvidenceSummary {
        platformsAnalyzed = List.copyOf(platformsAnalyzed);
        positiveIndicators = List.copyOf(positiveIndicators);
        redFlags = List.copyOf(redFlags);
        warnings = List.copyOf(warnings);
        presentGroups = FeatureGroup.orderedCopy(presentGroups);
        absentGroups = FeatureGroup.orderedCopy(absentGroups);
    }
}
