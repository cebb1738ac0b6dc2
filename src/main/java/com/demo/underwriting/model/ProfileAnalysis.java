package com.demo.underwriting.model;

import java.util.List;

/** Structured reading of one successfully searched profile. */
public record ProfileAnalysis(
        Platform platform,
        String identifier,
        String narrative,
        String summary,
        List<String> positiveIndicators,
        List<String> redFlags,
        Confidence confidence
) {
    public ProfileAnalysis {
        positiveIndicators = positiveIndicators == null ? List.of() : List.copyOf(positiveIndicators);
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
    }
}
