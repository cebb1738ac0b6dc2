package com.demo.underwriting.model;

import java.util.List;

/**
 * A positive indicator or red flag taken from profile evidence, together with
 * the features it moved (empty when it matched no feature rule).
 */
public record EvidenceSignal(
        Platform platform,
        Polarity polarity,
        String text,
        List<String> affectedFeatures
) {
    public EvidenceSignal {
        affectedFeatures = affectedFeatures == null ? List.of() : List.copyOf(affectedFeatures);
    }
}
