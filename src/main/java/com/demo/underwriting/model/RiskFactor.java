package com.demo.underwriting.model;

import java.util.List;

/**
 * A reason the score moved, tagged to the sub-score it belongs to.
 *
 * @param code     stable machine-readable code, e.g. {@code DTI_ABOVE_WARNING}
 * @param reason   sentence an underwriter can read
 * @param features feature keys the factor was derived from
 */
public record RiskFactor(
        SubScore subScore,
        Polarity polarity,
        String code,
        String reason,
        List<String> features
) {
    public RiskFactor {
        features = features == null ? List.of() : List.copyOf(features);
    }
}
