package com.demo.underwriting.model;

import java.util.List;

/** A normalized feature in [0,1] and the signals that produced it. */
public record FeatureValue(double value, List<Contribution> contributions) {

    public FeatureValue {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("feature value out of [0,1]: " + value);
        }
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }

    public static FeatureValue of(double value) {
        return new FeatureValue(value, List.of());
    }
}
