package com.demo.underwriting.model;

/** Discrete tier of the composite score; each band includes its lower bound. */
public enum RiskTier {
    LOW(80.0),
    MODERATE(60.0),
    ELEVATED(40.0),
    HIGH(Double.NEGATIVE_INFINITY);

    private final double minComposite;

    RiskTier(double minComposite) {
        this.minComposite = minComposite;
    }

    public static RiskTier forComposite(double composite) {
        for (RiskTier t : values()) {
            if (composite >= t.minComposite) return t;
        }
        return HIGH;
    }
}
