package com.demo.underwriting.service.policy;

import com.demo.underwriting.exception.ConfigurationDefectException;
import com.demo.underwriting.model.SubScore;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/** Composite weights per sub-score. Renormalized over the sub-scores actually present. */
public final class RiskWeights {

    private static final double SUM_TOLERANCE = 0.01;

    private final EnumMap<SubScore, Double> weights;

    public RiskWeights(double credit, double capacity, double collateral, double fourthFactor) {
        EnumMap<SubScore, Double> w = new EnumMap<>(SubScore.class);
        w.put(SubScore.CREDIT, credit);
        w.put(SubScore.CAPACITY, capacity);
        w.put(SubScore.COLLATERAL, collateral);
        w.put(SubScore.FOURTH_FACTOR, fourthFactor);
        double sum = 0.0;
        for (Map.Entry<SubScore, Double> e : w.entrySet()) {
            double v = e.getValue();
            if (Double.isNaN(v) || Double.isInfinite(v) || v <= 0) {
                throw new ConfigurationDefectException("weight for " + e.getKey() + " must be > 0, was " + v);
            }
            sum += v;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationDefectException("risk weights must sum to 1.0, sum was " + sum);
        }
        this.weights = w;
    }

    public static RiskWeights defaults() {
        return new RiskWeights(0.35, 0.30, 0.25, 0.10);
    }

    public double weight(SubScore s) {
        return weights.get(s);
    }

    /** Weights restricted to {@code present}, scaled to sum to exactly 1. */
    public Map<SubScore, Double> renormalized(Set<SubScore> present) {
        if (present.isEmpty()) {
            throw new IllegalArgumentException("no sub-scores present");
        }
        double total = 0.0;
        for (SubScore s : present) total += weights.get(s);
        EnumMap<SubScore, Double> out = new EnumMap<>(SubScore.class);
        for (SubScore s : present) out.put(s, weights.get(s) / total);
        return out;
    }

    public Map<SubScore, Double> asMap() {
        return Collections.unmodifiableMap(weights);
    }
}
