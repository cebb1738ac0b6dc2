package com.demo.underwriting.model;

/** How much of a profile could actually be observed. Scales the weight of its signals. */
public enum Confidence {
    LOW(0.5),
    MEDIUM(0.75),
    HIGH(1.0);

    private final double weight;

    Confidence(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
