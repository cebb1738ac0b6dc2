package com.demo.underwriting.model;

/**
 * One signal that moved a profile-derived feature.
 *
 * @param source    {@code INDICATOR} when {@code text} is a positive-indicator or
 *                  red-flag string, {@code NARRATIVE} when it is a phrase found in
 *                  the free-text narrative
 * @param delta     signed change applied to the feature before clamping
 */
public record Contribution(
        Platform platform,
        Polarity polarity,
        Source source,
        String text,
        double delta
) {
    public enum Source {
        INDICATOR,
        NARRATIVE
    }
}
