package com.demo.underwriting.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Partition of the feature vector. Only TRADITIONAL is always populated. */
public enum FeatureGroup {
    TRADITIONAL("traditional"),
    PROFESSIONAL("professional"),
    LIFESTYLE("lifestyle"),
    SOCIAL("social");

    private final String key;

    FeatureGroup(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isProfileDerived() {
        return this != TRADITIONAL;
    }

    /** Unmodifiable copy iterating in declaration order. */
    public static Set<FeatureGroup> orderedCopy(Collection<FeatureGroup> groups) {
        Set<FeatureGroup> out = EnumSet.noneOf(FeatureGroup.class);
        out.addAll(groups);
        return Collections.unmodifiableSet(out);
    }
}
