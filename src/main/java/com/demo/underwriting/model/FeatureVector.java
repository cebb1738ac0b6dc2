package com.demo.underwriting.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named, normalized features of one application. A profile-derived group is
 * either fully present or entirely absent; it is never filled with defaults.
 */
public final class FeatureVector {

    private final EnumMap<FeatureName, FeatureValue> values;
    private final List<EvidenceSignal> evidence;

    public FeatureVector(Map<FeatureName, FeatureValue> values, List<EvidenceSignal> evidence) {
        this.values = values.isEmpty() ? new EnumMap<>(FeatureName.class) : new EnumMap<>(values);
        this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public Optional<FeatureValue> get(FeatureName name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean has(FeatureName name) {
        return values.containsKey(name);
    }

    public double value(FeatureName name) {
        FeatureValue v = values.get(name);
        if (v == null) {
            throw new IllegalStateException("feature not present: " + name.key());
        }
        return v.value();
    }

    public boolean hasGroup(FeatureGroup group) {
        return values.keySet().stream().anyMatch(n -> n.group() == group);
    }

    public Set<FeatureGroup> presentGroups() {
        Set<FeatureGroup> out = EnumSet.noneOf(FeatureGroup.class);
        values.keySet().forEach(n -> out.add(n.group()));
        return out;
    }

    public Set<FeatureGroup> absentGroups() {
        Set<FeatureGroup> out = EnumSet.allOf(FeatureGroup.class);
        out.removeAll(presentGroups());
        return out;
    }

    public boolean hasProfileEvidence() {
        return presentGroups().stream().anyMatch(FeatureGroup::isProfileDerived);
    }

    public Map<FeatureName, FeatureValue> group(FeatureGroup group) {
        Map<FeatureName, FeatureValue> out = new EnumMap<>(FeatureName.class);
        values.forEach((k, v) -> {
            if (k.group() == group) out.put(k, v);
        });
        return out;
    }

    public List<EvidenceSignal> evidence() {
        return evidence;
    }

    /** Flat {@code group.name -> value} view in declaration order, as handed to a model. */
    public Map<String, Double> asModelInput() {
        Map<String, Double> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k.key(), v.value()));
        return Collections.unmodifiableMap(out);
    }

    @JsonIgnore
    public Map<FeatureName, FeatureValue> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector other)) return false;
        return values.equals(other.values) && evidence.equals(other.evidence);
    }

    @Override
    public int hashCode() {
        return 31 * values.hashCode() + evidence.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureVector" + asModelInput();
    }
}
