package com.demo.underwriting.service.profile;

import com.demo.underwriting.model.EvidenceWarning;
import com.demo.underwriting.model.ProfileAnalysis;

import java.util.List;

/** Outcome of one collection run: successes in input order and one warning per lost lookup. */
public record EvidenceCollection(int requested, List<ProfileAnalysis> analyses, List<EvidenceWarning> warnings) {

    public EvidenceCollection {
        analyses = List.copyOf(analyses);
        warnings = List.copyOf(warnings);
    }

    public static EvidenceCollection empty() {
        return new EvidenceCollection(0, List.of(), List.of());
    }
}
