package com.demo.underwriting.service.features;

import com.demo.underwriting.exception.ConfigurationDefectException;
import com.demo.underwriting.model.ApplicantRecord;
import com.demo.underwriting.model.Contribution;
import com.demo.underwriting.model.EvidenceSignal;
import com.demo.underwriting.model.FeatureGroup;
import com.demo.underwriting.model.FeatureName;
import com.demo.underwriting.model.FeatureValue;
import com.demo.underwriting.model.FeatureVector;
import com.demo.underwriting.model.LoanRecord;
import com.demo.underwriting.model.Polarity;
import com.demo.underwriting.model.ProfileAnalysis;
import com.demo.underwriting.model.PropertyRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges the output of every {@link FeatureProvider} into one {@link FeatureVector}.
 * The traditional group is mandatory and its errors propagate; a profile-derived
 * group is computed only when some analysis informs it and is dropped whole if
 * its provider fails.
 */
@Slf4j
@Service
public class FeatureNormalizer {

    private final List<FeatureProvider> providers;

    public FeatureNormalizer(List<FeatureProvider> providers) {
        boolean hasTraditional = providers.stream().anyMatch(p -> p.group() == FeatureGroup.TRADITIONAL);
        if (!hasTraditional) {
            throw new ConfigurationDefectException("no provider registered for the traditional feature group");
        }
        this.providers = List.copyOf(providers);
    }

    public FeatureVector extract(ApplicantRecord applicant,
                                 PropertyRecord property,
                                 LoanRecord loan,
                                 List<ProfileAnalysis> analyses) {
        List<ProfileAnalysis> all = analyses == null ? List.of() : analyses;
        FeatureInput base = new FeatureInput(applicant, property, loan, List.of());

        Map<FeatureName, FeatureValue> out = new EnumMap<>(FeatureName.class);
        for (FeatureProvider p : providers) {
            FeatureGroup g = p.group();
            if (g == FeatureGroup.TRADITIONAL) {
                // lỗi ở nhóm traditional -> ném ra ngoài
                out.putAll(checked(p, p.compute(base)));
                continue;
            }
            List<ProfileAnalysis> informing = all.stream().filter(a -> a.platform().informs(g)).toList();
            if (informing.isEmpty()) {
                continue;
            }
            out.putAll(safeCompute(p, base.withAnalyses(informing)));
        }

        List<EvidenceSignal> evidence = evidenceSignals(all, out);
        FeatureVector vector = new FeatureVector(out, evidence);
        if (log.isDebugEnabled()) {
            log.debug("Features extracted: groups={} values={}", vector.presentGroups(), vector.asModelInput());
        }
        return vector;
    }

    private Map<FeatureName, FeatureValue> safeCompute(FeatureProvider p, FeatureInput in) {
        try {
            return checked(p, p.compute(in));
        } catch (RuntimeException e) {
            // fail-closed: provider lỗi -> bỏ cả nhóm features
            log.warn("Feature group {} dropped: {}", p.group().key(), e.getMessage());
            return Map.of();
        }
    }

    private static Map<FeatureName, FeatureValue> checked(FeatureProvider p, Map<FeatureName, FeatureValue> part) {
        if (part == null) {
            return Map.of();
        }
        for (FeatureName n : part.keySet()) {
            if (n.group() != p.group()) {
                throw new ConfigurationDefectException(
                        "provider for " + p.group().key() + " returned foreign feature " + n.key());
            }
        }
        return part;
    }

    /** Indicators and red flags of analyses that fed a present group, first occurrence wins. */
    private static List<EvidenceSignal> evidenceSignals(List<ProfileAnalysis> analyses,
                                                        Map<FeatureName, FeatureValue> features) {
        Set<FeatureGroup> present = new LinkedHashSet<>();
        features.keySet().forEach(n -> present.add(n.group()));

        List<EvidenceSignal> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (ProfileAnalysis a : analyses) {
            boolean fed = present.stream().anyMatch(g -> g.isProfileDerived() && a.platform().informs(g));
            if (!fed) continue;
            for (String s : a.positiveIndicators()) {
                addSignal(out, seen, a, Polarity.POSITIVE, s, features);
            }
            for (String s : a.redFlags()) {
                addSignal(out, seen, a, Polarity.NEGATIVE, s, features);
            }
        }
        return out;
    }

    private static void addSignal(List<EvidenceSignal> out, Set<String> seen, ProfileAnalysis a,
                                  Polarity polarity, String text, Map<FeatureName, FeatureValue> features) {
        if (!seen.add(a.platform() + "|" + polarity + "|" + text)) return;
        List<String> affected = new ArrayList<>();
        features.forEach((name, value) -> {
            for (Contribution c : value.contributions()) {
                if (c.source() == Contribution.Source.INDICATOR
                        && c.platform() == a.platform()
                        && c.polarity() == polarity
                        && Objects.equals(c.text(), text)) {
                    affected.add(name.key());
                    break;
                }
            }
        });
        out.add(new EvidenceSignal(a.platform(), polarity, text, affected));
    }
}
