package com.demo.underwriting.service.features.providers;

import com.demo.underwriting.model.Contribution;
import com.demo.underwriting.model.FeatureName;
import com.demo.underwriting.model.FeatureValue;
import com.demo.underwriting.model.Polarity;
import com.demo.underwriting.model.ProfileAnalysis;
import com.demo.underwriting.service.features.FeatureInput;
import com.demo.underwriting.service.features.FeatureProvider;
import com.demo.underwriting.service.features.SignalRule;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores a profile-derived group by keyword presence. Each rule starts at its
 * baseline; a matching indicator or red flag moves it by a fixed step and a
 * matching narrative phrase by a smaller one, all scaled by the analysis'
 * confidence. Every move is kept as a {@link Contribution}.
 */
public abstract class ProfileSignalFeaturesProvider implements FeatureProvider {

    static final double INDICATOR_STEP = 0.10;
    static final double RED_FLAG_STEP = 0.15;
    static final double NARRATIVE_STEP = 0.05;

    private static final Pattern NEGATION = Pattern.compile("\\b(?:no|not|never|without|free of)\\b");
    private static final int NEGATION_WINDOW = 20;

    protected abstract List<SignalRule> rules();

    @Override
    public Map<FeatureName, FeatureValue> compute(FeatureInput in) {
        Map<FeatureName, FeatureValue> f = new EnumMap<>(FeatureName.class);
        if (in.analyses().isEmpty()) {
            return f;
        }
        for (SignalRule rule : rules()) {
            f.put(rule.feature(), evaluate(rule, in.analyses()));
        }
        return f;
    }

    private FeatureValue evaluate(SignalRule rule, List<ProfileAnalysis> analyses) {
        double score = rule.baseline();
        List<Contribution> contributions = new ArrayList<>();

        for (ProfileAnalysis a : analyses) {
            double w = a.confidence().weight();
            Set<String> credited = new HashSet<>();

            for (String indicator : a.positiveIndicators()) {
                String term = firstMatch(indicator, rule.positiveTerms());
                if (term != null) {
                    double delta = INDICATOR_STEP * w;
                    score += delta;
                    credited.add(term);
                    contributions.add(new Contribution(a.platform(), Polarity.POSITIVE,
                            Contribution.Source.INDICATOR, indicator, delta));
                }
            }
            for (String flag : a.redFlags()) {
                String term = firstMatch(flag, rule.negativeTerms());
                if (term != null) {
                    double delta = -RED_FLAG_STEP * w;
                    score += delta;
                    credited.add(term);
                    contributions.add(new Contribution(a.platform(), Polarity.NEGATIVE,
                            Contribution.Source.INDICATOR, flag, delta));
                }
            }

            String narrative = a.narrative() == null ? "" : a.narrative().toLowerCase(Locale.ROOT);
            for (String term : rule.positiveTerms()) {
                if (!credited.contains(term) && mentions(narrative, term)) {
                    double delta = NARRATIVE_STEP * w;
                    score += delta;
                    contributions.add(new Contribution(a.platform(), Polarity.POSITIVE,
                            Contribution.Source.NARRATIVE, term, delta));
                }
            }
            for (String term : rule.negativeTerms()) {
                if (!credited.contains(term) && mentions(narrative, term)) {
                    double delta = -NARRATIVE_STEP * w;
                    score += delta;
                    contributions.add(new Contribution(a.platform(), Polarity.NEGATIVE,
                            Contribution.Source.NARRATIVE, term, delta));
                }
            }
        }
        return new FeatureValue(TraditionalFeaturesProvider.clamp(score), contributions);
    }

    private static String firstMatch(String text, List<String> terms) {
        if (text == null) return null;
        String t = text.toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (t.contains(term)) return term;
        }
        return null;
    }

    /** True when {@code term} occurs at least once without a negation just before it. */
    static boolean mentions(String lowerText, String term) {
        int from = 0;
        while (true) {
            int idx = lowerText.indexOf(term, from);
            if (idx < 0) return false;
            String before = lowerText.substring(Math.max(0, idx - NEGATION_WINDOW), idx);
            if (!NEGATION.matcher(before).find()) return true;
            from = idx + term.length();
        }
    }
}
