package com.demo.underwriting.service.features.providers;

import com.demo.underwriting.model.FeatureGroup;
import com.demo.underwriting.model.FeatureName;
import com.demo.underwriting.service.features.SignalRule;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ProfessionalFeaturesProvider extends ProfileSignalFeaturesProvider {

    private static final List<SignalRule> RULES = List.of(
            new SignalRule(FeatureName.JOB_STABILITY, 0.5,
                    List.of("long-term employment", "long tenure", "stable employment", "steady employment",
                            "same employer", "consistent employment"),
                    List.of("frequent job change", "job hopping", "employment gap", "gap in employment",
                            "unemployed", "short tenure", "laid off")),
            new SignalRule(FeatureName.PROFESSIONAL_CREDIBILITY, 0.5,
                    List.of("degree", "certified", "certification", "licensed", "recommendation",
                            "endorsement", "award", "publication"),
                    List.of("inconsisten", "unverified", "discrepanc", "misrepresent", "fabricated")),
            new SignalRule(FeatureName.CAREER_TRAJECTORY, 0.5,
                    List.of("promotion", "promoted", "career growth", "professional growth", "advancement",
                            "increasing responsibility"),
                    List.of("declining", "demotion", "demoted", "stagnant", "downward"))
    );

    @Override public FeatureGroup group() { return FeatureGroup.PROFESSIONAL; }

    @Override protected List<SignalRule> rules() { return RULES; }
}
