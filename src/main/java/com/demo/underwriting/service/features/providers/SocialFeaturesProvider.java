package com.demo.underwriting.service.features.providers;

import com.demo.underwriting.model.FeatureGroup;
import com.demo.underwriting.model.FeatureName;
import com.demo.underwriting.service.features.SignalRule;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SocialFeaturesProvider extends ProfileSignalFeaturesProvider {

    private static final List<SignalRule> RULES = List.of(
            new SignalRule(FeatureName.SOCIAL_SUPPORT, 0.5,
                    List.of("family", "close friends", "long-term friendships", "support network",
                            "strong network"),
                    List.of("isolation", "isolated", "conflict", "drama", "estranged")),
            new SignalRule(FeatureName.COMMUNITY_ROOTEDNESS, 0.5,
                    List.of("community", "volunteer", "charity", "local ties", "church", "neighborhood"),
                    List.of("frequent moves", "relocat", "transient", "no local ties")),
            new SignalRule(FeatureName.RELATIONSHIP_STABILITY, 0.5,
                    List.of("married", "stable relationship", "long-term relationship", "spouse"),
                    List.of("divorce", "breakup", "separated", "relationship instability", "custody dispute"))
    );

    @Override public FeatureGroup group() { return FeatureGroup.SOCIAL; }

    @Override protected List<SignalRule> rules() { return RULES; }
}
