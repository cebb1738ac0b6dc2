package com.demo.underwriting.service.features.providers;

import com.demo.underwriting.model.FeatureGroup;
import com.demo.underwriting.model.FeatureName;
import com.demo.underwriting.service.features.SignalRule;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class LifestyleFeaturesProvider extends ProfileSignalFeaturesProvider {

    private static final List<SignalRule> RULES = List.of(
            new SignalRule(FeatureName.FINANCIAL_RESPONSIBILITY, 0.5,
                    List.of("budget", "saving", "invest", "financial responsibility", "debt-free", "homeowner"),
                    List.of("erratic income", "overspending", "living beyond", "in debt", "debt problems",
                            "collections", "gambling", "casino", "betting", "bankruptcy")),
            new SignalRule(FeatureName.LIFESTYLE_STABILITY, 0.5,
                    List.of("stable lifestyle", "settled", "homeowner", "consistent routine", "family-oriented"),
                    List.of("gambling", "casino", "substance", "excessive alcohol", "drug use", "partying",
                            "reckless")),
            new SignalRule(FeatureName.INCOME_LIFESTYLE_ALIGNMENT, 0.5,
                    List.of("modest", "within means", "within their means", "frugal", "moderate spending"),
                    List.of("beyond means", "beyond apparent means", "beyond their means", "lavish", "luxury",
                            "designer", "expensive travel", "overspending"))
    );

    @Override public FeatureGroup group() { return FeatureGroup.LIFESTYLE; }

    @Override protected List<SignalRule> rules() { return RULES; }
}
