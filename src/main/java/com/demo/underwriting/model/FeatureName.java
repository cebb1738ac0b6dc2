package com.demo.underwriting.model;

/**
 * Closed set of feature names. The group is part of the key
 * ({@code professional.job_stability}), so a group being absent from a
 * {@link FeatureVector} is visible from the keys alone.
 */
public enum FeatureName {
    // traditional
    DTI_RATIO(FeatureGroup.TRADITIONAL, "dti_ratio"),
    LTV_RATIO(FeatureGroup.TRADITIONAL, "ltv_ratio"),
    CREDIT_SCORE_NORMALIZED(FeatureGroup.TRADITIONAL, "credit_score_normalized"),
    EMPLOYMENT_STABILITY(FeatureGroup.TRADITIONAL, "employment_stability"),
    INCOME_LEVEL(FeatureGroup.TRADITIONAL, "income_level"),
    PRIMARY_RESIDENCE(FeatureGroup.TRADITIONAL, "primary_residence"),
    CASH_OUT(FeatureGroup.TRADITIONAL, "cash_out"),

    // professional
    JOB_STABILITY(FeatureGroup.PROFESSIONAL, "job_stability"),
    PROFESSIONAL_CREDIBILITY(FeatureGroup.PROFESSIONAL, "credibility"),
    CAREER_TRAJECTORY(FeatureGroup.PROFESSIONAL, "career_trajectory"),

    // lifestyle
    FINANCIAL_RESPONSIBILITY(FeatureGroup.LIFESTYLE, "financial_responsibility"),
    LIFESTYLE_STABILITY(FeatureGroup.LIFESTYLE, "stability"),
    INCOME_LIFESTYLE_ALIGNMENT(FeatureGroup.LIFESTYLE, "income_alignment"),

    // social connectedness
    SOCIAL_SUPPORT(FeatureGroup.SOCIAL, "support"),
    COMMUNITY_ROOTEDNESS(FeatureGroup.SOCIAL, "community_rootedness"),
    RELATIONSHIP_STABILITY(FeatureGroup.SOCIAL, "relationship_stability");

    private final FeatureGroup group;
    private final String localName;

    FeatureName(FeatureGroup group, String localName) {
        this.group = group;
        this.localName = localName;
    }

    public FeatureGroup group() {
        return group;
    }

    public String localName() {
        return localName;
    }

    public String key() {
        return group.key() + "." + localName;
    }
}
