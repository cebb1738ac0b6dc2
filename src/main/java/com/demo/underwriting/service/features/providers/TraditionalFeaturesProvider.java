package com.demo.underwriting.service.features.providers;

import com.demo.underwriting.model.ApplicantRecord;
import com.demo.underwriting.model.FeatureGroup;
import com.demo.underwriting.model.FeatureName;
import com.demo.underwriting.model.FeatureValue;
import com.demo.underwriting.model.LoanPurpose;
import com.demo.underwriting.model.LoanRecord;
import com.demo.underwriting.model.Occupancy;
import com.demo.underwriting.model.PropertyRecord;
import com.demo.underwriting.service.RecordPreconditions;
import com.demo.underwriting.service.features.FeatureInput;
import com.demo.underwriting.service.features.FeatureProvider;
import com.demo.underwriting.service.policy.ScoringThresholds;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/** Features from the declared applicant, property and loan fields. Always computed. */
@Component
public class TraditionalFeaturesProvider implements FeatureProvider {

    static final double INCOME_CAP = 500_000.0;

    private final ScoringThresholds thresholds;

    public TraditionalFeaturesProvider(ScoringThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override public FeatureGroup group() { return FeatureGroup.TRADITIONAL; }

    @Override
    public Map<FeatureName, FeatureValue> compute(FeatureInput in) {
        ApplicantRecord a = in.applicant();
        PropertyRecord p = in.property();
        LoanRecord l = in.loan();
        RecordPreconditions.check(a, p, l);

        Map<FeatureName, FeatureValue> f = new EnumMap<>(FeatureName.class);
        f.put(FeatureName.DTI_RATIO, FeatureValue.of(clamp(a.debtToIncome() / thresholds.dtiCeiling())));
        f.put(FeatureName.LTV_RATIO, FeatureValue.of(clamp(l.loanToValue(p) / thresholds.ltvCeiling())));
        f.put(FeatureName.CREDIT_SCORE_NORMALIZED, FeatureValue.of(normalizeCreditScore(a.creditScore())));
        f.put(FeatureName.EMPLOYMENT_STABILITY,
                FeatureValue.of(clamp(a.yearsEmployed() / thresholds.stabilityHorizonYears())));
        f.put(FeatureName.INCOME_LEVEL, FeatureValue.of(clamp(a.annualIncome() / INCOME_CAP)));
        f.put(FeatureName.PRIMARY_RESIDENCE, FeatureValue.of(p.occupancy() == Occupancy.PRIMARY ? 1.0 : 0.0));
        f.put(FeatureName.CASH_OUT, FeatureValue.of(l.purpose() == LoanPurpose.CASH_OUT ? 1.0 : 0.0));
        return f;
    }

    public static double normalizeCreditScore(int creditScore) {
        double span = RecordPreconditions.MAX_CREDIT_SCORE - RecordPreconditions.MIN_CREDIT_SCORE;
        return clamp((creditScore - RecordPreconditions.MIN_CREDIT_SCORE) / span);
    }

    static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
