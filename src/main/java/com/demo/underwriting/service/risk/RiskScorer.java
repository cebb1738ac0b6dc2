package com.demo.underwriting.service.risk;

import com.demo.underwriting.model.EvidenceSignal;
import com.demo.underwriting.model.FeatureGroup;
import com.demo.underwriting.model.FeatureName;
import com.demo.underwriting.model.FeatureValue;
import com.demo.underwriting.model.FeatureVector;
import com.demo.underwriting.model.Polarity;
import com.demo.underwriting.model.RiskAssessment;
import com.demo.underwriting.model.RiskFactor;
import com.demo.underwriting.model.RiskTier;
import com.demo.underwriting.model.SubScore;
import com.demo.underwriting.service.RecordPreconditions;
import com.demo.underwriting.service.policy.RiskWeights;
import com.demo.underwriting.service.policy.ScoringThresholds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Credit, capacity, collateral and (when profile evidence exists) fourth-factor
 * sub-scores on 0..100, combined with {@link RiskWeights} renormalized over the
 * sub-scores present. Pure function of its arguments and the configuration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskScorer {

    static final double CREDIT_SCORE_SHARE = 0.70;
    static final double EMPLOYMENT_SHARE = 0.30;
    static final double CAPACITY_FLOOR = 0.0;

    private final RiskWeights weights;
    private final ScoringThresholds thresholds;

    public RiskAssessment score(FeatureVector features, double dtiRatioRaw, double ltvRatioRaw) {
        List<RiskFactor> factors = new ArrayList<>();
        Map<SubScore, Double> sub = new EnumMap<>(SubScore.class);

        sub.put(SubScore.CREDIT, creditScore(features, factors));
        sub.put(SubScore.CAPACITY, capacityScore(features, dtiRatioRaw, factors));
        sub.put(SubScore.COLLATERAL, collateralScore(ltvRatioRaw, factors));
        if (features.hasProfileEvidence()) {
            sub.put(SubScore.FOURTH_FACTOR, fourthFactorScore(features, factors));
        }

        Map<SubScore, Double> applied = weights.renormalized(sub.keySet());
        double exact = 0.0;
        for (Map.Entry<SubScore, Double> e : sub.entrySet()) {
            exact += applied.get(e.getKey()) * e.getValue();
        }
        // tier theo điểm chưa làm tròn; 79.996 vẫn là MODERATE
        RiskTier tier = RiskTier.forComposite(exact);
        double composite = round2(exact);
        sub.replaceAll((k, v) -> round2(v));

        log.debug("Risk sub-scores={} weights={} composite={} tier={}", sub, applied, composite, tier);
        return new RiskAssessment(sub, applied, composite, tier, factors,
                dtiRatioRaw, ltvRatioRaw, features.presentGroups(), features.absentGroups());
    }

    private double creditScore(FeatureVector f, List<RiskFactor> factors) {
        double csn = f.value(FeatureName.CREDIT_SCORE_NORMALIZED);
        double emp = f.value(FeatureName.EMPLOYMENT_STABILITY);

        long creditPoints = Math.round(RecordPreconditions.MIN_CREDIT_SCORE
                + csn * (RecordPreconditions.MAX_CREDIT_SCORE - RecordPreconditions.MIN_CREDIT_SCORE));
        List<String> creditKey = List.of(FeatureName.CREDIT_SCORE_NORMALIZED.key());
        if (creditPoints < thresholds.creditFloor()) {
            factors.add(new RiskFactor(SubScore.CREDIT, Polarity.NEGATIVE, "CREDIT_BELOW_FLOOR",
                    "Credit score " + creditPoints + " is below " + thresholds.creditFloor(), creditKey));
        } else if (creditPoints >= thresholds.creditStrong()) {
            factors.add(new RiskFactor(SubScore.CREDIT, Polarity.POSITIVE, "CREDIT_STRONG",
                    "Credit score " + creditPoints + " is at or above " + thresholds.creditStrong(), creditKey));
        }

        double years = emp * thresholds.stabilityHorizonYears();
        List<String> empKey = List.of(FeatureName.EMPLOYMENT_STABILITY.key());
        if (years < thresholds.employmentShortYears()) {
            factors.add(new RiskFactor(SubScore.CREDIT, Polarity.NEGATIVE, "EMPLOYMENT_SHORT",
                    String.format(Locale.ROOT, "Employment history of %.1f years is shorter than %.1f years",
                            years, thresholds.employmentShortYears()), empKey));
        } else if (emp >= 1.0) {
            factors.add(new RiskFactor(SubScore.CREDIT, Polarity.POSITIVE, "EMPLOYMENT_STABLE",
                    String.format(Locale.ROOT, "Employed for at least %.0f years", thresholds.stabilityHorizonYears()), empKey));
        }

        return 100.0 * (CREDIT_SCORE_SHARE * csn + EMPLOYMENT_SHARE * emp);
    }

    private double capacityScore(FeatureVector f, double dtiRaw, List<RiskFactor> factors) {
        List<String> key = List.of(FeatureName.DTI_RATIO.key());
        String pct = percent(dtiRaw);
        if (dtiRaw >= thresholds.dtiCeiling() || f.value(FeatureName.DTI_RATIO) >= 1.0) {
            // clamp giấu mức DTI thực, nên ghi rõ vào factor
            factors.add(new RiskFactor(SubScore.CAPACITY, Polarity.NEGATIVE, "DTI_AT_CEILING",
                    "Debt-to-income of " + pct + " reaches the " + percent(thresholds.dtiCeiling())
                            + " ceiling; capacity floored", key));
            return CAPACITY_FLOOR;
        }
        if (dtiRaw > thresholds.dtiWarning()) {
            factors.add(new RiskFactor(SubScore.CAPACITY, Polarity.NEGATIVE, "DTI_ABOVE_WARNING",
                    "Debt-to-income of " + pct + " exceeds " + percent(thresholds.dtiWarning()), key));
        } else if (dtiRaw <= thresholds.dtiComfortable()) {
            factors.add(new RiskFactor(SubScore.CAPACITY, Polarity.POSITIVE, "DTI_COMFORTABLE",
                    "Debt-to-income of " + pct + " is within " + percent(thresholds.dtiComfortable()), key));
        }
        return clamp100(100.0 - RiskCurves.dtiRisk(dtiRaw * 100.0));
    }

    private double collateralScore(double ltvRaw, List<RiskFactor> factors) {
        List<String> key = List.of(FeatureName.LTV_RATIO.key());
        String pct = percent(ltvRaw);
        if (ltvRaw > thresholds.ltvHigh()) {
            factors.add(new RiskFactor(SubScore.COLLATERAL, Polarity.NEGATIVE, "LTV_HIGH",
                    "Loan-to-value of " + pct + " exceeds " + percent(thresholds.ltvHigh()), key));
        } else if (ltvRaw > thresholds.ltvWarning()) {
            factors.add(new RiskFactor(SubScore.COLLATERAL, Polarity.NEGATIVE, "LTV_ABOVE_WARNING",
                    "Loan-to-value of " + pct + " exceeds " + percent(thresholds.ltvWarning()), key));
        } else {
            factors.add(new RiskFactor(SubScore.COLLATERAL, Polarity.POSITIVE, "LTV_WITHIN_LIMIT",
                    "Loan-to-value of " + pct + " is within " + percent(thresholds.ltvWarning()), key));
        }
        return clamp100(100.0 - RiskCurves.ltvRisk(ltvRaw * 100.0));
    }

    private double fourthFactorScore(FeatureVector f, List<RiskFactor> factors) {
        double sum = 0.0;
        int n = 0;
        for (FeatureGroup g : f.presentGroups()) {
            if (!g.isProfileDerived()) continue;
            for (FeatureValue v : f.group(g).values()) {
                sum += v.value();
                n++;
            }
        }
        for (EvidenceSignal s : f.evidence()) {
            boolean red = s.polarity() == Polarity.NEGATIVE;
            factors.add(new RiskFactor(SubScore.FOURTH_FACTOR, s.polarity(),
                    red ? "PROFILE_RED_FLAG" : "PROFILE_POSITIVE",
                    (red ? "Red flag (" : "Positive indicator (") + s.platform().category() + "): " + s.text(),
                    s.affectedFeatures()));
        }
        return n == 0 ? 0.0 : 100.0 * sum / n;
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100.0);
    }

    private static double clamp100(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
