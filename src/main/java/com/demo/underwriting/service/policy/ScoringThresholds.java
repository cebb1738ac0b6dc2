package com.demo.underwriting.service.policy;

import com.demo.underwriting.exception.ConfigurationDefectException;

/**
 * Ceilings and warning levels shared by the feature normalizer and the risk
 * scorer. Ratios are decimals (0.43 = 43 %).
 */
public record ScoringThresholds(
        double dtiCeiling,
        double ltvCeiling,
        double stabilityHorizonYears,
        double dtiComfortable,
        double dtiWarning,
        double ltvWarning,
        double ltvHigh,
        int creditFloor,
        int creditStrong,
        double employmentShortYears
) {
    public ScoringThresholds {
        requirePositive("dtiCeiling", dtiCeiling);
        requirePositive("ltvCeiling", ltvCeiling);
        requirePositive("stabilityHorizonYears", stabilityHorizonYears);
        requirePositive("dtiComfortable", dtiComfortable);
        requirePositive("ltvWarning", ltvWarning);
        if (!(dtiComfortable <= dtiWarning && dtiWarning <= dtiCeiling)) {
            throw new ConfigurationDefectException(
                    "DTI thresholds must satisfy comfortable <= warning <= ceiling: "
                            + dtiComfortable + ", " + dtiWarning + ", " + dtiCeiling);
        }
        if (!(ltvWarning <= ltvHigh && ltvHigh <= ltvCeiling)) {
            throw new ConfigurationDefectException(
                    "LTV thresholds must satisfy warning <= high <= ceiling: "
                            + ltvWarning + ", " + ltvHigh + ", " + ltvCeiling);
        }
        if (creditFloor < 300 || creditStrong > 850 || creditFloor >= creditStrong) {
            throw new ConfigurationDefectException(
                    "credit thresholds must satisfy 300 <= floor < strong <= 850: " + creditFloor + ", " + creditStrong);
        }
        if (employmentShortYears < 0 || employmentShortYears > stabilityHorizonYears) {
            throw new ConfigurationDefectException(
                    "employmentShortYears must be within 0.." + stabilityHorizonYears + ": " + employmentShortYears);
        }
    }

    public static ScoringThresholds defaults() {
        return new ScoringThresholds(1.0, 1.0, 5.0, 0.36, 0.43, 0.80, 0.95, 620, 740, 2.0);
    }

    private static void requirePositive(String name, double v) {
        if (!(v > 0) || Double.isInfinite(v)) {
            throw new ConfigurationDefectException(name + " must be a positive number, was " + v);
        }
    }
}
