package com.demo.underwriting.service.risk;

/**
 * Piecewise risk curves for DTI and LTV. Input is a percentage (43.0 = 43 %),
 * output a risk level on 0..100 where higher is worse.
 */
final class RiskCurves {

    private RiskCurves() {}

    static double dtiRisk(double pct) {
        if (pct <= 20) return 5 + pct * 0.5;
        if (pct <= 36) return 15 + (pct - 20) * 0.94;
        if (pct <= 43) return 30 + (pct - 36) * 2.86;
        if (pct <= 50) return 50 + (pct - 43) * 2.86;
        return Math.min(70 + (pct - 50) * 2, 90);
    }

    static double ltvRisk(double pct) {
        if (pct <= 60) return 5 + pct * 0.17;
        if (pct <= 80) return 15 + (pct - 60) * 0.5;
        if (pct <= 90) return 25 + (pct - 80) * 2;
        if (pct <= 95) return 45 + (pct - 90) * 4;
        return Math.min(65 + (pct - 95) * 4, 85);
    }
}
