package com.demo.underwriting.service.compliance;

import com.demo.underwriting.model.LoanType;
import com.demo.underwriting.model.Occupancy;
import com.demo.underwriting.model.PropertyType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Regulatory thresholds in raw units: credit points, decimal ratios, dollars
 * and years. Completeness is checked by {@link ComplianceRuleTable}.
 */
public record ComplianceThresholds(
        Map<LoanType, Integer> minCreditScore,
        Map<LoanType, Double> maxDti,
        Map<Occupancy, Double> maxLtv,
        Map<LoanType, Set<PropertyType>> ineligibleProperties,
        double preferredDti,
        double cashOutMaxLtv,
        double minAnnualIncome,
        double minEmploymentYears,
        int investmentMinCreditScore,
        double conformingLoanLimit
) {
    public ComplianceThresholds {
        minCreditScore = frozen(LoanType.class, minCreditScore);
        maxDti = frozen(LoanType.class, maxDti);
        maxLtv = frozen(Occupancy.class, maxLtv);
        ineligibleProperties = frozenSets(ineligibleProperties);
    }

    public static ComplianceThresholds standard() {
        Map<LoanType, Integer> credit = new EnumMap<>(LoanType.class);
        Map<LoanType, Double> dti = new EnumMap<>(LoanType.class);
        for (LoanType t : LoanType.values()) {
            credit.put(t, 620);
            dti.put(t, 0.50);
        }
        credit.put(LoanType.FHA_30, 580);
        credit.put(LoanType.VA_30, 580);
        dti.put(LoanType.FHA_30, 0.57);
        dti.put(LoanType.VA_30, 0.60);

        Map<Occupancy, Double> ltv = new EnumMap<>(Occupancy.class);
        ltv.put(Occupancy.PRIMARY, 0.97);
        ltv.put(Occupancy.SECOND_HOME, 0.90);
        ltv.put(Occupancy.INVESTMENT, 0.85);

        Map<LoanType, Set<PropertyType>> ineligible = new EnumMap<>(LoanType.class);
        ineligible.put(LoanType.ARM_7_1, EnumSet.of(PropertyType.MANUFACTURED));
        ineligible.put(LoanType.ARM_5_1, EnumSet.of(PropertyType.MANUFACTURED));

        return new ComplianceThresholds(credit, dti, ltv, ineligible,
                0.43, 0.80, 15_000, 2.0, 680, 766_550);
    }

    private static <K extends Enum<K>, V> Map<K, V> frozen(Class<K> type, Map<K, V> in) {
        Map<K, V> out = new EnumMap<>(type);
        if (in != null) out.putAll(in);
        return Collections.unmodifiableMap(out);
    }

    private static Map<LoanType, Set<PropertyType>> frozenSets(Map<LoanType, Set<PropertyType>> in) {
        Map<LoanType, Set<PropertyType>> out = new EnumMap<>(LoanType.class);
        if (in != null) {
            in.forEach((type, props) -> {
                Set<PropertyType> copy = EnumSet.noneOf(PropertyType.class);
                if (props != null) copy.addAll(props);
                out.put(type, Collections.unmodifiableSet(copy));
            });
        }
        return Collections.unmodifiableMap(out);
    }
}
