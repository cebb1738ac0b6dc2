package com.demo.underwriting.service.compliance;

import com.demo.underwriting.exception.ConfigurationDefectException;
import com.demo.underwriting.model.LoanPurpose;
import com.demo.underwriting.model.LoanType;
import com.demo.underwriting.model.Occupancy;
import com.demo.underwriting.model.PropertyType;
import com.demo.underwriting.model.RuleSeverity;
import com.demo.underwriting.service.RecordPreconditions;
import com.demo.underwriting.service.compliance.ComplianceRule.Outcome;

import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * The ordered compliance rule table. Built and validated once at startup; a
 * threshold missing for some loan type or occupancy, or a duplicated rule id,
 * is a {@link ConfigurationDefectException}.
 */
public final class ComplianceRuleTable {

    static final String FANNIE_MAE = "Fannie Mae Selling Guide";
    static final String HUD = "HUD Handbook 4000.1";
    static final String VA = "VA Pamphlet 26-7";
    static final String ATR = "Regulation Z, 12 CFR 1026.43 (Ability-to-Repay)";
    static final String FHFA = "FHFA Conforming Loan Limits";

    private final ComplianceThresholds thresholds;
    private final List<ComplianceRule> rules;

    public ComplianceRuleTable(ComplianceThresholds thresholds) {
        this(thresholds, buildRules(thresholds));
    }

    ComplianceRuleTable(ComplianceThresholds thresholds, List<ComplianceRule> rules) {
        validate(thresholds);
        Set<String> ids = new HashSet<>();
        for (ComplianceRule r : rules) {
            if (!ids.add(r.id())) {
                throw new ConfigurationDefectException("duplicate compliance rule id: " + r.id());
            }
        }
        this.thresholds = thresholds;
        this.rules = List.copyOf(rules);
    }

    public static ComplianceRuleTable standard() {
        return new ComplianceRuleTable(ComplianceThresholds.standard());
    }

    public List<ComplianceRule> rules() {
        return rules;
    }

    public ComplianceThresholds thresholds() {
        return thresholds;
    }

    static String programGuide(LoanType type) {
        if (type == LoanType.FHA_30) return HUD;
        if (type == LoanType.VA_30) return VA;
        return FANNIE_MAE;
    }

    private static void validate(ComplianceThresholds t) {
        for (LoanType type : LoanType.values()) {
            Integer credit = t.minCreditScore().get(type);
            if (credit == null) {
                throw new ConfigurationDefectException("no minimum credit score for loan type " + type);
            }
            if (credit < RecordPreconditions.MIN_CREDIT_SCORE || credit > RecordPreconditions.MAX_CREDIT_SCORE) {
                throw new ConfigurationDefectException("minimum credit score for " + type + " out of range: " + credit);
            }
            requireRatio("maximum DTI for " + type, t.maxDti().get(type));
        }
        for (Occupancy o : Occupancy.values()) {
            requireRatio("maximum LTV for " + o, t.maxLtv().get(o));
        }
        requireRatio("preferred DTI", t.preferredDti());
        requireRatio("cash-out maximum LTV", t.cashOutMaxLtv());
        if (!(t.minAnnualIncome() >= 0) || !(t.minEmploymentYears() >= 0) || !(t.conformingLoanLimit() > 0)) {
            throw new ConfigurationDefectException("income, employment and loan limit thresholds must be non-negative");
        }
    }

    private static void requireRatio(String what, Double v) {
        if (v == null) {
            throw new ConfigurationDefectException("no " + what + " configured");
        }
        if (!(v > 0) || v > 2.0) {
            throw new ConfigurationDefectException(what + " must be a ratio in (0, 2], was " + v);
        }
    }

    private static List<ComplianceRule> buildRules(ComplianceThresholds t) {
        Function<LoanType, String> program = ComplianceRuleTable::programGuide;
        List<ComplianceRule> r = new ArrayList<>();

        r.add(new ComplianceRule("CREDIT_MIN", "Minimum credit score for the loan program",
                RuleSeverity.HARD, program, (a, p, l) -> {
            int min = t.minCreditScore().get(l.loanType());
            return new Outcome(String.valueOf(min), String.valueOf(a.creditScore()), a.creditScore() >= min);
        }));
        r.add(new ComplianceRule("DTI_MAX", "Maximum debt-to-income ratio for the loan program",
                RuleSeverity.HARD, program, (a, p, l) -> {
            double max = t.maxDti().get(l.loanType());
            double dti = a.debtToIncome();
            return new Outcome(pct(max), pct(dti), dti <= max);
        }));
        r.add(new ComplianceRule("DTI_PREFERRED", "Debt-to-income within the qualified-mortgage guideline",
                RuleSeverity.SOFT, type -> ATR, (a, p, l) -> {
            double dti = a.debtToIncome();
            return new Outcome(pct(t.preferredDti()), pct(dti), dti <= t.preferredDti());
        }));
        r.add(new ComplianceRule("LTV_MAX", "Maximum loan-to-value for the occupancy type",
                RuleSeverity.HARD, program, (a, p, l) -> {
            double max = t.maxLtv().get(p.occupancy());
            double ltv = l.loanToValue(p);
            return new Outcome(pct(max) + " (" + p.occupancy() + ")", pct(ltv), ltv <= max);
        }));
        r.add(new ComplianceRule("LTV_CASH_OUT", "Maximum loan-to-value for a cash-out refinance",
                RuleSeverity.HARD, program, (a, p, l) -> {
            if (l.purpose() != LoanPurpose.CASH_OUT) {
                return new Outcome(pct(t.cashOutMaxLtv()), "not applicable (" + l.purpose() + ")", true);
            }
            double ltv = l.loanToValue(p);
            return new Outcome(pct(t.cashOutMaxLtv()), pct(ltv), ltv <= t.cashOutMaxLtv());
        }));
        r.add(new ComplianceRule("PROPERTY_ELIGIBLE", "Property type eligible for the loan program",
                RuleSeverity.HARD, program, (a, p, l) -> {
            Set<PropertyType> excluded = t.ineligibleProperties().getOrDefault(l.loanType(), Set.of());
            String threshold = excluded.isEmpty() ? "any property type" : "not " + excluded;
            return new Outcome(threshold, String.valueOf(p.propertyType()), !excluded.contains(p.propertyType()));
        }));
        r.add(new ComplianceRule("GOVERNMENT_OCCUPANCY", "Government-backed loans require owner occupancy",
                RuleSeverity.HARD, program, (a, p, l) -> {
            if (!l.loanType().isGovernmentBacked()) {
                return new Outcome(String.valueOf(Occupancy.PRIMARY), "not applicable (" + l.loanType() + ")", true);
            }
            return new Outcome(String.valueOf(Occupancy.PRIMARY), String.valueOf(p.occupancy()),
                    p.occupancy() == Occupancy.PRIMARY);
        }));
        r.add(new ComplianceRule("INCOME_MIN", "Minimum documented annual income",
                RuleSeverity.HARD, type -> ATR, (a, p, l) ->
                new Outcome(money(t.minAnnualIncome()), money(a.annualIncome()),
                        a.annualIncome() >= t.minAnnualIncome())));
        r.add(new ComplianceRule("EMPLOYMENT_HISTORY", "Two-year employment history",
                RuleSeverity.SOFT, program, (a, p, l) ->
                new Outcome(years(t.minEmploymentYears()), years(a.yearsEmployed()),
                        a.yearsEmployed() >= t.minEmploymentYears())));
        r.add(new ComplianceRule("INVESTMENT_CREDIT", "Higher credit score for investment properties",
                RuleSeverity.SOFT, type -> FANNIE_MAE, (a, p, l) -> {
            String threshold = String.valueOf(t.investmentMinCreditScore());
            if (p.occupancy() != Occupancy.INVESTMENT) {
                return new Outcome(threshold, "not applicable (" + p.occupancy() + ")", true);
            }
            return new Outcome(threshold, String.valueOf(a.creditScore()),
                    a.creditScore() >= t.investmentMinCreditScore());
        }));
        r.add(new ComplianceRule("CONFORMING_LIMIT", "Loan amount within the conforming limit",
                RuleSeverity.SOFT, type -> FHFA, (a, p, l) -> {
            String threshold = money(t.conformingLoanLimit());
            if (l.loanType().isGovernmentBacked()) {
                return new Outcome(threshold, "not applicable (" + l.loanType() + ")", true);
            }
            return new Outcome(threshold, money(l.amount()), l.amount() <= t.conformingLoanLimit());
        }));
        return r;
    }

    private static String pct(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100.0);
    }

    private static String money(double amount) {
        NumberFormat f = NumberFormat.getCurrencyInstance(Locale.US);
        f.setMaximumFractionDigits(0);
        return f.format(amount);
    }

    private static String years(double y) {
        return String.format(Locale.ROOT, "%.1f years", y);
    }
}
