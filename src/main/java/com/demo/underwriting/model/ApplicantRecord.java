package com.demo.underwriting.model;

import java.util.List;

/**
 * Identity and financial facts of the applicant as submitted. Lists are
 * copied so the record stays immutable once it enters the pipeline.
 */
public record ApplicantRecord(
        String fullName,
        String email,
        String phone,
        Integer creditScore,
        Double annualIncome,
        Double yearsEmployed,
        List<DeclaredDebt> debts,
        List<SocialProfileRef> socialProfiles
) {
    public ApplicantRecord {
        debts = debts == null ? List.of() : List.copyOf(debts);
        socialProfiles = socialProfiles == null ? List.of() : List.copyOf(socialProfiles);
    }

    public double totalMonthlyDebt() {
        double total = 0.0;
        for (DeclaredDebt d : debts) {
            total += d.monthlyPayment();
        }
        return total;
    }

    /** Monthly debt over monthly income, unclamped. */
    public double debtToIncome() {
        return totalMonthlyDebt() / (annualIncome / 12.0);
    }
}
