package com.demo.underwriting.model;

public record LoanRecord(
        Double amount,
        LoanType loanType,
        LoanPurpose purpose
) {
    /** Loan amount over property value, unclamped. */
    public double loanToValue(PropertyRecord property) {
        return amount / property.estimatedValue();
    }
}
