package com.demo.underwriting.model;

public enum LoanPurpose {
    PURCHASE,
    REFINANCE,
    CASH_OUT
}
