package com.demo.underwriting.service;

import com.demo.underwriting.exception.InputDefectException;
import com.demo.underwriting.model.ApplicantRecord;
import com.demo.underwriting.model.DeclaredDebt;
import com.demo.underwriting.model.LoanRecord;
import com.demo.underwriting.model.PropertyRecord;

/**
 * Range checks the core relies on for its own arithmetic. Presence and format
 * are validated upstream; anything caught here is a defect in the caller.
 */
public final class RecordPreconditions {

    public static final int MIN_CREDIT_SCORE = 300;
    public static final int MAX_CREDIT_SCORE = 850;

    private RecordPreconditions() {}

    public static void check(ApplicantRecord applicant, PropertyRecord property, LoanRecord loan) {
        checkApplicant(applicant);
        checkProperty(property);
        checkLoan(loan);
    }

    public static void checkApplicant(ApplicantRecord a) {
        if (a == null) throw new InputDefectException("applicant", "missing");
        Integer score = a.creditScore();
        if (score == null) throw new InputDefectException("applicant.creditScore", "missing");
        if (score < MIN_CREDIT_SCORE || score > MAX_CREDIT_SCORE) {
            throw new InputDefectException("applicant.creditScore", "must be within 300..850, was " + score);
        }
        requirePositive("applicant.annualIncome", a.annualIncome());
        Double years = a.yearsEmployed();
        if (years == null || years.isNaN() || years < 0) {
            throw new InputDefectException("applicant.yearsEmployed", "must be >= 0, was " + years);
        }
        for (DeclaredDebt d : a.debts()) {
            if (d == null || Double.isNaN(d.monthlyPayment()) || d.monthlyPayment() < 0) {
                throw new InputDefectException("applicant.debts", "monthly payment must be >= 0");
            }
        }
    }

    public static void checkProperty(PropertyRecord p) {
        if (p == null) throw new InputDefectException("property", "missing");
        requirePositive("property.estimatedValue", p.estimatedValue());
        if (p.propertyType() == null) throw new InputDefectException("property.propertyType", "missing");
        if (p.occupancy() == null) throw new InputDefectException("property.occupancy", "missing");
    }

    public static void checkLoan(LoanRecord l) {
        if (l == null) throw new InputDefectException("loan", "missing");
        requirePositive("loan.amount", l.amount());
        if (l.loanType() == null) throw new InputDefectException("loan.loanType", "missing");
        if (l.purpose() == null) throw new InputDefectException("loan.purpose", "missing");
    }

    private static void requirePositive(String field, Double v) {
        if (v == null || v.isNaN() || v.isInfinite() || v <= 0) {
            throw new InputDefectException(field, "must be > 0, was " + v);
        }
    }
}
