package com.demo.underwriting.model;

/** One recurring monthly obligation declared by the applicant. */
public record DeclaredDebt(String description, double monthlyPayment) {
}
