package com.demo.underwriting.model;

/** HARD failures make an application Non-Compliant, SOFT failures send it to review. */
public enum RuleSeverity {
    HARD,
    SOFT
}
