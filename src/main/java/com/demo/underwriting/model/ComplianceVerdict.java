package com.demo.underwriting.model;

public enum ComplianceVerdict {
    COMPLIANT,
    NEEDS_REVIEW,
    NON_COMPLIANT
}
