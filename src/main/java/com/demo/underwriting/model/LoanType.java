package com.demo.underwriting.model;

public enum LoanType {
    CONVENTIONAL_30(false),
    CONVENTIONAL_15(false),
    FHA_30(true),
    VA_30(true),
    ARM_7_1(false),
    ARM_5_1(false);

    private final boolean governmentBacked;

    LoanType(boolean governmentBacked) {
        this.governmentBacked = governmentBacked;
    }

    public boolean isGovernmentBacked() {
        return governmentBacked;
    }
}
