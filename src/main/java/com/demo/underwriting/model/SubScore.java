package com.demo.underwriting.model;

public enum SubScore {
    CREDIT,
    CAPACITY,
    COLLATERAL,
    FOURTH_FACTOR
}
