package com.demo.underwriting.model;

public enum PropertyType {
    SINGLE_FAMILY,
    TOWNHOUSE,
    CONDO,
    PUD,
    MULTI_UNIT,
    MANUFACTURED
}
