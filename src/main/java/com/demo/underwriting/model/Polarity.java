package com.demo.underwriting.model;

public enum Polarity {
    POSITIVE,
    NEGATIVE
}
