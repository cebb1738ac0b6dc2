package com.demo.underwriting.model;

public enum Occupancy {
    PRIMARY,
    SECOND_HOME,
    INVESTMENT
}
