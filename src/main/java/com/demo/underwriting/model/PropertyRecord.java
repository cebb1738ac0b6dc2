package com.demo.underwriting.model;

public record PropertyRecord(
        String address,
        Double estimatedValue,
        PropertyType propertyType,
        Occupancy occupancy
) {
}
