package com.demo.underwriting.model;

/** A profile lookup that produced no analysis, and why. */
public record EvidenceWarning(Platform platform, String identifier, String reason) {
}
