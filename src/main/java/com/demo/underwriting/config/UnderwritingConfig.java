package com.demo.underwriting.config;

import com.demo.underwriting.service.compliance.ComplianceRuleTable;
import com.demo.underwriting.service.policy.RiskWeights;
import com.demo.underwriting.service.policy.ScoringThresholds;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Read-only scoring configuration, built once; a malformed value stops the context. */
@Configuration
public class UnderwritingConfig {

    @Bean
    public RiskWeights riskWeights(@Value("${underwriting.weights.credit:0.35}") double credit,
                                   @Value("${underwriting.weights.capacity:0.30}") double capacity,
                                   @Value("${underwriting.weights.collateral:0.25}") double collateral,
                                   @Value("${underwriting.weights.fourthFactor:0.10}") double fourthFactor) {
        return new RiskWeights(credit, capacity, collateral, fourthFactor);
    }

    @Bean
    public ScoringThresholds scoringThresholds(
            @Value("${underwriting.thresholds.dtiCeiling:1.0}") double dtiCeiling,
            @Value("${underwriting.thresholds.ltvCeiling:1.0}") double ltvCeiling,
            @Value("${underwriting.thresholds.stabilityHorizonYears:5}") double horizon,
            @Value("${underwriting.thresholds.dtiComfortable:0.36}") double dtiComfortable,
            @Value("${underwriting.thresholds.dtiWarning:0.43}") double dtiWarning,
            @Value("${underwriting.thresholds.ltvWarning:0.80}") double ltvWarning,
            @Value("${underwriting.thresholds.ltvHigh:0.95}") double ltvHigh,
            @Value("${underwriting.thresholds.creditFloor:620}") int creditFloor,
            @Value("${underwriting.thresholds.creditStrong:740}") int creditStrong,
            @Value("${underwriting.thresholds.employmentShortYears:2}") double employmentShort) {
        return new ScoringThresholds(dtiCeiling, ltvCeiling, horizon, dtiComfortable, dtiWarning,
                ltvWarning, ltvHigh, creditFloor, creditStrong, employmentShort);
    }

    @Bean
    public ComplianceRuleTable complianceRuleTable() {
        return ComplianceRuleTable.standard();
    }
}
