package com.demo.underwriting.service.compliance;

import com.demo.underwriting.exception.ConfigurationDefectException;
import com.demo.underwriting.model.LoanType;
import com.demo.underwriting.model.Occupancy;
import com.demo.underwriting.model.PropertyType;
import com.demo.underwriting.model.RuleSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ComplianceRuleTable")
class ComplianceRuleTableTest {

    private static ComplianceThresholds withCredit(Map<LoanType, Integer> credit) {
        ComplianceThresholds s = ComplianceThresholds.standard();
        return new ComplianceThresholds(credit, s.maxDti(), s.maxLtv(), s.ineligibleProperties(),
                s.preferredDti(), s.cashOutMaxLtv(), s.minAnnualIncome(), s.minEmploymentYears(),
                s.investmentMinCreditScore(), s.conformingLoanLimit());
    }

    @Test
    @DisplayName("standard table has eleven uniquely named rules")
    void standard() {
        ComplianceRuleTable t = ComplianceRuleTable.standard();

        assertThat(t.rules()).hasSize(11);
        assertThat(t.rules()).filteredOn(r -> r.severity() == RuleSeverity.SOFT)
                .extracting(ComplianceRule::id)
                .containsExactly("DTI_PREFERRED", "EMPLOYMENT_HISTORY", "INVESTMENT_CREDIT", "CONFORMING_LIMIT");
    }

    @Test
    @DisplayName("a loan type without a credit minimum is a configuration defect")
    void missingLoanType() {
        Map<LoanType, Integer> credit = new EnumMap<>(ComplianceThresholds.standard().minCreditScore());
        credit.remove(LoanType.ARM_7_1);

        assertThatThrownBy(() -> new ComplianceRuleTable(withCredit(credit)))
                .isInstanceOf(ConfigurationDefectException.class)
                .hasMessageContaining("ARM_7_1");
    }

    @Test
    @DisplayName("an occupancy without an LTV maximum is a configuration defect")
    void missingOccupancy() {
        ComplianceThresholds s = ComplianceThresholds.standard();
        Map<Occupancy, Double> ltv = new EnumMap<>(s.maxLtv());
        ltv.remove(Occupancy.SECOND_HOME);
        ComplianceThresholds broken = new ComplianceThresholds(s.minCreditScore(), s.maxDti(), ltv,
                Map.<LoanType, Set<PropertyType>>of(), s.preferredDti(), s.cashOutMaxLtv(), s.minAnnualIncome(),
                s.minEmploymentYears(), s.investmentMinCreditScore(), s.conformingLoanLimit());

        assertThatThrownBy(() -> new ComplianceRuleTable(broken))
                .isInstanceOf(ConfigurationDefectException.class)
                .hasMessageContaining("SECOND_HOME");
    }

    @Test
    @DisplayName("an out-of-range credit minimum is a configuration defect")
    void creditOutOfRange() {
        Map<LoanType, Integer> credit = new EnumMap<>(ComplianceThresholds.standard().minCreditScore());
        credit.put(LoanType.VA_30, 900);

        assertThatThrownBy(() -> new ComplianceRuleTable(withCredit(credit)))
                .isInstanceOf(ConfigurationDefectException.class);
    }

    @Test
    @DisplayName("duplicate rule ids are a configuration defect")
    void duplicateIds() {
        ComplianceRuleTable standard = ComplianceRuleTable.standard();
        ComplianceRule first = standard.rules().get(0);

        assertThatThrownBy(() -> new ComplianceRuleTable(standard.thresholds(), List.of(first, first)))
                .isInstanceOf(ConfigurationDefectException.class)
                .hasMessageContaining(first.id());
    }
}
