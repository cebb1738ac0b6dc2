package com.demo.underwriting.controller.dto;

import com.demo.underwriting.model.ApplicantRecord;
import com.demo.underwriting.model.DeclaredDebt;
import com.demo.underwriting.model.LoanPurpose;
import com.demo.underwriting.model.LoanRecord;
import com.demo.underwriting.model.LoanType;
import com.demo.underwriting.model.Occupancy;
import com.demo.underwriting.model.Platform;
import com.demo.underwriting.model.PropertyRecord;
import com.demo.underwriting.model.PropertyType;
import com.demo.underwriting.model.RuleSeverity;
import com.demo.underwriting.model.SocialProfileRef;
import com.demo.underwriting.model.SubScore;
import com.demo.underwriting.service.compliance.ComplianceThresholds;
import com.demo.underwriting.service.policy.ScoringThresholds;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class AssessmentDtos {

    private AssessmentDtos() {}

    public static class AssessmentRequest {
        @NotNull @Valid
        public Applicant applicant;
        @NotNull @Valid
        public Property property;
        @NotNull @Valid
        public Loan loan;
    }

    public static class Applicant {
        @NotBlank
        public String fullName;
        @Email
        public String email;
        public String phone;
        @NotNull @Min(300) @Max(850)
        public Integer creditScore;
        @NotNull @Positive
        public Double annualIncome;
        @NotNull @PositiveOrZero
        public Double yearsEmployed;
        @Valid
        public List<Debt> debts;
        @Valid @Size(max = 5)
        public List<Profile> socialProfiles;

        public ApplicantRecord toRecord() {
            List<DeclaredDebt> d = new ArrayList<>();
            if (debts != null) debts.forEach(x -> d.add(new DeclaredDebt(x.description, x.monthlyPayment)));
            List<SocialProfileRef> p = new ArrayList<>();
            if (socialProfiles != null) socialProfiles.forEach(x -> p.add(x.toRef()));
            return new ApplicantRecord(fullName, email, phone, creditScore, annualIncome, yearsEmployed, d, p);
        }
    }

    public static class Debt {
        public String description;
        @NotNull @PositiveOrZero
        public Double monthlyPayment;
    }

    /** Either {@code url}, or {@code platform} + {@code identifier}. */
    public static class Profile {
        public Platform platform;
        public String identifier;
        public String url;

        @JsonIgnore
        @AssertTrue(message = "give either url or platform and identifier")
        public boolean isAddressable() {
            boolean hasUrl = url != null && !url.isBlank();
            boolean hasPair = platform != null && identifier != null && !identifier.isBlank();
            return hasUrl || hasPair;
        }

        public SocialProfileRef toRef() {
            if (platform != null && identifier != null && !identifier.isBlank()) {
                return new SocialProfileRef(platform, identifier);
            }
            return SocialProfileRef.fromUrl(url);
        }
    }

    public static class Property {
        public String address;
        @NotNull @Positive
        public Double estimatedValue;
        @NotNull
        public PropertyType propertyType;
        @NotNull
        public Occupancy occupancy;

        public PropertyRecord toRecord() {
            return new PropertyRecord(address, estimatedValue, propertyType, occupancy);
        }
    }

    public static class Loan {
        @NotNull @Positive
        public Double amount;
        @NotNull
        public LoanType loanType;
        @NotNull
        public LoanPurpose purpose;

        public LoanRecord toRecord() {
            return new LoanRecord(amount, loanType, purpose);
        }
    }

    /** Active configuration, read-only. */
    public static class PolicyView {
        public Map<SubScore, Double> weights;
        public ScoringThresholds scoringThresholds;
        public ComplianceThresholds complianceThresholds;
        public List<RuleView> complianceRules;
    }

    public static class RuleView {
        public String id;
        public String description;
        public RuleSeverity severity;

        public RuleView(String id, String description, RuleSeverity severity) {
            this.id = id;
            this.description = description;
            this.severity = severity;
        }
    }
}
