package com.demo.underwriting.service.risk;

import com.demo.underwriting.TestRecords;
import com.demo.underwriting.model.ApplicantRecord;
import com.demo.underwriting.model.EvidenceSignal;
import com.demo.underwriting.model.FeatureName;
import com.demo.underwriting.model.FeatureValue;
import com.demo.underwriting.model.FeatureVector;
import com.demo.underwriting.model.LoanPurpose;
import com.demo.underwriting.model.LoanRecord;
import com.demo.underwriting.model.LoanType;
import com.demo.underwriting.model.Occupancy;
import com.demo.underwriting.model.Platform;
import com.demo.underwriting.model.Polarity;
import com.demo.underwriting.model.PropertyRecord;
import com.demo.underwriting.model.PropertyType;
import com.demo.underwriting.model.RiskAssessment;
import com.demo.underwriting.model.RiskFactor;
import com.demo.underwriting.model.RiskTier;
import com.demo.underwriting.model.SubScore;
import com.demo.underwriting.service.features.FeatureInput;
import com.demo.underwriting.service.features.providers.TraditionalFeaturesProvider;
import com.demo.underwriting.service.policy.RiskWeights;
import com.demo.underwriting.service.policy.ScoringThresholds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RiskScorer")
class RiskScorerTest {

    private final ScoringThresholds thresholds = ScoringThresholds.defaults();
    private final RiskScorer scorer = new RiskScorer(RiskWeights.defaults(), thresholds);
    private final TraditionalFeaturesProvider traditional = new TraditionalFeaturesProvider(thresholds);

    private RiskAssessment score(ApplicantRecord a, PropertyRecord p, LoanRecord l,
                                 Map<FeatureName, FeatureValue> profile, List<EvidenceSignal> evidence) {
        Map<FeatureName, FeatureValue> values = new EnumMap<>(FeatureName.class);
        values.putAll(traditional.compute(new FeatureInput(a, p, l, null)));
        values.putAll(profile);
        return scorer.score(new FeatureVector(values, evidence), a.debtToIncome(), l.loanToValue(p));
    }

    private RiskAssessment score(ApplicantRecord a, PropertyRecord p, LoanRecord l) {
        return score(a, p, l, Map.of(), List.of());
    }

    private static List<String> codes(RiskAssessment r) {
        return r.factors().stream().map(RiskFactor::code).toList();
    }

    @Nested
    @DisplayName("traditional-only application")
    class TraditionalOnly {

        private final RiskAssessment r = score(TestRecords.applicant(), TestRecords.property(), TestRecords.loan());

        @Test
        @DisplayName("omits the fourth factor instead of scoring it")
        void omitsFourthFactor() {
            assertThat(r.hasFourthFactor()).isFalse();
            assertThat(r.subScores()).containsOnlyKeys(SubScore.CREDIT, SubScore.CAPACITY, SubScore.COLLATERAL);
            assertThat(r.appliedWeights()).doesNotContainKey(SubScore.FOURTH_FACTOR);
        }

        @Test
        @DisplayName("renormalizes the weights over the three present sub-scores")
        void weightsSumToOne() {
            double sum = r.appliedWeights().values().stream().mapToDouble(Double::doubleValue).sum();
            assertThat(sum).isCloseTo(1.0, within(1e-9));
            assertThat(r.appliedWeights().get(SubScore.CREDIT)).isCloseTo(0.35 / 0.90, within(1e-9));
        }

        @Test
        @DisplayName("scores a favorable file as low risk")
        void favorable() {
            assertThat(r.subScores().get(SubScore.CREDIT)).isCloseTo(83.45, within(0.001));
            assertThat(r.subScores().get(SubScore.CAPACITY)).isCloseTo(91.84, within(0.001));
            assertThat(r.subScores().get(SubScore.COLLATERAL)).isCloseTo(76.11, within(0.001));
            assertThat(r.compositeScore()).isCloseTo(84.21, within(0.001));
            assertThat(r.tier()).isEqualTo(RiskTier.LOW);
            assertThat(r.dtiRatio()).isCloseTo(0.0632, within(0.0001));
            assertThat(r.ltvRatio()).isCloseTo(0.7778, within(0.0001));
        }

        @Test
        @DisplayName("lists positive contributors tagged to their sub-score")
        void positiveFactors() {
            assertThat(codes(r)).containsExactly("EMPLOYMENT_STABLE", "DTI_COMFORTABLE", "LTV_WITHIN_LIMIT");
            assertThat(r.factorsFor(SubScore.CAPACITY)).singleElement()
                    .satisfies(f -> assertThat(f.polarity()).isEqualTo(Polarity.POSITIVE));
        }
    }

    @Nested
    @DisplayName("with profile evidence")
    class WithProfile {

        private final Map<FeatureName, FeatureValue> professional = Map.of(
                FeatureName.JOB_STABILITY, FeatureValue.of(0.6),
                FeatureName.PROFESSIONAL_CREDIBILITY, FeatureValue.of(0.5),
                FeatureName.CAREER_TRAJECTORY, FeatureValue.of(0.6));

        private final List<EvidenceSignal> evidence = List.of(
                new EvidenceSignal(Platform.LINKEDIN, Polarity.NEGATIVE, "Employment gap in 2021",
                        List.of("professional.job_stability")));

        @Test
        @DisplayName("adds the fourth factor as the mean of profile features")
        void fourthFactor() {
            RiskAssessment r = score(TestRecords.applicant(), TestRecords.property(), TestRecords.loan(),
                    professional, evidence);

            assertThat(r.hasFourthFactor()).isTrue();
            assertThat(r.subScores().get(SubScore.FOURTH_FACTOR)).isCloseTo(56.67, within(0.001));
            double sum = r.appliedWeights().values().stream().mapToDouble(Double::doubleValue).sum();
            assertThat(sum).isCloseTo(1.0, within(1e-9));
            assertThat(r.appliedWeights().get(SubScore.FOURTH_FACTOR)).isCloseTo(0.10, within(1e-9));
        }

        @Test
        @DisplayName("every red flag shows up as a fourth-factor factor")
        void redFlagFactor() {
            RiskAssessment r = score(TestRecords.applicant(), TestRecords.property(), TestRecords.loan(),
                    professional, evidence);

            assertThat(r.factorsFor(SubScore.FOURTH_FACTOR)).singleElement().satisfies(f -> {
                assertThat(f.code()).isEqualTo("PROFILE_RED_FLAG");
                assertThat(f.polarity()).isEqualTo(Polarity.NEGATIVE);
                assertThat(f.reason()).contains("Employment gap in 2021");
                assertThat(f.features()).containsExactly("professional.job_stability");
            });
        }
    }

    @Nested
    @DisplayName("negative contributors")
    class Negative {

        @Test
        @DisplayName("DTI at or above the ceiling floors capacity and is reported")
        void dtiFloor() {
            // 1500/month against 12k income -> DTI 1.5
            ApplicantRecord a = TestRecords.applicant(700, 12_000, 1_500, 3);

            RiskAssessment r = score(a, TestRecords.property(), TestRecords.loan());

            assertThat(r.subScores().get(SubScore.CAPACITY)).isEqualTo(0.0);
            assertThat(r.dtiRatio()).isCloseTo(1.5, within(1e-9));
            assertThat(r.factorsFor(SubScore.CAPACITY)).singleElement().satisfies(f -> {
                assertThat(f.code()).isEqualTo("DTI_AT_CEILING");
                assertThat(f.polarity()).isEqualTo(Polarity.NEGATIVE);
                assertThat(f.reason()).contains("150.0%");
            });
        }

        @Test
        @DisplayName("credit below the floor and a short history are both reported")
        void weakCredit() {
            ApplicantRecord a = TestRecords.applicant(580, 95_000, 500, 1);

            RiskAssessment r = score(a, TestRecords.property(), TestRecords.loan());

            assertThat(codes(r)).contains("CREDIT_BELOW_FLOOR", "EMPLOYMENT_SHORT");
            assertThat(r.factorsFor(SubScore.CREDIT)).allMatch(f -> f.polarity() == Polarity.NEGATIVE);
        }

        @Test
        @DisplayName("DTI above the warning threshold is reported")
        void dtiWarning() {
            // 3000/month against 72k income -> DTI 0.50
            ApplicantRecord a = TestRecords.applicant(700, 72_000, 3_000, 3);

            RiskAssessment r = score(a, TestRecords.property(), TestRecords.loan());

            assertThat(codes(r)).contains("DTI_ABOVE_WARNING");
            assertThat(r.subScores().get(SubScore.CAPACITY)).isCloseTo(29.98, within(0.001));
        }

        @Test
        @DisplayName("LTV above the high threshold is reported")
        void ltvHigh() {
            PropertyRecord p = TestRecords.property(100_000, PropertyType.CONDO, Occupancy.PRIMARY);
            LoanRecord l = TestRecords.loan(97_000, LoanType.FHA_30, LoanPurpose.PURCHASE);

            RiskAssessment r = score(TestRecords.applicant(), p, l);

            assertThat(codes(r)).contains("LTV_HIGH");
            assertThat(r.subScores().get(SubScore.COLLATERAL)).isCloseTo(27.0, within(0.01));
        }
    }

    @ParameterizedTest(name = "composite {0} -> {1}")
    @CsvSource({
            "100.0, LOW",
            "80.0, LOW",
            "79.99, MODERATE",
            "60.0, MODERATE",
            "59.99, ELEVATED",
            "40.0, ELEVATED",
            "39.99, HIGH",
            "0.0, HIGH"
    })
    void tierBoundariesIncludeLowerBound(double composite, RiskTier expected) {
        assertThat(RiskTier.forComposite(composite)).isEqualTo(expected);
    }

    @Test
    @DisplayName("tier follows the unrounded composite; only the reported scores are rounded")
    void tierBeforeRounding() {
        // mỗi sub-score ~79.996
        Map<FeatureName, FeatureValue> values = new EnumMap<>(FeatureName.class);
        values.putAll(traditional.compute(new FeatureInput(TestRecords.applicant(), TestRecords.property(),
                TestRecords.loan(), null)));
        values.put(FeatureName.CREDIT_SCORE_NORMALIZED, FeatureValue.of(0.49996 / 0.7));
        values.put(FeatureName.EMPLOYMENT_STABILITY, FeatureValue.of(1.0));
        double dti = (20 + 5.004 / 0.94) / 100.0;
        double ltv = 0.70008;

        RiskAssessment r = scorer.score(new FeatureVector(values, List.of()), dti, ltv);

        assertThat(r.subScores().get(SubScore.CREDIT)).isEqualTo(80.0);
        assertThat(r.subScores().get(SubScore.CAPACITY)).isEqualTo(80.0);
        assertThat(r.subScores().get(SubScore.COLLATERAL)).isEqualTo(80.0);
        assertThat(r.compositeScore()).isEqualTo(80.0);
        assertThat(r.tier()).isEqualTo(RiskTier.MODERATE);
    }

    @Test
    @DisplayName("same inputs give an equal assessment")
    void deterministic() {
        assertThat(score(TestRecords.applicant(), TestRecords.property(), TestRecords.loan()))
                .isEqualTo(score(TestRecords.applicant(), TestRecords.property(), TestRecords.loan()));
    }
}
