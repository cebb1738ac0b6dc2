package com.demo.underwriting.controller;

import com.demo.underwriting.controller.dto.AssessmentDtos.AssessmentRequest;
import com.demo.underwriting.controller.dto.AssessmentDtos.PolicyView;
import com.demo.underwriting.controller.dto.AssessmentDtos.RuleView;
import com.demo.underwriting.model.UnderwritingResult;
import com.demo.underwriting.service.UnderwritingPipeline;
import com.demo.underwriting.service.compliance.ComplianceRuleTable;
import com.demo.underwriting.service.policy.RiskWeights;
import com.demo.underwriting.service.policy.ScoringThresholds;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/assessments")
public class AssessmentController {

    private final UnderwritingPipeline pipeline;
    private final RiskWeights weights;
    private final ScoringThresholds thresholds;
    private final ComplianceRuleTable rules;

    public AssessmentController(UnderwritingPipeline pipeline,
                                RiskWeights weights,
                                ScoringThresholds thresholds,
                                ComplianceRuleTable rules) {
        this.pipeline = pipeline;
        this.weights = weights;
        this.thresholds = thresholds;
        this.rules = rules;
    }

    /** Chạy toàn bộ pipeline cho một hồ sơ */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public UnderwritingResult assess(@Valid @RequestBody AssessmentRequest req) {
        return pipeline.run(req.applicant.toRecord(), req.property.toRecord(), req.loan.toRecord());
    }

    /** Weights, thresholds và bảng rule đang dùng */
    @GetMapping("/policy")
    public PolicyView policy() {
        PolicyView v = new PolicyView();
        v.weights = weights.asMap();
        v.scoringThresholds = thresholds;
        v.complianceThresholds = rules.thresholds();
        v.complianceRules = rules.rules().stream()
                .map(r -> new RuleView(r.id(), r.description(), r.severity()))
                .toList();
        return v;
    }
}
