package com.onboardpilot.orchestrator.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onboardpilot.orchestrator.TestConfigs;
import com.onboardpilot.orchestrator.metrics.PipelineMetrics;
import com.onboardpilot.orchestrator.model.PipelineStage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityGateEngineTest {

    private static final PipelineStage STAGE = PipelineStage.IT_PROVISIONING;

    private final ObjectMapper json = new ObjectMapper();

    private QualityGateEngine engine;
    private SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);
        engine = new QualityGateEngine(TestConfigs.registry(TestConfigs.config()),
                new PipelineMetrics(meters), clock);
    }

    // ------------------------------------------------------------------
    // Pass / fail
    // ------------------------------------------------------------------

    @Test
    void evaluate_allChecksSatisfied_passesWithFullScore() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, payload("""
                {"done": true, "quality_score": 92.5}
                """));

        assertThat(result.status()).isEqualTo(GateStatus.PASSED);
        assertThat(result.passed()).isTrue();
        assertThat(result.score()).isEqualTo(100.0);
        assertThat(result.criticalIssues()).isEmpty();
        assertThat(meters.get("onboardpilot.gate.evaluations")
                .tag("stage", STAGE.name()).tag("status", "PASSED").counter().count()).isEqualTo(1.0);
    }

    @Test
    void evaluate_falseFlag_countsAsMissingField() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, payload("""
                {"done": false, "quality_score": 90}
                """));

        assertThat(result.passed()).isFalse();
        assertThat(result.criticalIssues()).containsExactly("done");
        assertThat(result.fieldChecks()).containsEntry("done", false);
        assertThat(result.recommendations()).contains("Provide a value for 'done'");
    }

    @Test
    void evaluate_emptyStringAndEmptyContainer_countAsMissing() throws Exception {
        QualityGateConfig gate = new QualityGateConfig(List.of("name", "accounts", "meta.owner"), Map.of(),
                List.of(), true, false, null, FailureAction.BLOCK, 0);

        QualityGateResult result = engine.evaluate(STAGE, gate, payload("""
                {"name": " ", "accounts": [], "meta": {"owner": null}}
                """), null, TestConfigs.authorization());

        assertThat(result.criticalIssues()).containsExactly("name", "accounts", "meta.owner");
    }

    @Test
    void evaluate_thresholdBelowMinimum_reportsActualAgainstRequired() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, payload("""
                {"done": true, "quality_score": 75.5}
                """));

        assertThat(result.criticalIssues()).containsExactly("quality_score: 75.5 < 80");
        assertThat(result.score()).isCloseTo(66.67, within(0.001));
        // WARN gate is not a hard block, so a middling score goes to a human
        assertThat(result.status()).isEqualTo(GateStatus.MANUAL_REVIEW);
    }

    @Test
    void evaluate_metricAbsent_printsMissing() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, payload("""
                {"done": true}
                """));

        assertThat(result.criticalIssues()).containsExactly("quality_score: missing < 80");
        assertThat(result.thresholdChecks().get(0).actual()).isNull();
    }

    @Test
    void evaluate_metricOneLevelDown_isFound() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, payload("""
                {"done": true, "metrics": {"quality_score": 80}}
                """));

        assertThat(result.status()).isEqualTo(GateStatus.PASSED);
    }

    @Test
    void evaluate_hardBlockGate_neverFallsBackToManualReview() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, TestConfigs.gate(FailureAction.BLOCK, 2),
                payload("""
                        {"done": true, "quality_score": 10}
                        """), null, TestConfigs.authorization());

        assertThat(result.status()).isEqualTo(GateStatus.FAILED);
    }

    @Test
    void evaluate_provisioningPayloadMissingEquipment_failsWithBothIssues() throws Exception {
        Map<String, Double> thresholds = new LinkedHashMap<>();
        thresholds.put("securityCompliance", 95.0);
        QualityGateConfig gate = new QualityGateConfig(List.of("credentialsCreated", "equipmentAssigned"),
                thresholds, List.of(), true, true, "it_manager", FailureAction.BLOCK, 2);

        QualityGateResult result = engine.evaluate(STAGE, gate, payload("""
                {"credentialsCreated": true, "equipmentAssigned": false, "securityCompliance": 80}
                """), null, TestConfigs.authorization());

        assertThat(result.passed()).isFalse();
        assertThat(result.status()).isEqualTo(GateStatus.FAILED);
        assertThat(result.criticalIssues()).containsExactly("equipmentAssigned", "securityCompliance: 80 < 95");
        assertThat(result.score()).isEqualTo(50.0);
    }

    @Test
    void evaluate_noChecksConfigured_passes() throws Exception {
        QualityGateConfig empty = new QualityGateConfig(List.of(), Map.of(), List.of(),
                false, false, null, FailureAction.WARN, 0);

        QualityGateResult result = engine.evaluate(STAGE, empty, payload("{}"), null, TestConfigs.authorization());

        assertThat(result.status()).isEqualTo(GateStatus.PASSED);
        assertThat(result.score()).isEqualTo(100.0);
    }

    // ------------------------------------------------------------------
    // Custom rules
    // ------------------------------------------------------------------

    @Test
    void evaluate_failingRule_addsWarningNotCriticalIssue() throws Exception {
        QualityGateConfig gate = new QualityGateConfig(List.of(), Map.of(), List.of(
                ValidationRule.minValue("accounts_created", 3),
                ValidationRule.requiredBoolean("mfa_enabled", true)),
                true, false, null, FailureAction.BLOCK, 0);

        QualityGateResult result = engine.evaluate(STAGE, gate, payload("""
                {"accounts_created": 2, "mfa_enabled": true}
                """), null, TestConfigs.authorization());

        assertThat(result.criticalIssues()).isEmpty();
        assertThat(result.warnings()).containsExactly("MIN_VALUE on 'accounts_created': 2 < 3");
        assertThat(result.score()).isCloseTo(83.33, within(0.001));
        assertThat(result.status()).isEqualTo(GateStatus.PASSED);
    }

    @Test
    void evaluate_unknownRuleKind_passesWithWarning() throws Exception {
        ValidationRule custom = new ValidationRule("regex_match", "email", null, null, null, null, null);
        QualityGateConfig gate = new QualityGateConfig(List.of(), Map.of(), List.of(custom),
                false, false, null, FailureAction.WARN, 0);

        QualityGateResult result = engine.evaluate(STAGE, gate, payload("{}"), null, TestConfigs.authorization());

        assertThat(result.passed()).isTrue();
        assertThat(result.ruleChecks()).singleElement().satisfies(c -> assertThat(c.passed()).isTrue());
        assertThat(result.warnings()).singleElement().asString().contains("unrecognized rule kind 'regex_match'");
    }

    @Test
    void evaluate_maxValueAndNotEmptyRules() throws Exception {
        Map<String, Double> none = new LinkedHashMap<>();
        QualityGateConfig gate = new QualityGateConfig(List.of(), none, List.of(
                new ValidationRule("MAX_VALUE", "latency_ms", null, 500.0, null, RuleSeverity.ERROR, ""),
                new ValidationRule("not-empty", "meetings", null, null, null, RuleSeverity.WARNING, "")),
                false, false, null, FailureAction.WARN, 0);

        QualityGateResult result = engine.evaluate(STAGE, gate, payload("""
                {"latency_ms": 750, "meetings": ["kickoff"]}
                """), null, TestConfigs.authorization());

        assertThat(result.warnings()).containsExactly("MAX_VALUE on 'latency_ms': 750 > 500");
        assertThat(result.ruleChecks()).extracting(QualityGateResult.RuleCheck::passed).containsExactly(false, true);
    }

    // ------------------------------------------------------------------
    // Bypass
    // ------------------------------------------------------------------

    @Test
    void evaluate_bypassByHigherRank_movesIssuesIntoWarnings() throws Exception {
        BypassRequest bypass = new BypassRequest("director", "laptop ships tomorrow", "alex");

        QualityGateResult result = engine.evaluate(STAGE, payload("""
                {"done": false, "quality_score": 50}
                """), bypass);

        assertThat(result.status()).isEqualTo(GateStatus.BYPASS);
        assertThat(result.passed()).isTrue();
        assertThat(result.criticalIssues()).isEmpty();
        assertThat(result.warnings()).containsExactly("bypassed: done", "bypassed: quality_score: 50 < 80");
        assertThat(result.bypassReason()).isEqualTo("laptop ships tomorrow (authorized by alex as director)");
    }

    @Test
    void evaluate_bypassBySameRoleName_isGranted() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, payload("{\"done\": false}"),
                new BypassRequest("MANAGER", "approved", "sam"));

        assertThat(result.status()).isEqualTo(GateStatus.BYPASS);
    }

    @Test
    void evaluate_bypassByLowerRank_isRejected() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, payload("{\"done\": false}"),
                new BypassRequest("operator", "please", "sam"));

        assertThat(result.status()).isNotEqualTo(GateStatus.BYPASS);
        assertThat(result.passed()).isFalse();
        assertThat(result.criticalIssues()).contains("done");
        assertThat(result.warnings()).contains(
                "bypass rejected: level 'operator' does not cover required level 'manager'");
    }

    @Test
    void evaluate_bypassBySiblingRoleAtSameRank_isRejected() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, payload("{\"done\": false}"),
                new BypassRequest("it_manager", "please", "sam"));

        assertThat(result.status()).isNotEqualTo(GateStatus.BYPASS);
    }

    @Test
    void evaluate_bypassOnPassingGate_isIgnored() throws Exception {
        QualityGateResult result = engine.evaluate(STAGE, payload("""
                {"done": true, "quality_score": 99}
                """), new BypassRequest("director", "not needed", "alex"));

        assertThat(result.status()).isEqualTo(GateStatus.PASSED);
        assertThat(result.bypassReason()).isNull();
    }

    @Test
    void bypassDenial_nonBypassableGate_explainsWhy() {
        QualityGateConfig locked = new QualityGateConfig(List.of("done"), Map.of(), List.of(),
                true, false, null, FailureAction.BLOCK, 0);

        assertThat(engine.bypassDenial(locked, new BypassRequest("director", "r", "a"), TestConfigs.authorization()))
                .contains("gate is not bypassable");
        assertThat(engine.bypassDenial(TestConfigs.gate(FailureAction.WARN, 1),
                new BypassRequest("director", " ", "a"), TestConfigs.authorization()))
                .contains("a bypass reason is required");
    }

    @Test
    void format_stripsTrailingZeros() {
        assertThat(QualityGateEngine.format(80.0)).isEqualTo("80");
        assertThat(QualityGateEngine.format(92.50)).isEqualTo("92.5");
    }

    private JsonNode payload(String raw) throws Exception {
        return json.readTree(raw);
    }
}
