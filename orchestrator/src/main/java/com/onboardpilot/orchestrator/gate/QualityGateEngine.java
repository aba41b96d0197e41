package com.onboardpilot.orchestrator.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import com.onboardpilot.orchestrator.config.ResilienceConfiguration;
import com.onboardpilot.orchestrator.gate.QualityGateResult.RuleCheck;
import com.onboardpilot.orchestrator.gate.QualityGateResult.ThresholdCheck;
import com.onboardpilot.orchestrator.metrics.PipelineMetrics;
import com.onboardpilot.orchestrator.model.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Validates a stage's output payload before the pipeline may advance past it.
 *
 * An evaluation runs three checks and averages their pass rates into a score:
 * <ol>
 *   <li>Required fields: every dotted path must hold a real value.</li>
 *   <li>Thresholds: every named metric must be {@code >=} its minimum.</li>
 *   <li>Custom rules: a closed set of kinds; unknown kinds pass with a warning.</li>
 * </ol>
 * A gate passes only with no missing fields, no threshold failures and a
 * score of at least {@value #PASS_SCORE}. Missing fields and threshold
 * failures are critical issues; failing custom rules are warnings.
 *
 * <p>A bypass is the only way past a failed gate. It needs a bypassable
 * gate and an authorization level that covers the gate's requirement.
 */
@Component
public class QualityGateEngine {

    private static final Logger log = LoggerFactory.getLogger(QualityGateEngine.class);

    static final double PASS_SCORE = 70.0;

    private final ConfigurationRegistry config;
    private final PipelineMetrics       metrics;
    private final Clock                 clock;

    public QualityGateEngine(ConfigurationRegistry config, PipelineMetrics metrics, Clock clock) {
        this.config  = config;
        this.metrics = metrics;
        this.clock   = clock;
    }

    // ------------------------------------------------------------------
    // Evaluation
    // ------------------------------------------------------------------

    public QualityGateResult evaluate(PipelineStage stage, JsonNode payload) {
        return evaluate(stage, payload, null);
    }

    public QualityGateResult evaluate(PipelineStage stage, JsonNode payload, BypassRequest bypass) {
        ResilienceConfiguration current = config.current();
        return evaluate(stage, current.gate(stage), payload, bypass, current.authorization());
    }

    /**
     * Evaluate {@code payload} against an explicit gate configuration.
     *
     * @param bypass optional; ignored when the gate passes on its own merits
     */
    public QualityGateResult evaluate(PipelineStage stage,
                                      QualityGateConfig gate,
                                      JsonNode payload,
                                      BypassRequest bypass,
                                      AuthorizationLevels authorization) {
        JsonNode root = payload == null ? MissingNode.getInstance() : payload;

        List<String> criticalIssues  = new ArrayList<>();
        List<String> warnings        = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        // ── Required fields ──────────────────────────────────────────────
        Map<String, Boolean> fieldChecks = new LinkedHashMap<>();
        for (String field : gate.requiredFields()) {
            boolean present = PayloadPaths.hasValue(root, field);
            fieldChecks.put(field, present);
            if (!present) {
                criticalIssues.add(field);
                recommendations.add("Provide a value for '" + field + "'");
            }
        }

        // ── Thresholds ───────────────────────────────────────────────────
        List<ThresholdCheck> thresholdChecks = new ArrayList<>();
        for (Map.Entry<String, Double> t : gate.thresholds().entrySet()) {
            String metric   = t.getKey();
            double required = t.getValue();
            OptionalDouble found = PayloadPaths.findMetric(root, metric);
            Double actual = found.isPresent() ? found.getAsDouble() : null;
            boolean ok = actual != null && actual >= required;
            thresholdChecks.add(new ThresholdCheck(metric, required, actual, ok));
            if (!ok) {
                String shown = actual == null ? "missing" : format(actual);
                criticalIssues.add(metric + ": " + shown + " < " + format(required));
                recommendations.add("Raise '" + metric + "' to at least " + format(required));
            }
        }

        // ── Custom rules ─────────────────────────────────────────────────
        List<RuleCheck> ruleChecks = new ArrayList<>();
        for (ValidationRule rule : gate.rules()) {
            RuleCheck check = evaluateRule(root, rule);
            ruleChecks.add(check);
            if (!check.passed()) {
                warnings.add(check.message());
            } else if (RuleKind.parse(rule.kind()).isEmpty()) {
                warnings.add(check.message());
            }
        }

        // ── Score and status ─────────────────────────────────────────────
        double fieldPct     = percent(fieldChecks.values().stream().filter(b -> b).count(), fieldChecks.size());
        double thresholdPct = percent(thresholdChecks.stream().filter(ThresholdCheck::passed).count(), thresholdChecks.size());
        double rulePct      = percent(ruleChecks.stream().filter(RuleCheck::passed).count(), ruleChecks.size());
        double score        = round((fieldPct + thresholdPct + rulePct) / 3.0);

        boolean passed = criticalIssues.isEmpty() && score >= PASS_SCORE;

        GateStatus status;
        if (passed) {
            status = GateStatus.PASSED;
        } else if (score > 0 && score < PASS_SCORE && !gate.isHardBlock()) {
            status = GateStatus.MANUAL_REVIEW;
        } else {
            status = GateStatus.FAILED;
        }

        // ── Bypass ───────────────────────────────────────────────────────
        String bypassReason = null;
        if (!passed && bypass != null) {
            Optional<String> denial = bypassDenial(gate, bypass, authorization);
            if (denial.isEmpty()) {
                for (String issue : criticalIssues) {
                    warnings.add("bypassed: " + issue);
                }
                criticalIssues.clear();
                status       = GateStatus.BYPASS;
                passed       = true;
                bypassReason = describeBypass(bypass);
                log.warn("Quality gate for {} bypassed by '{}' at level '{}': {}",
                        stage, bypass.requestedBy(), bypass.authorizationLevel(), bypass.reason());
            } else {
                warnings.add("bypass rejected: " + denial.get());
            }
        }

        QualityGateResult result = new QualityGateResult(
                stage, status, passed, score,
                fieldChecks, thresholdChecks, ruleChecks,
                criticalIssues, warnings, recommendations,
                bypassReason, clock.instant());

        metrics.gateEvaluated(stage, status);
        log.info("Quality gate {} → {} (score={}, criticalIssues={}, warnings={})",
                stage, status, score, criticalIssues.size(), warnings.size());
        return result;
    }

    /**
     * Explain why a bypass would be refused, or empty when it would be granted.
     */
    public Optional<String> bypassDenial(QualityGateConfig gate,
                                         BypassRequest bypass,
                                         AuthorizationLevels authorization) {
        if (!gate.bypassable()) {
            return Optional.of("gate is not bypassable");
        }
        if (bypass.reason() == null || bypass.reason().isBlank()) {
            return Optional.of("a bypass reason is required");
        }
        if (!authorization.isKnown(bypass.authorizationLevel())) {
            return Optional.of("unknown authorization level '" + bypass.authorizationLevel() + "'");
        }
        if (!authorization.authorizes(bypass.authorizationLevel(), gate.bypassAuthLevel())) {
            return Optional.of("level '" + bypass.authorizationLevel()
                    + "' does not cover required level '" + gate.bypassAuthLevel() + "'");
        }
        return Optional.empty();
    }

    public Optional<String> bypassDenial(PipelineStage stage, BypassRequest bypass) {
        ResilienceConfiguration current = config.current();
        return bypassDenial(current.gate(stage), bypass, current.authorization());
    }

    // ------------------------------------------------------------------
    // Rules
    // ------------------------------------------------------------------

    private RuleCheck evaluateRule(JsonNode root, ValidationRule rule) {
        Optional<RuleKind> kind = RuleKind.parse(rule.kind());
        if (kind.isEmpty()) {
            return new RuleCheck(rule.kind(), rule.field(), rule.severity(), true,
                    "unrecognized rule kind '" + rule.kind() + "' on '" + rule.field() + "' evaluated as pass");
        }

        Optional<JsonNode> node = PayloadPaths.resolve(root, rule.field());
        String label = kind.get() + " on '" + rule.field() + "'";

        return switch (kind.get()) {
            case MIN_VALUE -> {
                OptionalDouble value = numeric(root, node, rule.field());
                double min = rule.minValue() == null ? 0.0 : rule.minValue();
                boolean ok = value.isPresent() && value.getAsDouble() >= min;
                yield new RuleCheck(kind.get().name(), rule.field(), rule.severity(), ok,
                        ok ? label + " satisfied"
                           : label + ": " + shown(value) + " < " + format(min));
            }
            case MAX_VALUE -> {
                OptionalDouble value = numeric(root, node, rule.field());
                double max = rule.maxValue() == null ? Double.MAX_VALUE : rule.maxValue();
                boolean ok = value.isPresent() && value.getAsDouble() <= max;
                yield new RuleCheck(kind.get().name(), rule.field(), rule.severity(), ok,
                        ok ? label + " satisfied"
                           : label + ": " + shown(value) + " > " + format(max));
            }
            case REQUIRED_BOOLEAN -> {
                boolean expected = rule.expected() == null || rule.expected();
                boolean ok = node.isPresent() && node.get().isBoolean() && node.get().booleanValue() == expected;
                yield new RuleCheck(kind.get().name(), rule.field(), rule.severity(), ok,
                        ok ? label + " satisfied"
                           : label + ": expected " + expected + " but was "
                             + node.map(JsonNode::asText).orElse("missing"));
            }
            case NOT_EMPTY -> {
                boolean ok = node.isPresent()
                        && !(node.get().isTextual() && node.get().asText().isBlank())
                        && !(node.get().isContainerNode() && node.get().size() == 0);
                yield new RuleCheck(kind.get().name(), rule.field(), rule.severity(), ok,
                        ok ? label + " satisfied" : label + ": value is empty");
            }
        };
    }

    /** Rule fields may be dotted paths or bare metric names found one level down. */
    private static OptionalDouble numeric(JsonNode root, Optional<JsonNode> node, String field) {
        if (node.isPresent()) return PayloadPaths.asNumber(node.get());
        return field.contains(".") ? OptionalDouble.empty() : PayloadPaths.findMetric(root, field);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double percent(long passed, int total) {
        return total == 0 ? 100.0 : passed * 100.0 / total;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static String shown(OptionalDouble value) {
        return value.isPresent() ? format(value.getAsDouble()) : "missing";
    }

    private static String describeBypass(BypassRequest bypass) {
        String by = bypass.requestedBy() == null || bypass.requestedBy().isBlank()
                ? "unknown operator" : bypass.requestedBy();
        return bypass.reason() + " (authorized by " + by + " as " + bypass.authorizationLevel() + ")";
    }

    /** 80.0 → "80", 92.5 → "92.5". */
    static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
