package com.onboardpilot.orchestrator.recovery;

import com.onboardpilot.orchestrator.model.StageError;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void classify_knownCodes_mapToTheirKind() {
        assertThat(classifier.classify("TIMEOUT")).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify("RATE_LIMITED")).isEqualTo(FailureKind.RESOURCE_EXHAUSTION);
        assertThat(classifier.classify("SERVICE_UNAVAILABLE")).isEqualTo(FailureKind.DEPENDENCY_UNAVAILABLE);
        assertThat(classifier.classify("CORRUPT_OUTPUT")).isEqualTo(FailureKind.STATE_INCONSISTENCY);
        assertThat(classifier.classify("PERMISSION_DENIED")).isEqualTo(FailureKind.UNRECOVERABLE);
    }

    @Test
    void classify_unknownOrMissingCode_isTransient() {
        assertThat(classifier.classify("SOMETHING_NEW")).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify((String) null)).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void classify_lowerCaseCodeFromWorker_isNormalizedByStageError() {
        assertThat(classifier.classify(List.of(new StageError(" quota_exceeded ", "monthly quota"))))
                .isEqualTo(FailureKind.RESOURCE_EXHAUSTION);
    }

    @Test
    void classify_severalErrors_mostSevereWins() {
        List<StageError> errors = List.of(
                new StageError("TIMEOUT", "slow"),
                new StageError("INCONSISTENT_STATE", "duplicate account"),
                new StageError("RATE_LIMITED", "429"));

        assertThat(classifier.classify(errors)).isEqualTo(FailureKind.STATE_INCONSISTENCY);
    }

    @Test
    void classify_noErrors_isTransient() {
        assertThat(classifier.classify(List.of())).isEqualTo(FailureKind.TRANSIENT);
    }
}
