package com.eainde.analysis.state;

import com.eainde.analysis.AnalysisFixtures;
import com.eainde.analysis.error.ErrorKind;
import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.model.UsageCounters;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineLedgerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private PipelineLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PipelineLedger("run-1", AnalysisFixtures.key(), T0);
    }

    private static StageResult ok(StageName stage, int second) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("stage", stage.name());
        return StageResult.success(stage, payload, T0.plusSeconds(second), T0.plusSeconds(second + 1),
                new UsageCounters(10, 5, 15, 0.01));
    }

    private void appendAll() {
        int second = 0;
        for (StageName stage : StageName.values()) {
            ledger.append(ok(stage, second));
            second += 2;
        }
    }

    private static AnalysisReport report() {
        return new AnalysisReport("ACME", "Acme", "2024", "PKR", "text", List.of(), null);
    }

    @Nested
    @DisplayName("append()")
    class Append {

        @Test
        @DisplayName("should accept stages in canonical order")
        void append_shouldAcceptCanonicalOrder() {
            // Arrange
            ledger.markRunning();

            // Act
            appendAll();

            // Assert
            assertThat(ledger.snapshot().stages()).extracting(StageResult::stage)
                    .containsExactly(StageName.values());
            assertThat(ledger.nextStage()).isEmpty();
        }

        @Test
        @DisplayName("should reject a stage out of order")
        void append_shouldRejectSkippedStage() {
            // Arrange
            ledger.markRunning();
            ledger.append(ok(StageName.EXTRACT, 0));

            // Act & Assert
            assertThatThrownBy(() -> ledger.append(ok(StageName.VALIDATE, 2)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("expects CALCULATE");
        }

        @Test
        @DisplayName("should reject a stage recorded twice")
        void append_shouldRejectDuplicate() {
            ledger.markRunning();
            ledger.append(ok(StageName.EXTRACT, 0));

            assertThatThrownBy(() -> ledger.append(ok(StageName.EXTRACT, 2)))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should reject a stage that started before its predecessor finished")
        void append_shouldRejectOverlappingStage() {
            ledger.markRunning();
            ledger.append(ok(StageName.EXTRACT, 0));

            StageResult overlapping = StageResult.success(StageName.CALCULATE, null,
                    T0, T0.plusSeconds(5), UsageCounters.ZERO);

            assertThatThrownBy(() -> ledger.append(overlapping))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("started before EXTRACT finished");
        }

        @Test
        @DisplayName("should reject anything after a failed stage")
        void append_shouldRejectAfterFailure() {
            // Arrange
            ledger.markRunning();
            ledger.append(StageResult.failure(StageName.EXTRACT, null,
                    new StageError(ErrorKind.SCHEMA_VALIDATION, "bad"), T0, T0, UsageCounters.ZERO));

            // Act & Assert
            assertThatThrownBy(() -> ledger.append(ok(StageName.CALCULATE, 1)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already failed at EXTRACT");
        }

        @Test
        @DisplayName("should reject appends before the run started")
        void append_shouldRequireRunning() {
            assertThatThrownBy(() -> ledger.append(ok(StageName.EXTRACT, 0)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("PENDING");
        }
    }

    @Nested
    @DisplayName("status transitions")
    class Transitions {

        @Test
        @DisplayName("complete() should require every stage to have succeeded")
        void complete_shouldRequireAllStages() {
            ledger.markRunning();
            ledger.append(ok(StageName.EXTRACT, 0));

            assertThatThrownBy(() -> ledger.complete(report(), T0.plusSeconds(60)))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("complete() should store the report and freeze the ledger")
        void complete_shouldFreezeLedger() {
            // Arrange
            ledger.markRunning();
            appendAll();

            // Act
            ledger.complete(report(), T0.plusSeconds(60));

            // Assert
            LedgerSnapshot snapshot = ledger.snapshot();
            assertThat(snapshot.status()).isEqualTo(RunStatus.COMPLETE);
            assertThat(snapshot.finalReport()).isEqualTo(report());
            assertThat(snapshot.usage().total().totalTokens()).isEqualTo(75);
            assertThatThrownBy(() -> ledger.fail(T0.plusSeconds(61))).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("restore() should only accept terminal snapshots")
        void restore_shouldRejectLiveSnapshot() {
            ledger.markRunning();

            assertThatThrownBy(() -> PipelineLedger.restore(ledger.snapshot()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("recorded results should not change when the caller mutates its payload")
    void snapshot_shouldBeImmutable() {
        // Arrange
        ledger.markRunning();
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("eps", 3.5);
        ledger.append(StageResult.success(StageName.EXTRACT, payload, T0, T0, UsageCounters.ZERO));

        // Act
        payload.put("eps", 99.0);
        ((ObjectNode) ledger.snapshot().stages().get(0).payload()).put("eps", 42.0);

        // Assert
        assertThat(ledger.snapshot().stages().get(0).payload().get("eps").asDouble()).isEqualTo(3.5);
    }
}
