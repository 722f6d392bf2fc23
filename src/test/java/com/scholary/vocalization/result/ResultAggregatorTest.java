package com.scholary.vocalization.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.vocalization.inference.InferenceOutput;
import com.scholary.vocalization.job.FailureReason;
import com.scholary.vocalization.job.JobStatus;
import com.scholary.vocalization.quality.QualityFlag;
import com.scholary.vocalization.quality.QualityVerdict;
import com.scholary.vocalization.scheduler.DispatchOutcome;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ResultAggregatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final ResultAggregator aggregator =
      new ResultAggregator(0.80, Clock.fixed(NOW, ZoneOffset.UTC));

  private final QualityVerdict clean = verdict(Set.of());

  @Test
  void reconcile_shouldSucceedAtAccuracyFloor() {
    Reconciliation reconciliation =
        aggregator.reconcile("j1", clean, success(new InferenceOutput("hi", List.of("x"), 0.80)));

    assertThat(reconciliation.terminalState()).isEqualTo(JobStatus.SUCCEEDED);
    assertThat(reconciliation.result().partial()).isFalse();
    assertThat(reconciliation.result().finalizedAt()).isEqualTo(NOW);
  }

  @Test
  void reconcile_shouldBePartialBelowAccuracyFloor() {
    Reconciliation reconciliation =
        aggregator.reconcile("j1", clean, success(new InferenceOutput("hi", List.of("x"), 0.79)));

    assertThat(reconciliation.terminalState()).isEqualTo(JobStatus.PARTIAL);
    assertThat(reconciliation.result().partial()).isTrue();
    assertThat(reconciliation.result().confidence()).isEqualTo(0.79);
  }

  @Test
  void reconcile_shouldBePartialWhenQualityFlagged() {
    QualityVerdict noisy = verdict(EnumSet.of(QualityFlag.NOISY));

    Reconciliation reconciliation =
        aggregator.reconcile("j1", noisy, success(new InferenceOutput("hi", List.of(), 0.99)));

    assertThat(reconciliation.terminalState()).isEqualTo(JobStatus.PARTIAL);
    assertThat(reconciliation.result().qualityVerdict()).isSameAs(noisy);
  }

  @Test
  void reconcile_shouldRejectUnusableAudioWhateverInferenceSaid() {
    QualityVerdict clipped = verdict(EnumSet.of(QualityFlag.CLIPPED));

    Reconciliation reconciliation =
        aggregator.reconcile("j1", clipped, success(new InferenceOutput("hi", List.of(), 0.99)));

    assertThat(reconciliation.terminalState()).isEqualTo(JobStatus.REJECTED);
    assertThat(reconciliation.result()).isNull();
    assertThat(aggregator.reconcile("j1", clipped, null).terminalState())
        .isEqualTo(JobStatus.REJECTED);
  }

  @Test
  void reconcile_shouldFailWithDispatchReason() {
    DispatchOutcome timedOut = DispatchOutcome.failure(FailureReason.TIMEOUT, "too slow", 2);

    Reconciliation reconciliation = aggregator.reconcile("j1", clean, timedOut);

    assertThat(reconciliation.terminalState()).isEqualTo(JobStatus.FAILED);
    assertThat(reconciliation.failureReason()).isEqualTo(FailureReason.TIMEOUT);
    assertThat(reconciliation.message()).isEqualTo("too slow");
    assertThat(reconciliation.result()).isNull();
  }

  @Test
  void reconcile_shouldTreatOutOfRangeConfidenceAsModelError() {
    Reconciliation above =
        aggregator.reconcile("j1", clean, success(new InferenceOutput("hi", List.of(), 1.2)));
    Reconciliation nan =
        aggregator.reconcile(
            "j1", clean, success(new InferenceOutput("hi", List.of(), Double.NaN)));

    assertThat(above.failureReason()).isEqualTo(FailureReason.MODEL_ERROR);
    assertThat(nan.failureReason()).isEqualTo(FailureReason.MODEL_ERROR);
  }

  @Test
  void reconcile_shouldFailAsModelErrorWhenConfidenceMissing() {
    Reconciliation reconciliation =
        aggregator.reconcile(
            "j1", clean, success(new InferenceOutput("hi", List.of("alarm_call"), null)));

    assertThat(reconciliation.terminalState()).isEqualTo(JobStatus.FAILED);
    assertThat(reconciliation.failureReason()).isEqualTo(FailureReason.MODEL_ERROR);
    assertThat(reconciliation.result()).isNull();
  }

  @Test
  void reconcile_shouldSortAndDeduplicateTags() {
    InferenceOutput output =
        new InferenceOutput("hi", List.of("territorial", "alarm_call", "territorial"), 0.9);

    AnalysisResult result = aggregator.reconcile("j1", clean, success(output)).result();

    assertThat(result.tags()).containsExactly("alarm_call", "territorial");
  }

  @Test
  void reconcile_shouldRequireOutcomeForUsableAudio() {
    assertThatThrownBy(() -> aggregator.reconcile("j1", clean, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static DispatchOutcome success(InferenceOutput output) {
    return DispatchOutcome.success(output, 1);
  }

  private static QualityVerdict verdict(Set<QualityFlag> flags) {
    return QualityVerdict.of("a1", flags, 0.9, 2.0, 40.0, 0.0);
  }
}
