package com.scholary.vocalization.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private final RetryPolicy policy =
      new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(10));

  @Test
  void nextDelay_shouldDoubleFromBase() {
    assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofMillis(500));
    assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofMillis(1000));
    assertThat(policy.nextDelay(3)).isEqualTo(Duration.ofMillis(2000));
    assertThat(policy.nextDelay(5)).isEqualTo(Duration.ofMillis(8000));
  }

  @Test
  void nextDelay_shouldCapAtMaxDelay() {
    assertThat(policy.nextDelay(6)).isEqualTo(Duration.ofSeconds(10));
    assertThat(policy.nextDelay(40)).isEqualTo(Duration.ofSeconds(10));
    assertThat(policy.nextDelay(Integer.MAX_VALUE)).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void shouldRetry_shouldStopAtMaxAttempts() {
    assertThat(policy.shouldRetry(1)).isTrue();
    assertThat(policy.shouldRetry(2)).isTrue();
    assertThat(policy.shouldRetry(3)).isFalse();
  }

  @Test
  void constructor_shouldRejectInvalidSettings() {
    assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofMillis(-1), Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> policy.nextDelay(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
