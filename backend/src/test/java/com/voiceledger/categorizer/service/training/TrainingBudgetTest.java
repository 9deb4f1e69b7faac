package com.voiceledger.categorizer.service.training;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.voiceledger.categorizer.exception.TrainingCancelledException;

@DisplayName("TrainingBudget Tests")
class TrainingBudgetTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void shouldPassBeforeDeadline() {
    TrainingBudget budget =
        new TrainingBudget(Clock.fixed(NOW, ZoneOffset.UTC), NOW.plusSeconds(60));

    assertThatCode(() -> budget.checkpoint("fold 1")).doesNotThrowAnyException();
  }

  @Test
  void shouldCancelAfterDeadline() {
    TrainingBudget budget =
        new TrainingBudget(Clock.fixed(NOW, ZoneOffset.UTC), NOW.minusMillis(1));

    assertThatThrownBy(() -> budget.checkpoint("fold 2"))
        .isInstanceOf(TrainingCancelledException.class)
        .hasMessage("Training timed out before fold 2");
  }

  @Test
  void shouldCancelInterruptedThread() {
    TrainingBudget budget = TrainingBudget.unlimited();
    Thread.currentThread().interrupt();

    assertThatThrownBy(() -> budget.checkpoint("indexing"))
        .isInstanceOf(TrainingCancelledException.class)
        .hasMessageContaining("interrupted");
  }

  @Test
  void shouldTreatMissingOrNonPositiveTimeoutAsUnlimited() {
    assertThatCode(() -> TrainingBudget.of(null).checkpoint("a")).doesNotThrowAnyException();
    assertThatCode(() -> TrainingBudget.of(Duration.ZERO).checkpoint("b"))
        .doesNotThrowAnyException();
    assertThatCode(() -> TrainingBudget.of(Duration.ofSeconds(-5)).checkpoint("c"))
        .doesNotThrowAnyException();
    assertThatCode(() -> TrainingBudget.of(Duration.ofMinutes(5)).checkpoint("d"))
        .doesNotThrowAnyException();
  }
}
