package com.voiceledger.categorizer.service.training;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import com.voiceledger.categorizer.exception.TrainingCancelledException;

/**
 * Coarse-grained cancellation for a training run. Long loops call {@link #checkpoint} between
 * units of work; the run is aborted once the deadline has passed or the thread was interrupted.
 */
public final class TrainingBudget {

  private final Clock clock;
  private final Instant deadline;

  TrainingBudget(Clock clock, Instant deadline) {
    this.clock = clock;
    this.deadline = deadline;
  }

  public static TrainingBudget of(Duration timeout) {
    Clock clock = Clock.systemUTC();
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return new TrainingBudget(clock, null);
    }
    return new TrainingBudget(clock, clock.instant().plus(timeout));
  }

  public static TrainingBudget unlimited() {
    return new TrainingBudget(Clock.systemUTC(), null);
  }

  /**
   * @param stage what is about to run, used in the cancellation message
   * @throws TrainingCancelledException when the run must stop
   */
  public void checkpoint(String stage) {
    if (Thread.currentThread().isInterrupted()) {
      throw new TrainingCancelledException("Training interrupted before " + stage);
    }
    if (deadline != null && clock.instant().isAfter(deadline)) {
      throw new TrainingCancelledException("Training timed out before " + stage);
    }
  }
}
