package com.voiceledger.categorizer.dto.training;

import com.voiceledger.categorizer.dto.metrics.MetricsSnapshot;

import lombok.Builder;
import lombok.Value;

/** Outcome of a full training run. A snapshot is present only when training succeeded. */
@Value
@Builder
public class TrainingResult {

  TrainingStatus status;

  String message;

  MetricsSnapshot snapshot;

  public boolean isSuccess() {
    return status == TrainingStatus.TRAINED;
  }

  public static TrainingResult failure(TrainingStatus status, String message) {
    return TrainingResult.builder().status(status).message(message).build();
  }
}
