package com.voiceledger.categorizer.dto.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Evaluation results of one training run. Written once, never modified. */
@Value
@Builder
@Jacksonized
public class MetricsSnapshot {

  String id;

  Instant timestamp;

  TrainingType trainingType;

  double accuracy;

  int sampleCount;

  int categoryCount;

  @Singular List<Double> foldAccuracies;

  int failedFolds;

  ConfusionData confusion;

  @Singular("categoryMetric")
  Map<String, CategoryMetrics> categoryMetrics;

  String bestCategory;

  String worstCategory;

  @Singular List<String> topCategories;

  @Singular List<ConfusedPair> confusedPairs;

  String notes;
}
