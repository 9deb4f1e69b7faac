package com.voiceledger.categorizer.service.evaluation;

import java.util.List;
import java.util.Map;

import com.voiceledger.categorizer.dto.metrics.CategoryMetrics;
import com.voiceledger.categorizer.dto.metrics.ConfusedPair;
import com.voiceledger.categorizer.dto.metrics.ConfusionData;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Aggregated outcome of one cross-validation run over the successfully evaluated folds. */
@Value
@Builder
public class EvaluationReport {

  /** Accuracy of each fold that completed, in fold order. */
  @Singular List<Double> foldAccuracies;

  /** Folds dropped because the index or embedding model failed. */
  int failedFolds;

  /** Mean of the fold accuracies; 0.0 when no fold completed. */
  double accuracy;

  int sampleCount;

  List<String> categories;

  ConfusionData confusion;

  Map<String, CategoryMetrics> categoryMetrics;

  String bestCategory;

  String worstCategory;

  List<String> topCategories;

  List<ConfusedPair> confusedPairs;

  public boolean hasCompletedFolds() {
    return !foldAccuracies.isEmpty();
  }
}
