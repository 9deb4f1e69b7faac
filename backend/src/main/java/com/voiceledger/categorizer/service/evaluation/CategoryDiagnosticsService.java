package com.voiceledger.categorizer.service.evaluation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.dto.metrics.CategoryMetrics;
import com.voiceledger.categorizer.dto.metrics.ConfusedPair;

/** Derives per-category diagnostics and rankings from an out-of-fold confusion matrix. */
@Service
public class CategoryDiagnosticsService {

  static final int TOP_CATEGORIES = 3;
  static final int TOP_CONFUSED_PAIRS = 5;

  public Map<String, CategoryMetrics> categoryMetrics(ConfusionMatrix matrix) {
    int total = matrix.total();
    Map<String, CategoryMetrics> metrics = new LinkedHashMap<>();
    for (String category : matrix.getCategories()) {
      int support = matrix.rowTotal(category);
      int tp = matrix.count(category, category);
      int fp = matrix.columnTotal(category) - tp;
      int fn = support - tp;
      int tn = total - tp - fp - fn;

      double precision = tp + fp == 0 ? 0 : tp / (double) (tp + fp);
      double recall = tp + fn == 0 ? 0 : tp / (double) (tp + fn);
      double f1 = precision + recall == 0 ? 0 : 2 * precision * recall / (precision + recall);
      double accuracy = total == 0 ? 0 : (tp + tn) / (double) total;
      double meanConfidence = support == 0 ? 0 : matrix.confidenceSum(category) / support;

      metrics.put(
          category,
          CategoryMetrics.builder()
              .category(category)
              .support(support)
              .precision(precision)
              .recall(recall)
              .f1(f1)
              .accuracy(accuracy)
              .meanConfidence(meanConfidence)
              .build());
    }
    return metrics;
  }

  /**
   * Categories with at least one held-out sample, best F1 first. Ties go to the larger support,
   * then to the name.
   */
  public List<String> rankByF1(Map<String, CategoryMetrics> metrics) {
    return metrics.values().stream()
        .filter(m -> m.getSupport() > 0)
        .sorted(
            Comparator.comparingDouble(CategoryMetrics::getF1)
                .reversed()
                .thenComparing(Comparator.comparingInt(CategoryMetrics::getSupport).reversed())
                .thenComparing(CategoryMetrics::getCategory))
        .map(CategoryMetrics::getCategory)
        .collect(Collectors.toList());
  }

  public List<ConfusedPair> topConfusedPairs(ConfusionMatrix matrix) {
    List<ConfusedPair> pairs = new ArrayList<>();
    for (String actual : matrix.getCategories()) {
      for (String predicted : matrix.getLabels()) {
        int count = matrix.count(actual, predicted);
        if (!actual.equals(predicted) && count > 0) {
          pairs.add(
              ConfusedPair.builder().actual(actual).predicted(predicted).count(count).build());
        }
      }
    }
    return pairs.stream()
        .sorted(
            Comparator.comparingInt(ConfusedPair::getCount)
                .reversed()
                .thenComparing(ConfusedPair::getActual)
                .thenComparing(ConfusedPair::getPredicted))
        .limit(TOP_CONFUSED_PAIRS)
        .collect(Collectors.toList());
  }

  /** Fills the diagnostic fields of a report from the merged matrix. */
  public EvaluationReport.EvaluationReportBuilder diagnose(
      ConfusionMatrix matrix, EvaluationReport.EvaluationReportBuilder report) {
    Map<String, CategoryMetrics> metrics = categoryMetrics(matrix);
    List<String> ranking = rankByF1(metrics);
    return report
        .confusion(matrix.toData())
        .categoryMetrics(metrics)
        .bestCategory(ranking.isEmpty() ? null : ranking.get(0))
        .worstCategory(ranking.isEmpty() ? null : ranking.get(ranking.size() - 1))
        .topCategories(ranking.subList(0, Math.min(TOP_CATEGORIES, ranking.size())))
        .confusedPairs(topConfusedPairs(matrix));
  }
}
