package com.voiceledger.categorizer.service.evaluation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.classification.ClassificationResult;
import com.voiceledger.categorizer.exception.TransientInfraException;
import com.voiceledger.categorizer.service.classification.VotingClassifier;
import com.voiceledger.categorizer.service.training.TrainingBudget;
import com.voiceledger.categorizer.service.vector.EmbeddingService;
import com.voiceledger.categorizer.service.vector.EphemeralPartition;
import com.voiceledger.categorizer.service.vector.SimilarityIndex;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * K-fold cross-validation of the nearest-neighbor classifier. Each fold indexes its training rows
 * into its own ephemeral partition, classifies the held-out rows against it and releases the
 * partition before the next fold starts. A fold that hits an infrastructure failure is dropped
 * from every aggregate; the run continues with the remaining folds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrossValidationEvaluator {

  private final ApplicationProperties applicationProperties;
  private final EmbeddingService embeddingService;
  private final SimilarityIndex similarityIndex;
  private final VotingClassifier votingClassifier;
  private final CategoryDiagnosticsService diagnosticsService;

  /**
   * @param samples samples of eligible categories only
   * @param embeddings vectors already computed for sample ids; filled as new ones are computed
   * @throws com.voiceledger.categorizer.exception.TrainingCancelledException when the budget runs
   *     out; the current fold's partition is released first
   */
  public EvaluationReport evaluate(
      List<EvaluationSample> samples, Map<Long, List<Float>> embeddings, TrainingBudget budget) {
    ApplicationProperties.Training training = applicationProperties.getTraining();
    int k = applicationProperties.getClassification().getNeighbors();

    ConfusionMatrix merged = new ConfusionMatrix(orderedCategories(samples));
    EvaluationReport.EvaluationReportBuilder report =
        EvaluationReport.builder().sampleCount(samples.size()).categories(merged.getCategories());

    List<FoldSplitter.Fold<EvaluationSample>> folds =
        FoldSplitter.split(samples, training.getFolds(), training.getShuffleSeed());
    List<Double> accuracies = new ArrayList<>();
    int failed = 0;

    for (FoldSplitter.Fold<EvaluationSample> fold : folds) {
      budget.checkpoint("fold " + fold.getNumber());
      try {
        ConfusionMatrix foldMatrix = runFold(fold, embeddings, budget, merged.getCategories(), k);
        merged.add(foldMatrix);
        double accuracy = foldMatrix.correct() / (double) foldMatrix.total();
        accuracies.add(accuracy);
        log.info(
            "Fold {}/{}: accuracy {} on {} held-out samples",
            fold.getNumber(),
            folds.size(),
            String.format(Locale.ROOT, "%.4f", accuracy),
            foldMatrix.total());
      } catch (TransientInfraException e) {
        failed++;
        log.warn(
            "Fold {}/{} dropped from aggregates: {}",
            fold.getNumber(),
            folds.size(),
            e.getMessage());
      }
    }

    double mean = accuracies.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    report.foldAccuracies(accuracies).failedFolds(failed).accuracy(mean);
    return diagnosticsService.diagnose(merged, report).build();
  }

  private ConfusionMatrix runFold(
      FoldSplitter.Fold<EvaluationSample> fold,
      Map<Long, List<Float>> embeddings,
      TrainingBudget budget,
      List<String> categories,
      int k) {
    ConfusionMatrix foldMatrix = new ConfusionMatrix(categories);
    String prefix = applicationProperties.getIndex().getEphemeralPrefix();

    try (EphemeralPartition partition =
        similarityIndex.openEphemeralPartition(prefix, embeddingService.getDimension())) {
      for (EvaluationSample sample : fold.getTrain()) {
        similarityIndex.upsert(
            partition.getName(), sample.getId(), embed(sample, embeddings), sample.getPayload());
      }
      budget.checkpoint("scoring fold " + fold.getNumber());

      for (EvaluationSample sample : fold.getTest()) {
        ClassificationResult result =
            votingClassifier.classify(partition.getName(), embed(sample, embeddings), k);
        foldMatrix.record(
            sample.getCategory(), result.getPrediction().orElse(null), result.getConfidence());
      }
    }
    return foldMatrix;
  }

  private List<Float> embed(EvaluationSample sample, Map<Long, List<Float>> embeddings) {
    List<Float> cached = embeddings.get(sample.getId());
    if (cached != null) {
      return cached;
    }
    List<Float> vector = embeddingService.generateEmbedding(sample.getText());
    embeddings.put(sample.getId(), vector);
    return vector;
  }

  /** Categories by descending sample count, then by name. */
  static List<String> orderedCategories(List<EvaluationSample> samples) {
    Map<String, Long> counts =
        samples.stream()
            .collect(
                Collectors.groupingBy(
                    EvaluationSample::getCategory, LinkedHashMap::new, Collectors.counting()));
    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  /** Convenience overload with a fresh embedding cache. */
  public EvaluationReport evaluate(List<EvaluationSample> samples, TrainingBudget budget) {
    return evaluate(samples, new HashMap<>(), budget);
  }
}
