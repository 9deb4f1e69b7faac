package com.voiceledger.categorizer.service.training;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.expense.ExpenseRecord;
import com.voiceledger.categorizer.dto.metrics.MetricsSnapshot;
import com.voiceledger.categorizer.dto.metrics.TrainingType;
import com.voiceledger.categorizer.dto.training.ModelStatus;
import com.voiceledger.categorizer.dto.training.TrainingResult;
import com.voiceledger.categorizer.dto.training.TrainingStatus;
import com.voiceledger.categorizer.dto.vector.VectorPayload;
import com.voiceledger.categorizer.dto.vector.VectorPoint;
import com.voiceledger.categorizer.exception.ExpenseValidationException;
import com.voiceledger.categorizer.exception.InsufficientDataException;
import com.voiceledger.categorizer.exception.TrainingCancelledException;
import com.voiceledger.categorizer.exception.TransientInfraException;
import com.voiceledger.categorizer.service.correction.ReferenceDataService;
import com.voiceledger.categorizer.service.evaluation.CrossValidationEvaluator;
import com.voiceledger.categorizer.service.evaluation.EvaluationReport;
import com.voiceledger.categorizer.service.evaluation.EvaluationSample;
import com.voiceledger.categorizer.service.metrics.MetricsRecorder;
import com.voiceledger.categorizer.service.storage.ExpenseRecordRepository;
import com.voiceledger.categorizer.service.text.ExpenseTextNormalizer;
import com.voiceledger.categorizer.service.vector.EmbeddingService;
import com.voiceledger.categorizer.service.vector.SimilarityIndex;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Full training and incremental updates of the main similarity partition.
 *
 * <p>A full run validates the stored expenses, cross-validates on the eligible categories, indexes
 * every eligible expense into the main partition and appends a metrics snapshot. Insufficient data
 * ends the run before anything is written. An incremental update re-indexes a single confirmed
 * expense and falls back to a full run when no model exists yet.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelTrainingService {

  static final String MDC_TRAINING_RUN_ID = "trainingRunId";

  private final ApplicationProperties applicationProperties;
  private final ExpenseRecordRepository expenseRecordRepository;
  private final ExpenseTextNormalizer textNormalizer;
  private final EmbeddingService embeddingService;
  private final SimilarityIndex similarityIndex;
  private final CrossValidationEvaluator crossValidationEvaluator;
  private final MetricsRecorder metricsRecorder;
  private final ReferenceDataService referenceDataService;

  private final AtomicInteger activeRuns = new AtomicInteger();

  /** Runs a full training synchronously. Never throws for data or infrastructure problems. */
  public TrainingResult train() {
    return runTraining(TrainingType.FULL, null);
  }

  @Async("trainingExecutor")
  public CompletableFuture<TrainingResult> trainAsync() {
    return CompletableFuture.completedFuture(train());
  }

  /**
   * Indexes one expense under its confirmed category. When the main partition is empty a full
   * training run is performed first.
   *
   * @return true when the expense is now indexed under the confirmed category
   */
  public boolean incrementalUpdate(long expenseId, String confirmedCategory) {
    if (confirmedCategory == null || confirmedCategory.isBlank()) {
      log.warn("Ignoring incremental update for expense {} without a category", expenseId);
      return false;
    }
    Optional<ExpenseRecord> expense = expenseRecordRepository.findById(expenseId);
    if (expense.isEmpty()) {
      log.warn("Incremental update skipped, expense {} not found", expenseId);
      return false;
    }

    String partition = applicationProperties.getIndex().getMainPartition();
    try {
      if (similarityIndex.count(partition) == 0) {
        log.info("No trained model yet, running full training for expense {}", expenseId);
        TrainingResult result =
            runTraining(
                TrainingType.INCREMENTAL, "Incremental training for expense ID " + expenseId);
        if (!result.isSuccess()) {
          return false;
        }
      }

      ExpenseRecord record = expense.get();
      List<Float> vector = embeddingService.generateEmbedding(textNormalizer.canonicalText(record));
      similarityIndex.upsert(partition, expenseId, vector, payload(record, confirmedCategory));
      log.info("Expense {} indexed under confirmed category {}", expenseId, confirmedCategory);
      return true;
    } catch (TransientInfraException e) {
      log.warn("Incremental update for expense {} failed: {}", expenseId, e.getMessage());
      return false;
    }
  }

  public ModelStatus getStatus() {
    int points;
    try {
      points = similarityIndex.count(applicationProperties.getIndex().getMainPartition());
    } catch (TransientInfraException e) {
      log.warn("Similarity index unavailable: {}", e.getMessage());
      points = 0;
    }
    return ModelStatus.builder()
        .modelAvailable(points > 0)
        .indexedPoints(points)
        .trainingInProgress(activeRuns.get() > 0)
        .lastAccuracy(metricsRecorder.latest().map(MetricsSnapshot::getAccuracy).orElse(null))
        .build();
  }

  private TrainingResult runTraining(TrainingType trainingType, String notesPrefix) {
    String runId = UUID.randomUUID().toString().substring(0, 8);
    MDC.put(MDC_TRAINING_RUN_ID, runId);
    activeRuns.incrementAndGet();
    log.info("Starting {} training run {}", trainingType.getValue(), runId);
    try {
      TrainingBudget budget = TrainingBudget.of(applicationProperties.getTraining().getTimeout());
      referenceDataService.refresh();

      List<EvaluationSample> samples = eligibleSamples(expenseRecordRepository.findAll());
      Optional<MetricsSnapshot> previous = metricsRecorder.latest();

      Map<Long, List<Float>> embeddings = new HashMap<>();
      EvaluationReport report = crossValidationEvaluator.evaluate(samples, embeddings, budget);
      if (!report.hasCompletedFolds()) {
        log.error("All {} folds failed, model left unchanged", report.getFailedFolds());
        return TrainingResult.failure(
            TrainingStatus.FAILED, "Every cross-validation fold failed; model left unchanged");
      }

      indexMainPartition(samples, embeddings, budget);

      MetricsSnapshot snapshot =
          metricsRecorder.record(report, trainingType, notes(notesPrefix, previous, report));
      log.info(
          "Trained on {} expenses across {} categories, cross-validation accuracy {}",
          samples.size(),
          report.getCategories().size(),
          String.format(Locale.ROOT, "%.4f", report.getAccuracy()));
      return TrainingResult.builder()
          .status(TrainingStatus.TRAINED)
          .message("Model trained")
          .snapshot(snapshot)
          .build();

    } catch (InsufficientDataException e) {
      log.warn("Training skipped: {}", e.getMessage());
      return TrainingResult.failure(TrainingStatus.INSUFFICIENT_DATA, e.getMessage());
    } catch (TrainingCancelledException e) {
      log.warn("Training cancelled: {}", e.getMessage());
      return TrainingResult.failure(TrainingStatus.CANCELLED, e.getMessage());
    } catch (TransientInfraException e) {
      log.error("Training failed: {}", e.getMessage(), e);
      return TrainingResult.failure(TrainingStatus.FAILED, e.getMessage());
    } catch (UncheckedIOException e) {
      log.error("Training failed, storage unavailable: {}", e.getMessage(), e);
      return TrainingResult.failure(
          TrainingStatus.FAILED, "Storage unavailable: " + e.getCause().getMessage());
    } finally {
      activeRuns.decrementAndGet();
      MDC.remove(MDC_TRAINING_RUN_ID);
    }
  }

  /**
   * Validates the stored expenses and keeps those of categories with enough samples.
   *
   * @throws InsufficientDataException if too few valid expenses or eligible categories remain
   */
  List<EvaluationSample> eligibleSamples(List<ExpenseRecord> records) {
    ApplicationProperties.Training training = applicationProperties.getTraining();

    List<EvaluationSample> valid = new ArrayList<>();
    for (ExpenseRecord record : records) {
      try {
        valid.add(toSample(record));
      } catch (ExpenseValidationException e) {
        log.warn("Skipping expense {}: {}", e.getExpenseId(), e.getMessage());
      }
    }
    if (valid.size() < training.getMinTrainingSamples()) {
      throw new InsufficientDataException(
          String.format(
              "Not enough data to train model: %d valid expenses, minimum %d",
              valid.size(), training.getMinTrainingSamples()));
    }

    Map<String, Long> counts =
        valid.stream()
            .collect(
                Collectors.groupingBy(
                    EvaluationSample::getCategory, LinkedHashMap::new, Collectors.counting()));
    Set<String> eligible =
        counts.entrySet().stream()
            .filter(entry -> entry.getValue() >= training.getMinSamplesPerCategory())
            .map(Map.Entry::getKey)
            .collect(Collectors.toSet());
    if (eligible.size() < 2) {
      throw new InsufficientDataException(
          String.format(
              "Not enough categories with at least %d samples: %s",
              training.getMinSamplesPerCategory(), counts));
    }
    if (eligible.size() < counts.size()) {
      log.info("Excluding categories below {} samples", training.getMinSamplesPerCategory());
    }

    return valid.stream()
        .filter(sample -> eligible.contains(sample.getCategory()))
        .collect(Collectors.toList());
  }

  private EvaluationSample toSample(ExpenseRecord record) {
    if (record.getId() == null) {
      throw new ExpenseValidationException(null, "expense has no id");
    }
    if (record.getCategory() == null || record.getCategory().isBlank()) {
      throw new ExpenseValidationException(record.getId(), "missing category");
    }
    String text = textNormalizer.canonicalText(record);
    if (text.isEmpty()) {
      throw new ExpenseValidationException(record.getId(), "missing text");
    }
    return EvaluationSample.builder()
        .id(record.getId())
        .text(text)
        .payload(payload(record, record.getCategory().trim()))
        .build();
  }

  private void indexMainPartition(
      List<EvaluationSample> samples, Map<Long, List<Float>> embeddings, TrainingBudget budget) {
    String partition = applicationProperties.getIndex().getMainPartition();
    int dimension = embeddingService.getDimension();
    try {
      similarityIndex.createPartition(partition, dimension);
    } catch (IllegalArgumentException e) {
      log.warn(
          "Recreating partition {} for {}: {}",
          partition,
          embeddingService.getModelVersion(),
          e.getMessage());
      similarityIndex.deletePartition(partition);
      similarityIndex.createPartition(partition, dimension);
    }

    List<VectorPoint> points = new ArrayList<>(samples.size());
    for (EvaluationSample sample : samples) {
      List<Float> vector = embeddings.get(sample.getId());
      if (vector == null) {
        budget.checkpoint("embedding expense " + sample.getId());
        vector = embeddingService.generateEmbedding(sample.getText());
      }
      points.add(
          VectorPoint.builder()
              .id(sample.getId())
              .embedding(vector)
              .payload(sample.getPayload())
              .build());
    }
    budget.checkpoint("indexing " + points.size() + " expenses");
    similarityIndex.upsertAll(partition, points);
    log.info("Indexed {} expenses into partition {}", points.size(), partition);
  }

  private static VectorPayload payload(ExpenseRecord record, String category) {
    return VectorPayload.builder()
        .category(category)
        .amount(record.getAmount())
        .date(record.getDate())
        .build();
  }

  static String notes(
      String prefix, Optional<MetricsSnapshot> previous, EvaluationReport report) {
    String change =
        previous
            .map(
                before ->
                    String.format(
                        Locale.ROOT,
                        "Accuracy change: %+.4f (%.4f -> %.4f)",
                        report.getAccuracy() - before.getAccuracy(),
                        before.getAccuracy(),
                        report.getAccuracy()))
            .orElse(null);
    if (prefix == null) {
      return change == null ? "Initial training" : change;
    }
    return change == null ? prefix : prefix + ", " + change;
  }
}
