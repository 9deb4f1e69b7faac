package com.voiceledger.categorizer.service.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.metrics.ConfusionData;
import com.voiceledger.categorizer.dto.metrics.MetricsSnapshot;
import com.voiceledger.categorizer.dto.metrics.TrainingType;
import com.voiceledger.categorizer.service.evaluation.EvaluationReport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Writes one immutable snapshot per training run and serves the read side for reporting. */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsRecorder {

  private final MetricsSnapshotRepository repository;
  private final ApplicationProperties applicationProperties;

  public MetricsSnapshot record(EvaluationReport report, TrainingType trainingType, String notes) {
    MetricsSnapshot snapshot =
        MetricsSnapshot.builder()
            .id(UUID.randomUUID().toString())
            .timestamp(Instant.now())
            .trainingType(trainingType)
            .accuracy(report.getAccuracy())
            .sampleCount(report.getSampleCount())
            .categoryCount(report.getCategories().size())
            .foldAccuracies(report.getFoldAccuracies())
            .failedFolds(report.getFailedFolds())
            .confusion(report.getConfusion())
            .categoryMetrics(report.getCategoryMetrics())
            .bestCategory(report.getBestCategory())
            .worstCategory(report.getWorstCategory())
            .topCategories(report.getTopCategories())
            .confusedPairs(report.getConfusedPairs())
            .notes(notes)
            .build();
    repository.append(snapshot);
    log.info(
        "Recorded {} metrics snapshot {}: accuracy {}, {} samples, {} categories",
        trainingType.getValue(),
        snapshot.getId(),
        formatAccuracy(snapshot.getAccuracy()),
        snapshot.getSampleCount(),
        snapshot.getCategoryCount());
    return snapshot;
  }

  static String formatAccuracy(double accuracy) {
    return String.format(Locale.ROOT, "%.4f", accuracy);
  }

  public Optional<MetricsSnapshot> latest() {
    return repository.findRecent(1).stream().findFirst();
  }

  /** The configured number of most recent snapshots, newest first. */
  public List<MetricsSnapshot> recent() {
    return recent(applicationProperties.getStorage().getMetricsHistoryLimit());
  }

  public List<MetricsSnapshot> recent(int limit) {
    return repository.findRecent(limit);
  }

  /** Confusion data of the newest snapshot that has any. */
  public Optional<ConfusionData> latestConfusion() {
    return recent().stream()
        .map(MetricsSnapshot::getConfusion)
        .filter(confusion -> confusion != null && !confusion.getLabels().isEmpty())
        .findFirst();
  }
}
