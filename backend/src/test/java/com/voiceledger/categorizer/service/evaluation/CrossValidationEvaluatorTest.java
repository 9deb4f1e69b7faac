package com.voiceledger.categorizer.service.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.expense.ExpenseRecord;
import com.voiceledger.categorizer.dto.metrics.ConfusionData;
import com.voiceledger.categorizer.dto.vector.VectorPayload;
import com.voiceledger.categorizer.dto.vector.VectorPoint;
import com.voiceledger.categorizer.exception.TrainingCancelledException;
import com.voiceledger.categorizer.exception.TransientInfraException;
import com.voiceledger.categorizer.fixtures.TestFixtures;
import com.voiceledger.categorizer.service.classification.VotingClassifier;
import com.voiceledger.categorizer.service.text.ExpenseTextNormalizer;
import com.voiceledger.categorizer.service.training.TrainingBudget;
import com.voiceledger.categorizer.service.vector.HashingEmbeddingService;
import com.voiceledger.categorizer.service.vector.InMemorySimilarityIndex;

@DisplayName("CrossValidationEvaluator Tests")
class CrossValidationEvaluatorTest {

  private InMemorySimilarityIndex index;
  private CrossValidationEvaluator evaluator;
  private List<EvaluationSample> samples;

  @BeforeEach
  void setUp() {
    ApplicationProperties properties = TestFixtures.properties();
    index = spy(new InMemorySimilarityIndex());
    evaluator =
        new CrossValidationEvaluator(
            properties,
            new HashingEmbeddingService(properties),
            index,
            new VotingClassifier(index),
            new CategoryDiagnosticsService());

    ExpenseTextNormalizer normalizer = new ExpenseTextNormalizer();
    samples =
        TestFixtures.groceriesAndFuel().stream()
            .map(record -> sample(normalizer, record))
            .collect(Collectors.toList());
  }

  private static EvaluationSample sample(ExpenseTextNormalizer normalizer, ExpenseRecord record) {
    return EvaluationSample.builder()
        .id(record.getId())
        .text(normalizer.canonicalText(record))
        .payload(VectorPayload.builder().category(record.getCategory()).build())
        .build();
  }

  private static int[] rowSums(ConfusionData confusion) {
    return confusion.getMatrix().stream()
        .mapToInt(row -> row.stream().mapToInt(Integer::intValue).sum())
        .toArray();
  }

  @Test
  void shouldEvaluateEveryFold() {
    EvaluationReport report = evaluator.evaluate(samples, TrainingBudget.unlimited());

    assertThat(report.getFoldAccuracies()).hasSize(5);
    assertThat(report.getFailedFolds()).isZero();
    assertThat(report.getSampleCount()).isEqualTo(12);
    assertThat(report.getAccuracy()).isBetween(0.0, 1.0);
    assertThat(report.getCategories()).containsExactly("Groceries", "Fuel");
    assertThat(report.getCategoryMetrics()).containsOnlyKeys("Groceries", "Fuel");
    assertThat(report.getTopCategories()).isNotEmpty().hasSizeLessThanOrEqualTo(3);
    assertThat(report.getConfusedPairs()).hasSizeLessThanOrEqualTo(5);
  }

  @Test
  void shouldHaveRowSumsEqualToHeldOutCounts() {
    ConfusionData confusion =
        evaluator.evaluate(samples, TrainingBudget.unlimited()).getConfusion();

    assertThat(confusion.getLabels()).containsExactly("Groceries", "Fuel", "Unknown");
    assertThat(rowSums(confusion)).containsExactly(8, 4, 0);
    assertThat(confusion.getMatrix()).allSatisfy(row -> assertThat(row).allMatch(v -> v >= 0));
  }

  @Test
  void shouldDeleteEveryFoldPartition() {
    evaluator.evaluate(samples, TrainingBudget.unlimited());

    ArgumentCaptor<String> names = ArgumentCaptor.forClass(String.class);
    verify(index, times(5)).deletePartition(names.capture());
    assertThat(names.getAllValues()).doesNotHaveDuplicates().allMatch(n -> n.startsWith("cv-"));
    for (String name : names.getAllValues()) {
      assertThat(index.partitionExists(name)).isFalse();
    }
  }

  @Test
  void shouldReuseEmbeddingsAcrossFolds() {
    Map<Long, List<Float>> embeddings = new HashMap<>();

    evaluator.evaluate(samples, embeddings, TrainingBudget.unlimited());

    assertThat(embeddings).hasSize(12);
  }

  @Test
  void shouldDropFoldOnInfrastructureFailure() {
    doThrow(new TransientInfraException("index unreachable"))
        .doCallRealMethod()
        .when(index)
        .upsert(anyString(), any(VectorPoint.class));

    EvaluationReport report = evaluator.evaluate(samples, TrainingBudget.unlimited());

    assertThat(report.getFailedFolds()).isEqualTo(1);
    assertThat(report.getFoldAccuracies()).hasSize(4);
    // the first fold held out three samples
    int[] sums = rowSums(report.getConfusion());
    assertThat(sums[0] + sums[1] + sums[2]).isEqualTo(9);
    verify(index, times(5)).deletePartition(anyString());
  }

  @Test
  void shouldReleasePartitionWhenCancelled() {
    TrainingBudget budget = mock(TrainingBudget.class);
    doThrow(new TrainingCancelledException("Training timed out"))
        .when(budget)
        .checkpoint(startsWith("scoring"));

    assertThatThrownBy(() -> evaluator.evaluate(samples, budget))
        .isInstanceOf(TrainingCancelledException.class);

    ArgumentCaptor<String> name = ArgumentCaptor.forClass(String.class);
    verify(index).deletePartition(name.capture());
    assertThat(index.partitionExists(name.getValue())).isFalse();
  }

  @Test
  void shouldOrderCategoriesByCountThenName() {
    List<EvaluationSample> mixed =
        samples.stream().filter(s -> s.getId() > 4).collect(Collectors.toList());

    assertThat(CrossValidationEvaluator.orderedCategories(mixed))
        .containsExactly("Fuel", "Groceries");
  }
}
