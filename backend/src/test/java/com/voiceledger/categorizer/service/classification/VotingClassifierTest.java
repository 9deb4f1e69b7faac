package com.voiceledger.categorizer.service.classification;

import static com.voiceledger.categorizer.fixtures.TestFixtures.neighbor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.voiceledger.categorizer.dto.classification.ClassificationResult;
import com.voiceledger.categorizer.service.vector.SimilarityIndex;

@ExtendWith(MockitoExtension.class)
@DisplayName("VotingClassifier Tests")
class VotingClassifierTest {

  @Mock private SimilarityIndex similarityIndex;

  @InjectMocks private VotingClassifier votingClassifier;

  @Nested
  @DisplayName("Weighted vote")
  class WeightedVote {

    @Test
    @DisplayName("five grocery neighbors give full confidence")
    void shouldGiveFullConfidenceForUnanimousNeighbors() {
      ClassificationResult result =
          votingClassifier.vote(
              Arrays.asList(
                  neighbor(1, 0.9, "Groceries"),
                  neighbor(2, 0.85, "Groceries"),
                  neighbor(3, 0.8, "Groceries"),
                  neighbor(4, 0.7, "Groceries"),
                  neighbor(5, 0.6, "Groceries")));

      assertThat(result.getPrediction()).contains("Groceries");
      assertThat(result.getConfidence()).isCloseTo(1.0, within(1e-9));
      assertThat(result.isDegraded()).isFalse();
    }

    @Test
    @DisplayName("three alcohol against two grocery neighbors")
    void shouldNormalizeSummedSimilarities() {
      ClassificationResult result =
          votingClassifier.vote(
              Arrays.asList(
                  neighbor(1, 0.8, "Alcohol"),
                  neighbor(2, 0.75, "Groceries"),
                  neighbor(3, 0.7, "Alcohol"),
                  neighbor(4, 0.65, "Groceries"),
                  neighbor(5, 0.6, "Alcohol")));

      assertThat(result.getPrediction()).contains("Alcohol");
      assertThat(result.getConfidence()).isCloseTo(0.6, within(1e-9));
      assertThat(result.getScores().get("Alcohol")).isCloseTo(2.1 / 3.5, within(1e-9));
      assertThat(result.getScores().get("Groceries")).isCloseTo(1.4 / 3.5, within(1e-9));
    }

    @Test
    void shouldReturnEmptyResultWithoutNeighbors() {
      ClassificationResult result = votingClassifier.vote(Collections.emptyList());

      assertThat(result.getPrediction()).isEmpty();
      assertThat(result.getConfidence()).isEqualTo(0.0);
      assertThat(result.getScores()).isEmpty();
    }

    @Test
    void shouldBreakTiesByHighestRankedNeighbor() {
      ClassificationResult result =
          votingClassifier.vote(
              Arrays.asList(
                  neighbor(1, 0.5, "Fuel"),
                  neighbor(2, 0.25, "Groceries"),
                  neighbor(3, 0.25, "Groceries")));

      assertThat(result.getPrediction()).contains("Fuel");
      assertThat(result.getConfidence()).isEqualTo(0.5);
    }

    @Test
    void shouldIgnoreNegativeSimilarities() {
      ClassificationResult result =
          votingClassifier.vote(
              Arrays.asList(neighbor(1, 0.8, "Fuel"), neighbor(2, -0.5, "Groceries")));

      assertThat(result.getPrediction()).contains("Fuel");
      assertThat(result.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void shouldAbstainWhenNoNeighborHasPositiveSimilarity() {
      ClassificationResult result =
          votingClassifier.vote(
              Arrays.asList(neighbor(1, 0.0, "Fuel"), neighbor(2, -0.3, "Groceries")));

      assertThat(result.getPrediction()).isEmpty();
      assertThat(result.getConfidence()).isEqualTo(0.0);
    }
  }

  @Test
  void shouldQueryIndexWithRequestedNeighborCount() {
    List<Float> vector = Arrays.asList(0.1f, 0.2f);
    when(similarityIndex.query("expenses", vector, 7))
        .thenReturn(Arrays.asList(neighbor(1, 0.9, "Fuel"), neighbor(2, 0.3, "Groceries")));

    ClassificationResult result = votingClassifier.classify("expenses", vector, 7);

    assertThat(result.getPrediction()).contains("Fuel");
    assertThat(result.getConfidence()).isCloseTo(0.75, within(1e-9));
    assertThat(result.getConfidence()).isBetween(0.0, 1.0);
    verify(similarityIndex).query("expenses", vector, 7);
  }
}
