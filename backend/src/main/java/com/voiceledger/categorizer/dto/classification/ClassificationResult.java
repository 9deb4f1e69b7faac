package com.voiceledger.categorizer.dto.classification;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Output of the voting classifier. The prediction is absent when no neighbor voted; confidence is
 * always defined and lies in [0, 1].
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ClassificationResult {

  @Getter(AccessLevel.NONE)
  private final String prediction;

  private final double confidence;

  /** Normalized vote share per category, in neighbor rank order. */
  private final Map<String, Double> scores;

  /** True when the index or the embedding model could not be reached. */
  private final boolean degraded;

  public static ClassificationResult of(
      String prediction, double confidence, Map<String, Double> scores) {
    double bounded = Math.max(0.0, Math.min(1.0, confidence));
    return new ClassificationResult(
        prediction, bounded, Collections.unmodifiableMap(scores), false);
  }

  public static ClassificationResult empty() {
    return new ClassificationResult(null, 0.0, Collections.emptyMap(), false);
  }

  public static ClassificationResult unavailable() {
    return new ClassificationResult(null, 0.0, Collections.emptyMap(), true);
  }

  public Optional<String> getPrediction() {
    return Optional.ofNullable(prediction);
  }
}
