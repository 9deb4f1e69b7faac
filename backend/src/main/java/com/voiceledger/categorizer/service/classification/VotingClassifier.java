package com.voiceledger.categorizer.service.classification;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.dto.classification.ClassificationResult;
import com.voiceledger.categorizer.dto.vector.ScoredPoint;
import com.voiceledger.categorizer.service.vector.SimilarityIndex;

import lombok.RequiredArgsConstructor;

/**
 * Similarity-weighted k-nearest-neighbor vote. Each neighbor adds its cosine similarity to the
 * score of its category; scores are then divided by their total, so the winning share is the
 * confidence.
 */
@Service
@RequiredArgsConstructor
public class VotingClassifier {

  private final SimilarityIndex similarityIndex;

  /**
   * Queries {@code k} neighbors from {@code partition} and votes over them.
   *
   * @throws com.voiceledger.categorizer.exception.TransientInfraException if the index is
   *     unreachable
   */
  public ClassificationResult classify(String partition, List<Float> vector, int k) {
    return vote(similarityIndex.query(partition, vector, k));
  }

  /**
   * Votes over neighbors given in descending similarity order. Negative similarities count as
   * zero. On equal scores the category of the higher-ranked neighbor wins.
   */
  public ClassificationResult vote(List<ScoredPoint> neighbors) {
    Map<String, Double> scores = new LinkedHashMap<>();
    double total = 0.0;
    for (ScoredPoint neighbor : neighbors) {
      if (neighbor.getPayload() == null || neighbor.getPayload().getCategory() == null) {
        continue;
      }
      double weight = Math.max(0.0, neighbor.getSimilarity());
      scores.merge(neighbor.getPayload().getCategory(), weight, Double::sum);
      total += weight;
    }
    if (total <= 0.0) {
      return ClassificationResult.empty();
    }

    String best = null;
    double bestScore = -1.0;
    Map<String, Double> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : scores.entrySet()) {
      double share = entry.getValue() / total;
      normalized.put(entry.getKey(), share);
      if (share > bestScore) {
        best = entry.getKey();
        bestScore = share;
      }
    }
    return ClassificationResult.of(best, bestScore, normalized);
  }
}
