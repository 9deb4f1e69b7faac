package com.voiceledger.categorizer.service.classification;

import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.classification.CategoryDecision;
import com.voiceledger.categorizer.dto.classification.ClassificationResult;
import com.voiceledger.categorizer.dto.classification.DecisionSource;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reconciles the learned model with the externally suggested category.
 *
 * <ul>
 *   <li>confidence &ge; accept threshold: model prediction, model confidence
 *   <li>reject threshold &le; confidence &lt; accept threshold: suggestion, model confidence
 *   <li>confidence &lt; reject threshold: suggestion, 0.0
 *   <li>model unavailable: suggestion, 0.0
 * </ul>
 *
 * A missing suggestion is replaced by the configured fallback category.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryDecisionPolicy {

  private final ApplicationProperties applicationProperties;

  public CategoryDecision decide(String mlPrediction, double mlConfidence, String llmCategory) {
    ApplicationProperties.Classification config = applicationProperties.getClassification();
    String suggestion = suggestionOrFallback(llmCategory);
    double confidence =
        Double.isNaN(mlConfidence) ? 0.0 : Math.max(0.0, Math.min(1.0, mlConfidence));

    CategoryDecision.CategoryDecisionBuilder decision =
        CategoryDecision.builder().mlPrediction(mlPrediction).llmCategory(llmCategory);

    if (mlPrediction != null && confidence >= config.getAcceptThreshold()) {
      return decision
          .finalCategory(mlPrediction)
          .confidence(confidence)
          .source(DecisionSource.MODEL)
          .build();
    }
    if (confidence >= config.getRejectThreshold()) {
      return decision
          .finalCategory(suggestion)
          .confidence(confidence)
          .source(DecisionSource.SUGGESTION)
          .build();
    }
    return decision
        .finalCategory(suggestion)
        .confidence(0.0)
        .source(DecisionSource.SUGGESTION_LOW_CONFIDENCE)
        .build();
  }

  public CategoryDecision decide(ClassificationResult result, String llmCategory) {
    if (result.isDegraded()) {
      return decideDegraded(llmCategory);
    }
    return decide(result.getPrediction().orElse(null), result.getConfidence(), llmCategory);
  }

  /** Decision used when the index or embedding model could not be reached. */
  public CategoryDecision decideDegraded(String llmCategory) {
    String suggestion = suggestionOrFallback(llmCategory);
    log.warn("Categorizer degraded, falling back to suggested category {}", suggestion);
    return CategoryDecision.builder()
        .finalCategory(suggestion)
        .confidence(0.0)
        .llmCategory(llmCategory)
        .source(DecisionSource.DEGRADED)
        .build();
  }

  private String suggestionOrFallback(String llmCategory) {
    if (llmCategory == null || llmCategory.isBlank()) {
      return applicationProperties.getClassification().getFallbackCategory();
    }
    return llmCategory;
  }
}
