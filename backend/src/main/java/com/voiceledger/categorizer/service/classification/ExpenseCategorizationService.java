package com.voiceledger.categorizer.service.classification;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.classification.CategoryDecision;
import com.voiceledger.categorizer.dto.classification.ClassificationResult;
import com.voiceledger.categorizer.dto.classification.DecisionSource;
import com.voiceledger.categorizer.dto.expense.CategorizedExpense;
import com.voiceledger.categorizer.dto.expense.ExpenseCandidate;
import com.voiceledger.categorizer.exception.TransientInfraException;
import com.voiceledger.categorizer.service.correction.CategoryCorrectionService;
import com.voiceledger.categorizer.service.correction.ReferenceDataService;
import com.voiceledger.categorizer.service.correction.VendorCorrectionService;
import com.voiceledger.categorizer.service.text.ExpenseTextNormalizer;
import com.voiceledger.categorizer.service.vector.EmbeddingService;
import com.voiceledger.categorizer.service.vector.SimilarityIndex;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Synchronous inference path: correct, normalize, embed, query, vote, decide. Never throws for
 * infrastructure problems; an unreachable model or index yields a degraded result instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpenseCategorizationService {

  private final ApplicationProperties applicationProperties;
  private final ExpenseTextNormalizer textNormalizer;
  private final EmbeddingService embeddingService;
  private final SimilarityIndex similarityIndex;
  private final VotingClassifier votingClassifier;
  private final CategoryDecisionPolicy decisionPolicy;
  private final CategoryCorrectionService categoryCorrectionService;
  private final VendorCorrectionService vendorCorrectionService;
  private final ReferenceDataService referenceDataService;

  /**
   * Classifies canonical text against the main partition. The result is degraded when no model
   * has been trained yet, the main partition does not match the embedding dimension, or the
   * embedding model or index stays unreachable after the configured retries.
   */
  public ClassificationResult classify(String text) {
    String partition = applicationProperties.getIndex().getMainPartition();
    int k = applicationProperties.getClassification().getNeighbors();
    int attempts = 1 + Math.max(0, applicationProperties.getClassification().getInferenceRetries());

    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        if (similarityIndex.count(partition) == 0) {
          log.debug("No trained model in partition {}", partition);
          return ClassificationResult.unavailable();
        }
        List<Float> vector = embeddingService.generateEmbedding(text);
        return votingClassifier.classify(partition, vector, k);
      } catch (TransientInfraException e) {
        log.warn(
            "Classification attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
      } catch (IllegalArgumentException e) {
        // Partition built with another embedding model or dimension; retraining replaces it.
        log.warn("Main partition incompatible with current embeddings: {}", e.getMessage());
        return ClassificationResult.unavailable();
      }
    }
    return ClassificationResult.unavailable();
  }

  /** Categorizes one candidate expense line coming from the extraction pipeline. */
  public CategorizedExpense categorize(ExpenseCandidate candidate) {
    List<String> knownVendors = referenceDataService.current().getKnownVendors();
    String vendor = vendorCorrectionService.correctOrKeep(candidate.getVendor(), knownVendors);

    Optional<String> ruleCategory =
        categoryCorrectionService.findRuleCategory(candidate.getDescription());
    String suggestion = ruleCategory.orElse(candidate.getSuggestedCategory());

    String text =
        textNormalizer.canonicalText(
            candidate.getTranscription(), vendor, candidate.getDescription());
    ClassificationResult result = classify(text);
    CategoryDecision decision = decisionPolicy.decide(result, suggestion);

    if (ruleCategory.isPresent() && !ruleCategory.get().equals(decision.getFinalCategory())) {
      decision =
          decision.toBuilder()
              .finalCategory(ruleCategory.get())
              .source(DecisionSource.RULE)
              .build();
    }

    double confirmationThreshold =
        applicationProperties.getClassification().getConfirmationThreshold();
    boolean needsConfirmation = decision.getConfidence() < confirmationThreshold;

    return CategorizedExpense.builder()
        .vendor(vendor)
        .suggestedCategory(suggestion)
        .ruleApplied(ruleCategory.isPresent())
        .decision(decision)
        .needsConfirmation(needsConfirmation)
        .build();
  }
}
