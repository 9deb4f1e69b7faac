package com.voiceledger.categorizer.dto.expense;

import com.voiceledger.categorizer.dto.classification.CategoryDecision;

import lombok.Builder;
import lombok.Value;

/** The outcome of categorizing an {@link ExpenseCandidate}. */
@Value
@Builder
public class CategorizedExpense {

  /** Vendor after known-vendor correction. */
  String vendor;

  /** Suggested category after rule-based correction. */
  String suggestedCategory;

  /** True when a curated term rewrote the suggested category. */
  boolean ruleApplied;

  CategoryDecision decision;

  boolean needsConfirmation;

  /** Applies the outcome to a new record for persistence. */
  public ExpenseRecord toRecord(ExpenseCandidate candidate) {
    return ExpenseRecord.builder()
        .date(candidate.getDate())
        .amount(candidate.getAmount())
        .vendor(vendor)
        .category(decision.getFinalCategory())
        .description(candidate.getDescription())
        .transcription(candidate.getTranscription())
        .confidenceScore(decision.getConfidence())
        .mlPrediction(decision.getMlPrediction())
        .llmCategory(decision.getLlmCategory())
        .needsConfirmation(needsConfirmation)
        .build();
  }
}
