package com.voiceledger.categorizer.dto.classification;

/** Which branch of the decision policy produced the final category. */
public enum DecisionSource {
  /** Learned model accepted (confidence at or above the accept threshold). */
  MODEL,
  /** Suggestion used; model confidence kept for observability. */
  SUGGESTION,
  /** Suggestion used; model confidence too low to report. */
  SUGGESTION_LOW_CONFIDENCE,
  /** Index or model unavailable. */
  DEGRADED,
  /** A curated term rule fixed the category. */
  RULE
}
