package com.voiceledger.categorizer.dto.classification;

import lombok.Builder;
import lombok.Value;

/** Final category and confidence after reconciling the model with the external suggestion. */
@Value
@Builder(toBuilder = true)
public class CategoryDecision {

  String finalCategory;

  double confidence;

  String mlPrediction;

  String llmCategory;

  DecisionSource source;
}
