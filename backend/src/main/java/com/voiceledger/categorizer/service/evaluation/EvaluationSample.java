package com.voiceledger.categorizer.service.evaluation;

import com.voiceledger.categorizer.dto.vector.VectorPayload;

import lombok.Builder;
import lombok.Value;

/** One labeled expense prepared for evaluation: its id, canonical text and payload. */
@Value
@Builder
public class EvaluationSample {

  long id;

  String text;

  VectorPayload payload;

  public String getCategory() {
    return payload.getCategory();
  }
}
