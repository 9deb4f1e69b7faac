package com.voiceledger.categorizer.dto.vector;

import lombok.Builder;
import lombok.Value;

/** A nearest-neighbor hit. */
@Value
@Builder
public class ScoredPoint {

  long id;

  double similarity;

  VectorPayload payload;
}
