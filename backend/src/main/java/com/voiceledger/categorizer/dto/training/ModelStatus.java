package com.voiceledger.categorizer.dto.training;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelStatus {

  boolean modelAvailable;

  int indexedPoints;

  boolean trainingInProgress;

  Double lastAccuracy;
}
