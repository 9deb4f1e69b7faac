package com.voiceledger.categorizer.dto.training;

public enum TrainingStatus {
  TRAINED,
  INSUFFICIENT_DATA,
  CANCELLED,
  FAILED
}
