package com.voiceledger.categorizer.dto.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrainingType {
  FULL("full"),
  INCREMENTAL("incremental");

  private final String value;

  TrainingType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
