package com.voiceledger.categorizer.dto.metrics;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ConfusedPair {

  String actual;

  String predicted;

  int count;
}
