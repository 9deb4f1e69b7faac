package com.voiceledger.categorizer.service.correction;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Snapshot of the known categories and vendor spellings, taken once per training run. */
@Value
@Builder
public class ReferenceData {

  @Singular List<String> categories;

  @Singular List<String> knownVendors;
}
