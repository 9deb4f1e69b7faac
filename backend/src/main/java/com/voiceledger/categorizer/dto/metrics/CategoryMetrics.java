package com.voiceledger.categorizer.dto.metrics;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Out-of-fold diagnostics for one category. */
@Value
@Builder
@Jacksonized
public class CategoryMetrics {

  String category;

  /** Held-out samples whose true label is this category. */
  int support;

  double precision;

  double recall;

  double f1;

  /** One-vs-rest accuracy: (TP + TN) / evaluated samples. */
  double accuracy;

  /** Mean vote confidence over this category's held-out samples. */
  double meanConfidence;
}
