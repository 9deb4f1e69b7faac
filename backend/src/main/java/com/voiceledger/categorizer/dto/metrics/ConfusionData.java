package com.voiceledger.categorizer.dto.metrics;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Confusion matrix with its labels; rows are true labels, columns predicted labels. */
@Value
@Builder
@Jacksonized
public class ConfusionData {

  List<String> labels;

  List<List<Integer>> matrix;
}
