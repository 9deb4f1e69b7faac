package com.voiceledger.categorizer.dto.expense;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One candidate expense line produced by the extraction pipeline, before categorization. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseCandidate {

  private String transcription;

  private String vendor;

  private String description;

  /** Category suggested by the generative-text service. */
  private String suggestedCategory;

  private Double amount;

  private LocalDate date;
}
