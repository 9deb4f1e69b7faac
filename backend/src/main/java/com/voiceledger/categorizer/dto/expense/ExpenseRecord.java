package com.voiceledger.categorizer.dto.expense;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A recorded expense as persisted by the ingestion pipeline. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseRecord {

  private Long id;

  private LocalDate date;

  private Double amount;

  private String vendor;

  /** Current (possibly user-confirmed) category. */
  private String category;

  /** Short item description, usually a single noun ("cucumber", "petrol"). */
  private String description;

  /** Transcribed speech the expense was extracted from. */
  private String transcription;

  private double confidenceScore;

  /** Category proposed by the learned model, if it proposed one. */
  private String mlPrediction;

  /** Category proposed by the generative-text extraction step. */
  private String llmCategory;

  private boolean needsConfirmation;
}
