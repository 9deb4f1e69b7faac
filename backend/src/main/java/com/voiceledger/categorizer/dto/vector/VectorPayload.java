package com.voiceledger.categorizer.dto.vector;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Metadata stored next to each vector. Amount and date are optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorPayload {

  private String category;

  private Double amount;

  private LocalDate date;
}
