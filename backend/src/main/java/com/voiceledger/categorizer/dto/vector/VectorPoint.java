package com.voiceledger.categorizer.dto.vector;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One indexed expense. The id is the expense id; a later upsert with the same id replaces it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorPoint {

  private long id;

  private List<Float> embedding;

  private VectorPayload payload;
}
