package com.voiceledger.categorizer.service.vector;

import java.util.List;

import com.voiceledger.categorizer.exception.TransientInfraException;

/**
 * Maps canonical expense text to a fixed-dimension vector. Implementations are deterministic for a
 * given model version and have no observable side effects.
 */
public interface EmbeddingService {

  /**
   * @throws TransientInfraException if the model cannot be reached
   */
  List<Float> generateEmbedding(String text);

  int getDimension();

  /** Identifies the model that produced the vectors; vectors of different versions never mix. */
  String getModelVersion();
}
