package com.voiceledger.categorizer.util;

import java.util.ArrayList;
import java.util.List;

public final class VectorMath {

  private VectorMath() {}

  /**
   * Calculate cosine similarity between two embedding vectors.
   *
   * @return cosine similarity between -1 and 1; 0 when either vector has zero length
   */
  public static double cosineSimilarity(List<Float> embedding1, List<Float> embedding2) {
    if (embedding1.size() != embedding2.size()) {
      throw new IllegalArgumentException("Embeddings must have the same dimension");
    }

    double dotProduct = 0.0;
    double norm1 = 0.0;
    double norm2 = 0.0;

    for (int i = 0; i < embedding1.size(); i++) {
      double x = embedding1.get(i);
      double y = embedding2.get(i);
      dotProduct += x * y;
      norm1 += x * x;
      norm2 += y * y;
    }

    if (norm1 == 0.0 || norm2 == 0.0) {
      return 0.0;
    }
    return dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
  }

  /**
   * Returns a unit-length copy of the vector; the input array is not modified. A zero vector is
   * copied unchanged.
   */
  public static List<Float> normalize(float[] vector) {
    double norm = 0.0;
    for (float x : vector) {
      norm += x * x;
    }
    norm = Math.sqrt(norm);
    List<Float> out = new ArrayList<>(vector.length);
    for (float x : vector) {
      out.add(norm == 0.0 ? x : (float) (x / norm));
    }
    return out;
  }
}
