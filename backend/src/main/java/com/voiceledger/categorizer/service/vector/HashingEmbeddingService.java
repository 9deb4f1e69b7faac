package com.voiceledger.categorizer.service.vector;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.util.VectorMath;

import lombok.RequiredArgsConstructor;

/**
 * Offline embedder hashing word tokens and character trigrams into a fixed number of buckets. The
 * vector is L2 normalised, so cosine similarity reflects shared vocabulary and spelling.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "categorizer.embedding", name = "provider", havingValue = "hashing")
public class HashingEmbeddingService implements EmbeddingService {

  private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final float TOKEN_WEIGHT = 1.0f;
  private static final float TRIGRAM_WEIGHT = 0.5f;

  private final ApplicationProperties properties;

  @Override
  public List<Float> generateEmbedding(String text) {
    int dimension = getDimension();
    float[] vector = new float[dimension];
    if (text == null) {
      return VectorMath.normalize(vector);
    }
    for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
      if (token.isEmpty()) {
        continue;
      }
      vector[bucket("w:" + token, dimension)] += TOKEN_WEIGHT;
      String padded = "^" + token + "$";
      for (int i = 0; i + 3 <= padded.length(); i++) {
        vector[bucket("c:" + padded.substring(i, i + 3), dimension)] += TRIGRAM_WEIGHT;
      }
    }
    return VectorMath.normalize(vector);
  }

  @Override
  public int getDimension() {
    return properties.getEmbedding().getDimension();
  }

  @Override
  public String getModelVersion() {
    return "hashing-v1/" + getDimension();
  }

  private static int bucket(String feature, int dimension) {
    return Math.floorMod(feature.hashCode(), dimension);
  }
}
