package com.voiceledger.categorizer.config;

import org.springframework.stereotype.Component;

import com.voiceledger.categorizer.exception.ConfigurationException;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fails the application context when the embedding or index settings cannot work. Settings are
 * only checked here, at startup; request paths assume a valid configuration.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupConfigurationValidator {

  private final ApplicationProperties properties;

  @PostConstruct
  public void validateStartup() {
    ApplicationProperties.Embedding embedding = properties.getEmbedding();
    ApplicationProperties.Index index = properties.getIndex();
    ApplicationProperties.Classification classification = properties.getClassification();

    if (!"bedrock".equalsIgnoreCase(embedding.getProvider())
        && !"hashing".equalsIgnoreCase(embedding.getProvider())) {
      throw new ConfigurationException(
          "Unknown categorizer.embedding.provider: " + embedding.getProvider());
    }
    if (!"memory".equalsIgnoreCase(index.getType()) && !"s3".equalsIgnoreCase(index.getType())) {
      throw new ConfigurationException("Unknown categorizer.index.type: " + index.getType());
    }
    if ("bedrock".equalsIgnoreCase(embedding.getProvider()) && isBlank(embedding.getModelId())) {
      throw new ConfigurationException(
          "categorizer.embedding.model-id is required for the bedrock embedding provider");
    }
    if (embedding.getDimension() <= 0) {
      throw new ConfigurationException("categorizer.embedding.dimension must be positive");
    }
    if ("s3".equalsIgnoreCase(index.getType()) && isBlank(index.getBucket())) {
      throw new ConfigurationException("categorizer.index.bucket is required for the s3 index");
    }
    if (isBlank(index.getMainPartition())) {
      throw new ConfigurationException("categorizer.index.main-partition must not be empty");
    }
    int k = classification.getNeighbors();
    if (k < 5 || k > 7) {
      throw new ConfigurationException(
          "categorizer.classification.neighbors must be between 5 and 7, was " + k);
    }
    int retries = classification.getInferenceRetries();
    if (retries < 0 || retries > 1) {
      throw new ConfigurationException(
          "categorizer.classification.inference-retries must be 0 or 1, was " + retries);
    }
    if (classification.getRejectThreshold() > classification.getAcceptThreshold()) {
      throw new ConfigurationException(
          "categorizer.classification.reject-threshold must not exceed accept-threshold");
    }

    log.info(
        "Categorizer configured: embedding={} ({}d), index={}, partition={}, k={}",
        embedding.getProvider(),
        embedding.getDimension(),
        index.getType(),
        index.getMainPartition(),
        k);
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
