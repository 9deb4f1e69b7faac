package com.voiceledger.categorizer.service.vector;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.exception.TransientInfraException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

/**
 * Generates expense embeddings with an Amazon Titan text embedding model on AWS Bedrock.
 * Embeddings are memoised per text when the cache is enabled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "categorizer.embedding",
    name = "provider",
    havingValue = "bedrock",
    matchIfMissing = true)
public class BedrockEmbeddingService implements EmbeddingService {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;

  private BedrockRuntimeClient bedrockClient;
  private Cache<String, List<Float>> embeddingCache;

  @PostConstruct
  public void init() {
    ApplicationProperties.Embedding embedding = properties.getEmbedding();
    this.bedrockClient =
        BedrockRuntimeClient.builder()
            .region(Region.of(embedding.getRegion()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .build();

    ApplicationProperties.Cache cache = properties.getCache();
    if (cache.isEnabled()) {
      embeddingCache =
          CacheBuilder.newBuilder()
              .maximumSize(cache.getMaxSize())
              .expireAfterWrite(cache.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
              .build();
    }
    log.info(
        "Bedrock embedding client initialized for model {} in {}",
        embedding.getModelId(),
        embedding.getRegion());
  }

  @PreDestroy
  public void close() {
    if (bedrockClient != null) {
      bedrockClient.close();
    }
  }

  /**
   * Generate embedding vector for a single text input.
   *
   * @param text The text to generate embedding for
   * @return The embedding vector as a list of floats
   */
  @Override
  public List<Float> generateEmbedding(String text) {
    if (embeddingCache == null) {
      return invokeModel(text);
    }
    try {
      return embeddingCache.get(text, () -> invokeModel(text));
    } catch (ExecutionException | UncheckedExecutionException e) {
      if (e.getCause() instanceof TransientInfraException) {
        throw (TransientInfraException) e.getCause();
      }
      throw new TransientInfraException("Failed to generate embedding", e.getCause());
    }
  }

  private List<Float> invokeModel(String text) {
    log.debug(
        "Generating embedding for text: {}", text.substring(0, Math.min(text.length(), 100)));

    try {
      Map<String, Object> requestBody =
          Map.of(
              "inputText", text,
              "dimensions", properties.getEmbedding().getDimension(),
              "normalize", true);

      String payload = objectMapper.writeValueAsString(requestBody);

      InvokeModelRequest invokeRequest =
          InvokeModelRequest.builder()
              .modelId(properties.getEmbedding().getModelId())
              .contentType("application/json")
              .body(SdkBytes.fromString(payload, StandardCharsets.UTF_8))
              .build();

      InvokeModelResponse response = bedrockClient.invokeModel(invokeRequest);

      String responseJson = response.body().asUtf8String();
      @SuppressWarnings("unchecked")
      Map<String, Object> responseMap = objectMapper.readValue(responseJson, Map.class);

      @SuppressWarnings("unchecked")
      List<Number> embedding = (List<Number>) responseMap.get("embedding");
      if (embedding == null || embedding.size() != getDimension()) {
        throw new TransientInfraException(
            "Embedding model returned "
                + (embedding == null ? "no vector" : embedding.size() + " dimensions"));
      }

      return embedding.stream().map(Number::floatValue).collect(Collectors.toList());

    } catch (SdkException e) {
      log.warn("Bedrock embedding call failed: {}", e.getMessage());
      throw new TransientInfraException("Embedding model unavailable", e);
    } catch (TransientInfraException e) {
      throw e;
    } catch (Exception e) {
      log.error("Error generating embedding for text", e);
      throw new TransientInfraException("Failed to generate embedding", e);
    }
  }

  @Override
  public int getDimension() {
    return properties.getEmbedding().getDimension();
  }

  @Override
  public String getModelVersion() {
    return properties.getEmbedding().getModelId() + "/" + getDimension();
  }
}
