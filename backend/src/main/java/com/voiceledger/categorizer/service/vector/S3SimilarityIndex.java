package com.voiceledger.categorizer.service.vector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.vector.ScoredPoint;
import com.voiceledger.categorizer.dto.vector.VectorPoint;
import com.voiceledger.categorizer.exception.TransientInfraException;
import com.voiceledger.categorizer.util.VectorMath;

import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Similarity index persisted in S3. Each point is one JSON object under {@code
 * <prefix><partition>/points/<id>.json}; each partition has a {@code partition.json} descriptor
 * carrying its fixed dimension. Cosine scoring runs locally over a per-partition read cache that is
 * filled from S3 on first access and kept current by this instance's writes.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "categorizer.index", name = "type", havingValue = "s3")
public class S3SimilarityIndex implements SimilarityIndex {

  private static final String DESCRIPTOR = "partition.json";
  private static final String POINTS = "points/";

  private final S3Client s3Client;
  private final ObjectMapper objectMapper;
  private final String bucketName;
  private final String vectorPrefix;
  private final String region;

  private final Map<String, Map<Long, VectorPoint>> pointCache = new ConcurrentHashMap<>();
  private final Map<String, Integer> dimensions = new ConcurrentHashMap<>();

  public S3SimilarityIndex(
      S3Client s3Client, ObjectMapper objectMapper, ApplicationProperties properties) {
    this.s3Client = s3Client;
    this.objectMapper = objectMapper;
    this.bucketName = properties.getIndex().getBucket();
    this.vectorPrefix = properties.getIndex().getPrefix();
    this.region = properties.getIndex().getRegion();
  }

  @PostConstruct
  public void init() {
    try {
      ensureBucketExists();
      log.info("S3 similarity index using bucket {} with prefix {}", bucketName, vectorPrefix);
    } catch (SdkException e) {
      // the bucket is re-checked implicitly by every call; inference degrades until S3 is back
      log.warn("S3 bucket {} not reachable at startup: {}", bucketName, e.getMessage());
    }
  }

  private void ensureBucketExists() {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
      log.debug("S3 bucket {} exists", bucketName);
    } catch (NoSuchBucketException e) {
      log.info("Creating S3 bucket: {}", bucketName);
      CreateBucketRequest.Builder createRequest = CreateBucketRequest.builder().bucket(bucketName);

      // Only set location constraint for non us-east-1 regions
      if (!"us-east-1".equals(region)) {
        createRequest.createBucketConfiguration(
            CreateBucketConfiguration.builder().locationConstraint(region).build());
      }
      s3Client.createBucket(createRequest.build());
      log.info("Created S3 bucket '{}' in region '{}'", bucketName, region);
    }
  }

  @Override
  public void createPartition(String partition, int dimension) {
    Integer existing = dimensionOf(partition);
    if (existing != null) {
      if (existing != dimension) {
        throw new IllegalArgumentException(
            String.format(
                "Partition %s has dimension %d, not %d", partition, existing, dimension));
      }
      return;
    }
    try {
      putJson(partitionPrefix(partition) + DESCRIPTOR, new PartitionDescriptor(dimension));
      dimensions.put(partition, dimension);
      pointCache.put(partition, new ConcurrentHashMap<>());
      log.debug("Created partition {} ({}d)", partition, dimension);
    } catch (SdkException e) {
      throw new TransientInfraException("Failed to create partition " + partition, e);
    }
  }

  @Override
  public void deletePartition(String partition) {
    try {
      List<String> keys = listKeys(partitionPrefix(partition));
      for (String key : keys) {
        s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
      }
      log.debug("Deleted partition {} ({} objects)", partition, keys.size());
    } catch (SdkException e) {
      throw new TransientInfraException("Failed to delete partition " + partition, e);
    } finally {
      pointCache.remove(partition);
      dimensions.remove(partition);
    }
  }

  @Override
  public boolean partitionExists(String partition) {
    return dimensionOf(partition) != null;
  }

  @Override
  public void upsert(String partition, VectorPoint point) {
    Integer dimension = dimensionOf(partition);
    if (dimension == null) {
      throw new IllegalStateException("Partition does not exist: " + partition);
    }
    checkDimension(dimension, point.getEmbedding().size());
    try {
      putJson(pointKey(partition, point.getId()), point);
      loadPoints(partition).put(point.getId(), point);
    } catch (SdkException e) {
      throw new TransientInfraException("Failed to store vector " + point.getId(), e);
    }
  }

  @Override
  public List<ScoredPoint> query(String partition, List<Float> vector, int k) {
    Integer dimension = dimensionOf(partition);
    if (dimension == null) {
      return Collections.emptyList();
    }
    checkDimension(dimension, vector.size());
    return loadPoints(partition).values().stream()
        .map(
            point ->
                ScoredPoint.builder()
                    .id(point.getId())
                    .similarity(VectorMath.cosineSimilarity(vector, point.getEmbedding()))
                    .payload(point.getPayload())
                    .build())
        .sorted(
            Comparator.comparingDouble(ScoredPoint::getSimilarity)
                .reversed()
                .thenComparingLong(ScoredPoint::getId))
        .limit(k)
        .collect(Collectors.toList());
  }

  @Override
  public int count(String partition) {
    if (dimensionOf(partition) == null) {
      return 0;
    }
    return loadPoints(partition).size();
  }

  private Integer dimensionOf(String partition) {
    Integer cached = dimensions.get(partition);
    if (cached != null) {
      return cached;
    }
    try {
      byte[] data =
          s3Client
              .getObjectAsBytes(
                  GetObjectRequest.builder()
                      .bucket(bucketName)
                      .key(partitionPrefix(partition) + DESCRIPTOR)
                      .build())
              .asByteArray();
      int dimension = objectMapper.readValue(data, PartitionDescriptor.class).getDimension();
      dimensions.put(partition, dimension);
      return dimension;
    } catch (NoSuchKeyException e) {
      return null;
    } catch (SdkException e) {
      throw new TransientInfraException("Failed to read partition " + partition, e);
    } catch (IOException e) {
      throw new TransientInfraException("Corrupt partition descriptor for " + partition, e);
    }
  }

  private Map<Long, VectorPoint> loadPoints(String partition) {
    Map<Long, VectorPoint> cached = pointCache.get(partition);
    if (cached != null) {
      return cached;
    }
    Map<Long, VectorPoint> points = new ConcurrentHashMap<>();
    try {
      for (String key : listKeys(partitionPrefix(partition) + POINTS)) {
        if (!key.endsWith(".json")) {
          continue;
        }
        byte[] data =
            s3Client
                .getObjectAsBytes(GetObjectRequest.builder().bucket(bucketName).key(key).build())
                .asByteArray();
        VectorPoint point = objectMapper.readValue(data, VectorPoint.class);
        points.put(point.getId(), point);
      }
    } catch (SdkException e) {
      throw new TransientInfraException("Failed to load vectors for " + partition, e);
    } catch (IOException e) {
      throw new TransientInfraException("Corrupt vector in partition " + partition, e);
    }
    log.info("Loaded {} vectors for partition {} from S3", points.size(), partition);
    Map<Long, VectorPoint> raced = pointCache.putIfAbsent(partition, points);
    return raced != null ? raced : points;
  }

  private List<String> listKeys(String prefix) {
    List<String> keys = new ArrayList<>();
    String continuationToken = null;
    do {
      ListObjectsV2Request.Builder requestBuilder =
          ListObjectsV2Request.builder().bucket(bucketName).prefix(prefix);
      if (continuationToken != null) {
        requestBuilder.continuationToken(continuationToken);
      }
      ListObjectsV2Response response = s3Client.listObjectsV2(requestBuilder.build());
      for (S3Object s3Object : response.contents()) {
        keys.add(s3Object.key());
      }
      continuationToken = response.nextContinuationToken();
    } while (continuationToken != null);
    return keys;
  }

  private void putJson(String key, Object value) {
    String json;
    try {
      json = objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize " + key, e);
    }
    s3Client.putObject(
        PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType("application/json")
            .build(),
        RequestBody.fromString(json));
  }

  private String partitionPrefix(String partition) {
    return vectorPrefix + partition.replaceAll("[^A-Za-z0-9_.-]", "_") + "/";
  }

  private String pointKey(String partition, long id) {
    return partitionPrefix(partition) + POINTS + id + ".json";
  }

  private static void checkDimension(int expected, int actual) {
    if (expected != actual) {
      throw new IllegalArgumentException(
          "Vector has dimension " + actual + " but partition expects " + expected);
    }
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  static class PartitionDescriptor {
    private int dimension;
  }
}
