package com.voiceledger.categorizer.service.vector;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.dto.vector.ScoredPoint;
import com.voiceledger.categorizer.dto.vector.VectorPoint;
import com.voiceledger.categorizer.util.VectorMath;

import lombok.extern.slf4j.Slf4j;

/** Process-local index. Points live only as long as the application. */
@Slf4j
@Service
@ConditionalOnProperty(
    prefix = "categorizer.index",
    name = "type",
    havingValue = "memory",
    matchIfMissing = true)
public class InMemorySimilarityIndex implements SimilarityIndex {

  private final Map<String, Partition> partitions = new ConcurrentHashMap<>();

  @Override
  public void createPartition(String partition, int dimension) {
    Partition existing = partitions.putIfAbsent(partition, new Partition(dimension));
    if (existing != null && existing.dimension != dimension) {
      throw new IllegalArgumentException(
          String.format(
              "Partition %s has dimension %d, not %d", partition, existing.dimension, dimension));
    }
    if (existing == null) {
      log.debug("Created partition {} ({}d)", partition, dimension);
    }
  }

  @Override
  public void deletePartition(String partition) {
    partitions.remove(partition);
  }

  @Override
  public boolean partitionExists(String partition) {
    return partitions.containsKey(partition);
  }

  @Override
  public void upsert(String partition, VectorPoint point) {
    Partition target = partitions.get(partition);
    if (target == null) {
      throw new IllegalStateException("Partition does not exist: " + partition);
    }
    target.checkDimension(point.getEmbedding().size());
    target.points.put(point.getId(), point);
  }

  @Override
  public List<ScoredPoint> query(String partition, List<Float> vector, int k) {
    Partition target = partitions.get(partition);
    if (target == null || target.points.isEmpty()) {
      return Collections.emptyList();
    }
    target.checkDimension(vector.size());
    return target.points.values().stream()
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
    Partition target = partitions.get(partition);
    return target == null ? 0 : target.points.size();
  }

  private static final class Partition {
    private final int dimension;
    private final Map<Long, VectorPoint> points = new ConcurrentHashMap<>();

    private Partition(int dimension) {
      this.dimension = dimension;
    }

    private void checkDimension(int size) {
      if (size != dimension) {
        throw new IllegalArgumentException(
            "Vector has dimension " + size + " but partition expects " + dimension);
      }
    }
  }
}
