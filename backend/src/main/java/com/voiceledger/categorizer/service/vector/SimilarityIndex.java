package com.voiceledger.categorizer.service.vector;

import java.util.List;
import java.util.UUID;

import com.voiceledger.categorizer.dto.vector.ScoredPoint;
import com.voiceledger.categorizer.dto.vector.VectorPayload;
import com.voiceledger.categorizer.dto.vector.VectorPoint;
import com.voiceledger.categorizer.exception.TransientInfraException;

/**
 * Stores expense vectors in independently named partitions and answers k-nearest-neighbor queries
 * by cosine similarity. Each partition has a dimension fixed at creation. All operations may throw
 * {@link TransientInfraException} when the backing store is unreachable.
 */
public interface SimilarityIndex {

  /** Creates the partition if it does not exist. An existing partition must have this dimension. */
  void createPartition(String partition, int dimension);

  /** Removes the partition and all its points. Removing a missing partition is a no-op. */
  void deletePartition(String partition);

  boolean partitionExists(String partition);

  /** Inserts or replaces the point with the same id. */
  void upsert(String partition, VectorPoint point);

  default void upsert(String partition, long id, List<Float> vector, VectorPayload payload) {
    upsert(partition, VectorPoint.builder().id(id).embedding(vector).payload(payload).build());
  }

  default void upsertAll(String partition, List<VectorPoint> points) {
    for (VectorPoint point : points) {
      upsert(partition, point);
    }
  }

  /**
   * @return at most {@code k} points ordered by descending cosine similarity; empty when the
   *     partition is missing or empty
   */
  List<ScoredPoint> query(String partition, List<Float> vector, int k);

  int count(String partition);

  /**
   * Creates a uniquely named partition that is deleted when the returned handle is closed. Use it
   * with try-with-resources.
   */
  default EphemeralPartition openEphemeralPartition(String prefix, int dimension) {
    String name = prefix + "-" + UUID.randomUUID().toString().replace("-", "");
    createPartition(name, dimension);
    return new EphemeralPartition(this, name);
  }
}
