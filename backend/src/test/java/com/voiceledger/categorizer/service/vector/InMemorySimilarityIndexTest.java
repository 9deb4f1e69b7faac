package com.voiceledger.categorizer.service.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.voiceledger.categorizer.dto.vector.ScoredPoint;
import com.voiceledger.categorizer.dto.vector.VectorPayload;

@DisplayName("InMemorySimilarityIndex Tests")
class InMemorySimilarityIndexTest {

  private static final String PARTITION = "expenses";

  private InMemorySimilarityIndex index;

  @BeforeEach
  void setUp() {
    index = new InMemorySimilarityIndex();
    index.createPartition(PARTITION, 3);
  }

  private static VectorPayload payload(String category) {
    return VectorPayload.builder().category(category).build();
  }

  @Nested
  @DisplayName("Upsert")
  class Upsert {

    @Test
    void shouldBeIdempotentForTheSamePoint() {
      List<Float> vector = Arrays.asList(1f, 0f, 0f);
      index.upsert(PARTITION, 7L, vector, payload("Groceries"));
      List<ScoredPoint> once = index.query(PARTITION, vector, 5);

      index.upsert(PARTITION, 7L, vector, payload("Groceries"));
      List<ScoredPoint> twice = index.query(PARTITION, vector, 5);

      assertThat(index.count(PARTITION)).isEqualTo(1);
      assertThat(twice).isEqualTo(once);
    }

    @Test
    void shouldReplacePointWithSameId() {
      index.upsert(PARTITION, 7L, Arrays.asList(1f, 0f, 0f), payload("Groceries"));
      index.upsert(PARTITION, 7L, Arrays.asList(0f, 1f, 0f), payload("Fuel"));

      List<ScoredPoint> hits = index.query(PARTITION, Arrays.asList(0f, 1f, 0f), 5);

      assertThat(hits).hasSize(1);
      assertThat(hits.get(0).getPayload().getCategory()).isEqualTo("Fuel");
      assertThat(hits.get(0).getSimilarity()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectVectorOfWrongDimension() {
      assertThatThrownBy(
              () -> index.upsert(PARTITION, 1L, Arrays.asList(1f, 0f), payload("Groceries")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("dimension");
    }

    @Test
    void shouldRejectUpsertIntoMissingPartition() {
      assertThatThrownBy(
              () -> index.upsert("missing", 1L, Arrays.asList(1f, 0f, 0f), payload("Fuel")))
          .isInstanceOf(IllegalStateException.class);
    }
  }

  @Nested
  @DisplayName("Query")
  class Query {

    @Test
    void shouldReturnNeighborsByDescendingSimilarity() {
      index.upsert(PARTITION, 1L, Arrays.asList(1f, 0f, 0f), payload("A"));
      index.upsert(PARTITION, 2L, Arrays.asList(1f, 1f, 0f), payload("B"));
      index.upsert(PARTITION, 3L, Arrays.asList(0f, 0f, 1f), payload("C"));

      List<ScoredPoint> hits = index.query(PARTITION, Arrays.asList(1f, 0.1f, 0f), 2);

      assertThat(hits).extracting(ScoredPoint::getId).containsExactly(1L, 2L);
      assertThat(hits.get(0).getSimilarity()).isGreaterThan(hits.get(1).getSimilarity());
    }

    @Test
    void shouldReturnEmptyForMissingOrEmptyPartition() {
      assertThat(index.query(PARTITION, Arrays.asList(1f, 0f, 0f), 5)).isEmpty();
      assertThat(index.query("missing", Arrays.asList(1f, 0f), 5)).isEmpty();
    }

    @Test
    void shouldKeepDimensionFixedForPartitionLifetime() {
      assertThatThrownBy(() -> index.createPartition(PARTITION, 4))
          .isInstanceOf(IllegalArgumentException.class);
      index.createPartition(PARTITION, 3);
      assertThat(index.partitionExists(PARTITION)).isTrue();
    }
  }

  @Nested
  @DisplayName("Ephemeral partitions")
  class Ephemeral {

    @Test
    void shouldDeletePartitionOnClose() {
      String name;
      try (EphemeralPartition partition = index.openEphemeralPartition("cv", 3)) {
        name = partition.getName();
        index.upsert(name, 1L, Arrays.asList(1f, 0f, 0f), payload("A"));
        assertThat(index.count(name)).isEqualTo(1);
      }
      assertThat(index.partitionExists(name)).isFalse();
    }

    @Test
    void shouldDeletePartitionWhenBlockThrows() {
      String[] name = new String[1];

      assertThatThrownBy(
              () -> {
                try (EphemeralPartition partition = index.openEphemeralPartition("cv", 3)) {
                  name[0] = partition.getName();
                  throw new IllegalStateException("fold failed");
                }
              })
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("fold failed");

      assertThat(index.partitionExists(name[0])).isFalse();
    }

    @Test
    void shouldUseCollisionFreeNames() {
      try (EphemeralPartition first = index.openEphemeralPartition("cv", 3);
          EphemeralPartition second = index.openEphemeralPartition("cv", 3)) {
        assertThat(first.getName()).startsWith("cv-").isNotEqualTo(second.getName());
        assertThat(index.partitionExists(first.getName())).isTrue();
        assertThat(index.partitionExists(second.getName())).isTrue();
      }
    }

    @Test
    void shouldTolerateRepeatedClose() {
      EphemeralPartition partition = index.openEphemeralPartition("cv", 3);
      partition.close();
      partition.close();

      assertThat(index.partitionExists(partition.getName())).isFalse();
      assertThat(index.partitionExists(PARTITION)).isTrue();
    }
  }
}
