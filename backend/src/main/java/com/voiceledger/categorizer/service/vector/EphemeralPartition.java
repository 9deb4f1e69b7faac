package com.voiceledger.categorizer.service.vector;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Handle on a short-lived index partition. Closing deletes the partition; a failed delete is
 * logged so that it never replaces the exception that ended the enclosing block.
 */
@Slf4j
public final class EphemeralPartition implements AutoCloseable {

  private final SimilarityIndex index;

  @Getter private final String name;

  private boolean closed;

  EphemeralPartition(SimilarityIndex index, String name) {
    this.index = index;
    this.name = name;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      index.deletePartition(name);
      log.debug("Deleted ephemeral partition {}", name);
    } catch (RuntimeException e) {
      log.error("Failed to delete ephemeral partition {}", name, e);
    }
  }
}
