package com.voiceledger.categorizer.service.metrics;

import java.util.List;

import com.voiceledger.categorizer.dto.metrics.MetricsSnapshot;

/** Append-only store of metrics snapshots. */
public interface MetricsSnapshotRepository {

  void append(MetricsSnapshot snapshot);

  /**
   * @param limit maximum number of snapshots to return
   * @return the most recent snapshots, newest first
   */
  List<MetricsSnapshot> findRecent(int limit);
}
