package com.voiceledger.categorizer.service.metrics;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.metrics.MetricsSnapshot;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores metrics snapshots as JSON lines, one snapshot per line, appended in write order. Lines
 * that cannot be parsed are skipped on read.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FileBasedMetricsSnapshotRepository implements MetricsSnapshotRepository {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;
  private Path metricsFile;

  @PostConstruct
  public void init() {
    metricsFile = Paths.get(applicationProperties.getStorage().getMetricsFile());
    try {
      Path parent = metricsFile.getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      log.warn(
          "Failed to ensure directory for metrics file '{}': {}", metricsFile, e.getMessage());
    }
  }

  @Override
  public synchronized void append(MetricsSnapshot snapshot) {
    try (BufferedWriter writer =
        Files.newBufferedWriter(
            metricsFile,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND)) {
      writer.write(objectMapper.writeValueAsString(snapshot));
      writer.newLine();
      log.debug("Appended metrics snapshot {} to {}", snapshot.getId(), metricsFile);
    } catch (IOException e) {
      log.error("Failed to append metrics snapshot to {}", metricsFile, e);
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public synchronized List<MetricsSnapshot> findRecent(int limit) {
    if (limit <= 0 || !Files.exists(metricsFile)) {
      return Collections.emptyList();
    }
    List<String> lines;
    try {
      lines = Files.readAllLines(metricsFile, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("Failed to read metrics from file: {}", metricsFile, e);
      throw new UncheckedIOException(e);
    }

    List<MetricsSnapshot> snapshots = new ArrayList<>();
    for (int i = lines.size() - 1; i >= 0 && snapshots.size() < limit; i--) {
      String line = lines.get(i);
      if (line.isBlank()) {
        continue;
      }
      try {
        snapshots.add(objectMapper.readValue(line, MetricsSnapshot.class));
      } catch (IOException e) {
        log.warn(
            "Skipping unreadable metrics line {} in {}: {}", i + 1, metricsFile, e.getMessage());
      }
    }
    return snapshots;
  }
}
