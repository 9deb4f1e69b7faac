package com.voiceledger.categorizer.service.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.voiceledger.categorizer.dto.metrics.ConfusionData;

/**
 * Out-of-fold true-label by predicted-label counts. Labels are the evaluated categories followed
 * by {@link #UNKNOWN}, which collects samples for which no prediction was made. Also tracks the
 * summed vote confidence per true label.
 */
public final class ConfusionMatrix {

  public static final String UNKNOWN = "Unknown";

  private final List<String> labels;
  private final Map<String, Integer> indexByLabel = new HashMap<>();
  private final int[][] counts;
  private final double[] confidenceSums;

  public ConfusionMatrix(List<String> categories) {
    List<String> all = new ArrayList<>(categories);
    all.remove(UNKNOWN);
    all.add(UNKNOWN);
    this.labels = Collections.unmodifiableList(all);
    for (int i = 0; i < all.size(); i++) {
      indexByLabel.put(all.get(i), i);
    }
    this.counts = new int[all.size()][all.size()];
    this.confidenceSums = new double[all.size()];
  }

  /**
   * @param predicted predicted category, or null when the classifier abstained
   */
  public void record(String actual, String predicted, double confidence) {
    int row = indexOf(actual);
    int col = predicted == null ? unknownIndex() : indexOf(predicted);
    counts[row][col]++;
    confidenceSums[row] += confidence;
  }

  /** Adds every count of {@code other}, which must have the same labels. */
  public void add(ConfusionMatrix other) {
    if (!labels.equals(other.labels)) {
      throw new IllegalArgumentException("Cannot merge matrices with different labels");
    }
    for (int i = 0; i < counts.length; i++) {
      for (int j = 0; j < counts.length; j++) {
        counts[i][j] += other.counts[i][j];
      }
      confidenceSums[i] += other.confidenceSums[i];
    }
  }

  public List<String> getLabels() {
    return labels;
  }

  /** Evaluated categories, without the unknown label. */
  public List<String> getCategories() {
    return labels.subList(0, labels.size() - 1);
  }

  public int count(String actual, String predicted) {
    return counts[indexOf(actual)][indexOf(predicted)];
  }

  public int rowTotal(String actual) {
    int total = 0;
    for (int value : counts[indexOf(actual)]) {
      total += value;
    }
    return total;
  }

  public int columnTotal(String predicted) {
    int col = indexOf(predicted);
    int total = 0;
    for (int[] row : counts) {
      total += row[col];
    }
    return total;
  }

  public int total() {
    int total = 0;
    for (int[] row : counts) {
      for (int value : row) {
        total += value;
      }
    }
    return total;
  }

  public int correct() {
    int correct = 0;
    for (int i = 0; i < counts.length; i++) {
      correct += counts[i][i];
    }
    return correct;
  }

  public double confidenceSum(String actual) {
    return confidenceSums[indexOf(actual)];
  }

  public ConfusionData toData() {
    List<List<Integer>> matrix = new ArrayList<>(counts.length);
    for (int[] row : counts) {
      List<Integer> values = new ArrayList<>(row.length);
      for (int value : row) {
        values.add(value);
      }
      matrix.add(values);
    }
    return ConfusionData.builder().labels(new ArrayList<>(labels)).matrix(matrix).build();
  }

  private int unknownIndex() {
    return labels.size() - 1;
  }

  private int indexOf(String label) {
    Integer index = indexByLabel.get(label);
    if (index == null) {
      return unknownIndex();
    }
    return index;
  }
}
