package com.voiceledger.categorizer.service.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import lombok.Value;

/**
 * Seeded shuffled k-fold split. Every sample lands in exactly one test fold; the first {@code n %
 * k} folds get one extra sample.
 */
public final class FoldSplitter {

  private FoldSplitter() {}

  @Value
  public static class Fold<T> {
    int number;
    List<T> train;
    List<T> test;
  }

  /**
   * @param folds requested fold count; reduced to the sample count when there are fewer samples
   */
  public static <T> List<Fold<T>> split(List<T> samples, int folds, long seed) {
    int n = samples.size();
    int k = Math.min(folds, n);
    if (k < 2) {
      throw new IllegalArgumentException("Need at least 2 folds and 2 samples, got " + n);
    }

    List<T> shuffled = new ArrayList<>(samples);
    Collections.shuffle(shuffled, new Random(seed));

    List<Fold<T>> result = new ArrayList<>(k);
    int start = 0;
    for (int i = 0; i < k; i++) {
      int size = n / k + (i < n % k ? 1 : 0);
      int end = start + size;
      List<T> test = new ArrayList<>(shuffled.subList(start, end));
      List<T> train = new ArrayList<>(shuffled.subList(0, start));
      train.addAll(shuffled.subList(end, n));
      result.add(new Fold<>(i + 1, train, test));
      start = end;
    }
    return result;
  }
}
