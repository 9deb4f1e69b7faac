package com.voiceledger.categorizer.util;

/**
 * Ratcliff/Obershelp string similarity: twice the number of matching characters divided by the
 * combined length, where matches are found by repeatedly taking the longest common block and
 * recursing into the text on either side of it.
 */
public final class StringSimilarity {

  private StringSimilarity() {}

  /**
   * @return similarity in [0, 1]; 1.0 for two empty strings
   */
  public static double ratio(String a, String b) {
    if (a == null || b == null) {
      return 0.0;
    }
    int total = a.length() + b.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
  }

  private static int matchingCharacters(
      String a, int aLo, int aHi, String b, int bLo, int bHi) {
    if (aLo >= aHi || bLo >= bHi) {
      return 0;
    }
    int bestA = aLo;
    int bestB = bLo;
    int bestSize = 0;
    // lengths of common suffixes ending at (i, j), one row at a time
    int[] previous = new int[bHi - bLo + 1];
    for (int i = aLo; i < aHi; i++) {
      int[] current = new int[bHi - bLo + 1];
      for (int j = bLo; j < bHi; j++) {
        if (a.charAt(i) == b.charAt(j)) {
          int size = previous[j - bLo] + 1;
          current[j - bLo + 1] = size;
          if (size > bestSize) {
            bestSize = size;
            bestA = i - size + 1;
            bestB = j - size + 1;
          }
        }
      }
      previous = current;
    }
    if (bestSize == 0) {
      return 0;
    }
    return bestSize
        + matchingCharacters(a, aLo, bestA, b, bLo, bestB)
        + matchingCharacters(a, bestA + bestSize, aHi, b, bestB + bestSize, bHi);
  }
}
