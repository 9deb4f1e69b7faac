package com.voiceledger.categorizer.service.correction;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.util.StringSimilarity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Replaces a transcribed vendor name with the closest known spelling. An exact case-insensitive
 * match wins; otherwise the known vendor with the highest similarity ratio is taken when it reaches
 * the configured cutoff.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VendorCorrectionService {

  private final ApplicationProperties applicationProperties;

  /**
   * @param vendor transcribed vendor name, may be null
   * @param knownVendors current known spellings
   * @return the known spelling to use, or empty when nothing is close enough
   */
  public Optional<String> correct(String vendor, List<String> knownVendors) {
    if (vendor == null || vendor.isBlank() || knownVendors == null || knownVendors.isEmpty()) {
      return Optional.empty();
    }
    String needle = vendor.trim().toLowerCase(Locale.ROOT);

    for (String known : knownVendors) {
      if (known.toLowerCase(Locale.ROOT).equals(needle)) {
        return Optional.of(known);
      }
    }

    double cutoff = applicationProperties.getCorrection().getVendorMatchCutoff();
    String best = null;
    double bestRatio = 0.0;
    for (String known : knownVendors) {
      double ratio = StringSimilarity.ratio(needle, known.toLowerCase(Locale.ROOT));
      if (ratio >= cutoff && ratio > bestRatio) {
        best = known;
        bestRatio = ratio;
      }
    }
    if (best != null) {
      log.debug("Vendor '{}' corrected to '{}' (ratio {})", vendor, best, bestRatio);
    }
    return Optional.ofNullable(best);
  }

  /** Same as {@link #correct} but falls back to the input. */
  public String correctOrKeep(String vendor, List<String> knownVendors) {
    return correct(vendor, knownVendors).orElse(vendor);
  }
}
