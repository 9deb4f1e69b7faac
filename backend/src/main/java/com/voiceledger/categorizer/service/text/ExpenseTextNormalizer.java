package com.voiceledger.categorizer.service.text;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.voiceledger.categorizer.dto.expense.ExpenseCandidate;
import com.voiceledger.categorizer.dto.expense.ExpenseRecord;

/**
 * Builds the single canonical string that is embedded for an expense. Training and inference must
 * both go through here so that the same expense always yields the same text.
 */
@Component
public class ExpenseTextNormalizer {

  private static final Pattern MULTI_SPACE = Pattern.compile("\\s+");
  private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}&&[^'&-]]+");

  public String canonicalText(String transcription, String vendor, String description) {
    String joined = clean(transcription) + " " + clean(vendor) + " " + clean(description);
    return MULTI_SPACE.matcher(joined).replaceAll(" ").trim();
  }

  public String canonicalText(ExpenseRecord record) {
    return canonicalText(record.getTranscription(), record.getVendor(), record.getDescription());
  }

  public String canonicalText(ExpenseCandidate candidate) {
    return canonicalText(
        candidate.getTranscription(), candidate.getVendor(), candidate.getDescription());
  }

  /** Lower-cased, punctuation-free form used for exact term lookups. */
  public String canonicalTerm(String value) {
    String t = clean(value).toLowerCase(Locale.ROOT);
    t = PUNCTUATION.matcher(t).replaceAll(" ");
    return MULTI_SPACE.matcher(t).replaceAll(" ").trim();
  }

  private static String clean(String value) {
    if (value == null) {
      return "";
    }
    return Normalizer.normalize(value.trim(), Normalizer.Form.NFKC);
  }
}
