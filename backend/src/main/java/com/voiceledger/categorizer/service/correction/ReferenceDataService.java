package com.voiceledger.categorizer.service.correction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.service.storage.ExpenseRecordRepository;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the current {@link ReferenceData}. Configured vendor spellings come first so that they win
 * over spellings learned from stored expenses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceDataService {

  private final ExpenseRecordRepository expenseRecordRepository;
  private final ApplicationProperties applicationProperties;

  private final AtomicReference<ReferenceData> current =
      new AtomicReference<>(ReferenceData.builder().build());

  @PostConstruct
  public void init() {
    refresh();
  }

  public ReferenceData current() {
    return current.get();
  }

  /** Rebuilds the snapshot from persistence and publishes it. */
  public ReferenceData refresh() {
    Map<String, String> vendors = new LinkedHashMap<>();
    for (String vendor : applicationProperties.getCorrection().getKnownVendors()) {
      addDistinct(vendors, vendor);
    }
    for (String vendor : expenseRecordRepository.findKnownVendors()) {
      addDistinct(vendors, vendor);
    }
    List<String> categories = expenseRecordRepository.findAllCategories();

    ReferenceData data =
        ReferenceData.builder().categories(categories).knownVendors(vendors.values()).build();
    current.set(data);
    log.debug(
        "Reference data refreshed: {} categories, {} known vendors",
        data.getCategories().size(),
        data.getKnownVendors().size());
    return data;
  }

  private static void addDistinct(Map<String, String> target, String value) {
    if (value != null && !value.isBlank()) {
      target.putIfAbsent(value.trim().toLowerCase(Locale.ROOT), value.trim());
    }
  }
}
