package com.voiceledger.categorizer.service.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.expense.ExpenseRecord;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * File-based repository for expense records. The whole table is kept in memory and written back
 * to a single JSON array on every change.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FileBasedExpenseRecordRepository implements ExpenseRecordRepository {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;
  private final TreeMap<Long, ExpenseRecord> expenses = new TreeMap<>();
  private Path expensesFile;

  @PostConstruct
  public void init() {
    expensesFile = Paths.get(applicationProperties.getStorage().getExpensesFile());
    try {
      Path parent = expensesFile.getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      log.warn(
          "Failed to ensure directory for expenses file '{}': {}", expensesFile, e.getMessage());
    }
    loadExpenses();
  }

  @Override
  public synchronized ExpenseRecord save(ExpenseRecord expense) {
    ExpenseRecord stored = expense;
    if (stored.getId() == null) {
      long nextId = expenses.isEmpty() ? 1L : expenses.lastKey() + 1;
      stored = stored.toBuilder().id(nextId).build();
    }
    putAndPersist(stored);
    return stored;
  }

  @Override
  public synchronized Optional<ExpenseRecord> findById(long id) {
    return Optional.ofNullable(expenses.get(id));
  }

  @Override
  public synchronized List<ExpenseRecord> findAll() {
    return new ArrayList<>(expenses.values());
  }

  @Override
  public synchronized boolean confirmCategory(long id, String category) {
    ExpenseRecord existing = expenses.get(id);
    if (existing == null) {
      return false;
    }
    putAndPersist(
        existing.toBuilder()
            .category(category)
            .confidenceScore(1.0)
            .needsConfirmation(false)
            .build());
    return true;
  }

  @Override
  public synchronized List<String> findKnownVendors() {
    List<String> vendors = new ArrayList<>();
    expenses.values().forEach(expense -> vendors.add(expense.getVendor()));
    return distinct(vendors);
  }

  @Override
  public synchronized List<String> findAllCategories() {
    List<String> categories = new ArrayList<>();
    expenses.values().forEach(expense -> categories.add(expense.getCategory()));
    return distinct(categories);
  }

  /** Puts the record and writes the table, restoring the previous entry if the write fails. */
  private void putAndPersist(ExpenseRecord record) {
    ExpenseRecord previous = expenses.put(record.getId(), record);
    try {
      saveExpenses();
    } catch (UncheckedIOException e) {
      if (previous == null) {
        expenses.remove(record.getId());
      } else {
        expenses.put(record.getId(), previous);
      }
      throw e;
    }
  }

  /** Clears the in-memory table and reloads it from the file. */
  public synchronized void reload() {
    expenses.clear();
    loadExpenses();
  }

  private static List<String> distinct(List<String> values) {
    Map<String, String> seen = new LinkedHashMap<>();
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        seen.putIfAbsent(value.trim().toLowerCase(Locale.ROOT), value.trim());
      }
    }
    return new ArrayList<>(seen.values());
  }

  private void loadExpenses() {
    if (!Files.exists(expensesFile)) {
      log.debug("No expenses file found at {}, starting with empty repository", expensesFile);
      return;
    }

    try {
      String json = Files.readString(expensesFile);
      List<ExpenseRecord> records =
          objectMapper.readValue(
              json,
              objectMapper
                  .getTypeFactory()
                  .constructCollectionType(List.class, ExpenseRecord.class));

      for (ExpenseRecord record : records) {
        if (record.getId() == null) {
          log.warn("Ignoring stored expense without id: {}", record);
          continue;
        }
        expenses.put(record.getId(), record);
      }

      log.info("Loaded {} expenses from {}", expenses.size(), expensesFile);

    } catch (IOException e) {
      log.error("Failed to load expenses from file: {}", expensesFile, e);
    }
  }

  private void saveExpenses() {
    try {
      Path parent = expensesFile.getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
      List<ExpenseRecord> records = new ArrayList<>(expenses.values());
      String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
      Files.writeString(expensesFile, json);

      log.debug("Saved {} expenses to {}", records.size(), expensesFile);

    } catch (IOException e) {
      log.error("Failed to save expenses to file: {}", expensesFile, e);
      throw new UncheckedIOException(e);
    }
  }
}
