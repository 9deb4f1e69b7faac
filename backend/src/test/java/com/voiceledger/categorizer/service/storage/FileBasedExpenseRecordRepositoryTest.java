package com.voiceledger.categorizer.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.voiceledger.categorizer.config.ApplicationProperties;
import com.voiceledger.categorizer.dto.expense.ExpenseRecord;
import com.voiceledger.categorizer.fixtures.TestFixtures;

@DisplayName("FileBasedExpenseRecordRepository Tests")
class FileBasedExpenseRecordRepositoryTest {

  @TempDir Path tempDir;

  private Path expensesFile;
  private FileBasedExpenseRecordRepository repository;

  @BeforeEach
  void setUp() {
    expensesFile = tempDir.resolve("data/expenses.json");
    ApplicationProperties properties = TestFixtures.properties();
    properties.getStorage().setExpensesFile(expensesFile.toString());
    repository = new FileBasedExpenseRecordRepository(TestFixtures.objectMapper(), properties);
    repository.init();
  }

  @Nested
  @DisplayName("Saving")
  class Saving {

    @Test
    void shouldAssignSequentialIdsToNewRecords() {
      ExpenseRecord first = repository.save(TestFixtures.expense(1, "Fuel", "BP", "diesel", "x"));
      ExpenseRecord second =
          repository.save(
              TestFixtures.expense(0, "Groceries", "Lidl", "bread", "bread").toBuilder()
                  .id(null)
                  .build());

      assertThat(first.getId()).isEqualTo(1L);
      assertThat(second.getId()).isEqualTo(2L);
      assertThat(repository.findAll()).hasSize(2);
    }

    @Test
    void shouldReplaceRecordWithSameId() {
      repository.save(TestFixtures.expense(3, "Fuel", "BP", "diesel", "diesel at bp"));
      repository.save(TestFixtures.expense(3, "Groceries", "BP", "milk", "milk at bp"));

      assertThat(repository.findAll()).hasSize(1);
      assertThat(repository.findById(3)).get().extracting(ExpenseRecord::getCategory)
          .isEqualTo("Groceries");
    }

    @Test
    void shouldPersistRecordsAcrossReload() {
      TestFixtures.groceriesAndFuel().forEach(repository::save);

      repository.reload();

      assertThat(repository.findAll()).hasSize(12);
      assertThat(repository.findById(9)).get().extracting(ExpenseRecord::getVendor)
          .isEqualTo("Shell");
      assertThat(Files.exists(expensesFile)).isTrue();
    }
  }

  @Nested
  @DisplayName("Confirmation")
  class Confirmation {

    @Test
    void shouldConfirmExistingRecord() {
      repository.save(
          TestFixtures.expense(1, "Groceries", "Shell", "snacks", "snacks at shell").toBuilder()
              .needsConfirmation(true)
              .confidenceScore(0.3)
              .build());

      assertThat(repository.confirmCategory(1, "Fuel")).isTrue();

      ExpenseRecord confirmed = repository.findById(1).orElseThrow();
      assertThat(confirmed.getCategory()).isEqualTo("Fuel");
      assertThat(confirmed.getConfidenceScore()).isEqualTo(1.0);
      assertThat(confirmed.isNeedsConfirmation()).isFalse();
    }

    @Test
    void shouldReturnFalseForUnknownRecord() {
      assertThat(repository.confirmCategory(42, "Fuel")).isFalse();
      assertThat(repository.findAll()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Write failures")
  class WriteFailures {

    private void makeFileUnwritable() throws IOException {
      Files.delete(expensesFile);
      Files.createDirectory(expensesFile);
    }

    @Test
    void shouldNotKeepNewRecordWhenWriteFails() throws IOException {
      repository.save(TestFixtures.expense(1, "Fuel", "BP", "diesel", "diesel at bp"));
      makeFileUnwritable();

      assertThatThrownBy(
              () ->
                  repository.save(
                      TestFixtures.expense(2, "Groceries", "Lidl", "bread", "bread at lidl")))
          .isInstanceOf(UncheckedIOException.class);

      assertThat(repository.findAll()).extracting(ExpenseRecord::getId).containsExactly(1L);
    }

    @Test
    void shouldKeepPreviousCategoryWhenConfirmationWriteFails() throws IOException {
      repository.save(TestFixtures.expense(1, "Groceries", "Shell", "snacks", "snacks at shell"));
      makeFileUnwritable();

      assertThatThrownBy(() -> repository.confirmCategory(1, "Fuel"))
          .isInstanceOf(UncheckedIOException.class);

      ExpenseRecord unchanged = repository.findById(1).orElseThrow();
      assertThat(unchanged.getCategory()).isEqualTo("Groceries");
      assertThat(unchanged.getConfidenceScore()).isEqualTo(0.9);
    }
  }

  @Nested
  @DisplayName("Reference lists")
  class ReferenceLists {

    @Test
    void shouldListDistinctVendorsAndCategoriesInFirstSeenOrder() {
      TestFixtures.groceriesAndFuel().forEach(repository::save);
      repository.save(TestFixtures.expense(13, "fuel", "shell", "petrol", "petrol"));
      repository.save(TestFixtures.expense(14, " ", null, "gum", "gum"));

      assertThat(repository.findKnownVendors())
          .containsExactly("Tesco", "Lidl", "Aldi", "Asda", "Morrisons", "Shell", "BP", "Esso");
      assertThat(repository.findAllCategories()).containsExactly("Groceries", "Fuel");
    }
  }

  @Nested
  @DisplayName("Loading")
  class Loading {

    @Test
    void shouldStartEmptyWhenFileIsMissing() {
      assertThat(repository.findAll()).isEmpty();
      assertThat(Files.isDirectory(expensesFile.getParent())).isTrue();
    }

    @Test
    void shouldIgnoreStoredRecordsWithoutId() throws IOException {
      Files.writeString(
          expensesFile,
          "[{\"id\":5,\"vendor\":\"Aldi\",\"category\":\"Groceries\",\"date\":\"2024-03-02\"},"
              + "{\"vendor\":\"BP\",\"category\":\"Fuel\"}]",
          StandardCharsets.UTF_8);

      repository.reload();

      assertThat(repository.findAll()).extracting(ExpenseRecord::getId).containsExactly(5L);
    }

    @Test
    void shouldStartEmptyWhenFileIsUnreadable() throws IOException {
      Files.writeString(expensesFile, "not json", StandardCharsets.UTF_8);

      repository.reload();

      assertThat(repository.findAll()).isEmpty();
    }
  }
}
