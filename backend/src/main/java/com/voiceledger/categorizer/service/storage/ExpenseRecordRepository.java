package com.voiceledger.categorizer.service.storage;

import java.util.List;
import java.util.Optional;

import com.voiceledger.categorizer.dto.expense.ExpenseRecord;

/** Read/write contract for historical expense records. */
public interface ExpenseRecordRepository {

  /**
   * Saves a record, assigning the next free id when it has none.
   *
   * @param expense the record to save
   * @return the saved record
   */
  ExpenseRecord save(ExpenseRecord expense);

  /**
   * Finds an expense by id.
   *
   * @param id the expense id
   * @return the expense if found
   */
  Optional<ExpenseRecord> findById(long id);

  /**
   * Finds all expenses, ordered by id.
   *
   * @return every stored expense, including malformed ones
   */
  List<ExpenseRecord> findAll();

  /**
   * Stores a user-confirmed category for an expense.
   *
   * @return false when no expense has this id
   */
  boolean confirmCategory(long id, String category);

  /** Distinct vendor names seen so far, in first-seen order. */
  List<String> findKnownVendors();

  /** Distinct categories seen so far, in first-seen order. */
  List<String> findAllCategories();
}
