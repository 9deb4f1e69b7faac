package com.voiceledger.categorizer.service.training;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.voiceledger.categorizer.service.storage.ExpenseRecordRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Applies a user's category confirmation and feeds it to the incremental updater. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpenseConfirmationService {

  static final String MDC_EXPENSE_ID = "expenseId";

  private final ExpenseRecordRepository expenseRecordRepository;
  private final ModelTrainingService modelTrainingService;

  /**
   * Stores the confirmed category (confidence 1.0, no longer awaiting confirmation) and then
   * updates the model with it. A failed model update does not undo the stored confirmation.
   *
   * @return false when the category is blank or the expense does not exist
   */
  public boolean confirmCategory(long expenseId, String category) {
    if (category == null || category.isBlank()) {
      log.warn("Rejected confirmation for expense {} without a category", expenseId);
      return false;
    }
    MDC.put(MDC_EXPENSE_ID, String.valueOf(expenseId));
    try {
      String confirmed = category.trim();
      if (!expenseRecordRepository.confirmCategory(expenseId, confirmed)) {
        log.warn("Cannot confirm category, expense {} not found", expenseId);
        return false;
      }
      log.info("Expense {} confirmed as {}", expenseId, confirmed);

      if (!modelTrainingService.incrementalUpdate(expenseId, confirmed)) {
        log.warn("Model not updated for expense {} until the next full training", expenseId);
      }
      return true;
    } finally {
      MDC.remove(MDC_EXPENSE_ID);
    }
  }
}
