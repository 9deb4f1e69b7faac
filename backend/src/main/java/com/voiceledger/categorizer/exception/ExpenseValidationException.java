package com.voiceledger.categorizer.exception;

import lombok.Getter;

/** A historical expense record cannot be used for training or evaluation. */
@Getter
public class ExpenseValidationException extends RuntimeException {

  private final Long expenseId;

  public ExpenseValidationException(Long expenseId, String message) {
    super(message);
    this.expenseId = expenseId;
  }
}
