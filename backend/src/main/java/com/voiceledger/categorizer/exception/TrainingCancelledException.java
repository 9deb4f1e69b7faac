package com.voiceledger.categorizer.exception;

public class TrainingCancelledException extends RuntimeException {

  public TrainingCancelledException(String message) {
    super(message);
  }
}
