package com.voiceledger.categorizer.exception;

/** Too few samples or categories to train a model. */
public class InsufficientDataException extends RuntimeException {

  public InsufficientDataException(String message) {
    super(message);
  }
}
