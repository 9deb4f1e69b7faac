package com.voiceledger.categorizer.exception;

/** The embedding model or the similarity index could not be reached. Always recoverable. */
public class TransientInfraException extends RuntimeException {

  public TransientInfraException(String message) {
    super(message);
  }

  public TransientInfraException(String message, Throwable cause) {
    super(message, cause);
  }
}
