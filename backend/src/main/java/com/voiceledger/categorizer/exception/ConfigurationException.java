package com.voiceledger.categorizer.exception;

/** Missing or invalid connection settings. Raised while the application context starts. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
