package edu.jhu.hlt.candgen;

/**
 * Thrown when an extractor, relation schema or store is configured in a way
 * that can never work (mismatched list lengths, wrong arity, malformed store
 * URL, ...). Always raised before any document is processed.
 */
public class ConfigurationException extends RuntimeException {
  private static final long serialVersionUID = 3310846521557012811L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
