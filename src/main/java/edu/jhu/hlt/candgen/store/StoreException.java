package edu.jhu.hlt.candgen.store;

import java.sql.SQLException;

/**
 * Unchecked wrapper for failures of the backing store.
 */
public class StoreException extends RuntimeException {
  private static final long serialVersionUID = -4182250318841617925L;

  public StoreException(String message, SQLException cause) {
    super(message + ": " + cause.getMessage(), cause);
  }

  public StoreException(String message) {
    super(message);
  }

  /** SQLState of the underlying error, or null. */
  public String getSqlState() {
    if (getCause() instanceof SQLException)
      return ((SQLException) getCause()).getSQLState();
    return null;
  }
}
