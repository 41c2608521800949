package com.onthegomap.gpkg.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by a geometry that does not fit the column it is being written to.
 * <p>
 * Thrown before anything is written, so callers can skip the offending feature and keep going.
 */
public class GeometryException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryException.class);

  private final String stat;

  /**
   * Constructs a new exception with a detailed error message.
   *
   * @param stat    string that uniquely identifies this error condition
   * @param message description of the error that names the table, column and offending value
   */
  public GeometryException(String stat, String message) {
    super(message);
    this.stat = stat;
  }

  public GeometryException(String stat, String message, Throwable cause) {
    super(message, cause);
    this.stat = stat;
  }

  /** Returns the unique code for this error condition. */
  public String stat() {
    return stat;
  }

  /** Logs the error with some context about what was being done. */
  public void log(String logContext) {
    logMessage(logContext + ": " + getMessage());
  }

  void logMessage(String log) {
    LOGGER.warn(log);
  }

  /** The runtime type of a geometry is not compatible with the declared type of its column. */
  public static class TypeMismatch extends GeometryException {

    public TypeMismatch(String message) {
      super("type_mismatch", message);
    }
  }

  /** A geometry has Z or M values its column prohibits, or lacks ones its column requires. */
  public static class Dimension extends GeometryException {

    public Dimension(String stat, String message) {
      super(stat, message);
    }

    @Override
    void logMessage(String log) {
      LOGGER.debug(log);
    }
  }
}
