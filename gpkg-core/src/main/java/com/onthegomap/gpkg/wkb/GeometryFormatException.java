package com.onthegomap.gpkg.wkb;

/**
 * Error encountered while parsing a geometry blob: bad magic, unsupported version or type code, or truncated bytes.
 */
public class GeometryFormatException extends RuntimeException {
  public GeometryFormatException(String message) {
    super(message);
  }

  public GeometryFormatException(String message, Throwable throwable) {
    super(message, throwable);
  }
}
