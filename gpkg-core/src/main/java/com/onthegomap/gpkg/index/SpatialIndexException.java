package com.onthegomap.gpkg.index;

/**
 * Thrown when a spatial index operation does not fit the current state: creating an index that exists, dropping,
 * rebuilding or querying one that does not, or indexing a table without a geometry column.
 */
public class SpatialIndexException extends IllegalStateException {

  public SpatialIndexException(String message) {
    super(message);
  }
}
