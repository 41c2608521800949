package com.onthegomap.gpkg.schema;

import java.time.Instant;
import org.locationtech.jts.geom.Envelope;

/**
 * A row of {@code gpkg_contents} that describes one user table.
 *
 * @param tableName   name of the user table
 * @param dataType    what the table holds
 * @param identifier  unique human-readable identifier, defaults to the table name
 * @param description human-readable description
 * @param lastChange  when the table was last modified, set by the database when null
 * @param bounds      bounding box of the table contents, or null if unknown
 * @param srsId       spatial reference system of {@code bounds}, or null for attribute tables
 */
public record Content(
  String tableName,
  DataType dataType,
  String identifier,
  String description,
  Instant lastChange,
  Envelope bounds,
  Integer srsId
) {

  public Content(String tableName, DataType dataType, Integer srsId) {
    this(tableName, dataType, tableName, "", null, null, srsId);
  }

  public Content withBounds(Envelope newBounds) {
    return new Content(tableName, dataType, identifier, description, lastChange, newBounds, srsId);
  }

  public Content withDescription(String newDescription) {
    return new Content(tableName, dataType, identifier, newDescription, lastChange, bounds, srsId);
  }
}
