package com.onthegomap.gpkg.schema;

import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.locationtech.jts.geom.Envelope;

/** Reads and writes the {@code gpkg_contents} table which lists every user table in the geopackage. */
public class Contents {

  public static final String TABLE = "gpkg_contents";

  private static final String NOW = "strftime('%Y-%m-%dT%H:%M:%fZ', 'now')";
  private static final String COLUMNS =
    "table_name, data_type, identifier, description, last_change, min_x, min_y, max_x, max_y, srs_id";

  private final Sqlite db;
  private final SpatialReferenceSystems srs;

  public Contents(Sqlite db, SpatialReferenceSystems srs) {
    this.db = db;
    this.srs = srs;
  }

  public void createTable() {
    db.execute("""
      CREATE TABLE IF NOT EXISTS %s (
        table_name TEXT NOT NULL PRIMARY KEY,
        data_type TEXT NOT NULL,
        identifier TEXT UNIQUE,
        description TEXT DEFAULT '',
        last_change DATETIME NOT NULL DEFAULT (%s),
        min_x DOUBLE,
        min_y DOUBLE,
        max_x DOUBLE,
        max_y DOUBLE,
        srs_id INTEGER,
        CONSTRAINT fk_gc_r_srs_id FOREIGN KEY (srs_id) REFERENCES %s(srs_id)
      )
      """.formatted(TABLE, NOW, SpatialReferenceSystems.TABLE));
  }

  public Optional<Content> get(String tableName) {
    return db.queryFirst("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE table_name = ?", Contents::read,
      tableName);
  }

  public boolean exists(String tableName) {
    return db.queryLong("SELECT count(*) FROM " + TABLE + " WHERE table_name = ?", tableName) > 0;
  }

  public List<Content> list() {
    return db.query("SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY table_name", Contents::read);
  }

  public List<Content> list(DataType dataType) {
    return db.query("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE data_type = ? ORDER BY table_name",
      Contents::read, dataType.value());
  }

  /**
   * Registers a user table.
   *
   * @throws IllegalArgumentException if the table name is invalid, is already registered, or the srs does not exist
   */
  public void add(Content content) {
    SqlNames.validateTable(content.tableName());
    checkSrs(content.srsId());
    if (exists(content.tableName())) {
      throw new IllegalArgumentException("Content for table " + content.tableName() + " already exists");
    }
    Envelope bounds = content.bounds();
    db.update("""
      INSERT INTO %s (table_name, data_type, identifier, description, last_change, min_x, min_y, max_x, max_y, srs_id)
      VALUES (?, ?, ?, ?, coalesce(?, %s), ?, ?, ?, ?, ?)
      """.formatted(TABLE, NOW),
      content.tableName(),
      content.dataType().value(),
      content.identifier() == null ? content.tableName() : content.identifier(),
      content.description() == null ? "" : content.description(),
      content.lastChange() == null ? null : content.lastChange().toString(),
      bounds == null ? null : bounds.getMinX(),
      bounds == null ? null : bounds.getMinY(),
      bounds == null ? null : bounds.getMaxX(),
      bounds == null ? null : bounds.getMaxY(),
      content.srsId()
    );
  }

  /**
   * Replaces the identifier, description, bounds and srs of a registered table and sets its last change to now.
   *
   * @throws IllegalArgumentException if the table is not registered or the srs does not exist
   */
  public void update(Content content) {
    checkSrs(content.srsId());
    Envelope bounds = content.bounds();
    int changed = db.update("""
      UPDATE %s SET identifier = ?, description = ?, last_change = %s,
        min_x = ?, min_y = ?, max_x = ?, max_y = ?, srs_id = ?
      WHERE table_name = ?
      """.formatted(TABLE, NOW),
      content.identifier() == null ? content.tableName() : content.identifier(),
      content.description(),
      bounds == null ? null : bounds.getMinX(),
      bounds == null ? null : bounds.getMinY(),
      bounds == null ? null : bounds.getMaxX(),
      bounds == null ? null : bounds.getMaxY(),
      content.srsId(),
      content.tableName()
    );
    if (changed == 0) {
      throw new IllegalArgumentException("Content for table " + content.tableName() + " not found");
    }
  }

  /** Sets the bounding box of a table, or clears it when {@code bounds} is null or empty. */
  public void updateBounds(String tableName, Envelope bounds) {
    boolean clear = bounds == null || bounds.isNull();
    int changed = db.update("""
      UPDATE %s SET min_x = ?, min_y = ?, max_x = ?, max_y = ?, last_change = %s WHERE table_name = ?
      """.formatted(TABLE, NOW),
      clear ? null : bounds.getMinX(),
      clear ? null : bounds.getMinY(),
      clear ? null : bounds.getMaxX(),
      clear ? null : bounds.getMaxY(),
      tableName
    );
    if (changed == 0) {
      throw new IllegalArgumentException("Content for table " + tableName + " not found");
    }
  }

  /** Sets the last change time of a table to now. */
  public void touch(String tableName) {
    db.update("UPDATE " + TABLE + " SET last_change = " + NOW + " WHERE table_name = ?", tableName);
  }

  /**
   * Removes the registration of a table, but not the table itself.
   *
   * @throws IllegalArgumentException if the table is not registered
   */
  public void delete(String tableName) {
    if (db.update("DELETE FROM " + TABLE + " WHERE table_name = ?", tableName) == 0) {
      throw new IllegalArgumentException("Content for table " + tableName + " not found");
    }
  }

  private void checkSrs(Integer srsId) {
    if (srsId != null && !srs.exists(srsId)) {
      throw new IllegalArgumentException("SRS ID " + srsId + " not found");
    }
  }

  private static Content read(ResultSet rs) throws SQLException {
    double minX = rs.getDouble("min_x");
    boolean hasBounds = !rs.wasNull();
    Envelope bounds = hasBounds ?
      new Envelope(minX, rs.getDouble("max_x"), rs.getDouble("min_y"), rs.getDouble("max_y")) : null;
    int srsId = rs.getInt("srs_id");
    Integer srs = rs.wasNull() ? null : srsId;
    String lastChange = rs.getString("last_change");
    return new Content(
      rs.getString("table_name"),
      DataType.fromValue(rs.getString("data_type")),
      rs.getString("identifier"),
      rs.getString("description"),
      lastChange == null ? null : Instant.parse(lastChange),
      bounds,
      srs
    );
  }
}
