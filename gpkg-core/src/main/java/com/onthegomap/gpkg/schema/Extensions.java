package com.onthegomap.gpkg.schema;

import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/** Reads and writes the {@code gpkg_extensions} registry. */
public class Extensions {

  public static final String TABLE = "gpkg_extensions";

  public static final String RTREE_INDEX = "gpkg_rtree_index";
  public static final String SCHEMA = "gpkg_schema";
  public static final String METADATA = "gpkg_metadata";
  public static final String CRS_WKT = "gpkg_crs_wkt";
  public static final String WEBP = "gpkg_webp";
  public static final String ZOOM_OTHER = "gpkg_zoom_other";

  private static final String COLUMNS = "table_name, column_name, extension_name, definition, scope";
  // null columns never compare equal in sql so match them with IS
  private static final String MATCH = "table_name IS ? AND column_name IS ? AND extension_name = ?";

  private final Sqlite db;

  public Extensions(Sqlite db) {
    this.db = db;
  }

  public void createTable() {
    db.execute("""
      CREATE TABLE IF NOT EXISTS %s (
        table_name TEXT,
        column_name TEXT,
        extension_name TEXT NOT NULL,
        definition TEXT NOT NULL,
        scope TEXT NOT NULL,
        CONSTRAINT ge_tce UNIQUE (table_name, column_name, extension_name)
      )
      """.formatted(TABLE));
  }

  /**
   * Registers an extension.
   *
   * @throws IllegalArgumentException if the same extension is already registered for that table and column, or a
   *                                  column is given without a table
   */
  public void register(Extension extension) {
    if (extension.tableName() != null) {
      SqlNames.validateTable(extension.tableName());
    }
    if (extension.columnName() != null) {
      if (extension.tableName() == null) {
        throw new IllegalArgumentException("Extension " + extension.extensionName() + " has a column but no table");
      }
      SqlNames.validateColumn(extension.columnName());
    }
    if (exists(extension.extensionName(), extension.tableName(), extension.columnName())) {
      throw new IllegalArgumentException("Extension " + extension.extensionName() + " already registered for " +
        describe(extension.tableName(), extension.columnName()));
    }
    db.update("INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?)",
      extension.tableName(),
      extension.columnName(),
      extension.extensionName(),
      extension.definition(),
      extension.scope().value()
    );
  }

  /** Registers an extension unless it is already registered for that table and column. */
  public void registerIfAbsent(Extension extension) {
    if (!exists(extension.extensionName(), extension.tableName(), extension.columnName())) {
      register(extension);
    }
  }

  public Optional<Extension> get(String extensionName, String tableName, String columnName) {
    return db.queryFirst("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE " + MATCH, Extensions::read,
      tableName, columnName, extensionName);
  }

  public boolean exists(String extensionName, String tableName, String columnName) {
    return db.queryLong("SELECT count(*) FROM " + TABLE + " WHERE " + MATCH, tableName, columnName,
      extensionName) > 0;
  }

  public List<Extension> list() {
    return db.query("SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY extension_name, table_name, column_name",
      Extensions::read);
  }

  public List<Extension> listForTable(String tableName) {
    return db.query("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE table_name = ? ORDER BY extension_name",
      Extensions::read, tableName);
  }

  /** Returns the extensions that apply to the whole geopackage rather than to one table. */
  public List<Extension> listForGeoPackage() {
    return db.query("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE table_name IS NULL ORDER BY extension_name",
      Extensions::read);
  }

  /**
   * Removes one extension registration.
   *
   * @throws IllegalArgumentException if it is not registered
   */
  public void delete(String extensionName, String tableName, String columnName) {
    int changed = db.update("DELETE FROM " + TABLE + " WHERE " + MATCH, tableName, columnName, extensionName);
    if (changed == 0) {
      throw new IllegalArgumentException(
        "Extension " + extensionName + " not registered for " + describe(tableName, columnName));
    }
  }

  /** Removes every extension registered for {@code tableName} and returns how many there were. */
  public int deleteForTable(String tableName) {
    return db.update("DELETE FROM " + TABLE + " WHERE table_name = ?", tableName);
  }

  private static String describe(String tableName, String columnName) {
    return tableName == null ? "geopackage" : columnName == null ? tableName : tableName + "." + columnName;
  }

  private static Extension read(ResultSet rs) throws SQLException {
    return new Extension(
      rs.getString("table_name"),
      rs.getString("column_name"),
      rs.getString("extension_name"),
      rs.getString("definition"),
      Extension.Scope.fromValue(rs.getString("scope"))
    );
  }
}
