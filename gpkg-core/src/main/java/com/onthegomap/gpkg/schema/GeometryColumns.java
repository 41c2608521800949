package com.onthegomap.gpkg.schema;

import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import com.onthegomap.gpkg.geo.GeometryType;
import com.onthegomap.gpkg.geo.ZmPolicy;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/** Reads and writes the {@code gpkg_geometry_columns} table. */
public class GeometryColumns {

  public static final String TABLE = "gpkg_geometry_columns";

  private static final String COLUMNS = "table_name, column_name, geometry_type_name, srs_id, z, m";

  private final Sqlite db;

  public GeometryColumns(Sqlite db) {
    this.db = db;
  }

  public void createTable() {
    db.execute("""
      CREATE TABLE IF NOT EXISTS %s (
        table_name TEXT NOT NULL,
        column_name TEXT NOT NULL,
        geometry_type_name TEXT NOT NULL,
        srs_id INTEGER NOT NULL,
        z TINYINT NOT NULL,
        m TINYINT NOT NULL,
        CONSTRAINT pk_geom_cols PRIMARY KEY (table_name, column_name),
        CONSTRAINT fk_gc_tn FOREIGN KEY (table_name) REFERENCES %s(table_name),
        CONSTRAINT fk_gc_srs FOREIGN KEY (srs_id) REFERENCES %s(srs_id)
      )
      """.formatted(TABLE, Contents.TABLE, SpatialReferenceSystems.TABLE));
  }

  /** Returns the geometry column of {@code tableName}, or empty if it is not a feature table. */
  public Optional<GeometryColumn> get(String tableName) {
    return db.queryFirst("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE table_name = ?", GeometryColumns::read,
      tableName);
  }

  public List<GeometryColumn> list() {
    return db.query("SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY table_name", GeometryColumns::read);
  }

  public void add(GeometryColumn column) {
    SqlNames.validateTable(column.tableName());
    SqlNames.validateColumn(column.columnName());
    db.update("INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
      column.tableName(),
      column.columnName(),
      column.geometryType().typeName(),
      column.srsId(),
      column.z().value(),
      column.m().value()
    );
  }

  public boolean delete(String tableName) {
    return db.update("DELETE FROM " + TABLE + " WHERE table_name = ?", tableName) > 0;
  }

  private static GeometryColumn read(ResultSet rs) throws SQLException {
    return new GeometryColumn(
      rs.getString("table_name"),
      rs.getString("column_name"),
      GeometryType.fromName(rs.getString("geometry_type_name")),
      rs.getInt("srs_id"),
      ZmPolicy.fromValue(rs.getInt("z")),
      ZmPolicy.fromValue(rs.getInt("m"))
    );
  }
}
