package com.onthegomap.gpkg.schema;

import com.onthegomap.gpkg.db.Sqlite;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Reads and writes the {@code gpkg_spatial_ref_sys} table. */
public class SpatialReferenceSystems {

  public static final String TABLE = "gpkg_spatial_ref_sys";

  public static final int WGS84 = 4326;
  public static final int WEB_MERCATOR = 3857;
  public static final int UNDEFINED_CARTESIAN = -1;
  public static final int UNDEFINED_GEOGRAPHIC = 0;

  private static final Set<Integer> REQUIRED = Set.of(WGS84, UNDEFINED_CARTESIAN, UNDEFINED_GEOGRAPHIC);

  private static final String WGS84_WKT = """
    GEOGCS["WGS 84",DATUM["WGS_1984",SPHEROID["WGS 84",6378137,298.257223563,AUTHORITY["EPSG","7030"]],\
    AUTHORITY["EPSG","6326"]],PRIMEM["Greenwich",0,AUTHORITY["EPSG","8901"]],\
    UNIT["degree",0.0174532925199433,AUTHORITY["EPSG","9122"]],AUTHORITY["EPSG","4326"]]""";

  private static final String WEB_MERCATOR_WKT = """
    PROJCS["WGS 84 / Pseudo-Mercator",GEOGCS["WGS 84",DATUM["WGS_1984",SPHEROID["WGS 84",6378137,298.257223563,\
    AUTHORITY["EPSG","7030"]],AUTHORITY["EPSG","6326"]],PRIMEM["Greenwich",0,AUTHORITY["EPSG","8901"]],\
    UNIT["degree",0.0174532925199433,AUTHORITY["EPSG","9122"]],AUTHORITY["EPSG","4326"]],\
    PROJECTION["Mercator_1SP"],PARAMETER["central_meridian",0],PARAMETER["scale_factor",1],\
    PARAMETER["false_easting",0],PARAMETER["false_northing",0],UNIT["metre",1,AUTHORITY["EPSG","9001"]],\
    AXIS["X",EAST],AXIS["Y",NORTH],AUTHORITY["EPSG","3857"]]""";

  public static final List<SpatialReferenceSystem> DEFAULTS = List.of(
    new SpatialReferenceSystem("WGS 84", WGS84, "EPSG", WGS84, WGS84_WKT, "WGS 84 geographic 2D CRS"),
    new SpatialReferenceSystem("WGS 84 / Pseudo-Mercator", WEB_MERCATOR, "EPSG", WEB_MERCATOR, WEB_MERCATOR_WKT,
      "WGS 84 / Pseudo-Mercator (Web Mercator)"),
    new SpatialReferenceSystem("Undefined Cartesian SRS", UNDEFINED_CARTESIAN, "NONE", UNDEFINED_CARTESIAN,
      "undefined", "Undefined Cartesian coordinate reference system"),
    new SpatialReferenceSystem("Undefined Geographic SRS", UNDEFINED_GEOGRAPHIC, "NONE", UNDEFINED_GEOGRAPHIC,
      "undefined", "Undefined geographic coordinate reference system")
  );

  private static final String COLUMNS =
    "srs_name, srs_id, organization, organization_coordsys_id, definition, description";

  private final Sqlite db;

  public SpatialReferenceSystems(Sqlite db) {
    this.db = db;
  }

  /** Creates the table if it does not exist and inserts the default systems that are missing. */
  public void createTable() {
    db.execute("""
      CREATE TABLE IF NOT EXISTS %s (
        srs_name TEXT NOT NULL,
        srs_id INTEGER NOT NULL PRIMARY KEY,
        organization TEXT NOT NULL,
        organization_coordsys_id INTEGER NOT NULL,
        definition TEXT NOT NULL,
        description TEXT
      )
      """.formatted(TABLE));
    for (var srs : DEFAULTS) {
      db.update("INSERT OR IGNORE INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
        srs.name(), srs.id(), srs.organization(), srs.organizationCoordsysId(), srs.definition(), srs.description());
    }
  }

  public Optional<SpatialReferenceSystem> get(int id) {
    return db.queryFirst("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE srs_id = ?", SpatialReferenceSystems::read,
      id);
  }

  public List<SpatialReferenceSystem> list() {
    return db.query("SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY srs_id", SpatialReferenceSystems::read);
  }

  public boolean exists(int id) {
    return db.queryLong("SELECT count(*) FROM " + TABLE + " WHERE srs_id = ?", id) > 0;
  }

  /**
   * Inserts a new spatial reference system.
   *
   * @throws IllegalArgumentException if one with the same id already exists
   */
  public void add(SpatialReferenceSystem srs) {
    if (exists(srs.id())) {
      throw new IllegalArgumentException("SRS with ID " + srs.id() + " already exists");
    }
    db.update("INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
      srs.name(), srs.id(), srs.organization(), srs.organizationCoordsysId(), srs.definition(), srs.description());
  }

  /**
   * Replaces every field of an existing spatial reference system.
   *
   * @throws IllegalArgumentException if no system with that id exists
   */
  public void update(SpatialReferenceSystem srs) {
    int changed = db.update("""
      UPDATE %s SET srs_name = ?, organization = ?, organization_coordsys_id = ?, definition = ?, description = ?
      WHERE srs_id = ?
      """.formatted(TABLE),
      srs.name(), srs.organization(), srs.organizationCoordsysId(), srs.definition(), srs.description(), srs.id());
    if (changed == 0) {
      throw new IllegalArgumentException("SRS with ID " + srs.id() + " not found");
    }
  }

  /**
   * Deletes a spatial reference system.
   *
   * @throws IllegalArgumentException if it is one of the required systems, is still referenced by a table, or does
   *                                  not exist
   */
  public void delete(int id) {
    if (REQUIRED.contains(id)) {
      throw new IllegalArgumentException("Cannot delete required SRS: " + id);
    }
    long references = db.queryLong("SELECT count(*) FROM " + Contents.TABLE + " WHERE srs_id = ?", id) +
      db.queryLong("SELECT count(*) FROM " + GeometryColumns.TABLE + " WHERE srs_id = ?", id);
    if (references > 0) {
      throw new IllegalArgumentException("Cannot delete SRS " + id + ": it is referenced by " + references + " rows");
    }
    if (db.update("DELETE FROM " + TABLE + " WHERE srs_id = ?", id) == 0) {
      throw new IllegalArgumentException("SRS with ID " + id + " not found");
    }
  }

  private static SpatialReferenceSystem read(ResultSet rs) throws SQLException {
    return new SpatialReferenceSystem(
      rs.getString("srs_name"),
      rs.getInt("srs_id"),
      rs.getString("organization"),
      rs.getInt("organization_coordsys_id"),
      rs.getString("definition"),
      rs.getString("description")
    );
  }
}
