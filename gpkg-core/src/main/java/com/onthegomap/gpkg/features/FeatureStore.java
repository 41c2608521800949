package com.onthegomap.gpkg.features;

import com.onthegomap.gpkg.config.GeoPackageConfig;
import com.onthegomap.gpkg.db.CloseableIterator;
import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import com.onthegomap.gpkg.db.UserRows;
import com.onthegomap.gpkg.geo.GeoUtils;
import com.onthegomap.gpkg.geo.GeometryException;
import com.onthegomap.gpkg.geo.TypeValidator;
import com.onthegomap.gpkg.index.SpatialIndex;
import com.onthegomap.gpkg.schema.Content;
import com.onthegomap.gpkg.schema.Contents;
import com.onthegomap.gpkg.schema.DataColumns;
import com.onthegomap.gpkg.schema.DataType;
import com.onthegomap.gpkg.schema.Extensions;
import com.onthegomap.gpkg.schema.GeometryColumn;
import com.onthegomap.gpkg.schema.GeometryColumns;
import com.onthegomap.gpkg.schema.SpatialReferenceSystems;
import com.onthegomap.gpkg.wkb.EnvelopeExtractor;
import com.onthegomap.gpkg.wkb.GeometryCodec;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates feature tables and reads and writes their rows.
 * <p>
 * Every write validates the geometry against the table's geometry column, encodes it, stores it and updates the
 * table's spatial index in one transaction, so the index always agrees with the table. A geometry that fails
 * validation throws {@link GeometryException} before anything is written.
 */
public class FeatureStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureStore.class);
  private static final String ID = "id";

  private final Sqlite db;
  private final GeoPackageConfig config;
  private final SpatialReferenceSystems srs;
  private final Contents contents;
  private final GeometryColumns geometryColumns;
  private final Extensions extensions;
  private final DataColumns dataColumns;
  private final SpatialIndex spatialIndex;
  private final TypeValidator validator;
  private final EnvelopeExtractor envelopeExtractor;

  public FeatureStore(Sqlite db, GeoPackageConfig config, SpatialReferenceSystems srs, Contents contents,
    GeometryColumns geometryColumns, Extensions extensions, DataColumns dataColumns, SpatialIndex spatialIndex,
    TypeValidator validator, EnvelopeExtractor envelopeExtractor) {
    this.db = db;
    this.config = config;
    this.srs = srs;
    this.contents = contents;
    this.geometryColumns = geometryColumns;
    this.extensions = extensions;
    this.dataColumns = dataColumns;
    this.spatialIndex = spatialIndex;
    this.validator = validator;
    this.envelopeExtractor = envelopeExtractor;
  }

  /**
   * Creates a feature table with an {@code id} primary key, a geometry column and the user columns of {@code table},
   * and registers it in {@code gpkg_contents} and {@code gpkg_geometry_columns}.
   *
   * @throws IllegalArgumentException if a name is invalid or taken, a column name repeats, or the srs does not exist
   */
  public void createFeatureTable(FeatureTableConfig table) {
    String name = SqlNames.validateTable(table.tableName());
    String geometryColumn = SqlNames.validateColumn(table.geometryColumn());
    if (!srs.exists(table.srsId())) {
      throw new IllegalArgumentException("SRS ID " + table.srsId() + " not found");
    }
    if (contents.exists(name) || db.tableExists(name)) {
      throw new IllegalArgumentException("Table " + name + " already exists");
    }
    List<String> definitions = new ArrayList<>();
    definitions.add(ID + " INTEGER PRIMARY KEY AUTOINCREMENT");
    definitions.add(SqlNames.quote(geometryColumn) + " " + table.geometryType().typeName());
    Set<String> seen = new LinkedHashSet<>(List.of(ID, geometryColumn));
    for (ColumnDefinition column : table.columns()) {
      if (!seen.add(column.name())) {
        throw new IllegalArgumentException("Duplicate column " + column.name() + " in table " + name);
      }
      definitions.add(column.toSql());
    }
    db.runInTransaction(() -> {
      db.execute("CREATE TABLE " + SqlNames.quote(name) + " (\n  " + String.join(",\n  ", definitions) + "\n)");
      contents.add(new Content(name, DataType.FEATURES, table.identifier() == null ? name : table.identifier(),
        table.description() == null ? "" : table.description(), null, null, table.srsId()));
      geometryColumns.add(new GeometryColumn(name, geometryColumn, table.geometryType(), table.srsId(), table.z(),
        table.m()));
      if (table.spatialIndex() || config.spatialIndex()) {
        spatialIndex.createIndex(name);
      }
    });
    LOGGER.debug("Created feature table {} with {} user columns", name, table.columns().size());
  }

  /** Returns true if {@code tableName} is registered as a feature table. */
  public boolean isFeatureTable(String tableName) {
    return geometryColumns.get(tableName).isPresent();
  }

  /**
   * Returns the geometry column of a feature table.
   *
   * @throws IllegalArgumentException if it is not a feature table
   */
  public GeometryColumn getGeometryColumn(String tableName) {
    return geometryColumns.get(tableName)
      .orElseThrow(() -> new IllegalArgumentException("Table " + tableName + " is not a feature table"));
  }

  /** Returns the names of the user columns of a feature table, leaving out {@code id} and the geometry column. */
  public List<String> propertyColumns(String tableName) {
    GeometryColumn column = getGeometryColumn(tableName);
    List<String> result = new ArrayList<>(db.columnNames(tableName));
    result.remove(ID);
    result.remove(column.columnName());
    return result;
  }

  /**
   * Adds a feature and returns its new id.
   *
   * @param geometry   the geometry, or null
   * @param properties values of user columns, may be null or leave columns out
   * @throws GeometryException        if {@code geometry} does not fit the table's geometry column
   * @throws IllegalArgumentException if it is not a feature table or a property does not name a column
   */
  public long insert(String tableName, Geometry geometry, Map<String, Object> properties) throws GeometryException {
    GeometryColumn column = getGeometryColumn(tableName);
    Map<String, Object> props = properties == null ? Map.of() : properties;
    UserRows.checkColumns(tableName, props.keySet(), propertyColumns(tableName));
    validator.validate(geometry, column);
    byte[] blob = encode(geometry, column);

    List<String> names = new ArrayList<>();
    List<Object> values = new ArrayList<>();
    names.add(SqlNames.quote(column.columnName()));
    values.add(blob);
    for (var entry : props.entrySet()) {
      names.add(SqlNames.quote(entry.getKey()));
      values.add(UserRows.bindable(entry.getValue()));
    }
    String sql = "INSERT INTO %s (%s) VALUES (%s)".formatted(SqlNames.quote(tableName), String.join(", ", names),
      String.join(", ", Collections.nCopies(names.size(), "?")));
    return db.inTransaction(() -> {
      long id = db.insert(sql, values.toArray());
      spatialIndex.insertEntry(tableName, id, blob);
      contents.touch(tableName);
      return id;
    });
  }

  /** Same as {@link #insert(String, Geometry, Map)} for the geometry and properties of {@code feature}. */
  public long insert(String tableName, Feature feature) throws GeometryException {
    return insert(tableName, feature.geometry(), feature.properties());
  }

  /** Returns the feature with {@code id}, or empty if there is none. */
  public Optional<Feature> get(String tableName, long id) {
    GeometryColumn column = getGeometryColumn(tableName);
    return db.queryFirst("SELECT * FROM " + SqlNames.quote(tableName) + " WHERE " + ID + " = ?",
      rs -> readFeature(rs, column), id);
  }

  /**
   * Replaces the geometry of feature {@code feature.id()} and sets the properties it contains.
   *
   * @throws GeometryException        if the geometry does not fit the table's geometry column
   * @throws IllegalArgumentException if the feature does not exist or a property does not name a column
   */
  public void update(String tableName, Feature feature) throws GeometryException {
    GeometryColumn column = getGeometryColumn(tableName);
    Map<String, Object> props = feature.properties() == null ? Map.of() : feature.properties();
    UserRows.checkColumns(tableName, props.keySet(), propertyColumns(tableName));
    validator.validate(feature.geometry(), column);
    byte[] blob = encode(feature.geometry(), column);

    List<String> names = new ArrayList<>();
    List<Object> values = new ArrayList<>();
    names.add(column.columnName());
    values.add(blob);
    for (var entry : props.entrySet()) {
      names.add(entry.getKey());
      values.add(UserRows.bindable(entry.getValue()));
    }
    values.add(feature.id());
    String sql = "UPDATE %s SET %s WHERE %s = ?".formatted(SqlNames.quote(tableName), UserRows.assignments(names),
      ID);
    db.runInTransaction(() -> {
      if (db.update(sql, values.toArray()) == 0) {
        throw new IllegalArgumentException("Feature " + feature.id() + " not found in table " + tableName);
      }
      spatialIndex.updateEntry(tableName, feature.id(), blob);
      contents.touch(tableName);
    });
  }

  /**
   * Sets some properties of a feature without touching its geometry.
   *
   * @throws IllegalArgumentException if the feature does not exist or a property does not name a column
   */
  public void updateProperties(String tableName, long id, Map<String, Object> properties) {
    getGeometryColumn(tableName);
    if (properties.isEmpty()) {
      return;
    }
    UserRows.checkColumns(tableName, properties.keySet(), propertyColumns(tableName));
    List<Object> values = new ArrayList<>();
    for (Object value : properties.values()) {
      values.add(UserRows.bindable(value));
    }
    values.add(id);
    String sql = "UPDATE %s SET %s WHERE %s = ?".formatted(SqlNames.quote(tableName),
      UserRows.assignments(properties.keySet()), ID);
    db.runInTransaction(() -> {
      if (db.update(sql, values.toArray()) == 0) {
        throw new IllegalArgumentException("Feature " + id + " not found in table " + tableName);
      }
      contents.touch(tableName);
    });
  }

  /** Removes a feature and returns true if it existed. */
  public boolean delete(String tableName, long id) {
    getGeometryColumn(tableName);
    return db.inTransaction(() -> {
      boolean deleted = db.update("DELETE FROM " + SqlNames.quote(tableName) + " WHERE " + ID + " = ?", id) > 0;
      if (deleted) {
        spatialIndex.deleteEntry(tableName, id);
        contents.touch(tableName);
      }
      return deleted;
    });
  }

  public long count(String tableName) {
    getGeometryColumn(tableName);
    return db.queryLong("SELECT count(*) FROM " + SqlNames.quote(tableName));
  }

  /**
   * Returns the features that match {@code query}.
   * <p>
   * With bounds, candidates come from the spatial index when the table has one and otherwise from the envelope of
   * every row, so both return features whose bounding box overlaps the bounds, including ones that only touch it.
   * Features without a geometry or without an envelope never match bounds.
   */
  public List<Feature> query(String tableName, FeatureQuery query) {
    GeometryColumn column = getGeometryColumn(tableName);
    StringBuilder sql = new StringBuilder("SELECT * FROM ").append(SqlNames.quote(tableName));
    if (query.where() != null && !query.where().isBlank()) {
      sql.append(" WHERE (").append(query.where()).append(')');
    }
    sql.append(" ORDER BY ").append(query.orderBy() == null ? ID : query.orderBy().trim());
    if (query.bounds() == null) {
      if (query.limit() != null || query.offset() != null) {
        sql.append(" LIMIT ").append(query.limit() == null ? -1 : query.limit());
        sql.append(" OFFSET ").append(query.offset() == null ? 0 : query.offset());
      }
      return db.query(sql.toString(), rs -> readFeature(rs, column), query.params().toArray());
    }

    Predicate<Row> matches = boundsFilter(tableName, column, query.bounds());
    int skip = query.offset() == null ? 0 : query.offset();
    int limit = query.limit() == null ? Integer.MAX_VALUE : query.limit();
    List<Feature> result = new ArrayList<>();
    try (var rows = db.iterate(sql.toString(), rs -> readRow(rs, column), query.params().toArray())) {
      while (rows.hasNext() && result.size() < limit) {
        Row row = rows.next();
        if (matches.test(row)) {
          if (skip > 0) {
            skip--;
          } else {
            result.add(row.toFeature());
          }
        }
      }
    }
    return result;
  }

  private Predicate<Row> boundsFilter(String tableName, GeometryColumn column, Envelope bounds) {
    if (spatialIndex.hasIndex(tableName)) {
      Set<Long> ids = spatialIndex.query(tableName, bounds);
      return row -> ids.contains(row.id);
    }
    LOGGER.debug("No spatial index on {}.{}, scanning every row", tableName, column.columnName());
    return row -> envelopeExtractor.extract(row.geometry)
      .map(envelope -> GeoUtils.overlaps(envelope, bounds))
      .orElse(false);
  }

  /** Returns every feature in id order, reading one row at a time. The iterator must be closed. */
  public CloseableIterator<Feature> iterate(String tableName) {
    GeometryColumn column = getGeometryColumn(tableName);
    return db.iterate("SELECT * FROM " + SqlNames.quote(tableName) + " ORDER BY " + ID,
      rs -> readFeature(rs, column));
  }

  /** Returns the union of the envelopes of every feature, or empty if none has one. */
  public Optional<Envelope> calculateBounds(String tableName) {
    GeometryColumn column = getGeometryColumn(tableName);
    String geometry = SqlNames.quote(column.columnName());
    Envelope result = new Envelope();
    try (var blobs = db.iterate("SELECT %s FROM %s WHERE %s IS NOT NULL".formatted(geometry,
      SqlNames.quote(tableName), geometry), rs -> rs.getBytes(1))) {
      while (blobs.hasNext()) {
        envelopeExtractor.extract(blobs.next()).ifPresent(result::expandToInclude);
      }
    }
    return result.isNull() ? Optional.empty() : Optional.of(result);
  }

  /** Stores the result of {@link #calculateBounds(String)} in {@code gpkg_contents} and returns it. */
  public Optional<Envelope> updateContentsBounds(String tableName) {
    Optional<Envelope> bounds = calculateBounds(tableName);
    contents.updateBounds(tableName, bounds.orElse(null));
    return bounds;
  }

  /**
   * Drops a feature table along with its spatial index, geometry column, column descriptions, extensions and
   * contents registration.
   */
  public void deleteTable(String tableName) {
    getGeometryColumn(tableName);
    db.runInTransaction(() -> {
      if (spatialIndex.hasIndex(tableName)) {
        spatialIndex.dropIndex(tableName);
      }
      dataColumns.deleteForTable(tableName);
      extensions.deleteForTable(tableName);
      geometryColumns.delete(tableName);
      contents.delete(tableName);
      db.execute("DROP TABLE " + SqlNames.quote(tableName));
    });
    LOGGER.debug("Deleted feature table {}", tableName);
  }

  // null geometries are stored as sql NULL
  private byte[] encode(Geometry geometry, GeometryColumn column) {
    return geometry == null ? null : GeometryCodec.encode(geometry, column.srsId(), config.envelope());
  }

  private static Feature readFeature(ResultSet rs, GeometryColumn column) throws SQLException {
    return readRow(rs, column).toFeature();
  }

  private static Row readRow(ResultSet rs, GeometryColumn column) throws SQLException {
    return new Row(
      rs.getLong(ID),
      rs.getBytes(column.columnName()),
      UserRows.values(rs, Set.of(ID, column.columnName()))
    );
  }

  private record Row(long id, byte[] geometry, Map<String, Object> properties) {

    Feature toFeature() {
      Geometry decoded = geometry == null ? null : GeometryCodec.decode(geometry).geometry();
      return new Feature(id, decoded, properties);
    }
  }
}
