package com.onthegomap.gpkg.index;

import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import com.onthegomap.gpkg.geo.GeoUtils;
import com.onthegomap.gpkg.schema.Extension;
import com.onthegomap.gpkg.schema.Extensions;
import com.onthegomap.gpkg.schema.GeometryColumn;
import com.onthegomap.gpkg.schema.GeometryColumns;
import com.onthegomap.gpkg.wkb.EnvelopeExtractor;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains an R-tree of feature bounding boxes for feature tables.
 * <p>
 * Nothing updates the index automatically: whoever mutates a feature table has to call
 * {@link #insertEntry(String, long, byte[])}, {@link #updateEntry(String, long, byte[])} or
 * {@link #deleteEntry(String, long)} right after each change, in the same transaction and in the same order as the
 * changes. These calls do nothing for tables without an index. If they are ever skipped, {@link #rebuildIndex(String)}
 * repopulates the index from the table.
 * <p>
 * Features whose geometry is null or has no extractable envelope get no entry, so {@link #query(String, Envelope)}
 * never returns them.
 */
public class SpatialIndex {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpatialIndex.class);

  public static final String EXTENSION_DEFINITION = "http://www.geopackage.org/spec120/#extension_rtree";

  private final Sqlite db;
  private final GeometryColumns geometryColumns;
  private final Extensions extensions;
  private final BoundsIndex boundsIndex;
  private final EnvelopeExtractor envelopeExtractor;

  public SpatialIndex(Sqlite db, GeometryColumns geometryColumns, Extensions extensions, BoundsIndex boundsIndex,
    EnvelopeExtractor envelopeExtractor) {
    this.db = db;
    this.geometryColumns = geometryColumns;
    this.extensions = extensions;
    this.boundsIndex = boundsIndex;
    this.envelopeExtractor = envelopeExtractor;
  }

  /** Returns the name of the R-tree table for a feature table's geometry column. */
  public static String indexName(String tableName, String geometryColumn) {
    return "rtree_" + tableName + "_" + geometryColumn;
  }

  /** Returns true if {@code tableName} is a feature table with a spatial index. */
  public boolean hasIndex(String tableName) {
    return indexName(tableName).map(boundsIndex::exists).orElse(false);
  }

  /**
   * Creates the index for a feature table and fills it from the existing rows.
   *
   * @throws SpatialIndexException if the table has no geometry column or already has an index
   */
  public void createIndex(String tableName) {
    GeometryColumn column = requireGeometryColumn(tableName);
    String name = indexName(tableName, column.columnName());
    if (boundsIndex.exists(name)) {
      throw new SpatialIndexException("Spatial index already exists for table " + tableName);
    }
    db.runInTransaction(() -> {
      boundsIndex.create(name);
      extensions.registerIfAbsent(new Extension(tableName, column.columnName(), Extensions.RTREE_INDEX,
        EXTENSION_DEFINITION, Extension.Scope.WRITE_ONLY));
      populate(column, name);
    });
    LOGGER.info("Created spatial index {} with {} entries", name, boundsIndex.count(name));
  }

  /**
   * Removes the index of a feature table and its extension registration.
   *
   * @throws SpatialIndexException if the table has no index
   */
  public void dropIndex(String tableName) {
    GeometryColumn column = requireIndex(tableName);
    String name = indexName(tableName, column.columnName());
    db.runInTransaction(() -> {
      boundsIndex.drop(name);
      if (extensions.exists(Extensions.RTREE_INDEX, tableName, column.columnName())) {
        extensions.delete(Extensions.RTREE_INDEX, tableName, column.columnName());
      }
    });
    LOGGER.info("Dropped spatial index {}", name);
  }

  /**
   * Removes every entry from the index of a feature table and adds them back from the current rows.
   *
   * @throws SpatialIndexException if the table has no index
   */
  public void rebuildIndex(String tableName) {
    GeometryColumn column = requireIndex(tableName);
    String name = indexName(tableName, column.columnName());
    db.runInTransaction(() -> populate(column, name));
    LOGGER.info("Rebuilt spatial index {} with {} entries", name, boundsIndex.count(name));
  }

  private void populate(GeometryColumn column, String name) {
    boundsIndex.clear(name);
    String geometry = SqlNames.quote(column.columnName());
    String sql = "SELECT id, %s FROM %s WHERE %s IS NOT NULL".formatted(geometry,
      SqlNames.quote(column.tableName()), geometry);
    try (var rows = db.iterate(sql, rs -> new Row(rs.getLong(1), rs.getBytes(2)))) {
      while (rows.hasNext()) {
        Row row = rows.next();
        insert(name, row.id, row.geometry);
      }
    }
  }

  private record Row(long id, byte[] geometry) {}

  /**
   * Adds the bounding box of a newly inserted feature. Does nothing if the table has no index, {@code geometry} is
   * null, or it has no envelope.
   *
   * @throws com.onthegomap.gpkg.wkb.GeometryFormatException if {@code geometry} is not a valid geometry blob
   */
  public void insertEntry(String tableName, long id, byte[] geometry) {
    Optional<String> name = existingIndexName(tableName);
    if (name.isPresent() && geometry != null) {
      insert(name.get(), id, geometry);
    }
  }

  /**
   * Replaces the bounding box of a feature whose geometry changed. A null or envelope-less {@code geometry} removes
   * the feature from the index. Does nothing if the table has no index.
   *
   * @throws com.onthegomap.gpkg.wkb.GeometryFormatException if {@code geometry} is not a valid geometry blob
   */
  public void updateEntry(String tableName, long id, byte[] geometry) {
    Optional<String> name = existingIndexName(tableName);
    if (name.isPresent()) {
      Optional<Envelope> envelope = envelopeExtractor.extract(geometry);
      boundsIndex.delete(name.get(), id);
      envelope.ifPresent(bounds -> boundsIndex.insert(name.get(), id, bounds));
    }
  }

  /** Removes a deleted feature from the index. Does nothing if the table has no index. */
  public void deleteEntry(String tableName, long id) {
    existingIndexName(tableName).ifPresent(name -> boundsIndex.delete(name, id));
  }

  /**
   * Returns the ids of every indexed feature whose bounding box overlaps {@code bounds}. This is a superset of the
   * features whose geometry actually intersects {@code bounds}.
   * <p>
   * The backing index may store boxes rounded outward, so each candidate is checked again against the envelope of its
   * current geometry blob. The result is the same as computing every envelope with a full scan.
   *
   * @throws SpatialIndexException if the table has no index
   */
  public Set<Long> query(String tableName, Envelope bounds) {
    GeometryColumn column = requireIndex(tableName);
    Set<Long> candidates = boundsIndex.query(indexName(tableName, column.columnName()), bounds);
    String sql = "SELECT %s FROM %s WHERE id = ?".formatted(SqlNames.quote(column.columnName()),
      SqlNames.quote(tableName));
    Set<Long> result = new LinkedHashSet<>();
    for (long id : candidates) {
      Optional<byte[]> geometry = db.queryFirst(sql, rs -> rs.getBytes(1), id);
      if (geometry.flatMap(envelopeExtractor::extract).map(envelope -> GeoUtils.overlaps(envelope, bounds))
        .orElse(false)) {
        result.add(id);
      }
    }
    return result;
  }

  private void insert(String name, long id, byte[] geometry) {
    Optional<Envelope> envelope = envelopeExtractor.extract(geometry);
    if (envelope.isPresent()) {
      boundsIndex.insert(name, id, envelope.get());
    } else {
      LOGGER.debug("No envelope for feature {} in {}, leaving it out of the index", id, name);
    }
  }

  private Optional<String> indexName(String tableName) {
    return geometryColumns.get(tableName).map(column -> indexName(tableName, column.columnName()));
  }

  private Optional<String> existingIndexName(String tableName) {
    return indexName(tableName).filter(boundsIndex::exists);
  }

  private GeometryColumn requireGeometryColumn(String tableName) {
    return geometryColumns.get(tableName)
      .orElseThrow(() -> new SpatialIndexException("Table " + tableName + " is not a feature table"));
  }

  private GeometryColumn requireIndex(String tableName) {
    GeometryColumn column = requireGeometryColumn(tableName);
    if (!boundsIndex.exists(indexName(tableName, column.columnName()))) {
      throw new SpatialIndexException("Spatial index does not exist for table " + tableName);
    }
    return column;
  }
}
