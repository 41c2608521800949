package com.onthegomap.gpkg;

import com.onthegomap.gpkg.attributes.AttributeStore;
import com.onthegomap.gpkg.config.Arguments;
import com.onthegomap.gpkg.config.GeoPackageConfig;
import com.onthegomap.gpkg.db.Sqlite;
import com.onthegomap.gpkg.features.FeatureStore;
import com.onthegomap.gpkg.geo.TypeValidator;
import com.onthegomap.gpkg.geojson.GeoJsonConverter;
import com.onthegomap.gpkg.index.SpatialIndex;
import com.onthegomap.gpkg.index.SqliteRTreeIndex;
import com.onthegomap.gpkg.schema.Contents;
import com.onthegomap.gpkg.schema.DataColumns;
import com.onthegomap.gpkg.schema.Extensions;
import com.onthegomap.gpkg.schema.GeometryColumns;
import com.onthegomap.gpkg.schema.SpatialReferenceSystems;
import com.onthegomap.gpkg.tiles.TileStore;
import com.onthegomap.gpkg.wkb.EnvelopeExtractor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * An open GeoPackage: a sqlite database holding feature, tile and attribute tables along with the metadata tables
 * that describe them.
 * <p>
 * Each instance owns one connection and is not thread-safe. Close it when done.
 */
public class GeoPackage implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeoPackage.class);

  /** {@code "GPKG"} as a big-endian 32-bit integer. */
  public static final int APPLICATION_ID = 0x47504B47;
  public static final int USER_VERSION = 10200;
  private static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5_000;

  private final Sqlite db;
  private final Path path;
  private final GeoPackageConfig config;
  private final SpatialReferenceSystems srs;
  private final Contents contents;
  private final GeometryColumns geometryColumns;
  private final Extensions extensions;
  private final DataColumns dataColumns;
  private final SpatialIndex spatialIndex;
  private final FeatureStore features;
  private final TileStore tiles;
  private final AttributeStore attributes;
  private final GeoJsonConverter geoJson;
  private boolean closed = false;

  private GeoPackage(Sqlite db, Path path, GeoPackageConfig config) {
    this.db = db;
    this.path = path;
    this.config = config;
    this.srs = new SpatialReferenceSystems(db);
    this.contents = new Contents(db, srs);
    this.geometryColumns = new GeometryColumns(db);
    this.extensions = new Extensions(db);
    this.dataColumns = new DataColumns(db, contents, extensions);
    EnvelopeExtractor envelopeExtractor = new EnvelopeExtractor();
    this.spatialIndex = new SpatialIndex(db, geometryColumns, extensions, new SqliteRTreeIndex(db),
      envelopeExtractor);
    this.features = new FeatureStore(db, config, srs, contents, geometryColumns, extensions, dataColumns,
      spatialIndex, new TypeValidator(), envelopeExtractor);
    this.tiles = new TileStore(db, config, srs, contents, extensions);
    this.attributes = new AttributeStore(db, contents, extensions, dataColumns);
    this.geoJson = new GeoJsonConverter(db, features, contents, srs);
  }

  /** Returns a geopackage that only lives in memory, mostly useful for tests. */
  public static GeoPackage newInMemory(Arguments arguments) {
    GeoPackageConfig config = GeoPackageConfig.from(arguments);
    GeoPackage result = new GeoPackage(Sqlite.newInMemoryDatabase(sqliteConfig(config), arguments), null, config);
    result.initialize(true);
    return result;
  }

  /**
   * Creates a new geopackage file.
   *
   * @throws IllegalArgumentException if {@code path} already exists
   */
  public static GeoPackage create(Path path, Arguments arguments) {
    if (Files.exists(path)) {
      throw new IllegalArgumentException(path + " already exists");
    }
    GeoPackageConfig config = GeoPackageConfig.from(arguments);
    if (config.readOnly()) {
      throw new IllegalArgumentException("Cannot create " + path + " read-only");
    }
    GeoPackage result = new GeoPackage(Sqlite.newFileDatabase(path, sqliteConfig(config), arguments), path, config);
    result.initialize(true);
    LOGGER.info("Created geopackage {}", path);
    return result;
  }

  /**
   * Opens an existing geopackage file, read-only when {@code read_only} is set. Metadata tables that are missing from
   * a writable file get created.
   *
   * @throws IllegalArgumentException if {@code path} does not exist
   */
  public static GeoPackage open(Path path, Arguments arguments) {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(path + " does not exist");
    }
    GeoPackageConfig config = GeoPackageConfig.from(arguments);
    GeoPackage result = new GeoPackage(Sqlite.newFileDatabase(path, sqliteConfig(config), arguments), path, config);
    if (!config.readOnly()) {
      result.initialize(false);
    }
    if (result.applicationId() != APPLICATION_ID) {
      LOGGER.warn("{} has application_id {}, expected {}", path, Integer.toHexString(result.applicationId()),
        Integer.toHexString(APPLICATION_ID));
    }
    LOGGER.info("Opened geopackage {}{}", path, config.readOnly() ? " read-only" : "");
    return result;
  }

  /** Opens an existing geopackage file that cannot be written to. */
  public static GeoPackage openReadOnly(Path path, Arguments arguments) {
    return open(path, Arguments.of("read_only", true).orElse(arguments));
  }

  private static SQLiteConfig sqliteConfig(GeoPackageConfig config) {
    SQLiteConfig sqliteConfig = new SQLiteConfig();
    sqliteConfig.setReadOnly(config.readOnly());
    sqliteConfig.setBusyTimeout(DEFAULT_BUSY_TIMEOUT_MILLIS);
    sqliteConfig.enforceForeignKeys(true);
    return sqliteConfig;
  }

  private void initialize(boolean created) {
    db.runInTransaction(() -> {
      if (created) {
        db.execute("PRAGMA application_id = " + APPLICATION_ID, "PRAGMA user_version = " + USER_VERSION);
      }
      srs.createTable();
      contents.createTable();
      geometryColumns.createTable();
      tiles.createTables();
      extensions.createTable();
    });
  }

  public int applicationId() {
    return (int) db.queryLong("PRAGMA application_id");
  }

  public int userVersion() {
    return (int) db.queryLong("PRAGMA user_version");
  }

  /** Returns the file this geopackage is stored in, or empty for an in-memory one. */
  public Optional<Path> path() {
    return Optional.ofNullable(path);
  }

  public GeoPackageConfig config() {
    return config;
  }

  public SpatialReferenceSystems srs() {
    return srs;
  }

  public Contents contents() {
    return contents;
  }

  public GeometryColumns geometryColumns() {
    return geometryColumns;
  }

  public Extensions extensions() {
    return extensions;
  }

  public DataColumns dataColumns() {
    return dataColumns;
  }

  public SpatialIndex spatialIndex() {
    return spatialIndex;
  }

  public FeatureStore features() {
    return features;
  }

  public TileStore tiles() {
    return tiles;
  }

  public AttributeStore attributes() {
    return attributes;
  }

  public GeoJsonConverter geoJson() {
    return geoJson;
  }

  /** Returns the underlying database for queries this class does not cover. */
  public Sqlite db() {
    return db;
  }

  /** Runs {@code work} in one transaction that rolls back everything it did if it throws. */
  public <T> T inTransaction(Supplier<T> work) {
    return db.inTransaction(work);
  }

  public void runInTransaction(Runnable work) {
    db.runInTransaction(work);
  }

  /** Rebuilds the database file to reclaim unused space. */
  public void vacuum() {
    if (db.inTransaction()) {
      throw new IllegalStateException("Cannot vacuum inside a transaction");
    }
    db.execute("VACUUM");
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      db.close();
      LOGGER.debug("Closed geopackage {}", path == null ? "in memory" : path);
    }
  }
}
