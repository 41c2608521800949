package com.onthegomap.gpkg.tiles;

import com.onthegomap.gpkg.config.GeoPackageConfig;
import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import com.onthegomap.gpkg.schema.Content;
import com.onthegomap.gpkg.schema.Contents;
import com.onthegomap.gpkg.schema.DataType;
import com.onthegomap.gpkg.schema.Extension;
import com.onthegomap.gpkg.schema.Extensions;
import com.onthegomap.gpkg.schema.SpatialReferenceSystems;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates tile pyramid tables and reads and writes their tiles.
 * <p>
 * A tile can only be stored at a zoom level that has a {@link TileMatrix}, and its column and row must fall inside
 * that matrix. Storing a tile where one already exists replaces it.
 */
public class TileStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileStore.class);

  public static final String MATRIX_SET_TABLE = "gpkg_tile_matrix_set";
  public static final String MATRIX_TABLE = "gpkg_tile_matrix";
  public static final int MAX_ZOOM = 30;
  public static final String WEBP_DEFINITION = "http://www.geopackage.org/spec120/#extension_tiles_webp";

  private static final String TILE_DATA = "tile_data";
  private static final String TILE_COLUMNS = "id, zoom_level, tile_column, tile_row, tile_data";
  private static final String MATRIX_COLUMNS =
    "table_name, zoom_level, matrix_width, matrix_height, tile_width, tile_height, pixel_x_size, pixel_y_size";

  private final Sqlite db;
  private final GeoPackageConfig config;
  private final SpatialReferenceSystems srs;
  private final Contents contents;
  private final Extensions extensions;

  public TileStore(Sqlite db, GeoPackageConfig config, SpatialReferenceSystems srs, Contents contents,
    Extensions extensions) {
    this.db = db;
    this.config = config;
    this.srs = srs;
    this.contents = contents;
    this.extensions = extensions;
  }

  static void checkZoom(int zoom) {
    if (zoom < 0 || zoom > MAX_ZOOM) {
      throw new IllegalArgumentException("Invalid zoom level: " + zoom);
    }
  }

  /** Creates {@code gpkg_tile_matrix_set} and {@code gpkg_tile_matrix} if they do not exist. */
  public void createTables() {
    db.execute("""
      CREATE TABLE IF NOT EXISTS %s (
        table_name TEXT NOT NULL PRIMARY KEY,
        srs_id INTEGER NOT NULL,
        min_x DOUBLE NOT NULL,
        min_y DOUBLE NOT NULL,
        max_x DOUBLE NOT NULL,
        max_y DOUBLE NOT NULL,
        CONSTRAINT fk_gtms_table_name FOREIGN KEY (table_name) REFERENCES %s(table_name),
        CONSTRAINT fk_gtms_srs FOREIGN KEY (srs_id) REFERENCES %s(srs_id)
      )
      """.formatted(MATRIX_SET_TABLE, Contents.TABLE, SpatialReferenceSystems.TABLE), """
      CREATE TABLE IF NOT EXISTS %s (
        table_name TEXT NOT NULL,
        zoom_level INTEGER NOT NULL CHECK (zoom_level >= 0),
        matrix_width INTEGER NOT NULL CHECK (matrix_width >= 1),
        matrix_height INTEGER NOT NULL CHECK (matrix_height >= 1),
        tile_width INTEGER NOT NULL CHECK (tile_width >= 1),
        tile_height INTEGER NOT NULL CHECK (tile_height >= 1),
        pixel_x_size DOUBLE NOT NULL CHECK (pixel_x_size > 0),
        pixel_y_size DOUBLE NOT NULL CHECK (pixel_y_size > 0),
        CONSTRAINT pk_ttm PRIMARY KEY (table_name, zoom_level),
        CONSTRAINT fk_tmm_table_name FOREIGN KEY (table_name) REFERENCES %s(table_name)
      )
      """.formatted(MATRIX_TABLE, Contents.TABLE));
  }

  /**
   * Creates a tile pyramid table and registers it with its extent in {@code gpkg_contents} and
   * {@code gpkg_tile_matrix_set}.
   *
   * @throws IllegalArgumentException if the name is invalid or taken, or the srs does not exist
   */
  public void createTileTable(TileMatrixSet set) {
    String name = SqlNames.validateTable(set.tableName());
    if (!srs.exists(set.srsId())) {
      throw new IllegalArgumentException("SRS ID " + set.srsId() + " not found");
    }
    if (contents.exists(name) || db.tableExists(name)) {
      throw new IllegalArgumentException("Table " + name + " already exists");
    }
    Envelope bounds = set.bounds();
    db.runInTransaction(() -> {
      db.execute("""
        CREATE TABLE %s (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          zoom_level INTEGER NOT NULL,
          tile_column INTEGER NOT NULL,
          tile_row INTEGER NOT NULL,
          tile_data BLOB NOT NULL,
          UNIQUE (zoom_level, tile_column, tile_row)
        )
        """.formatted(SqlNames.quote(name)));
      contents.add(new Content(name, DataType.TILES, set.srsId()).withBounds(bounds));
      db.update("INSERT INTO " + MATRIX_SET_TABLE +
          " (table_name, srs_id, min_x, min_y, max_x, max_y) VALUES (?, ?, ?, ?, ?, ?)",
        name, set.srsId(), bounds.getMinX(), bounds.getMinY(), bounds.getMaxX(), bounds.getMaxY());
    });
    LOGGER.debug("Created tile table {}", name);
  }

  public Optional<TileMatrixSet> getTileMatrixSet(String tableName) {
    return db.queryFirst("SELECT table_name, srs_id, min_x, min_y, max_x, max_y FROM " + MATRIX_SET_TABLE +
      " WHERE table_name = ?", TileStore::readMatrixSet, tableName);
  }

  public List<TileMatrixSet> listTileMatrixSets() {
    return db.query("SELECT table_name, srs_id, min_x, min_y, max_x, max_y FROM " + MATRIX_SET_TABLE +
      " ORDER BY table_name", TileStore::readMatrixSet);
  }

  public boolean isTileTable(String tableName) {
    return getTileMatrixSet(tableName).isPresent();
  }

  /**
   * Defines the grid of one zoom level.
   *
   * @throws IllegalArgumentException if the table has no tile matrix set or the zoom level is already defined
   */
  public void addTileMatrix(TileMatrix matrix) {
    requireMatrixSet(matrix.tableName());
    if (getTileMatrix(matrix.tableName(), matrix.zoomLevel()).isPresent()) {
      throw new IllegalArgumentException(
        "Tile matrix for " + matrix.tableName() + " at zoom level " + matrix.zoomLevel() + " already exists");
    }
    db.update("INSERT INTO " + MATRIX_TABLE + " (" + MATRIX_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
      matrix.tableName(), matrix.zoomLevel(), matrix.matrixWidth(), matrix.matrixHeight(), matrix.tileWidth(),
      matrix.tileHeight(), matrix.pixelXSize(), matrix.pixelYSize());
  }

  public Optional<TileMatrix> getTileMatrix(String tableName, int zoom) {
    return db.queryFirst("SELECT " + MATRIX_COLUMNS + " FROM " + MATRIX_TABLE +
      " WHERE table_name = ? AND zoom_level = ?", TileStore::readMatrix, tableName, zoom);
  }

  public List<TileMatrix> listTileMatrices(String tableName) {
    return db.query("SELECT " + MATRIX_COLUMNS + " FROM " + MATRIX_TABLE +
      " WHERE table_name = ? ORDER BY zoom_level", TileStore::readMatrix, tableName);
  }

  /**
   * Stores a tile, replacing any tile at the same position, and returns its id.
   *
   * @throws IllegalArgumentException if the zoom level is out of range or has no matrix, the position is outside the
   *                                  matrix, or format validation is enabled and the data is not PNG, JPEG or WEBP
   */
  public long insertTile(String tableName, Tile tile) {
    TileFormat format = checkTile(tableName, tile);
    return db.inTransaction(() -> {
      long id = db.insert("INSERT OR REPLACE INTO " + SqlNames.quote(tableName) +
          " (zoom_level, tile_column, tile_row, tile_data) VALUES (?, ?, ?, ?)",
        tile.zoomLevel(), tile.tileColumn(), tile.tileRow(), tile.tileData());
      registerFormat(tableName, format);
      contents.touch(tableName);
      return id;
    });
  }

  private TileFormat checkTile(String tableName, Tile tile) {
    SqlNames.validateTable(tableName);
    checkZoom(tile.zoomLevel());
    TileMatrix matrix = getTileMatrix(tableName, tile.zoomLevel())
      .orElseThrow(() -> new IllegalArgumentException(
        "Tile matrix for " + tableName + " at zoom level " + tile.zoomLevel() + " not found"));
    if (!matrix.contains(tile.tileColumn(), tile.tileRow())) {
      throw new IllegalArgumentException("Tile coordinates (%d, %d) out of bounds for zoom level %d".formatted(
        tile.tileColumn(), tile.tileRow(), tile.zoomLevel()));
    }
    if (tile.tileData() == null || tile.tileData().length == 0) {
      throw new IllegalArgumentException("Tile data is empty");
    }
    return config.validateTiles() ? TileFormat.validate(tile.tileData(), TileFormat.IMAGE_FORMATS) : tile.format();
  }

  private void registerFormat(String tableName, TileFormat format) {
    if (format == TileFormat.WEBP) {
      extensions.registerIfAbsent(new Extension(tableName, TILE_DATA, Extensions.WEBP, WEBP_DEFINITION,
        Extension.Scope.READ_WRITE));
    }
  }

  public Optional<Tile> getTile(String tableName, int zoom, int column, int row) {
    return db.queryFirst("SELECT " + TILE_COLUMNS + " FROM " + SqlNames.quote(SqlNames.validateTable(tableName)) +
      " WHERE zoom_level = ? AND tile_column = ? AND tile_row = ?", TileStore::readTile, zoom, column, row);
  }

  /** Returns the tiles that match {@code query} ordered by zoom level, column and row. */
  public List<Tile> queryTiles(String tableName, TileQuery query) {
    List<String> conditions = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    addCondition(conditions, params, "zoom_level = ?", query.zoom());
    addCondition(conditions, params, "tile_column >= ?", query.minColumn());
    addCondition(conditions, params, "tile_column <= ?", query.maxColumn());
    addCondition(conditions, params, "tile_row >= ?", query.minRow());
    addCondition(conditions, params, "tile_row <= ?", query.maxRow());
    String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    return db.query("SELECT " + TILE_COLUMNS + " FROM " + SqlNames.quote(SqlNames.validateTable(tableName)) + where +
      " ORDER BY zoom_level, tile_column, tile_row", TileStore::readTile, params.toArray());
  }

  private static void addCondition(List<String> conditions, List<Object> params, String condition, Integer value) {
    if (value != null) {
      conditions.add(condition);
      params.add(value);
    }
  }

  /**
   * Removes one tile.
   *
   * @throws IllegalArgumentException if there is no tile at that position
   */
  public void deleteTile(String tableName, int zoom, int column, int row) {
    db.runInTransaction(() -> {
      int changed = db.update("DELETE FROM " + SqlNames.quote(SqlNames.validateTable(tableName)) +
        " WHERE zoom_level = ? AND tile_column = ? AND tile_row = ?", zoom, column, row);
      if (changed == 0) {
        throw new IllegalArgumentException(
          "Tile at zoom %d, column %d, row %d not found".formatted(zoom, column, row));
      }
      contents.touch(tableName);
    });
  }

  /** Returns the number of tiles at {@code zoom}, or in the whole table when {@code zoom} is null. */
  public long countTiles(String tableName, Integer zoom) {
    String table = SqlNames.quote(SqlNames.validateTable(tableName));
    return zoom == null ? db.queryLong("SELECT count(*) FROM " + table) :
      db.queryLong("SELECT count(*) FROM " + table + " WHERE zoom_level = ?", zoom);
  }

  /** Returns the zoom levels that have at least one tile in ascending order. */
  public List<Integer> zoomLevels(String tableName) {
    return db.query("SELECT DISTINCT zoom_level FROM " + SqlNames.quote(SqlNames.validateTable(tableName)) +
      " ORDER BY zoom_level", rs -> rs.getInt(1));
  }

  /** Drops a tile pyramid table along with its matrices, matrix set, extensions and contents registration. */
  public void deleteTileTable(String tableName) {
    requireMatrixSet(tableName);
    db.runInTransaction(() -> {
      db.update("DELETE FROM " + MATRIX_TABLE + " WHERE table_name = ?", tableName);
      db.update("DELETE FROM " + MATRIX_SET_TABLE + " WHERE table_name = ?", tableName);
      extensions.deleteForTable(tableName);
      contents.delete(tableName);
      db.execute("DROP TABLE " + SqlNames.quote(tableName));
    });
  }

  /**
   * Returns a writer that stores tiles in multi-row statements of up to {@code tile_batch_size} tiles. Tiles are
   * checked when they are written but only stored when a batch fills up or the writer is closed.
   */
  public TileWriter newTileWriter(String tableName) {
    requireMatrixSet(tableName);
    return new TileWriter(tableName);
  }

  private TileMatrixSet requireMatrixSet(String tableName) {
    return getTileMatrixSet(tableName)
      .orElseThrow(() -> new IllegalArgumentException("Tile matrix set " + tableName + " not found"));
  }

  private static TileMatrixSet readMatrixSet(ResultSet rs) throws SQLException {
    return new TileMatrixSet(
      rs.getString("table_name"),
      rs.getInt("srs_id"),
      new Envelope(rs.getDouble("min_x"), rs.getDouble("max_x"), rs.getDouble("min_y"), rs.getDouble("max_y"))
    );
  }

  private static TileMatrix readMatrix(ResultSet rs) throws SQLException {
    return new TileMatrix(
      rs.getString("table_name"),
      rs.getInt("zoom_level"),
      rs.getInt("matrix_width"),
      rs.getInt("matrix_height"),
      rs.getInt("tile_width"),
      rs.getInt("tile_height"),
      rs.getDouble("pixel_x_size"),
      rs.getDouble("pixel_y_size")
    );
  }

  private static Tile readTile(ResultSet rs) throws SQLException {
    return new Tile(
      rs.getLong("id"),
      rs.getInt("zoom_level"),
      rs.getInt("tile_column"),
      rs.getInt("tile_row"),
      rs.getBytes("tile_data")
    );
  }

  /** Queues tiles and inserts them in batches, must be closed to store the last partial batch. */
  public class TileWriter implements AutoCloseable {

    private static final int MAX_PARAMETERS_IN_PREPARED_STATEMENT = 999;
    private static final int PARAMS_PER_TILE = 4;

    private final String tableName;
    private final int batchLimit;
    private final List<Tile> batch;
    private PreparedStatement batchStatement;
    private boolean webp = false;
    private long count = 0;

    private TileWriter(String tableName) {
      this.tableName = tableName;
      this.batchLimit = Math.min(config.tileBatchSize(), MAX_PARAMETERS_IN_PREPARED_STATEMENT / PARAMS_PER_TILE);
      this.batch = new ArrayList<>(batchLimit);
    }

    /**
     * Checks a tile and queues it, flushing the batch when it is full.
     *
     * @throws IllegalArgumentException if the tile would be rejected by {@link #insertTile(String, Tile)}
     */
    public void write(Tile tile) {
      webp |= checkTile(tableName, tile) == TileFormat.WEBP;
      count++;
      batch.add(tile);
      if (batch.size() >= batchLimit) {
        if (batchStatement == null) {
          batchStatement = prepare(batchLimit);
        }
        flush(batchStatement);
      }
    }

    /** Returns the number of tiles written so far, including ones not flushed yet. */
    public long count() {
      return count;
    }

    private PreparedStatement prepare(int size) {
      String sql = "INSERT OR REPLACE INTO %s (zoom_level, tile_column, tile_row, tile_data) VALUES %s".formatted(
        SqlNames.quote(tableName),
        IntStream.range(0, size).mapToObj(i -> "(?, ?, ?, ?)").collect(Collectors.joining(", "))
      );
      try {
        return db.connection().prepareStatement(sql);
      } catch (SQLException throwables) {
        throw new IllegalStateException("Could not create prepared statement", throwables);
      }
    }

    private void flush(PreparedStatement statement) {
      try {
        int pos = 1;
        for (Tile tile : batch) {
          statement.setInt(pos++, tile.zoomLevel());
          statement.setInt(pos++, tile.tileColumn());
          statement.setInt(pos++, tile.tileRow());
          statement.setBytes(pos++, tile.tileData());
        }
        statement.execute();
        batch.clear();
      } catch (SQLException throwables) {
        throw new IllegalStateException("Error flushing batch of tiles to " + tableName, throwables);
      }
    }

    @Override
    public void close() {
      // closes the full-batch statement even when the last flush fails
      try (PreparedStatement fullBatch = batchStatement) {
        if (!batch.isEmpty()) {
          try (var lastBatch = prepare(batch.size())) {
            flush(lastBatch);
          }
        }
      } catch (SQLException throwables) {
        throw new IllegalStateException("Could not close tile writer for " + tableName, throwables);
      }
      if (count > 0) {
        if (webp) {
          registerFormat(tableName, TileFormat.WEBP);
        }
        contents.touch(tableName);
      }
      LOGGER.debug("Wrote {} tiles to {}", count, tableName);
    }
  }
}
