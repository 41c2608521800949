package com.onthegomap.gpkg.config;

import com.onthegomap.gpkg.wkb.EnvelopeType;

/**
 * Settings that control how a geopackage is opened and written.
 *
 * @param envelope      envelope embedded in the header of every geometry the feature store writes
 * @param spatialIndex  whether new feature tables get a spatial index right away
 * @param validateTiles whether tile data must start with PNG, JPEG or WEBP magic bytes
 * @param tileBatchSize how many tiles a batched tile writer inserts per statement
 * @param readOnly      whether to open the file read-only
 * @param arguments     where the other settings came from, also read for sqlite pragmas like {@code busy_timeout}
 *                      or {@code journal_mode}
 */
public record GeoPackageConfig(
  EnvelopeType envelope,
  boolean spatialIndex,
  boolean validateTiles,
  int tileBatchSize,
  boolean readOnly,
  Arguments arguments
) {

  public GeoPackageConfig {
    if (tileBatchSize < 1) {
      throw new IllegalArgumentException("tile_batch_size must be at least 1, got " + tileBatchSize);
    }
  }

  public static GeoPackageConfig defaults() {
    return from(Arguments.of());
  }

  public static GeoPackageConfig from(Arguments arguments) {
    return new GeoPackageConfig(
      EnvelopeType.fromName(arguments.getString("envelope",
        "envelope to store in geometry headers: none, xy, xyz, xym or xyzm", "xy")),
      arguments.getBoolean("spatial_index", "create a spatial index for every new feature table", false),
      arguments.getBoolean("validate_tiles", "reject tile data that is not PNG, JPEG or WEBP", true),
      arguments.getInteger("tile_batch_size", "number of tiles to insert per batched statement", 200),
      arguments.getBoolean("read_only", "open the geopackage read-only", false),
      arguments
    );
  }
}
