package com.onthegomap.gpkg.geojson;

import com.onthegomap.gpkg.features.FeatureTableConfig;

/**
 * Where imported features go.
 *
 * @param tableName      feature table to create, or to append to
 * @param srsId          srs of the new table, or null to detect it from the {@code crs} member and fall back to WGS84
 * @param geometryColumn geometry column of the new table
 * @param append         insert into an existing table instead of creating one
 */
public record ImportOptions(String tableName, Integer srsId, String geometryColumn, boolean append) {

  public static ImportOptions of(String tableName) {
    return new ImportOptions(tableName, null, FeatureTableConfig.DEFAULT_GEOMETRY_COLUMN, false);
  }

  public ImportOptions withSrsId(Integer newSrsId) {
    return new ImportOptions(tableName, newSrsId, geometryColumn, append);
  }

  public ImportOptions withAppend(boolean newAppend) {
    return new ImportOptions(tableName, srsId, geometryColumn, newAppend);
  }
}
