package com.onthegomap.gpkg.features;

import com.onthegomap.gpkg.geo.GeometryType;
import com.onthegomap.gpkg.geo.ZmPolicy;
import java.util.List;

/**
 * What to create for a new feature table.
 *
 * @param tableName      table name
 * @param geometryColumn name of the geometry column
 * @param geometryType   declared geometry type
 * @param srsId          spatial reference system of the geometries
 * @param z              Z policy of the geometry column
 * @param m              M policy of the geometry column
 * @param columns        user columns besides {@code id} and the geometry column
 * @param identifier     {@code gpkg_contents} identifier, defaults to the table name
 * @param description    {@code gpkg_contents} description
 * @param spatialIndex   whether to create a spatial index right away
 */
public record FeatureTableConfig(
  String tableName,
  String geometryColumn,
  GeometryType geometryType,
  int srsId,
  ZmPolicy z,
  ZmPolicy m,
  List<ColumnDefinition> columns,
  String identifier,
  String description,
  boolean spatialIndex
) {

  public static final String DEFAULT_GEOMETRY_COLUMN = "geom";

  public FeatureTableConfig {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  /** Returns a 2D table with geometry column {@code geom} and no user columns. */
  public static FeatureTableConfig of(String tableName, GeometryType geometryType, int srsId) {
    return new FeatureTableConfig(tableName, DEFAULT_GEOMETRY_COLUMN, geometryType, srsId, ZmPolicy.PROHIBITED,
      ZmPolicy.PROHIBITED, List.of(), null, "", false);
  }

  public FeatureTableConfig withColumns(ColumnDefinition... newColumns) {
    return withColumns(List.of(newColumns));
  }

  public FeatureTableConfig withColumns(List<ColumnDefinition> newColumns) {
    return new FeatureTableConfig(tableName, geometryColumn, geometryType, srsId, z, m, newColumns, identifier,
      description, spatialIndex);
  }

  public FeatureTableConfig withDimensions(ZmPolicy newZ, ZmPolicy newM) {
    return new FeatureTableConfig(tableName, geometryColumn, geometryType, srsId, newZ, newM, columns, identifier,
      description, spatialIndex);
  }

  public FeatureTableConfig withGeometryColumn(String newGeometryColumn) {
    return new FeatureTableConfig(tableName, newGeometryColumn, geometryType, srsId, z, m, columns, identifier,
      description, spatialIndex);
  }

  public FeatureTableConfig withDescription(String newDescription) {
    return new FeatureTableConfig(tableName, geometryColumn, geometryType, srsId, z, m, columns, identifier,
      newDescription, spatialIndex);
  }

  public FeatureTableConfig withSpatialIndex(boolean newSpatialIndex) {
    return new FeatureTableConfig(tableName, geometryColumn, geometryType, srsId, z, m, columns, identifier,
      description, newSpatialIndex);
  }
}
