package com.onthegomap.gpkg.schema;

import com.onthegomap.gpkg.geo.GeometryType;
import com.onthegomap.gpkg.geo.ZmPolicy;

/**
 * A row of {@code gpkg_geometry_columns} describing the geometry column of a feature table.
 *
 * @param tableName    feature table name
 * @param columnName   name of the column holding geometry blobs
 * @param geometryType declared type that every geometry in the column must be compatible with
 * @param srsId        spatial reference system of every geometry in the column
 * @param z            whether geometries may or must have Z values
 * @param m            whether geometries may or must have M values
 */
public record GeometryColumn(
  String tableName,
  String columnName,
  GeometryType geometryType,
  int srsId,
  ZmPolicy z,
  ZmPolicy m
) {}
