package com.onthegomap.gpkg.geojson;

/**
 * What to add to an exported feature collection besides the features.
 *
 * @param includeCrs  add a named {@code crs} member for the table's srs
 * @param includeBbox add a {@code bbox} member from the contents bounds, computed from the features when unset
 */
public record ExportOptions(boolean includeCrs, boolean includeBbox) {

  public static ExportOptions defaults() {
    return new ExportOptions(false, false);
  }
}
