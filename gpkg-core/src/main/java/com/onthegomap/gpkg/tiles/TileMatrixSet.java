package com.onthegomap.gpkg.tiles;

import org.locationtech.jts.geom.Envelope;

/**
 * A row of {@code gpkg_tile_matrix_set}: the extent every zoom level of a tile pyramid covers.
 *
 * @param tableName name of the tile pyramid table
 * @param srsId     spatial reference system of {@code bounds}
 * @param bounds    extent of the full pyramid
 */
public record TileMatrixSet(String tableName, int srsId, Envelope bounds) {

  public TileMatrixSet {
    if (bounds == null || bounds.isNull() || bounds.getWidth() <= 0 || bounds.getHeight() <= 0) {
      throw new IllegalArgumentException("Tile matrix set " + tableName + " needs a non-empty extent, got " + bounds);
    }
  }
}
