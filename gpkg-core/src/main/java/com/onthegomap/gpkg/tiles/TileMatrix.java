package com.onthegomap.gpkg.tiles;

import org.locationtech.jts.geom.Envelope;

/**
 * A row of {@code gpkg_tile_matrix}: the grid of one zoom level of a tile pyramid.
 *
 * @param tableName    name of the tile pyramid table
 * @param zoomLevel    zoom level from 0 to {@link TileStore#MAX_ZOOM}
 * @param matrixWidth  number of tile columns
 * @param matrixHeight number of tile rows
 * @param tileWidth    width of each tile in pixels
 * @param tileHeight   height of each tile in pixels
 * @param pixelXSize   width of a pixel in srs units
 * @param pixelYSize   height of a pixel in srs units
 */
public record TileMatrix(
  String tableName,
  int zoomLevel,
  int matrixWidth,
  int matrixHeight,
  int tileWidth,
  int tileHeight,
  double pixelXSize,
  double pixelYSize
) {

  public TileMatrix {
    TileStore.checkZoom(zoomLevel);
    if (matrixWidth < 1 || matrixHeight < 1 || tileWidth < 1 || tileHeight < 1) {
      throw new IllegalArgumentException("Tile matrix dimensions must be at least 1 for zoom " + zoomLevel);
    }
    if (!(pixelXSize > 0) || !(pixelYSize > 0)) {
      throw new IllegalArgumentException("Pixel sizes must be positive for zoom " + zoomLevel);
    }
  }

  /**
   * Returns a matrix of {@code 2^zoom x 2^zoom} square tiles of {@code tileSize} pixels that exactly covers the
   * extent of {@code set}.
   */
  public static TileMatrix quadTree(TileMatrixSet set, int zoom, int tileSize) {
    TileStore.checkZoom(zoom);
    int tiles = 1 << zoom;
    Envelope bounds = set.bounds();
    return new TileMatrix(set.tableName(), zoom, tiles, tiles, tileSize, tileSize,
      bounds.getWidth() / tiles / tileSize, bounds.getHeight() / tiles / tileSize);
  }

  public boolean contains(int column, int row) {
    return column >= 0 && column < matrixWidth && row >= 0 && row < matrixHeight;
  }

  /** Returns the extent of a tile, where row 0 is the top row of {@code set}. */
  public Envelope tileBounds(TileMatrixSet set, int column, int row) {
    Envelope bounds = set.bounds();
    double width = bounds.getWidth() / matrixWidth;
    double height = bounds.getHeight() / matrixHeight;
    double minX = bounds.getMinX() + column * width;
    double maxY = bounds.getMaxY() - row * height;
    return new Envelope(minX, minX + width, maxY - height, maxY);
  }
}
