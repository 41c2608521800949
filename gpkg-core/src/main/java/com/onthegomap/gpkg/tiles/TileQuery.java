package com.onthegomap.gpkg.tiles;

/**
 * Which tiles {@link TileStore#queryTiles(String, TileQuery)} returns, every field is an inclusive bound or null for
 * no limit.
 */
public record TileQuery(Integer zoom, Integer minColumn, Integer maxColumn, Integer minRow, Integer maxRow) {

  public static TileQuery all() {
    return new TileQuery(null, null, null, null, null);
  }

  public static TileQuery zoom(int zoom) {
    return new TileQuery(zoom, null, null, null, null);
  }

  public TileQuery withColumns(Integer min, Integer max) {
    return new TileQuery(zoom, min, max, minRow, maxRow);
  }

  public TileQuery withRows(Integer min, Integer max) {
    return new TileQuery(zoom, minColumn, maxColumn, min, max);
  }
}
