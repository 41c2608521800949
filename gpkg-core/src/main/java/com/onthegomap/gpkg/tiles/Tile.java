package com.onthegomap.gpkg.tiles;

/**
 * A row of a tile pyramid table.
 *
 * @param id         rowid, or null for a tile that has not been stored yet
 * @param zoomLevel  zoom level
 * @param tileColumn column from the left edge
 * @param tileRow    row from the top edge
 * @param tileData   encoded image
 */
public record Tile(Long id, int zoomLevel, int tileColumn, int tileRow, byte[] tileData) {

  public static Tile of(int zoomLevel, int tileColumn, int tileRow, byte[] tileData) {
    return new Tile(null, zoomLevel, tileColumn, tileRow, tileData);
  }

  public TileFormat format() {
    return TileFormat.detect(tileData);
  }
}
