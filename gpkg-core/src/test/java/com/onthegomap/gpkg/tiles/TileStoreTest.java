package com.onthegomap.gpkg.tiles;

import static com.onthegomap.gpkg.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.gpkg.GeoPackage;
import com.onthegomap.gpkg.schema.DataType;
import com.onthegomap.gpkg.schema.Extensions;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

class TileStoreTest {

  private static final Envelope EXTENT = new Envelope(0, 8, 0, 8);

  private final GeoPackage gpkg = newGeoPackage();
  private final TileStore tiles = gpkg.tiles();

  @AfterEach
  void close() {
    gpkg.close();
  }

  private TileMatrixSet createPyramid(TileStore store, String name, int maxZoom) {
    TileMatrixSet set = new TileMatrixSet(name, 4326, EXTENT);
    store.createTileTable(set);
    for (int z = 0; z <= maxZoom; z++) {
      store.addTileMatrix(TileMatrix.quadTree(set, z, 256));
    }
    return set;
  }

  @Test
  void testCreateTileTable() {
    TileMatrixSet set = createPyramid(tiles, "imagery", 2);
    assertTrue(tiles.isTileTable("imagery"));
    assertFalse(tiles.isTileTable("missing"));
    assertEquals(set, tiles.getTileMatrixSet("imagery").orElseThrow());
    assertEquals(List.of(set), tiles.listTileMatrixSets());
    assertEquals(List.of(0, 1, 2), tiles.listTileMatrices("imagery").stream().map(TileMatrix::zoomLevel).toList());
    assertEquals(TileMatrix.quadTree(set, 1, 256), tiles.getTileMatrix("imagery", 1).orElseThrow());

    var content = gpkg.contents().get("imagery").orElseThrow();
    assertEquals(DataType.TILES, content.dataType());
    assertEquals(EXTENT, content.bounds());
    assertEquals(Integer.valueOf(4326), content.srsId());
  }

  @Test
  void testCreateTileTableErrors() {
    createPyramid(tiles, "imagery", 0);
    assertThrows(IllegalArgumentException.class,
      () -> tiles.createTileTable(new TileMatrixSet("imagery", 4326, EXTENT)));
    assertThrows(IllegalArgumentException.class,
      () -> tiles.createTileTable(new TileMatrixSet("other", 123456, EXTENT)));
    assertThrows(IllegalArgumentException.class,
      () -> tiles.addTileMatrix(TileMatrix.quadTree(new TileMatrixSet("imagery", 4326, EXTENT), 0, 256)));
    assertThrows(IllegalArgumentException.class,
      () -> tiles.addTileMatrix(TileMatrix.quadTree(new TileMatrixSet("missing", 4326, EXTENT), 0, 256)));
  }

  @Test
  void testInsertAndGetTile() {
    createPyramid(tiles, "imagery", 1);
    long id = tiles.insertTile("imagery", Tile.of(1, 1, 0, PNG));
    Tile tile = tiles.getTile("imagery", 1, 1, 0).orElseThrow();
    assertEquals(id, (long) tile.id());
    assertArrayEquals(PNG, tile.tileData());
    assertEquals(TileFormat.PNG, tile.format());
    assertTrue(tiles.getTile("imagery", 1, 0, 1).isEmpty());
  }

  @Test
  void testInsertReplacesExistingTile() {
    createPyramid(tiles, "imagery", 0);
    tiles.insertTile("imagery", Tile.of(0, 0, 0, PNG));
    tiles.insertTile("imagery", Tile.of(0, 0, 0, JPEG));
    assertEquals(1, tiles.countTiles("imagery", null));
    assertArrayEquals(JPEG, tiles.getTile("imagery", 0, 0, 0).orElseThrow().tileData());
  }

  @Test
  void testRejectsInvalidTiles() {
    createPyramid(tiles, "imagery", 1);
    assertThrows(IllegalArgumentException.class, () -> tiles.insertTile("imagery", Tile.of(-1, 0, 0, PNG)));
    assertThrows(IllegalArgumentException.class, () -> tiles.insertTile("imagery", Tile.of(31, 0, 0, PNG)));
    assertThrows(IllegalArgumentException.class, () -> tiles.insertTile("imagery", Tile.of(2, 0, 0, PNG)));
    assertThrows(IllegalArgumentException.class, () -> tiles.insertTile("imagery", Tile.of(1, 2, 0, PNG)));
    assertThrows(IllegalArgumentException.class, () -> tiles.insertTile("imagery", Tile.of(1, 0, -1, PNG)));
    assertThrows(IllegalArgumentException.class, () -> tiles.insertTile("imagery", Tile.of(0, 0, 0, new byte[0])));
    assertThrows(IllegalArgumentException.class,
      () -> tiles.insertTile("imagery", Tile.of(0, 0, 0, new byte[]{1, 2, 3})));
    assertEquals(0, tiles.countTiles("imagery", null));
  }

  @Test
  void testUnknownFormatAllowedWithoutValidation() {
    try (var lenient = newGeoPackage("validate_tiles", false)) {
      createPyramid(lenient.tiles(), "vectors", 0);
      lenient.tiles().insertTile("vectors", Tile.of(0, 0, 0, new byte[]{0x1A, 0x02}));
      assertEquals(TileFormat.UNKNOWN, lenient.tiles().getTile("vectors", 0, 0, 0).orElseThrow().format());
    }
  }

  @Test
  void testWebpRegistersExtension() {
    createPyramid(tiles, "imagery", 1);
    tiles.insertTile("imagery", Tile.of(0, 0, 0, PNG));
    assertFalse(gpkg.extensions().exists(Extensions.WEBP, "imagery", "tile_data"));
    tiles.insertTile("imagery", Tile.of(1, 0, 0, WEBP));
    tiles.insertTile("imagery", Tile.of(1, 1, 0, WEBP));
    assertTrue(gpkg.extensions().exists(Extensions.WEBP, "imagery", "tile_data"));
  }

  @Test
  void testQueryTiles() {
    createPyramid(tiles, "imagery", 2);
    tiles.insertTile("imagery", Tile.of(0, 0, 0, PNG));
    for (int x = 0; x < 4; x++) {
      for (int y = 0; y < 4; y++) {
        tiles.insertTile("imagery", Tile.of(2, x, y, PNG));
      }
    }
    assertEquals(17, tiles.queryTiles("imagery", TileQuery.all()).size());
    assertEquals(16, tiles.queryTiles("imagery", TileQuery.zoom(2)).size());
    List<Tile> window = tiles.queryTiles("imagery", TileQuery.zoom(2).withColumns(1, 2).withRows(3, null));
    assertEquals(List.of("2/1/3", "2/2/3"),
      window.stream().map(t -> t.zoomLevel() + "/" + t.tileColumn() + "/" + t.tileRow()).toList());
    assertEquals(List.of(0, 2), tiles.zoomLevels("imagery"));
    assertEquals(1, tiles.countTiles("imagery", 0));
    assertEquals(0, tiles.countTiles("imagery", 1));
  }

  @Test
  void testDeleteTile() {
    createPyramid(tiles, "imagery", 0);
    tiles.insertTile("imagery", Tile.of(0, 0, 0, PNG));
    tiles.deleteTile("imagery", 0, 0, 0);
    assertEquals(0, tiles.countTiles("imagery", null));
    assertThrows(IllegalArgumentException.class, () -> tiles.deleteTile("imagery", 0, 0, 0));
  }

  @Test
  void testDeleteTileTable() {
    createPyramid(tiles, "imagery", 1);
    tiles.insertTile("imagery", Tile.of(1, 0, 0, WEBP));
    tiles.deleteTileTable("imagery");
    assertFalse(tiles.isTileTable("imagery"));
    assertEquals(List.of(), tiles.listTileMatrices("imagery"));
    assertFalse(gpkg.contents().exists("imagery"));
    assertEquals(List.of(), gpkg.extensions().listForTable("imagery"));
    assertFalse(gpkg.db().tableExists("imagery"));
    assertThrows(IllegalArgumentException.class, () -> tiles.deleteTileTable("imagery"));
  }

  @Test
  void testTileWriterBatches() {
    try (var batched = newGeoPackage("tile_batch_size", 3)) {
      TileStore store = batched.tiles();
      createPyramid(store, "imagery", 3);
      try (var writer = store.newTileWriter("imagery")) {
        for (int x = 0; x < 7; x++) {
          writer.write(Tile.of(3, x, 0, x == 4 ? WEBP : PNG));
        }
        assertEquals(7, writer.count());
        // two full batches are stored, the last tile waits for close
        assertEquals(6, store.countTiles("imagery", 3));
      }
      assertEquals(7, store.countTiles("imagery", 3));
      assertTrue(batched.extensions().exists(Extensions.WEBP, "imagery", "tile_data"));
      assertEquals(TileFormat.WEBP, store.getTile("imagery", 3, 4, 0).orElseThrow().format());
    }
  }

  @Test
  void testTileWriterFailedLastBatch() {
    try (var batched = newGeoPackage("tile_batch_size", 3)) {
      TileStore store = batched.tiles();
      createPyramid(store, "imagery", 2);
      batched.db().execute("""
        CREATE TRIGGER reject_column_3 BEFORE INSERT ON imagery
        WHEN NEW.tile_column = 3 BEGIN SELECT RAISE(ABORT, 'rejected'); END
        """);
      var writer = store.newTileWriter("imagery");
      for (int x = 0; x < 4; x++) {
        writer.write(Tile.of(2, x, 1, PNG));
      }
      assertThrows(IllegalStateException.class, writer::close);
      assertEquals(3, store.countTiles("imagery", 2));

      store.deleteTileTable("imagery");
      assertFalse(batched.db().tableExists("imagery"));
    }
  }

  @Test
  void testTileWriterChecksTiles() {
    createPyramid(tiles, "imagery", 0);
    try (var writer = tiles.newTileWriter("imagery")) {
      assertThrows(IllegalArgumentException.class, () -> writer.write(Tile.of(0, 1, 0, PNG)));
      writer.write(Tile.of(0, 0, 0, PNG));
    }
    assertEquals(1, tiles.countTiles("imagery", null));
    assertThrows(IllegalArgumentException.class, () -> tiles.newTileWriter("missing"));
  }
}
