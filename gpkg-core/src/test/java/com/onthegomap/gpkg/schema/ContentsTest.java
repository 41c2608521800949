package com.onthegomap.gpkg.schema;

import static com.onthegomap.gpkg.TestUtils.newGeoPackage;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.gpkg.GeoPackage;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

class ContentsTest {

  private final GeoPackage gpkg = newGeoPackage();
  private final Contents contents = gpkg.contents();

  @AfterEach
  void close() {
    gpkg.close();
  }

  @Test
  void testAddAndGet() {
    Instant time = Instant.parse("2020-01-02T03:04:05.678Z");
    contents.add(new Content("lakes", DataType.FEATURES, "Lakes", "all lakes", time, new Envelope(1, 2, 3, 4), 4326));
    Content content = contents.get("lakes").orElseThrow();
    assertEquals(new Content("lakes", DataType.FEATURES, "Lakes", "all lakes", time, new Envelope(1, 2, 3, 4), 4326),
      content);
    assertTrue(contents.exists("lakes"));
    assertTrue(contents.get("rivers").isEmpty());
  }

  @Test
  void testDefaults() {
    contents.add(new Content("notes", DataType.ATTRIBUTES, null));
    Content content = contents.get("notes").orElseThrow();
    assertEquals("notes", content.identifier());
    assertEquals("", content.description());
    assertNull(content.bounds());
    assertNull(content.srsId());
    assertNotNull(content.lastChange());
  }

  @Test
  void testAddErrors() {
    contents.add(new Content("lakes", DataType.FEATURES, 4326));
    assertThrows(IllegalArgumentException.class, () -> contents.add(new Content("lakes", DataType.FEATURES, 4326)));
    assertThrows(IllegalArgumentException.class, () -> contents.add(new Content("other", DataType.FEATURES, 99)));
    assertThrows(IllegalArgumentException.class, () -> contents.add(new Content("bad-name", DataType.TILES, 4326)));
  }

  @Test
  void testList() {
    contents.add(new Content("b", DataType.FEATURES, 4326));
    contents.add(new Content("a", DataType.TILES, 3857));
    contents.add(new Content("c", DataType.ATTRIBUTES, null));
    assertEquals(List.of("a", "b", "c"), contents.list().stream().map(Content::tableName).toList());
    assertEquals(List.of("a"), contents.list(DataType.TILES).stream().map(Content::tableName).toList());
  }

  @Test
  void testUpdate() {
    contents.add(new Content("lakes", DataType.FEATURES, 4326));
    Content updated = contents.get("lakes").orElseThrow().withDescription("updated").withBounds(new Envelope(0, 1, 0,
      1));
    contents.update(updated);
    Content read = contents.get("lakes").orElseThrow();
    assertEquals("updated", read.description());
    assertEquals(new Envelope(0, 1, 0, 1), read.bounds());
    assertThrows(IllegalArgumentException.class, () -> contents.update(new Content("missing", DataType.FEATURES,
      4326)));
  }

  @Test
  void testUpdateBounds() {
    contents.add(new Content("lakes", DataType.FEATURES, 4326));
    contents.updateBounds("lakes", new Envelope(-1, 1, -2, 2));
    assertEquals(new Envelope(-1, 1, -2, 2), contents.get("lakes").orElseThrow().bounds());
    contents.updateBounds("lakes", new Envelope());
    assertNull(contents.get("lakes").orElseThrow().bounds());
    assertThrows(IllegalArgumentException.class, () -> contents.updateBounds("missing", null));
  }

  @Test
  void testTouchMovesLastChangeForward() {
    contents.add(new Content("lakes", DataType.FEATURES, "lakes", "", Instant.parse("2000-01-01T00:00:00Z"), null,
      4326));
    contents.touch("lakes");
    assertTrue(contents.get("lakes").orElseThrow().lastChange().isAfter(Instant.parse("2000-01-01T00:00:00Z")));
  }

  @Test
  void testDelete() {
    contents.add(new Content("lakes", DataType.FEATURES, 4326));
    contents.delete("lakes");
    assertFalse(contents.exists("lakes"));
    assertThrows(IllegalArgumentException.class, () -> contents.delete("lakes"));
  }
}
