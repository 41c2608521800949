package com.onthegomap.gpkg.features;

import static com.onthegomap.gpkg.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.gpkg.GeoPackage;
import com.onthegomap.gpkg.db.CloseableIterator;
import com.onthegomap.gpkg.geo.GeoUtils;
import com.onthegomap.gpkg.geo.GeometryException;
import com.onthegomap.gpkg.geo.GeometryType;
import com.onthegomap.gpkg.geo.ZmPolicy;
import com.onthegomap.gpkg.schema.Content;
import com.onthegomap.gpkg.schema.DataColumn;
import com.onthegomap.gpkg.schema.DataType;
import com.onthegomap.gpkg.schema.GeometryColumn;
import com.onthegomap.gpkg.wkb.GeometryCodec;
import com.onthegomap.gpkg.wkb.GeometryHeader;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

class FeatureStoreTest {

  private final GeoPackage gpkg = newGeoPackage();
  private final FeatureStore features = gpkg.features();

  @AfterEach
  void close() {
    gpkg.close();
  }

  private void createRoads() {
    features.createFeatureTable(FeatureTableConfig.of("roads", GeometryType.LINESTRING, 4326)
      .withDescription("main roads")
      .withColumns(
        ColumnDefinition.of("name", "TEXT").withNotNull(),
        ColumnDefinition.of("lanes", "INTEGER").withDefault(2),
        ColumnDefinition.of("speed", "REAL"),
        ColumnDefinition.of("paved", "BOOLEAN")
      ));
  }

  @Test
  void testCreateTableRegistersMetadata() {
    createRoads();
    assertTrue(features.isFeatureTable("roads"));
    assertFalse(features.isFeatureTable("gpkg_contents"));
    assertEquals(List.of("name", "lanes", "speed", "paved"), features.propertyColumns("roads"));

    GeometryColumn column = features.getGeometryColumn("roads");
    assertEquals(new GeometryColumn("roads", "geom", GeometryType.LINESTRING, 4326, ZmPolicy.PROHIBITED,
      ZmPolicy.PROHIBITED), column);

    Content content = gpkg.contents().get("roads").orElseThrow();
    assertEquals(DataType.FEATURES, content.dataType());
    assertEquals("roads", content.identifier());
    assertEquals("main roads", content.description());
    assertEquals(Integer.valueOf(4326), content.srsId());
    assertNotNull(content.lastChange());
  }

  @Test
  void testCreateTableErrors() {
    createRoads();
    assertThrows(IllegalArgumentException.class,
      () -> features.createFeatureTable(FeatureTableConfig.of("roads", GeometryType.POINT, 4326)));
    assertThrows(IllegalArgumentException.class,
      () -> features.createFeatureTable(FeatureTableConfig.of("gpkg_contents", GeometryType.POINT, 4326)));
    assertThrows(IllegalArgumentException.class,
      () -> features.createFeatureTable(FeatureTableConfig.of("bad name", GeometryType.POINT, 4326)));
    assertThrows(IllegalArgumentException.class,
      () -> features.createFeatureTable(FeatureTableConfig.of("other", GeometryType.POINT, 999_999)));
    assertThrows(IllegalArgumentException.class,
      () -> features.createFeatureTable(FeatureTableConfig.of("other", GeometryType.POINT, 4326)
        .withColumns(ColumnDefinition.of("geom", "TEXT"))));
    assertThrows(IllegalArgumentException.class, () -> ColumnDefinition.of("x", "TEXT; DROP TABLE roads"));
    assertFalse(gpkg.contents().exists("other"));
  }

  @Test
  void testInsertAndGet() throws GeometryException {
    createRoads();
    long id = features.insert("roads", newLineString(0, 0, 1, 1), Map.of("name", "Main St", "paved", true));
    Feature feature = features.get("roads", id).orElseThrow();
    assertEquals(id, feature.id());
    assertTrue(newLineString(0, 0, 1, 1).equalsExact(feature.geometry()));
    assertEquals("Main St", feature.getProperty("name"));
    assertEquals(2L, feature.getProperty("lanes"));
    assertNull(feature.getProperty("speed"));
    assertEquals(1L, feature.getProperty("paved"));
    assertEquals(Optional.empty(), features.get("roads", id + 100));
    assertEquals(1, features.count("roads"));
  }

  @Test
  void testGeometryIsStoredWithHeaderAndColumnSrs() throws GeometryException {
    createRoads();
    long id = features.insert("roads", newLineString(0, 0, 1, 1), Map.of("name", "a"));
    byte[] blob;
    try (var rows = gpkgRows("SELECT geom FROM roads WHERE id = " + id)) {
      blob = rows.next();
    }
    GeometryHeader header = GeometryHeader.read(ByteBuffer.wrap(blob));
    assertEquals(4326, header.srsId());
    assertEquals(gpkg.config().envelope(), header.envelopeType());
    assertEquals(4326, GeometryCodec.decode(blob).srsId());
  }

  private CloseableIterator<byte[]> gpkgRows(String sql) {
    return gpkg.db().iterate(sql, rs -> rs.getBytes(1));
  }

  @Test
  void testNullGeometryIsSqlNull() throws GeometryException {
    createRoads();
    long id = features.insert("roads", null, Map.of("name", "unknown"));
    assertNull(features.get("roads", id).orElseThrow().geometry());
    assertEquals(0, gpkg.db().queryLong("SELECT count(*) FROM roads WHERE geom IS NOT NULL"));
  }

  @Test
  void testInvalidGeometryWritesNothing() {
    createRoads();
    assertThrows(GeometryException.TypeMismatch.class,
      () -> features.insert("roads", newPoint(1, 1), Map.of("name", "x")));
    assertThrows(GeometryException.Dimension.class,
      () -> features.insert("roads", newLineString(List.of(
        GeoUtils.coordinate(0, 0, 1),
        GeoUtils.coordinate(1, 1, 1))), Map.of("name", "x")));
    assertThrows(IllegalArgumentException.class,
      () -> features.insert("roads", newLineString(0, 0, 1, 1), Map.of("nope", 1)));
    assertThrows(IllegalArgumentException.class,
      () -> features.insert("not_a_table", newLineString(0, 0, 1, 1), Map.of()));
    assertEquals(0, features.count("roads"));
  }

  @Test
  void testUpdate() throws GeometryException {
    createRoads();
    long id = features.insert("roads", newLineString(0, 0, 1, 1), Map.of("name", "Main St", "lanes", 4));
    features.update("roads", new Feature(id, newLineString(5, 5, 6, 6), Map.of("name", "Broadway")));
    Feature updated = features.get("roads", id).orElseThrow();
    assertTrue(newLineString(5, 5, 6, 6).equalsExact(updated.geometry()));
    assertEquals("Broadway", updated.getProperty("name"));
    assertEquals(4L, updated.getProperty("lanes"));

    features.updateProperties("roads", id, Map.of("speed", 35.5));
    assertEquals(35.5, features.get("roads", id).orElseThrow().getProperty("speed"));

    assertThrows(IllegalArgumentException.class,
      () -> features.update("roads", new Feature(id + 1, newLineString(0, 0, 1, 1), Map.of())));
    assertThrows(IllegalArgumentException.class,
      () -> features.updateProperties("roads", id + 1, Map.of("speed", 1)));
  }

  @Test
  void testDelete() throws GeometryException {
    createRoads();
    long id = features.insert("roads", newLineString(0, 0, 1, 1), Map.of("name", "a"));
    assertTrue(features.delete("roads", id));
    assertFalse(features.delete("roads", id));
    assertEquals(0, features.count("roads"));
  }

  @Test
  void testQuery() throws GeometryException {
    createRoads();
    for (int i = 0; i < 10; i++) {
      features.insert("roads", newLineString(i, i, i + 1, i + 1), Map.of("name", "road " + i, "lanes", i % 3));
    }
    assertEquals(10, features.query("roads", FeatureQuery.all()).size());
    assertEquals(List.of("road 2", "road 5", "road 8"), names(FeatureQuery.all().withWhere("lanes = ?", 2)));
    assertEquals(List.of("road 9", "road 8"), names(FeatureQuery.all().withOrderBy("name DESC").withLimit(2)));
    assertEquals(List.of("road 3", "road 4"), names(FeatureQuery.all().withLimit(2).withOffset(3)));
    assertEquals(List.of("road 3", "road 4", "road 5"), names(FeatureQuery.intersecting(new Envelope(3.5, 5, 3.5,
      5.5))));
    assertEquals(List.of("road 4", "road 5"), names(FeatureQuery.intersecting(new Envelope(3.5, 5, 3.5, 5.5))
      .withOffset(1)));
    assertEquals(List.of("road 5"), names(FeatureQuery.intersecting(new Envelope(0, 100, 0, 100))
      .withWhere("lanes = ?", 2).withLimit(1).withOffset(1)));
    assertThrows(IllegalArgumentException.class, () -> FeatureQuery.all().withOrderBy("name; DROP TABLE roads"));
    assertThrows(IllegalArgumentException.class, () -> FeatureQuery.all().withLimit(-1));
  }

  @Test
  void testQueryWithAndWithoutIndexAgree() throws GeometryException {
    createRoads();
    features.insert("roads", newLineString(0, 0, 10, 10), Map.of("name", "a"));
    features.insert("roads", newLineString(20, 20, 30, 30), Map.of("name", "b"));
    features.insert("roads", null, Map.of("name", "c"));
    Envelope bounds = new Envelope(10, 20, 10, 20);
    List<String> scanned = names(FeatureQuery.intersecting(bounds));
    gpkg.spatialIndex().createIndex("roads");
    assertEquals(List.of("a", "b"), scanned);
    assertEquals(scanned, names(FeatureQuery.intersecting(bounds)));
  }

  private List<String> names(FeatureQuery query) {
    return features.query("roads", query).stream().map(f -> (String) f.getProperty("name")).toList();
  }

  @Test
  void testBounds() throws GeometryException {
    createRoads();
    assertEquals(Optional.empty(), features.calculateBounds("roads"));
    features.insert("roads", newLineString(0, 0, 1, 1), Map.of("name", "a"));
    features.insert("roads", newLineString(-5, 3, 2, 8), Map.of("name", "b"));
    features.insert("roads", null, Map.of("name", "c"));
    Envelope expected = new Envelope(-5, 2, 0, 8);
    assertEquals(Optional.of(expected), features.calculateBounds("roads"));
    assertEquals(Optional.of(expected), features.updateContentsBounds("roads"));
    assertEquals(expected, gpkg.contents().get("roads").orElseThrow().bounds());
  }

  @Test
  void testSpatialIndexFromConfig() {
    try (var indexed = newGeoPackage("spatial_index", true)) {
      indexed.features().createFeatureTable(FeatureTableConfig.of("points", GeometryType.POINT, 4326));
      assertTrue(indexed.spatialIndex().hasIndex("points"));
    }
    features.createFeatureTable(FeatureTableConfig.of("points", GeometryType.POINT, 4326).withSpatialIndex(true));
    assertTrue(gpkg.spatialIndex().hasIndex("points"));
  }

  @Test
  void testDeleteTableRemovesEverything() throws GeometryException {
    createRoads();
    gpkg.spatialIndex().createIndex("roads");
    gpkg.dataColumns().add(new DataColumn("roads", "name", "Road name", null));
    features.insert("roads", newLineString(0, 0, 1, 1), Map.of("name", "a"));

    features.deleteTable("roads");
    assertFalse(features.isFeatureTable("roads"));
    assertFalse(gpkg.contents().exists("roads"));
    assertEquals(List.of(), gpkg.extensions().listForTable("roads"));
    assertEquals(List.of(), gpkg.dataColumns().list("roads"));
    assertFalse(gpkg.db().tableExists("roads"));
    assertFalse(gpkg.db().tableExists("rtree_roads_geom"));
    assertThrows(IllegalArgumentException.class, () -> features.deleteTable("roads"));
  }

  @Test
  void testIterate() throws GeometryException {
    createRoads();
    features.insert("roads", newLineString(0, 0, 1, 1), Map.of("name", "a"));
    features.insert("roads", newLineString(0, 0, 1, 1), Map.of("name", "b"));
    List<String> names = new ArrayList<>();
    try (var iterator = features.iterate("roads")) {
      while (iterator.hasNext()) {
        names.add((String) iterator.next().getProperty("name"));
      }
    }
    assertEquals(List.of("a", "b"), names);
  }
}
