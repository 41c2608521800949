package com.onthegomap.gpkg.geo;

import static com.onthegomap.gpkg.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class GeometryTypeTest {

  @ParameterizedTest
  @EnumSource(GeometryType.class)
  void testCodeAndNameRoundTrip(GeometryType type) {
    assertEquals(type, GeometryType.fromCode(type.code()));
    assertEquals(type, GeometryType.fromName(type.typeName().toLowerCase()));
    assertTrue(type.accepts(type));
    assertTrue(GeometryType.GEOMETRY.accepts(type));
  }

  @Test
  void testCodes() {
    assertEquals(0, GeometryType.GEOMETRY.code());
    assertEquals(1, GeometryType.POINT.code());
    assertEquals(7, GeometryType.GEOMETRYCOLLECTION.code());
    assertEquals(14, GeometryType.SURFACE.code());
    assertThrows(IllegalArgumentException.class, () -> GeometryType.fromCode(15));
    assertThrows(IllegalArgumentException.class, () -> GeometryType.fromName("triangle"));
  }

  @Test
  void testValueOfGeometry() {
    assertEquals(GeometryType.POINT, GeometryType.valueOf(newPoint(0, 0)));
    assertEquals(GeometryType.MULTIPOINT, GeometryType.valueOf(newMultiPoint(newPoint(0, 0))));
    assertEquals(GeometryType.MULTILINESTRING, GeometryType.valueOf(newMultiLineString(newLineString(0, 0, 1, 1))));
    assertEquals(GeometryType.MULTIPOLYGON, GeometryType.valueOf(newMultiPolygon(rectangle(0, 0, 1, 1))));
    assertEquals(GeometryType.GEOMETRYCOLLECTION, GeometryType.valueOf(newGeometryCollection(newPoint(0, 0))));
    assertEquals("MultiPolygon", GeometryType.MULTIPOLYGON.geoJsonName());
    assertThrows(IllegalArgumentException.class, GeometryType.CURVE::geoJsonName);
  }

  @Test
  void testEncodable() {
    assertTrue(GeometryType.POINT.isEncodable());
    assertTrue(GeometryType.GEOMETRYCOLLECTION.isEncodable());
    assertFalse(GeometryType.GEOMETRY.isEncodable());
    assertFalse(GeometryType.CIRCULARSTRING.isEncodable());
  }
}
