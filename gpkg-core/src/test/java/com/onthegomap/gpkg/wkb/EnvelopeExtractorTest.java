package com.onthegomap.gpkg.wkb;

import static com.onthegomap.gpkg.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.gpkg.geo.GeoUtils;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

class EnvelopeExtractorTest {

  private final EnvelopeExtractor extractor = new EnvelopeExtractor();
  private final EnvelopeExtractor headerOnly = new EnvelopeExtractor(List.of(EnvelopeSource.HEADER));
  private final EnvelopeExtractor bodyOnly = new EnvelopeExtractor(List.of(EnvelopeSource.BODY));

  private static Stream<Arguments> scannable() {
    return Stream.of(
      Arguments.of(newPoint(3, 4)),
      Arguments.of(newPoint(-1, -2, 30, 40)),
      Arguments.of(newLineString(0, 5, 10, -5, 3, 2)),
      Arguments.of(newPolygon(
        rectangleCoordList(0, 0, 10, 10),
        List.of(rectangleCoordList(2, 2, 4, 4))
      )),
      Arguments.of(newMultiPoint(newPoint(1, 2, 3), newPoint(-4, 8, 1))),
      Arguments.of(newMultiLineString(newLineString(0, 0, 1, 1), newLineString(-3, 7, 4, 2))),
      Arguments.of(newMultiPolygon(rectangle(0, 0, 1, 1), rectangle(20, -20, 30, -10)))
    );
  }

  @ParameterizedTest
  @MethodSource("scannable")
  void testHeaderAndBodyAgree(Geometry geometry) {
    Envelope expected = geometry.getEnvelopeInternal();
    byte[] withHeader = GeometryCodec.encode(geometry, 0, EnvelopeType.XY);
    byte[] withoutHeader = GeometryCodec.encode(geometry, 0, EnvelopeType.NONE);

    assertEquals(Optional.of(expected), headerOnly.extract(withHeader));
    assertEquals(Optional.of(expected), bodyOnly.extract(withHeader));
    assertEquals(Optional.of(expected), extractor.extract(withoutHeader));
    assertEquals(Optional.empty(), headerOnly.extract(withoutHeader));

    Envelope envelope = extractor.extract(withHeader).orElseThrow();
    for (Coordinate coordinate : geometry.getCoordinates()) {
      assertTrue(envelope.contains(coordinate.getX(), coordinate.getY()), coordinate.toString());
    }
  }

  @Test
  void testHeaderEnvelopeWinsOverBody() {
    byte[] bytes = GeometryCodec.encode(newPoint(1, 1), 0, EnvelopeType.XYZ);
    // overwrite min x in the header so the two sources disagree
    ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putDouble(8, -50);
    assertEquals(Optional.of(new Envelope(-50, 1, 1, 1)), extractor.extract(bytes));
    assertEquals(Optional.of(new Envelope(1, 1, 1, 1)), bodyOnly.extract(bytes));
  }

  @Test
  void testGeometryCollectionBodyHasNoEnvelope() {
    Geometry collection = newGeometryCollection(newPoint(1, 2), newLineString(0, 0, 5, 5));
    assertEquals(Optional.empty(), extractor.extract(GeometryCodec.encode(collection, 0, EnvelopeType.NONE)));
    assertEquals(Optional.of(new Envelope(0, 5, 0, 5)),
      extractor.extract(GeometryCodec.encode(collection, 0, EnvelopeType.XY)));
  }

  @Test
  void testNullAndEmptyHaveNoEnvelope() {
    assertEquals(Optional.empty(), extractor.extract(null));
    assertEquals(Optional.empty(), extractor.extract(GeometryCodec.encode(null, 0, EnvelopeType.XY)));
    assertEquals(Optional.empty(),
      extractor.extract(GeometryCodec.encode(GeoUtils.EMPTY_POINT, 0, EnvelopeType.XY)));
    assertEquals(Optional.empty(), extractor.extract(GeometryCodec.encode(newMultiPoint(), 0, EnvelopeType.XY)));
  }

  @Test
  void testMalformedInputThrows() {
    byte[] bytes = GeometryCodec.encode(newLineString(0, 0, 1, 1), 0, EnvelopeType.NONE);
    assertThrows(GeometryFormatException.class, () -> extractor.extract(new byte[]{1, 2, 3}));
    assertThrows(GeometryFormatException.class, () -> extractor.extract(Arrays.copyOf(bytes, bytes.length - 3)));

    byte[] badType = bytes.clone();
    badType[9] = 99;
    assertThrows(GeometryFormatException.class, () -> extractor.extract(badType));

    byte[] headerTooShort = GeometryCodec.encode(newPoint(1, 1), 0, EnvelopeType.XY);
    assertThrows(GeometryFormatException.class, () -> extractor.extract(Arrays.copyOf(headerTooShort, 20)));

    // Point Z type code with only X and Y after it
    ByteBuffer pointZ = ByteBuffer.allocate(GeometryHeader.SIZE + 1 + 4 + 2 * Double.BYTES);
    pointZ.put((byte) 'G').put((byte) 'P').put((byte) 0).put((byte) 1).putInt(4326);
    pointZ.order(ByteOrder.LITTLE_ENDIAN).put((byte) 1).putInt(1001).putDouble(1.5).putDouble(2.5);
    byte[] missingZ = pointZ.array();
    assertThrows(GeometryFormatException.class, () -> extractor.extract(missingZ));
    assertThrows(GeometryFormatException.class, () -> GeometryCodec.decode(missingZ));
  }
}
