package com.onthegomap.gpkg.wkb;

import static com.onthegomap.gpkg.geo.GeoUtils.JTS_FACTORY;

import com.onthegomap.gpkg.geo.GeoUtils;
import com.onthegomap.gpkg.geo.GeometryType;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Converts JTS geometries to and from the geometry blobs stored in feature tables: a {@link GeometryHeader}, an
 * optional envelope, then a little-endian WKB-style body.
 * <p>
 * Whether coordinates have Z and M is decided once from the first coordinate tuple of the geometry (see
 * {@link GeoUtils#tupleLength(Geometry)}) and applied to every part of it. A 3-ordinate tuple is always written with
 * the Z flag, even if the third ordinate is an M value.
 */
public class GeometryCodec {

  private static final byte WKB_BIG_ENDIAN = 0;
  private static final byte WKB_LITTLE_ENDIAN = 1;
  // byte order + type code
  private static final int GEOMETRY_PREFIX_SIZE = 5;
  private static final int COUNT_SIZE = Integer.BYTES;

  // should not instantiate
  private GeometryCodec() {}

  /**
   * Returns the blob for {@code geometry}.
   * <p>
   * {@code null} is written with the empty flag, no envelope, and a point type code with no coordinates after it. An
   * empty geometry has no bounds so it is always written without an envelope.
   *
   * @param geometry     the geometry to encode, or null
   * @param srsId        spatial reference system id to put in the header
   * @param envelopeMode which envelope to embed in the header
   * @throws IllegalArgumentException if the geometry is not one of the 7 encodable types
   */
  public static byte[] encode(Geometry geometry, int srsId, EnvelopeType envelopeMode) {
    if (geometry == null) {
      ByteBuffer buffer = ByteBuffer.allocate(GeometryHeader.SIZE + GEOMETRY_PREFIX_SIZE)
        .order(ByteOrder.LITTLE_ENDIAN);
      GeometryHeader.of(true, EnvelopeType.NONE, srsId).write(buffer);
      buffer.put(WKB_LITTLE_ENDIAN);
      buffer.putInt(GeometryType.POINT.code());
      return buffer.array();
    }
    int tupleLength = GeoUtils.tupleLength(geometry);
    EnvelopeType envelopeType = geometry.isEmpty() ? EnvelopeType.NONE : envelopeMode;
    GeometryHeader header = GeometryHeader.of(false, envelopeType, srsId);
    ByteBuffer buffer = ByteBuffer.allocate(header.length() + bodySize(geometry, tupleLength))
      .order(ByteOrder.LITTLE_ENDIAN);
    header.write(buffer);
    writeEnvelope(buffer, geometry, envelopeType);
    writeGeometry(buffer, geometry, tupleLength);
    return buffer.array();
  }

  /**
   * Parses a blob back into a geometry and spatial reference system id. The envelope is skipped, only the body is
   * used to build the geometry.
   *
   * @throws GeometryFormatException if the header is invalid, the body is truncated or contains a type code that
   *                                 cannot be decoded
   */
  public static DecodedGeometry decode(byte[] bytes) {
    if (bytes == null) {
      throw new GeometryFormatException("Geometry blob is null");
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    GeometryHeader header = GeometryHeader.read(buffer);
    if (header.extended()) {
      throw new GeometryFormatException("Extended geometry types are not supported");
    }
    if (header.empty()) {
      return new DecodedGeometry(null, header.srsId());
    }
    if (bytes.length < header.length()) {
      throw new GeometryFormatException("Geometry blob too short for " + header.envelopeType() + " envelope");
    }
    buffer.position(header.length());
    try {
      return new DecodedGeometry(readGeometry(buffer), header.srsId());
    } catch (BufferUnderflowException e) {
      throw new GeometryFormatException("Truncated geometry body", e);
    } catch (IllegalArgumentException e) {
      // JTS rejects rings that are not closed
      throw new GeometryFormatException("Invalid geometry: " + e.getMessage(), e);
    }
  }

  private static int bodySize(Geometry geometry, int tupleLength) {
    int tupleSize = tupleLength * Double.BYTES;
    if (geometry instanceof Point) {
      return GEOMETRY_PREFIX_SIZE + tupleSize;
    } else if (geometry instanceof LineString line) {
      return GEOMETRY_PREFIX_SIZE + COUNT_SIZE + line.getNumPoints() * tupleSize;
    } else if (geometry instanceof Polygon polygon) {
      int size = GEOMETRY_PREFIX_SIZE + COUNT_SIZE;
      if (!polygon.isEmpty()) {
        size += COUNT_SIZE + polygon.getExteriorRing().getNumPoints() * tupleSize;
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
          size += COUNT_SIZE + polygon.getInteriorRingN(i).getNumPoints() * tupleSize;
        }
      }
      return size;
    } else {
      int size = GEOMETRY_PREFIX_SIZE + COUNT_SIZE;
      for (int i = 0; i < geometry.getNumGeometries(); i++) {
        size += bodySize(geometry.getGeometryN(i), tupleLength);
      }
      return size;
    }
  }

  private static void writeEnvelope(ByteBuffer buffer, Geometry geometry, EnvelopeType envelopeType) {
    if (envelopeType == EnvelopeType.NONE) {
      return;
    }
    Envelope envelope = geometry.getEnvelopeInternal();
    buffer.putDouble(envelope.getMinX());
    buffer.putDouble(envelope.getMaxX());
    buffer.putDouble(envelope.getMinY());
    buffer.putDouble(envelope.getMaxY());
    if (envelopeType.hasZ()) {
      writeRange(buffer, GeoUtils.zRange(geometry));
    }
    if (envelopeType.hasM()) {
      writeRange(buffer, GeoUtils.mRange(geometry));
    }
  }

  private static void writeRange(ByteBuffer buffer, double[] range) {
    // an axis the geometry does not have is written as NaN
    buffer.putDouble(range == null ? Double.NaN : range[0]);
    buffer.putDouble(range == null ? Double.NaN : range[1]);
  }

  private static void writeGeometry(ByteBuffer buffer, Geometry geometry, int tupleLength) {
    GeometryType type = GeometryType.valueOf(geometry);
    buffer.put(WKB_LITTLE_ENDIAN);
    buffer.putInt(WkbType.forTupleLength(type, tupleLength).code());
    if (geometry instanceof Point point) {
      if (point.isEmpty()) {
        for (int i = 0; i < tupleLength; i++) {
          buffer.putDouble(Double.NaN);
        }
      } else {
        writeCoordinate(buffer, point.getCoordinateSequence(), 0, tupleLength);
      }
    } else if (geometry instanceof LineString line) {
      writeSequence(buffer, line.getCoordinateSequence(), tupleLength);
    } else if (geometry instanceof Polygon polygon) {
      if (polygon.isEmpty()) {
        buffer.putInt(0);
      } else {
        buffer.putInt(1 + polygon.getNumInteriorRing());
        writeSequence(buffer, polygon.getExteriorRing().getCoordinateSequence(), tupleLength);
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
          writeSequence(buffer, polygon.getInteriorRingN(i).getCoordinateSequence(), tupleLength);
        }
      }
    } else {
      // multipoint, multilinestring, multipolygon and collection all nest full geometries
      buffer.putInt(geometry.getNumGeometries());
      for (int i = 0; i < geometry.getNumGeometries(); i++) {
        writeGeometry(buffer, geometry.getGeometryN(i), tupleLength);
      }
    }
  }

  private static void writeSequence(ByteBuffer buffer, CoordinateSequence sequence, int tupleLength) {
    buffer.putInt(sequence.size());
    for (int i = 0; i < sequence.size(); i++) {
      writeCoordinate(buffer, sequence, i, tupleLength);
    }
  }

  private static void writeCoordinate(ByteBuffer buffer, CoordinateSequence sequence, int index, int tupleLength) {
    buffer.putDouble(sequence.getX(index));
    buffer.putDouble(sequence.getY(index));
    double z = sequence.getZ(index);
    double m = sequence.getM(index);
    if (tupleLength == 3) {
      buffer.putDouble(Double.isNaN(z) ? m : z);
    } else if (tupleLength == 4) {
      buffer.putDouble(z);
      buffer.putDouble(m);
    }
  }

  private static ByteOrder readByteOrder(ByteBuffer buffer) {
    byte order = buffer.get();
    return switch (order) {
      case WKB_BIG_ENDIAN -> ByteOrder.BIG_ENDIAN;
      case WKB_LITTLE_ENDIAN -> ByteOrder.LITTLE_ENDIAN;
      default -> throw new GeometryFormatException("Invalid byte order in geometry body: " + order);
    };
  }

  private static Geometry readGeometry(ByteBuffer buffer) {
    ByteOrder parentOrder = buffer.order();
    buffer.order(readByteOrder(buffer));
    WkbType wkbType = WkbType.parse(buffer.getInt());
    Geometry result = switch (wkbType.type()) {
      case POINT -> readPoint(buffer, wkbType);
      case LINESTRING -> JTS_FACTORY.createLineString(readCoordinates(buffer, wkbType));
      case POLYGON -> readPolygon(buffer, wkbType);
      case MULTIPOINT -> JTS_FACTORY.createMultiPoint(readParts(buffer, Point.class).toArray(new Point[0]));
      case MULTILINESTRING -> JTS_FACTORY.createMultiLineString(
        readParts(buffer, LineString.class).toArray(new LineString[0]));
      case MULTIPOLYGON -> JTS_FACTORY.createMultiPolygon(readParts(buffer, Polygon.class).toArray(new Polygon[0]));
      case GEOMETRYCOLLECTION -> JTS_FACTORY.createGeometryCollection(
        readParts(buffer, Geometry.class).toArray(new Geometry[0]));
      default -> throw new GeometryFormatException("Unsupported geometry type: " + wkbType.type());
    };
    buffer.order(parentOrder);
    return result;
  }

  private static Point readPoint(ByteBuffer buffer, WkbType wkbType) {
    Coordinate coordinate = readCoordinate(buffer, wkbType);
    if (Double.isNaN(coordinate.getX()) && Double.isNaN(coordinate.getY())) {
      return JTS_FACTORY.createPoint();
    }
    return JTS_FACTORY.createPoint(coordinate);
  }

  private static Polygon readPolygon(ByteBuffer buffer, WkbType wkbType) {
    int numRings = readCount(buffer, COUNT_SIZE);
    if (numRings == 0) {
      return JTS_FACTORY.createPolygon();
    }
    LinearRing shell = JTS_FACTORY.createLinearRing(readCoordinates(buffer, wkbType));
    LinearRing[] holes = new LinearRing[numRings - 1];
    for (int i = 0; i < holes.length; i++) {
      holes[i] = JTS_FACTORY.createLinearRing(readCoordinates(buffer, wkbType));
    }
    return JTS_FACTORY.createPolygon(shell, holes);
  }

  private static <T extends Geometry> List<T> readParts(ByteBuffer buffer, Class<T> partType) {
    int count = readCount(buffer, GEOMETRY_PREFIX_SIZE);
    List<T> parts = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      Geometry part = readGeometry(buffer);
      if (!partType.isInstance(part)) {
        throw new GeometryFormatException(
          "Expected " + partType.getSimpleName() + " part but got " + part.getGeometryType());
      }
      parts.add(partType.cast(part));
    }
    return parts;
  }

  private static Coordinate[] readCoordinates(ByteBuffer buffer, WkbType wkbType) {
    int count = readCount(buffer, wkbType.tupleSize());
    Coordinate[] coordinates = new Coordinate[count];
    for (int i = 0; i < count; i++) {
      coordinates[i] = readCoordinate(buffer, wkbType);
    }
    return coordinates;
  }

  private static Coordinate readCoordinate(ByteBuffer buffer, WkbType wkbType) {
    double x = buffer.getDouble();
    double y = buffer.getDouble();
    double z = wkbType.hasZ() ? buffer.getDouble() : Double.NaN;
    double m = wkbType.hasM() ? buffer.getDouble() : Double.NaN;
    return GeoUtils.coordinate(x, y, z, m, wkbType.hasZ(), wkbType.hasM());
  }

  /** Reads a count and checks that enough bytes remain for that many items of at least {@code minItemSize}. */
  static int readCount(ByteBuffer buffer, int minItemSize) {
    int count = buffer.getInt();
    if (count < 0 || (long) count * minItemSize > buffer.remaining()) {
      throw new GeometryFormatException(
        "Count of " + Integer.toUnsignedString(count) + " exceeds the " + buffer.remaining() + " remaining bytes");
    }
    return count;
  }
}
