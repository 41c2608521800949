package com.onthegomap.gpkg.wkb;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Streams the X/Y values of every coordinate in a geometry body without building JTS geometries.
 * <p>
 * Z and M values are skipped. Geometry collections and curve types are not scanned.
 */
final class WkbBodyScanner {

  /** Receives the X/Y of each coordinate. */
  @FunctionalInterface
  interface CoordinateVisitor {

    void visit(double x, double y);
  }

  // should not instantiate
  private WkbBodyScanner() {}

  /**
   * Visits every coordinate of the geometry at the current position of {@code buffer}.
   *
   * @return false if the body contains a part that cannot be scanned, in which case the visitor may have seen only
   *         some coordinates
   * @throws GeometryFormatException         if the body has an invalid byte order or type code
   * @throws java.nio.BufferUnderflowException if the body is truncated
   */
  static boolean scan(ByteBuffer buffer, CoordinateVisitor visitor) {
    ByteOrder parentOrder = buffer.order();
    byte order = buffer.get();
    if (order != 0 && order != 1) {
      throw new GeometryFormatException("Invalid byte order in geometry body: " + order);
    }
    buffer.order(order == 1 ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN);
    WkbType wkbType = WkbType.parse(buffer.getInt());
    boolean result = switch (wkbType.type()) {
      case POINT -> {
        visitCoordinate(buffer, wkbType, visitor);
        yield true;
      }
      case LINESTRING -> {
        visitSequence(buffer, wkbType, visitor);
        yield true;
      }
      case POLYGON -> {
        int numRings = GeometryCodec.readCount(buffer, Integer.BYTES);
        for (int i = 0; i < numRings; i++) {
          visitSequence(buffer, wkbType, visitor);
        }
        yield true;
      }
      case MULTIPOINT, MULTILINESTRING, MULTIPOLYGON -> {
        int numParts = GeometryCodec.readCount(buffer, 5);
        boolean scanned = true;
        for (int i = 0; i < numParts && scanned; i++) {
          scanned = scan(buffer, visitor);
        }
        yield scanned;
      }
      default -> false;
    };
    buffer.order(parentOrder);
    return result;
  }

  private static void visitSequence(ByteBuffer buffer, WkbType wkbType, CoordinateVisitor visitor) {
    int count = GeometryCodec.readCount(buffer, wkbType.tupleSize());
    for (int i = 0; i < count; i++) {
      visitCoordinate(buffer, wkbType, visitor);
    }
  }

  private static void visitCoordinate(ByteBuffer buffer, WkbType wkbType, CoordinateVisitor visitor) {
    double x = buffer.getDouble();
    double y = buffer.getDouble();
    // skip Z and M, reading them so a truncated tuple underflows
    for (int i = 2 * Double.BYTES; i < wkbType.tupleSize(); i += Double.BYTES) {
      buffer.getDouble();
    }
    visitor.visit(x, y);
  }
}
