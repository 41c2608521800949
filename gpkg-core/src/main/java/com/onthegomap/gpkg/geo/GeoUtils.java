package com.onthegomap.gpkg.geo;

import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.CoordinateXYM;
import org.locationtech.jts.geom.CoordinateXYZM;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;

/**
 * A collection of utilities for working with JTS geometries and their coordinate dimensions.
 */
public class GeoUtils {

  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);

  public static final Point EMPTY_POINT = JTS_FACTORY.createPoint();
  private static final LinearRing[] EMPTY_RING_ARRAY = new LinearRing[0];

  // should not instantiate
  private GeoUtils() {}

  /**
   * Returns a coordinate with only the ordinates that are present, so that {@link #tupleLength(Coordinate)} reports
   * the right dimension.
   */
  public static Coordinate coordinate(double x, double y, double z, double m, boolean hasZ, boolean hasM) {
    if (hasZ && hasM) {
      return new CoordinateXYZM(x, y, z, m);
    } else if (hasZ) {
      return new Coordinate(x, y, z);
    } else if (hasM) {
      return new CoordinateXYM(x, y, m);
    } else {
      return new CoordinateXY(x, y);
    }
  }

  /** Returns a coordinate from 2, 3 (x, y, z) or 4 (x, y, z, m) ordinates. */
  public static Coordinate coordinate(double... ordinates) {
    return switch (ordinates.length) {
      case 2 -> new CoordinateXY(ordinates[0], ordinates[1]);
      case 3 -> new Coordinate(ordinates[0], ordinates[1], ordinates[2]);
      case 4 -> new CoordinateXYZM(ordinates[0], ordinates[1], ordinates[2], ordinates[3]);
      default -> throw new IllegalArgumentException("Expected 2-4 ordinates, got " + ordinates.length);
    };
  }

  /**
   * Returns the number of ordinates in a coordinate tuple: 2 plus one for a Z value plus one for an M value.
   * <p>
   * A missing ordinate is represented by NaN in JTS.
   */
  public static int tupleLength(Coordinate coordinate) {
    int length = 2;
    if (!Double.isNaN(coordinate.getZ())) {
      length++;
    }
    if (!Double.isNaN(coordinate.getM())) {
      length++;
    }
    return length;
  }

  /**
   * Returns the tuple length of the first coordinate in {@code geometry}, or 2 if it is null or has no coordinates.
   * <p>
   * Every other coordinate in the geometry is assumed to have the same length.
   */
  public static int tupleLength(Geometry geometry) {
    Coordinate first = firstCoordinate(geometry);
    return first == null ? 2 : tupleLength(first);
  }

  /** Returns the first coordinate of the first non-empty part of {@code geometry}, or null if there is none. */
  public static Coordinate firstCoordinate(Geometry geometry) {
    if (geometry == null || geometry.isEmpty()) {
      return null;
    }
    if (geometry instanceof Point point) {
      return point.getCoordinateSequence().getCoordinate(0);
    } else if (geometry instanceof LineString line) {
      return line.getCoordinateSequence().getCoordinate(0);
    } else if (geometry instanceof Polygon polygon) {
      return firstCoordinate(polygon.getExteriorRing());
    }
    for (int i = 0; i < geometry.getNumGeometries(); i++) {
      Coordinate result = firstCoordinate(geometry.getGeometryN(i));
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  /** Returns the ordinate written after X and Y for a 3-ordinate tuple: Z when it is set, otherwise M. */
  public static double thirdOrdinate(Coordinate coordinate) {
    double z = coordinate.getZ();
    return Double.isNaN(z) ? coordinate.getM() : z;
  }

  /** Returns the min/max of every non-NaN Z value, or {@code null} if there are none. */
  public static double[] zRange(Geometry geometry) {
    return ordinateRange(geometry, false);
  }

  /** Returns the min/max of every non-NaN M value, or {@code null} if there are none. */
  public static double[] mRange(Geometry geometry) {
    return ordinateRange(geometry, true);
  }

  private static double[] ordinateRange(Geometry geometry, boolean measure) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (Coordinate coordinate : geometry.getCoordinates()) {
      double value = measure ? coordinate.getM() : coordinate.getZ();
      if (!Double.isNaN(value)) {
        min = Math.min(min, value);
        max = Math.max(max, value);
      }
    }
    return min > max ? null : new double[]{min, max};
  }

  /** Returns true if the two boxes overlap, treating touching edges as overlapping. */
  public static boolean overlaps(Envelope a, Envelope b) {
    return a.getMaxX() >= b.getMinX() && a.getMinX() <= b.getMaxX() &&
      a.getMaxY() >= b.getMinY() && a.getMinY() <= b.getMaxY();
  }

  public static Point point(double x, double y) {
    return JTS_FACTORY.createPoint(new CoordinateXY(x, y));
  }

  public static Polygon createPolygon(LinearRing exteriorRing, List<LinearRing> rings) {
    return JTS_FACTORY.createPolygon(exteriorRing, rings.toArray(EMPTY_RING_ARRAY));
  }
}
