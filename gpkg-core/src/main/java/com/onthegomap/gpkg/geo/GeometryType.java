package com.onthegomap.gpkg.geo;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Geometry type names stored in {@code gpkg_geometry_columns.geometry_type_name} along with the base type code used in
 * the binary geometry body.
 * <p>
 * Only the first seven concrete types can be encoded, the rest exist so columns can declare them.
 */
public enum GeometryType {
  GEOMETRY(0),
  POINT(1),
  LINESTRING(2),
  POLYGON(3),
  MULTIPOINT(4),
  MULTILINESTRING(5),
  MULTIPOLYGON(6),
  GEOMETRYCOLLECTION(7),
  CIRCULARSTRING(8),
  COMPOUNDCURVE(9),
  CURVEPOLYGON(10),
  MULTICURVE(11),
  MULTISURFACE(12),
  CURVE(13),
  SURFACE(14);

  private static final GeometryType[] BY_CODE = new GeometryType[15];
  private static final Map<GeometryType, Set<GeometryType>> ACCEPTS = new EnumMap<>(GeometryType.class);

  static {
    for (GeometryType type : values()) {
      BY_CODE[type.code] = type;
    }
    ACCEPTS.put(GEOMETRY, EnumSet.allOf(GeometryType.class));
    ACCEPTS.put(CURVE, EnumSet.of(LINESTRING, CIRCULARSTRING, COMPOUNDCURVE));
    ACCEPTS.put(SURFACE, EnumSet.of(POLYGON, CURVEPOLYGON));
    ACCEPTS.put(MULTICURVE, EnumSet.of(MULTILINESTRING));
    ACCEPTS.put(MULTISURFACE, EnumSet.of(MULTIPOLYGON));
  }

  private final int code;

  GeometryType(int code) {
    this.code = code;
  }

  /** Returns the base type code written to the geometry body, before adding the Z and M offsets. */
  public int code() {
    return code;
  }

  /** Returns the upper case name used in the geometry columns table. */
  public String typeName() {
    return name();
  }

  /** Returns true if the body codec can write and read this type. */
  public boolean isEncodable() {
    return code >= POINT.code && code <= GEOMETRYCOLLECTION.code;
  }

  /**
   * Returns true if a column declared with this type can store a geometry of {@code other} type.
   */
  public boolean accepts(GeometryType other) {
    if (this == other) {
      return true;
    }
    Set<GeometryType> subtypes = ACCEPTS.get(this);
    return subtypes != null && subtypes.contains(other);
  }

  /**
   * Returns the type for a base type code.
   *
   * @throws IllegalArgumentException if {@code code} is not between 0 and 14
   */
  public static GeometryType fromCode(int code) {
    if (code < 0 || code >= BY_CODE.length) {
      throw new IllegalArgumentException("Unknown geometry type code: " + code);
    }
    return BY_CODE[code];
  }

  /**
   * Returns the type for a geometry type name, ignoring case.
   *
   * @throws IllegalArgumentException if {@code name} is not a known geometry type
   */
  public static GeometryType fromName(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown geometry type name: " + name, e);
    }
  }

  /** Returns the GeoJSON type name for encodable types, for example {@code "MultiPolygon"}. */
  public String geoJsonName() {
    return switch (this) {
      case POINT -> "Point";
      case LINESTRING -> "LineString";
      case POLYGON -> "Polygon";
      case MULTIPOINT -> "MultiPoint";
      case MULTILINESTRING -> "MultiLineString";
      case MULTIPOLYGON -> "MultiPolygon";
      case GEOMETRYCOLLECTION -> "GeometryCollection";
      default -> throw new IllegalArgumentException(this + " has no GeoJSON representation");
    };
  }

  /** Returns the runtime type of a JTS geometry. */
  public static GeometryType valueOf(Geometry geometry) {
    // multi geometries extend GeometryCollection so they need to be checked first
    if (geometry instanceof Point) {
      return POINT;
    } else if (geometry instanceof LineString) {
      return LINESTRING;
    } else if (geometry instanceof Polygon) {
      return POLYGON;
    } else if (geometry instanceof MultiPoint) {
      return MULTIPOINT;
    } else if (geometry instanceof MultiLineString) {
      return MULTILINESTRING;
    } else if (geometry instanceof MultiPolygon) {
      return MULTIPOLYGON;
    } else if (geometry instanceof GeometryCollection) {
      return GEOMETRYCOLLECTION;
    }
    throw new IllegalArgumentException("Unsupported geometry: " + (geometry == null ? "null" :
      geometry.getGeometryType()));
  }
}
