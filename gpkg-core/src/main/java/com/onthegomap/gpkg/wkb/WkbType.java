package com.onthegomap.gpkg.wkb;

import com.onthegomap.gpkg.geo.GeometryType;

/**
 * The type code written after the byte order of every geometry in a body: the base {@link GeometryType#code()} plus
 * 1000 if coordinates have Z and 2000 if they have M.
 * <p>
 * This is the additive scheme, not ISO WKB's 0x80000000/0x40000000 flags.
 */
record WkbType(GeometryType type, boolean hasZ, boolean hasM) {

  private static final int Z_OFFSET = 1000;
  private static final int M_OFFSET = 2000;

  /** Returns the type for a geometry whose coordinate tuples have {@code tupleLength} ordinates. */
  static WkbType forTupleLength(GeometryType type, int tupleLength) {
    return new WkbType(type, tupleLength >= 3, tupleLength >= 4);
  }

  /**
   * Parses a type code read from a body.
   *
   * @throws GeometryFormatException if the base code is not 0-14 or the dimension offset is not 0-3000
   */
  static WkbType parse(int code) {
    if (code < 0 || code >= 4000 || code % 1000 > GeometryType.SURFACE.code()) {
      throw new GeometryFormatException("Unrecognized geometry type code: " + Integer.toUnsignedString(code));
    }
    boolean hasZ = (code >= 1000 && code < 2000) || code >= 3000;
    boolean hasM = (code >= 2000 && code < 3000) || code >= 3000;
    return new WkbType(GeometryType.fromCode(code % 1000), hasZ, hasM);
  }

  int code() {
    return type.code() + (hasZ ? Z_OFFSET : 0) + (hasM ? M_OFFSET : 0);
  }

  /** Number of float64 values per coordinate tuple. */
  int tupleLength() {
    return 2 + (hasZ ? 1 : 0) + (hasM ? 1 : 0);
  }

  int tupleSize() {
    return tupleLength() * Double.BYTES;
  }
}
