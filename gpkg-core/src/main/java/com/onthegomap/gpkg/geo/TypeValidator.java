package com.onthegomap.gpkg.geo;

import com.onthegomap.gpkg.schema.GeometryColumn;
import java.util.Locale;
import org.locationtech.jts.geom.Geometry;

/**
 * Checks that a geometry can be stored in a geometry column before it gets encoded.
 * <p>
 * The declared type must accept the runtime type of the geometry (see {@link GeometryType#accepts(GeometryType)}) and
 * the Z and M values of the first coordinate must satisfy the column's {@link ZmPolicy Z and M policies}. A 3-ordinate
 * tuple always counts as having Z, so XYM input is treated like XYZ.
 */
public class TypeValidator {

  public void validate(Geometry geometry, GeometryColumn column) throws GeometryException {
    if (geometry == null) {
      return;
    }
    GeometryType actual;
    try {
      actual = GeometryType.valueOf(geometry);
    } catch (IllegalArgumentException e) {
      throw new GeometryException("unsupported_type", e.getMessage() + " for " + describe(column), e);
    }
    if (!column.geometryType().accepts(actual)) {
      throw new GeometryException.TypeMismatch(
        "%s expects %s but got %s".formatted(describe(column), column.geometryType(), actual));
    }
    int length = GeoUtils.tupleLength(geometry);
    checkDimension(column, "Z", column.z(), length >= 3);
    checkDimension(column, "M", column.m(), length >= 4);
  }

  private static void checkDimension(GeometryColumn column, String ordinate, ZmPolicy policy, boolean present)
    throws GeometryException.Dimension {
    if (!policy.permits(present)) {
      String verb = present ? "prohibits" : "requires";
      throw new GeometryException.Dimension(
        verb + "_" + ordinate.toLowerCase(Locale.ROOT),
        "%s %s %s".formatted(describe(column), verb, ordinate)
      );
    }
  }

  private static String describe(GeometryColumn column) {
    return column.tableName() + "." + column.columnName();
  }
}
