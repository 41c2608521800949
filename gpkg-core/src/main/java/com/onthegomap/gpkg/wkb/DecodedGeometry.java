package com.onthegomap.gpkg.wkb;

import org.locationtech.jts.geom.Geometry;

/**
 * A geometry read back from a blob along with its spatial reference system id.
 *
 * @param geometry the geometry, or {@code null} if the blob had the empty flag set
 * @param srsId    spatial reference system id from the header
 */
public record DecodedGeometry(Geometry geometry, int srsId) {

  public boolean isNull() {
    return geometry == null;
  }
}
