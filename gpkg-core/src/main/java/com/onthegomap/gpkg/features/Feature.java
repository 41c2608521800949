package com.onthegomap.gpkg.features;

import java.util.Map;
import org.locationtech.jts.geom.Geometry;

/**
 * A row read from a feature table.
 *
 * @param id         value of the {@code id} primary key
 * @param geometry   decoded geometry, or null
 * @param properties values of the user columns in table order, null values included
 */
public record Feature(long id, Geometry geometry, Map<String, Object> properties) {

  public Object getProperty(String key) {
    return properties.get(key);
  }
}
