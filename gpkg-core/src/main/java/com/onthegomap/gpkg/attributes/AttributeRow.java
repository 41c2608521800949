package com.onthegomap.gpkg.attributes;

import java.util.Map;

/**
 * A row of an attribute table.
 *
 * @param id     value of the {@code id} primary key
 * @param values every other column in table order, null values included
 */
public record AttributeRow(long id, Map<String, Object> values) {

  public Object get(String column) {
    return values.get(column);
  }
}
