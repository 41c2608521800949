package com.onthegomap.gpkg.attributes;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Which rows {@link AttributeStore#query(String, AttributeQuery)} returns.
 *
 * @param where   sql condition with {@code ?} placeholders, or null for every row
 * @param params  values bound to the placeholders of {@code where}
 * @param orderBy column name optionally followed by {@code ASC} or {@code DESC}, or null for id order
 * @param limit   maximum number of rows, or null
 * @param offset  number of rows to skip, or null
 */
public record AttributeQuery(String where, List<Object> params, String orderBy, Integer limit, Integer offset) {

  private static final Pattern ORDER_BY =
    Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*(\\s+(ASC|DESC|asc|desc))?$");

  public AttributeQuery {
    params = params == null ? List.of() : List.copyOf(params);
    if (orderBy != null && !ORDER_BY.matcher(orderBy.trim()).matches()) {
      throw new IllegalArgumentException("Invalid order by: " + orderBy);
    }
  }

  public static AttributeQuery all() {
    return new AttributeQuery(null, List.of(), null, null, null);
  }

  public static AttributeQuery where(String where, Object... params) {
    return new AttributeQuery(where, List.of(params), null, null, null);
  }

  public AttributeQuery withOrderBy(String newOrderBy) {
    return new AttributeQuery(where, params, newOrderBy, limit, offset);
  }

  public AttributeQuery withPage(Integer newLimit, Integer newOffset) {
    return new AttributeQuery(where, params, orderBy, newLimit, newOffset);
  }
}
