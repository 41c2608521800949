package com.onthegomap.gpkg.features;

import java.util.List;
import java.util.regex.Pattern;
import org.locationtech.jts.geom.Envelope;

/**
 * Which features {@link FeatureStore#query(String, FeatureQuery)} returns.
 *
 * @param bounds  only features whose bounding box overlaps this, or null for all
 * @param where   sql condition on the table's columns with {@code ?} placeholders, or null
 * @param params  values bound to the placeholders of {@code where}
 * @param orderBy column name optionally followed by {@code ASC} or {@code DESC}, or null for id order
 * @param limit   maximum number of features, or null
 * @param offset  number of matching features to skip, or null
 */
public record FeatureQuery(
  Envelope bounds,
  String where,
  List<Object> params,
  String orderBy,
  Integer limit,
  Integer offset
) {

  private static final Pattern ORDER_BY =
    Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*(\\s+(ASC|DESC|asc|desc))?$");

  public FeatureQuery {
    params = params == null ? List.of() : List.copyOf(params);
    if (orderBy != null && !ORDER_BY.matcher(orderBy.trim()).matches()) {
      throw new IllegalArgumentException("Invalid order by: " + orderBy);
    }
    if ((limit != null && limit < 0) || (offset != null && offset < 0)) {
      throw new IllegalArgumentException("limit and offset must not be negative");
    }
  }

  public static FeatureQuery all() {
    return new FeatureQuery(null, null, List.of(), null, null, null);
  }

  public static FeatureQuery intersecting(Envelope bounds) {
    return all().withBounds(bounds);
  }

  public FeatureQuery withBounds(Envelope newBounds) {
    return new FeatureQuery(newBounds, where, params, orderBy, limit, offset);
  }

  public FeatureQuery withWhere(String newWhere, Object... newParams) {
    return new FeatureQuery(bounds, newWhere, List.of(newParams), orderBy, limit, offset);
  }

  public FeatureQuery withOrderBy(String newOrderBy) {
    return new FeatureQuery(bounds, where, params, newOrderBy, limit, offset);
  }

  public FeatureQuery withLimit(Integer newLimit) {
    return new FeatureQuery(bounds, where, params, orderBy, newLimit, offset);
  }

  public FeatureQuery withOffset(Integer newOffset) {
    return new FeatureQuery(bounds, where, params, orderBy, limit, newOffset);
  }
}
