package com.onthegomap.gpkg.geojson;

import static com.onthegomap.gpkg.geo.GeoUtils.JTS_FACTORY;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.onthegomap.gpkg.geo.GeoUtils;
import com.onthegomap.gpkg.geo.GeometryException;
import com.onthegomap.gpkg.geo.GeometryType;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/** Converts between JTS geometries and GeoJSON geometry objects. */
class GeoJsonGeometries {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  // should not instantiate
  private GeoJsonGeometries() {}

  /**
   * Returns the GeoJSON object for {@code geometry}. Every position gets as many ordinates as the first coordinate
   * of the geometry has, with Z before M.
   */
  static ObjectNode toJson(Geometry geometry) {
    GeometryType type = GeometryType.valueOf(geometry);
    ObjectNode result = NODES.objectNode();
    result.put("type", type.geoJsonName());
    if (type == GeometryType.GEOMETRYCOLLECTION) {
      ArrayNode geometries = result.putArray("geometries");
      for (int i = 0; i < geometry.getNumGeometries(); i++) {
        geometries.add(toJson(geometry.getGeometryN(i)));
      }
    } else {
      result.set("coordinates", coordinates(geometry, GeoUtils.tupleLength(geometry)));
    }
    return result;
  }

  private static ArrayNode coordinates(Geometry geometry, int tupleLength) {
    if (geometry instanceof Point point) {
      return point.isEmpty() ? NODES.arrayNode() : position(point.getCoordinate(), tupleLength);
    } else if (geometry instanceof LineString line) {
      ArrayNode result = NODES.arrayNode();
      for (Coordinate coordinate : line.getCoordinates()) {
        result.add(position(coordinate, tupleLength));
      }
      return result;
    } else if (geometry instanceof Polygon polygon) {
      ArrayNode result = NODES.arrayNode();
      if (!polygon.isEmpty()) {
        result.add(coordinates(polygon.getExteriorRing(), tupleLength));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
          result.add(coordinates(polygon.getInteriorRingN(i), tupleLength));
        }
      }
      return result;
    }
    ArrayNode result = NODES.arrayNode();
    for (int i = 0; i < geometry.getNumGeometries(); i++) {
      result.add(coordinates(geometry.getGeometryN(i), tupleLength));
    }
    return result;
  }

  private static ArrayNode position(Coordinate coordinate, int tupleLength) {
    ArrayNode result = NODES.arrayNode();
    result.add(coordinate.getX());
    result.add(coordinate.getY());
    if (tupleLength == 3) {
      result.add(GeoUtils.thirdOrdinate(coordinate));
    } else if (tupleLength == 4) {
      result.add(coordinate.getZ());
      result.add(coordinate.getM());
    }
    return result;
  }

  /**
   * Returns the JTS geometry for a GeoJSON geometry object, where 3-ordinate positions get a Z value and 4-ordinate
   * positions get Z and M values.
   *
   * @throws GeometryException if the type is not one of the seven GeoJSON geometry types or the coordinates are
   *                           malformed
   */
  static Geometry fromJson(JsonNode json) throws GeometryException {
    String typeName = json.path("type").asText(null);
    GeometryType type = typeForName(typeName);
    if (type == GeometryType.GEOMETRYCOLLECTION) {
      JsonNode parts = json.path("geometries");
      List<Geometry> geometries = new ArrayList<>();
      for (JsonNode part : parts) {
        geometries.add(fromJson(part));
      }
      return JTS_FACTORY.createGeometryCollection(geometries.toArray(Geometry[]::new));
    }
    JsonNode coordinates = json.path("coordinates");
    if (!coordinates.isArray()) {
      throw new GeometryException("geojson_invalid_coordinates", typeName + " has no coordinates array");
    }
    try {
      return switch (type) {
        case POINT -> point(coordinates);
        case LINESTRING -> JTS_FACTORY.createLineString(positions(coordinates));
        case POLYGON -> polygon(coordinates);
        case MULTIPOINT -> JTS_FACTORY.createMultiPoint(map(coordinates, GeoJsonGeometries::point)
          .toArray(Point[]::new));
        case MULTILINESTRING -> JTS_FACTORY.createMultiLineString(
          map(coordinates, line -> JTS_FACTORY.createLineString(positions(line))).toArray(LineString[]::new));
        case MULTIPOLYGON -> JTS_FACTORY.createMultiPolygon(map(coordinates, GeoJsonGeometries::polygon)
          .toArray(Polygon[]::new));
        default -> throw new IllegalStateException("Unexpected type " + type);
      };
    } catch (IllegalArgumentException e) {
      // JTS rejects rings that are not closed or too short
      throw new GeometryException("geojson_invalid_coordinates", "Invalid " + typeName + ": " + e.getMessage(), e);
    }
  }

  private static GeometryType typeForName(String name) throws GeometryException {
    for (GeometryType type : GeometryType.values()) {
      if (type.isEncodable() && type.geoJsonName().equals(name)) {
        return type;
      }
    }
    throw new GeometryException("geojson_unsupported_type", "Unsupported GeoJSON geometry type: " + name);
  }

  private interface PartReader<T> {
    T read(JsonNode node) throws GeometryException;
  }

  private static <T> List<T> map(JsonNode array, PartReader<T> reader) throws GeometryException {
    List<T> result = new ArrayList<>(array.size());
    for (JsonNode item : array) {
      result.add(reader.read(item));
    }
    return result;
  }

  private static Point point(JsonNode coordinates) throws GeometryException {
    return coordinates.isEmpty() ? JTS_FACTORY.createPoint() : JTS_FACTORY.createPoint(position(coordinates));
  }

  private static Polygon polygon(JsonNode rings) throws GeometryException {
    if (rings.isEmpty()) {
      return JTS_FACTORY.createPolygon();
    }
    LinearRing shell = JTS_FACTORY.createLinearRing(positions(rings.get(0)));
    List<LinearRing> holes = new ArrayList<>();
    for (int i = 1; i < rings.size(); i++) {
      holes.add(JTS_FACTORY.createLinearRing(positions(rings.get(i))));
    }
    return GeoUtils.createPolygon(shell, holes);
  }

  private static Coordinate[] positions(JsonNode array) throws GeometryException {
    if (!array.isArray()) {
      throw new GeometryException("geojson_invalid_coordinates", "Expected an array of positions but got " + array);
    }
    return map(array, GeoJsonGeometries::position).toArray(Coordinate[]::new);
  }

  private static Coordinate position(JsonNode position) throws GeometryException {
    int size = position.size();
    if (!position.isArray() || size < 2 || size > 4) {
      throw new GeometryException("geojson_invalid_coordinates", "Invalid position: " + position);
    }
    double[] ordinates = new double[size];
    for (int i = 0; i < size; i++) {
      JsonNode ordinate = position.get(i);
      if (!ordinate.isNumber()) {
        throw new GeometryException("geojson_invalid_coordinates", "Invalid position: " + position);
      }
      ordinates[i] = ordinate.doubleValue();
    }
    return GeoUtils.coordinate(ordinates);
  }
}
