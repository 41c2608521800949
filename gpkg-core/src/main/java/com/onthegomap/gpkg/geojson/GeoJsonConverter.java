package com.onthegomap.gpkg.geojson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import com.onthegomap.gpkg.features.ColumnDefinition;
import com.onthegomap.gpkg.features.Feature;
import com.onthegomap.gpkg.features.FeatureStore;
import com.onthegomap.gpkg.features.FeatureTableConfig;
import com.onthegomap.gpkg.geo.GeoUtils;
import com.onthegomap.gpkg.geo.GeometryException;
import com.onthegomap.gpkg.geo.GeometryType;
import com.onthegomap.gpkg.geo.ZmPolicy;
import com.onthegomap.gpkg.schema.Contents;
import com.onthegomap.gpkg.schema.GeometryColumn;
import com.onthegomap.gpkg.schema.SpatialReferenceSystem;
import com.onthegomap.gpkg.schema.SpatialReferenceSystems;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports feature tables to GeoJSON feature collections and imports feature collections into feature tables.
 * <p>
 * Importing into a new table infers its schema from the features: the geometry type is the single type every feature
 * has, or {@code GEOMETRY} when they differ, Z and M are optional when any position has them, and each property gets
 * the sql type of its values. Features whose geometry cannot be stored are skipped with a warning.
 */
public class GeoJsonConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeoJsonConverter.class);
  private static final Pattern EPSG_CODE = Pattern.compile("EPSG:(?::)?(\\d+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern CRS84 = Pattern.compile("CRS:?84$", Pattern.CASE_INSENSITIVE);

  private final ObjectMapper mapper = new ObjectMapper();
  private final Sqlite db;
  private final FeatureStore features;
  private final Contents contents;
  private final SpatialReferenceSystems srs;

  public GeoJsonConverter(Sqlite db, FeatureStore features, Contents contents, SpatialReferenceSystems srs) {
    this.db = db;
    this.features = features;
    this.contents = contents;
    this.srs = srs;
  }

  /** Returns every feature of {@code tableName} as a GeoJSON {@code FeatureCollection}. */
  public ObjectNode toGeoJson(String tableName, ExportOptions options) {
    GeometryColumn column = features.getGeometryColumn(tableName);
    ObjectNode result = mapper.createObjectNode();
    result.put("type", "FeatureCollection");
    if (options.includeCrs()) {
      srs.get(column.srsId()).ifPresent(system -> result.set("crs", crs(system)));
    }
    if (options.includeBbox()) {
      Optional<Envelope> bounds = contents.get(tableName)
        .map(content -> content.bounds())
        .or(() -> features.calculateBounds(tableName));
      bounds.ifPresent(envelope -> result.set("bbox", mapper.createArrayNode()
        .add(envelope.getMinX()).add(envelope.getMinY()).add(envelope.getMaxX()).add(envelope.getMaxY())));
    }
    ArrayNode array = result.putArray("features");
    try (var iterator = features.iterate(tableName)) {
      while (iterator.hasNext()) {
        array.add(toGeoJson(iterator.next()));
      }
    }
    return result;
  }

  public String toGeoJsonString(String tableName, ExportOptions options) {
    try {
      return mapper.writeValueAsString(toGeoJson(tableName, options));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write " + tableName + " as GeoJSON", e);
    }
  }

  /** Writes {@link #toGeoJson(String, ExportOptions)} to a file. */
  public void writeGeoJson(String tableName, Path output, ExportOptions options) throws IOException {
    mapper.writeValue(output.toFile(), toGeoJson(tableName, options));
  }

  /** Returns one feature as a GeoJSON {@code Feature}. */
  public ObjectNode toGeoJson(Feature feature) {
    ObjectNode result = mapper.createObjectNode();
    result.put("type", "Feature");
    result.put("id", feature.id());
    if (feature.geometry() == null) {
      result.putNull("geometry");
    } else {
      result.set("geometry", GeoJsonGeometries.toJson(feature.geometry()));
    }
    result.set("properties", mapper.valueToTree(feature.properties()));
    return result;
  }

  private ObjectNode crs(SpatialReferenceSystem system) {
    String name = system.organization().toUpperCase(Locale.ROOT).equals("EPSG") ?
      "urn:ogc:def:crs:EPSG::" + system.organizationCoordsysId() :
      "urn:ogc:def:crs:" + system.organization() + "::" + system.organizationCoordsysId();
    ObjectNode crs = mapper.createObjectNode();
    crs.put("type", "name");
    crs.putObject("properties").put("name", name);
    return crs;
  }

  /**
   * Parses a GeoJSON {@code FeatureCollection} and imports it.
   *
   * @throws IllegalArgumentException if {@code json} is not valid JSON
   */
  public ImportResult fromGeoJson(String json, ImportOptions options) {
    try {
      return fromGeoJson(mapper.readTree(json), options);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid GeoJSON: " + e.getOriginalMessage(), e);
    }
  }

  /** Reads a GeoJSON {@code FeatureCollection} file and imports it. */
  public ImportResult fromGeoJson(Path input, ImportOptions options) throws IOException {
    try (var reader = Files.newBufferedReader(input)) {
      return fromGeoJson(mapper.readTree(reader), options);
    }
  }

  /**
   * Stores every feature of a GeoJSON {@code FeatureCollection} in a new table, or in an existing one when
   * {@link ImportOptions#append()} is set.
   *
   * @throws IllegalArgumentException if {@code json} is not a feature collection with at least one feature, or the
   *                                  table cannot be created
   */
  public ImportResult fromGeoJson(JsonNode json, ImportOptions options) {
    if (json == null || !"FeatureCollection".equals(json.path("type").asText())) {
      throw new IllegalArgumentException("Input must be a GeoJSON FeatureCollection");
    }
    JsonNode featureArray = json.path("features");
    if (!featureArray.isArray() || featureArray.isEmpty()) {
      throw new IllegalArgumentException("FeatureCollection must contain at least one feature");
    }
    String tableName = options.tableName();
    List<ParsedFeature> parsed = parse(featureArray);

    return db.inTransaction(() -> {
      List<String> columns;
      if (options.append()) {
        columns = features.propertyColumns(tableName);
      } else {
        FeatureTableConfig config = inferSchema(tableName, options, detectSrs(json, options), parsed);
        features.createFeatureTable(config);
        columns = config.columns().stream().map(ColumnDefinition::name).toList();
      }
      int inserted = 0;
      int skipped = 0;
      for (ParsedFeature feature : parsed) {
        if (feature.error != null) {
          feature.error.log("Skipping feature " + feature.index + " of " + tableName);
          skipped++;
          continue;
        }
        try {
          features.insert(tableName, feature.geometry, properties(feature.properties, columns));
          inserted++;
        } catch (GeometryException e) {
          e.log("Skipping feature " + feature.index + " of " + tableName);
          skipped++;
        }
      }
      LOGGER.info("Imported {} features into {}, skipped {}", inserted, tableName, skipped);
      return new ImportResult(tableName, inserted, skipped);
    });
  }

  private record ParsedFeature(int index, Geometry geometry, JsonNode properties, GeometryException error) {}

  private static List<ParsedFeature> parse(JsonNode featureArray) {
    List<ParsedFeature> result = new ArrayList<>();
    int index = 0;
    for (JsonNode feature : featureArray) {
      if (!"Feature".equals(feature.path("type").asText())) {
        LOGGER.warn("Ignoring member {} of the collection with type {}", index, feature.path("type"));
      } else {
        JsonNode geometry = feature.path("geometry");
        try {
          Geometry parsed = geometry.isObject() ? GeoJsonGeometries.fromJson(geometry) : null;
          result.add(new ParsedFeature(index, parsed, feature.path("properties"), null));
        } catch (GeometryException e) {
          result.add(new ParsedFeature(index, null, feature.path("properties"), e));
        }
      }
      index++;
    }
    return result;
  }

  private int detectSrs(JsonNode json, ImportOptions options) {
    if (options.srsId() != null) {
      return options.srsId();
    }
    String name = json.path("crs").path("properties").path("name").asText("");
    Matcher matcher = EPSG_CODE.matcher(name);
    if (matcher.find()) {
      return Integer.parseInt(matcher.group(1));
    }
    if (!name.isEmpty() && !CRS84.matcher(name).find()) {
      LOGGER.warn("Unrecognized crs {}, assuming EPSG:{}", name, SpatialReferenceSystems.WGS84);
    }
    return SpatialReferenceSystems.WGS84;
  }

  private static FeatureTableConfig inferSchema(String tableName, ImportOptions options, int srsId,
    List<ParsedFeature> parsed) {
    Set<GeometryType> types = EnumSet.noneOf(GeometryType.class);
    int maxTupleLength = 2;
    Map<String, Set<String>> columnTypes = new LinkedHashMap<>();
    Set<String> reserved = Set.of("id", options.geometryColumn());
    Set<String> ignored = new HashSet<>();
    for (ParsedFeature feature : parsed) {
      if (feature.geometry != null) {
        types.add(GeometryType.valueOf(feature.geometry));
        maxTupleLength = Math.max(maxTupleLength, maxTupleLength(feature.geometry));
      }
      var fields = feature.properties.fields();
      while (fields.hasNext()) {
        var field = fields.next();
        String name = field.getKey();
        if (!SqlNames.isValid(name) || reserved.contains(name)) {
          if (ignored.add(name)) {
            LOGGER.warn("Property {} of {} cannot be stored as a column, leaving it out", name, tableName);
          }
          continue;
        }
        Set<String> sqlTypes = columnTypes.computeIfAbsent(name, key -> new HashSet<>());
        String sqlType = sqlType(field.getValue());
        if (sqlType != null) {
          sqlTypes.add(sqlType);
        }
      }
    }
    List<ColumnDefinition> columns = new ArrayList<>();
    columnTypes.forEach((name, sqlTypes) -> columns.add(ColumnDefinition.of(name, combine(sqlTypes))));
    GeometryType geometryType = types.size() == 1 ? types.iterator().next() : GeometryType.GEOMETRY;
    return FeatureTableConfig.of(tableName, geometryType, srsId)
      .withGeometryColumn(options.geometryColumn())
      .withDimensions(maxTupleLength >= 3 ? ZmPolicy.OPTIONAL : ZmPolicy.PROHIBITED,
        maxTupleLength >= 4 ? ZmPolicy.OPTIONAL : ZmPolicy.PROHIBITED)
      .withColumns(columns);
  }

  private static int maxTupleLength(Geometry geometry) {
    int result = 2;
    for (var coordinate : geometry.getCoordinates()) {
      result = Math.max(result, GeoUtils.tupleLength(coordinate));
    }
    return result;
  }

  /** Returns the sql type for one property value, or null for a JSON null that says nothing about the type. */
  private static String sqlType(JsonNode value) {
    if (value.isNull()) {
      return null;
    } else if (value.isBoolean() || value.isIntegralNumber()) {
      return "INTEGER";
    } else if (value.isNumber()) {
      return "REAL";
    } else if (value.isBinary()) {
      return "BLOB";
    }
    return "TEXT";
  }

  private static String combine(Set<String> sqlTypes) {
    if (sqlTypes.size() == 1) {
      return sqlTypes.iterator().next();
    } else if (sqlTypes.equals(Set.of("INTEGER", "REAL"))) {
      return "REAL";
    }
    return "TEXT";
  }

  private Map<String, Object> properties(JsonNode json, List<String> columns) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (String column : columns) {
      JsonNode value = json.get(column);
      if (value != null) {
        result.put(column, value(value));
      }
    }
    return result;
  }

  private Object value(JsonNode value) {
    if (value.isNull()) {
      return null;
    } else if (value.isBoolean()) {
      return value.booleanValue();
    } else if (value.isIntegralNumber() && value.canConvertToLong()) {
      return value.longValue();
    } else if (value.isNumber()) {
      return value.doubleValue();
    } else if (value.isTextual()) {
      return value.textValue();
    }
    // nested objects and arrays are stored as JSON text
    return value.toString();
  }
}
