package com.onthegomap.gpkg.examples;

import com.onthegomap.gpkg.GeoPackage;
import com.onthegomap.gpkg.config.Arguments;
import com.onthegomap.gpkg.features.ColumnDefinition;
import com.onthegomap.gpkg.features.FeatureQuery;
import com.onthegomap.gpkg.features.FeatureTableConfig;
import com.onthegomap.gpkg.geo.GeoUtils;
import com.onthegomap.gpkg.geo.GeometryException;
import com.onthegomap.gpkg.geo.GeometryType;
import com.onthegomap.gpkg.geojson.ExportOptions;
import com.onthegomap.gpkg.schema.DataColumn;
import com.onthegomap.gpkg.schema.SpatialReferenceSystems;
import com.onthegomap.gpkg.tiles.Tile;
import com.onthegomap.gpkg.tiles.TileMatrix;
import com.onthegomap.gpkg.tiles.TileMatrixSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a small geopackage with a feature table of cities, a tile pyramid and an attribute table of populations,
 * then exports the cities as GeoJSON.
 *
 * <p>To run this example:
 *
 * <ol>
 *   <li>build the examples: {@code mvn clean package}</li>
 *   <li>then run: {@code java -cp target/*.jar com.onthegomap.gpkg.examples.CityPackage output=data/cities.gpkg
 *   geojson=data/cities.geojson bounds=-125,30,-110,50}</li>
 *   <li>then open {@code data/cities.gpkg} in any GIS that reads geopackages</li>
 * </ol>
 */
public class CityPackage {

  private static final Logger LOGGER = LoggerFactory.getLogger(CityPackage.class);

  static final String CITIES = "cities";
  static final String BASEMAP = "basemap";
  static final String POPULATION = "population";

  // just enough of a PNG for the tile store to recognize its signature
  private static final byte[] PLACEHOLDER_PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0};

  private record City(String name, String country, double lon, double lat, long population) {}

  private static final List<City> DATA = List.of(
    new City("San Francisco", "US", -122.4, 37.8, 815_201),
    new City("Seattle", "US", -122.3, 47.6, 755_078),
    new City("Vancouver", "CA", -123.1, 49.3, 662_248),
    new City("Denver", "US", -105, 39.75, 716_577),
    new City("Mexico City", "MX", -99.125, 19.375, 9_209_944)
  );

  public static void main(String[] args) throws Exception {
    run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging());
  }

  /** Writes the geopackage and returns the names of the cities inside {@code bounds}. */
  static List<String> run(Arguments inArgs) throws IOException, GeometryException {
    var args = inArgs.orElse(Arguments.of(
      "spatial_index", true,
      "envelope", "xy"
    ));
    Path output = args.file("output", "geopackage file to write", Path.of("data", "cities.gpkg"));
    Path geojson = args.file("geojson", "GeoJSON file to export cities to", null);
    Envelope bounds = args.bounds("bounds", "only report cities inside minLon,minLat,maxLon,maxLat");
    int maxZoom = args.getInteger("maxzoom", "deepest zoom level of the basemap", 2);

    if (output.getParent() != null) {
      Files.createDirectories(output.getParent());
    }
    Files.deleteIfExists(output);

    try (GeoPackage gpkg = GeoPackage.create(output, args)) {
      writeCities(gpkg);
      writeBasemap(gpkg, maxZoom);
      writePopulation(gpkg);

      if (geojson != null) {
        gpkg.geoJson().writeGeoJson(CITIES, geojson, ExportOptions.defaults());
        LOGGER.info("Wrote {}", geojson);
      }

      FeatureQuery query = bounds == null ? FeatureQuery.all() : FeatureQuery.intersecting(bounds);
      List<String> found = gpkg.features().query(CITIES, query).stream()
        .map(feature -> (String) feature.getProperty("name"))
        .toList();
      LOGGER.info("{} cities in {}: {}", found.size(), bounds == null ? "total" : bounds, found);
      return found;
    }
  }

  private static void writeCities(GeoPackage gpkg) throws GeometryException {
    gpkg.features().createFeatureTable(
      FeatureTableConfig.of(CITIES, GeometryType.POINT, SpatialReferenceSystems.WGS84)
        .withDescription("Large cities of North America")
        .withColumns(
          ColumnDefinition.of("name", "TEXT").withNotNull(),
          ColumnDefinition.of("country", "TEXT(2)")
        )
    );
    for (City city : DATA) {
      gpkg.features().insert(CITIES, GeoUtils.point(city.lon, city.lat), Map.of(
        "name", city.name,
        "country", city.country
      ));
    }
    gpkg.features().updateContentsBounds(CITIES);
  }

  private static void writeBasemap(GeoPackage gpkg, int maxZoom) {
    var set = new TileMatrixSet(BASEMAP, SpatialReferenceSystems.WEB_MERCATOR,
      new Envelope(-20037508.342789244, 20037508.342789244, -20037508.342789244, 20037508.342789244));
    gpkg.tiles().createTileTable(set);
    for (int z = 0; z <= maxZoom; z++) {
      gpkg.tiles().addTileMatrix(TileMatrix.quadTree(set, z, 256));
    }
    try (var writer = gpkg.tiles().newTileWriter(BASEMAP)) {
      for (int z = 0; z <= maxZoom; z++) {
        int tiles = 1 << z;
        for (int x = 0; x < tiles; x++) {
          for (int y = 0; y < tiles; y++) {
            writer.write(Tile.of(z, x, y, PLACEHOLDER_PNG));
          }
        }
      }
    }
  }

  private static void writePopulation(GeoPackage gpkg) {
    gpkg.attributes().createAttributeTable(POPULATION, List.of(
      ColumnDefinition.of("city", "TEXT").withNotNull(),
      ColumnDefinition.of("population", "INTEGER")
    ), "City populations");
    gpkg.dataColumns().addRangeConstraint("positive", 0d, true, null, false, "population is never negative");
    gpkg.dataColumns().add(new DataColumn(POPULATION, "population", "Population", "positive"));
    gpkg.runInTransaction(() -> {
      for (City city : DATA) {
        gpkg.dataColumns().validate("positive", city.population);
        gpkg.attributes().insert(POPULATION, Map.of("city", city.name, "population", city.population));
      }
    });
  }
}
