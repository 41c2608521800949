package com.onthegomap.gpkg.examples;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.gpkg.GeoPackage;
import com.onthegomap.gpkg.config.Arguments;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CityPackageTest {

  @TempDir
  Path tmpDir;

  @Test
  void testWritesEverything() throws Exception {
    Path output = tmpDir.resolve("out").resolve("cities.gpkg");
    Path geojson = tmpDir.resolve("cities.geojson");
    List<String> found = CityPackage.run(Arguments.of(
      "output", output,
      "geojson", geojson,
      "bounds", "-125,30,-110,50",
      "maxzoom", 1
    ));
    assertEquals(List.of("San Francisco", "Seattle", "Vancouver"), found);
    assertTrue(Files.readString(geojson).contains("\"Mexico City\""));

    try (var gpkg = GeoPackage.openReadOnly(output, Arguments.of())) {
      assertEquals(GeoPackage.APPLICATION_ID, gpkg.applicationId());
      assertEquals(5, gpkg.features().count(CityPackage.CITIES));
      assertTrue(gpkg.spatialIndex().hasIndex(CityPackage.CITIES));
      assertEquals(1 + 4, gpkg.tiles().countTiles(CityPackage.BASEMAP, null));
      assertEquals(List.of(0, 1), gpkg.tiles().zoomLevels(CityPackage.BASEMAP));
      assertEquals(5, gpkg.attributes().count(CityPackage.POPULATION));
      assertEquals("positive",
        gpkg.dataColumns().get(CityPackage.POPULATION, "population").orElseThrow().constraintName());
    }
  }

  @Test
  void testNoBoundsReturnsAllCities() throws Exception {
    List<String> found = CityPackage.run(Arguments.of(
      "output", tmpDir.resolve("all.gpkg"),
      "maxzoom", 0
    ));
    assertEquals(5, found.size());
  }
}
