package com.onthegomap.gpkg.schema;

import static com.onthegomap.gpkg.TestUtils.newGeoPackage;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.gpkg.GeoPackage;
import com.onthegomap.gpkg.features.ColumnDefinition;
import com.onthegomap.gpkg.features.FeatureTableConfig;
import com.onthegomap.gpkg.geo.GeometryType;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DataColumnsTest {

  private final GeoPackage gpkg = newGeoPackage();
  private final DataColumns dataColumns = gpkg.dataColumns();

  @BeforeEach
  void createTable() {
    gpkg.features().createFeatureTable(FeatureTableConfig.of("parks", GeometryType.POLYGON, 4326)
      .withColumns(ColumnDefinition.of("name", "TEXT"), ColumnDefinition.of("area", "REAL"),
        ColumnDefinition.of("kind", "TEXT")));
  }

  @AfterEach
  void close() {
    gpkg.close();
  }

  @Test
  void testTablesCreatedOnFirstUse() {
    assertFalse(gpkg.db().tableExists(DataColumns.TABLE));
    assertEquals(List.of(), dataColumns.list());
    assertEquals(List.of(), dataColumns.constraintNames());
    dataColumns.add(new DataColumn("parks", "name", "Park name", null));
    assertTrue(gpkg.db().tableExists(DataColumns.TABLE));
    assertTrue(gpkg.db().tableExists(DataColumns.CONSTRAINTS_TABLE));
  }

  @Test
  void testAddRegistersSchemaExtension() {
    DataColumn column = new DataColumn("parks", "name", "park_name", "Park name", "Official name", "text/plain",
      null);
    dataColumns.add(column);
    assertEquals(column, dataColumns.get("parks", "name").orElseThrow());
    assertTrue(dataColumns.exists("parks", "name"));
    assertTrue(gpkg.extensions().exists(Extensions.SCHEMA, "parks", "name"));
    assertEquals(List.of(column), dataColumns.list("parks"));
  }

  @Test
  void testAddErrors() {
    dataColumns.add(new DataColumn("parks", "name", "Park name", null));
    assertThrows(IllegalArgumentException.class,
      () -> dataColumns.add(new DataColumn("parks", "name", "again", null)));
    assertThrows(IllegalArgumentException.class,
      () -> dataColumns.add(new DataColumn("missing", "name", "x", null)));
    assertThrows(IllegalArgumentException.class,
      () -> dataColumns.add(new DataColumn("parks", "area", "Area", "no_such_constraint")));
  }

  @Test
  void testUpdateAndDelete() {
    dataColumns.addRangeConstraint("positive", 0d, false, null, true, "greater than zero");
    dataColumns.add(new DataColumn("parks", "area", "Area", null));
    dataColumns.update(new DataColumn("parks", "area", "Area in m2", "positive"));
    assertEquals("positive", dataColumns.get("parks", "area").orElseThrow().constraintName());
    assertEquals("Area in m2", dataColumns.get("parks", "area").orElseThrow().title());
    assertThrows(IllegalArgumentException.class,
      () -> dataColumns.update(new DataColumn("parks", "kind", "Kind", null)));

    dataColumns.delete("parks", "area");
    assertFalse(dataColumns.exists("parks", "area"));
    assertThrows(IllegalArgumentException.class, () -> dataColumns.delete("parks", "area"));
  }

  @Test
  void testRangeConstraint() {
    dataColumns.addRangeConstraint("percent", 0d, true, 100d, false, "0 to 100 exclusive");
    assertEquals(List.of(DataColumnConstraint.range("percent", 0d, true, 100d, false, "0 to 100 exclusive")),
      dataColumns.constraints("percent"));
    assertThrows(IllegalArgumentException.class,
      () -> dataColumns.addRangeConstraint("nothing", null, true, null, true, null));
  }

  @ParameterizedTest
  @CsvSource({
    "0, true",
    "50.5, true",
    "99.999, true",
    "100, false",
    "-0.1, false",
  })
  void testValidateRange(double value, boolean valid) {
    dataColumns.addRangeConstraint("percent", 0d, true, 100d, false, null);
    if (valid) {
      assertDoesNotThrow(() -> dataColumns.validate("percent", value));
    } else {
      assertThrows(IllegalArgumentException.class, () -> dataColumns.validate("percent", value));
    }
  }

  @Test
  void testValidateRangeNeedsNumber() {
    dataColumns.addRangeConstraint("positive", 0d, false, null, true, null);
    assertThrows(IllegalArgumentException.class, () -> dataColumns.validate("positive", "5"));
    assertThrows(IllegalArgumentException.class, () -> dataColumns.validate("positive", 0));
    dataColumns.validate("positive", 1L);
  }

  @Test
  void testEnumConstraint() {
    dataColumns.addEnumConstraint("park_kind", "kinds of park", "national", "city", "state");
    assertEquals(List.of("city", "national", "state"), dataColumns.enumValues("park_kind"));
    dataColumns.validate("park_kind", "city");
    assertThrows(IllegalArgumentException.class, () -> dataColumns.validate("park_kind", "county"));

    dataColumns.deleteEnumValue("park_kind", "city");
    assertEquals(List.of("national", "state"), dataColumns.enumValues("park_kind"));
    assertThrows(IllegalArgumentException.class, () -> dataColumns.deleteEnumValue("park_kind", "city"));
    assertThrows(IllegalArgumentException.class, () -> dataColumns.addEnumConstraint("empty", null));
    assertThrows(IllegalArgumentException.class, () -> dataColumns.addEnumConstraint("blank", null, "a", ""));
    assertFalse(dataColumns.constraintExists("blank"));
  }

  @ParameterizedTest
  @CsvSource({
    "P-*, P-123, true",
    "P-*, P-, true",
    "P-*, Q-1, false",
    "??-1, AB-1, true",
    "??-1, ABC-1, false",
    "a.b*, a.bc, true",
    "a.b*, axbc, false",
  })
  void testGlobConstraint(String pattern, String value, boolean valid) {
    dataColumns.addGlobConstraint("code", pattern, null);
    if (valid) {
      assertDoesNotThrow(() -> dataColumns.validate("code", value));
    } else {
      assertThrows(IllegalArgumentException.class, () -> dataColumns.validate("code", value));
    }
  }

  @Test
  void testConstraintNamesAndDelete() {
    dataColumns.addRangeConstraint("positive", 0d, false, null, true, null);
    dataColumns.addGlobConstraint("code", "P-*", null);
    assertEquals(List.of("code", "positive"), dataColumns.constraintNames());

    dataColumns.add(new DataColumn("parks", "area", "Area", "positive"));
    assertThrows(IllegalArgumentException.class, () -> dataColumns.deleteConstraint("positive"));
    dataColumns.delete("parks", "area");
    dataColumns.deleteConstraint("positive");
    assertFalse(dataColumns.constraintExists("positive"));
    assertThrows(IllegalArgumentException.class, () -> dataColumns.deleteConstraint("positive"));
    assertThrows(IllegalArgumentException.class, () -> dataColumns.validate("positive", 1));
  }

  @Test
  void testDeleteForTable() {
    dataColumns.add(new DataColumn("parks", "name", "Name", null));
    dataColumns.add(new DataColumn("parks", "kind", "Kind", null));
    dataColumns.deleteForTable("parks");
    assertEquals(List.of(), dataColumns.list("parks"));
  }
}
