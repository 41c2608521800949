package com.onthegomap.gpkg.schema;

/**
 * A row of {@code gpkg_extensions} that records an extension used by the whole geopackage, a table, or a column.
 *
 * @param tableName     table the extension applies to, or null for the whole geopackage
 * @param columnName    column the extension applies to, or null for a whole table
 * @param extensionName name like {@code gpkg_rtree_index}
 * @param definition    URL or other reference to the extension definition
 * @param scope         whether readers need to know about the extension
 */
public record Extension(
  String tableName,
  String columnName,
  String extensionName,
  String definition,
  Scope scope
) {

  /** Whether an extension affects reading the geopackage or only writing to it. */
  public enum Scope {
    READ_WRITE("read-write"),
    WRITE_ONLY("write-only");

    private final String value;

    Scope(String value) {
      this.value = value;
    }

    public String value() {
      return value;
    }

    public static Scope fromValue(String value) {
      for (Scope scope : values()) {
        if (scope.value.equals(value)) {
          return scope;
        }
      }
      throw new IllegalArgumentException("Invalid extension scope: " + value);
    }
  }
}
