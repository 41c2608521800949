package com.onthegomap.gpkg.schema;

/**
 * A row of {@code gpkg_data_columns} with human-readable metadata about one column of a user table.
 *
 * @param tableName      user table
 * @param columnName     column in that table
 * @param name           short name
 * @param title          formal title
 * @param description    description
 * @param mimeType       MIME type of values in a BLOB column
 * @param constraintName name of the constraint in {@code gpkg_data_column_constraints} that values must satisfy
 */
public record DataColumn(
  String tableName,
  String columnName,
  String name,
  String title,
  String description,
  String mimeType,
  String constraintName
) {

  public DataColumn(String tableName, String columnName, String title, String constraintName) {
    this(tableName, columnName, columnName, title, null, null, constraintName);
  }
}
