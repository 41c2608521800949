package com.onthegomap.gpkg.schema;

import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads and writes {@code gpkg_data_columns} and {@code gpkg_data_column_constraints}, and checks values against
 * constraints.
 * <p>
 * Describing a column registers the {@code gpkg_schema} extension for it.
 */
public class DataColumns {

  public static final String TABLE = "gpkg_data_columns";
  public static final String CONSTRAINTS_TABLE = "gpkg_data_column_constraints";
  private static final String SCHEMA_DEFINITION = "http://www.geopackage.org/spec120/#extension_schema";

  private static final String COLUMNS =
    "table_name, column_name, name, title, description, mime_type, constraint_name";
  private static final String CONSTRAINT_COLUMNS =
    "constraint_name, constraint_type, value, min, min_is_inclusive, max, max_is_inclusive, description";

  private final Sqlite db;
  private final Contents contents;
  private final Extensions extensions;

  public DataColumns(Sqlite db, Contents contents, Extensions extensions) {
    this.db = db;
    this.contents = contents;
    this.extensions = extensions;
  }

  private void createTables() {
    if (db.tableExists(TABLE)) {
      return;
    }
    db.execute("""
      CREATE TABLE IF NOT EXISTS %s (
        table_name TEXT NOT NULL,
        column_name TEXT NOT NULL,
        name TEXT,
        title TEXT,
        description TEXT,
        mime_type TEXT,
        constraint_name TEXT,
        CONSTRAINT pk_gdc PRIMARY KEY (table_name, column_name),
        CONSTRAINT fk_gdc_tn FOREIGN KEY (table_name) REFERENCES %s(table_name)
      )
      """.formatted(TABLE, Contents.TABLE), """
      CREATE TABLE IF NOT EXISTS %s (
        constraint_name TEXT NOT NULL,
        constraint_type TEXT NOT NULL,
        value TEXT,
        min NUMERIC,
        min_is_inclusive INTEGER,
        max NUMERIC,
        max_is_inclusive INTEGER,
        description TEXT,
        CONSTRAINT gdcc_ntv UNIQUE (constraint_name, constraint_type, value)
      )
      """.formatted(CONSTRAINTS_TABLE));
  }

  /**
   * Describes a column of a registered table.
   *
   * @throws IllegalArgumentException if the table is not registered, the column is already described, or the
   *                                  constraint does not exist
   */
  public void add(DataColumn column) {
    SqlNames.validateTable(column.tableName());
    SqlNames.validateColumn(column.columnName());
    createTables();
    if (!contents.exists(column.tableName())) {
      throw new IllegalArgumentException("Table " + column.tableName() + " not found in " + Contents.TABLE);
    }
    if (exists(column.tableName(), column.columnName())) {
      throw new IllegalArgumentException(
        "Data column definition already exists for " + column.tableName() + "." + column.columnName());
    }
    checkConstraint(column.constraintName());
    db.update("INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
      column.tableName(), column.columnName(), column.name(), column.title(), column.description(),
      column.mimeType(), column.constraintName());
    extensions.registerIfAbsent(new Extension(column.tableName(), column.columnName(), Extensions.SCHEMA,
      SCHEMA_DEFINITION, Extension.Scope.READ_WRITE));
  }

  public Optional<DataColumn> get(String tableName, String columnName) {
    if (!db.tableExists(TABLE)) {
      return Optional.empty();
    }
    return db.queryFirst("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE table_name = ? AND column_name = ?",
      DataColumns::readColumn, tableName, columnName);
  }

  public boolean exists(String tableName, String columnName) {
    return get(tableName, columnName).isPresent();
  }

  public List<DataColumn> list(String tableName) {
    if (!db.tableExists(TABLE)) {
      return List.of();
    }
    return db.query("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE table_name = ? ORDER BY column_name",
      DataColumns::readColumn, tableName);
  }

  public List<DataColumn> list() {
    if (!db.tableExists(TABLE)) {
      return List.of();
    }
    return db.query("SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY table_name, column_name",
      DataColumns::readColumn);
  }

  public void update(DataColumn column) {
    checkConstraint(column.constraintName());
    int changed = !db.tableExists(TABLE) ? 0 : db.update("""
      UPDATE %s SET name = ?, title = ?, description = ?, mime_type = ?, constraint_name = ?
      WHERE table_name = ? AND column_name = ?
      """.formatted(TABLE),
      column.name(), column.title(), column.description(), column.mimeType(), column.constraintName(),
      column.tableName(), column.columnName());
    if (changed == 0) {
      throw new IllegalArgumentException(
        "Data column definition not found for " + column.tableName() + "." + column.columnName());
    }
  }

  public void delete(String tableName, String columnName) {
    int changed = !db.tableExists(TABLE) ? 0 :
      db.update("DELETE FROM " + TABLE + " WHERE table_name = ? AND column_name = ?", tableName, columnName);
    if (changed == 0) {
      throw new IllegalArgumentException("Data column definition not found for " + tableName + "." + columnName);
    }
  }

  /** Removes every column description of {@code tableName}. */
  public void deleteForTable(String tableName) {
    if (db.tableExists(TABLE)) {
      db.update("DELETE FROM " + TABLE + " WHERE table_name = ?", tableName);
    }
  }

  /** Adds a range constraint, at least one of {@code min} and {@code max} must be set. */
  public void addRangeConstraint(String name, Double min, boolean minIsInclusive, Double max, boolean maxIsInclusive,
    String description) {
    if (min == null && max == null) {
      throw new IllegalArgumentException("Range constraint must have at least min or max value");
    }
    addConstraint(DataColumnConstraint.range(name, min, minIsInclusive, max, maxIsInclusive, description));
  }

  /** Adds one row per allowed value of an enum constraint. */
  public void addEnumConstraint(String name, String description, String... values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("Enum constraint must have a value");
    }
    db.runInTransaction(() -> {
      for (String value : values) {
        if (value == null || value.isEmpty()) {
          throw new IllegalArgumentException("Enum constraint must have a value");
        }
        addConstraint(DataColumnConstraint.enumValue(name, value, description));
      }
    });
  }

  /** Adds a glob constraint where {@code *} matches any run of characters and {@code ?} matches one character. */
  public void addGlobConstraint(String name, String pattern, String description) {
    if (pattern == null || pattern.isEmpty()) {
      throw new IllegalArgumentException("Glob constraint must have a pattern value");
    }
    addConstraint(DataColumnConstraint.glob(name, pattern, description));
  }

  private void addConstraint(DataColumnConstraint constraint) {
    createTables();
    db.update("INSERT INTO " + CONSTRAINTS_TABLE + " (" + CONSTRAINT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
      constraint.constraintName(),
      constraint.type().value(),
      constraint.value(),
      constraint.min(),
      constraint.minIsInclusive() == null ? null : (constraint.minIsInclusive() ? 1 : 0),
      constraint.max(),
      constraint.maxIsInclusive() == null ? null : (constraint.maxIsInclusive() ? 1 : 0),
      constraint.description()
    );
  }

  /** Returns every row of a constraint ordered by type then value. */
  public List<DataColumnConstraint> constraints(String name) {
    if (!db.tableExists(CONSTRAINTS_TABLE)) {
      return List.of();
    }
    return db.query("SELECT " + CONSTRAINT_COLUMNS + " FROM " + CONSTRAINTS_TABLE +
      " WHERE constraint_name = ? ORDER BY constraint_type, value", DataColumns::readConstraint, name);
  }

  public List<String> enumValues(String name) {
    return constraints(name).stream()
      .filter(c -> c.type() == DataColumnConstraint.Type.ENUM)
      .map(DataColumnConstraint::value)
      .toList();
  }

  public List<String> constraintNames() {
    if (!db.tableExists(CONSTRAINTS_TABLE)) {
      return List.of();
    }
    return db.query("SELECT DISTINCT constraint_name FROM " + CONSTRAINTS_TABLE + " ORDER BY constraint_name",
      rs -> rs.getString(1));
  }

  public boolean constraintExists(String name) {
    return !constraints(name).isEmpty();
  }

  /**
   * Deletes every row of a constraint.
   *
   * @throws IllegalArgumentException if a data column still refers to it or it does not exist
   */
  public void deleteConstraint(String name) {
    long references = db.tableExists(TABLE) ?
      db.queryLong("SELECT count(*) FROM " + TABLE + " WHERE constraint_name = ?", name) : 0;
    if (references > 0) {
      throw new IllegalArgumentException(
        "Cannot delete constraint " + name + ": it is referenced by " + references + " data column(s)");
    }
    int changed = !db.tableExists(CONSTRAINTS_TABLE) ? 0 :
      db.update("DELETE FROM " + CONSTRAINTS_TABLE + " WHERE constraint_name = ?", name);
    if (changed == 0) {
      throw new IllegalArgumentException("Constraint " + name + " not found");
    }
  }

  public void deleteEnumValue(String name, String value) {
    int changed = !db.tableExists(CONSTRAINTS_TABLE) ? 0 : db.update(
      "DELETE FROM " + CONSTRAINTS_TABLE + " WHERE constraint_name = ? AND constraint_type = 'enum' AND value = ?",
      name, value);
    if (changed == 0) {
      throw new IllegalArgumentException("Enum value '" + value + "' not found in constraint " + name);
    }
  }

  /**
   * Checks {@code value} against every row of a constraint: range rows need a number within bounds, enum rows need
   * the string form of the value to be one of the allowed values, and glob rows need it to match the pattern.
   *
   * @throws IllegalArgumentException if the value does not satisfy the constraint or the constraint does not exist
   */
  public void validate(String constraintName, Object value) {
    List<DataColumnConstraint> rows = constraints(constraintName);
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("Constraint " + constraintName + " not found");
    }
    List<String> allowed = rows.stream()
      .filter(c -> c.type() == DataColumnConstraint.Type.ENUM)
      .map(DataColumnConstraint::value)
      .toList();
    if (!allowed.isEmpty() && !allowed.contains(String.valueOf(value))) {
      throw new IllegalArgumentException(
        "Value '" + value + "' is not in allowed values: " + String.join(", ", allowed));
    }
    for (var constraint : rows) {
      if (constraint.type() == DataColumnConstraint.Type.RANGE) {
        checkRange(constraint, value);
      } else if (constraint.type() == DataColumnConstraint.Type.GLOB &&
        !globToRegex(constraint.value()).matcher(String.valueOf(value)).matches()) {
        throw new IllegalArgumentException(
          "Value '" + value + "' does not match pattern '" + constraint.value() + "'");
      }
    }
  }

  private static void checkRange(DataColumnConstraint constraint, Object value) {
    if (!(value instanceof Number number)) {
      throw new IllegalArgumentException(
        "Value must be a number for range constraint " + constraint.constraintName());
    }
    double v = number.doubleValue();
    Double min = constraint.min();
    Double max = constraint.max();
    boolean minInclusive = !Boolean.FALSE.equals(constraint.minIsInclusive());
    boolean maxInclusive = !Boolean.FALSE.equals(constraint.maxIsInclusive());
    if (min != null && (minInclusive ? v < min : v <= min)) {
      throw new IllegalArgumentException("Value " + value + (minInclusive ? " is less than minimum " :
        " must be greater than ") + min);
    }
    if (max != null && (maxInclusive ? v > max : v >= max)) {
      throw new IllegalArgumentException("Value " + value + (maxInclusive ? " is greater than maximum " :
        " must be less than ") + max);
    }
  }

  /** Returns a regular expression for a glob where {@code *} matches anything and {@code ?} matches one char. */
  static Pattern globToRegex(String glob) {
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char c : glob.toCharArray()) {
      if (c == '*' || c == '?') {
        if (!literal.isEmpty()) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (!literal.isEmpty()) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  private void checkConstraint(String constraintName) {
    if (constraintName != null && !constraintExists(constraintName)) {
      throw new IllegalArgumentException("Constraint " + constraintName + " not found");
    }
  }

  private static DataColumn readColumn(ResultSet rs) throws SQLException {
    return new DataColumn(
      rs.getString("table_name"),
      rs.getString("column_name"),
      rs.getString("name"),
      rs.getString("title"),
      rs.getString("description"),
      rs.getString("mime_type"),
      rs.getString("constraint_name")
    );
  }

  private static DataColumnConstraint readConstraint(ResultSet rs) throws SQLException {
    return new DataColumnConstraint(
      rs.getString("constraint_name"),
      DataColumnConstraint.Type.fromValue(rs.getString("constraint_type")),
      rs.getString("value"),
      readDouble(rs, "min"),
      readBoolean(rs, "min_is_inclusive"),
      readDouble(rs, "max"),
      readBoolean(rs, "max_is_inclusive"),
      rs.getString("description")
    );
  }

  private static Double readDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }

  private static Boolean readBoolean(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value == 1;
  }
}
