package com.onthegomap.gpkg.db;

import java.util.regex.Pattern;

/** Validation and quoting for table and column names that get concatenated into SQL. */
public class SqlNames {

  private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

  // should not instantiate
  private SqlNames() {}

  public static boolean isValid(String name) {
    return name != null && IDENTIFIER.matcher(name).matches();
  }

  /**
   * Returns {@code name} if it is a letter or underscore followed by letters, digits or underscores.
   *
   * @throws IllegalArgumentException otherwise
   */
  public static String validate(String name, String kind) {
    if (!isValid(name)) {
      throw new IllegalArgumentException("Invalid " + kind + " name: " + name);
    }
    return name;
  }

  public static String validateTable(String name) {
    return validate(name, "table");
  }

  public static String validateColumn(String name) {
    return validate(name, "column");
  }

  /** Returns {@code name} wrapped in double quotes, with embedded quotes doubled. */
  public static String quote(String name) {
    return "\"" + name.replace("\"", "\"\"") + "\"";
  }
}
