package com.onthegomap.gpkg.attributes;

import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import com.onthegomap.gpkg.db.UserRows;
import com.onthegomap.gpkg.features.ColumnDefinition;
import com.onthegomap.gpkg.schema.Content;
import com.onthegomap.gpkg.schema.Contents;
import com.onthegomap.gpkg.schema.DataColumns;
import com.onthegomap.gpkg.schema.DataType;
import com.onthegomap.gpkg.schema.Extensions;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Creates non-spatial attribute tables and reads and writes their rows. */
public class AttributeStore {

  private static final String ID = "id";

  private final Sqlite db;
  private final Contents contents;
  private final Extensions extensions;
  private final DataColumns dataColumns;

  public AttributeStore(Sqlite db, Contents contents, Extensions extensions, DataColumns dataColumns) {
    this.db = db;
    this.contents = contents;
    this.extensions = extensions;
    this.dataColumns = dataColumns;
  }

  /**
   * Creates an attribute table with an {@code id} primary key and {@code columns}, and registers it in
   * {@code gpkg_contents} without an srs.
   *
   * @throws IllegalArgumentException if the name is invalid or taken, there are no columns, or a column repeats
   */
  public void createAttributeTable(String tableName, List<ColumnDefinition> columns, String description) {
    SqlNames.validateTable(tableName);
    if (contents.exists(tableName) || db.tableExists(tableName)) {
      throw new IllegalArgumentException("Table " + tableName + " already exists");
    }
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("Attribute table must have at least one column besides id");
    }
    List<String> definitions = new ArrayList<>();
    definitions.add(ID + " INTEGER PRIMARY KEY AUTOINCREMENT");
    Set<String> seen = new HashSet<>(Set.of(ID));
    for (ColumnDefinition column : columns) {
      if (!seen.add(column.name())) {
        throw new IllegalArgumentException("Duplicate column " + column.name() + " in table " + tableName);
      }
      definitions.add(column.toSql());
    }
    db.runInTransaction(() -> {
      db.execute("CREATE TABLE " + SqlNames.quote(tableName) + " (\n  " + String.join(",\n  ", definitions) + "\n)");
      contents.add(new Content(tableName, DataType.ATTRIBUTES, null).withDescription(description));
    });
  }

  /** Returns true if {@code tableName} is registered in {@code gpkg_contents} as an attribute table. */
  public boolean isAttributeTable(String tableName) {
    return contents.get(tableName).map(content -> content.dataType() == DataType.ATTRIBUTES).orElse(false);
  }

  /**
   * Adds a row and returns its new id.
   *
   * @throws IllegalArgumentException if {@code values} is empty or has a key that does not name a column
   */
  public long insert(String tableName, Map<String, Object> values) {
    List<String> columns = writableColumns(tableName);
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Cannot insert empty row");
    }
    UserRows.checkColumns(tableName, values.keySet(), columns);
    List<String> names = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (var entry : values.entrySet()) {
      names.add(SqlNames.quote(entry.getKey()));
      params.add(UserRows.bindable(entry.getValue()));
    }
    String sql = "INSERT INTO %s (%s) VALUES (%s)".formatted(SqlNames.quote(tableName), String.join(", ", names),
      String.join(", ", Collections.nCopies(names.size(), "?")));
    return db.inTransaction(() -> {
      long id = db.insert(sql, params.toArray());
      contents.touch(tableName);
      return id;
    });
  }

  public Optional<AttributeRow> get(String tableName, long id) {
    requireAttributeTable(tableName);
    return db.queryFirst("SELECT * FROM " + SqlNames.quote(tableName) + " WHERE " + ID + " = ?",
      AttributeStore::read, id);
  }

  public List<AttributeRow> query(String tableName, AttributeQuery query) {
    requireAttributeTable(tableName);
    StringBuilder sql = new StringBuilder("SELECT * FROM ").append(SqlNames.quote(tableName));
    if (query.where() != null && !query.where().isBlank()) {
      sql.append(" WHERE (").append(query.where()).append(')');
    }
    sql.append(" ORDER BY ").append(query.orderBy() == null ? ID : query.orderBy().trim());
    if (query.limit() != null || query.offset() != null) {
      sql.append(" LIMIT ").append(query.limit() == null ? -1 : query.limit());
      sql.append(" OFFSET ").append(query.offset() == null ? 0 : query.offset());
    }
    return db.query(sql.toString(), AttributeStore::read, query.params().toArray());
  }

  /**
   * Sets some columns of a row.
   *
   * @throws IllegalArgumentException if the row does not exist or a key does not name a column
   */
  public void update(String tableName, long id, Map<String, Object> values) {
    List<String> columns = writableColumns(tableName);
    if (values.isEmpty()) {
      return;
    }
    UserRows.checkColumns(tableName, values.keySet(), columns);
    List<Object> params = new ArrayList<>();
    for (Object value : values.values()) {
      params.add(UserRows.bindable(value));
    }
    params.add(id);
    String sql = "UPDATE %s SET %s WHERE %s = ?".formatted(SqlNames.quote(tableName),
      UserRows.assignments(values.keySet()), ID);
    db.runInTransaction(() -> {
      if (db.update(sql, params.toArray()) == 0) {
        throw new IllegalArgumentException("Row with ID " + id + " not found in table " + tableName);
      }
      contents.touch(tableName);
    });
  }

  /** Removes a row and returns true if it existed. */
  public boolean delete(String tableName, long id) {
    requireAttributeTable(tableName);
    return db.inTransaction(() -> {
      boolean deleted = db.update("DELETE FROM " + SqlNames.quote(tableName) + " WHERE " + ID + " = ?", id) > 0;
      if (deleted) {
        contents.touch(tableName);
      }
      return deleted;
    });
  }

  /** Returns the number of rows matching {@code where}, or every row when it is null. */
  public long count(String tableName, String where, Object... params) {
    requireAttributeTable(tableName);
    String condition = where == null || where.isBlank() ? "" : " WHERE (" + where + ")";
    return db.queryLong("SELECT count(*) FROM " + SqlNames.quote(tableName) + condition, params);
  }

  public long count(String tableName) {
    return count(tableName, null);
  }

  /** Drops an attribute table along with its column descriptions, extensions and contents registration. */
  public void deleteTable(String tableName) {
    requireAttributeTable(tableName);
    db.runInTransaction(() -> {
      dataColumns.deleteForTable(tableName);
      extensions.deleteForTable(tableName);
      contents.delete(tableName);
      db.execute("DROP TABLE " + SqlNames.quote(tableName));
    });
  }

  private List<String> writableColumns(String tableName) {
    requireAttributeTable(tableName);
    List<String> columns = new ArrayList<>(db.columnNames(tableName));
    columns.remove(ID);
    return columns;
  }

  private void requireAttributeTable(String tableName) {
    SqlNames.validateTable(tableName);
    if (!isAttributeTable(tableName)) {
      throw new IllegalArgumentException("Table " + tableName + " is not an attribute table");
    }
  }

  private static AttributeRow read(ResultSet rs) throws SQLException {
    return new AttributeRow(rs.getLong(ID), UserRows.values(rs, Set.of(ID)));
  }
}
