package com.onthegomap.gpkg.db;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.gpkg.config.Arguments;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sqlite.SQLiteConfig;

class SqliteTest {

  private final Sqlite db = Sqlite.newInMemoryDatabase(new SQLiteConfig(), Arguments.of());

  @BeforeEach
  void setup() {
    db.execute("CREATE TABLE items (id INTEGER PRIMARY KEY AUTOINCREMENT, name TEXT NOT NULL, size REAL)");
  }

  @AfterEach
  void close() {
    db.close();
  }

  private long count() {
    return db.queryLong("SELECT count(*) FROM items");
  }

  @Test
  void testInsertReturnsRowId() {
    assertEquals(1, db.insert("INSERT INTO items (name, size) VALUES (?, ?)", "a", 1.5));
    assertEquals(2, db.insert("INSERT INTO items (name) VALUES (?)", "b"));
    assertEquals(2, count());
  }

  @Test
  void testUpdateReturnsChangedRows() {
    db.insert("INSERT INTO items (name) VALUES (?)", "a");
    db.insert("INSERT INTO items (name) VALUES (?)", "b");
    assertEquals(2, db.update("UPDATE items SET size = ?", 3.0));
    assertEquals(0, db.update("DELETE FROM items WHERE name = ?", "c"));
    assertEquals(1, db.update("DELETE FROM items WHERE name = ?", "a"));
  }

  @Test
  void testQuery() {
    db.insert("INSERT INTO items (name, size) VALUES (?, ?)", "a", 1.0);
    db.insert("INSERT INTO items (name, size) VALUES (?, ?)", "b", 2.0);
    assertEquals(List.of("a", "b"), db.query("SELECT name FROM items ORDER BY id", rs -> rs.getString(1)));
    assertEquals(List.of("b"), db.query("SELECT name FROM items WHERE size > ?", rs -> rs.getString(1), 1.5));
    assertEquals(Optional.of("a"), db.queryFirst("SELECT name FROM items ORDER BY id", rs -> rs.getString(1)));
    assertEquals(Optional.empty(), db.queryFirst("SELECT name FROM items WHERE id = ?", rs -> rs.getString(1), 9));
  }

  @Test
  void testQueryLongWithNoRowsIsZero() {
    assertEquals(0, db.queryLong("SELECT id FROM items WHERE name = ?", "missing"));
  }

  @Test
  void testIterate() {
    for (int i = 0; i < 5; i++) {
      db.insert("INSERT INTO items (name) VALUES (?)", "item" + i);
    }
    List<String> names = new ArrayList<>();
    try (var iter = db.iterate("SELECT name FROM items ORDER BY id", rs -> rs.getString(1))) {
      iter.forEachRemaining(names::add);
    }
    assertEquals(List.of("item0", "item1", "item2", "item3", "item4"), names);
  }

  @Test
  void testIterateEmpty() {
    try (var iter = db.iterate("SELECT name FROM items", rs -> rs.getString(1))) {
      assertFalse(iter.hasNext());
      assertThrows(NoSuchElementException.class, iter::next);
    }
  }

  @Test
  void testCloseIteratorEarly() {
    for (int i = 0; i < 3; i++) {
      db.insert("INSERT INTO items (name) VALUES (?)", "item" + i);
    }
    try (var iter = db.iterate("SELECT id FROM items ORDER BY id", rs -> rs.getLong(1)).map(id -> id * 10)) {
      assertEquals(Long.valueOf(10), iter.next());
    }
    db.execute("DROP TABLE items");
    assertFalse(db.tableExists("items"));
  }

  @Test
  void testTableExistsAndColumnNames() {
    assertTrue(db.tableExists("items"));
    assertFalse(db.tableExists("other"));
    db.execute("CREATE VIEW item_names AS SELECT name FROM items");
    assertTrue(db.tableExists("item_names"));
    assertEquals(List.of("id", "name", "size"), db.columnNames("items"));
    assertEquals(List.of(), db.columnNames("other"));
  }

  @Test
  void testBadSqlThrowsIllegalState() {
    assertThrows(IllegalStateException.class, () -> db.execute("CREATE TABLEE broken"));
    assertThrows(IllegalStateException.class, () -> db.query("SELECT nope FROM items", rs -> rs.getString(1)));
    assertThrows(IllegalStateException.class, () -> db.update("INSERT INTO items (name) VALUES (NULL)"));
  }

  @Test
  void testTransactionCommits() {
    long id = db.inTransaction(() -> db.insert("INSERT INTO items (name) VALUES (?)", "a"));
    assertEquals(1, id);
    assertFalse(db.inTransaction());
    assertEquals(1, count());
  }

  @Test
  void testTransactionRollsBackAndRethrows() {
    var error = new IllegalArgumentException("boom");
    var thrown = assertThrows(IllegalArgumentException.class, () -> db.runInTransaction(() -> {
      db.insert("INSERT INTO items (name) VALUES (?)", "a");
      throw error;
    }));
    assertSame(error, thrown);
    assertFalse(db.inTransaction());
    assertEquals(0, count());
  }

  @Test
  void testNestedTransactionJoinsOuter() {
    assertThrows(IllegalStateException.class, () -> db.runInTransaction(() -> {
      db.runInTransaction(() -> db.insert("INSERT INTO items (name) VALUES (?)", "inner"));
      assertTrue(db.inTransaction());
      db.insert("INSERT INTO items (name) VALUES (?)", "outer");
      throw new IllegalStateException("fail after inner commit");
    }));
    assertEquals(0, count());
  }

  @Test
  void testInnerFailureRollsBackOuter() {
    assertThrows(IllegalStateException.class, () -> db.runInTransaction(() -> {
      db.insert("INSERT INTO items (name) VALUES (?)", "outer");
      db.runInTransaction(() -> db.update("INSERT INTO items (name) VALUES (NULL)"));
    }));
    assertEquals(0, count());
    db.insert("INSERT INTO items (name) VALUES (?)", "after");
    assertEquals(1, count());
  }

  @Test
  void testCustomPragmaFromArguments() {
    try (var other = Sqlite.newInMemoryDatabase(new SQLiteConfig(), Arguments.of("busy_timeout", "1234"))) {
      assertEquals(1234, other.queryLong("PRAGMA busy_timeout"));
    }
  }
}
