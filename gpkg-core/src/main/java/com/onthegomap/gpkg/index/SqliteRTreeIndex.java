package com.onthegomap.gpkg.index;

import com.onthegomap.gpkg.db.SqlNames;
import com.onthegomap.gpkg.db.Sqlite;
import java.util.LinkedHashSet;
import java.util.Set;
import org.locationtech.jts.geom.Envelope;

/**
 * A {@link BoundsIndex} stored in sqlite R*Tree virtual tables with columns {@code id, minx, maxx, miny, maxy}.
 * <p>
 * The R*Tree module stores 32-bit floats rounded outward, so a stored box always contains the box that was inserted.
 */
public class SqliteRTreeIndex implements BoundsIndex {

  private final Sqlite db;

  public SqliteRTreeIndex(Sqlite db) {
    this.db = db;
  }

  @Override
  public boolean exists(String name) {
    return db.tableExists(name);
  }

  @Override
  public void create(String name) {
    db.execute("CREATE VIRTUAL TABLE " + quote(name) + " USING rtree(id, minx, maxx, miny, maxy)");
  }

  @Override
  public void drop(String name) {
    db.execute("DROP TABLE IF EXISTS " + quote(name));
  }

  @Override
  public void clear(String name) {
    db.execute("DELETE FROM " + quote(name));
  }

  @Override
  public void insert(String name, long id, Envelope bounds) {
    db.update("INSERT OR REPLACE INTO " + quote(name) + " (id, minx, maxx, miny, maxy) VALUES (?, ?, ?, ?, ?)",
      id, bounds.getMinX(), bounds.getMaxX(), bounds.getMinY(), bounds.getMaxY());
  }

  @Override
  public void delete(String name, long id) {
    db.update("DELETE FROM " + quote(name) + " WHERE id = ?", id);
  }

  @Override
  public Set<Long> query(String name, Envelope bounds) {
    return new LinkedHashSet<>(db.query(
      "SELECT id FROM " + quote(name) + " WHERE maxx >= ? AND minx <= ? AND maxy >= ? AND miny <= ? ORDER BY id",
      rs -> rs.getLong(1),
      bounds.getMinX(), bounds.getMaxX(), bounds.getMinY(), bounds.getMaxY()
    ));
  }

  @Override
  public long count(String name) {
    return db.queryLong("SELECT count(*) FROM " + quote(name));
  }

  private static String quote(String name) {
    return SqlNames.quote(name);
  }
}
