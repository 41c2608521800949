package com.onthegomap.gpkg.index;

import java.util.Set;
import org.locationtech.jts.geom.Envelope;

/**
 * Storage for named collections of (id, 2D bounding box) entries that can be searched by box overlap.
 * <p>
 * {@link SpatialIndex} decides which entries go in here; implementations only store and search them.
 */
public interface BoundsIndex {

  boolean exists(String name);

  void create(String name);

  void drop(String name);

  /** Removes every entry but keeps the structure. */
  void clear(String name);

  /** Adds an entry, an existing entry with the same id gets replaced. */
  void insert(String name, long id, Envelope bounds);

  void delete(String name, long id);

  /** Returns the ids of entries whose stored box overlaps {@code bounds}, including boxes that only touch it. */
  Set<Long> query(String name, Envelope bounds);

  long count(String name);
}
