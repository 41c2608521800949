package com.onthegomap.gpkg.geo;

/**
 * Whether a geometry column allows Z or M values, stored as {@code 0}, {@code 1} or {@code 2} in the {@code z} and
 * {@code m} columns of {@code gpkg_geometry_columns}.
 */
public enum ZmPolicy {
  PROHIBITED(0),
  MANDATORY(1),
  OPTIONAL(2);

  private final int value;

  ZmPolicy(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  public boolean permits(boolean present) {
    return switch (this) {
      case PROHIBITED -> !present;
      case MANDATORY -> present;
      case OPTIONAL -> true;
    };
  }

  public static ZmPolicy fromValue(int value) {
    return switch (value) {
      case 0 -> PROHIBITED;
      case 1 -> MANDATORY;
      case 2 -> OPTIONAL;
      default -> throw new IllegalArgumentException("z/m must be 0, 1 or 2, got: " + value);
    };
  }
}
