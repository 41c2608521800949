package com.onthegomap.gpkg.wkb;

import java.util.Locale;

/** Which envelope gets embedded in a geometry blob header, stored in bits 1-3 of the flags byte. */
public enum EnvelopeType {
  NONE(0, 0),
  XY(1, 4),
  XYZ(2, 6),
  XYM(3, 6),
  XYZM(4, 8);

  private final int code;
  private final int numValues;

  EnvelopeType(int code, int numValues) {
    this.code = code;
    this.numValues = numValues;
  }

  public int code() {
    return code;
  }

  /** Returns the number of bytes the envelope takes up in the header. */
  public int size() {
    return numValues * Double.BYTES;
  }

  public boolean hasZ() {
    return this == XYZ || this == XYZM;
  }

  public boolean hasM() {
    return this == XYM || this == XYZM;
  }

  /**
   * Returns the envelope type for the 3-bit code in a header.
   *
   * @throws GeometryFormatException if {@code code} is not 0-4
   */
  public static EnvelopeType fromCode(int code) {
    for (EnvelopeType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    throw new GeometryFormatException("Invalid envelope indicator: " + code);
  }

  /** Returns the envelope type for a name like {@code "xyz"}, ignoring case. */
  public static EnvelopeType fromName(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Envelope must be one of none, xy, xyz, xym, xyzm, got: " + name, e);
    }
  }
}
