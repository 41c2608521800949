package com.onthegomap.gpkg.tiles;

import java.util.Set;

/** Image encodings a tile pyramid may hold, detected from the leading magic bytes of the tile data. */
public enum TileFormat {
  PNG("image/png"),
  JPEG("image/jpeg"),
  WEBP("image/webp"),
  UNKNOWN("application/octet-stream");

  private static final byte[] PNG_MAGIC = {(byte) 0x89, 0x50, 0x4E, 0x47};
  private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
  private static final byte[] RIFF = {'R', 'I', 'F', 'F'};
  private static final byte[] WEBP_MAGIC = {'W', 'E', 'B', 'P'};

  public static final Set<TileFormat> IMAGE_FORMATS = Set.of(PNG, JPEG, WEBP);

  private final String mimeType;

  TileFormat(String mimeType) {
    this.mimeType = mimeType;
  }

  public String mimeType() {
    return mimeType;
  }

  /** Returns the format of {@code data}, or {@link #UNKNOWN} if it does not start with a known signature. */
  public static TileFormat detect(byte[] data) {
    if (data == null) {
      return UNKNOWN;
    } else if (startsWith(data, 0, PNG_MAGIC)) {
      return PNG;
    } else if (startsWith(data, 0, JPEG_MAGIC)) {
      return JPEG;
    } else if (startsWith(data, 0, RIFF) && startsWith(data, 8, WEBP_MAGIC)) {
      return WEBP;
    }
    return UNKNOWN;
  }

  /**
   * Returns the format of {@code data} if it is one of {@code allowed}.
   *
   * @throws IllegalArgumentException if {@code data} is empty, of unknown format, or of a format not allowed
   */
  public static TileFormat validate(byte[] data, Set<TileFormat> allowed) {
    if (data == null || data.length == 0) {
      throw new IllegalArgumentException("Tile data is empty");
    }
    TileFormat format = detect(data);
    if (format == UNKNOWN) {
      throw new IllegalArgumentException("Unrecognized tile image format");
    }
    if (!allowed.contains(format)) {
      throw new IllegalArgumentException("Tile format " + format + " is not allowed, expected one of " + allowed);
    }
    return format;
  }

  private static boolean startsWith(byte[] data, int offset, byte[] magic) {
    if (data.length < offset + magic.length) {
      return false;
    }
    for (int i = 0; i < magic.length; i++) {
      if (data[offset + i] != magic[i]) {
        return false;
      }
    }
    return true;
  }
}
