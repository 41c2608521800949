package com.onthegomap.gpkg.wkb;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The fixed 8-byte prefix of a geometry blob, followed by an optional envelope and the geometry body.
 *
 * <pre>
 * offset 0  magic "GP"
 * offset 2  version
 * offset 3  flags: bit 5 extended type, bit 4 empty, bits 1-3 envelope type, bit 0 byte order (1 = little endian)
 * offset 4  srs id, big endian
 * </pre>
 *
 * @param version      binary format version, always 0
 * @param extended     true if the body uses an extension-defined geometry type
 * @param empty        true if the blob stands for a null geometry
 * @param envelopeType which envelope follows the header
 * @param byteOrder    byte order of the envelope values
 * @param srsId        spatial reference system id
 */
public record GeometryHeader(
  byte version,
  boolean extended,
  boolean empty,
  EnvelopeType envelopeType,
  ByteOrder byteOrder,
  int srsId
) {

  public static final int SIZE = 8;
  public static final short MAGIC = 0x4750;
  public static final byte VERSION = 0;

  private static final int EXTENDED_FLAG = 0b0010_0000;
  private static final int EMPTY_FLAG = 0b0001_0000;
  private static final int ENVELOPE_MASK = 0b0000_1110;
  private static final int LITTLE_ENDIAN_FLAG = 0b0000_0001;

  /** Returns a standard little-endian header. */
  public static GeometryHeader of(boolean empty, EnvelopeType envelopeType, int srsId) {
    return new GeometryHeader(VERSION, false, empty, envelopeType, ByteOrder.LITTLE_ENDIAN, srsId);
  }

  public byte flags() {
    int flags = envelopeType.code() << 1;
    if (extended) {
      flags |= EXTENDED_FLAG;
    }
    if (empty) {
      flags |= EMPTY_FLAG;
    }
    if (byteOrder == ByteOrder.LITTLE_ENDIAN) {
      flags |= LITTLE_ENDIAN_FLAG;
    }
    return (byte) flags;
  }

  /** Returns the number of bytes taken by the header and envelope, which is where the body starts. */
  public int length() {
    return SIZE + envelopeType.size();
  }

  /** Writes the 8 header bytes at the current position of {@code buffer}. */
  public void write(ByteBuffer buffer) {
    ByteOrder original = buffer.order();
    buffer.order(ByteOrder.BIG_ENDIAN);
    buffer.putShort(MAGIC);
    buffer.put(version);
    buffer.put(flags());
    buffer.putInt(srsId);
    buffer.order(original);
  }

  /**
   * Reads and validates the 8 header bytes from the current position of {@code buffer}.
   *
   * @throws GeometryFormatException if the magic, version or envelope type are wrong or there are fewer than 8 bytes
   */
  public static GeometryHeader read(ByteBuffer buffer) {
    if (buffer.remaining() < SIZE) {
      throw new GeometryFormatException("Geometry blob too short for header: " + buffer.remaining() + " bytes");
    }
    ByteOrder original = buffer.order();
    try {
      buffer.order(ByteOrder.BIG_ENDIAN);
      short magic = buffer.getShort();
      if (magic != MAGIC) {
        throw new GeometryFormatException("Incorrect magic number for geometry blob: 0x%04x".formatted(magic));
      }
      byte version = buffer.get();
      if (version != VERSION) {
        throw new GeometryFormatException("Unsupported geometry blob version: " + version);
      }
      int flags = buffer.get();
      int srsId = buffer.getInt();
      return new GeometryHeader(
        version,
        (flags & EXTENDED_FLAG) != 0,
        (flags & EMPTY_FLAG) != 0,
        EnvelopeType.fromCode((flags & ENVELOPE_MASK) >> 1),
        (flags & LITTLE_ENDIAN_FLAG) != 0 ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN,
        srsId
      );
    } catch (BufferUnderflowException e) {
      throw new GeometryFormatException("Truncated geometry header", e);
    } finally {
      buffer.order(original);
    }
  }
}
