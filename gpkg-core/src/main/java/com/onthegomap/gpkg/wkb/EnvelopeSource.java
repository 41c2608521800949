package com.onthegomap.gpkg.wkb;

import java.nio.ByteBuffer;
import java.util.Optional;
import org.locationtech.jts.geom.Envelope;

/** A way to get the 2D bounds of a geometry blob without decoding it. */
public enum EnvelopeSource {

  /** Reads the X/Y bounds embedded after the header, if the header has any. */
  HEADER {
    @Override
    Optional<Envelope> read(GeometryHeader header, ByteBuffer buffer) {
      if (header.envelopeType() == EnvelopeType.NONE) {
        return Optional.empty();
      }
      if (buffer.limit() < header.length()) {
        throw new GeometryFormatException("Geometry blob too short for " + header.envelopeType() + " envelope");
      }
      buffer.position(GeometryHeader.SIZE);
      buffer.order(header.byteOrder());
      double minX = buffer.getDouble();
      double maxX = buffer.getDouble();
      double minY = buffer.getDouble();
      double maxY = buffer.getDouble();
      if (Double.isNaN(minX) || Double.isNaN(maxX) || Double.isNaN(minY) || Double.isNaN(maxY)) {
        return Optional.empty();
      }
      return Optional.of(new Envelope(minX, maxX, minY, maxY));
    }
  },

  /** Computes X/Y bounds by scanning every coordinate in the body. */
  BODY {
    @Override
    Optional<Envelope> read(GeometryHeader header, ByteBuffer buffer) {
      if (header.extended()) {
        return Optional.empty();
      }
      if (buffer.limit() < header.length()) {
        throw new GeometryFormatException("Geometry blob too short for " + header.envelopeType() + " envelope");
      }
      buffer.position(header.length());
      Envelope envelope = new Envelope();
      boolean scanned = WkbBodyScanner.scan(buffer, (x, y) -> {
        if (!Double.isNaN(x) && !Double.isNaN(y)) {
          envelope.expandToInclude(x, y);
        }
      });
      return scanned && !envelope.isNull() ? Optional.of(envelope) : Optional.empty();
    }
  };

  /**
   * Returns the bounds of the blob in {@code buffer}, or empty if this source cannot provide them.
   *
   * @param header the already-validated header
   * @param buffer the whole blob, the position may be changed
   */
  abstract Optional<Envelope> read(GeometryHeader header, ByteBuffer buffer);
}
