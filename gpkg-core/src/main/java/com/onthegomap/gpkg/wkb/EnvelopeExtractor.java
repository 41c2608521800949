package com.onthegomap.gpkg.wkb;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import org.locationtech.jts.geom.Envelope;

/**
 * Gets the 2D bounding box of a geometry blob, first from the envelope in its header and otherwise by scanning the
 * body.
 * <p>
 * Null geometries, empty geometries and geometry collections without a header envelope have no bounds.
 */
public class EnvelopeExtractor {

  private final List<EnvelopeSource> sources;

  public EnvelopeExtractor() {
    this(List.of(EnvelopeSource.HEADER, EnvelopeSource.BODY));
  }

  /** Returns an extractor that tries {@code sources} in order and returns the first envelope found. */
  public EnvelopeExtractor(List<EnvelopeSource> sources) {
    this.sources = List.copyOf(sources);
  }

  /**
   * Returns the X/Y bounds of {@code bytes}, or empty if it has none.
   *
   * @throws GeometryFormatException if the header is invalid or the blob is truncated
   */
  public Optional<Envelope> extract(byte[] bytes) {
    if (bytes == null) {
      return Optional.empty();
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    GeometryHeader header = GeometryHeader.read(buffer);
    if (header.empty()) {
      return Optional.empty();
    }
    try {
      for (EnvelopeSource source : sources) {
        Optional<Envelope> result = source.read(header, buffer);
        if (result.isPresent()) {
          return result;
        }
      }
      return Optional.empty();
    } catch (BufferUnderflowException e) {
      throw new GeometryFormatException("Truncated geometry blob", e);
    }
  }
}
