package com.onthegomap.gpkg.schema;

/**
 * A row of {@code gpkg_spatial_ref_sys}.
 *
 * @param name                   human-readable name, for example {@code "WGS 84"}
 * @param id                     srs id referenced by contents and geometry columns
 * @param organization           defining organization, for example {@code "EPSG"}
 * @param organizationCoordsysId id assigned by {@code organization}
 * @param definition             well-known text definition
 * @param description            optional description
 */
public record SpatialReferenceSystem(
  String name,
  int id,
  String organization,
  int organizationCoordsysId,
  String definition,
  String description
) {}
