package com.onthegomap.gpkg.geojson;

/**
 * Outcome of an import.
 *
 * @param tableName table the features went to
 * @param inserted  number of features stored
 * @param skipped   number of features left out because their geometry could not be stored
 */
public record ImportResult(String tableName, int inserted, int skipped) {}
