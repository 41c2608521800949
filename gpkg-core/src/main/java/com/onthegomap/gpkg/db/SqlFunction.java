package com.onthegomap.gpkg.db;

import java.sql.SQLException;

/** A function that reads from JDBC and may throw {@link SQLException}. */
@FunctionalInterface
public interface SqlFunction<I, O> {

  O apply(I t) throws SQLException;
}
