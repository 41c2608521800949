package com.onthegomap.gpkg.db;

import com.onthegomap.gpkg.config.Arguments;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * A handle to one sqlite connection that every table manager of a geopackage shares.
 * <p>
 * Wraps {@link SQLException} in unchecked exceptions and supports nested transactions, where inner calls to
 * {@link #inTransaction(Supplier)} join the outermost one. Not thread-safe.
 */
public final class Sqlite implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Sqlite.class);

  // load the sqlite driver
  static {
    try {
      Class.forName("org.sqlite.JDBC");
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("JDBC driver not found", e);
    }
  }

  private final Connection connection;
  private final String url;
  private int transactionDepth = 0;

  private Sqlite(Connection connection, String url) {
    this.connection = connection;
    this.url = url;
  }

  /** Returns a connection to a database that won't get written to disk. */
  public static Sqlite newInMemoryDatabase(SQLiteConfig config, Arguments options) {
    String url = "jdbc:sqlite::memory:";
    return new Sqlite(newConnection(url, config, options), url);
  }

  /** Returns a connection to a database file, which gets created if it does not exist unless it is read-only. */
  public static Sqlite newFileDatabase(Path path, SQLiteConfig config, Arguments options) {
    Objects.requireNonNull(path);
    String url = "jdbc:sqlite:" + path.toAbsolutePath();
    return new Sqlite(newConnection(url, config, options), url);
  }

  private static Connection newConnection(String url, SQLiteConfig defaults, Arguments args) {
    try {
      args = args.copy().silence();
      var config = new SQLiteConfig(defaults.toProperties());
      for (var pragma : SQLiteConfig.Pragma.values()) {
        var value = args.getString(pragma.getPragmaName(), pragma.getPragmaName(), null);
        if (value != null) {
          LOGGER.info("Setting custom sqlite pragma {}={}", pragma.getPragmaName(), value);
          config.setPragma(pragma, value);
        }
      }
      return DriverManager.getConnection(url, config.toProperties());
    } catch (SQLException throwables) {
      throw new IllegalArgumentException("Unable to open " + url, throwables);
    }
  }

  public Connection connection() {
    return connection;
  }

  /** Runs each DDL or other statement that takes no parameters. */
  public Sqlite execute(Collection<String> queries) {
    for (String query : queries) {
      try (var statement = connection.createStatement()) {
        LOGGER.debug("Execute: {}", query);
        statement.execute(query);
      } catch (SQLException throwables) {
        throw new IllegalStateException("Error executing query " + query, throwables);
      }
    }
    return this;
  }

  public Sqlite execute(String... queries) {
    return execute(Arrays.asList(queries));
  }

  /** Runs an insert, update or delete with {@code params} bound in order and returns the number of rows changed. */
  public int update(String sql, Object... params) {
    try (PreparedStatement statement = prepare(sql, params)) {
      return statement.executeUpdate();
    } catch (SQLException throwables) {
      throw new IllegalStateException("Error executing " + sql, throwables);
    }
  }

  /** Runs an insert with {@code params} bound in order and returns the rowid of the new row. */
  public long insert(String sql, Object... params) {
    update(sql, params);
    return queryFirst("SELECT last_insert_rowid()", rs -> rs.getLong(1)).orElseThrow();
  }

  /** Returns every row of a query mapped through {@code rowMapper}. */
  public <T> List<T> query(String sql, SqlFunction<ResultSet, T> rowMapper, Object... params) {
    try (
      PreparedStatement statement = prepare(sql, params);
      ResultSet rs = statement.executeQuery()
    ) {
      List<T> result = new ArrayList<>();
      while (rs.next()) {
        result.add(rowMapper.apply(rs));
      }
      return result;
    } catch (SQLException throwables) {
      throw new IllegalStateException("Error executing " + sql, throwables);
    }
  }

  /** Returns the first row of a query mapped through {@code rowMapper}, or empty if there are no rows. */
  public <T> Optional<T> queryFirst(String sql, SqlFunction<ResultSet, T> rowMapper, Object... params) {
    try (
      PreparedStatement statement = prepare(sql, params);
      ResultSet rs = statement.executeQuery()
    ) {
      return rs.next() ? Optional.ofNullable(rowMapper.apply(rs)) : Optional.empty();
    } catch (SQLException throwables) {
      throw new IllegalStateException("Error executing " + sql, throwables);
    }
  }

  /** Returns a single number from a query like {@code SELECT count(*) ...}. */
  public long queryLong(String sql, Object... params) {
    return queryFirst(sql, rs -> rs.getLong(1), params).orElse(0L);
  }

  /** Returns an iterator over the rows of a query that reads one row at a time, and must be closed. */
  public <T> CloseableIterator<T> iterate(String sql, SqlFunction<ResultSet, T> rowMapper, Object... params) {
    return new QueryIterator<>(sql, rowMapper, params);
  }

  /** Returns true if a table, view or virtual table named {@code name} exists. */
  public boolean tableExists(String name) {
    return queryLong("SELECT count(*) FROM sqlite_master WHERE type IN ('table', 'view') AND name = ?", name) > 0;
  }

  /** Returns the names of the columns of {@code table} in order. */
  public List<String> columnNames(String table) {
    return query("PRAGMA table_info(" + SqlNames.quote(table) + ")", rs -> rs.getString("name"));
  }

  /**
   * Runs {@code work} in a transaction that commits when it returns and rolls back if it throws. Calls made while a
   * transaction is already open become part of it.
   */
  public <T> T inTransaction(Supplier<T> work) {
    if (transactionDepth > 0) {
      transactionDepth++;
      try {
        return work.get();
      } finally {
        transactionDepth--;
      }
    }
    try {
      connection.setAutoCommit(false);
    } catch (SQLException throwables) {
      throw new IllegalStateException("Unable to begin transaction on " + url, throwables);
    }
    transactionDepth = 1;
    try {
      T result = work.get();
      connection.commit();
      return result;
    } catch (SQLException throwables) {
      rollback(throwables);
      throw new IllegalStateException("Unable to commit transaction on " + url, throwables);
    } catch (RuntimeException | Error e) {
      rollback(e);
      throw e;
    } finally {
      transactionDepth = 0;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException throwables) {
        LOGGER.warn("Unable to restore auto-commit on {}", url, throwables);
      }
    }
  }

  /** Same as {@link #inTransaction(Supplier)} for work that does not return anything. */
  public void runInTransaction(Runnable work) {
    inTransaction(() -> {
      work.run();
      return null;
    });
  }

  public boolean inTransaction() {
    return transactionDepth > 0;
  }

  private void rollback(Throwable cause) {
    try {
      connection.rollback();
    } catch (SQLException throwables) {
      cause.addSuppressed(throwables);
    }
  }

  private PreparedStatement prepare(String sql, Object... params) throws SQLException {
    PreparedStatement statement = connection.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) {
        statement.setObject(i + 1, params[i]);
      }
    } catch (SQLException e) {
      statement.close();
      throw e;
    }
    return statement;
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException throwables) {
      throw new IllegalStateException("Unable to close " + url, throwables);
    }
  }

  /** Iterates through the results of a query one at a time without materializing the entire list in memory. */
  private class QueryIterator<T> implements CloseableIterator<T> {
    private final PreparedStatement statement;
    private final ResultSet rs;
    private final SqlFunction<ResultSet, T> rowMapper;
    private boolean hasNext = false;

    private QueryIterator(String sql, SqlFunction<ResultSet, T> rowMapper, Object... params) {
      this.rowMapper = rowMapper;
      try {
        this.statement = prepare(sql, params);
        this.rs = statement.executeQuery();
        hasNext = rs.next();
      } catch (SQLException e) {
        throw new IllegalStateException("Error executing " + sql, e);
      } finally {
        if (!hasNext) {
          close();
        }
      }
    }

    @Override
    public void close() {
      try {
        if (statement != null) {
          statement.close();
        }
      } catch (SQLException e) {
        throw new IllegalStateException("Could not close statement on " + url, e);
      }
    }

    @Override
    public boolean hasNext() {
      return hasNext;
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      try {
        T result = rowMapper.apply(rs);
        hasNext = rs.next();
        if (!hasNext) {
          close();
        }
        return result;
      } catch (SQLException e) {
        throw new IllegalStateException("Could not read row from " + url, e);
      }
    }
  }
}
