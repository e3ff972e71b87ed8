/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.auth.AuthProvider;
import com.datastax.oss.driver.api.core.auth.ProgrammaticPlainTextAuthProvider;
import com.datastax.oss.driver.api.core.config.DriverOption;
import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import zipkin2.Call;
import zipkin2.CheckResult;
import zipkin2.internal.ClosedComponentException;
import zipkin2.internal.Nullable;

import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.CONNECTION_MAX_REQUESTS;
import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.CONNECTION_POOL_LOCAL_SIZE;

/**
 * Reads the series ids stored in Cassandra, which are the input of a {@link ClientSideIndex}.
 *
 * <p>Queries are logged to the category
 * "com.datastax.oss.driver.internal.core.tracker.RequestLogger" when debug or trace is enabled via
 * SLF4J. Trace level includes bound values.
 */
public final class CassandraSeriesSource implements Closeable {
  static final Logger LOG = LoggerFactory.getLogger(CassandraSeriesSource.class);

  /** Creates the session used to scan series tables. Tests supply a mock session. */
  public interface SessionFactory {
    SessionFactory DEFAULT = new DefaultSessionFactory();

    CqlSession create(CassandraSeriesSource source);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    SessionFactory sessionFactory = SessionFactory.DEFAULT;
    String contactPoints = "localhost";
    // the driver needs a local datacenter; the default of a single node install
    String localDc = "datacenter1";
    @Nullable String username, password;
    boolean useSsl = false;
    int maxConnections = 8;
    String keyspace = Schema.DEFAULT_KEYSPACE;
    List<String> tables = Schema.BLESSED_TABLES;

    Builder() {
    }

    /**
     * Comma separated list of host addresses part of Cassandra cluster. You can also specify a
     * custom port with 'host:port'. Defaults to localhost on port 9042
     */
    public Builder contactPoints(String contactPoints) {
      if (contactPoints == null) throw new NullPointerException("contactPoints == null");
      this.contactPoints = contactPoints;
      return this;
    }

    /** Name of the datacenter that will be considered "local". Defaults to "datacenter1" */
    public Builder localDc(String localDc) {
      if (localDc == null) throw new NullPointerException("localDc == null");
      this.localDc = localDc;
      return this;
    }

    /** Will throw an exception on startup if authentication fails. No default. */
    public Builder username(@Nullable String username) {
      this.username = username;
      return this;
    }

    /** Will throw an exception on startup if authentication fails. No default. */
    public Builder password(@Nullable String password) {
      this.password = password;
      return this;
    }

    /** Use ssl for connection. Defaults to false. */
    public Builder useSsl(boolean useSsl) {
      this.useSsl = useSsl;
      return this;
    }

    /** Max pooled connections per datacenter-local host. Defaults to 8 */
    public Builder maxConnections(int maxConnections) {
      if (maxConnections <= 0) throw new IllegalArgumentException("maxConnections <= 0");
      this.maxConnections = maxConnections;
      return this;
    }

    /** Keyspace holding the series tables. Defaults to "measurements" */
    public Builder keyspace(String keyspace) {
      if (keyspace == null) throw new NullPointerException("keyspace == null");
      this.keyspace = keyspace;
      return this;
    }

    /** Tables to scan for series ids, in order. Defaults to {@link Schema#BLESSED_TABLES} */
    public Builder tables(List<String> tables) {
      if (tables == null) throw new NullPointerException("tables == null");
      if (tables.isEmpty()) throw new IllegalArgumentException("tables are empty");
      this.tables = List.copyOf(tables);
      return this;
    }

    /** Override to control how sessions are created. */
    public Builder sessionFactory(SessionFactory sessionFactory) {
      if (sessionFactory == null) throw new NullPointerException("sessionFactory == null");
      this.sessionFactory = sessionFactory;
      return this;
    }

    public CassandraSeriesSource build() {
      return new CassandraSeriesSource(this);
    }
  }

  final String contactPoints, localDc;
  final Map<DriverOption, Integer> poolingOptions;
  @Nullable final AuthProvider authProvider;
  final boolean useSsl;
  final String keyspace;
  final List<String> tables;

  final LazySession session;

  CassandraSeriesSource(Builder builder) {
    this.contactPoints = builder.contactPoints;
    this.localDc = builder.localDc;
    this.poolingOptions = new LinkedHashMap<>();
    this.poolingOptions.put(CONNECTION_POOL_LOCAL_SIZE, builder.maxConnections);
    this.poolingOptions.put(CONNECTION_MAX_REQUESTS, 1024);
    if (builder.username != null) {
      this.authProvider = new ProgrammaticPlainTextAuthProvider(builder.username, builder.password);
    } else {
      this.authProvider = null;
    }
    this.useSsl = builder.useSsl;
    this.keyspace = builder.keyspace;
    this.tables = builder.tables;
    this.session = new LazySession(this, builder.sessionFactory);
  }

  /** close is typically called from a different thread */
  volatile boolean closeCalled;

  /**
   * Returns a call that lists every distinct series id of each configured table, parsed with its
   * table name. Executing it throws {@link MalformedSeriesIdException} on the first invalid id.
   */
  public Call<List<Series>> fetchSeriesCollection() {
    if (closeCalled) throw new ClosedComponentException();
    return session.selectSeriesIds().newCall();
  }

  /**
   * Scans all series and indexes them. This is the startup step of a benchmark run: any failure
   * propagates so the run can abort.
   *
   * @throws EmptyIndexException if no table had series
   */
  public ClientSideIndex clientSideIndex() throws IOException {
    long start = System.nanoTime();
    List<Series> seriesCollection = fetchSeriesCollection().execute();
    LOG.info("fetched {} series from {} tables in {}ms", seriesCollection.size(), tables.size(),
      (System.nanoTime() - start) / 1_000_000);
    return ClientSideIndex.create(seriesCollection);
  }

  public CheckResult check() {
    if (closeCalled) throw new ClosedComponentException();
    try {
      session.healthCheck();
    } catch (Throwable e) {
      Call.propagateIfFatal(e);
      return CheckResult.failed(e);
    }
    return CheckResult.OK;
  }

  @Override public void close() {
    if (closeCalled) return;
    session.close();
    closeCalled = true;
  }

  @Override public String toString() {
    return "CassandraSeriesSource{contactPoints=" + contactPoints + ", keyspace=" + keyspace
      + ", tables=" + tables + "}";
  }
}
