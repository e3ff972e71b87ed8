/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import tsbench.query.cassandra.CassandraSeriesSource.SessionFactory;
import zipkin2.internal.ClosedComponentException;

import static zipkin2.Call.propagateIfFatal;

final class LazySession {
  final CassandraSeriesSource source;
  final SessionFactory sessionFactory;

  volatile CqlSession session;
  volatile PreparedStatement healthCheck; // guarded by session
  volatile SelectSeriesIds.Factory selectSeriesIds; // guarded by session

  LazySession(CassandraSeriesSource source, SessionFactory sessionFactory) {
    this.source = source;
    this.sessionFactory = sessionFactory;
  }

  /** Creates a session, selects the keyspace and prepares statements once. */
  CqlSession get() {
    if (session != null) return session;
    synchronized (this) {
      if (session != null) return session; // lost race
      session = sessionFactory.create(source);

      try {
        session.execute("USE " + source.keyspace);
        healthCheck = session.prepare("SELECT " + Schema.COLUMN_SERIES_ID
          + " FROM " + source.tables.get(0) + " LIMIT 1");
        selectSeriesIds = new SelectSeriesIds.Factory(session, source.tables);
      } catch (RuntimeException | Error e) {
        propagateIfFatal(e);
        CassandraSeriesSource.LOG.error("Failed to prepare queries in keyspace {}",
          source.keyspace, e);
        // a closed session fails later calls below
        session.close();
      }
    }
    if (session.isClosed()) {
      throw new ClosedComponentException("Session initialization failed. See logs");
    }
    return session;
  }

  SelectSeriesIds.Factory selectSeriesIds() {
    get();
    return selectSeriesIds;
  }

  void healthCheck() {
    get();
    session.execute(healthCheck.bind());
  }

  void close() {
    CqlSession maybeSession = session;
    if (maybeSession != null) {
      maybeSession.close();
      session = null;
    }
  }
}
