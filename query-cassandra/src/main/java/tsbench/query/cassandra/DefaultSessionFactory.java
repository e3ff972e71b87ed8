/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import com.datastax.oss.driver.api.core.CqlSession;
import tsbench.query.cassandra.internal.SessionBuilder;

final class DefaultSessionFactory implements CassandraSeriesSource.SessionFactory {
  @Override public CqlSession create(CassandraSeriesSource source) {
    return SessionBuilder.buildSession(
      source.contactPoints,
      source.localDc,
      source.poolingOptions,
      source.authProvider,
      source.useSsl
    );
  }

  @Override public String toString() {
    return "DefaultSessionFactory{}";
  }
}
