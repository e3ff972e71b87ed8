/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra.internal;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.auth.AuthProvider;
import com.datastax.oss.driver.api.core.config.DriverConfigLoader;
import com.datastax.oss.driver.api.core.config.DriverOption;
import com.datastax.oss.driver.api.core.config.ProgrammaticDriverConfigLoaderBuilder;
import com.datastax.oss.driver.internal.core.ssl.DefaultSslEngineFactory;
import com.datastax.oss.driver.internal.core.tracker.RequestLogger;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import zipkin2.internal.Nullable;

import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.REQUEST_CONSISTENCY;
import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.REQUEST_DEFAULT_IDEMPOTENCE;
import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.REQUEST_LOGGER_SUCCESS_ENABLED;
import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.REQUEST_LOGGER_VALUES;
import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.REQUEST_PAGE_SIZE;
import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.REQUEST_TIMEOUT;
import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.REQUEST_TRACKER_CLASS;
import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.REQUEST_WARN_IF_SET_KEYSPACE;
import static com.datastax.oss.driver.api.core.config.DefaultDriverOption.SSL_ENGINE_FACTORY_CLASS;

public final class SessionBuilder {
  public static final int DEFAULT_PORT = 9042;

  /** SELECT DISTINCT over a partition key walks the whole token ring. */
  static final Duration SCAN_TIMEOUT = Duration.ofMinutes(1);
  static final int SCAN_PAGE_SIZE = 5000;

  /** Returns a connected session for scanning series tables. */
  public static CqlSession buildSession(
    String contactPoints,
    String localDc,
    Map<DriverOption, Integer> poolingOptions,
    @Nullable AuthProvider authProvider,
    boolean useSsl
  ) {
    Logger requestLogger = LoggerFactory.getLogger(RequestLogger.class);
    CqlSessionBuilder builder = CqlSession.builder()
      .addContactPoints(parseContactPoints(contactPoints))
      .withLocalDatacenter(localDc)
      .withConfigLoader(scanConfig(poolingOptions, useSsl, requestLogger).build());
    if (authProvider != null) builder.withAuthProvider(authProvider);
    return builder.build();
  }

  /**
   * Driver settings for read-only, full-table scans at LOCAL_ONE. The keyspace is selected with
   * "USE" after connecting. Enabling debug on the request logger's category logs each query, and
   * trace adds bound values.
   */
  static ProgrammaticDriverConfigLoaderBuilder scanConfig(
    Map<DriverOption, Integer> poolingOptions, boolean useSsl, Logger requestLogger) {
    // the context class loader can be null when embedded
    ProgrammaticDriverConfigLoaderBuilder config =
      DriverConfigLoader.programmaticBuilder(SessionBuilder.class.getClassLoader())
        .withDuration(REQUEST_TIMEOUT, SCAN_TIMEOUT)
        .withInt(REQUEST_PAGE_SIZE, SCAN_PAGE_SIZE)
        .withString(REQUEST_CONSISTENCY, "LOCAL_ONE")
        .withBoolean(REQUEST_DEFAULT_IDEMPOTENCE, true)
        .withBoolean(REQUEST_WARN_IF_SET_KEYSPACE, false);
    for (Map.Entry<DriverOption, Integer> option : poolingOptions.entrySet()) {
      config = config.withInt(option.getKey(), option.getValue());
    }
    if (useSsl) {
      config = config.withClass(SSL_ENGINE_FACTORY_CLASS, DefaultSslEngineFactory.class);
    }
    if (requestLogger.isDebugEnabled()) {
      config = config.withClass(REQUEST_TRACKER_CLASS, RequestLogger.class)
        .withBoolean(REQUEST_LOGGER_SUCCESS_ENABLED, true)
        .withBoolean(REQUEST_LOGGER_VALUES, requestLogger.isTraceEnabled());
    }
    return config;
  }

  static List<InetSocketAddress> parseContactPoints(String contactPoints) {
    List<InetSocketAddress> result = new ArrayList<>();
    for (String contactPoint : contactPoints.split(",", -1)) {
      result.add(HostAndPort.fromString(contactPoint.trim(), DEFAULT_PORT).toSocketAddress());
    }
    return result;
  }

  SessionBuilder() {
  }
}
