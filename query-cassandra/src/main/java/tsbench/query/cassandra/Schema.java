/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import java.time.Duration;
import java.util.List;

/** Names and constants of the wide-row series tables loaded by the benchmark. */
public final class Schema {
  public static final String DEFAULT_KEYSPACE = "measurements";

  public static final String TABLE_SERIES_BIGINT = "series_bigint";
  public static final String TABLE_SERIES_FLOAT = "series_float";
  public static final String TABLE_SERIES_DOUBLE = "series_double";
  public static final String TABLE_SERIES_BOOLEAN = "series_boolean";
  public static final String TABLE_SERIES_BLOB = "series_blob";

  /** Tables whose series are candidates for query planning. */
  public static final List<String> BLESSED_TABLES = List.of(
    TABLE_SERIES_BIGINT,
    TABLE_SERIES_FLOAT,
    TABLE_SERIES_DOUBLE,
    TABLE_SERIES_BOOLEAN,
    TABLE_SERIES_BLOB
  );

  /** Partition key column holding the composite series id. */
  public static final String COLUMN_SERIES_ID = "series_id";

  /**
   * Time window covered by a single row of a series table, in seconds. Default: 1 day
   *
   * <p>Writers bucket by day, so only override this when the loaded data was bucketed the same way.
   */
  public static final Duration BUCKET_DURATION = bucketDuration(
    Long.getLong("tsbench.cassandra.internal.bucketDurationSeconds", 24 * 60 * 60));

  static Duration bucketDuration(long seconds) {
    if (seconds <= 0) {
      throw new IllegalArgumentException("bucketDurationSeconds <= 0: " + seconds);
    }
    return Duration.ofSeconds(seconds);
  }

  Schema() {
  }
}
