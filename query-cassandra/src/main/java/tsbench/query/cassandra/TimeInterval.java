/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import com.google.auto.value.AutoValue;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * A half-open range of time, {@code [start, end)}. Equality is by value, so instances key the
 * time bucket index.
 */
@AutoValue
public abstract class TimeInterval {
  public static TimeInterval create(Instant start, Instant end) {
    if (start == null) throw new NullPointerException("start == null");
    if (end == null) throw new NullPointerException("end == null");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("end " + end + " is before start " + start);
    }
    return new AutoValue_TimeInterval(start, end);
  }

  /** Returns the bucket that starts at midnight UTC on the given day. */
  public static TimeInterval ofDay(LocalDate day) {
    if (day == null) throw new NullPointerException("day == null");
    Instant start = day.atStartOfDay(ZoneOffset.UTC).toInstant();
    return create(start, start.plus(Schema.BUCKET_DURATION));
  }

  public abstract Instant start();

  public abstract Instant end();

  /**
   * Returns true when the two ranges share at least one instant. Ranges that only touch at an
   * endpoint, like {@code [Jan1, Jan2)} and {@code [Jan2, Jan3)}, do not overlap.
   */
  public boolean overlaps(TimeInterval other) {
    return start().isBefore(other.end()) && other.start().isBefore(end());
  }

  TimeInterval() {
  }
}
