/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One wide row of a series table. Values are parsed from the row's composite id, for example
 * {@code cpu,hostname=host_0,region=eu-central-1#usage_idle#2016-01-01}.
 *
 * <p>Instances are immutable and shared between all buckets of a {@link ClientSideIndex}.
 */
@AutoValue
public abstract class Series {
  static final DateTimeFormatter DAY =
    DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

  /**
   * Parses a series id read from the given table.
   *
   * @throws MalformedSeriesIdException if the id isn't three '#' delimited sections, repeats a tag
   * or has an invalid day.
   */
  public static Series parse(String table, String id) {
    if (table == null) throw new NullPointerException("table == null");
    if (id == null) throw new NullPointerException("id == null");

    String[] sections = id.split("#", -1); // keep empty sections so "a##" is still three
    if (sections.length != 3) {
      throw new MalformedSeriesIdException(id, "expected 3 sections, but found " + sections.length);
    }

    String[] measurementAndTags = sections[0].split(",", -1);
    Set<String> tags = new LinkedHashSet<>();
    for (int i = 1; i < measurementAndTags.length; i++) {
      if (!tags.add(measurementAndTags[i])) {
        throw new MalformedSeriesIdException(id, "duplicate tag " + measurementAndTags[i]);
      }
    }

    LocalDate day;
    try {
      day = LocalDate.parse(sections[2], DAY);
    } catch (DateTimeParseException e) {
      throw new MalformedSeriesIdException(id, "invalid time bucket " + sections[2], e);
    }

    return new AutoValue_Series(
      table,
      id,
      measurementAndTags[0],
      Collections.unmodifiableSet(tags),
      sections[1],
      TimeInterval.ofDay(day)
    );
  }

  /** Table the row was read from, e.g. "series_bigint" */
  public abstract String table();

  /** The unparsed composite id */
  public abstract String id();

  /** e.g. "cpu" */
  public abstract String measurement();

  /** Tags joined on equals, e.g. "hostname=host_0" */
  public abstract Set<String> tags();

  /** e.g. "usage_idle" */
  public abstract String field();

  /** The UTC time bucket of this row */
  public abstract TimeInterval timeInterval();

  /** Returns true if this row's bucket overlaps the given interval. */
  public boolean matchesTimeInterval(TimeInterval timeInterval) {
    return timeInterval().overlaps(timeInterval);
  }

  public boolean matchesMeasurementName(String measurement) {
    return measurement().equals(measurement);
  }

  public boolean matchesFieldName(String field) {
    return field().equals(field);
  }

  /**
   * Returns true if every tag set has at least one tag in this row. In other words, tags in the
   * same set are OR'ed and the sets are AND'ed. No tag sets match everything.
   */
  public boolean matchesTagSets(List<List<String>> tagSets) {
    Set<String> tags = tags();
    for (int i = 0, length = tagSets.size(); i < length; i++) {
      List<String> tagSet = tagSets.get(i);
      boolean match = false;
      for (int j = 0, tagCount = tagSet.size(); j < tagCount; j++) {
        if (tags.contains(tagSet.get(j))) {
          match = true;
          break;
        }
      }
      if (!match) return false;
    }
    return true;
  }

  /** Rows are hashed once per index bucket they join. */
  @Memoized @Override public abstract int hashCode();

  Series() {
  }
}
