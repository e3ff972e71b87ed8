/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import com.google.auto.value.AutoValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Criteria a query planner uses to prune rows before generating CQL. A row is a candidate when
 * all of the criteria match.
 *
 * @see ClientSideIndex#select(SeriesQuery)
 */
@AutoValue
public abstract class SeriesQuery {
  public static SeriesQuery create(String measurementName, String fieldName,
    TimeInterval timeInterval, List<List<String>> tagSets) {
    if (measurementName == null) throw new NullPointerException("measurementName == null");
    if (fieldName == null) throw new NullPointerException("fieldName == null");
    if (timeInterval == null) throw new NullPointerException("timeInterval == null");
    if (tagSets == null) throw new NullPointerException("tagSets == null");

    List<List<String>> copy = new ArrayList<>(tagSets.size());
    for (List<String> tagSet : tagSets) {
      copy.add(List.copyOf(tagSet));
    }
    return new AutoValue_SeriesQuery(
      measurementName, fieldName, timeInterval, Collections.unmodifiableList(copy));
  }

  public abstract String measurementName();

  public abstract String fieldName();

  public abstract TimeInterval timeInterval();

  /** Tags are OR'ed within a set and the sets are AND'ed. Empty matches all rows. */
  public abstract List<List<String>> tagSets();

  /** Returns true if the row satisfies all criteria of this query. */
  public boolean matches(Series series) {
    return series.matchesMeasurementName(measurementName())
      && series.matchesFieldName(fieldName())
      && series.matchesTimeInterval(timeInterval())
      && series.matchesTagSets(tagSets());
  }

  SeriesQuery() {
  }
}
