/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime data used to translate a query into CQL against the series tables. Cassandra can't
 * efficiently answer which rows match a combination of predicates, so this indexes every known
 * row id client-side.
 *
 * <p>Instances are read-only after {@link #create(Collection)}, so they can be shared between any
 * number of threads without locking.
 */
public final class ClientSideIndex {
  static final Logger LOG = LoggerFactory.getLogger(ClientSideIndex.class);

  /**
   * Indexes a snapshot of series, typically from {@link CassandraSeriesSource#fetchSeriesCollection()}.
   *
   * @throws EmptyIndexException if there are no series. A benchmark without data can't proceed.
   */
  public static ClientSideIndex create(Collection<Series> seriesCollection) {
    if (seriesCollection == null) throw new NullPointerException("seriesCollection == null");
    if (seriesCollection.isEmpty()) throw new EmptyIndexException();
    return new ClientSideIndex(seriesCollection);
  }

  final Map<TimeInterval, Set<Series>> timeIntervalMapping;
  final Map<String, Set<Series>> tagMapping;
  final List<Series> seriesCollection;
  final List<String> seriesIds;

  ClientSideIndex(Collection<Series> input) {
    Map<TimeInterval, Set<Series>> timeIntervalMapping = new LinkedHashMap<>();
    Map<String, Set<Series>> tagMapping = new LinkedHashMap<>();
    List<Series> seriesCollection = new ArrayList<>(input.size());
    List<String> seriesIds = new ArrayList<>(input.size());

    for (Series series : input) {
      if (series == null) throw new NullPointerException("seriesCollection contains null");
      // buckets reference the same instance as seriesCollection
      timeIntervalMapping.computeIfAbsent(series.timeInterval(), k -> new LinkedHashSet<>())
        .add(series);
      for (String tag : series.tags()) {
        tagMapping.computeIfAbsent(tag, k -> new LinkedHashSet<>()).add(series);
      }
      seriesCollection.add(series);
      seriesIds.add(series.id());
    }

    this.timeIntervalMapping = unmodifiable(timeIntervalMapping);
    this.tagMapping = unmodifiable(tagMapping);
    this.seriesCollection = Collections.unmodifiableList(seriesCollection);
    this.seriesIds = Collections.unmodifiableList(seriesIds);

    LOG.info("indexed {} series into {} time buckets and {} tags", seriesCollection.size(),
      timeIntervalMapping.size(), tagMapping.size());
  }

  /** Returns the count of indexed series, including any duplicates in the input. */
  public int size() {
    return seriesCollection.size();
  }

  /**
   * Returns a copy of the indexed series in input order. The returned list can be altered, but the
   * series within are shared with this index.
   */
  public List<Series> copyOfSeriesCollection() {
    return new ArrayList<>(seriesCollection);
  }

  /** Returns the raw series ids in input order. */
  public List<String> seriesIds() {
    return seriesIds;
  }

  /**
   * Returns series grouped by their exact time bucket. This is not an interval index: a series is
   * only under the key equal to {@link Series#timeInterval()}. Use {@link
   * #seriesOverlapping(TimeInterval)} to find series for a query spanning several buckets.
   */
  public Map<TimeInterval, Set<Series>> seriesByTimeInterval() {
    return timeIntervalMapping;
  }

  /** Returns series grouped by each of their tags, e.g. "hostname=host_0". */
  public Map<String, Set<Series>> seriesByTag() {
    return tagMapping;
  }

  /** Scans the bucket keys, returning series of every bucket overlapping the given interval. */
  public List<Series> seriesOverlapping(TimeInterval timeInterval) {
    if (timeInterval == null) throw new NullPointerException("timeInterval == null");
    List<Series> result = new ArrayList<>();
    for (Map.Entry<TimeInterval, Set<Series>> entry : timeIntervalMapping.entrySet()) {
      if (entry.getKey().overlaps(timeInterval)) result.addAll(entry.getValue());
    }
    return result;
  }

  /** Returns the series matching all criteria of the query, in input order. */
  public List<Series> select(SeriesQuery query) {
    if (query == null) throw new NullPointerException("query == null");
    List<Series> result = new ArrayList<>();
    for (Series series : seriesCollection) {
      if (query.matches(series)) result.add(series);
    }
    LOG.debug("{} matched {} of {} series", query, result.size(), seriesCollection.size());
    return result;
  }

  @Override public String toString() {
    return "ClientSideIndex{series=" + seriesCollection.size()
      + ", timeIntervals=" + timeIntervalMapping.size()
      + ", tags=" + tagMapping.size() + "}";
  }

  static <K> Map<K, Set<Series>> unmodifiable(Map<K, Set<Series>> mapping) {
    for (Map.Entry<K, Set<Series>> entry : mapping.entrySet()) {
      entry.setValue(Collections.unmodifiableSet(entry.getValue()));
    }
    return Collections.unmodifiableMap(mapping);
  }
}
