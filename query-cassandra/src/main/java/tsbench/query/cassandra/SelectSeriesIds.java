/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import tsbench.query.cassandra.internal.call.AggregateIntoList;
import tsbench.query.cassandra.internal.call.ScanAllPages;
import zipkin2.Call;

import static tsbench.query.cassandra.Schema.COLUMN_SERIES_ID;

/**
 * Lists the distinct series ids of one table, parsing each into a {@link Series}. A malformed id
 * fails the whole scan.
 */
final class SelectSeriesIds extends ScanAllPages<List<Series>> {
  static final class Factory {
    final CqlSession session;
    final Map<String, PreparedStatement> selectSeriesIdsByTable = new LinkedHashMap<>();

    Factory(CqlSession session, List<String> tables) {
      this.session = session;
      for (String table : tables) {
        selectSeriesIdsByTable.put(table, session.prepare("SELECT DISTINCT " + COLUMN_SERIES_ID
          + " FROM " + table));
      }
    }

    /** Scans all tables, returning series in table order. */
    Call<List<Series>> newCall() {
      List<Call<List<Series>>> calls = new ArrayList<>();
      for (String table : selectSeriesIdsByTable.keySet()) {
        calls.add(newCall(table));
      }
      return AggregateIntoList.create(calls);
    }

    Call<List<Series>> newCall(String table) {
      PreparedStatement preparedStatement = selectSeriesIdsByTable.get(table);
      if (preparedStatement == null) {
        throw new IllegalArgumentException("table " + table + " was not configured");
      }
      return new SelectSeriesIds(this, preparedStatement, table);
    }
  }

  final Factory factory;
  final PreparedStatement preparedStatement;
  final String table;

  SelectSeriesIds(Factory factory, PreparedStatement preparedStatement, String table) {
    this.factory = factory;
    this.preparedStatement = preparedStatement;
    this.table = table;
  }

  @Override protected CompletionStage<AsyncResultSet> firstPage() {
    return factory.session.executeAsync(preparedStatement.bind());
  }

  @Override protected List<Series> newResult() {
    return new ArrayList<>();
  }

  @Override protected void accumulate(Row row, List<Series> result) {
    result.add(Series.parse(table, row.getString(COLUMN_SERIES_ID)));
  }

  @Override public String toString() {
    return "SelectSeriesIds{table=" + table + "}";
  }

  @Override public SelectSeriesIds clone() {
    return new SelectSeriesIds(factory, preparedStatement, table);
  }
}
