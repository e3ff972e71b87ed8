/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.servererrors.InvalidQueryException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import zipkin2.CheckResult;
import zipkin2.internal.ClosedComponentException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static tsbench.query.cassandra.Schema.TABLE_SERIES_BIGINT;
import static tsbench.query.cassandra.Schema.TABLE_SERIES_FLOAT;

class CassandraSeriesSourceTest {
  CqlSession session = mock(CqlSession.class);
  Map<String, PreparedStatement> preparedStatements = new LinkedHashMap<>();
  CassandraSeriesSource source = CassandraSeriesSource.newBuilder()
    .tables(List.of(TABLE_SERIES_FLOAT, TABLE_SERIES_BIGINT))
    .sessionFactory(s -> session)
    .build();

  CassandraSeriesSourceTest() {
    when(session.prepare(anyString())).thenAnswer(
      i -> preparedStatements.computeIfAbsent(i.getArgument(0), k -> mock(PreparedStatement.class)));
  }

  @Test void builder_defaults() {
    CassandraSeriesSource source = CassandraSeriesSource.newBuilder().build();

    assertThat(source.contactPoints).isEqualTo("localhost");
    assertThat(source.localDc).isEqualTo("datacenter1");
    assertThat(source.keyspace).isEqualTo("measurements");
    assertThat(source.tables).isEqualTo(Schema.BLESSED_TABLES);
    assertThat(source.authProvider).isNull();
    assertThat(source.useSsl).isFalse();
  }

  @Test void builder_credentialsCreateAuthProvider() {
    CassandraSeriesSource source = CassandraSeriesSource.newBuilder()
      .username("bob")
      .password("secret")
      .build();

    assertThat(source.authProvider).isNotNull();
  }

  @Test void builder_validates() {
    CassandraSeriesSource.Builder builder = CassandraSeriesSource.newBuilder();

    assertThatThrownBy(() -> builder.tables(List.of()))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("tables are empty");
    assertThatThrownBy(() -> builder.maxConnections(0))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("maxConnections <= 0");
    assertThatThrownBy(() -> builder.keyspace(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("keyspace == null");
    assertThatThrownBy(() -> builder.contactPoints(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("contactPoints == null");
  }

  @Test void fetchSeriesCollection_allTablesInOrder() throws Exception {
    stubTable(TABLE_SERIES_FLOAT, page(
      "cpu,hostname=host_0#usage_idle#2016-01-01",
      "cpu,hostname=host_1#usage_idle#2016-01-01"));
    stubTable(TABLE_SERIES_BIGINT, page("mem,hostname=host_0#available#2016-01-02"));

    List<Series> series = source.fetchSeriesCollection().execute();

    assertThat(series).extracting(Series::table)
      .containsExactly(TABLE_SERIES_FLOAT, TABLE_SERIES_FLOAT, TABLE_SERIES_BIGINT);
    assertThat(series).extracting(Series::measurement).containsExactly("cpu", "cpu", "mem");
    verify(session).execute("USE measurements");
    assertThat(preparedStatements).containsKeys(
      "SELECT DISTINCT series_id FROM series_float",
      "SELECT DISTINCT series_id FROM series_bigint");
  }

  @Test void fetchSeriesCollection_readsAllPages() throws Exception {
    AsyncResultSet first = page("cpu,hostname=host_0#usage_idle#2016-01-01");
    AsyncResultSet second = page("cpu,hostname=host_1#usage_idle#2016-01-01");
    when(first.hasMorePages()).thenReturn(true);
    when(first.fetchNextPage()).thenReturn(CompletableFuture.completedFuture(second));
    stubTable(TABLE_SERIES_FLOAT, first);
    stubTable(TABLE_SERIES_BIGINT, page());

    assertThat(source.fetchSeriesCollection().execute())
      .extracting(Series::id)
      .containsExactly(
        "cpu,hostname=host_0#usage_idle#2016-01-01",
        "cpu,hostname=host_1#usage_idle#2016-01-01");
  }

  @Test void fetchSeriesCollection_malformedIdFailsScan() {
    stubTable(TABLE_SERIES_FLOAT, page(
      "cpu,hostname=host_0#usage_idle#2016-01-01",
      "cpu,hostname=a,hostname=a#usage_idle#2016-01-01"));
    stubTable(TABLE_SERIES_BIGINT, page());

    assertThatThrownBy(() -> source.fetchSeriesCollection().execute())
      .isInstanceOf(MalformedSeriesIdException.class)
      .hasMessageContaining("duplicate tag");
  }

  @Test void fetchSeriesCollection_propagatesDriverError() {
    PreparedStatement preparedStatement =
      preparedStatement("SELECT DISTINCT series_id FROM series_float");
    BoundStatement bound = mock(BoundStatement.class);
    when(preparedStatement.bind()).thenReturn(bound);
    CompletableFuture<AsyncResultSet> failed = new CompletableFuture<>();
    failed.completeExceptionally(new InvalidQueryException(null, "unconfigured table"));
    when(session.executeAsync(bound)).thenReturn(failed);
    stubTable(TABLE_SERIES_BIGINT, page());

    assertThatThrownBy(() -> source.fetchSeriesCollection().execute())
      .isInstanceOf(InvalidQueryException.class)
      .hasMessage("unconfigured table");
  }

  @Test void clientSideIndex() throws Exception {
    stubTable(TABLE_SERIES_FLOAT, page("cpu,hostname=host_0#usage_idle#2016-01-01"));
    stubTable(TABLE_SERIES_BIGINT, page("mem,hostname=host_1#available#2016-01-02"));

    ClientSideIndex index = source.clientSideIndex();

    assertThat(index.seriesIds()).containsExactly(
      "cpu,hostname=host_0#usage_idle#2016-01-01", "mem,hostname=host_1#available#2016-01-02");
    assertThat(index.seriesByTimeInterval()).hasSize(2);
  }

  @Test void clientSideIndex_noSeries() {
    stubTable(TABLE_SERIES_FLOAT, page());
    stubTable(TABLE_SERIES_BIGINT, page());

    assertThatThrownBy(source::clientSideIndex)
      .isInstanceOf(EmptyIndexException.class);
  }

  @Test void sessionInitializationFailure() {
    when(session.execute("USE measurements"))
      .thenThrow(new InvalidQueryException(null, "Keyspace 'measurements' does not exist"));
    when(session.isClosed()).thenReturn(true);

    assertThatThrownBy(source::fetchSeriesCollection)
      .isInstanceOf(ClosedComponentException.class);
    verify(session).close();
  }

  @Test void check_ok() {
    PreparedStatement healthCheck =
      preparedStatement("SELECT series_id FROM series_float LIMIT 1");
    when(healthCheck.bind()).thenReturn(mock(BoundStatement.class));

    assertThat(source.check()).isSameAs(CheckResult.OK);
  }

  @Test void check_failed() {
    RuntimeException error = new IllegalStateException("no hosts");
    CassandraSeriesSource source = CassandraSeriesSource.newBuilder()
      .sessionFactory(s -> {
        throw error;
      })
      .build();

    CheckResult result = source.check();
    assertThat(result.ok()).isFalse();
    assertThat(result.error()).isSameAs(error);
  }

  @Test void close_closesSessionOnce() throws Exception {
    stubTable(TABLE_SERIES_FLOAT, page("cpu#usage_idle#2016-01-01"));
    stubTable(TABLE_SERIES_BIGINT, page());
    source.fetchSeriesCollection().execute();

    source.close();
    source.close();

    verify(session).close();
    assertThatThrownBy(source::fetchSeriesCollection)
      .isInstanceOf(ClosedComponentException.class);
  }

  PreparedStatement preparedStatement(String cql) {
    return preparedStatements.computeIfAbsent(cql, k -> mock(PreparedStatement.class));
  }

  void stubTable(String table, AsyncResultSet resultSet) {
    PreparedStatement preparedStatement =
      preparedStatement("SELECT DISTINCT series_id FROM " + table);
    BoundStatement bound = mock(BoundStatement.class);
    when(preparedStatement.bind()).thenReturn(bound);
    when(session.executeAsync(bound)).thenReturn(CompletableFuture.completedFuture(resultSet));
  }

  static AsyncResultSet page(String... seriesIds) {
    List<Row> rows = new ArrayList<>();
    for (String seriesId : seriesIds) {
      Row row = mock(Row.class);
      when(row.getString("series_id")).thenReturn(seriesId);
      rows.add(row);
    }
    AsyncResultSet resultSet = mock(AsyncResultSet.class);
    when(resultSet.currentPage()).thenReturn(rows);
    return resultSet;
  }
}
