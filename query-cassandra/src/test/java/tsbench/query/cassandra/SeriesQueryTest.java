/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tsbench.query.cassandra.TestObjects.CPU_HOST_0;
import static tsbench.query.cassandra.TestObjects.JAN_1;

class SeriesQueryTest {
  @Test void matches_conjunction() {
    SeriesQuery query = SeriesQuery.create("cpu", "usage_idle", TimeInterval.ofDay(JAN_1),
      List.of(List.of("hostname=host_0")));

    assertThat(query.matches(CPU_HOST_0)).isTrue();
    assertThat(SeriesQuery.create("cpu", "usage_idle", TimeInterval.ofDay(JAN_1),
      List.of(List.of("hostname=host_9"))).matches(CPU_HOST_0)).isFalse();
  }

  @Test void create_copiesTagSets() {
    List<String> tagSet = new ArrayList<>(List.of("hostname=host_0"));
    List<List<String>> tagSets = new ArrayList<>();
    tagSets.add(tagSet);

    SeriesQuery query = SeriesQuery.create("cpu", "usage_idle", TimeInterval.ofDay(JAN_1), tagSets);
    tagSet.clear();
    tagSets.add(List.of("hostname=host_9"));

    assertThat(query.tagSets()).containsExactly(List.of("hostname=host_0"));
    assertThat(query.matches(CPU_HOST_0)).isTrue();
  }

  @Test void create_nullArguments() {
    assertThatThrownBy(() -> SeriesQuery.create(null, "f", TimeInterval.ofDay(JAN_1), List.of()))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("measurementName == null");
    assertThatThrownBy(() -> SeriesQuery.create("cpu", "f", TimeInterval.ofDay(JAN_1), null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("tagSets == null");
  }
}
