/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra.internal.call;

import java.util.ArrayList;
import java.util.List;
import zipkin2.Call;
import zipkin2.internal.AggregateCall;

/** Concatenates the lists returned by each call, in call order when executed synchronously. */
public final class AggregateIntoList<T> extends AggregateCall<List<T>, List<T>> {
  /** Returns the only call as-is, or an aggregate when there are several. */
  public static <T> Call<List<T>> create(List<Call<List<T>>> calls) {
    if (calls.isEmpty()) return Call.emptyList();
    if (calls.size() == 1) return calls.get(0);
    return new AggregateIntoList<>(calls);
  }

  AggregateIntoList(List<Call<List<T>>> calls) {
    super(calls);
  }

  @Override protected List<T> newOutput() {
    return new ArrayList<>();
  }

  @Override protected void append(List<T> input, List<T> output) {
    output.addAll(input);
  }

  @Override public AggregateIntoList<T> clone() {
    return new AggregateIntoList<>(cloneCalls());
  }
}
