/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra.internal.call;

import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.DriverExecutionException;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import zipkin2.Call;
import zipkin2.Callback;

/**
 * Folds every row of a query into one result, following the driver's paging state until the last
 * page. Rows are folded in the order the driver returns them.
 */
public abstract class ScanAllPages<T> extends Call.Base<T> {
  /** Issues the query. Each execution issues it again. */
  protected abstract CompletionStage<AsyncResultSet> firstPage();

  protected abstract T newResult();

  /** Adds one row to the result. An exception here fails the scan. */
  protected abstract void accumulate(Row row, T result);

  @Override protected T doExecute() {
    return getUninterruptibly(scan());
  }

  @Override protected void doEnqueue(Callback<T> callback) {
    scan().whenComplete((result, error) -> {
      if (error != null) {
        callback.onError(error instanceof CompletionException ? error.getCause() : error);
      } else {
        callback.onSuccess(result);
      }
    });
  }

  CompletionStage<T> scan() {
    T result = newResult();
    return firstPage().thenCompose(page -> scanFrom(page, result));
  }

  CompletionStage<T> scanFrom(AsyncResultSet page, T result) {
    for (Row row : page.currentPage()) {
      accumulate(row, result);
    }
    if (!page.hasMorePages()) return CompletableFuture.completedFuture(result);
    return page.fetchNextPage().thenCompose(next -> scanFrom(next, result));
  }

  static <T> T getUninterruptibly(CompletionStage<T> stage) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return stage.toCompletableFuture().get();
        } catch (InterruptedException e) {
          interrupted = true;
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          // copy so that the stack trace includes the caller
          if (cause instanceof DriverException) throw ((DriverException) cause).copy();
          if (cause instanceof RuntimeException) throw (RuntimeException) cause;
          if (cause instanceof Error) throw (Error) cause;
          throw new DriverExecutionException(cause);
        }
      }
    } finally {
      if (interrupted) Thread.currentThread().interrupt();
    }
  }
}
