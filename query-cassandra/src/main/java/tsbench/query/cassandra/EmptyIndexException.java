/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

/** Thrown when a {@link ClientSideIndex} is requested without any series to index. */
public final class EmptyIndexException extends IllegalStateException {
  static final long serialVersionUID = 0L;

  public EmptyIndexException() {
    super("no series to build the client side index from");
  }
}
