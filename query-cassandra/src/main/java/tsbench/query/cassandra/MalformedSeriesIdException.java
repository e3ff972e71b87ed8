/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra;

/**
 * Thrown when a series id read from the store doesn't follow
 * {@code <measurement>(,<tag>)*#<field>#<YYYY-MM-DD>}. Stored ids are assumed valid, so this means
 * the data is corrupt and startup should abort.
 */
public final class MalformedSeriesIdException extends IllegalArgumentException {
  static final long serialVersionUID = 0L;

  final String seriesId;

  MalformedSeriesIdException(String seriesId, String message) {
    super(message + ": " + seriesId);
    this.seriesId = seriesId;
  }

  MalformedSeriesIdException(String seriesId, String message, Throwable cause) {
    super(message + ": " + seriesId, cause);
    this.seriesId = seriesId;
  }

  public String seriesId() {
    return seriesId;
  }
}
