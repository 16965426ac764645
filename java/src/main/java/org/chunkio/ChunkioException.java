//  Copyright (c) Meta Platforms, Inc. and affiliates.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.chunkio;

/**
 * A ChunkioException reports a failure caused by the input of an operation,
 * such as malformed option text. It is recoverable: the caller decides
 * whether to abort, fall back to defaults or report it further.
 *
 * <p>Misuse of the API (an out-of-range argument passed directly to a
 * setter) is not reported this way; it throws an unchecked
 * {@link IllegalArgumentException} or {@link IllegalStateException}.</p>
 */
public class ChunkioException extends Exception {
  private static final long serialVersionUID = 3419652104715522837L;

  /**
   * The error status that led to this exception.
   */
  private final Status status;

  /**
   * Constructs a ChunkioException.
   *
   * @param status the error status that led to this exception.
   */
  public ChunkioException(final Status status) {
    super(status.getState() != null ? status.getState()
        : status.getCodeString());
    this.status = status;
  }

  /**
   * Get the status which describes the failure
   *
   * @return The status, never null
   */
  public Status getStatus() {
    return status;
  }
}
