//  Copyright (c) Meta Platforms, Inc. and affiliates.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.chunkio;

import java.util.Objects;

/**
 * Represents the status of an operation which may fail on ordinary input.
 *
 * Currently only used with {@link ChunkioException} when the
 * status is not {@link Code#Ok}
 */
public class Status {
  private final Code code;
  /* @Nullable */ private final String state;

  public Status(final Code code, final String state) {
    this.code = Objects.requireNonNull(code, "code");
    this.state = state;
  }

  public static Status invalidArgument(final String state) {
    return new Status(Code.InvalidArgument, state);
  }

  public Code getCode() {
    return code;
  }

  public String getState() {
    return state;
  }

  public boolean isOk() {
    return code == Code.Ok;
  }

  public String getCodeString() {
    return code.name();
  }

  @Override
  public String toString() {
    return state == null ? getCodeString() : getCodeString() + ": " + state;
  }

  public enum Code {
    Ok(                 (byte)0x0),
    InvalidArgument(    (byte)0x4);

    private final byte value;

    Code(final byte value) {
      this.value = value;
    }

    public byte getValue() {
      return value;
    }

    public static Code getCode(final byte value) {
      for (final Code code : Code.values()) {
        if (code.value == value){
          return code;
        }
      }
      throw new IllegalArgumentException(
          "Illegal value provided for Code.");
    }
  }
}
