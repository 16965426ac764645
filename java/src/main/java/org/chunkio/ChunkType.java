//  Copyright (c) Meta Platforms, Inc. and affiliates.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.chunkio;

/**
 * Kinds of chunks stored in a chunked record file.
 *
 * <p>The byte values are written into every chunk header and are frozen
 * in the file format. They must never be renumbered or reused.</p>
 */
public enum ChunkType {
  FILE_SIGNATURE((byte) 's'),
  PADDING((byte) 'p'),
  SIMPLE((byte) 'r'),
  TRANSPOSED((byte) 't');

  private final byte value;

  ChunkType(final byte value) {
    this.value = value;
  }

  /**
   * Returns the byte value of the enumerations value
   *
   * @return byte representation
   */
  public byte getValue() {
    return value;
  }

  /**
   * Get ChunkType by byte value.
   *
   * @param value byte representation of ChunkType.
   *
   * @return {@link org.chunkio.ChunkType} instance.
   * @throws java.lang.IllegalArgumentException if an invalid
   *     value is provided.
   */
  public static ChunkType getChunkType(final byte value) {
    for (final ChunkType chunkType : ChunkType.values()) {
      if (chunkType.getValue() == value) {
        return chunkType;
      }
    }
    throw new IllegalArgumentException("Illegal value provided for ChunkType: " + value);
  }
}
