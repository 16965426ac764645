//  Copyright (c) Meta Platforms, Inc. and affiliates.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.chunkio;

/**
 * Enum CompressionType
 *
 * <p>Records in a chunk may be compressed before the chunk is written.
 * The following enum describes which compression algorithm (if any)
 * was used. The byte values are frozen in the file format.</p>
 */
public enum CompressionType {
  NONE((byte) 0, "uncompressed"),
  BROTLI((byte) 'b', "brotli"),
  ZSTD((byte) 'z', "zstd"),
  SNAPPY((byte) 's', "snappy");

  private final byte value;
  private final String optionName;

  CompressionType(final byte value, final String optionName) {
    this.value = value;
    this.optionName = optionName;
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
   * Returns the keyword which selects this compression type in
   * {@link CompressorOptions#fromString(String)}.
   *
   * @return option keyword, e.g. "zstd"
   */
  public String getOptionName() {
    return optionName;
  }

  /**
   * Get CompressionType by byte value.
   *
   * @param value byte representation of CompressionType.
   *
   * @return {@link org.chunkio.CompressionType} instance.
   * @throws java.lang.IllegalArgumentException if an invalid
   *     value is provided.
   */
  public static CompressionType getCompressionType(final byte value) {
    for (final CompressionType compressionType : CompressionType.values()) {
      if (compressionType.getValue() == value) {
        return compressionType;
      }
    }
    throw new IllegalArgumentException("Illegal value provided for CompressionType: " + value);
  }

  /**
   * Get CompressionType by its option keyword.
   *
   * @param optionName keyword as accepted by the option grammar
   *
   * @return {@link org.chunkio.CompressionType} instance, or null if the
   *     keyword does not name a compression type.
   */
  public static CompressionType getFromOptionName(final String optionName) {
    for (final CompressionType compressionType : CompressionType.values()) {
      if (compressionType.optionName.equals(optionName)) {
        return compressionType;
      }
    }
    return null;
  }
}
