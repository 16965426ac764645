//  Copyright (c) Meta Platforms, Inc. and affiliates.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.chunkio;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Selects the compression algorithm, its level and its window size used when
 * chunks are encoded.
 *
 * <p>Setters return {@code this} so that calls can be chained. They check
 * their arguments eagerly: an out-of-range value is a bug in the caller and
 * is reported with an unchecked exception. Text coming from users should go
 * through {@link #fromString(String)}, which reports bad input with a
 * {@link ChunkioException} instead.</p>
 *
 * <p>The default is Brotli at level {@value #DEFAULT_BROTLI} with the window
 * size chosen by the compressor.</p>
 */
public class CompressorOptions {
  /**
   * Brotli compression level bounds and default.
   */
  public static final int MIN_BROTLI = 0;
  public static final int MAX_BROTLI = 11;
  public static final int DEFAULT_BROTLI = 6;

  /**
   * Zstd compression level bounds and default. Level 0 is currently
   * equivalent to {@value #DEFAULT_ZSTD}.
   */
  public static final int MIN_ZSTD = -(1 << 17);
  public static final int MAX_ZSTD = 22;
  public static final int DEFAULT_ZSTD = 3;

  public static final int BROTLI_MIN_WINDOW_LOG = 10;
  public static final int BROTLI_MAX_WINDOW_LOG = 30;
  public static final int BROTLI_DEFAULT_WINDOW_LOG = 22;

  public static final int ZSTD_MIN_WINDOW_LOG = 10;
  public static final int ZSTD_MAX_WINDOW_LOG = 31;

  /**
   * Window log bounds accepted by {@link #setWindowLog(OptionalInt)}, the
   * union of the Brotli and Zstd ranges.
   */
  public static final int MIN_WINDOW_LOG = Math.min(BROTLI_MIN_WINDOW_LOG, ZSTD_MIN_WINDOW_LOG);
  public static final int MAX_WINDOW_LOG = Math.max(BROTLI_MAX_WINDOW_LOG, ZSTD_MAX_WINDOW_LOG);

  private CompressionType compressionType = CompressionType.BROTLI;
  private int compressionLevel = DEFAULT_BROTLI;
  private OptionalInt windowLog = OptionalInt.empty();

  /**
   * Creates options with the defaults: Brotli, level {@value #DEFAULT_BROTLI},
   * window log chosen by the compressor.
   */
  public CompressorOptions() {
  }

  /**
   * Copy constructor.
   *
   * @param other the options to copy
   */
  public CompressorOptions(final CompressorOptions other) {
    this.compressionType = other.compressionType;
    this.compressionLevel = other.compressionLevel;
    this.windowLog = other.windowLog;
  }

  /**
   * Parses options from text, starting from the defaults:
   *
   * <pre>
   *   options ::= option? ("," option?)*
   *   option ::=
   *     "uncompressed" |
   *     "brotli" (":" brotli_level)? |
   *     "zstd" (":" zstd_level)? |
   *     "snappy" |
   *     "window_log" ":" window_log
   *   brotli_level ::= integer 0..11 (default 6)
   *   zstd_level ::= integer -131072..22 (default 3)
   *   window_log ::= "auto" or integer 10..31
   * </pre>
   *
   * Options are applied from left to right, so a later option overrides an
   * earlier one which sets the same field.
   *
   * @param text the options text
   * @return the parsed options
   * @throws ChunkioException with status {@link Status.Code#InvalidArgument}
   *     if the text is malformed or a value is out of range
   */
  public static CompressorOptions fromString(final String text) throws ChunkioException {
    return CompressorOptionsString.parse(text);
  }

  /**
   * Changes compression algorithm to Uncompressed (turns compression off).
   *
   * @return the reference to the current options.
   */
  public CompressorOptions setUncompressed() {
    compressionType = CompressionType.NONE;
    compressionLevel = 0;
    return this;
  }

  /**
   * Changes compression algorithm to Brotli with the default level.
   *
   * @return the reference to the current options.
   */
  public CompressorOptions setBrotli() {
    return setBrotli(DEFAULT_BROTLI);
  }

  /**
   * Changes compression algorithm to Brotli. The compression level tunes the
   * tradeoff between compression density and compression speed (higher =
   * better density but slower).
   *
   * @param compressionLevel between {@value #MIN_BROTLI} and
   *     {@value #MAX_BROTLI}
   * @return the reference to the current options.
   * @throws IllegalArgumentException if the level is out of range
   */
  public CompressorOptions setBrotli(final int compressionLevel) {
    checkRange(compressionLevel, MIN_BROTLI, MAX_BROTLI, "setBrotli", "compression level");
    this.compressionType = CompressionType.BROTLI;
    this.compressionLevel = compressionLevel;
    return this;
  }

  /**
   * Changes compression algorithm to Zstd with the default level.
   *
   * @return the reference to the current options.
   */
  public CompressorOptions setZstd() {
    return setZstd(DEFAULT_ZSTD);
  }

  /**
   * Changes compression algorithm to Zstd. The compression level tunes the
   * tradeoff between compression density and compression speed (higher =
   * better density but slower).
   *
   * @param compressionLevel between {@value #MIN_ZSTD} and {@value #MAX_ZSTD}
   * @return the reference to the current options.
   * @throws IllegalArgumentException if the level is out of range
   */
  public CompressorOptions setZstd(final int compressionLevel) {
    checkRange(compressionLevel, MIN_ZSTD, MAX_ZSTD, "setZstd", "compression level");
    this.compressionType = CompressionType.ZSTD;
    this.compressionLevel = compressionLevel;
    return this;
  }

  /**
   * Changes compression algorithm to Snappy. There are no Snappy
   * compression levels to tune.
   *
   * @return the reference to the current options.
   */
  public CompressorOptions setSnappy() {
    compressionType = CompressionType.SNAPPY;
    compressionLevel = 0;
    return this;
  }

  public CompressionType compressionType() {
    return compressionType;
  }

  public int compressionLevel() {
    return compressionLevel;
  }

  /**
   * Sets the logarithm of the LZ77 sliding window size. This tunes the
   * tradeoff between compression density and memory usage (higher = better
   * density but more memory).
   *
   * An empty value keeps the compressor default (Brotli:
   * {@value #BROTLI_DEFAULT_WINDOW_LOG}, Zstd: derived from the compression
   * level and the chunk size). Uncompressed and Snappy ignore it; see
   * {@link #brotliWindowLog()} and {@link #zstdWindowLog()} for the ranges
   * each compressor accepts.
   *
   * @param windowLog empty, or between {@value #MIN_WINDOW_LOG} and
   *     {@value #MAX_WINDOW_LOG}
   * @return the reference to the current options.
   * @throws IllegalArgumentException if the window log is out of range
   */
  public CompressorOptions setWindowLog(final OptionalInt windowLog) {
    Objects.requireNonNull(windowLog, "windowLog");
    if (windowLog.isPresent()) {
      checkRange(windowLog.getAsInt(), MIN_WINDOW_LOG, MAX_WINDOW_LOG, "setWindowLog",
          "window log");
    }
    this.windowLog = windowLog;
    return this;
  }

  /**
   * Same as {@code setWindowLog(OptionalInt.of(windowLog))}.
   *
   * @param windowLog between {@value #MIN_WINDOW_LOG} and
   *     {@value #MAX_WINDOW_LOG}
   * @return the reference to the current options.
   */
  public CompressorOptions setWindowLog(final int windowLog) {
    return setWindowLog(OptionalInt.of(windowLog));
  }

  public OptionalInt windowLog() {
    return windowLog;
  }

  /**
   * Returns {@link #windowLog()} translated for the Brotli compressor.
   *
   * @return the configured window log, or {@value #BROTLI_DEFAULT_WINDOW_LOG}
   *     if it is not set
   * @throws IllegalStateException if the compression type is not
   *     {@link CompressionType#BROTLI}, or if the configured window log is
   *     above {@value #BROTLI_MAX_WINDOW_LOG}
   */
  public int brotliWindowLog() {
    checkCompressionType(CompressionType.BROTLI, "brotliWindowLog");
    if (!windowLog.isPresent()) {
      return BROTLI_DEFAULT_WINDOW_LOG;
    }
    final int value = windowLog.getAsInt();
    if (value < BROTLI_MIN_WINDOW_LOG || value > BROTLI_MAX_WINDOW_LOG) {
      throw new IllegalStateException(failedPrecondition("brotliWindowLog")
          + "window log " + value + " out of range [" + BROTLI_MIN_WINDOW_LOG + ".."
          + BROTLI_MAX_WINDOW_LOG + "] for Brotli");
    }
    return value;
  }

  /**
   * Returns {@link #windowLog()} translated for the Zstd compressor.
   *
   * @return the configured window log, or empty if the compressor should
   *     derive it from the compression level and the chunk size
   * @throws IllegalStateException if the compression type is not
   *     {@link CompressionType#ZSTD}
   */
  public OptionalInt zstdWindowLog() {
    checkCompressionType(CompressionType.ZSTD, "zstdWindowLog");
    return windowLog;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final CompressorOptions that = (CompressorOptions) o;
    return compressionType == that.compressionType
        && compressionLevel == that.compressionLevel
        && windowLog.equals(that.windowLog);
  }

  @Override
  public int hashCode() {
    return Objects.hash(compressionType, compressionLevel, windowLog);
  }

  /**
   * Returns a string representation of the options which is suitable for
   * consumption by {@link #fromString(String)}.
   *
   * @return options text, e.g. "zstd:5,window_log:20"
   */
  @Override
  public String toString() {
    return CompressorOptionsString.toString(this);
  }

  private void checkCompressionType(final CompressionType expected, final String method) {
    if (compressionType != expected) {
      throw new IllegalStateException(failedPrecondition(method)
          + "compression type is " + compressionType + ", not " + expected);
    }
  }

  private static void checkRange(final int value, final int min, final int max,
      final String method, final String what) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(failedPrecondition(method)
          + what + " " + value + " out of range [" + min + ".." + max + "]");
    }
  }

  private static String failedPrecondition(final String method) {
    return "Failed precondition of CompressorOptions::" + method + "(): ";
  }
}
