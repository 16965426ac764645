//  Copyright (c) Meta Platforms, Inc. and affiliates.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.chunkio;

import java.text.MessageFormat;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text form of {@link CompressorOptions}.
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
 */
final class CompressorOptionsString {
  private static final Logger LOG = LoggerFactory.getLogger(CompressorOptionsString.class);

  static final char OPTION_SEPARATOR = ',';
  static final char VALUE_SEPARATOR = ':';
  static final String WINDOW_LOG = "window_log";
  static final String AUTO = "auto";

  private static final String MESSAGE_UNKNOWN_OPTION =
      "Unknown compressor option \"{0}\", expected one of: uncompressed, brotli, zstd, snappy, "
      + "window_log";
  private static final String MESSAGE_NO_VALUE_EXPECTED =
      "Compressor option \"{0}\" does not take a value, got \"{1}\"";
  private static final String MESSAGE_VALUE_REQUIRED =
      "Compressor option \"{0}\" requires a value";
  private static final String MESSAGE_INVALID_INTEGER =
      "Invalid value for compressor option \"{0}\": \"{1}\" is not an integer{2}";
  private static final String MESSAGE_OUT_OF_RANGE =
      "Invalid value for compressor option \"{0}\": {1} is out of range [{2}..{3}]";

  private CompressorOptionsString() {}

  /**
   * Renders options in the form accepted by {@link #parse(String)}.
   */
  static String toString(final CompressorOptions options) {
    final StringBuilder sb = new StringBuilder(options.compressionType().getOptionName());
    switch (options.compressionType()) {
      case BROTLI:
      case ZSTD:
        sb.append(VALUE_SEPARATOR).append(options.compressionLevel());
        break;
      default:
        break;
    }
    final OptionalInt windowLog = options.windowLog();
    if (windowLog.isPresent()) {
      sb.append(OPTION_SEPARATOR)
          .append(WINDOW_LOG)
          .append(VALUE_SEPARATOR)
          .append(windowLog.getAsInt());
    }
    return sb.toString();
  }

  static CompressorOptions parse(final String str) throws ChunkioException {
    Objects.requireNonNull(str);

    final Parser parser = new Parser(str);
    try {
      final CompressorOptions options = parser.parseOptions();
      LOG.debug("Parsed compressor options \"{}\" as {}", str, options);
      return options;
    } catch (final ChunkioException e) {
      LOG.debug("Rejected compressor options \"{}\": {}", str, e.getMessage());
      throw e;
    }
  }

  private static final class Parser {
    private final String str;
    private int pos;

    private Parser(final String str) {
      this.str = str;
      this.pos = 0;
    }

    private boolean hasNext() {
      return pos < str.length();
    }

    private boolean isChar(final char c) {
      return hasNext() && str.charAt(pos) == c;
    }

    private char next() {
      return str.charAt(pos++);
    }

    private String parseUntil(final char... terminators) {
      final int start = pos;
      while (hasNext() && !isAnyOf(str.charAt(pos), terminators)) {
        pos++;
      }
      return str.substring(start, pos);
    }

    private static boolean isAnyOf(final char c, final char... chars) {
      for (final char candidate : chars) {
        if (c == candidate) {
          return true;
        }
      }
      return false;
    }

    private CompressorOptions parseOptions() throws ChunkioException {
      final CompressorOptions options = new CompressorOptions();
      while (true) {
        if (hasNext() && !isChar(OPTION_SEPARATOR)) {
          parseOption(options);
        }
        if (!hasNext()) {
          return options;
        }
        // parseOption() stops only at a separator or at the end
        next();
      }
    }

    private void parseOption(final CompressorOptions options) throws ChunkioException {
      final String key = parseUntil(VALUE_SEPARATOR, OPTION_SEPARATOR);
      final String value;
      if (isChar(VALUE_SEPARATOR)) {
        next();
        value = parseUntil(OPTION_SEPARATOR);
      } else {
        value = null;
      }

      if (WINDOW_LOG.equals(key)) {
        options.setWindowLog(parseWindowLog(value));
        return;
      }

      final CompressionType compressionType = CompressionType.getFromOptionName(key);
      if (compressionType == null) {
        throw error(MessageFormat.format(MESSAGE_UNKNOWN_OPTION, key));
      }
      switch (compressionType) {
        case NONE:
          requireNoValue(key, value);
          options.setUncompressed();
          break;
        case BROTLI:
          options.setBrotli(value == null
              ? CompressorOptions.DEFAULT_BROTLI
              : parseInt(key, value, CompressorOptions.MIN_BROTLI, CompressorOptions.MAX_BROTLI));
          break;
        case ZSTD:
          options.setZstd(value == null
              ? CompressorOptions.DEFAULT_ZSTD
              : parseInt(key, value, CompressorOptions.MIN_ZSTD, CompressorOptions.MAX_ZSTD));
          break;
        case SNAPPY:
          requireNoValue(key, value);
          options.setSnappy();
          break;
        default:
          throw new IllegalStateException("Unhandled compression type: " + compressionType);
      }
    }

    private OptionalInt parseWindowLog(final String value) throws ChunkioException {
      if (value == null) {
        throw error(MessageFormat.format(MESSAGE_VALUE_REQUIRED, WINDOW_LOG));
      }
      if (AUTO.equals(value)) {
        return OptionalInt.empty();
      }
      return OptionalInt.of(parseInt(WINDOW_LOG, value,
          CompressorOptions.MIN_WINDOW_LOG, CompressorOptions.MAX_WINDOW_LOG));
    }

    private static void requireNoValue(final String key, final String value)
        throws ChunkioException {
      if (value != null) {
        throw error(MessageFormat.format(MESSAGE_NO_VALUE_EXPECTED, key, value));
      }
    }

    /**
     * Accepts an optional sign followed by decimal digits, nothing else.
     */
    private static int parseInt(final String key, final String value, final int min,
        final int max) throws ChunkioException {
      int i = 0;
      if (i < value.length() && (value.charAt(i) == '-' || value.charAt(i) == '+')) {
        i++;
      }
      if (i == value.length()) {
        throw error(MessageFormat.format(MESSAGE_INVALID_INTEGER, key, value, ""));
      }
      for (; i < value.length(); i++) {
        final char c = value.charAt(i);
        if (c < '0' || c > '9') {
          throw error(MessageFormat.format(MESSAGE_INVALID_INTEGER, key, value, ""));
        }
      }

      final long parsed;
      try {
        parsed = Long.parseLong(value);
      } catch (final NumberFormatException e) {
        throw error(MessageFormat.format(MESSAGE_INVALID_INTEGER, key, value,
            " in range [" + min + ".." + max + "]"));
      }
      if (parsed < min || parsed > max) {
        // MessageFormat would group digits, keep the numbers as typed
        throw error(MessageFormat.format(MESSAGE_OUT_OF_RANGE, key, value,
            String.valueOf(min), String.valueOf(max)));
      }
      return (int) parsed;
    }

    private static ChunkioException error(final String message) {
      return new ChunkioException(Status.invalidArgument(message));
    }
  }
}
